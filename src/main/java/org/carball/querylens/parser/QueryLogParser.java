package org.carball.querylens.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.config.AnalysisThresholds;
import org.carball.querylens.model.query.LogDialect;
import org.carball.querylens.model.query.LogStatistics;
import org.carball.querylens.model.query.Query;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.zip.GZIPInputStream;

/**
 * Reads a PostgreSQL or SQLAlchemy log and produces one {@link Query} per executed statement.
 *
 * <p>Results of the last run are available through {@link #getQueries()} and
 * {@link #getStatistics()}. An instance is not meant to be shared between threads.</p>
 */
@Slf4j
public class QueryLogParser {

    private static final int GZIP_MAGIC_FIRST = 0x1f;
    private static final int GZIP_MAGIC_SECOND = 0x8b;

    private final AnalysisThresholds thresholds;
    private final StatementReconstructor reconstructor;
    private final Random random;

    private List<Query> queries = new ArrayList<>();
    private LogStatistics statistics = new LogStatistics();

    public QueryLogParser() {
        this(AnalysisThresholds.defaults());
    }

    public QueryLogParser(AnalysisThresholds thresholds) {
        this(thresholds, new Random());
    }

    public QueryLogParser(AnalysisThresholds thresholds, Random random) {
        this.thresholds = thresholds;
        this.reconstructor = new StatementReconstructor(thresholds);
        this.random = random;
    }

    public List<Query> parseFile(Path logFile) throws IOException {
        return parseFile(logFile, null);
    }

    /**
     * Parses a log file, optionally looking at a random sample of its lines only.
     *
     * @param sampleSize number of lines to sample, or null for all lines
     * @throws IOException when the file does not exist or cannot be read
     */
    public List<Query> parseFile(Path logFile, Integer sampleSize) throws IOException {
        if (!Files.exists(logFile)) {
            throw new IOException("Log file not found: " + logFile);
        }

        try (InputStream in = Files.newInputStream(logFile)) {
            return parse(in, logFile.getFileName().toString(), sampleSize);
        }
    }

    /**
     * Parses a log stream. Gzip content is recognised by a {@code .gz} source name or by its magic bytes.
     */
    public List<Query> parse(InputStream input, String sourceName, Integer sampleSize) throws IOException {
        log.info("Starting to parse log: {}", sourceName);

        InputStream buffered = new BufferedInputStream(input);
        if (isGzip(buffered, sourceName)) {
            log.debug("Reading {} as gzip", sourceName);
            buffered = new GZIPInputStream(buffered);
        }

        Reader reader = new InputStreamReader(buffered, StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE));
        return parse(reader, sampleSize);
    }

    /**
     * Parses already decoded log text.
     */
    public List<Query> parse(Reader reader, Integer sampleSize) throws IOException {
        queries = new ArrayList<>();
        statistics = new LogStatistics();
        ParserState state = new ParserState();

        List<String> lines = readLines(reader);
        if (sampleSize != null && sampleSize < lines.size()) {
            lines = sample(lines, sampleSize);
            log.info("Sampled {} lines", lines.size());
        }

        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }

            statistics.incrementTotalLines();
            processLine(line, state);

            if (thresholds.getProgressLogInterval() > 0
                    && statistics.getTotalLines() % thresholds.getProgressLogInterval() == 0) {
                log.info("Processed {} lines, found {} queries so far",
                        statistics.getTotalLines(), statistics.getParsedQueries());
            }
        }

        reconstructor.flush(state).ifPresent(this::emit);

        log.info("Parsing complete. {}", statistics.getSummary());
        return Collections.unmodifiableList(queries);
    }

    private void processLine(String line, ParserState state) {
        try {
            LineResult result = reconstructor.consume(line, state);

            if (result.timestamp() != null) {
                statistics.recordTimestamp(result.timestamp());
            }
            if (result.classification() == LineClassification.UNPARSED) {
                statistics.incrementUnparsedLines();
                log.debug("Line did not match any log pattern: {}", line);
            }
            result.completed().forEach(this::emit);

        } catch (DateTimeParseException e) {
            statistics.incrementErrors();
            log.warn("Invalid timestamp in line {}: {}", statistics.getTotalLines(), e.getParsedString());
        } catch (RuntimeException e) {
            statistics.incrementErrors();
            log.error("Error parsing line {}: {}", statistics.getTotalLines(), e.getMessage(), e);
        }
    }

    private void emit(CompletedStatement statement) {
        if (statement.text() == null || statement.text().isBlank()) {
            return;
        }

        Query query = Query.builder()
                .queryId(assignId(statement))
                .queryText(statement.text())
                .executionTimeMs(statement.executionTimeMs())
                .timestamp(statement.timestamp())
                .database(statement.database())
                .dialect(statement.dialect())
                .tablesAccessed(SqlTableExtractor.extractTables(statement.text()))
                .parameters(statement.parameters())
                .build();

        queries.add(query);
        statistics.incrementParsedQueries();
        log.debug("Parsed query {} ({} ms)", query.getQueryId(), query.getExecutionTimeMs());
    }

    private String assignId(CompletedStatement statement) {
        if (statement.timestamp() == null) {
            return null;
        }
        long epochMillis = toEpochMillis(statement.timestamp());
        if (statement.dialect() == LogDialect.POSTGRES) {
            return statement.processId() + "_" + epochMillis;
        }
        return "sqlalchemy_" + epochMillis + "_" + queries.size();
    }

    private static long toEpochMillis(LocalDateTime timestamp) {
        return timestamp.atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
    }

    private List<String> sample(List<String> lines, int sampleSize) {
        List<Integer> indexes = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            indexes.add(i);
        }
        Collections.shuffle(indexes, random);

        return indexes.subList(0, Math.max(sampleSize, 0)).stream()
                .sorted()
                .map(lines::get)
                .collect(Collectors.toList());
    }

    private static List<String> readLines(Reader reader) throws IOException {
        List<String> lines = new ArrayList<>();
        BufferedReader buffered = reader instanceof BufferedReader
                ? (BufferedReader) reader
                : new BufferedReader(reader);
        String line;
        while ((line = buffered.readLine()) != null) {
            lines.add(line);
        }
        return lines;
    }

    private static boolean isGzip(InputStream buffered, String sourceName) throws IOException {
        if (sourceName != null && sourceName.endsWith(".gz")) {
            return true;
        }
        buffered.mark(2);
        int first = buffered.read();
        int second = buffered.read();
        buffered.reset();
        return first == GZIP_MAGIC_FIRST && second == GZIP_MAGIC_SECOND;
    }

    public List<Query> getQueries() {
        return Collections.unmodifiableList(queries);
    }

    public LogStatistics getStatistics() {
        return statistics;
    }

    /**
     * Returns the queries of the last run at or above the configured slow-query threshold.
     */
    public List<Query> getSlowQueries() {
        return getSlowQueries(thresholds.getSlowQueryThresholdMs());
    }

    public List<Query> getSlowQueries(double thresholdMs) {
        return queries.stream()
                .filter(q -> q.isSlowerThan(thresholdMs))
                .collect(Collectors.toList());
    }
}
