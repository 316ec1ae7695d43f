package org.carball.querylens.parser;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.config.AnalysisThresholds;
import org.carball.querylens.model.query.LogDialect;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns log lines into finished statements.
 *
 * <p>Each line is classified by the first rule that applies:</p>
 * <ol>
 *   <li>PostgreSQL line: a {@code duration: N ms statement: ...} message is a complete statement.</li>
 *   <li>SQLAlchemy line starting with SELECT, INSERT, UPDATE or DELETE: opens a new buffer.
 *       A buffer that was still open is dropped, not flushed.</li>
 *   <li>SQLAlchemy BEGIN, COMMIT or ROLLBACK: flushes the open buffer, then is emitted itself.</li>
 *   <li>SQLAlchemy line starting with {@code [} while a buffer is open: timing annotation, flushes the buffer.</li>
 *   <li>Any other line while a buffer is open: appended when it looks like a SQL fragment.</li>
 * </ol>
 *
 * <p>The reconstructor itself is stateless; everything that spans lines lives in the
 * {@link ParserState} passed in by the caller.</p>
 */
@Slf4j
public class StatementReconstructor {

    static final String FRAGMENT_MARKER = "did not match any log pattern:";

    private static final List<String> STATEMENT_KEYWORDS = List.of("SELECT", "INSERT", "UPDATE", "DELETE");

    private static final List<String> CLAUSE_KEYWORDS = List.of(
            "FROM", "WHERE", "GROUP BY", "HAVING", "ORDER BY", "LIMIT", "JOIN", "UNION");

    private static final Pattern DURATION_PATTERN = Pattern.compile(
            "duration: (\\d+(?:\\.\\d+)?) ms\\s+(?:statement|execute [^:]*): (.+)$");

    private static final Pattern GENERATED_PATTERN = Pattern.compile("generated in (\\d+(?:\\.\\d+)?)s");

    private static final Pattern CACHED_PATTERN = Pattern.compile("cached since (\\d+(?:\\.\\d+)?)s ago");

    // Python literals that JSON does not know, when they appear as dict values. Quoted strings are
    // matched first so that their content is kept as is.
    private static final Pattern PYTHON_LITERAL = Pattern.compile(
            "'(?:[^'\\\\]|\\\\.)*'"
            + "|\"(?:[^\"\\\\]|\\\\.)*\""
            + "|([:\\[,(]\\s*)(None|True|False)(?=\\s*[,}\\])])");

    private final List<LogLineMatcher> matchers;
    private final AnalysisThresholds thresholds;
    private final ObjectMapper payloadMapper;

    public StatementReconstructor(AnalysisThresholds thresholds) {
        this(List.of(new PostgresLineMatcher(), new SqlAlchemyLineMatcher()), thresholds);
    }

    public StatementReconstructor(List<LogLineMatcher> matchers, AnalysisThresholds thresholds) {
        this.matchers = List.copyOf(matchers);
        this.thresholds = thresholds;
        this.payloadMapper = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
                .build();
    }

    /**
     * Classifies one line and applies its transition to {@code state}.
     *
     * @throws java.time.format.DateTimeParseException when a matched line carries an invalid timestamp
     */
    public LineResult consume(String line, ParserState state) {
        for (LogLineMatcher matcher : matchers) {
            Optional<LineMatch> match = matcher.tryMatch(line);
            if (match.isPresent()) {
                LineMatch lineMatch = match.get();
                LocalDateTime timestamp = lineMatch.dialect().parseTimestamp(lineMatch.timestamp());

                if (lineMatch.dialect() == LogDialect.POSTGRES) {
                    return handlePostgres(lineMatch, timestamp);
                }
                return handleSqlAlchemy(lineMatch, line, timestamp, state);
            }
        }
        return handleFragment(line, null, state);
    }

    /**
     * Finishes a statement still open when the input ends.
     */
    public Optional<CompletedStatement> flush(ParserState state) {
        if (!state.hasOpenStatement()) {
            return Optional.empty();
        }
        log.debug("Flushing statement left open at end of input ({} fragments)", state.getFragments().size());
        return Optional.of(finish(state, thresholds.getNominalExecutionTimeMs(), null));
    }

    private LineResult handlePostgres(LineMatch match, LocalDateTime timestamp) {
        Matcher duration = DURATION_PATTERN.matcher(match.message());
        if (!duration.find()) {
            return LineResult.of(LineClassification.POSTGRES_OTHER, timestamp);
        }

        CompletedStatement statement = new CompletedStatement(
                duration.group(2).trim(),
                Double.parseDouble(duration.group(1)),
                timestamp,
                match.database(),
                LogDialect.POSTGRES,
                match.processId(),
                null
        );
        return LineResult.of(LineClassification.POSTGRES_DURATION, timestamp, List.of(statement));
    }

    private LineResult handleSqlAlchemy(LineMatch match, String line, LocalDateTime timestamp, ParserState state) {
        String message = match.message();

        if (startsWithAny(message, STATEMENT_KEYWORDS)) {
            if (state.hasOpenStatement()) {
                log.debug("Dropping unfinished statement opened at {}: {}", state.getOpenTimestamp(), state.joinedText());
            }
            state.open(message, timestamp);
            return LineResult.of(LineClassification.STATEMENT_START, timestamp);
        }

        if (isTransaction(message)) {
            List<CompletedStatement> completed = new ArrayList<>();
            if (state.hasOpenStatement()) {
                completed.add(finish(state, thresholds.getNominalExecutionTimeMs(), null));
            }
            state.clear();
            completed.add(new CompletedStatement(
                    message,
                    thresholds.getNominalExecutionTimeMs(),
                    timestamp,
                    match.database(),
                    LogDialect.SQLALCHEMY,
                    null,
                    null
            ));
            return LineResult.of(LineClassification.TRANSACTION, timestamp, completed);
        }

        if (message.startsWith("[") && state.isCollecting()) {
            List<CompletedStatement> completed = new ArrayList<>();
            if (state.hasOpenStatement()) {
                completed.add(finish(state, resolveExecutionTime(message), readParameters(message)));
            }
            state.clear();
            return LineResult.of(LineClassification.ANNOTATION, timestamp, completed);
        }

        return handleFragment(line, timestamp, state);
    }

    private LineResult handleFragment(String line, LocalDateTime timestamp, ParserState state) {
        if (state.isCollecting()) {
            Optional<String> fragment = extractFragment(line);
            if (fragment.isPresent()) {
                state.append(fragment.get());
                log.debug("Identified SQL fragment: {}", fragment.get());
                return LineResult.of(LineClassification.CONTINUATION, timestamp);
            }
        }
        return LineResult.of(LineClassification.UNPARSED, timestamp);
    }

    private CompletedStatement finish(ParserState state, double executionTimeMs, Map<String, Object> parameters) {
        CompletedStatement statement = new CompletedStatement(
                state.joinedText(),
                executionTimeMs,
                state.getOpenTimestamp(),
                SqlAlchemyLineMatcher.DATABASE_SENTINEL,
                LogDialect.SQLALCHEMY,
                null,
                parameters
        );
        state.clear();
        return statement;
    }

    /**
     * Returns the SQL carried by a continuation line, if it is one.
     */
    static Optional<String> extractFragment(String line) {
        int markerPos = line.indexOf(FRAGMENT_MARKER);
        if (markerPos != -1) {
            String fragment = line.substring(markerPos + FRAGMENT_MARKER.length()).trim();
            return fragment.isEmpty() ? Optional.empty() : Optional.of(fragment);
        }

        String trimmed = line.trim();
        if (startsWithAny(trimmed.toUpperCase(Locale.ROOT), CLAUSE_KEYWORDS)) {
            return Optional.of(trimmed);
        }
        return Optional.empty();
    }

    /**
     * Derives a duration from a SQLAlchemy annotation such as {@code [generated in 0.00123s]}.
     * "cached since" ages are only a rough proxy and are scaled down and capped.
     */
    double resolveExecutionTime(String annotation) {
        Matcher generated = GENERATED_PATTERN.matcher(annotation);
        if (generated.find()) {
            return Double.parseDouble(generated.group(1)) * 1000;
        }

        Matcher cached = CACHED_PATTERN.matcher(annotation);
        if (cached.find()) {
            double ageSeconds = Double.parseDouble(cached.group(1));
            return Math.min(ageSeconds * thresholds.getCachedAgeFactor(), thresholds.getCachedDurationCapMs());
        }

        return thresholds.getNominalExecutionTimeMs();
    }

    /**
     * Reads the {@code {'name': value}} payload that follows an annotation. Returns null when
     * there is no payload or it cannot be read.
     */
    Map<String, Object> readParameters(String annotation) {
        int closing = annotation.indexOf(']');
        if (closing == -1) {
            return null;
        }

        String payload = annotation.substring(closing + 1).trim();
        if (!payload.startsWith("{")) {
            return null;
        }

        String json = PYTHON_LITERAL.matcher(payload).replaceAll(result -> {
            String literal = result.group(2);
            if (literal == null) {
                return Matcher.quoteReplacement(result.group());
            }
            String replacement = "None".equals(literal) ? "null" : literal.toLowerCase(Locale.ROOT);
            return Matcher.quoteReplacement(result.group(1) + replacement);
        });

        try {
            return payloadMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            log.debug("Could not read parameter payload {}: {}", payload, e.getOriginalMessage());
            return null;
        }
    }

    private static boolean isTransaction(String message) {
        return message.startsWith("BEGIN") || message.equals("COMMIT") || message.equals("ROLLBACK");
    }

    private static boolean startsWithAny(String text, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (text.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
