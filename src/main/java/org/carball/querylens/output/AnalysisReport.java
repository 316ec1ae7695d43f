package org.carball.querylens.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.config.AnalysisThresholds;
import org.carball.querylens.model.query.LogStatistics;
import org.carball.querylens.model.query.Query;
import org.carball.querylens.model.query.QueryPatternGroup;
import org.carball.querylens.model.recommendation.Recommendation;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Summary of one log analysis run: parse statistics, slow queries, top patterns and recommendations.
 */
@Slf4j
public class AnalysisReport {

    private static final int MARKDOWN_QUERY_PREVIEW = 120;

    private final String source;
    private final LogStatistics statistics;
    private final List<Query> slowQueries;
    private final List<QueryPatternGroup> patterns;
    private final List<Recommendation> recommendations;
    private final AnalysisThresholds thresholds;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public AnalysisReport(String source,
                          LogStatistics statistics,
                          List<Query> slowQueries,
                          List<QueryPatternGroup> patterns,
                          List<Recommendation> recommendations,
                          AnalysisThresholds thresholds) {
        this.source = source;
        this.statistics = statistics;
        this.slowQueries = slowQueries.stream()
                .sorted(Comparator.comparingDouble(Query::getExecutionTimeMs).reversed())
                .collect(Collectors.toList());
        this.patterns = patterns;
        this.recommendations = recommendations;
        this.thresholds = thresholds;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Query Log Analysis Report\n\n");
        md.append("**Source:** ").append(source).append("  \n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n\n");

        md.append("## Log Statistics\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Lines Read | ").append(statistics.getTotalLines()).append(" |\n");
        md.append("| Queries Parsed | ").append(statistics.getParsedQueries()).append(" |\n");
        md.append("| Errors | ").append(statistics.getErrors()).append(" |\n");
        md.append("| Unparsed Lines | ").append(statistics.getUnparsedLines()).append(" |\n");
        md.append("| First Entry | ").append(formatTime(statistics.getStartTime())).append(" |\n");
        md.append("| Last Entry | ").append(formatTime(statistics.getEndTime())).append(" |\n\n");

        md.append("## Slow Queries\n\n");
        md.append(String.format("Queries taking %.1f ms or longer: **%d**%n%n",
                thresholds.getSlowQueryThresholdMs(), slowQueries.size()));
        if (!slowQueries.isEmpty()) {
            md.append("| Query ID | Duration (ms) | Query |\n");
            md.append("|----------|---------------|-------|\n");
            slowQueries.stream()
                    .limit(thresholds.getTopPatternCount())
                    .forEach(q -> md.append("| ").append(q.getQueryId())
                            .append(" | ").append(String.format("%.2f", q.getExecutionTimeMs()))
                            .append(" | `").append(preview(q.getQueryText())).append("` |\n"));
            md.append("\n");
        }

        md.append("## Top Query Patterns\n\n");
        if (patterns.isEmpty()) {
            md.append("**No queries were found in the log.**\n\n");
        } else {
            md.append("| Count | Avg (ms) | Max (ms) | Pattern |\n");
            md.append("|-------|----------|----------|---------|\n");
            patterns.stream()
                    .limit(thresholds.getTopPatternCount())
                    .forEach(p -> md.append("| ").append(p.getCount())
                            .append(" | ").append(String.format("%.2f", p.getAverageExecutionTimeMs()))
                            .append(" | ").append(String.format("%.2f", p.getMaxExecutionTimeMs()))
                            .append(" | `").append(preview(p.pattern())).append("` |\n"));
            md.append("\n");
        }

        // one level down, so every exported heading nests under this report
        md.append(new RecommendationExporter(recommendations).toMarkdown().replaceAll("(?m)^(#+) ", "#$1 "));

        md.append("---\n\n");
        md.append("*Generated by querylens*\n");
        return md.toString();
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setSource(source);
        report.setGeneratedAt(timestamp);
        report.setThresholds(thresholds);
        report.setStatistics(statistics);

        report.setSlowQueries(slowQueries.stream()
                .map(q -> new SlowQuery(q.getQueryId(), q.getExecutionTimeMs(), q.getTimestamp(),
                        q.getDatabase(), q.getQueryText()))
                .collect(Collectors.toList()));

        report.setTopPatterns(patterns.stream()
                .limit(thresholds.getTopPatternCount())
                .map(p -> new PatternSummary(p.pattern(), p.getCount(), p.getAverageExecutionTimeMs(),
                        p.getMaxExecutionTimeMs(), p.getTotalExecutionTimeMs()))
                .collect(Collectors.toList()));

        report.setRecommendations(recommendations);
        return report;
    }

    private static String formatTime(LocalDateTime time) {
        return time == null ? "-" : time.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }

    private static String preview(String text) {
        String singleLine = text.replace('\n', ' ').replace("|", "\\|").replace("`", "'");
        if (singleLine.length() <= MARKDOWN_QUERY_PREVIEW) {
            return singleLine;
        }
        return singleLine.substring(0, MARKDOWN_QUERY_PREVIEW) + "...";
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private String source;
        private LocalDateTime generatedAt;
        private AnalysisThresholds thresholds;
        private LogStatistics statistics;
        private List<SlowQuery> slowQueries;
        private List<PatternSummary> topPatterns;
        private List<Recommendation> recommendations;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class SlowQuery {
        private String queryId;
        private double executionTimeMs;
        private LocalDateTime timestamp;
        private String database;
        private String queryText;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class PatternSummary {
        private String pattern;
        private int count;
        private double averageExecutionTimeMs;
        private double maxExecutionTimeMs;
        private double totalExecutionTimeMs;
    }
}
