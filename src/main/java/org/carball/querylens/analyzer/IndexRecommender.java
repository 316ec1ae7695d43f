package org.carball.querylens.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.config.AnalysisThresholds;
import org.carball.querylens.model.query.Query;
import org.carball.querylens.model.recommendation.Recommendation;
import org.carball.querylens.model.recommendation.RecommendationType;
import org.carball.querylens.parser.SqlTableExtractor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Proposes single-table indexes from the columns that SELECT statements filter on.
 *
 * <p>The column detection is a text heuristic and does not consult execution plans. A statement that
 * touches several tables contributes its column set to each of them.</p>
 */
@Slf4j
public class IndexRecommender {

    private final AnalysisThresholds thresholds;
    private List<Recommendation> recommendations = new ArrayList<>();

    public IndexRecommender() {
        this(AnalysisThresholds.defaults());
    }

    public IndexRecommender(AnalysisThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Analyzes a batch of queries and returns index recommendations ordered by impact, highest first.
     */
    public List<Recommendation> analyzeQueries(List<Query> queries) {
        log.info("Analyzing {} queries for index candidates", queries.size());

        Map<String, List<Query>> queriesByTable = new LinkedHashMap<>();
        for (Query query : queries) {
            for (String table : query.getTablesAccessed()) {
                queriesByTable.computeIfAbsent(table, k -> new ArrayList<>()).add(query);
            }
        }

        List<Recommendation> results = new ArrayList<>();
        queriesByTable.forEach((table, tableQueries) -> {
            Map<List<String>, List<Query>> candidates = identifyCandidateColumns(tableQueries);

            candidates.forEach((columns, impacted) -> {
                if (columns.size() > thresholds.getMaxIndexColumns()) {
                    log.debug("Skipping {} ({} columns exceed the limit of {})",
                            columns, columns.size(), thresholds.getMaxIndexColumns());
                    return;
                }
                results.add(buildRecommendation(table, columns, impacted));
            });
        });

        results.sort(Comparator.comparingDouble(Recommendation::getImpactScore).reversed());
        recommendations = results;

        log.info("Generated {} index recommendations", results.size());
        return Collections.unmodifiableList(recommendations);
    }

    /**
     * Maps each distinct column set to the queries that filter on exactly that set.
     */
    private Map<List<String>, List<Query>> identifyCandidateColumns(List<Query> tableQueries) {
        // slowest first, so source queries are listed by cost
        List<Query> ordered = new ArrayList<>(tableQueries);
        ordered.sort(Comparator.comparingDouble(Query::getExecutionTimeMs).reversed());

        Map<List<String>, List<Query>> candidates = new LinkedHashMap<>();
        for (Query query : ordered) {
            List<String> columns = SqlTableExtractor.extractWhereColumns(query.getQueryText());
            if (!columns.isEmpty()) {
                candidates.computeIfAbsent(columns, k -> new ArrayList<>()).add(query);
            }
        }
        return candidates;
    }

    private Recommendation buildRecommendation(String table, List<String> columns, List<Query> impacted) {
        double totalTime = impacted.stream().mapToDouble(Query::getExecutionTimeMs).sum();
        int frequency = impacted.size();
        double impactScore = Math.min(100.0, totalTime * frequency / 1000.0);

        String columnList = String.join(", ", columns);
        String indexName = indexName(table, columns);

        return Recommendation.builder()
                .recommendationId(UUID.randomUUID().toString())
                .type(RecommendationType.INDEX)
                .title(String.format("Add index on %s(%s)", table, columnList))
                .description(String.format("Creating an index on %s(%s) could improve the performance of %d "
                        + "queries with a total execution time of %.2f ms.", table, columnList, frequency, totalTime))
                .impactScore(impactScore)
                .sqlScript(String.format("CREATE INDEX %s ON %s (%s);", indexName, table, columnList))
                .relatedObjects(new ArrayList<>(List.of(table)))
                .estimatedImprovement(String.format("May reduce query time by up to 80%% for %d queries", frequency))
                .sourceQueries(impacted.stream().map(Query::getQueryId).collect(Collectors.toList()))
                .build();
    }

    static String indexName(String table, List<String> columns) {
        String name = "idx_" + table + "_" + String.join("_", columns);
        return name.replaceAll("\\W", "_");
    }

    public List<Recommendation> getRecommendations() {
        return Collections.unmodifiableList(recommendations);
    }

    public Optional<Recommendation> getRecommendationById(String recommendationId) {
        return recommendations.stream()
                .filter(r -> r.getRecommendationId().equals(recommendationId))
                .findFirst();
    }
}
