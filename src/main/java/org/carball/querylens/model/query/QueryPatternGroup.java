package org.carball.querylens.model.query;

import java.util.List;

/**
 * Queries that share one normalized pattern.
 */
public record QueryPatternGroup(String pattern, List<Query> queries) {

    public int getCount() {
        return queries.size();
    }

    public double getTotalExecutionTimeMs() {
        return queries.stream()
                .mapToDouble(Query::getExecutionTimeMs)
                .sum();
    }

    public double getAverageExecutionTimeMs() {
        return queries.stream()
                .mapToDouble(Query::getExecutionTimeMs)
                .average()
                .orElse(0.0);
    }

    public double getMaxExecutionTimeMs() {
        return queries.stream()
                .mapToDouble(Query::getExecutionTimeMs)
                .max()
                .orElse(0.0);
    }
}
