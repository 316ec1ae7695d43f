package org.carball.querylens.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.model.query.Query;
import org.carball.querylens.model.query.QueryPatternGroup;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups queries whose text differs only in literal values.
 */
@Slf4j
public class QueryPatternAnalyzer {

    // null means each query is normalized in the style of its own dialect
    private final NormalizationStyle style;

    public QueryPatternAnalyzer() {
        this(null);
    }

    public QueryPatternAnalyzer(NormalizationStyle style) {
        this.style = style;
    }

    /**
     * Returns one group per pattern, largest first. Groups of equal size keep the order in which
     * their pattern first appeared.
     */
    public List<QueryPatternGroup> analyzePatterns(List<Query> queries) {
        Map<String, List<Query>> byPattern = new LinkedHashMap<>();

        for (Query query : queries) {
            String pattern = QueryNormalizer.normalize(query.getQueryText(), styleFor(query));
            byPattern.computeIfAbsent(pattern, k -> new ArrayList<>()).add(query);
        }

        List<QueryPatternGroup> groups = new ArrayList<>();
        byPattern.forEach((pattern, members) -> groups.add(new QueryPatternGroup(pattern, List.copyOf(members))));

        // List.sort is stable, which keeps first-appearance order for ties
        groups.sort(Comparator.comparingInt(QueryPatternGroup::getCount).reversed());

        log.info("Found {} distinct query patterns in {} queries", groups.size(), queries.size());
        return groups;
    }

    private NormalizationStyle styleFor(Query query) {
        return style != null ? style : NormalizationStyle.forDialect(query.getDialect());
    }
}
