package org.carball.querylens.analyzer;

import org.carball.querylens.model.query.LogDialect;
import org.carball.querylens.model.query.Query;
import org.carball.querylens.model.query.QueryPatternGroup;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class QueryPatternAnalyzerTest {

    @Test
    void shouldGroupQueriesDifferingOnlyInLiterals() {
        // Given
        List<Query> queries = List.of(
                query("SELECT * FROM users WHERE id = 1", 10.0),
                query("SELECT * FROM accounts WHERE owner = 'a'", 5.0),
                query("SELECT * FROM users WHERE id = 2", 30.0),
                query("SELECT * FROM accounts WHERE owner = 'b'", 7.0),
                query("SELECT * FROM users WHERE id = 3", 20.0),
                query("COMMIT", 0.1));

        // When
        List<QueryPatternGroup> groups = new QueryPatternAnalyzer().analyzePatterns(queries);

        // Then
        assertThat(groups).extracting(QueryPatternGroup::pattern).containsExactly(
                "SELECT * FROM users WHERE id = N",
                "SELECT * FROM accounts WHERE owner = 'S'",
                "COMMIT");

        QueryPatternGroup users = groups.get(0);
        assertThat(users.getCount()).isEqualTo(3);
        assertThat(users.getTotalExecutionTimeMs()).isCloseTo(60.0, within(1e-9));
        assertThat(users.getAverageExecutionTimeMs()).isCloseTo(20.0, within(1e-9));
        assertThat(users.getMaxExecutionTimeMs()).isEqualTo(30.0);
    }

    @Test
    void shouldKeepFirstAppearanceOrderForTies() {
        // Given
        List<Query> queries = List.of(
                query("SELECT b FROM t WHERE x = 1", 1.0),
                query("SELECT a FROM t WHERE x = 1", 1.0),
                query("SELECT b FROM t WHERE x = 2", 1.0),
                query("SELECT a FROM t WHERE x = 2", 1.0));

        // When
        List<QueryPatternGroup> groups = new QueryPatternAnalyzer().analyzePatterns(queries);

        // Then
        assertThat(groups).extracting(QueryPatternGroup::pattern)
                .containsExactly("SELECT b FROM t WHERE x = N", "SELECT a FROM t WHERE x = N");
    }

    @Test
    void shouldNormalizeEachQueryInItsDialectStyle() {
        // Given
        Query orm = query("SELECT * FROM t WHERE id = 5", 1.0);
        orm.setDialect(LogDialect.SQLALCHEMY);

        // When
        List<QueryPatternGroup> groups = new QueryPatternAnalyzer().analyzePatterns(List.of(orm));

        // Then
        assertThat(groups).singleElement().extracting(QueryPatternGroup::pattern)
                .isEqualTo("SELECT * FROM t WHERE id = ?");
    }

    @Test
    void shouldUseForcedStyleWhenGiven() {
        // Given
        Query orm = query("SELECT * FROM t WHERE id = 5", 1.0);
        orm.setDialect(LogDialect.SQLALCHEMY);

        // When
        List<QueryPatternGroup> groups = new QueryPatternAnalyzer(NormalizationStyle.POSTGRES)
                .analyzePatterns(List.of(orm));

        // Then
        assertThat(groups.get(0).pattern()).isEqualTo("SELECT * FROM t WHERE id = N");
    }

    private static Query query(String text, double executionTimeMs) {
        return Query.builder()
                .queryText(text)
                .executionTimeMs(executionTimeMs)
                .dialect(LogDialect.POSTGRES)
                .build();
    }
}
