package org.carball.querylens.model.query;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

public class QueryTest {

    @Test
    void shouldDeriveStableIdFromTextWhenNoneAssigned() {
        // Given
        Query first = Query.builder().queryText("SELECT 1").build();
        Query second = Query.builder().queryText("SELECT 1").build();

        // Then
        assertThat(first.getQueryId()).hasSize(10).matches("[0-9a-f]{10}");
        assertThat(first.getQueryId()).isEqualTo(second.getQueryId());
        assertThat(Query.builder().queryText("SELECT 2").build().getQueryId()).isNotEqualTo(first.getQueryId());
    }

    @Test
    void shouldKeepAssignedId() {
        assertThat(Query.builder().queryId("42_1000").queryText("SELECT 1").build().getQueryId()).isEqualTo("42_1000");
    }

    @Test
    void shouldCompareAgainstSlowThresholdInclusively() {
        // Given
        Query query = Query.builder().queryText("SELECT 1").executionTimeMs(100.0).build();

        // Then
        assertThat(query.isSlowerThan(100.0)).isTrue();
        assertThat(query.isSlowerThan(100.1)).isFalse();
        assertThat(query.getFrequency()).isEqualTo(1);
        assertThat(query.getTablesAccessed()).isEmpty();
    }

    @Test
    void shouldTrackTimeRangeInStatistics() {
        // Given
        LogStatistics stats = new LogStatistics();

        // When
        stats.recordTimestamp(LocalDateTime.of(2025, 5, 9, 10, 0));
        stats.recordTimestamp(LocalDateTime.of(2025, 5, 9, 9, 0));
        stats.recordTimestamp(LocalDateTime.of(2025, 5, 9, 11, 0));
        stats.incrementTotalLines();

        // Then
        assertThat(stats.getStartTime()).isEqualTo(LocalDateTime.of(2025, 5, 9, 9, 0));
        assertThat(stats.getEndTime()).isEqualTo(LocalDateTime.of(2025, 5, 9, 11, 0));
        assertThat(stats.getSummary()).contains("lines=1");
    }

    @Test
    void shouldParseDialectTimestamps() {
        assertThat(LogDialect.POSTGRES.parseTimestamp("2025-05-09 10:15:32.123456"))
                .isEqualTo(LocalDateTime.of(2025, 5, 9, 10, 15, 32, 123_456_000));
        assertThat(LogDialect.SQLALCHEMY.parseTimestamp("2025-05-09 09:51:36,7"))
                .isEqualTo(LocalDateTime.of(2025, 5, 9, 9, 51, 36, 700_000_000));
    }
}
