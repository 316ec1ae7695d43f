package org.carball.querylens.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@Slf4j
public class AnalysisThresholds {

    // Queries at or above this duration are reported as slow
    @Builder.Default
    private double slowQueryThresholdMs = 100.0;

    // Column sets wider than this are not proposed as indexes
    @Builder.Default
    private int maxIndexColumns = 3;

    // Duration given to SQLAlchemy statements whose timing was not logged
    @Builder.Default
    private double nominalExecutionTimeMs = 0.1;

    // "cached since N s ago" becomes min(N * factor, cap) milliseconds
    @Builder.Default
    private double cachedAgeFactor = 100.0;

    @Builder.Default
    private double cachedDurationCapMs = 10.0;

    @Builder.Default
    private int progressLogInterval = 1000;

    @Builder.Default
    private int topPatternCount = 15;

    /**
     * Creates the thresholds used when nothing is configured.
     */
    public static AnalysisThresholds defaults() {
        return AnalysisThresholds.builder().build();
    }

    /**
     * Validates the configuration and logs warnings for values that are likely mistakes.
     */
    public void validate() {
        if (slowQueryThresholdMs < 0) {
            log.warn("Slow query threshold ({}) should not be negative", slowQueryThresholdMs);
        }

        if (maxIndexColumns < 1) {
            log.warn("Max index columns ({}) should be at least 1, no index will be recommended", maxIndexColumns);
        }

        if (nominalExecutionTimeMs < 0) {
            log.warn("Nominal execution time ({}) should not be negative", nominalExecutionTimeMs);
        }

        if (cachedDurationCapMs > slowQueryThresholdMs) {
            log.warn("Cached duration cap ({}) is above the slow query threshold ({}); cached statements may be reported as slow",
                    cachedDurationCapMs, slowQueryThresholdMs);
        }

        if (progressLogInterval <= 0) {
            log.warn("Progress log interval ({}) should be positive", progressLogInterval);
        }

        log.debug("Using thresholds - Slow: {} ms, Max index columns: {}, Nominal: {} ms",
                slowQueryThresholdMs, maxIndexColumns, nominalExecutionTimeMs);
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    @JsonIgnore
    public String getConfigurationSummary() {
        return String.format("Slow query: %.1f ms | Max index columns: %d | Nominal duration: %.2f ms | Cached cap: %.1f ms",
                slowQueryThresholdMs, maxIndexColumns, nominalExecutionTimeMs, cachedDurationCapMs);
    }
}
