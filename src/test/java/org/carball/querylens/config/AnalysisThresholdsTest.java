package org.carball.querylens.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

public class AnalysisThresholdsTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(AnalysisThresholds.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setAdditive(true);
    }

    @Test
    void shouldCreateDefaultThresholds() {
        // When
        AnalysisThresholds thresholds = AnalysisThresholds.defaults();

        // Then
        assertThat(thresholds.getSlowQueryThresholdMs()).isEqualTo(100.0);
        assertThat(thresholds.getMaxIndexColumns()).isEqualTo(3);
        assertThat(thresholds.getNominalExecutionTimeMs()).isEqualTo(0.1);
        assertThat(thresholds.getCachedAgeFactor()).isEqualTo(100.0);
        assertThat(thresholds.getCachedDurationCapMs()).isEqualTo(10.0);
        assertThat(thresholds.getProgressLogInterval()).isEqualTo(1000);
        assertThat(thresholds.getTopPatternCount()).isEqualTo(15);
    }

    @Test
    void shouldOnlyLogDebugForValidThresholds() {
        // When
        AnalysisThresholds.defaults().validate();

        // Then
        assertThat(logAppender.list).hasSize(1);
        assertThat(logAppender.list.get(0).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void shouldWarnAboutSuspiciousValues() {
        // Given
        AnalysisThresholds thresholds = AnalysisThresholds.builder()
                .slowQueryThresholdMs(5.0)
                .maxIndexColumns(0)
                .nominalExecutionTimeMs(-1.0)
                .build();

        // When
        thresholds.validate();

        // Then
        List<String> warnings = logAppender.list.stream()
                .filter(e -> e.getLevel() == Level.WARN)
                .map(ILoggingEvent::getFormattedMessage)
                .collect(Collectors.toList());
        assertThat(warnings).hasSize(3);
        assertThat(warnings).anyMatch(m -> m.contains("Max index columns (0)"));
        assertThat(warnings).anyMatch(m -> m.contains("Nominal execution time (-1.0)"));
        assertThat(warnings).anyMatch(m -> m.contains("Cached duration cap (10.0)"));
    }

    @Test
    void shouldCopyWithOverrides() {
        // When
        AnalysisThresholds copy = AnalysisThresholds.defaults().toBuilder().slowQueryThresholdMs(20.0).build();

        // Then
        assertThat(copy.getSlowQueryThresholdMs()).isEqualTo(20.0);
        assertThat(copy.getMaxIndexColumns()).isEqualTo(3);
        assertThat(copy.getConfigurationSummary()).contains("Max index columns: 3");
    }
}
