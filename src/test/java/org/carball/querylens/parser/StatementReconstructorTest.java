package org.carball.querylens.parser;

import org.carball.querylens.config.AnalysisThresholds;
import org.carball.querylens.model.query.LogDialect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class StatementReconstructorTest {

    private StatementReconstructor reconstructor;
    private ParserState state;

    @BeforeEach
    void setUp() {
        reconstructor = new StatementReconstructor(AnalysisThresholds.defaults());
        state = new ParserState();
    }

    @Test
    void shouldEmitPostgresDurationLineImmediately() {
        // When
        LineResult result = reconstructor.consume("2025-05-09 10:15:32.5 UTC [77] app@shop:psql [s.1] LOG:  "
                + "duration: 12.5 ms  execute <unnamed>: SELECT 1", state);

        // Then
        assertThat(result.classification()).isEqualTo(LineClassification.POSTGRES_DURATION);
        assertThat(result.timestamp()).isEqualTo(LocalDateTime.of(2025, 5, 9, 10, 15, 32, 500_000_000));
        assertThat(result.completed()).singleElement().satisfies(statement -> {
            assertThat(statement.text()).isEqualTo("SELECT 1");
            assertThat(statement.executionTimeMs()).isEqualTo(12.5);
            assertThat(statement.database()).isEqualTo("shop");
            assertThat(statement.processId()).isEqualTo("77");
            assertThat(statement.dialect()).isEqualTo(LogDialect.POSTGRES);
        });
    }

    @Test
    void shouldClassifyPostgresLineWithoutDuration() {
        // When
        LineResult result = reconstructor.consume(
                "2025-05-09 10:15:32.123 UTC [77] shop [s.1] LOG:  checkpoint starting: time", state);

        // Then
        assertThat(result.classification()).isEqualTo(LineClassification.POSTGRES_OTHER);
        assertThat(result.completed()).isEmpty();
    }

    @Test
    void shouldReplaceOpenStatementWithoutFlushing() {
        // Given
        reconstructor.consume("2025-05-09 09:51:36,739 - INFO - SELECT a FROM first_table", state);

        // When
        LineResult result = reconstructor.consume("2025-05-09 09:51:36,740 - INFO - SELECT b FROM second_table", state);

        // Then
        assertThat(result.classification()).isEqualTo(LineClassification.STATEMENT_START);
        assertThat(result.completed()).isEmpty();
        assertThat(state.getFragments()).containsExactly("SELECT b FROM second_table");
    }

    @Test
    void shouldFlushOpenStatementBeforeTransactionLine() {
        // Given
        reconstructor.consume("2025-05-09 09:51:36,739 - INFO - UPDATE accounts SET balance = 0", state);

        // When
        LineResult result = reconstructor.consume("2025-05-09 09:51:36,800 - INFO - COMMIT", state);

        // Then
        assertThat(result.classification()).isEqualTo(LineClassification.TRANSACTION);
        assertThat(result.completed()).extracting(CompletedStatement::text)
                .containsExactly("UPDATE accounts SET balance = 0", "COMMIT");
        assertThat(result.completed()).allSatisfy(s -> assertThat(s.executionTimeMs()).isEqualTo(0.1));
        assertThat(state.isCollecting()).isFalse();
    }

    @Test
    void shouldFinishStatementOnGeneratedAnnotationWithParameters() {
        // Given
        reconstructor.consume("2025-05-09 09:51:36,739 - INFO - SELECT users.id FROM users", state);
        reconstructor.consume("WHERE users.email = %(email_1)s", state);

        // When
        LineResult result = reconstructor.consume(
                "2025-05-09 09:51:36,741 - INFO - [generated in 0.00123s] {'email_1': 'a@b.c', 'active': True, 'n': None}",
                state);

        // Then
        assertThat(result.classification()).isEqualTo(LineClassification.ANNOTATION);
        assertThat(result.completed()).singleElement().satisfies(statement -> {
            assertThat(statement.text()).isEqualTo("SELECT users.id FROM users WHERE users.email = %(email_1)s");
            assertThat(statement.executionTimeMs()).isCloseTo(1.23, within(1e-9));
            assertThat(statement.parameters())
                    .containsEntry("email_1", "a@b.c")
                    .containsEntry("active", true)
                    .containsEntry("n", null);
            assertThat(statement.timestamp()).isEqualTo(LocalDateTime.of(2025, 5, 9, 9, 51, 36, 739_000_000));
        });
    }

    @Test
    void shouldTreatUnknownLineOutsideStatementAsUnparsed() {
        // When
        LineResult result = reconstructor.consume("FROM orders", state);

        // Then
        assertThat(result.classification()).isEqualTo(LineClassification.UNPARSED);
        assertThat(result.timestamp()).isNull();
    }

    @Test
    void shouldIgnoreAnnotationWhenNothingIsOpen() {
        // When
        LineResult result = reconstructor.consume("2025-05-09 09:51:36,741 - INFO - [cached since 3s ago] {}", state);

        // Then
        assertThat(result.classification()).isEqualTo(LineClassification.UNPARSED);
        assertThat(result.completed()).isEmpty();
    }

    @Test
    void shouldFlushOpenStatementWithNominalDuration() {
        // Given
        reconstructor.consume("2025-05-09 09:51:36,739 - INFO - DELETE FROM sessions", state);

        // When
        Optional<CompletedStatement> flushed = reconstructor.flush(state);

        // Then
        assertThat(flushed).isPresent();
        assertThat(flushed.get().executionTimeMs()).isEqualTo(0.1);
        assertThat(reconstructor.flush(state)).isEmpty();
    }

    @Test
    void shouldRejectInvalidTimestamp() {
        assertThatThrownBy(() -> reconstructor.consume("2025-13-40 09:51:36,739 - INFO - COMMIT", state))
                .isInstanceOf(DateTimeParseException.class);
    }

    @Test
    void shouldResolveExecutionTimeFromAnnotations() {
        assertThat(reconstructor.resolveExecutionTime("[generated in 0.5s]")).isEqualTo(500.0);
        assertThat(reconstructor.resolveExecutionTime("[cached since 0.02s ago]")).isCloseTo(2.0, within(1e-9));
        assertThat(reconstructor.resolveExecutionTime("[cached since 22.05s ago]")).isEqualTo(10.0);
        assertThat(reconstructor.resolveExecutionTime("[raw sql]")).isEqualTo(0.1);
    }

    @Test
    void shouldReturnNullForUnreadableParameterPayload() {
        assertThat(reconstructor.readParameters("[generated in 0.1s] {'a': <object at 0x1>}")).isNull();
        assertThat(reconstructor.readParameters("[generated in 0.1s] ()")).isNull();
    }

    @Test
    void shouldExtractFragmentAfterMarker() {
        assertThat(StatementReconstructor.extractFragment(
                "2025-05-09 09:51:36,740 - DEBUG - Line 635 did not match any log pattern: FROM t WHERE x = 1"))
                .contains("FROM t WHERE x = 1");
        assertThat(StatementReconstructor.extractFragment("   order by created_at")).contains("order by created_at");
        assertThat(StatementReconstructor.extractFragment("Traceback (most recent call last):")).isEmpty();
    }

    @Test
    void shouldReadParameterMap() {
        // When
        Map<String, Object> parameters = reconstructor.readParameters("[generated in 0.1s] {'ticker_1': 'MSFT', 'param_1': 1}");

        // Then
        assertThat(parameters).containsEntry("ticker_1", "MSFT").containsEntry("param_1", 1);
    }

    @Test
    void shouldKeepPythonLiteralWordsInsideQuotedValues() {
        // When
        Map<String, Object> parameters = reconstructor.readParameters(
                "[generated in 0.1s] {'msg': 'x: None, y', 'note': \"it's True, really\", 'flag': False}");

        // Then
        assertThat(parameters)
                .containsEntry("msg", "x: None, y")
                .containsEntry("note", "it's True, really")
                .containsEntry("flag", false);
    }
}
