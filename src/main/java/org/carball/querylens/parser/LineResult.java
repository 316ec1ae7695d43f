package org.carball.querylens.parser;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Outcome of feeding one line to the {@link StatementReconstructor}.
 *
 * @param timestamp parsed timestamp of the line, null for lines without one
 * @param completed statements finished by this line, in emission order
 */
public record LineResult(
        LineClassification classification,
        LocalDateTime timestamp,
        List<CompletedStatement> completed
) {

    static LineResult of(LineClassification classification, LocalDateTime timestamp) {
        return new LineResult(classification, timestamp, List.of());
    }

    static LineResult of(LineClassification classification, LocalDateTime timestamp,
                         List<CompletedStatement> completed) {
        return new LineResult(classification, timestamp, List.copyOf(completed));
    }
}
