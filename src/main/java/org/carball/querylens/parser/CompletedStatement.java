package org.carball.querylens.parser;

import org.carball.querylens.model.query.LogDialect;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * A finished statement, before table extraction and id assignment.
 *
 * @param processId backend pid for PostgreSQL statements, null otherwise
 * @param parameters bound parameters read from a SQLAlchemy payload, null when none was seen
 */
public record CompletedStatement(
        String text,
        double executionTimeMs,
        LocalDateTime timestamp,
        String database,
        LogDialect dialect,
        String processId,
        Map<String, Object> parameters
) {}
