package org.carball.querylens.parser;

import org.carball.querylens.model.query.LogDialect;

/**
 * Fields captured from one log line by a {@link LogLineMatcher}.
 *
 * @param processId backend pid for PostgreSQL lines, log level for SQLAlchemy lines
 */
public record LineMatch(
        LogDialect dialect,
        String timestamp,
        String processId,
        String database,
        String message
) {}
