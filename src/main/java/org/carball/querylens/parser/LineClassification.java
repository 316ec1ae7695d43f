package org.carball.querylens.parser;

/**
 * How a log line was interpreted, in the order the rules are tried.
 */
public enum LineClassification {
    POSTGRES_DURATION,
    POSTGRES_OTHER,
    STATEMENT_START,
    TRANSACTION,
    ANNOTATION,
    CONTINUATION,
    UNPARSED
}
