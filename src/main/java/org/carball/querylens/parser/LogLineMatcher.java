package org.carball.querylens.parser;

import org.carball.querylens.model.query.LogDialect;

import java.util.Optional;

/**
 * Tests a single log line against one dialect's line layout.
 */
public interface LogLineMatcher {

    LogDialect dialect();

    /**
     * Returns the captured fields when the line is written in this dialect, empty otherwise.
     * Implementations must not throw for lines they do not recognise.
     */
    Optional<LineMatch> tryMatch(String line);
}
