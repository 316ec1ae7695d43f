package org.carball.querylens.parser;

import lombok.Getter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Buffer for a SQLAlchemy statement whose text is spread over several lines.
 * One instance belongs to one parse run.
 */
@Getter
public class ParserState {
    private boolean collecting;
    private final List<String> fragments = new ArrayList<>();
    private LocalDateTime openTimestamp;

    public List<String> getFragments() {
        return Collections.unmodifiableList(fragments);
    }

    /**
     * Starts a new statement, discarding whatever was buffered before.
     */
    void open(String firstFragment, LocalDateTime timestamp) {
        fragments.clear();
        fragments.add(firstFragment);
        openTimestamp = timestamp;
        collecting = true;
    }

    void append(String fragment) {
        fragments.add(fragment);
    }

    boolean hasOpenStatement() {
        return collecting && !fragments.isEmpty();
    }

    String joinedText() {
        return String.join(" ", fragments);
    }

    void clear() {
        collecting = false;
        fragments.clear();
        openTimestamp = null;
    }
}
