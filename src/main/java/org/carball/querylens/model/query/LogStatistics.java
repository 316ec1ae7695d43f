package org.carball.querylens.model.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Counters collected while parsing one log stream.
 */
@Data
public class LogStatistics {
    private long totalLines;
    private long parsedQueries;
    private long errors;
    private long unparsedLines;
    private LocalDateTime startTime;
    private LocalDateTime endTime;

    public void incrementTotalLines() {
        totalLines++;
    }

    public void incrementParsedQueries() {
        parsedQueries++;
    }

    public void incrementErrors() {
        errors++;
    }

    public void incrementUnparsedLines() {
        unparsedLines++;
    }

    /**
     * Widens the observed time range to include the given timestamp.
     */
    public void recordTimestamp(LocalDateTime timestamp) {
        if (startTime == null || timestamp.isBefore(startTime)) {
            startTime = timestamp;
        }
        if (endTime == null || timestamp.isAfter(endTime)) {
            endTime = timestamp;
        }
    }

    @JsonIgnore
    public String getSummary() {
        return String.format("lines=%d, queries=%d, errors=%d, unparsed=%d, range=%s..%s",
                totalLines, parsedQueries, errors, unparsedLines, startTime, endTime);
    }
}
