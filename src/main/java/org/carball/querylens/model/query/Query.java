package org.carball.querylens.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One statement reconstructed from a database log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Query {
    private String queryId;
    private String queryText;
    private double executionTimeMs;
    private LocalDateTime timestamp;
    private String database;
    private LogDialect dialect;

    @Builder.Default
    private Set<String> tablesAccessed = new LinkedHashSet<>();

    // Only set for SQLAlchemy statements whose parameter payload was seen
    private Map<String, Object> parameters;

    @Builder.Default
    private int frequency = 1;

    /**
     * Returns the assigned id, or a short content hash of the query text when none was assigned.
     */
    public String getQueryId() {
        if (queryId == null && queryText != null) {
            queryId = contentHash(queryText);
        }
        return queryId;
    }

    public boolean isSlowerThan(double thresholdMs) {
        return executionTimeMs >= thresholdMs;
    }

    public static String contentHash(String text) {
        return DigestUtils.md5Hex(text.getBytes(StandardCharsets.UTF_8)).substring(0, 10);
    }
}
