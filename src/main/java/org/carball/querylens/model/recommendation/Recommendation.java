package org.carball.querylens.model.recommendation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A candidate optimization derived from parsed queries.
 *
 * <p>Recommendations are created {@link RecommendationStatus#PENDING}. The status transitions below
 * are driven by whoever reviews the recommendation; the analyzers never call them.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recommendation {
    private String recommendationId;

    @Builder.Default
    private RecommendationType type = RecommendationType.INDEX;

    private String title;
    private String description;
    private double impactScore;
    private String sqlScript;

    @Builder.Default
    private RecommendationStatus status = RecommendationStatus.PENDING;

    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();
    private LocalDateTime updatedAt;
    private LocalDateTime implementedAt;

    @Builder.Default
    private List<String> relatedObjects = new ArrayList<>();
    private String estimatedImprovement;

    @Builder.Default
    private List<String> sourceQueries = new ArrayList<>();

    public void dismiss() {
        status = RecommendationStatus.DISMISSED;
        updatedAt = LocalDateTime.now();
    }

    public void implement() {
        LocalDateTime now = LocalDateTime.now();
        status = RecommendationStatus.IMPLEMENTED;
        updatedAt = now;
        implementedAt = now;
    }

    public void schedule() {
        status = RecommendationStatus.SCHEDULED;
        updatedAt = LocalDateTime.now();
    }

    public void restore() {
        status = RecommendationStatus.PENDING;
        updatedAt = LocalDateTime.now();
    }

    @JsonIgnore
    public boolean isPending() {
        return status == RecommendationStatus.PENDING;
    }
}
