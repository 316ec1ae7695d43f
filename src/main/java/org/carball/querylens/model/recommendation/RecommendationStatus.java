package org.carball.querylens.model.recommendation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationStatus {
    PENDING("pending"),
    IMPLEMENTED("implemented"),
    DISMISSED("dismissed"),
    SCHEDULED("scheduled");

    private final String value;

    RecommendationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
