package org.carball.querylens.model.recommendation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationType {
    INDEX("index"),
    TABLE("table"),
    QUERY("query"),
    CONFIG("config");

    private final String value;

    RecommendationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
