package org.carball.querylens.config;

public enum OutputFormat {
    SQL,
    MARKDOWN,
    JSON,
    ALL
}
