package org.carball.querylens.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class QueryLogAnalyzerConfig {
    private Path logFile;
    private String outputFile;
    private OutputFormat outputFormat;
    private Integer sampleSize;
    private Path thresholdsFile;
    private AnalysisThresholds thresholds;
}
