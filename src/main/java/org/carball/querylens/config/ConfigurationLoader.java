package org.carball.querylens.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public AnalysisThresholds loadConfiguration(String[] args) {
        return loadConfiguration(null, args);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > thresholds file > defaults
     */
    public AnalysisThresholds loadConfiguration(Path thresholdsFile, String[] args) {
        log.debug("Loading configuration");

        AnalysisThresholds.AnalysisThresholdsBuilder builder = AnalysisThresholds.builder();

        // 1. Apply thresholds file
        if (thresholdsFile != null) {
            applyThresholdsFile(builder, thresholdsFile);
        }

        // 2. Apply environment variables
        applyEnvironmentVariables(builder);

        // 3. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        AnalysisThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded: {}", thresholds.getConfigurationSummary());
        return thresholds;
    }

    private void applyThresholdsFile(AnalysisThresholds.AnalysisThresholdsBuilder builder, Path thresholdsFile) {
        if (!Files.exists(thresholdsFile)) {
            log.warn("Thresholds file not found: {}, using defaults", thresholdsFile);
            return;
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            JsonNode root = mapper.readTree(thresholdsFile.toFile());
            if (root == null || !root.isObject()) {
                log.warn("Thresholds file {} is empty or not a mapping, using defaults", thresholdsFile);
                return;
            }

            if (root.hasNonNull("slow_query_threshold_ms")) {
                builder.slowQueryThresholdMs(root.get("slow_query_threshold_ms").asDouble());
            }
            if (root.hasNonNull("max_index_columns")) {
                builder.maxIndexColumns(root.get("max_index_columns").asInt());
            }
            if (root.hasNonNull("nominal_execution_time_ms")) {
                builder.nominalExecutionTimeMs(root.get("nominal_execution_time_ms").asDouble());
            }
            if (root.hasNonNull("cached_age_factor")) {
                builder.cachedAgeFactor(root.get("cached_age_factor").asDouble());
            }
            if (root.hasNonNull("cached_duration_cap_ms")) {
                builder.cachedDurationCapMs(root.get("cached_duration_cap_ms").asDouble());
            }
            if (root.hasNonNull("progress_log_interval")) {
                builder.progressLogInterval(root.get("progress_log_interval").asInt());
            }
            if (root.hasNonNull("top_pattern_count")) {
                builder.topPatternCount(root.get("top_pattern_count").asInt());
            }
            log.info("Loaded threshold configuration from: {}", thresholdsFile);

        } catch (IOException e) {
            log.error("Failed to load thresholds from {}: {}, using defaults", thresholdsFile, e.getMessage());
        }
    }

    private void applyEnvironmentVariables(AnalysisThresholds.AnalysisThresholdsBuilder builder) {
        String slowQuery = environment.get("QUERYLENS_SLOW_QUERY_THRESHOLD_MS");
        String maxColumns = environment.get("QUERYLENS_MAX_INDEX_COLUMNS");
        String nominal = environment.get("QUERYLENS_NOMINAL_EXECUTION_TIME_MS");
        String cachedCap = environment.get("QUERYLENS_CACHED_DURATION_CAP_MS");

        try {
            if (slowQuery != null) {
                builder.slowQueryThresholdMs(Double.parseDouble(slowQuery));
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for QUERYLENS_SLOW_QUERY_THRESHOLD_MS: {}", slowQuery);
        }
        try {
            if (maxColumns != null) {
                builder.maxIndexColumns(Integer.parseInt(maxColumns));
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for QUERYLENS_MAX_INDEX_COLUMNS: {}", maxColumns);
        }
        try {
            if (nominal != null) {
                builder.nominalExecutionTimeMs(Double.parseDouble(nominal));
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for QUERYLENS_NOMINAL_EXECUTION_TIME_MS: {}", nominal);
        }
        try {
            if (cachedCap != null) {
                builder.cachedDurationCapMs(Double.parseDouble(cachedCap));
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for QUERYLENS_CACHED_DURATION_CAP_MS: {}", cachedCap);
        }
    }

    private void applyCLIArguments(AnalysisThresholds.AnalysisThresholdsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--slow-threshold":
                    case "--thresholds.slow-query-ms":
                        builder.slowQueryThresholdMs(Double.parseDouble(value));
                        break;
                    case "--thresholds.max-index-columns":
                        builder.maxIndexColumns(Integer.parseInt(value));
                        break;
                    case "--thresholds.nominal-ms":
                        builder.nominalExecutionTimeMs(Double.parseDouble(value));
                        break;
                    case "--thresholds.cached-factor":
                        builder.cachedAgeFactor(Double.parseDouble(value));
                        break;
                    case "--thresholds.cached-cap-ms":
                        builder.cachedDurationCapMs(Double.parseDouble(value));
                        break;
                    case "--thresholds.progress-interval":
                        builder.progressLogInterval(Integer.parseInt(value));
                        break;
                    case "--thresholds.top-patterns":
                        builder.topPatternCount(Integer.parseInt(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments:
              --slow-threshold <ms>                 Duration at or above which a query is slow (default 100)
              --thresholds.max-index-columns <num>  Widest column set proposed as an index (default 3)
              --thresholds.nominal-ms <ms>          Duration for statements without timing (default 0.1)
              --thresholds.cached-factor <num>      Multiplier applied to "cached since" ages (default 100)
              --thresholds.cached-cap-ms <ms>       Cap for durations derived from cache ages (default 10)
              --thresholds.progress-interval <num>  Lines between progress log messages (default 1000)
              --thresholds.top-patterns <num>       Patterns listed in reports (default 15)

            Environment Variables:
              QUERYLENS_SLOW_QUERY_THRESHOLD_MS     Same as --slow-threshold
              QUERYLENS_MAX_INDEX_COLUMNS           Same as --thresholds.max-index-columns
              QUERYLENS_NOMINAL_EXECUTION_TIME_MS   Same as --thresholds.nominal-ms
              QUERYLENS_CACHED_DURATION_CAP_MS      Same as --thresholds.cached-cap-ms

            Thresholds File (--thresholds <file.yml>):
              slow_query_threshold_ms, max_index_columns, nominal_execution_time_ms,
              cached_age_factor, cached_duration_cap_ms, progress_log_interval, top_pattern_count

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Thresholds file
              4. Built-in defaults
            """;
    }
}
