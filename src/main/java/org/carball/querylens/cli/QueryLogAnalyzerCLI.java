package org.carball.querylens.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.analyzer.IndexRecommender;
import org.carball.querylens.analyzer.QueryPatternAnalyzer;
import org.carball.querylens.config.ConfigurationLoader;
import org.carball.querylens.config.OutputFormat;
import org.carball.querylens.config.QueryLogAnalyzerConfig;
import org.carball.querylens.model.query.LogStatistics;
import org.carball.querylens.model.query.Query;
import org.carball.querylens.model.query.QueryPatternGroup;
import org.carball.querylens.model.recommendation.Recommendation;
import org.carball.querylens.output.AnalysisReport;
import org.carball.querylens.output.RecommendationExporter;
import org.carball.querylens.parser.QueryLogParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Slf4j
public class QueryLogAnalyzerCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║            Query Log Analyzer and Index Advisor v%s         ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    private static final String DEFAULT_OUTPUT = "query-analysis";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs one analysis and returns the process exit code.
     */
    static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? 1 : 0;
        }

        try {
            QueryLogAnalyzerConfig config = parseArgs(args);

            System.out.println("\n🔍 Starting analysis...");
            System.out.println("   Log file: " + config.getLogFile());
            if (config.getSampleSize() != null) {
                System.out.println("   Sample size: " + config.getSampleSize() + " lines");
            }
            System.out.println("   Output: " + String.join(", ", outputFiles(config)));
            System.out.println();

            // Step 1: Parse the log
            System.out.print("📄 Parsing log file... ");
            QueryLogParser parser = new QueryLogParser(config.getThresholds());
            List<Query> queries = parser.parseFile(config.getLogFile(), config.getSampleSize());
            List<Query> slowQueries = parser.getSlowQueries();
            System.out.println("✓");

            // Step 2: Group query patterns
            System.out.print("📊 Grouping query patterns... ");
            List<QueryPatternGroup> patterns = new QueryPatternAnalyzer().analyzePatterns(queries);
            System.out.println("✓");

            // Step 3: Recommend indexes
            System.out.print("🎯 Generating index recommendations... ");
            List<Recommendation> recommendations = new IndexRecommender(config.getThresholds()).analyzeQueries(queries);
            System.out.println("✓");

            // Step 4: Output results
            System.out.print("📝 Writing results... ");
            AnalysisReport report = new AnalysisReport(config.getLogFile().toString(), parser.getStatistics(),
                    slowQueries, patterns, recommendations, config.getThresholds());
            outputResults(report, recommendations, config);
            System.out.println("✓");

            printSummary(parser.getStatistics(), slowQueries, patterns, recommendations);

            System.out.println("\n✅ Analysis complete!");
            System.out.println("   Output files:");
            outputFiles(config).forEach(f -> System.out.println("     - " + f));

            if (queries.isEmpty()) {
                System.out.println("\n💡 No queries were found. Check that the log uses a PostgreSQL or SQLAlchemy format.");
            }
            return 0;

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (RuntimeException e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar querylens.jar <log-file> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  log-file            PostgreSQL or SQLAlchemy log file (plain or .gz)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file base name (default: " + DEFAULT_OUTPUT + ")");
        System.out.println("  --format, -f        Output format: sql|markdown|json|all (default: markdown)");
        System.out.println("  --sample            Analyze a random sample of N lines");
        System.out.println("  --slow-threshold    Duration in ms at or above which a query is slow");
        System.out.println("  --thresholds        YAML file with custom analysis thresholds (optional)");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  # Markdown report for a PostgreSQL log");
        System.out.println("  java -jar querylens.jar postgresql.log");
        System.out.println();
        System.out.println("  # Index script for a sample of a compressed log");
        System.out.println("  java -jar querylens.jar app.log.gz --sample 50000 --format sql -o indexes");
        System.out.println();
        System.out.println(ConfigurationLoader.getThresholdHelp());
    }

    static QueryLogAnalyzerConfig parseArgs(String[] args) {
        QueryLogAnalyzerConfig config = new QueryLogAnalyzerConfig();
        config.setLogFile(Paths.get(args[0]));

        // Set defaults
        config.setOutputFile(DEFAULT_OUTPUT);
        config.setOutputFormat(OutputFormat.MARKDOWN);

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output file not specified");
                    }
                    config.setOutputFile(args[++i]);
                    break;

                case "--format":
                case "-f":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output format not specified");
                    }
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(args[++i].toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: sql, markdown, json, or all");
                    }
                    break;

                case "--sample":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Sample size not specified");
                    }
                    config.setSampleSize(parseSampleSize(args[++i]));
                    break;

                case "--thresholds":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Thresholds file not specified");
                    }
                    config.setThresholdsFile(Paths.get(args[++i]));
                    break;

                case "--slow-threshold":
                case "--thresholds.slow-query-ms":
                case "--thresholds.max-index-columns":
                case "--thresholds.nominal-ms":
                case "--thresholds.cached-factor":
                case "--thresholds.cached-cap-ms":
                case "--thresholds.progress-interval":
                case "--thresholds.top-patterns":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Value not specified for " + args[i]);
                    }
                    // Just skip the value here, it will be handled by ConfigurationLoader
                    i++;
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        config.setOutputFile(removeFileExtension(config.getOutputFile()));
        config.setThresholds(new ConfigurationLoader().loadConfiguration(config.getThresholdsFile(), args));

        validateConfig(config);
        return config;
    }

    private static Integer parseSampleSize(String value) {
        try {
            int sampleSize = Integer.parseInt(value);
            if (sampleSize <= 0) {
                throw new IllegalArgumentException("Sample size must be positive: " + value);
            }
            return sampleSize;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid sample size: " + value);
        }
    }

    private static void validateConfig(QueryLogAnalyzerConfig config) {
        if (!Files.exists(config.getLogFile())) {
            throw new IllegalArgumentException("Log file not found: " + config.getLogFile());
        }

        if (Files.isDirectory(config.getLogFile())) {
            throw new IllegalArgumentException("Log file must be a file, not a directory");
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            // Check if this is a path with directories
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static List<String> outputFiles(QueryLogAnalyzerConfig config) {
        String base = config.getOutputFile();
        List<String> files = new ArrayList<>();
        OutputFormat format = config.getOutputFormat();

        if (format == OutputFormat.SQL || format == OutputFormat.ALL) {
            files.add(base + ".sql");
        }
        if (format == OutputFormat.MARKDOWN || format == OutputFormat.ALL) {
            files.add(base + ".md");
        }
        if (format == OutputFormat.JSON || format == OutputFormat.ALL) {
            files.add(base + ".json");
        }
        return files;
    }

    private static void outputResults(AnalysisReport report,
                                      List<Recommendation> recommendations,
                                      QueryLogAnalyzerConfig config) throws IOException {

        for (String file : outputFiles(config)) {
            String content;
            if (file.endsWith(".sql")) {
                content = new RecommendationExporter(recommendations).toSqlScript();
            } else if (file.endsWith(".md")) {
                content = report.toMarkdown();
            } else {
                content = report.toJson();
            }
            Files.writeString(Paths.get(file), content);
            log.debug("Wrote {}", file);
        }
    }

    private static void printSummary(LogStatistics statistics,
                                     List<Query> slowQueries,
                                     List<QueryPatternGroup> patterns,
                                     List<Recommendation> recommendations) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 ANALYSIS SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nLines read: " + statistics.getTotalLines());
        System.out.println("Queries parsed: " + statistics.getParsedQueries());
        System.out.println("Errors: " + statistics.getErrors());
        System.out.println("Unparsed lines: " + statistics.getUnparsedLines());
        if (statistics.getStartTime() != null) {
            System.out.println("Time range: " + statistics.getStartTime() + " → " + statistics.getEndTime());
        }
        System.out.println("Slow queries: " + slowQueries.size());
        System.out.println("Distinct patterns: " + patterns.size());

        System.out.println("\n🎯 Top Index Recommendations:");
        System.out.println("-".repeat(60));

        recommendations.stream()
                .limit(3)
                .forEach(rec -> {
                    System.out.printf("%-45s %6.2f%n", rec.getTitle(), rec.getImpactScore());
                    System.out.printf("  └─ %s%n", rec.getSqlScript());
                });

        if (recommendations.isEmpty()) {
            System.out.println("\n💡 No index candidates found.");
            System.out.println("See the report for slow queries and patterns.");
        }
    }
}
