package com.sqlgrader;

import com.sqlgrader.dto.FormatCheckReport;
import com.sqlgrader.dto.RunSummary;
import com.sqlgrader.exception.GradingConfigurationException;
import com.sqlgrader.exception.InfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point.
 *
 * <pre>
 * grade [config.json]                                    grade every file of the queries directory
 * check &lt;file.sql&gt; [expectedQuestions] [config.json]     lint a submission before handing it in
 * </pre>
 *
 * <p>{@code check} takes the question count and the file name rule from the configuration
 * ({@code grader.json} when present); an explicit count overrides the configured one.
 */
public class GraderCli {
    private static final Logger LOG = LoggerFactory.getLogger(GraderCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String DEFAULT_CONFIG = "grader.json";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length == 0) {
            return usage();
        }
        switch (args[0]) {
            case "grade":
                return grade(args.length > 1 ? args[1] : DEFAULT_CONFIG);
            case "check":
                if (args.length < 2 || args.length > 4) {
                    return usage();
                }
                return check(args);
            default:
                LOG.error("Unknown command: {}", args[0]);
                return usage();
        }
    }

    static int grade(String configPath) {
        try {
            GraderConfig config = GraderConfig.load(Paths.get(configPath));
            try (DatabaseManager databaseManager = new DatabaseManager(config.getDatabase())) {
                EvaluationOrchestrator orchestrator = new EvaluationOrchestrator(
                        SchemaManager.fromFile(databaseManager, config.getSchemaFile()),
                        new QueryRunner(databaseManager, config.getQueryTimeoutSeconds()),
                        new MarkerParser(),
                        new ResultComparator(),
                        new ReportWriter(config.getOutputCsv(), config.getLogsDir()),
                        config.getModelFile(),
                        config.getQueriesDir(),
                        config.getExpectedQuestions());
                RunSummary summary = orchestrator.run();
                LOG.info("Results written to {}", config.getOutputCsv());
                return summary.isCancelled() ? EXIT_FAILURE : EXIT_OK;
            }
        } catch (GradingConfigurationException e) {
            LOG.error("Grading configuration error: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (InfrastructureException e) {
            LOG.error("Database failure, run aborted: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (UncheckedIOException e) {
            LOG.error("Could not write results: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    private static int check(String[] args) {
        Integer expectedOverride = null;
        String configPath = null;
        for (int i = 2; i < args.length; i++) {
            try {
                expectedOverride = Integer.parseInt(args[i]);
            } catch (NumberFormatException e) {
                configPath = args[i];
            }
        }
        if (expectedOverride != null && expectedOverride < 1) {
            LOG.error("Question count must be at least 1, got {}", expectedOverride);
            return EXIT_USAGE;
        }

        GraderConfig config;
        try {
            config = checkConfig(configPath);
        } catch (GradingConfigurationException e) {
            LOG.error("Grading configuration error: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
        int expected = expectedOverride != null ? expectedOverride : config.getExpectedQuestions();
        return check(Paths.get(args[1]), expected, config.getStudentIdPattern());
    }

    /**
     * Configuration for {@code check}: the given file, else {@code grader.json} if it exists, else defaults.
     */
    static GraderConfig checkConfig(String configPath) {
        if (configPath != null) {
            return GraderConfig.read(Paths.get(configPath));
        }
        Path defaultConfig = Paths.get(DEFAULT_CONFIG);
        if (Files.isRegularFile(defaultConfig)) {
            return GraderConfig.read(defaultConfig);
        }
        return new GraderConfig();
    }

    static int check(Path file, int expectedQuestions, String studentIdPattern) {
        if (!Files.isRegularFile(file)) {
            LOG.error("File '{}' not found", file);
            return EXIT_FAILURE;
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.error("Could not read '{}': {}", file, e.getMessage());
            return EXIT_FAILURE;
        }

        SubmissionFormatChecker checker = new SubmissionFormatChecker(studentIdPattern);
        FormatCheckReport report = checker.check(file.getFileName().toString(), content, expectedQuestions);
        if (!report.isValidFileName()) {
            LOG.error("Invalid filename '{}'. The file must be named after your student ID (e.g. 2023A7PS0043H.sql)",
                    report.getFileName());
            return EXIT_FAILURE;
        }
        LOG.info("Checking {} for {} queries", file, expectedQuestions);
        for (FormatCheckReport.Item item : report.getItems()) {
            LOG.info("Query {}: [{}] {}", item.getQuestionIndex(), item.getStatus(), item.getMessage());
        }
        if (report.isPassed()) {
            LOG.info("All formatting checks passed");
            return EXIT_OK;
        }
        LOG.info("Formatting errors found, fix the issues above before submitting");
        return EXIT_FAILURE;
    }

    private static int usage() {
        LOG.info("Usage: grade [config.json] | check <student_id>.sql [expectedQuestions] [config.json]");
        return EXIT_USAGE;
    }
}
