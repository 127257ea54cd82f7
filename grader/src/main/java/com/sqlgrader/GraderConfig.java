package com.sqlgrader;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.sqlgrader.exception.GradingConfigurationException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Grading run settings, read from a JSON file. Keys missing from the file keep their defaults.
 *
 * <pre>
 * {
 *   "database": {"url": "jdbc:oracle:thin:@localhost:1521/FREEPDB1", "username": "grader", "password": "grader", "schema": "GRADER"},
 *   "schemaFile": "schema.sql",
 *   "modelFile": "model_solution.sql",
 *   "queriesDir": "queries",
 *   "logsDir": "logs",
 *   "outputCsv": "results.csv",
 *   "expectedQuestions": 2,
 *   "queryTimeoutSeconds": 30,
 *   "studentIdPattern": "^\\d{4}[A-Z0-9]{4}\\d{4}[A-Z]\\.sql$"
 * }
 * </pre>
 */
public class GraderConfig {
    public static final String DEFAULT_STUDENT_ID_PATTERN = "^\\d{4}[A-Z0-9]{4}\\d{4}[A-Z]\\.sql$";

    private static final Gson GSON = new GsonBuilder().setLenient().create();

    Map<String, String> database = new HashMap<>();
    String schemaFile = "schema.sql";
    String modelFile = "model_solution.sql";
    String queriesDir = "queries";
    String logsDir = "logs";
    String outputCsv = "results.csv";
    int expectedQuestions = 2;
    int queryTimeoutSeconds = 30;
    String studentIdPattern = DEFAULT_STUDENT_ID_PATTERN;

    // Directory relative paths resolve against; not part of the JSON
    private transient Path baseDir = Paths.get(".");

    /**
     * Reads and validates a configuration for a grading run.
     */
    public static GraderConfig load(Path configFile) {
        GraderConfig config = read(configFile);
        config.validate();
        return config;
    }

    /**
     * Reads a configuration without requiring database settings, for commands that never connect.
     */
    public static GraderConfig read(Path configFile) {
        GraderConfig config;
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            config = GSON.fromJson(reader, GraderConfig.class);
        } catch (IOException e) {
            throw new GradingConfigurationException("Could not read configuration " + configFile + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new GradingConfigurationException("Invalid configuration " + configFile + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new GradingConfigurationException("Configuration file " + configFile + " is empty");
        }
        Path parent = configFile.toAbsolutePath().getParent();
        config.baseDir = parent != null ? parent : Paths.get(".");
        if (config.database == null) {
            config.database = new HashMap<>();
        }
        if (config.expectedQuestions < 1) {
            throw new GradingConfigurationException("expectedQuestions must be at least 1, got " + config.expectedQuestions);
        }
        try {
            Pattern.compile(config.getStudentIdPattern());
        } catch (PatternSyntaxException e) {
            throw new GradingConfigurationException("Invalid studentIdPattern: " + e.getDescription(), e);
        }
        return config;
    }

    public void validate() {
        if (database == null || database.get("url") == null || database.get("url").trim().isEmpty()) {
            throw new GradingConfigurationException("database.url is required");
        }
        if (expectedQuestions < 1) {
            throw new GradingConfigurationException("expectedQuestions must be at least 1, got " + expectedQuestions);
        }
        if (queryTimeoutSeconds < 1) {
            throw new GradingConfigurationException("queryTimeoutSeconds must be at least 1, got " + queryTimeoutSeconds);
        }
        if (schemaFile == null || modelFile == null || queriesDir == null || logsDir == null || outputCsv == null) {
            throw new GradingConfigurationException("schemaFile, modelFile, queriesDir, logsDir and outputCsv cannot be null");
        }
    }

    public Map<String, String> getDatabase() {
        return database;
    }

    public Path getSchemaFile() {
        return resolve(schemaFile);
    }

    public Path getModelFile() {
        return resolve(modelFile);
    }

    public Path getQueriesDir() {
        return resolve(queriesDir);
    }

    public Path getLogsDir() {
        return resolve(logsDir);
    }

    public Path getOutputCsv() {
        return resolve(outputCsv);
    }

    public int getExpectedQuestions() {
        return expectedQuestions;
    }

    public int getQueryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    public String getStudentIdPattern() {
        return studentIdPattern != null ? studentIdPattern : DEFAULT_STUDENT_ID_PATTERN;
    }

    private Path resolve(String path) {
        Path p = Paths.get(path);
        return p.isAbsolute() ? p : baseDir.resolve(p).normalize();
    }
}
