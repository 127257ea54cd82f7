package com.sqlgrader;

import com.sqlgrader.exception.GradingConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GraderConfigTest {

    @TempDir
    Path workDir;

    private Path writeConfig(String json) throws IOException {
        Path file = workDir.resolve("grader.json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void testLoad_Defaults() throws IOException {
        GraderConfig config = GraderConfig.load(writeConfig("{\"database\": {\"url\": \"jdbc:h2:mem:cfg\"}}"));

        assertEquals("jdbc:h2:mem:cfg", config.getDatabase().get("url"));
        assertEquals(2, config.getExpectedQuestions());
        assertEquals(30, config.getQueryTimeoutSeconds());
        assertEquals(GraderConfig.DEFAULT_STUDENT_ID_PATTERN, config.getStudentIdPattern());
        assertEquals(workDir.toAbsolutePath().resolve("schema.sql").normalize(), config.getSchemaFile());
        assertEquals(workDir.toAbsolutePath().resolve("model_solution.sql").normalize(), config.getModelFile());
        assertEquals(workDir.toAbsolutePath().resolve("queries").normalize(), config.getQueriesDir());
        assertEquals(workDir.toAbsolutePath().resolve("logs").normalize(), config.getLogsDir());
        assertEquals(workDir.toAbsolutePath().resolve("results.csv").normalize(), config.getOutputCsv());
    }

    @Test
    void testLoad_OverridesAndPathResolution() throws IOException {
        Path absoluteLogs = workDir.resolve("elsewhere/logs").toAbsolutePath();
        GraderConfig config = GraderConfig.load(writeConfig("{\n"
                + "  \"database\": {\"url\": \"jdbc:oracle:thin:@localhost:1521/FREEPDB1\", \"username\": \"grader\"},\n"
                + "  \"queriesDir\": \"../submissions\",\n"
                + "  \"logsDir\": \"" + absoluteLogs.toString().replace("\\", "\\\\") + "\",\n"
                + "  \"expectedQuestions\": 5,\n"
                + "  \"queryTimeoutSeconds\": 10\n"
                + "}"));

        assertEquals("grader", config.getDatabase().get("username"));
        assertEquals(5, config.getExpectedQuestions());
        assertEquals(10, config.getQueryTimeoutSeconds());
        assertEquals(workDir.toAbsolutePath().getParent().resolve("submissions").normalize(), config.getQueriesDir());
        assertEquals(absoluteLogs, config.getLogsDir());
    }

    @Test
    void testLoad_MissingUrl() throws IOException {
        Path file = writeConfig("{\"expectedQuestions\": 3}");

        GradingConfigurationException e = assertThrows(GradingConfigurationException.class, () -> GraderConfig.load(file));
        assertEquals("database.url is required", e.getMessage());
    }

    @Test
    void testLoad_InvalidValues() throws IOException {
        Path noQuestions = writeConfig("{\"database\": {\"url\": \"jdbc:h2:mem:x\"}, \"expectedQuestions\": 0}");
        assertThrows(GradingConfigurationException.class, () -> GraderConfig.load(noQuestions));

        Path noTimeout = writeConfig("{\"database\": {\"url\": \"jdbc:h2:mem:x\"}, \"queryTimeoutSeconds\": 0}");
        assertThrows(GradingConfigurationException.class, () -> GraderConfig.load(noTimeout));
    }

    @Test
    void testLoad_MalformedJson() throws IOException {
        Path file = writeConfig("{\"database\": [1, 2");

        assertThrows(GradingConfigurationException.class, () -> GraderConfig.load(file));
    }

    @Test
    void testLoad_EmptyFile() throws IOException {
        Path file = writeConfig("");

        assertThrows(GradingConfigurationException.class, () -> GraderConfig.load(file));
    }

    @Test
    void testLoad_MissingFile() {
        assertThrows(GradingConfigurationException.class, () -> GraderConfig.load(workDir.resolve("absent.json")));
    }

    @Test
    void testRead_WithoutDatabase() throws IOException {
        Path file = writeConfig("{\"expectedQuestions\": 4, \"studentIdPattern\": \"^s\\\\d+\\\\.sql$\"}");

        GraderConfig config = GraderConfig.read(file);

        assertEquals(4, config.getExpectedQuestions());
        assertEquals("^s\\d+\\.sql$", config.getStudentIdPattern());
        assertThrows(GradingConfigurationException.class, () -> GraderConfig.load(file));
    }

    @Test
    void testRead_InvalidPattern() throws IOException {
        Path file = writeConfig("{\"studentIdPattern\": \"(\"}");

        assertThrows(GradingConfigurationException.class, () -> GraderConfig.read(file));
    }
}
