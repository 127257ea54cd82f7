package com.sqlgrader;

import com.sqlgrader.dto.QuestionVerdict;
import com.sqlgrader.dto.RunSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end grading runs against an in-memory H2 database.
 */
class EvaluationScenarioTest {

    private static final String MODEL = "--1--\n"
            + "SELECT * FROM Student WHERE marks > 97;\n"
            + "--2--\n"
            + "SELECT name FROM Student WHERE id = 1;\n"
            + "--3--\n"
            + "SELECT COUNT(*) AS total FROM Student;\n";

    @TempDir
    Path workDir;

    private DatabaseManager database;
    private Path queriesDir;
    private Path outputCsv;
    private Path logsDir;

    @BeforeEach
    void setUp() throws IOException {
        database = TestDatabases.newDatabase();
        queriesDir = Files.createDirectory(workDir.resolve("queries"));
        outputCsv = workDir.resolve("results.csv");
        logsDir = workDir.resolve("logs");
        write(workDir.resolve("model_solution.sql"), MODEL);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private RunSummary grade() {
        EvaluationOrchestrator orchestrator = new EvaluationOrchestrator(
                new SchemaManager(database, TestDatabases.studentSchema()),
                new QueryRunner(database, 5),
                new MarkerParser(),
                new ResultComparator(),
                new ReportWriter(outputCsv, logsDir),
                workDir.resolve("model_solution.sql"),
                queriesDir,
                3);
        return orchestrator.run();
    }

    private void submit(String studentId, String content) throws IOException {
        write(queriesDir.resolve(studentId + ".sql"), content);
    }

    private static void write(Path file, String content) throws IOException {
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private String log(String studentId) throws IOException {
        return Files.readString(logsDir.resolve(studentId + ".log"), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should pass a submission that matches the model solution in a different row order")
    void testFullScore() throws IOException {
        submit("2023A7PS0001H", "-- my answers\n--1--\n"
                + "SELECT id, name, marks FROM Student WHERE marks >= 98 ORDER BY id DESC;\n"
                + "--2--\nSELECT name FROM Student WHERE marks = 99\n"
                + "--3--\nselect count(*) as total from Student;\n");

        RunSummary summary = grade();

        assertEquals("3/3", summary.getScores().get("2023A7PS0001H"));
        assertEquals(1, summary.getFullScores());
        List<String> csv = Files.readAllLines(outputCsv, StandardCharsets.UTF_8);
        assertEquals(List.of("StudentID,Q1,Q2,Q3,Total", "2023A7PS0001H,PASS,PASS,PASS,3/3"), csv);
    }

    @Test
    @DisplayName("Should report the row a too narrow filter loses")
    void testMissingRow() throws IOException {
        submit("S1", "--1--\nSELECT * FROM Student WHERE marks > 98;\n"
                + "--2--\nSELECT name FROM Student WHERE id = 1;\n"
                + "--3--\nSELECT COUNT(*) AS total FROM Student;\n");

        RunSummary summary = grade();

        assertEquals("2/3", summary.getScores().get("S1"));
        String log = log("S1");
        assertTrue(log.contains("========== QUESTION 1: FAIL =========="));
        assertTrue(log.contains("Missing rows: {(2,'Sid',98)}"));
        assertTrue(log.contains("========== QUESTION 2: PASS =========="));
    }

    @Test
    @DisplayName("Should fail only the question whose query the engine rejects")
    void testInvalidQuery() throws IOException {
        submit("S1", "--1--\nSELEC * FROM Student;\n"
                + "--2--\nSELECT name FROM Student WHERE id = 1;\n"
                + "--3--\nSELECT COUNT(*) AS total FROM Student;\n");
        submit("S2", "--1--\nSELECT * FROM Student WHERE marks > 97;\n"
                + "--2--\nSELECT name FROM Professor;\n"
                + "--3--\nSELECT COUNT(*) AS total FROM Student;\n");

        RunSummary summary = grade();

        assertEquals("2/3", summary.getScores().get("S1"));
        assertEquals("2/3", summary.getScores().get("S2"));
        assertTrue(log("S1").contains("Syntax error"));
        assertTrue(log("S2").contains("PROFESSOR"));
        List<String> csv = Files.readAllLines(outputCsv, StandardCharsets.UTF_8);
        assertEquals("S1,FAIL,PASS,PASS,2/3", csv.get(1));
        assertEquals("S2,PASS,FAIL,PASS,2/3", csv.get(2));
    }

    @Test
    @DisplayName("Should fail a question whose marker is absent as a missing answer")
    void testMissingMarker() throws IOException {
        submit("S1", "--1--\nSELECT * FROM Student WHERE marks > 97;\n"
                + "--3--\nSELECT COUNT(*) AS total FROM Student;\n");

        RunSummary summary = grade();

        assertEquals("2/3", summary.getScores().get("S1"));
        String log = log("S1");
        assertTrue(log.contains("========== QUESTION 2: FAIL =========="));
        assertTrue(log.contains("DIFF:\nmissing answer"));
    }

    @Test
    @DisplayName("Should give every student a fresh schema regardless of what the previous one changed")
    void testStudentIsolation() throws IOException {
        submit("A", "--1--\nUPDATE Student SET marks = 0;\n"
                + "--2--\nSELECT name FROM Student WHERE marks = 99;\n"
                + "--3--\nSELECT COUNT(*) AS total FROM Student;\n");
        submit("B", "--1--\nSELECT * FROM Student WHERE marks > 97;\n"
                + "--2--\nSELECT name FROM Student WHERE id = 1;\n"
                + "--3--\nSELECT COUNT(*) AS total FROM Student;\n");

        RunSummary summary = grade();

        assertEquals("1/3", summary.getScores().get("A"));
        assertEquals("3/3", summary.getScores().get("B"));
    }

    @Test
    @DisplayName("Should fail all questions of a file without markers and keep grading the others")
    void testFormatError() throws IOException {
        submit("A", "SELECT * FROM Student;\n");
        submit("B", "--1--\nSELECT * FROM Student WHERE marks > 97;\n"
                + "--2--\nSELECT name FROM Student WHERE id = 1;\n"
                + "--3--\nSELECT COUNT(*) AS total FROM Student;\n");

        RunSummary summary = grade();

        assertEquals(2, summary.getStudentsEvaluated());
        assertEquals("0/3", summary.getScores().get("A"));
        assertTrue(log("A").contains("ERROR:\nFormat error: No question markers found but 3 questions are expected"));
        assertEquals("3/3", summary.getScores().get("B"));
    }

    @Test
    @DisplayName("Should not treat the model solution inside the queries directory as a student")
    void testModelInsideQueriesDirectory() throws IOException {
        Path model = queriesDir.resolve("model_solution.sql");
        write(model, MODEL);
        submit("S1", MODEL);

        EvaluationOrchestrator orchestrator = new EvaluationOrchestrator(
                new SchemaManager(database, TestDatabases.studentSchema()),
                new QueryRunner(database, 5),
                new MarkerParser(),
                new ResultComparator(),
                new ReportWriter(outputCsv, logsDir),
                model,
                queriesDir,
                3);
        RunSummary summary = orchestrator.run();

        assertEquals(1, summary.getStudentsEvaluated());
        assertEquals(3, orchestrator.getGroundTruth().size());
        assertEquals(QuestionVerdict.Verdict.PASS.name(),
                Files.readAllLines(outputCsv, StandardCharsets.UTF_8).get(1).split(",")[1]);
    }
}
