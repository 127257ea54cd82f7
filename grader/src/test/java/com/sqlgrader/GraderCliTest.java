package com.sqlgrader;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraderCliTest {

    @TempDir
    Path workDir;

    private Path write(String name, String content) throws IOException {
        Path file = workDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void testUsage() {
        assertEquals(GraderCli.EXIT_USAGE, GraderCli.run(new String[0]));
        assertEquals(GraderCli.EXIT_USAGE, GraderCli.run(new String[]{"publish"}));
        assertEquals(GraderCli.EXIT_USAGE, GraderCli.run(new String[]{"check"}));
    }

    @Test
    void testCheck_WellFormedSubmission() throws IOException {
        Path file = write("2023A7PS0043H.sql", "--1--\nSELECT 1;\n--2--\nSELECT 2\n");

        assertEquals(GraderCli.EXIT_OK, GraderCli.run(new String[]{"check", file.toString()}));
    }

    @Test
    void testCheck_MissingMarker() throws IOException {
        Path file = write("2023A7PS0043H.sql", "--1--\nSELECT 1;\n");

        assertEquals(GraderCli.EXIT_FAILURE, GraderCli.run(new String[]{"check", file.toString(), "2"}));
        assertEquals(GraderCli.EXIT_OK, GraderCli.run(new String[]{"check", file.toString(), "1"}));
    }

    @Test
    void testCheck_UsesConfiguredCountAndPattern() throws IOException {
        Path config = write("course/grader.json",
                "{\"expectedQuestions\": 3, \"studentIdPattern\": \"^cs\\\\d{3}\\\\.sql$\"}");
        Path twoAnswers = write("cs101.sql", "--1--\nSELECT 1;\n--2--\nSELECT 2;\n");
        Path threeAnswers = write("cs102.sql", "--1--\nSELECT 1;\n--2--\nSELECT 2;\n--3--\nSELECT 3;\n");
        Path defaultName = write("2023A7PS0043H.sql", "--1--\nSELECT 1;\n--2--\nSELECT 2;\n--3--\nSELECT 3;\n");

        assertEquals(GraderCli.EXIT_FAILURE, GraderCli.run(new String[]{"check", twoAnswers.toString(), config.toString()}));
        assertEquals(GraderCli.EXIT_OK, GraderCli.run(new String[]{"check", threeAnswers.toString(), config.toString()}));
        assertEquals(GraderCli.EXIT_FAILURE, GraderCli.run(new String[]{"check", defaultName.toString(), config.toString()}));
        // an explicit count overrides the configured one
        assertEquals(GraderCli.EXIT_OK,
                GraderCli.run(new String[]{"check", twoAnswers.toString(), "2", config.toString()}));
    }

    @Test
    void testCheck_ConfigurationWithoutDatabase() throws IOException {
        Path config = write("grader.json", "{\"expectedQuestions\": 1}");

        GraderConfig loaded = GraderCli.checkConfig(config.toString());

        assertEquals(1, loaded.getExpectedQuestions());
        assertEquals(GraderConfig.DEFAULT_STUDENT_ID_PATTERN, loaded.getStudentIdPattern());
    }

    @Test
    void testCheck_InvalidConfiguration() throws IOException {
        Path file = write("2023A7PS0043H.sql", "--1--\nSELECT 1;\n");
        Path badPattern = write("bad.json", "{\"studentIdPattern\": \"[unclosed\"}");

        assertEquals(GraderCli.EXIT_FAILURE, GraderCli.run(new String[]{"check", file.toString(), badPattern.toString()}));
        assertEquals(GraderCli.EXIT_FAILURE,
                GraderCli.run(new String[]{"check", file.toString(), workDir.resolve("absent.json").toString()}));
        assertEquals(GraderCli.EXIT_USAGE, GraderCli.run(new String[]{"check", file.toString(), "0"}));
    }

    @Test
    void testCheck_BadFileName() throws IOException {
        Path file = write("answers.sql", "--1--\nSELECT 1;\n--2--\nSELECT 2;\n");

        assertEquals(GraderCli.EXIT_FAILURE, GraderCli.run(new String[]{"check", file.toString()}));
    }

    @Test
    void testCheck_MissingFile() {
        assertEquals(GraderCli.EXIT_FAILURE,
                GraderCli.run(new String[]{"check", workDir.resolve("2023A7PS0043H.sql").toString()}));
    }

    @Test
    void testGrade_MissingConfiguration() {
        assertEquals(GraderCli.EXIT_FAILURE, GraderCli.run(new String[]{"grade", workDir.resolve("none.json").toString()}));
    }

    @Test
    void testGrade_BrokenModelSolution() throws IOException {
        write("schema.sql", TestDatabases.studentSchema());
        write("model_solution.sql", "--1--\nSELECT * FROM Professor;\n");
        write("queries/S1.sql", "--1--\nSELECT 1;\n");
        Path config = write("grader.json", "{\"database\": " + h2Json() + ", \"expectedQuestions\": 1}");

        assertEquals(GraderCli.EXIT_FAILURE, GraderCli.run(new String[]{"grade", config.toString()}));
        assertFalse(Files.exists(workDir.resolve("results.csv")));
    }

    @Test
    void testGrade_EndToEnd() throws IOException {
        write("schema.sql", TestDatabases.studentSchema());
        write("model_solution.sql", "--1--\nSELECT name FROM Student WHERE marks > 98;\n");
        write("queries/S1.sql", "--1--\nSELECT name FROM Student WHERE id = 1;\n");
        write("queries/S2.sql", "--1--\nSELECT name FROM Student;\n");
        Path config = write("grader.json", "{\"database\": " + h2Json() + ", \"expectedQuestions\": 1}");

        assertEquals(GraderCli.EXIT_OK, GraderCli.run(new String[]{"grade", config.toString()}));

        List<String> csv = Files.readAllLines(workDir.resolve("results.csv"), StandardCharsets.UTF_8);
        assertEquals(List.of("StudentID,Result", "S1,PASS", "S2,FAIL"), csv);
        assertTrue(Files.exists(workDir.resolve("logs/S2.log")));
    }

    private static String h2Json() {
        StringBuilder json = new StringBuilder("{");
        TestDatabases.h2Config().forEach((key, value) ->
                json.append(json.length() > 1 ? ", " : "").append('"').append(key).append("\": \"").append(value).append('"'));
        return json.append('}').toString();
    }
}
