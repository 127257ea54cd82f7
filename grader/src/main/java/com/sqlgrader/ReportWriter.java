package com.sqlgrader;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.sqlgrader.dto.QuestionVerdict;
import com.sqlgrader.dto.ResultTable;
import com.sqlgrader.dto.StudentReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the cumulative results CSV and one log file per student.
 *
 * <p>Each student's row is appended and flushed as soon as the student is done, so an aborted run
 * leaves a table with every fully evaluated student and nothing else.
 */
public class ReportWriter {
    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);
    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .serializeSpecialFloatingPointValues()
            .disableHtmlEscaping()
            .create();

    private final Path outputCsv;
    private final Path logsDir;
    private List<Integer> questionIndices;

    public ReportWriter(Path outputCsv, Path logsDir) {
        this.outputCsv = outputCsv;
        this.logsDir = logsDir;
    }

    /**
     * Truncates the results table and writes its header.
     */
    public void start(List<Integer> questionIndices) {
        this.questionIndices = new ArrayList<>(questionIndices);
        List<String> header = new ArrayList<>();
        header.add("StudentID");
        if (isSingleQuestion()) {
            header.add("Result");
        } else {
            for (Integer index : questionIndices) {
                header.add("Q" + index);
            }
            header.add("Total");
        }
        try {
            createParent(outputCsv);
            Files.createDirectories(logsDir);
            Files.writeString(outputCsv, csvLine(header), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create results table " + outputCsv, e);
        }
        LOG.info("Writing results to {} and logs to {}", outputCsv, logsDir);
    }

    /**
     * Appends the student's row to the results table and writes the student's log file.
     */
    public void write(StudentReport report) {
        if (questionIndices == null) {
            throw new IllegalStateException("start() must be called before writing reports");
        }
        Map<Integer, QuestionVerdict> byIndex = new LinkedHashMap<>();
        for (QuestionVerdict verdict : report.getVerdicts()) {
            byIndex.put(verdict.getQuestionIndex(), verdict);
        }

        List<String> row = new ArrayList<>();
        row.add(report.getStudentId());
        for (Integer index : questionIndices) {
            QuestionVerdict verdict = byIndex.get(index);
            row.add(verdict != null ? verdict.getVerdict().name() : QuestionVerdict.Verdict.FAIL.name());
        }
        if (!isSingleQuestion()) {
            row.add(report.getScore());
        }

        try {
            Files.writeString(outputCsv, csvLine(row), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            Files.writeString(logsDir.resolve(report.getStudentId() + ".log"), renderLog(report), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write report for student " + report.getStudentId(), e);
        }
    }

    static String renderLog(StudentReport report) {
        StringBuilder log = new StringBuilder();
        log.append("STUDENT ID: ").append(report.getStudentId()).append("\n");
        log.append("SCORE: ").append(report.getScore()).append("\n");
        if (report.getNote() != null) {
            log.append("\nERROR:\n").append(report.getNote()).append("\n");
        }
        if (!report.getUnexpectedQuestions().isEmpty()) {
            log.append("\nIGNORED QUESTIONS (not in model solution): ")
                    .append(report.getUnexpectedQuestions()).append("\n");
        }

        for (QuestionVerdict verdict : report.getVerdicts()) {
            log.append("\n========== QUESTION ").append(verdict.getQuestionIndex())
                    .append(": ").append(verdict.getVerdict()).append(" ==========\n\n");
            if (verdict.getExpected() != null) {
                log.append("EXPECTED OUTPUT:\n").append(toJson(verdict.getExpected())).append("\n\n");
            }
            if (verdict.getActual() != null) {
                log.append("STUDENT OUTPUT:\n").append(toJson(verdict.getActual())).append("\n\n");
            }
            if (verdict.isPassed()) {
                log.append("RESULT: PASS\n");
                if (verdict.getDiff() != null) {
                    log.append("NOTE:\n").append(verdict.getDiff()).append("\n");
                }
            } else {
                log.append("DIFF:\n").append(verdict.getDiff() != null ? verdict.getDiff() : "").append("\n");
            }
        }
        return log.toString();
    }

    static String toJson(ResultTable table) {
        Map<String, Object> structure = new LinkedHashMap<>();
        structure.put("columns", table.getColumns());
        structure.put("rows", table.getRows());
        return GSON.toJson(structure);
    }

    static String csvLine(List<String> fields) {
        List<String> escaped = new ArrayList<>(fields.size());
        for (String field : fields) {
            escaped.add(escapeCsv(field));
        }
        return String.join(",", escaped) + "\n";
    }

    private static String escapeCsv(String field) {
        if (field == null) {
            return "";
        }
        if (field.contains(",") || field.contains("\"") || field.contains("\n") || field.contains("\r")) {
            return "\"" + field.replace("\"", "\"\"") + "\"";
        }
        return field;
    }

    private boolean isSingleQuestion() {
        return questionIndices.size() == 1;
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
