package com.sqlgrader;

import com.sqlgrader.dto.ParseResult;
import com.sqlgrader.dto.QueryOutcome;
import com.sqlgrader.dto.QuerySet;
import com.sqlgrader.dto.QuestionVerdict;
import com.sqlgrader.dto.ResultTable;
import com.sqlgrader.dto.RunSummary;
import com.sqlgrader.dto.StudentReport;
import com.sqlgrader.exception.GradingConfigurationException;
import com.sqlgrader.exception.InfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Drives a grading run: builds the ground truth from the model solution once, then evaluates each
 * student file on a freshly reset schema, one student at a time.
 *
 * <p>Failures are contained at the smallest level that owns them. A failing query only fails its
 * question, a malformed file or a reset failure only fails its student. A broken model solution
 * or an infrastructure failure before the ground truth exists stops the run.
 */
public class EvaluationOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(EvaluationOrchestrator.class);

    static final String MISSING_ANSWER = "missing answer";
    static final String FORMAT_ERROR_PREFIX = "Format error: ";
    static final String INFRASTRUCTURE_ERROR_PREFIX = "Infrastructure error: ";

    private final SchemaManager schemaManager;
    private final QueryRunner queryRunner;
    private final MarkerParser markerParser;
    private final ResultComparator comparator;
    private final ReportWriter reportWriter;
    private final Path modelFile;
    private final Path queriesDir;
    private final int expectedQuestions;

    private Map<Integer, ResultTable> groundTruth;

    public EvaluationOrchestrator(SchemaManager schemaManager, QueryRunner queryRunner, MarkerParser markerParser,
                                  ResultComparator comparator, ReportWriter reportWriter,
                                  Path modelFile, Path queriesDir, int expectedQuestions) {
        this.schemaManager = schemaManager;
        this.queryRunner = queryRunner;
        this.markerParser = markerParser;
        this.comparator = comparator;
        this.reportWriter = reportWriter;
        this.modelFile = modelFile;
        this.queriesDir = queriesDir;
        this.expectedQuestions = expectedQuestions;
    }

    /**
     * Grades every student file of the queries directory in name order.
     *
     * @throws GradingConfigurationException if the model solution is unusable
     * @throws InfrastructureException if the database fails before the ground truth is built
     */
    public RunSummary run() {
        QuerySet model = loadModelSolution();
        buildGroundTruth(model);

        List<Path> studentFiles = listStudentFiles();
        LOG.info("Evaluating {} student files from {}", studentFiles.size(), queriesDir);
        reportWriter.start(new ArrayList<>(groundTruth.keySet()));

        RunSummary summary = new RunSummary();
        for (Path file : studentFiles) {
            if (Thread.currentThread().isInterrupted()) {
                LOG.warn("Run cancelled, {} of {} students evaluated", summary.getStudentsEvaluated(), studentFiles.size());
                summary.setCancelled(true);
                break;
            }
            String studentId = studentId(file);
            StudentReport report = evaluateStudent(studentId, file);
            reportWriter.write(report);
            summary.record(report);
            LOG.info("Student {}: {}", studentId, report.getScore());
        }

        LOG.info("Evaluation complete: {} students evaluated, {} with a full score",
                summary.getStudentsEvaluated(), summary.getFullScores());
        return summary;
    }

    QuerySet loadModelSolution() {
        String text;
        try {
            text = Files.readString(modelFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new GradingConfigurationException("Could not read model solution " + modelFile + ": " + e.getMessage(), e);
        }
        ParseResult parsed = markerParser.parse(text, expectedQuestions);
        if (!parsed.isSuccess()) {
            throw new GradingConfigurationException("Model solution is malformed: " + parsed.getError());
        }
        QuerySet model = parsed.getQuerySet();
        if (model.size() != expectedQuestions) {
            throw new GradingConfigurationException("Model solution has " + model.size()
                    + " questions but " + expectedQuestions + " are expected");
        }
        return model;
    }

    /**
     * Runs every model question on a fresh schema. Infrastructure failures propagate and end the run.
     */
    void buildGroundTruth(QuerySet model) {
        schemaManager.reset();
        Map<Integer, ResultTable> results = new LinkedHashMap<>();
        for (Map.Entry<Integer, String> entry : model.getQueries().entrySet()) {
            QueryOutcome outcome = queryRunner.execute(entry.getValue());
            if (!outcome.isSuccess()) {
                throw new GradingConfigurationException(
                        "Model solution question " + entry.getKey() + " failed: " + outcome.getMessage());
            }
            results.put(entry.getKey(), outcome.getResult());
        }
        groundTruth = Collections.unmodifiableMap(results);
        LOG.info("Ground truth built for {} questions", groundTruth.size());
    }

    /**
     * Evaluates one student on a fresh schema. Never throws for problems local to the student.
     */
    StudentReport evaluateStudent(String studentId, Path file) {
        List<Integer> questions = new ArrayList<>(groundTruth.keySet());

        try {
            schemaManager.reset();
        } catch (InfrastructureException e) {
            LOG.warn("Schema reset failed before student {}: {}", studentId, e.getMessage(), e);
            return StudentReport.allFailed(studentId, questions, INFRASTRUCTURE_ERROR_PREFIX + e.getMessage());
        }

        ParseResult parsed;
        try {
            parsed = markerParser.parse(Files.readString(file, StandardCharsets.UTF_8), expectedQuestions);
        } catch (IOException e) {
            parsed = ParseResult.formatError("Could not read file: " + e.getMessage());
        }
        if (!parsed.isSuccess()) {
            LOG.warn("Submission of student {} is malformed: {}", studentId, parsed.getError());
            return StudentReport.allFailed(studentId, questions, FORMAT_ERROR_PREFIX + parsed.getError());
        }
        QuerySet submission = parsed.getQuerySet();

        List<QuestionVerdict> verdicts = new ArrayList<>();
        try {
            for (Integer index : questions) {
                ResultTable expected = groundTruth.get(index);
                if (!submission.contains(index)) {
                    verdicts.add(QuestionVerdict.fail(index, MISSING_ANSWER, expected));
                    continue;
                }
                QueryOutcome outcome = queryRunner.execute(submission.get(index));
                verdicts.add(comparator.judge(index, expected, outcome));
            }
        } catch (InfrastructureException e) {
            LOG.warn("Evaluation of student {} aborted: {}", studentId, e.getMessage(), e);
            return StudentReport.allFailed(studentId, questions, INFRASTRUCTURE_ERROR_PREFIX + e.getMessage());
        }

        List<Integer> unexpected = new ArrayList<>();
        for (Integer index : submission.getQueries().keySet()) {
            if (!groundTruth.containsKey(index)) {
                unexpected.add(index);
            }
        }
        if (!unexpected.isEmpty()) {
            LOG.warn("Student {} answered questions {} which are not in the model solution; they are not scored",
                    studentId, unexpected);
        }
        return new StudentReport(studentId, verdicts, null, unexpected);
    }

    List<Path> listStudentFiles() {
        Path modelPath = modelFile.toAbsolutePath().normalize();
        try (Stream<Path> files = Files.list(queriesDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase().endsWith(".sql"))
                    .filter(p -> !p.toAbsolutePath().normalize().equals(modelPath))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new GradingConfigurationException("Could not list student files in " + queriesDir + ": " + e.getMessage(), e);
        }
    }

    Map<Integer, ResultTable> getGroundTruth() {
        return groundTruth;
    }

    static String studentId(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
