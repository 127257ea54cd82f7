package com.sqlgrader.dto;

/**
 * Verdict for one question of one student. Expected and actual tables are kept for the student log
 * and are null when there is nothing to show (missing answer, execution error, aborted student).
 */
public class QuestionVerdict {
    public enum Verdict {
        PASS,
        FAIL
    }

    private final int questionIndex;
    private final Verdict verdict;
    private final String diff;
    private final ResultTable expected;
    private final ResultTable actual;

    public QuestionVerdict(int questionIndex, Verdict verdict, String diff, ResultTable expected, ResultTable actual) {
        this.questionIndex = questionIndex;
        this.verdict = verdict;
        this.diff = diff;
        this.expected = expected;
        this.actual = actual;
    }

    public static QuestionVerdict fail(int questionIndex, String note) {
        return new QuestionVerdict(questionIndex, Verdict.FAIL, note, null, null);
    }

    public static QuestionVerdict fail(int questionIndex, String note, ResultTable expected) {
        return new QuestionVerdict(questionIndex, Verdict.FAIL, note, expected, null);
    }

    public int getQuestionIndex() {
        return questionIndex;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public boolean isPassed() {
        return verdict == Verdict.PASS;
    }

    public String getDiff() {
        return diff;
    }

    public ResultTable getExpected() {
        return expected;
    }

    public ResultTable getActual() {
        return actual;
    }
}
