package com.sqlgrader.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

public class StudentReport {
    private final String studentId;
    private final List<QuestionVerdict> verdicts;
    private final String note;
    private final List<Integer> unexpectedQuestions;

    public StudentReport(String studentId, List<QuestionVerdict> verdicts, String note, List<Integer> unexpectedQuestions) {
        this.studentId = studentId;
        List<QuestionVerdict> sorted = new ArrayList<>(verdicts);
        sorted.sort(Comparator.comparingInt(QuestionVerdict::getQuestionIndex));
        this.verdicts = Collections.unmodifiableList(sorted);
        this.note = note;
        this.unexpectedQuestions = unexpectedQuestions != null
                ? Collections.unmodifiableList(new ArrayList<>(unexpectedQuestions))
                : Collections.emptyList();
    }

    /**
     * Report where every question failed for the same student-level reason.
     */
    public static StudentReport allFailed(String studentId, List<Integer> questionIndices, String note) {
        List<QuestionVerdict> verdicts = new ArrayList<>();
        for (Integer index : questionIndices) {
            verdicts.add(QuestionVerdict.fail(index, note));
        }
        return new StudentReport(studentId, verdicts, note, null);
    }

    public String getStudentId() {
        return studentId;
    }

    public List<QuestionVerdict> getVerdicts() {
        return verdicts;
    }

    public String getNote() {
        return note;
    }

    public List<Integer> getUnexpectedQuestions() {
        return unexpectedQuestions;
    }

    public int getPassed() {
        int passed = 0;
        for (QuestionVerdict verdict : verdicts) {
            if (verdict.isPassed()) {
                passed++;
            }
        }
        return passed;
    }

    public int getTotal() {
        return verdicts.size();
    }

    public String getScore() {
        return getPassed() + "/" + getTotal();
    }
}
