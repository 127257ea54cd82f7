package com.sqlgrader.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class RunSummary {
    private final Map<String, String> scores = new LinkedHashMap<>();
    private int fullScores;
    private boolean cancelled;

    public void record(StudentReport report) {
        scores.put(report.getStudentId(), report.getScore());
        if (report.getTotal() > 0 && report.getPassed() == report.getTotal()) {
            fullScores++;
        }
    }

    public int getStudentsEvaluated() {
        return scores.size();
    }

    public int getFullScores() {
        return fullScores;
    }

    public Map<String, String> getScores() {
        return Collections.unmodifiableMap(scores);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void setCancelled(boolean cancelled) {
        this.cancelled = cancelled;
    }
}
