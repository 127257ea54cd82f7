package com.sqlgrader;

import com.sqlgrader.dto.FormatCheckReport;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pre-submission lint: file name must be a student identifier and every expected {@code --N--}
 * marker must be followed by a query. A query without a trailing {@code ;} is only a warning.
 */
public class SubmissionFormatChecker {
    private final Pattern fileNamePattern;

    public SubmissionFormatChecker(String fileNamePattern) {
        this.fileNamePattern = Pattern.compile(fileNamePattern, Pattern.CASE_INSENSITIVE);
    }

    public boolean isValidFileName(String fileName) {
        return fileName != null && fileNamePattern.matcher(fileName).matches();
    }

    /**
     * Lints one submission. A bad file name stops the check before any marker is looked at.
     */
    public FormatCheckReport check(String fileName, String content, int expectedQuestions) {
        FormatCheckReport report = new FormatCheckReport(fileName, isValidFileName(fileName));
        if (!report.isValidFileName()) {
            return report;
        }
        String text = content != null ? content : "";
        for (int i = 1; i <= expectedQuestions; i++) {
            String body = findBody(text, i);
            if (body == null) {
                report.add(i, FormatCheckReport.Status.FAIL, "Marker --" + i + "-- is missing.");
            } else if (SqlScripts.isBlankOrComment(body)) {
                report.add(i, FormatCheckReport.Status.FAIL, "Marker --" + i + "-- found, but no query follows it.");
            } else if (!body.endsWith(";")) {
                report.add(i, FormatCheckReport.Status.WARNING, "Marker found, but query might be missing a semicolon.");
            } else {
                report.add(i, FormatCheckReport.Status.PASS, "Correctly formatted.");
            }
        }
        return report;
    }

    /**
     * Text following the marker of {@code index} up to the next numeric marker, or null without marker.
     */
    private static String findBody(String content, int index) {
        Pattern pattern = Pattern.compile("(?m)^\\s*--" + index + "--\\s*$(.*?)(?=^\\s*--\\d+--\\s*$|\\z)", Pattern.DOTALL);
        Matcher matcher = pattern.matcher(content);
        if (!matcher.find()) {
            return null;
        }
        return matcher.group(1).trim();
    }
}
