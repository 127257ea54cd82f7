package com.sqlgrader;

import com.sqlgrader.dto.ParseResult;
import com.sqlgrader.dto.QuerySet;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a submission into questions using line-anchored {@code --N--} markers.
 *
 * <p>Everything between a marker and the next one (or the end of the file) is the SQL body of that
 * question. Text before the first marker is ignored. Statement terminators are not checked here.
 */
public class MarkerParser {

    // Token may not start with a dash so that separator lines such as "--------" are not markers
    private static final Pattern MARKER = Pattern.compile("^\\s*--([^\\s-]\\S*?)--\\s*$");
    private static final Pattern DIGITS = Pattern.compile("\\+?\\d+");

    /**
     * Parses a submission into its questions, or the first format error found.
     *
     * @param expectedQuestions lets a single-question file omit its marker
     */
    public ParseResult parse(String text, int expectedQuestions) {
        if (text == null || text.trim().isEmpty()) {
            return ParseResult.formatError("File is empty");
        }

        String[] lines = text.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);
        Map<Integer, String> queries = new LinkedHashMap<>();
        Integer currentIndex = null;
        StringBuilder body = new StringBuilder();
        boolean markerSeen = false;

        for (String line : lines) {
            Matcher matcher = MARKER.matcher(line);
            if (!matcher.matches()) {
                if (currentIndex != null) {
                    body.append(line).append('\n');
                }
                continue;
            }

            String token = matcher.group(1);
            int index;
            try {
                index = Integer.parseInt(token);
            } catch (NumberFormatException e) {
                if (DIGITS.matcher(token).matches()) {
                    return ParseResult.formatError("Marker --" + token + "-- has a question index out of range");
                }
                return ParseResult.formatError("Marker --" + token + "-- has a non-numeric question index");
            }
            if (index <= 0) {
                return ParseResult.formatError("Marker --" + token + "-- must use a positive question index");
            }
            if (queries.containsKey(index) || (currentIndex != null && currentIndex == index)) {
                return ParseResult.formatError("Marker --" + index + "-- appears more than once");
            }

            if (currentIndex != null) {
                String error = close(queries, currentIndex, body);
                if (error != null) {
                    return ParseResult.formatError(error);
                }
            }
            markerSeen = true;
            currentIndex = index;
            body.setLength(0);
        }

        if (!markerSeen) {
            if (expectedQuestions > 1) {
                return ParseResult.formatError(
                        "No question markers found but " + expectedQuestions + " questions are expected");
            }
            if (SqlScripts.isBlankOrComment(text)) {
                return ParseResult.formatError("Query for question 1 is empty");
            }
            queries.put(1, text.trim());
            return ParseResult.success(new QuerySet(queries));
        }

        String error = close(queries, currentIndex, body);
        if (error != null) {
            return ParseResult.formatError(error);
        }
        return ParseResult.success(new QuerySet(queries));
    }

    private String close(Map<Integer, String> queries, int index, StringBuilder body) {
        String sql = body.toString().trim();
        if (SqlScripts.isBlankOrComment(sql)) {
            return "Marker --" + index + "-- found, but no query follows it";
        }
        queries.put(index, sql);
        return null;
    }
}
