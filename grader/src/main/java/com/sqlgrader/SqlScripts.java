package com.sqlgrader;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits SQL text into statements on {@code ;}, ignoring semicolons inside quotes and comments.
 */
public final class SqlScripts {

    private SqlScripts() {
    }

    /**
     * Splits a script into trimmed statements without their terminators. Fragments made only of
     * comments (for example a trailing {@code -- end}) are dropped.
     */
    public static List<String> splitStatements(String script) {
        List<String> statements = new ArrayList<>();
        if (script == null) {
            return statements;
        }
        StringBuilder sb = new StringBuilder();
        boolean inSingleQuote = false;
        boolean inDoubleQuote = false;
        boolean inLineComment = false;
        boolean inBlockComment = false;
        int length = script.length();

        for (int i = 0; i < length; i++) {
            char c = script.charAt(i);
            char next = i + 1 < length ? script.charAt(i + 1) : '\0';

            if (inLineComment) {
                sb.append(c);
                if (c == '\n') {
                    inLineComment = false;
                }
            } else if (inBlockComment) {
                sb.append(c);
                if (c == '*' && next == '/') {
                    sb.append(next);
                    i++;
                    inBlockComment = false;
                }
            } else if (inSingleQuote) {
                sb.append(c);
                if (c == '\'') {
                    inSingleQuote = false;
                }
            } else if (inDoubleQuote) {
                sb.append(c);
                if (c == '"') {
                    inDoubleQuote = false;
                }
            } else if (c == '-' && next == '-') {
                sb.append(c).append(next);
                i++;
                inLineComment = true;
            } else if (c == '/' && next == '*') {
                sb.append(c).append(next);
                i++;
                inBlockComment = true;
            } else if (c == '\'') {
                sb.append(c);
                inSingleQuote = true;
            } else if (c == '"') {
                sb.append(c);
                inDoubleQuote = true;
            } else if (c == ';') {
                addIfMeaningful(statements, sb.toString());
                sb.setLength(0);
            } else {
                sb.append(c);
            }
        }

        addIfMeaningful(statements, sb.toString());
        return statements;
    }

    /**
     * True when the text holds nothing but whitespace, line comments and block comments.
     */
    public static boolean isBlankOrComment(String sql) {
        return sql == null || stripComments(sql).trim().isEmpty();
    }

    /**
     * Removes line and block comments outside quoted literals.
     */
    static String stripComments(String sql) {
        StringBuilder sb = new StringBuilder();
        boolean inSingleQuote = false;
        boolean inDoubleQuote = false;
        int length = sql.length();
        int i = 0;
        while (i < length) {
            char c = sql.charAt(i);
            char next = i + 1 < length ? sql.charAt(i + 1) : '\0';
            if (inSingleQuote || inDoubleQuote) {
                sb.append(c);
                if ((inSingleQuote && c == '\'') || (inDoubleQuote && c == '"')) {
                    inSingleQuote = false;
                    inDoubleQuote = false;
                }
                i++;
            } else if (c == '-' && next == '-') {
                int end = sql.indexOf('\n', i);
                i = end < 0 ? length : end;
            } else if (c == '/' && next == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? length : end + 2;
                sb.append(' ');
            } else {
                if (c == '\'') {
                    inSingleQuote = true;
                } else if (c == '"') {
                    inDoubleQuote = true;
                }
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private static void addIfMeaningful(List<String> statements, String fragment) {
        String statement = fragment.trim();
        if (!statement.isEmpty() && !isBlankOrComment(statement)) {
            statements.add(statement);
        }
    }
}
