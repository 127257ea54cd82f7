package com.sqlgrader;

import com.sqlgrader.dto.QueryOutcome;
import com.sqlgrader.dto.QuestionVerdict;
import com.sqlgrader.dto.ResultTable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares a student's result table with the expected one.
 *
 * <p>Rows are compared as a multiset: order is irrelevant, multiplicity is not. Each row is reduced
 * to a key of canonical value tokens, so numbers compare by value ({@code 98}, {@code 98.0} and
 * {@code 98.00} are the same) while strings compare exactly. Column names are reported when they
 * differ but only the column count and the row data decide the verdict.
 */
public class ResultComparator {

    /**
     * Verdict for a student outcome. An execution error fails without comparing anything.
     */
    public QuestionVerdict judge(int questionIndex, ResultTable expected, QueryOutcome outcome) {
        if (!outcome.isSuccess()) {
            return QuestionVerdict.fail(questionIndex, outcome.getMessage(), expected);
        }
        return compare(questionIndex, expected, outcome.getResult());
    }

    /**
     * Compares two results as row multisets. Row order is ignored, duplicate counts are not.
     */
    public QuestionVerdict compare(int questionIndex, ResultTable expected, ResultTable actual) {
        List<String> diff = new ArrayList<>();

        if (expected.getColumnCount() != actual.getColumnCount()) {
            diff.add("Column count mismatch: expected " + expected.getColumnCount()
                    + " " + expected.getColumns() + ", actual " + actual.getColumnCount() + " " + actual.getColumns());
            return new QuestionVerdict(questionIndex, QuestionVerdict.Verdict.FAIL, String.join("\n", diff), expected, actual);
        }

        String columnNote = null;
        if (!expected.getColumns().equals(actual.getColumns())) {
            columnNote = "Column names differ: expected " + expected.getColumns() + ", actual " + actual.getColumns();
        }

        Map<List<String>, Integer> expectedCounts = countRows(expected);
        Map<List<String>, Integer> actualCounts = countRows(actual);
        Map<List<String>, Integer> missing = subtract(expectedCounts, actualCounts);
        Map<List<String>, Integer> extra = subtract(actualCounts, expectedCounts);

        if (missing.isEmpty() && extra.isEmpty()) {
            return new QuestionVerdict(questionIndex, QuestionVerdict.Verdict.PASS, columnNote, expected, actual);
        }

        if (columnNote != null) {
            diff.add(columnNote);
        }
        if (!missing.isEmpty()) {
            diff.add("Missing rows: " + renderRows(missing));
        }
        if (!extra.isEmpty()) {
            diff.add("Extra rows: " + renderRows(extra));
        }
        return new QuestionVerdict(questionIndex, QuestionVerdict.Verdict.FAIL, String.join("\n", diff), expected, actual);
    }

    /**
     * Row key to occurrence count, keeping first-seen order for stable diffs.
     */
    static Map<List<String>, Integer> countRows(ResultTable table) {
        Map<List<String>, Integer> counts = new LinkedHashMap<>();
        for (List<Object> row : table.getRows()) {
            counts.merge(rowKey(row), 1, Integer::sum);
        }
        return counts;
    }

    static List<String> rowKey(List<Object> row) {
        List<String> key = new ArrayList<>(row.size());
        for (Object value : row) {
            key.add(canonical(value));
        }
        return key;
    }

    /**
     * Canonical token of a scalar. The leading letter keeps types apart: the number 1 and the
     * string '1' are different values.
     */
    static String canonical(Object value) {
        if (value == null) {
            return "Z";
        }
        if (value instanceof Number) {
            return canonicalNumber((Number) value);
        }
        if (value instanceof Boolean) {
            return "B" + value;
        }
        return "S" + value;
    }

    private static String canonicalNumber(Number number) {
        BigDecimal decimal;
        if (number instanceof BigDecimal) {
            decimal = (BigDecimal) number;
        } else if (number instanceof BigInteger) {
            decimal = new BigDecimal((BigInteger) number);
        } else if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return "N" + d;
            }
            // Float.toString keeps 0.1f as "0.1" instead of its binary expansion. Doubles are rounded
            // to 16 digits so that 0.1 + 0.2 and 0.3 share a token
            decimal = number instanceof Float
                    ? new BigDecimal(number.toString())
                    : BigDecimal.valueOf(d).round(MathContext.DECIMAL64);
        } else if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            decimal = BigDecimal.valueOf(number.longValue());
        } else {
            try {
                decimal = new BigDecimal(number.toString());
            } catch (NumberFormatException e) {
                decimal = BigDecimal.valueOf(number.doubleValue());
            }
        }
        if (decimal.signum() == 0) {
            return "N0";
        }
        return "N" + decimal.stripTrailingZeros().toPlainString();
    }

    private static Map<List<String>, Integer> subtract(Map<List<String>, Integer> from, Map<List<String>, Integer> other) {
        Map<List<String>, Integer> result = new LinkedHashMap<>();
        for (Map.Entry<List<String>, Integer> entry : from.entrySet()) {
            int remaining = entry.getValue() - other.getOrDefault(entry.getKey(), 0);
            if (remaining > 0) {
                result.put(entry.getKey(), remaining);
            }
        }
        return result;
    }

    /**
     * Renders rows as {@code {(2,'Sid',98), (3,NULL,1.5) x2}}.
     */
    static String renderRows(Map<List<String>, Integer> rows) {
        List<String> rendered = new ArrayList<>();
        for (Map.Entry<List<String>, Integer> entry : rows.entrySet()) {
            String row = renderRow(entry.getKey());
            rendered.add(entry.getValue() > 1 ? row + " x" + entry.getValue() : row);
        }
        return "{" + String.join(", ", rendered) + "}";
    }

    static String renderRow(List<String> key) {
        List<String> values = new ArrayList<>(key.size());
        for (String token : key) {
            values.add(renderToken(token));
        }
        return "(" + String.join(",", values) + ")";
    }

    private static String renderToken(String token) {
        char type = token.charAt(0);
        String body = token.substring(1);
        switch (type) {
            case 'Z':
                return "NULL";
            case 'N':
                return body;
            case 'B':
                return body.toUpperCase();
            default:
                return "'" + body.replace("'", "''") + "'";
        }
    }
}
