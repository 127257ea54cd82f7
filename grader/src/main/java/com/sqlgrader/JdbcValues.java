package com.sqlgrader;

import java.io.IOException;
import java.io.Reader;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.util.Base64;

/**
 * Converts JDBC column values into plain scalars so that results stay valid after the connection
 * moves on and can be compared and logged without driver classes.
 *
 * <p>Numbers, strings and booleans are kept as they are. LOBs are read fully, temporal values and
 * anything else driver-specific become their string form.
 */
public final class JdbcValues {

    private JdbcValues() {
    }

    public static Object readValue(ResultSet rs, int columnIndex) throws SQLException {
        return toScalar(rs.getObject(columnIndex));
    }

    static Object toScalar(Object v) throws SQLException {
        if (v == null) {
            return null;
        }
        if (v instanceof Number || v instanceof Boolean || v instanceof String) {
            return v;
        }
        if (v instanceof Character) {
            return v.toString();
        }

        Object driverSpecific = tryReadDriverSpecificValue(v);
        if (driverSpecific != null) {
            return driverSpecific;
        }

        if (v instanceof Clob) {
            return readClob((Clob) v);
        }
        if (v instanceof Blob) {
            Blob blob = (Blob) v;
            return Base64.getEncoder().encodeToString(blob.getBytes(1, (int) blob.length()));
        }
        if (v instanceof SQLXML) {
            return ((SQLXML) v).getString();
        }
        if (v instanceof byte[]) {
            return Base64.getEncoder().encodeToString((byte[]) v);
        }
        return v.toString();
    }

    private static Object tryReadDriverSpecificValue(Object v) throws SQLException {
        String className = v.getClass().getName();

        // Oracle TIMESTAMP/DATE wrappers are not java.sql types
        if (className.startsWith("oracle.sql.TIMESTAMP") || "oracle.sql.DATE".equals(className)) {
            try {
                Object ts = v.getClass().getMethod("timestampValue").invoke(v);
                return ts != null ? ts.toString() : null;
            } catch (ReflectiveOperationException e) {
                throw new SQLException("Could not read Oracle temporal value of type " + className, e);
            }
        }

        // PostgreSQL JSON and custom types
        if ("org.postgresql.util.PGobject".equals(className)) {
            try {
                return v.getClass().getMethod("getValue").invoke(v);
            } catch (ReflectiveOperationException e) {
                throw new SQLException("Could not read PostgreSQL value of type " + className, e);
            }
        }
        return null;
    }

    private static String readClob(Clob clob) throws SQLException {
        try (Reader reader = clob.getCharacterStream()) {
            if (reader == null) {
                return "";
            }
            StringBuilder sb = new StringBuilder();
            char[] buf = new char[8192];
            int n;
            while ((n = reader.read(buf)) > 0) {
                sb.append(buf, 0, n);
            }
            return sb.toString();
        } catch (IOException e) {
            throw new SQLException("Could not read CLOB value", e);
        }
    }
}
