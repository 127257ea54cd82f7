package com.sqlgrader;

import com.sqlgrader.dto.QueryOutcome;
import com.sqlgrader.dto.ResultTable;
import com.sqlgrader.exception.InfrastructureException;
import org.hibernate.HibernateException;
import org.hibernate.Session;
import org.hibernate.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Executes a single SQL statement on the current schema generation.
 *
 * <p>Engine errors are returned as {@link QueryOutcome} values, they are an expected part of
 * grading. Only a lost or unusable connection escapes as {@link InfrastructureException}.
 */
public class QueryRunner {
    private static final Logger LOG = LoggerFactory.getLogger(QueryRunner.class);

    // Vendor codes for "user requested cancel" / statement timeout
    private static final int ORACLE_CANCELLED = 1013;
    private static final int H2_STATEMENT_CANCELED = 57014;
    // SQL standard "query canceled", raised by PostgreSQL on statement_timeout
    private static final String SQLSTATE_QUERY_CANCELED = "57014";

    private final DatabaseManager databaseManager;
    private final int timeoutSeconds;

    public QueryRunner(DatabaseManager databaseManager, int timeoutSeconds) {
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("Query timeout must be at least one second");
        }
        this.databaseManager = databaseManager;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * Runs one statement in its own transaction and materializes its result.
     *
     * @param sql exactly one statement, trailing {@code ;} optional
     * @return SUCCESS with the result table, or ERROR with the engine message or {@code timeout}
     * @throws InfrastructureException if the connection is lost or unusable
     */
    public QueryOutcome execute(String sql) {
        long startTime = System.currentTimeMillis();

        List<String> statements = SqlScripts.splitStatements(sql);
        if (statements.isEmpty()) {
            return QueryOutcome.error("Query is empty", elapsed(startTime));
        }
        if (statements.size() > 1) {
            return QueryOutcome.error(
                    "Expected exactly one SQL statement but found " + statements.size(), elapsed(startTime));
        }
        String statementSql = statements.get(0);

        try (Session session = databaseManager.openSession()) {
            Transaction transaction = session.beginTransaction();
            QueryOutcome outcome;
            try {
                outcome = session.doReturningWork(connection -> run(connection, statementSql, startTime));
            } catch (RuntimeException e) {
                rollbackQuietly(transaction, e);
                throw e;
            }
            if (outcome.isSuccess()) {
                QueryOutcome commitFailure = commit(transaction, startTime);
                if (commitFailure != null) {
                    return commitFailure;
                }
                LOG.debug("Query executed in {} ms, {} rows: {}",
                        outcome.getExecutionTime(), outcome.getResult().getRowCount(), statementSql);
            } else {
                transaction.rollback();
                LOG.debug("Query failed after {} ms: {}", outcome.getExecutionTime(), outcome.getMessage());
            }
            return outcome;
        } catch (InfrastructureException e) {
            throw e;
        } catch (HibernateException e) {
            throw new InfrastructureException("Database connection failure: " + e.getMessage(), e);
        }
    }

    /**
     * Commits a successful statement. A commit the engine rejects, such as a deferred constraint
     * violation, fails the question; a lost connection is an infrastructure failure.
     *
     * @return null when committed, otherwise the error outcome
     */
    private QueryOutcome commit(Transaction transaction, long startTime) {
        try {
            transaction.commit();
            return null;
        } catch (RuntimeException e) {
            SQLException cause = findSqlException(e);
            if (cause == null || isConnectionFailure(cause)) {
                throw new InfrastructureException("Database connection failure: " + e.getMessage(), e);
            }
            rollbackQuietly(transaction, e);
            LOG.debug("Commit rejected: {}", cause.getMessage());
            return QueryOutcome.error(cause.getMessage(), elapsed(startTime));
        }
    }

    private QueryOutcome run(Connection connection, String sql, long startTime) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(timeoutSeconds);
            boolean hasResultSet = statement.execute(sql);
            if (!hasResultSet) {
                // DML/DDL: no result set, effects stay until the next schema reset
                return QueryOutcome.success(ResultTable.empty(), elapsed(startTime));
            }
            try (ResultSet rs = statement.getResultSet()) {
                return QueryOutcome.success(materialize(rs), elapsed(startTime));
            }
        } catch (SQLException e) {
            if (isConnectionFailure(e)) {
                throw new InfrastructureException("Database connection failure: " + e.getMessage(), e);
            }
            if (isTimeout(e)) {
                LOG.debug("Query exceeded {} s timeout", timeoutSeconds);
                return QueryOutcome.timeout(elapsed(startTime));
            }
            return QueryOutcome.error(e.getMessage(), elapsed(startTime));
        }
    }

    static ResultTable materialize(ResultSet rs) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(metaData.getColumnLabel(i));
        }
        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(JdbcValues.readValue(rs, i));
            }
            rows.add(row);
        }
        return new ResultTable(columns, rows);
    }

    static boolean isTimeout(SQLException e) {
        return e instanceof SQLTimeoutException
                || SQLSTATE_QUERY_CANCELED.equals(e.getSQLState())
                || e.getErrorCode() == ORACLE_CANCELLED
                || e.getErrorCode() == H2_STATEMENT_CANCELED;
    }

    static boolean isConnectionFailure(SQLException e) {
        String sqlState = e.getSQLState();
        return sqlState != null && sqlState.startsWith("08");
    }

    static SQLException findSqlException(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException) {
                return (SQLException) t;
            }
        }
        return null;
    }

    private static void rollbackQuietly(Transaction transaction, RuntimeException cause) {
        try {
            if (transaction.isActive()) {
                transaction.rollback();
            }
        } catch (RuntimeException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }

    private static long elapsed(long startTime) {
        return System.currentTimeMillis() - startTime;
    }
}
