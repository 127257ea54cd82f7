package com.sqlgrader;

import com.sqlgrader.exception.GradingConfigurationException;
import com.sqlgrader.exception.InfrastructureException;
import org.hibernate.HibernateException;
import org.hibernate.Session;
import org.hibernate.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Sole owner of the grading schema's structure. {@link #reset()} drops every view, table and
 * sequence of the target schema and replays the schema script, producing the same starting data
 * for every run of the model solution and every student.
 */
public class SchemaManager {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaManager.class);

    // Dictionary and vendor-maintained schemas; a reset would destroy or fail on their objects
    private static final Set<String> PROTECTED_SCHEMAS = new HashSet<>(Arrays.asList(
            "SYS", "SYSTEM", "XDB", "OUTLN", "DBSNMP", "AUDSYS", "CTXSYS", "MDSYS", "ORDSYS", "WMSYS",
            "LBACSYS", "DVSYS", "OJVMSYS", "OLAPSYS", "APPQOSSYS", "GSMADMIN_INTERNAL",
            "INFORMATION_SCHEMA", "PG_CATALOG", "MYSQL", "PERFORMANCE_SCHEMA"));

    private final DatabaseManager databaseManager;
    private final List<String> schemaStatements;

    public SchemaManager(DatabaseManager databaseManager, String schemaScript) {
        this.databaseManager = databaseManager;
        this.schemaStatements = Collections.unmodifiableList(SqlScripts.splitStatements(schemaScript));
        if (schemaStatements.isEmpty()) {
            throw new GradingConfigurationException("Schema script contains no statements");
        }
    }

    public static SchemaManager fromFile(DatabaseManager databaseManager, Path schemaFile) {
        try {
            return new SchemaManager(databaseManager, Files.readString(schemaFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new GradingConfigurationException("Could not read schema file " + schemaFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Drops all objects of the target schema, then replays the schema script.
     *
     * @throws InfrastructureException if anything could not be dropped or replayed
     * @throws GradingConfigurationException if the target is a system schema
     */
    public void reset() {
        long startTime = System.currentTimeMillis();
        try (Session session = databaseManager.openSession()) {
            Transaction transaction = session.beginTransaction();
            try {
                session.doWork(connection -> {
                    dropAll(connection);
                    replay(connection);
                });
                transaction.commit();
            } catch (RuntimeException e) {
                if (transaction.isActive()) {
                    transaction.rollback();
                }
                throw e;
            }
        } catch (InfrastructureException e) {
            throw e;
        } catch (HibernateException e) {
            throw new InfrastructureException("Schema reset failed: " + e.getMessage(), e);
        }
        LOG.debug("Schema reset in {} ms", System.currentTimeMillis() - startTime);
    }

    public int getStatementCount() {
        return schemaStatements.size();
    }

    private void dropAll(Connection connection) throws SQLException {
        DatabaseManager.Vendor vendor = databaseManager.getVendor();
        DatabaseMetaData metaData = connection.getMetaData();
        String schema = databaseManager.getSchema() != null ? databaseManager.getSchema() : connection.getSchema();
        if (schema == null) {
            throw new InfrastructureException("Could not determine the current schema, set database.schema explicitly");
        }
        if (isProtectedSchema(schema)) {
            throw new GradingConfigurationException("Refusing to reset system schema " + schema
                    + ", connect as a dedicated grading user or set database.schema");
        }
        String quote = metaData.getIdentifierQuoteString();
        if (quote == null || quote.trim().isEmpty()) {
            quote = "";
        }

        List<String> views = new ArrayList<>();
        List<String> tables = new ArrayList<>();
        try (ResultSet rs = metaData.getTables(connection.getCatalog(), schema, "%", null)) {
            while (rs.next()) {
                String type = rs.getString("TABLE_TYPE");
                String name = qualify(quote, rs.getString("TABLE_SCHEM"), rs.getString("TABLE_NAME"));
                if ("VIEW".equalsIgnoreCase(type)) {
                    views.add(name);
                } else if ("TABLE".equalsIgnoreCase(type) || "BASE TABLE".equalsIgnoreCase(type)) {
                    tables.add(name);
                }
            }
        }

        boolean foreignKeyChecksOff = vendor == DatabaseManager.Vendor.MYSQL || vendor == DatabaseManager.Vendor.MARIADB;
        try (Statement statement = connection.createStatement()) {
            if (foreignKeyChecksOff) {
                drop(statement, "SET FOREIGN_KEY_CHECKS = 0");
            }
            for (String view : views) {
                drop(statement, dropViewSql(vendor, view));
            }
            for (String table : tables) {
                drop(statement, dropTableSql(vendor, table));
            }
            // Listed after the tables are gone: identity and serial sequences go with their table
            List<String> sequences = listSequences(connection, metaData, vendor, schema, quote);
            for (String sequence : sequences) {
                drop(statement, "DROP SEQUENCE " + sequence);
            }
            if (foreignKeyChecksOff) {
                drop(statement, "SET FOREIGN_KEY_CHECKS = 1");
            }
            LOG.debug("Dropped {} views, {} tables, {} sequences from schema {}",
                    views.size(), tables.size(), sequences.size(), schema);
        }
    }

    private List<String> listSequences(Connection connection, DatabaseMetaData metaData,
                                       DatabaseManager.Vendor vendor, String schema, String quote) throws SQLException {
        List<String> sequences = new ArrayList<>();
        String sql;
        switch (vendor) {
            case H2:
                sql = "SELECT SEQUENCE_NAME FROM INFORMATION_SCHEMA.SEQUENCES WHERE SEQUENCE_SCHEMA = ?";
                break;
            case ORACLE:
                sql = "SELECT SEQUENCE_NAME FROM ALL_SEQUENCES WHERE SEQUENCE_OWNER = ?";
                break;
            default:
                sql = null;
        }

        if (sql != null) {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                ps.setString(1, schema);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        sequences.add(qualify(quote, schema, rs.getString(1)));
                    }
                }
            }
            return sequences;
        }

        try (ResultSet rs = metaData.getTables(connection.getCatalog(), schema, "%", new String[]{"SEQUENCE"})) {
            while (rs.next()) {
                sequences.add(qualify(quote, rs.getString("TABLE_SCHEM"), rs.getString("TABLE_NAME")));
            }
        }
        return sequences;
    }

    private void replay(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (String sql : schemaStatements) {
                try {
                    statement.execute(sql);
                } catch (SQLException e) {
                    throw new InfrastructureException("Schema script statement failed: " + e.getMessage() + " [" + sql + "]", e);
                }
            }
        }
    }

    private static void drop(Statement statement, String sql) {
        LOG.debug("Executing: {}", sql);
        try {
            statement.execute(sql);
        } catch (SQLException e) {
            throw new InfrastructureException("Could not drop schema object: " + e.getMessage() + " [" + sql + "]", e);
        }
    }

    static boolean isProtectedSchema(String schema) {
        return schema != null && PROTECTED_SCHEMAS.contains(schema.toUpperCase(Locale.ROOT));
    }

    static String dropTableSql(DatabaseManager.Vendor vendor, String table) {
        switch (vendor) {
            case ORACLE:
                return "DROP TABLE " + table + " CASCADE CONSTRAINTS PURGE";
            case POSTGRESQL:
            case H2:
                return "DROP TABLE " + table + " CASCADE";
            default:
                return "DROP TABLE " + table;
        }
    }

    static String dropViewSql(DatabaseManager.Vendor vendor, String view) {
        switch (vendor) {
            case POSTGRESQL:
            case H2:
                return "DROP VIEW IF EXISTS " + view + " CASCADE";
            default:
                return "DROP VIEW " + view;
        }
    }

    static String qualify(String quote, String schema, String name) {
        if (schema == null || schema.isEmpty()) {
            return quoteIdentifier(quote, name);
        }
        return quoteIdentifier(quote, schema) + "." + quoteIdentifier(quote, name);
    }

    private static String quoteIdentifier(String quote, String identifier) {
        if (quote.isEmpty()) {
            return identifier;
        }
        return quote + identifier.replace(quote, quote + quote) + quote;
    }
}
