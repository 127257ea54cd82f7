package com.sqlgrader;

import com.sqlgrader.exception.GradingConfigurationException;
import com.sqlgrader.exception.InfrastructureException;
import org.hibernate.HibernateException;
import org.hibernate.Session;
import org.hibernate.SessionFactory;
import org.hibernate.boot.Metadata;
import org.hibernate.boot.MetadataSources;
import org.hibernate.boot.registry.StandardServiceRegistry;
import org.hibernate.boot.registry.StandardServiceRegistryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Owns the Hibernate {@link SessionFactory} used for grading. The pool holds a single connection,
 * so every schema reset and every query of a run goes through the same physical connection.
 */
public class DatabaseManager implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(DatabaseManager.class);

    /**
     * Database products with vendor-specific handling.
     */
    public enum Vendor {
        ORACLE,
        POSTGRESQL,
        H2,
        MYSQL,
        MARIADB,
        SQLSERVER,
        OTHER
    }

    private final SessionFactory sessionFactory;
    private final StandardServiceRegistry registry;
    private final Vendor vendor;
    private final String schema;

    public DatabaseManager(Map<String, String> dbConfig) {
        if (dbConfig == null || dbConfig.get("url") == null || dbConfig.get("url").trim().isEmpty()) {
            throw new GradingConfigurationException("Database configuration not provided: 'url' is required");
        }
        String url = dbConfig.get("url");
        this.vendor = detectVendor(url);
        this.schema = blankToNull(dbConfig.get("schema"));

        StandardServiceRegistryBuilder registryBuilder = new StandardServiceRegistryBuilder();
        registryBuilder.applySetting("hibernate.connection.url", url);
        registryBuilder.applySetting("hibernate.connection.username", nullToEmpty(dbConfig.get("username")));
        registryBuilder.applySetting("hibernate.connection.password", nullToEmpty(dbConfig.get("password")));
        String driver = blankToNull(dbConfig.get("driver"));
        if (driver == null) {
            driver = defaultDriver(vendor);
        }
        if (driver != null) {
            registryBuilder.applySetting("hibernate.connection.driver_class", driver);
        }

        String dialect = getDialect(vendor);
        registryBuilder.applySetting("hibernate.dialect", dialect);
        registryBuilder.applySetting("hibernate.connection.pool_size", "1");
        registryBuilder.applySetting("hibernate.connection.autocommit", "false");
        registryBuilder.applySetting("hibernate.show_sql", "false");
        registryBuilder.applySetting("hibernate.format_sql", "false");
        registryBuilder.applySetting("hibernate.hbm2ddl.auto", "none");

        LOG.info("Connecting to {} database ({})", vendor, dialect);
        this.registry = registryBuilder.build();
        try {
            // No mapped entities: the session factory only serves native statements
            Metadata metadata = new MetadataSources(registry).getMetadataBuilder().build();
            this.sessionFactory = metadata.getSessionFactoryBuilder().build();
        } catch (HibernateException e) {
            StandardServiceRegistryBuilder.destroy(registry);
            throw new InfrastructureException("Could not initialize the database connection: " + e.getMessage(), e);
        }
    }

    /**
     * Opens a session on the shared connection pool.
     *
     * @throws InfrastructureException if the factory is closed or unusable
     */
    public Session openSession() {
        try {
            return sessionFactory.openSession();
        } catch (HibernateException | IllegalStateException e) {
            throw new InfrastructureException("Could not open a database session: " + e.getMessage(), e);
        }
    }

    public Vendor getVendor() {
        return vendor;
    }

    /**
     * Schema configured explicitly, or null to use the connection's current schema.
     */
    public String getSchema() {
        return schema;
    }

    @Override
    public void close() {
        if (sessionFactory != null && !sessionFactory.isClosed()) {
            LOG.info("Closing SessionFactory...");
            sessionFactory.close();
        }
        StandardServiceRegistryBuilder.destroy(registry);
    }

    static Vendor detectVendor(String url) {
        if (url == null) return Vendor.OTHER;
        String lower = url.toLowerCase();
        if (lower.startsWith("jdbc:oracle")) return Vendor.ORACLE;
        if (lower.startsWith("jdbc:postgresql")) return Vendor.POSTGRESQL;
        if (lower.startsWith("jdbc:h2")) return Vendor.H2;
        if (lower.startsWith("jdbc:mysql")) return Vendor.MYSQL;
        if (lower.startsWith("jdbc:mariadb")) return Vendor.MARIADB;
        if (lower.startsWith("jdbc:sqlserver")) return Vendor.SQLSERVER;
        return Vendor.OTHER;
    }

    static String getDialect(Vendor vendor) {
        switch (vendor) {
            case ORACLE: return "org.hibernate.dialect.Oracle12cDialect";
            case POSTGRESQL: return "org.hibernate.dialect.PostgreSQL10Dialect";
            case H2: return "org.hibernate.dialect.H2Dialect";
            case MARIADB: return "org.hibernate.dialect.MariaDB103Dialect";
            case SQLSERVER: return "org.hibernate.dialect.SQLServer2012Dialect";
            case MYSQL:
            default:
                return "org.hibernate.dialect.MySQL8Dialect";
        }
    }

    private static String defaultDriver(Vendor vendor) {
        switch (vendor) {
            case ORACLE: return "oracle.jdbc.OracleDriver";
            case POSTGRESQL: return "org.postgresql.Driver";
            case H2: return "org.h2.Driver";
            case MYSQL: return "com.mysql.cj.jdbc.Driver";
            case MARIADB: return "org.mariadb.jdbc.Driver";
            case SQLSERVER: return "com.microsoft.sqlserver.jdbc.SQLServerDriver";
            default: return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
