package com.sqlgrader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory H2 databases for tests. Each call gets its own database.
 */
final class TestDatabases {
    private static final AtomicInteger COUNTER = new AtomicInteger();

    private TestDatabases() {
    }

    static Map<String, String> h2Config() {
        Map<String, String> config = new HashMap<>();
        config.put("url", "jdbc:h2:mem:grading" + COUNTER.incrementAndGet() + ";DB_CLOSE_DELAY=-1");
        config.put("username", "sa");
        config.put("password", "");
        config.put("driver", "org.h2.Driver");
        return config;
    }

    static DatabaseManager newDatabase() {
        return new DatabaseManager(h2Config());
    }

    static String studentSchema() {
        try (InputStream in = TestDatabases.class.getResourceAsStream("/student_schema.sql")) {
            if (in == null) {
                throw new IllegalStateException("student_schema.sql not found on the test classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
