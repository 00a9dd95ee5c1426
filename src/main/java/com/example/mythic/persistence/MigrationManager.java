package com.example.mythic.persistence;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs each schema setup once per key for the lifetime of the JVM.
 * Keys include the JDBC URL so stores pointed at different databases each get their tables.
 */
public final class MigrationManager {

    private static final Map<String, Boolean> executed = new ConcurrentHashMap<>();

    private MigrationManager() { }

    /**
     * Run {@code migration} unless a migration with the same key already completed.
     * A migration that throws is not recorded and will run again on the next call.
     * The migration must not call back into this manager.
     */
    public static void ensureMigration(String key, Runnable migration) {
        String k = key == null ? "default" : key;
        executed.computeIfAbsent(k, ignored -> {
            migration.run();
            return Boolean.TRUE;
        });
    }
}
