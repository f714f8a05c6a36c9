package com.openforge.alchemy.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Owns the versioned table layout of the store file.
 *
 * Every script listed in {@link #SCRIPTS} is applied at most once; applied
 * versions are recorded in {@code schema_version} inside the same transaction
 * as the script itself, so an interrupted upgrade is simply re-run on the next
 * call. V1 uses IF NOT EXISTS throughout, which keeps a re-run harmless even
 * against a file created before version tracking existed. Later scripts alter
 * existing tables and rely on the version row alone.
 */
@Slf4j
@Service
public class SchemaManager {

    static final List<SchemaScript> SCRIPTS = List.of(
            new SchemaScript(1, "prompt store", "db/schema/V1__prompt_store.sql"),
            new SchemaScript(2, "generation metadata", "db/schema/V2__generation_metadata.sql")
    );

    private static final String VERSION_TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS schema_version (
                version     INTEGER PRIMARY KEY,
                description TEXT      NOT NULL,
                applied_at  TIMESTAMP NOT NULL
            )""";

    private final DataSource        dataSource;
    private final JdbcTemplate      jdbc;
    private final StoreTransactions transactions;
    private final Clock             clock;

    public SchemaManager(DataSource dataSource, StoreTransactions transactions, Clock clock) {
        this.dataSource   = dataSource;
        this.jdbc         = new JdbcTemplate(dataSource);
        this.transactions = transactions;
        this.clock        = clock;
    }

    public record SchemaScript(int version, String description, String location) {}

    /**
     * @param currentVersion highest applied version after the call
     * @param appliedNow     versions applied by this call (empty when already current)
     */
    public record SchemaStatus(int currentVersion, List<Integer> appliedNow) {}

    /** Idempotent: brings the store file to the latest schema version. */
    public SchemaStatus ensureSchema() {
        return transactions.write("ensureSchema", () -> {
            jdbc.execute(VERSION_TABLE_DDL);
            Set<Integer> applied = new HashSet<>(
                    jdbc.queryForList("SELECT version FROM schema_version", Integer.class));

            List<Integer> appliedNow = new ArrayList<>();
            for (SchemaScript script : SCRIPTS) {
                if (applied.contains(script.version())) continue;

                log.info("[Schema] Applying v{} ({}) from {}", script.version(), script.description(), script.location());
                new ResourceDatabasePopulator(new ClassPathResource(script.location())).execute(dataSource);
                jdbc.update("INSERT INTO schema_version (version, description, applied_at) VALUES (?, ?, ?)",
                        script.version(), script.description(), Timestamp.valueOf(LocalDateTime.now(clock)));
                appliedNow.add(script.version());
            }

            int current = currentVersionInternal();
            if (appliedNow.isEmpty()) {
                log.debug("[Schema] Already at v{}", current);
            } else {
                log.info("[Schema] Store schema now at v{} (applied {})", current, appliedNow);
            }
            return new SchemaStatus(current, List.copyOf(appliedNow));
        });
    }

    public int currentVersion() {
        return transactions.read("schemaVersion", () -> {
            Integer tables = jdbc.queryForObject(
                    "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = 'schema_version'", Integer.class);
            return tables == null || tables == 0 ? 0 : currentVersionInternal();
        });
    }

    private int currentVersionInternal() {
        Integer v = jdbc.queryForObject("SELECT MAX(version) FROM schema_version", Integer.class);
        return v == null ? 0 : v;
    }
}
