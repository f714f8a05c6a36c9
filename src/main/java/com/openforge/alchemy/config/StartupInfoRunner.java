package com.openforge.alchemy.config;

import com.openforge.alchemy.prompt.PromptRecordService;
import com.openforge.alchemy.settings.ConfigKeys;
import com.openforge.alchemy.settings.StoreConfigService;
import com.openforge.alchemy.store.SchemaManager;
import com.openforge.alchemy.store.StoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.nio.file.Paths;
import java.sql.Connection;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Reports:
 *   - Store file: absolute path, SQLite version, schema version, record count
 *   - Policy: the lifecycle values currently stored in the config table
 *   - Runtime: Java version, server port
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource          dataSource;
    private final StoreProperties     storeProperties;
    private final SchemaManager       schemaManager;
    private final PromptRecordService prompts;
    private final StoreConfigService  config;
    private final Environment         env;

    @Override
    public void run(ApplicationArguments args) {
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║           Alchemy Store  —  Startup Summary              ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Store (SQLite)                                          ║
                ║    File           : {}
                ║    {}
                ║    Schema         : v{}
                ║    Prompts        : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Lifecycle Policy                                        ║
                ║    Max Prompts    : {}  (headroom {})
                ║    Relevance      : floor={}  protect={}
                ║    Decay          : half-life={}d  usage-weight={}  saturation={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                javaVersion,

                Paths.get(storeProperties.path()).toAbsolutePath(),
                probeDatabase(),
                schemaManager.currentVersion(),
                prompts.count(),

                config.getString(ConfigKeys.MAX_PROMPTS, "?"),
                config.getString(ConfigKeys.CLEANUP_HEADROOM, "?"),
                config.getString(ConfigKeys.MIN_RELEVANCE_SCORE, "?"),
                config.getString(ConfigKeys.PROTECT_RELEVANCE_SCORE, "?"),
                config.getString(ConfigKeys.RELEVANCE_HALF_LIFE_DAYS, "?"),
                config.getString(ConfigKeys.RELEVANCE_USAGE_WEIGHT, "?"),
                config.getString(ConfigKeys.RELEVANCE_USAGE_SATURATION, "?")
        );
    }

    /**
     * Opens a real JDBC connection and reads the SQLite library version.
     * Returns a one-line summary or error message.
     */
    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            return "✔ Connected  sqlite=" + conn.getMetaData().getDatabaseProductVersion();
        } catch (Exception e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }
}
