package com.openforge.alchemy.lifecycle;

import com.openforge.alchemy.migration.EmbeddingMigrationService;
import com.openforge.alchemy.migration.EmbeddingStats;
import com.openforge.alchemy.migration.MigrationReport;
import com.openforge.alchemy.settings.StoreConfigService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Explicit triggers for the passes that never run on their own.
 *
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  POST /api/maintenance/run            relevance decay + cleanup      │
 * │  POST /api/maintenance/migrate        standardize embeddings         │
 * │  GET  /api/maintenance/embeddings     embedding model breakdown      │
 * │  GET  /api/maintenance/config         stored policy values           │
 * │  PUT  /api/maintenance/config/{key}   change one policy value        │
 * └──────────────────────────────────────────────────────────────────────┘
 */
@RestController
@RequestMapping("/api/maintenance")
@RequiredArgsConstructor
public class MaintenanceController {

    private final LifecycleService          lifecycle;
    private final EmbeddingMigrationService migration;
    private final StoreConfigService        config;

    /** Missing flags default to a full, real run. */
    @PostMapping("/run")
    public ResponseEntity<MaintenanceReport> run(@RequestBody(required = false) MaintenanceRequest req) {
        MaintenanceOptions options = req == null
                ? MaintenanceOptions.full()
                : new MaintenanceOptions(
                        req.updateRelevance() == null || req.updateRelevance(),
                        req.cleanup() == null || req.cleanup(),
                        Boolean.TRUE.equals(req.dryRun()));
        return ResponseEntity.ok(lifecycle.runMaintenance(options));
    }

    @PostMapping("/migrate")
    public ResponseEntity<MigrationReport> migrate(@Valid @RequestBody MigrateRequest req) {
        MigrationReport report = Boolean.TRUE.equals(req.dryRun())
                ? migration.preview(req.model(), req.dimensions())
                : migration.migrate(req.model(), req.dimensions(), req.batchSize() == null ? 0 : req.batchSize());
        return ResponseEntity.ok(report);
    }

    @GetMapping("/embeddings")
    public ResponseEntity<EmbeddingStats> embeddings() {
        return ResponseEntity.ok(migration.getEmbeddingStats());
    }

    @GetMapping("/config")
    public ResponseEntity<Map<String, String>> config() {
        return ResponseEntity.ok(config.all());
    }

    @PutMapping("/config/{key}")
    public ResponseEntity<Map<String, String>> setConfig(@PathVariable("key") String key,
                                                         @Valid @RequestBody ConfigValue body) {
        config.set(key, body.value());
        return ResponseEntity.ok(Map.of(key, body.value()));
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    public record MaintenanceRequest(Boolean updateRelevance, Boolean cleanup, Boolean dryRun) {}

    public record MigrateRequest(
            @NotBlank String  model,
            @Positive int     dimensions,
            Integer           batchSize,
            Boolean           dryRun
    ) {}

    public record ConfigValue(@NotNull String value) {}
}
