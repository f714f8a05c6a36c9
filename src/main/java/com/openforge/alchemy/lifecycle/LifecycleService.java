package com.openforge.alchemy.lifecycle;

import com.openforge.alchemy.domain.PromptCandidate;
import com.openforge.alchemy.relationship.RelationshipService;
import com.openforge.alchemy.repository.PromptCandidateRepository;
import com.openforge.alchemy.settings.ConfigKeys;
import com.openforge.alchemy.settings.StoreConfigService;
import com.openforge.alchemy.store.StoreProperties;
import com.openforge.alchemy.store.StoreTransactions;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Supplier;

/**
 * Keeps the store bounded: relevance decay plus capacity eviction.
 *
 * Nothing here runs on its own schedule; callers trigger each pass.
 * Dry runs execute the real code path inside a transaction that is rolled
 * back, so a preview reports exactly what a real run would do against the
 * same data.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LifecycleService {

    private static final double SCORE_EPSILON = 1e-9;

    private final PromptCandidateRepository repository;
    private final RelationshipService       relationships;
    private final StoreConfigService        config;
    private final StoreTransactions         transactions;
    private final StoreProperties           properties;
    private final Clock                     clock;
    private final EntityManager             entityManager;

    // ── Relevance ────────────────────────────────────────────────────────────

    /**
     * Commits page by page (scan-page-size rows each); an interrupted pass is
     * completed by running it again.
     *
     * @return number of records whose score changed
     */
    public int updateRelevanceScores() {
        return recomputeRelevance();
    }

    // ── Cleanup ──────────────────────────────────────────────────────────────

    public CleanupReport cleanupOldPrompts(boolean dryRun) {
        return dryRun
                ? transactions.rehearse("cleanup(dry-run)", () -> evict(true))
                : transactions.write("cleanup", () -> evict(false));
    }

    // ── Combined ─────────────────────────────────────────────────────────────

    /** Runs the selected steps, relevance first, as one transaction. */
    public MaintenanceReport runMaintenance(MaintenanceOptions options) {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        long t0 = System.nanoTime();

        Supplier<MaintenanceReport> work = () -> {
            Integer updated       = options.updateRelevance() ? recomputeRelevance() : null;
            CleanupReport cleanup = options.cleanup() ? evict(options.dryRun()) : null;
            return new MaintenanceReport(options.dryRun(), updated, cleanup, startedAt,
                    (System.nanoTime() - t0) / 1_000_000);
        };
        MaintenanceReport report = options.dryRun()
                ? transactions.rehearse("maintenance(dry-run)", work)
                : transactions.write("maintenance", work);

        log.info("[Lifecycle] Maintenance{} finished in {} ms: relevanceUpdated={} cleanup={}",
                options.dryRun() ? " (dry run)" : "", report.durationMs(), report.relevanceUpdated(), report.cleanup());
        return report;
    }

    public RelevancePolicy currentPolicy() {
        return new RelevancePolicy(
                config.getFloat(ConfigKeys.RELEVANCE_HALF_LIFE_DAYS,   RelevancePolicy.DEFAULT_HALF_LIFE_DAYS),
                config.getFloat(ConfigKeys.RELEVANCE_USAGE_WEIGHT,     RelevancePolicy.DEFAULT_USAGE_WEIGHT),
                config.getFloat(ConfigKeys.RELEVANCE_USAGE_SATURATION, RelevancePolicy.DEFAULT_USAGE_SATURATION));
    }

    // ── Steps ────────────────────────────────────────────────────────────────
    //
    // Each page goes through transactions.write: on its own that commits per
    // page, inside runMaintenance it joins the one surrounding transaction.

    private int recomputeRelevance() {
        RelevancePolicy policy = currentPolicy();
        LocalDateTime now = LocalDateTime.now(clock);
        int pageSize = Math.max(1, properties.scanPageSize());

        int changed = 0;
        String lastId = "";
        while (true) {
            String after = lastId;
            PageResult page = transactions.write("updateRelevance.page",
                    () -> recomputePage(after, pageSize, policy, now));
            changed += page.changed();
            if (page.size() < pageSize) break;
            lastId = page.lastId();
        }
        log.info("[Lifecycle] Relevance recomputed: {} record(s) changed (policy={})", changed, policy);
        return changed;
    }

    private record PageResult(int size, int changed, String lastId) {}

    private PageResult recomputePage(String afterId, int pageSize, RelevancePolicy policy, LocalDateTime now) {
        List<PromptCandidate> page = repository.findByIdGreaterThanOrderByIdAsc(afterId, PageRequest.of(0, pageSize));
        if (page.isEmpty()) return new PageResult(0, 0, afterId);
        int changed = 0;
        for (PromptCandidate c : page) {
            double score = policy.score(c.getCreateTime(), c.getUsageCount(), now);
            if (Math.abs(score - c.getRelevanceScore()) > SCORE_EPSILON) {
                c.setRelevanceScore(score);
                changed++;
            }
        }
        repository.flush();
        entityManager.clear();
        return new PageResult(page.size(), changed, page.get(page.size() - 1).getId());
    }

    private CleanupReport evict(boolean dryRun) {
        int    maxPrompts = config.getInt(ConfigKeys.MAX_PROMPTS, properties.lifecycle().maxPrompts());
        double floor      = config.getFloat(ConfigKeys.MIN_RELEVANCE_SCORE, properties.lifecycle().minRelevanceScore());
        double protect    = config.getFloat(ConfigKeys.PROTECT_RELEVANCE_SCORE, properties.lifecycle().protectRelevanceScore());
        int    headroom   = Math.max(0, config.getInt(ConfigKeys.CLEANUP_HEADROOM, properties.lifecycle().cleanupHeadroom()));
        double protectThreshold = Math.max(protect, floor);
        long   target     = Math.max(0, (long) maxPrompts - headroom);

        long before = repository.count();
        if (before <= maxPrompts) {
            log.debug("[Lifecycle] Cleanup skipped: {} record(s) within ceiling {}", before, maxPrompts);
            return new CleanupReport(dryRun, before, before, maxPrompts, floor, protectThreshold, target, 0, 0, false);
        }

        int pageSize = Math.max(1, properties.scanPageSize());
        long remaining = before - target;
        int deleted = 0;
        int belowFloor = 0;
        while (remaining > 0) {
            List<PromptCandidate> victims = repository
                    .findByRelevanceScoreLessThanOrderByRelevanceScoreAscCreateTimeAscIdAsc(
                            protectThreshold, PageRequest.of(0, (int) Math.min(remaining, pageSize)));
            if (victims.isEmpty()) break;
            for (PromptCandidate victim : victims) {
                relationships.removeForRecord(victim.getId());
                repository.delete(victim);
                deleted++;
                if (victim.getRelevanceScore() < floor) belowFloor++;
            }
            repository.flush();
            entityManager.clear();
            remaining -= victims.size();
        }

        long after = repository.count();
        if (remaining > 0) {
            log.warn("[Lifecycle] Cleanup stopped at {} record(s): everything left is protected (>= {})",
                    after, protectThreshold);
        }
        log.info("[Lifecycle] Cleanup{}: {} → {} (ceiling {}, target {}), deleted {} ({} below floor {})",
                dryRun ? " (dry run)" : "", before, after, maxPrompts, target, deleted, belowFloor, floor);
        return new CleanupReport(dryRun, before, dryRun ? before : after, maxPrompts, floor, protectThreshold,
                target, deleted, belowFloor, true);
    }
}
