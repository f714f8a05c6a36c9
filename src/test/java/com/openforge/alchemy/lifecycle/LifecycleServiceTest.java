package com.openforge.alchemy.lifecycle;

import com.openforge.alchemy.StoreTestSupport;
import com.openforge.alchemy.domain.RelationshipType;
import com.openforge.alchemy.prompt.PromptRecord;
import com.openforge.alchemy.relationship.RelationshipService;
import com.openforge.alchemy.settings.ConfigKeys;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LifecycleServiceTest extends StoreTestSupport {

    @Autowired
    private LifecycleService lifecycle;

    @Autowired
    private RelationshipService relationships;

    @Test
    void cleanupEvictsTheLeastRelevantRecordOverCapacity() {
        PromptRecord high = createWithRelevance("high", 0.9);
        PromptRecord mid  = createWithRelevance("mid", 0.5);
        PromptRecord low  = createWithRelevance("low", 0.1);
        configService.set(ConfigKeys.MAX_PROMPTS, "2");

        CleanupReport report = lifecycle.cleanupOldPrompts(false);

        assertThat(report.countBefore()).isEqualTo(3);
        assertThat(report.countAfter()).isEqualTo(2);
        assertThat(report.deleted()).isEqualTo(1);
        assertThat(report.belowFloor()).isEqualTo(1);
        assertThat(report.ceilingReached()).isTrue();
        assertThat(records.find(low.id())).isEmpty();
        assertThat(records.find(mid.id())).isPresent();
        assertThat(records.find(high.id())).isPresent();
    }

    @Test
    void cleanupIsANoOpWithinCapacity() {
        createWithRelevance("a", 0.1);
        createWithRelevance("b", 0.1);

        CleanupReport report = lifecycle.cleanupOldPrompts(false);

        assertThat(report.deleted()).isZero();
        assertThat(report.ceilingReached()).isFalse();
        assertThat(records.count()).isEqualTo(2);
    }

    @Test
    void protectedRecordsAreNeverEvicted() {
        createWithRelevance("p1", 0.95);
        createWithRelevance("p2", 0.85);
        createWithRelevance("p3", 0.8);
        configService.set(ConfigKeys.MAX_PROMPTS, "1");

        CleanupReport report = lifecycle.cleanupOldPrompts(false);

        assertThat(report.deleted()).isZero();
        assertThat(report.countAfter()).isEqualTo(3);
        assertThat(report.protectThreshold()).isEqualTo(0.8);
    }

    @Test
    void floorAboveProtectRaisesTheProtectThreshold() {
        configService.set(ConfigKeys.MIN_RELEVANCE_SCORE, "0.9");

        CleanupReport report = lifecycle.cleanupOldPrompts(true);

        assertThat(report.protectThreshold()).isEqualTo(0.9);
    }

    @Test
    void headroomEvictsBelowTheCeiling() {
        for (int i = 1; i <= 5; i++) createWithRelevance("r" + i, i / 10.0);
        configService.set(ConfigKeys.MAX_PROMPTS, "4");
        configService.set(ConfigKeys.CLEANUP_HEADROOM, "1");

        CleanupReport report = lifecycle.cleanupOldPrompts(false);

        assertThat(report.targetCount()).isEqualTo(3);
        assertThat(report.deleted()).isEqualTo(2);
        assertThat(records.count()).isEqualTo(3);
    }

    @Test
    void equalRelevanceEvictsOldestFirst() {
        PromptRecord oldest = createWithRelevance("oldest", 0.4);
        PromptRecord newer  = createWithRelevance("newer", 0.4);
        configService.set(ConfigKeys.MAX_PROMPTS, "1");

        lifecycle.cleanupOldPrompts(false);

        assertThat(records.find(oldest.id())).isEmpty();
        assertThat(records.find(newer.id())).isPresent();
    }

    @Test
    void dryRunReportsWithoutDeleting() {
        createWithRelevance("high", 0.9);
        createWithRelevance("mid", 0.5);
        PromptRecord low = createWithRelevance("low", 0.1);
        configService.set(ConfigKeys.MAX_PROMPTS, "2");

        CleanupReport report = lifecycle.cleanupOldPrompts(true);

        assertThat(report.dryRun()).isTrue();
        assertThat(report.deleted()).isEqualTo(1);
        assertThat(report.countAfter()).isEqualTo(3);
        assertThat(records.count()).isEqualTo(3);
        assertThat(records.find(low.id())).isPresent();
    }

    @Test
    void evictedRecordsTakeTheirEdgesWithThem() {
        PromptRecord keep = createWithRelevance("keep", 0.9);
        PromptRecord drop = createWithRelevance("drop", 0.1);
        relationships.addRelationship(keep.id(), drop.id(), RelationshipType.DERIVED_FROM, 0.5, null);
        configService.set(ConfigKeys.MAX_PROMPTS, "1");

        lifecycle.cleanupOldPrompts(false);

        assertThat(records.find(drop.id())).isEmpty();
        assertThat(relationships.count()).isZero();
    }

    @Test
    void relevanceDecaysWithAge() {
        PromptRecord r = createPrompt("aging");
        clock.advance(Duration.ofDays(30));

        int changed = lifecycle.updateRelevanceScores();

        assertThat(changed).isEqualTo(1);
        assertThat(records.get(r.id()).relevanceScore()).isCloseTo(0.35, within(1e-6));
        assertThat(lifecycle.updateRelevanceScores()).isZero();
    }

    @Test
    void maintenanceRecomputesThenEvicts() {
        PromptRecord x = createPrompt("x");
        PromptRecord y = createPrompt("y");
        PromptRecord z = createPrompt("z");
        for (int i = 0; i < 5; i++) records.recordUsage(z.id());
        configService.set(ConfigKeys.MAX_PROMPTS, "2");
        clock.advance(Duration.ofDays(60));

        MaintenanceReport report = lifecycle.runMaintenance(MaintenanceOptions.full());

        assertThat(report.dryRun()).isFalse();
        assertThat(report.relevanceUpdated()).isEqualTo(3);
        assertThat(report.cleanup().deleted()).isEqualTo(1);
        assertThat(records.find(x.id())).isEmpty();
        assertThat(records.find(y.id())).isPresent();
        assertThat(records.get(z.id()).relevanceScore()).isGreaterThan(records.get(y.id()).relevanceScore());
    }

    @Test
    void maintenanceDryRunLeavesEverythingUntouched() {
        PromptRecord x = createPrompt("x");
        createPrompt("y");
        configService.set(ConfigKeys.MAX_PROMPTS, "1");
        clock.advance(Duration.ofDays(90));

        MaintenanceReport report = lifecycle.runMaintenance(MaintenanceOptions.preview());

        assertThat(report.dryRun()).isTrue();
        assertThat(report.relevanceUpdated()).isEqualTo(2);
        assertThat(report.cleanup().deleted()).isEqualTo(1);
        assertThat(records.count()).isEqualTo(2);
        assertThat(records.get(x.id()).relevanceScore()).isEqualTo(1.0);
    }

    @Test
    void skippedStepsAreReportedAsNull() {
        MaintenanceReport report = lifecycle.runMaintenance(new MaintenanceOptions(false, true, false));

        assertThat(report.relevanceUpdated()).isNull();
        assertThat(report.cleanup()).isNotNull();
    }
}
