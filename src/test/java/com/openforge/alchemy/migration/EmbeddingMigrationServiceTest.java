package com.openforge.alchemy.migration;

import com.openforge.alchemy.StoreTestSupport;
import com.openforge.alchemy.prompt.PromptRecord;
import com.openforge.alchemy.settings.ConfigKeys;
import com.openforge.alchemy.store.StoreErrorKind;
import com.openforge.alchemy.store.StoreException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EmbeddingMigrationServiceTest extends StoreTestSupport {

    @Autowired
    private EmbeddingMigrationService migration;

    @Test
    void migratingToAnotherModelClearsEveryForeignVector() {
        List<PromptRecord> created = new ArrayList<>();
        for (int i = 0; i < 25; i++) created.add(createEmbedded("p" + i, "model-a", vector(1536, i)));

        MigrationReport report = migration.migrate("model-b", 768, 10);

        assertThat(report.cleared()).isEqualTo(25);
        assertThat(report.batches()).isEqualTo(3);
        assertThat(report.resumedFrom()).isNull();
        for (PromptRecord r : created) {
            PromptRecord after = records.get(r.id());
            assertThat(after.hasEmbedding()).isFalse();
            assertThat(after.embeddingModel()).isNull();
            assertThat(after.embeddingDimensions()).isNull();
            assertThat(after.embeddingProvider()).isNull();
        }
        assertThat(configService.find(ConfigKeys.MIGRATION_CHECKPOINT_TARGET)).isEmpty();
    }

    @Test
    void clearedRecordsShowUpInTheReembeddingQueue() {
        PromptRecord stale = createEmbedded("stale", "model-a", vector(4, 1));
        PromptRecord current = createEmbedded("current", "model-b", vector(2, 2));

        migration.migrate("model-b", 2, 10);

        assertThat(records.findWithoutEmbedding(null, 10))
                .extracting(PromptRecord::id)
                .containsExactly(stale.id())
                .doesNotContain(current.id());
    }

    @Test
    void vectorsAlreadyOnTargetAreKept() {
        PromptRecord onTarget = createEmbedded("keep", "model-b", vector(8, 1));
        PromptRecord sameModelOtherSize = createEmbedded("resize", "model-b", vector(4, 2));
        PromptRecord otherModel = createEmbedded("swap", "model-a", vector(8, 3));
        PromptRecord plain = createPrompt("plain");

        MigrationReport report = migration.migrate("model-b", 8, 0);

        assertThat(report.batchSize()).isEqualTo(EmbeddingMigrationService.DEFAULT_BATCH_SIZE);
        assertThat(report.cleared()).isEqualTo(2);
        assertThat(records.get(onTarget.id()).hasEmbedding()).isTrue();
        assertThat(records.get(sameModelOtherSize.id()).hasEmbedding()).isFalse();
        assertThat(records.get(otherModel.id()).hasEmbedding()).isFalse();
        assertThat(records.get(plain.id()).hasEmbedding()).isFalse();
    }

    @Test
    void secondRunIsANoOp() {
        for (int i = 0; i < 5; i++) createEmbedded("p" + i, "model-a", vector(4, i));
        createEmbedded("target", "model-b", vector(2, 9));

        migration.migrate("model-b", 2, 2);
        EmbeddingStats afterFirst = migration.getEmbeddingStats();
        MigrationReport second = migration.migrate("model-b", 2, 2);

        assertThat(second.cleared()).isZero();
        assertThat(second.batches()).isZero();
        assertThat(migration.getEmbeddingStats()).isEqualTo(afterFirst);
        assertThat(afterFirst.needsMigration("model-b", 2)).isFalse();
    }

    @Test
    void resumedRunConvergesOnTheSameEndStateAsAnUninterruptedOne() {
        List<PromptRecord> created = new ArrayList<>();
        for (int i = 0; i < 6; i++) created.add(createEmbedded("p" + i, "model-a", vector(4, i)));
        created.sort(Comparator.comparing(PromptRecord::id));
        String checkpoint = created.get(2).id();
        configService.set(ConfigKeys.MIGRATION_CHECKPOINT_TARGET, "model-b:4");
        configService.set(ConfigKeys.MIGRATION_CHECKPOINT_LAST_ID, checkpoint);

        MigrationReport resumed = migration.migrate("model-b", 4, 2);

        assertThat(resumed.resumedFrom()).isEqualTo(checkpoint);
        assertThat(resumed.cleared()).isEqualTo(6);
        for (PromptRecord r : created) {
            assertThat(records.get(r.id()).hasEmbedding()).isFalse();
        }
        assertThat(migration.needsMigration("model-b", 4)).isFalse();
        assertThat(configService.find(ConfigKeys.MIGRATION_CHECKPOINT_TARGET)).isEmpty();
        assertThat(configService.find(ConfigKeys.MIGRATION_CHECKPOINT_LAST_ID)).isEmpty();
        assertThat(migration.migrate("model-b", 4, 2).cleared()).isZero();
    }

    @Test
    void resumedRunClearsVectorsWrittenBelowTheCheckpoint() {
        for (int i = 0; i < 6; i++) createEmbedded("p" + i, "model-a", vector(2, i));
        migration.migrate("model-b", 2, 10);

        // an interrupted run left its checkpoint above every id, then a stale vector arrived
        configService.set(ConfigKeys.MIGRATION_CHECKPOINT_TARGET, "model-b:2");
        configService.set(ConfigKeys.MIGRATION_CHECKPOINT_LAST_ID, "ffffffff-ffff-ffff-ffff-ffffffffffff");
        PromptRecord late = createEmbedded("late", "model-a", vector(2, 42));

        MigrationReport resumed = migration.migrate("model-b", 2, 10);

        assertThat(resumed.resumedFrom()).isEqualTo("ffffffff-ffff-ffff-ffff-ffffffffffff");
        assertThat(resumed.cleared()).isEqualTo(1);
        assertThat(records.get(late.id()).hasEmbedding()).isFalse();
        assertThat(migration.needsMigration("model-b", 2)).isFalse();
        assertThat(configService.find(ConfigKeys.MIGRATION_CHECKPOINT_LAST_ID)).isEmpty();
    }

    @Test
    void checkpointOfAnotherTargetIsIgnored() {
        for (int i = 0; i < 3; i++) createEmbedded("p" + i, "model-a", vector(4, i));
        configService.set(ConfigKeys.MIGRATION_CHECKPOINT_TARGET, "model-z:16");
        configService.set(ConfigKeys.MIGRATION_CHECKPOINT_LAST_ID, "ffffffff");

        MigrationReport report = migration.migrate("model-b", 4, 10);

        assertThat(report.resumedFrom()).isNull();
        assertThat(report.cleared()).isEqualTo(3);
    }

    @Test
    void previewCountsWithoutClearing() {
        createEmbedded("a", "model-a", vector(4, 1));
        createEmbedded("b", "model-a", vector(4, 2));
        createEmbedded("c", "model-b", vector(4, 3));

        MigrationReport preview = migration.preview("model-b", 4);

        assertThat(preview.dryRun()).isTrue();
        assertThat(preview.cleared()).isEqualTo(2);
        assertThat(migration.getEmbeddingStats().withEmbeddings()).isEqualTo(3);
        assertThat(migration.needsMigration("model-b", 4)).isTrue();
    }

    @Test
    void statsDescribeCoverageAndModels() {
        createEmbedded("a", "model-a", vector(4, 1));
        createEmbedded("b", "model-a", vector(4, 2));
        createEmbedded("c", "model-b", vector(2, 3));
        createPrompt("d");

        EmbeddingStats stats = migration.getEmbeddingStats();

        assertThat(stats.total()).isEqualTo(4);
        assertThat(stats.withEmbeddings()).isEqualTo(3);
        assertThat(stats.coveragePercent()).isCloseTo(75.0, within(1e-9));
        assertThat(stats.models()).containsExactly(
                new EmbeddingStats.ModelCount("model-a", 4, 2),
                new EmbeddingStats.ModelCount("model-b", 2, 1));
        assertThat(stats.needsMigration("model-a", 4)).isTrue();
    }

    @Test
    void rejectsBadTargets() {
        assertThatThrownBy(() -> migration.migrate(" ", 8, 10))
                .isInstanceOf(StoreException.class)
                .satisfies(e -> assertThat(((StoreException) e).getKind()).isEqualTo(StoreErrorKind.INVALID_ARGUMENT));
        assertThatThrownBy(() -> migration.preview("model-b", 0))
                .isInstanceOf(StoreException.class);
    }

    private static float[] vector(int dims, int seed) {
        float[] v = new float[dims];
        for (int i = 0; i < dims; i++) v[i] = (float) Math.sin(seed + i + 1);
        return v;
    }
}
