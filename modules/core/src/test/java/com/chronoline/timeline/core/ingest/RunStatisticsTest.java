package com.chronoline.timeline.core.ingest;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RunStatisticsTest {

    @Test
    void shouldCountCreatedEventsAndSources() {
        RunStatistics stats = new RunStatistics();
        stats.recordCreated(3);
        stats.recordCreated(0);

        Statistics snapshot = stats.snapshot();

        assertThat(snapshot.eventsCreated()).isEqualTo(2);
        assertThat(snapshot.sourcesCreated()).isEqualTo(3);
        assertThat(snapshot.errors()).isEmpty();
    }

    @Test
    void shouldSplitRejectsByKindButCountAllAsSkipped() {
        RunStatistics stats = new RunStatistics();
        stats.recordRejected(RejectionKind.STRUCTURAL, "Missing required field: title");
        stats.recordRejected(RejectionKind.REFERENTIAL, "Category 'x' not found in registry");
        stats.recordRejected(RejectionKind.REFERENTIAL, "Category 'y' not found in registry");
        stats.recordRejected(RejectionKind.PERSISTENCE, "Database error");

        Statistics snapshot = stats.snapshot();

        assertThat(snapshot.eventsSkipped()).isEqualTo(4);
        assertThat(snapshot.structuralRejects()).isEqualTo(1);
        assertThat(snapshot.referentialRejects()).isEqualTo(2);
        assertThat(snapshot.persistenceFailures()).isEqualTo(1);
        assertThat(snapshot.errors()).first().isEqualTo("Missing required field: title");
    }

    @Test
    void shouldKeepSnapshotsIndependent() {
        RunStatistics stats = new RunStatistics();
        stats.recordFallback();
        Statistics before = stats.snapshot();

        stats.recordFallback();
        stats.recordDuplicate("Moon landing");
        stats.recordDryRun();

        assertThat(before.fallbacksApplied()).isEqualTo(1);
        assertThat(before.errors()).isEmpty();
        assertThat(stats.snapshot().fallbacksApplied()).isEqualTo(2);
        assertThat(stats.snapshot().duplicatesSkipped()).isEqualTo(1);
        assertThat(stats.snapshot().dryRunAccepted()).isEqualTo(1);
    }
}
