package com.chronoline.timeline.core.ingest;

import com.chronoline.timeline.core.validate.SourceValidationMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class IngestionPolicyTest {

    @Test
    void defaultsRejectEventsWithBadSourcesAndTrustImages() {
        IngestionPolicy policy = IngestionPolicy.defaults();

        assertThat(policy.sourceValidation()).isEqualTo(SourceValidationMode.REJECT_EVENT);
        assertThat(policy.imageTrust()).isEqualTo(ImageTrustPolicy.TRUST_SUPPLIED);
        assertThat(policy.requireSources()).isFalse();
        assertThat(policy.dryRun()).isFalse();
        assertThat(policy.skipDuplicateTitles()).isFalse();
        assertThat(policy.errorDisplayLimit()).isEqualTo(10);
    }

    @Test
    void withersChangeOnlyTheirField() {
        IngestionPolicy policy = IngestionPolicy.defaults()
                .withDryRun(true)
                .withSourceValidation(SourceValidationMode.SKIP_SOURCE);

        assertThat(policy.dryRun()).isTrue();
        assertThat(policy.sourceValidation()).isEqualTo(SourceValidationMode.SKIP_SOURCE);
        assertThat(policy.imageTrust()).isEqualTo(ImageTrustPolicy.TRUST_SUPPLIED);
        assertThat(IngestionPolicy.defaults().dryRun()).isFalse();
    }

    @Test
    void rejectsNegativeDisplayLimit() {
        assertThatThrownBy(() -> new IngestionPolicy(SourceValidationMode.REJECT_EVENT, false,
                ImageTrustPolicy.TRUST_SUPPLIED, false, false, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void contextDefaultsBlankActor() {
        IngestionContext ctx = IngestionContext.start(" ", IngestionPolicy.defaults());

        assertThat(ctx.actor()).isEqualTo(IngestionContext.DEFAULT_ACTOR);
        assertThat(ctx.statistics().snapshot()).isEqualTo(Statistics.empty());
    }
}
