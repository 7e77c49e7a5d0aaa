package com.chronoline.timeline.core.ingest;

import com.chronoline.timeline.core.validate.SourceValidationMode;

import java.util.Objects;

/**
 * Per-run ingestion switches. The configured defaults come from
 * {@link IngestionPolicyProducer}; callers derive variants with the
 * {@code with*} methods.
 */
public record IngestionPolicy(
        SourceValidationMode sourceValidation,
        boolean requireSources,
        ImageTrustPolicy imageTrust,
        boolean skipDuplicateTitles,
        boolean dryRun,
        int errorDisplayLimit
) {

    public static final int DEFAULT_ERROR_DISPLAY_LIMIT = 10;

    public IngestionPolicy {
        Objects.requireNonNull(sourceValidation, "sourceValidation");
        Objects.requireNonNull(imageTrust, "imageTrust");
        if (errorDisplayLimit < 0) {
            throw new IllegalArgumentException("errorDisplayLimit must be >= 0, got " + errorDisplayLimit);
        }
    }

    public static IngestionPolicy defaults() {
        return new IngestionPolicy(SourceValidationMode.REJECT_EVENT, false,
                ImageTrustPolicy.TRUST_SUPPLIED, false, false, DEFAULT_ERROR_DISPLAY_LIMIT);
    }

    public IngestionPolicy withSourceValidation(SourceValidationMode mode) {
        return new IngestionPolicy(mode, requireSources, imageTrust, skipDuplicateTitles, dryRun, errorDisplayLimit);
    }

    public IngestionPolicy withRequireSources(boolean require) {
        return new IngestionPolicy(sourceValidation, require, imageTrust, skipDuplicateTitles, dryRun, errorDisplayLimit);
    }

    public IngestionPolicy withImageTrust(ImageTrustPolicy trust) {
        return new IngestionPolicy(sourceValidation, requireSources, trust, skipDuplicateTitles, dryRun, errorDisplayLimit);
    }

    public IngestionPolicy withSkipDuplicateTitles(boolean skip) {
        return new IngestionPolicy(sourceValidation, requireSources, imageTrust, skip, dryRun, errorDisplayLimit);
    }

    public IngestionPolicy withDryRun(boolean dry) {
        return new IngestionPolicy(sourceValidation, requireSources, imageTrust, skipDuplicateTitles, dry, errorDisplayLimit);
    }
}
