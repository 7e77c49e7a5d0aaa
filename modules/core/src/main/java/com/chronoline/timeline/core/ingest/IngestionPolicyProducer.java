package com.chronoline.timeline.core.ingest;

import com.chronoline.timeline.core.validate.SourceValidationMode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class IngestionPolicyProducer {

    private static final Logger log = Logger.getLogger(IngestionPolicyProducer.class);

    @ConfigProperty(name = "timeline.ingest.source-validation", defaultValue = "reject-event")
    SourceValidationMode sourceValidation;

    @ConfigProperty(name = "timeline.ingest.require-sources", defaultValue = "false")
    boolean requireSources;

    @ConfigProperty(name = "timeline.ingest.image-trust", defaultValue = "trust-supplied")
    ImageTrustPolicy imageTrust;

    @ConfigProperty(name = "timeline.ingest.skip-duplicate-titles", defaultValue = "false")
    boolean skipDuplicateTitles;

    @ConfigProperty(name = "timeline.ingest.error-display-limit", defaultValue = "10")
    int errorDisplayLimit;

    @Produces
    @Singleton
    public IngestionPolicy defaultPolicy() {
        IngestionPolicy policy = new IngestionPolicy(sourceValidation, requireSources, imageTrust,
                skipDuplicateTitles, false, errorDisplayLimit);
        log.infof("Default ingestion policy: %s", policy);
        return policy;
    }
}
