package com.chronoline.timeline.core.ingest;

import java.util.UUID;

public sealed interface IngestOutcome {

    record Created(UUID eventId, int sourcesCreated, boolean fallbackUsed) implements IngestOutcome {}

    record Rejected(RejectionKind kind, String reason) implements IngestOutcome {}

    record DryRun(String title) implements IngestOutcome {}

    static IngestOutcome created(UUID eventId, int sourcesCreated, boolean fallbackUsed) {
        return new Created(eventId, sourcesCreated, fallbackUsed);
    }

    static IngestOutcome rejected(RejectionKind kind, String reason) {
        return new Rejected(kind, reason);
    }

    static IngestOutcome dryRun(String title) {
        return new DryRun(title);
    }
}
