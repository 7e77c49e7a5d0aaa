package com.chronoline.timeline.api;

import com.chronoline.timeline.core.batch.IngestionAbortedException;
import com.chronoline.timeline.core.ingest.IngestionPolicy;
import com.chronoline.timeline.loaders.api.LoadException;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.Map;

public final class IngestExceptionMappers {

    private static final Logger log = Logger.getLogger(IngestExceptionMappers.class);

    private IngestExceptionMappers() {}

    /** Unreadable or wrongly shaped payload. */
    @Provider
    public static class LoadFailed implements ExceptionMapper<LoadException> {

        @Override
        public Response toResponse(LoadException e) {
            log.warnf("Rejected ingest payload: %s", e.getMessage());
            return Response.status(Response.Status.BAD_REQUEST)
                    .type(MediaType.APPLICATION_JSON)
                    .entity(Map.of("error", e.getMessage()))
                    .build();
        }
    }

    /** Store went away mid-run; report what was committed before the abort. */
    @Provider
    public static class Aborted implements ExceptionMapper<IngestionAbortedException> {

        @Inject
        IngestionPolicy defaultPolicy;

        @Override
        public Response toResponse(IngestionAbortedException e) {
            log.errorf("Ingest run aborted: %s", e.getMessage());
            IngestResponse body = IngestResponse.from(
                    e.partial().summary(defaultPolicy.errorDisplayLimit()), true);
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .type(MediaType.APPLICATION_JSON)
                    .entity(body)
                    .build();
        }
    }
}
