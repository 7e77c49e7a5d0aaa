package com.chronoline.timeline.core.health;

import com.chronoline.timeline.core.db.DatabaseService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness of the event store. A FAILED store is restarted on every check,
 * so readiness returns once the database is reachable again.
 */
@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    @Inject
    DatabaseService databaseService;

    @Override
    public HealthCheckResponse call() {
        if (!databaseService.isRunning()) {
            databaseService.restart();
        }
        if (databaseService.isRunning() && databaseService.ping()) {
            return HealthCheckResponse.named("database")
                    .up()
                    .withData("version", databaseService.storeVersion())
                    .build();
        }
        HealthCheckResponseBuilder down = HealthCheckResponse.named("database")
                .down()
                .withData("state", databaseService.state().name());
        databaseService.lastFailure()
                .ifPresent(e -> down.withData("error", String.valueOf(e.getMessage())));
        return down.build();
    }
}
