package com.chronoline.timeline.core.health;

import com.chronoline.timeline.core.icon.IconCatalog;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Reports the icon catalog's state. An empty catalog is still UP: events then
 * keep a null image when none is supplied.
 */
@Readiness
@ApplicationScoped
public class IconCatalogHealthCheck implements HealthCheck {

    @Inject
    IconCatalog catalog;

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named("icon-catalog")
                .status(catalog.isRunning())
                .withData("placeholders", catalog.size())
                .withData("state", catalog.state().name())
                .build();
    }
}
