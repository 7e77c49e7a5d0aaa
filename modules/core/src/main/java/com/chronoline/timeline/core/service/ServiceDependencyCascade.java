package com.chronoline.timeline.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Propagates lifecycle changes along {@code @DependsOn} edges. When a service
 * fails, every service depending on it fails too; when a failed service comes
 * back, its FAILED dependents are restarted.
 * <p>
 * Only services seen failing are tracked, so the RUNNING transitions of
 * the normal boot sequence never walk the bean graph.
 */
@ApplicationScoped
public class ServiceDependencyCascade {

    private static final Logger log = Logger.getLogger(ServiceDependencyCascade.class);

    private final Set<String> failedServices = ConcurrentHashMap.newKeySet();

    @Inject
    Instance<ManagedService> allServices;

    void onStateChanged(@Observes ServiceStateChangedEvent event) {
        if (event.isFailure()) {
            failedServices.add(event.serviceId());
            forEachDependent(event.serviceId(), dependent -> {
                log.warnf("Dependency '%s' failed, cascading failure to '%s'",
                        event.serviceId(), dependent.serviceId());
                dependent.fail(new IllegalStateException("Dependency '" + event.serviceId() + "' failed"));
            });
        } else if (event.isRunning() && failedServices.remove(event.serviceId())) {
            forEachDependent(event.serviceId(), dependent -> {
                if (dependent.state() == ManagedService.State.FAILED) {
                    log.infof("Dependency '%s' recovered, restarting '%s'",
                            event.serviceId(), dependent.serviceId());
                    dependent.restart();
                }
            });
        }
    }

    private void forEachDependent(String serviceId, Consumer<AbstractManagedService> action) {
        ManagedService source = find(serviceId);
        if (source == null) {
            return;
        }
        for (ManagedService svc : allServices) {
            if (svc instanceof AbstractManagedService && ((AbstractManagedService) svc).dependsOn(source)) {
                action.accept((AbstractManagedService) svc);
            }
        }
    }

    private ManagedService find(String serviceId) {
        for (ManagedService svc : allServices) {
            if (svc.serviceId().equals(serviceId)) {
                return svc;
            }
        }
        return null;
    }
}
