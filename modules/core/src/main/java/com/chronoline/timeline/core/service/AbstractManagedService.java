package com.chronoline.timeline.core.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.event.Event;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

/**
 * Base class for the pipeline's {@link ManagedService}s.
 * <p>
 * Every transition fires a {@link ServiceStateChangedEvent}. A service will not
 * start while one of its {@code @DependsOn} targets is down, and a FAILED
 * service can be brought back with {@link #restart()}. Failure propagation and
 * recovery of dependents happen in {@link ServiceDependencyCascade}, outside
 * bean construction.
 */
public abstract class AbstractManagedService implements ManagedService {

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private final AtomicReference<Throwable> lastFailure = new AtomicReference<>();

    @Inject
    Event<ServiceStateChangedEvent> stateEvent;

    @Inject
    Instance<ManagedService> allServices;

    protected final Logger log = Logger.getLogger(getClass());

    protected abstract void doStart() throws Exception;

    protected abstract void doStop() throws Exception;

    @Override
    public State state() {
        return state.get();
    }

    @Override
    public void start() throws Exception {
        if (isRunning()) {
            return;
        }
        Optional<ManagedService> blocker = unavailableDependency();
        if (blocker.isPresent()) {
            throw new IllegalStateException("Cannot start '" + serviceId() + "': dependency '"
                    + blocker.get().serviceId() + "' is " + blocker.get().state());
        }

        transition(State.STARTING, null);
        try {
            doStart();
        } catch (Exception e) {
            fail(e);
            throw e;
        }
        lastFailure.set(null);
        transition(State.RUNNING, null);
    }

    @Override
    public void stop() throws Exception {
        if (state.get() == State.STOPPED) {
            return;
        }
        transition(State.STOPPING, null);
        try {
            doStop();
        } catch (Exception e) {
            fail(e);
            throw e;
        }
        transition(State.STOPPED, null);
    }

    @Override
    public void fail(Throwable cause) {
        State old = state.get();
        if (old == State.FAILED) {
            return;
        }
        lastFailure.set(cause);
        log.errorf("Service '%s' failed (was %s): %s", serviceId(), old, cause.getMessage());
        transition(State.FAILED, cause);
    }

    /**
     * Tries to bring a FAILED service back to RUNNING. Services in any other
     * state are left alone.
     *
     * @return whether the service is RUNNING afterwards
     */
    public boolean restart() {
        if (state.get() != State.FAILED) {
            return isRunning();
        }
        log.infof("Restarting service '%s'", serviceId());
        try {
            start();
        } catch (Exception e) {
            log.warnf("Service '%s' is still unavailable: %s", serviceId(), e.getMessage());
        }
        return isRunning();
    }

    /** The error behind the most recent failure, cleared once the service runs again. */
    public Optional<Throwable> lastFailure() {
        return Optional.ofNullable(lastFailure.get());
    }

    /** Sets state without firing events or lifecycle callbacks. Test use only. */
    public void forceState(State newState) {
        state.set(newState);
    }

    /** Returns the {@code @DependsOn} classes declared on this service. */
    public List<Class<? extends ManagedService>> getDependencies() {
        List<Class<? extends ManagedService>> deps = new ArrayList<>();
        for (DependsOn d : getClass().getAnnotationsByType(DependsOn.class)) {
            deps.add(d.value());
        }
        return deps;
    }

    /** Whether this service declares {@code @DependsOn} on {@code service}. */
    public boolean dependsOn(ManagedService service) {
        for (Class<? extends ManagedService> dep : getDependencies()) {
            if (dep.isInstance(service)) {
                return true;
            }
        }
        return false;
    }

    private void transition(State newState, Throwable cause) {
        State old = state.getAndSet(newState);
        log.infof("Service '%s': %s -> %s", serviceId(), old, newState);
        stateEvent.fire(new ServiceStateChangedEvent(serviceId(), old, newState, cause, Instant.now()));
    }

    private Optional<ManagedService> unavailableDependency() {
        for (ManagedService svc : allServices) {
            if (dependsOn(svc) && !svc.isRunning()) {
                return Optional.of(svc);
            }
        }
        return Optional.empty();
    }
}
