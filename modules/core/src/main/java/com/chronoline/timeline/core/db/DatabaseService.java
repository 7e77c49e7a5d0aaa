package com.chronoline.timeline.core.db;

import com.chronoline.timeline.core.dao.DatabaseDao;
import com.chronoline.timeline.core.service.AbstractManagedService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.ConnectionException;
import org.jdbi.v3.core.Jdbi;

import java.sql.DatabaseMetaData;
import java.sql.SQLException;

/**
 * Root infrastructure service that gates access to the event store.
 * Starts eagerly at boot via {@code @Startup}, verifies connectivity,
 * and exposes {@link #jdbi()} only when RUNNING. After a connection failure
 * it stays FAILED until {@link #restart()} reaches the store again.
 */
@ApplicationScoped
@Startup
public class DatabaseService extends AbstractManagedService {

    @Inject
    Jdbi jdbi;

    private String storeVersion;

    @Override
    public String serviceId() {
        return "database";
    }

    @Override
    protected void doStart() throws Exception {
        jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping);
        storeVersion = jdbi.withHandle(h -> {
            DatabaseMetaData meta = h.getConnection().getMetaData();
            return meta.getDatabaseProductName() + " " + meta.getDatabaseProductVersion();
        });
        log.infof("Connected to: %s", storeVersion);
    }

    @Override
    protected void doStop() {
        log.info("DatabaseService stopping (Agroal manages pool shutdown)");
    }

    /** Returns the JDBI instance. Throws {@link StoreUnavailableException} if not RUNNING. */
    public Jdbi jdbi() {
        if (!isRunning()) {
            throw new StoreUnavailableException(
                    "DatabaseService is not running (state=" + state() + ")");
        }
        return jdbi;
    }

    /** Executes SELECT 1 to verify connectivity. Calls {@link #fail} on error. */
    public boolean ping() {
        try {
            jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping);
            return true;
        } catch (Exception e) {
            fail(e);
            return false;
        }
    }

    /**
     * Marks the service FAILED when {@code error} is a connection-level failure
     * and returns the exception callers should propagate. Returns {@code null}
     * for ordinary statement errors, which leave the store usable.
     */
    public StoreUnavailableException checkConnectionFailure(Throwable error) {
        if (!isConnectionFailure(error)) {
            return null;
        }
        fail(error);
        return new StoreUnavailableException("Event store unavailable: " + error.getMessage(), error);
    }

    /** Product name and version reported by the JDBC driver at startup. */
    public String storeVersion() {
        return storeVersion;
    }

    static boolean isConnectionFailure(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ConnectionException) {
                return true;
            }
            // SQLState class 08: connection exception
            if (t instanceof SQLException sql && sql.getSQLState() != null
                    && sql.getSQLState().startsWith("08")) {
                return true;
            }
        }
        return false;
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("DatabaseService failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping DatabaseService", e);
        }
    }
}
