package com.chronoline.timeline.core.category;

import com.chronoline.timeline.core.dao.CategoryDao;
import com.chronoline.timeline.core.dao.CategoryRecord;
import com.chronoline.timeline.core.db.DatabaseService;
import com.chronoline.timeline.core.db.StoreUnavailableException;
import com.chronoline.timeline.core.service.AbstractManagedService;
import com.chronoline.timeline.core.service.DependsOn;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Optional;

/**
 * {@link CategoryRegistry} backed by the {@code categories} table. Each lookup
 * goes to the store, so categories added by a migration are visible without
 * a restart.
 */
@ApplicationScoped
@Startup
@DependsOn(DatabaseService.class)
public class JdbiCategoryRegistry extends AbstractManagedService implements CategoryRegistry {

    @Inject
    DatabaseService databaseService;

    @Override
    public String serviceId() {
        return "category-registry";
    }

    @Override
    protected void doStart() {
        int count = databaseService.jdbi().withExtension(CategoryDao.class, CategoryDao::count);
        log.infof("Category registry ready: %d categories", count);
        if (count == 0) {
            log.warn("Category table is empty; every event will be rejected as referential");
        }
    }

    @Override
    protected void doStop() {
        log.info("Category registry stopping");
    }

    @Override
    public Optional<CategoryRecord> find(String categoryId) {
        if (categoryId == null) {
            return Optional.empty();
        }
        if (!isRunning()) {
            throw new StoreUnavailableException(
                    "Category registry is not running (state=" + state() + ")");
        }
        return databaseService.jdbi().withExtension(CategoryDao.class, dao -> dao.findById(categoryId));
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("Category registry failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping category registry", e);
        }
    }
}
