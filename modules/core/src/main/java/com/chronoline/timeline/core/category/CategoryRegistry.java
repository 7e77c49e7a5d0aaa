package com.chronoline.timeline.core.category;

import com.chronoline.timeline.core.dao.CategoryRecord;

import java.util.Optional;

/**
 * Read-only view of the configured category hierarchy. Events may only
 * reference leaf categories this registry knows.
 */
public interface CategoryRegistry {

    /** Looks up any node of the hierarchy, leaf or not. */
    Optional<CategoryRecord> find(String categoryId);

    /** Whether {@code categoryId} names a known leaf category. */
    default boolean exists(String categoryId) {
        return find(categoryId).map(CategoryRecord::leaf).orElse(false);
    }
}
