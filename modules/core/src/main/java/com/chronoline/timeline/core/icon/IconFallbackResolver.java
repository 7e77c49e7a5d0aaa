package com.chronoline.timeline.core.icon;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Optional;

/**
 * Picks a placeholder image for an event that has none: the category's own
 * icon, then its parent's ({@code parent.child} ids), then the configured
 * default category's.
 */
@ApplicationScoped
public class IconFallbackResolver {

    @Inject
    IconCatalog catalog;

    public Optional<String> resolve(String category) {
        if (category == null || category.isBlank()) {
            return defaultPlaceholder();
        }
        Optional<String> exact = catalog.placeholderFor(category);
        if (exact.isPresent()) {
            return exact;
        }
        int dot = category.indexOf('.');
        if (dot > 0) {
            Optional<String> parent = catalog.placeholderFor(category.substring(0, dot));
            if (parent.isPresent()) {
                return parent;
            }
        }
        return defaultPlaceholder();
    }

    private Optional<String> defaultPlaceholder() {
        return catalog.defaultCategory().flatMap(catalog::placeholderFor);
    }
}
