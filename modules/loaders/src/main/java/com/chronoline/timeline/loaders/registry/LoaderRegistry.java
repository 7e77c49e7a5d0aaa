package com.chronoline.timeline.loaders.registry;

import com.chronoline.timeline.loaders.api.EventLoader;
import com.chronoline.timeline.loaders.api.InputContext;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import java.util.Comparator;
import java.util.Optional;
import java.util.stream.StreamSupport;

/**
 * Matches producer inputs to loaders.
 * All {@link EventLoader} beans are discovered via CDI.
 */
@ApplicationScoped
public class LoaderRegistry {

    @Inject
    Instance<EventLoader> loaders;

    /**
     * Returns the highest-priority loader whose criteria match the input's
     * MIME type or file extension.
     */
    public Optional<EventLoader> findLoader(InputContext context) {
        String mimeType = context.mimeType().orElse(null);
        String filename = context.filename();

        return StreamSupport.stream(loaders.spliterator(), false)
                .filter(l -> l.getCriteria().matches(mimeType, filename))
                .max(Comparator.comparingInt(l -> l.getCriteria().priority()));
    }
}
