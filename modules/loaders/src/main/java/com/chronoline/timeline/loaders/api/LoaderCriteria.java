package com.chronoline.timeline.loaders.api;

import java.util.Locale;
import java.util.Set;

/**
 * Criteria for selecting the loader that reads a producer file.
 *
 * @param mimeTypes  MIME types to match (e.g., "application/json", "text/*")
 * @param extensions File extensions without dot (e.g., "json", "csv")
 * @param priority   Higher priority wins when several loaders match
 */
public record LoaderCriteria(
        Set<String> mimeTypes,
        Set<String> extensions,
        int priority
) {
    public LoaderCriteria {
        mimeTypes = Set.copyOf(mimeTypes);
        extensions = Set.copyOf(extensions);
    }

    /**
     * Checks if these criteria match the given input properties. MIME type
     * parameters such as {@code ;charset=UTF-8} are ignored.
     */
    public boolean matches(String mimeType, String filename) {
        if (mimeType != null) {
            String bare = mimeType.split(";")[0].trim().toLowerCase(Locale.ROOT);
            if (mimeTypes.contains(bare)) {
                return true;
            }
            String baseType = bare.split("/")[0];
            if (mimeTypes.contains(baseType + "/*")) {
                return true;
            }
        }

        if (filename != null) {
            int dotIndex = filename.lastIndexOf('.');
            if (dotIndex > 0) {
                String ext = filename.substring(dotIndex + 1).toLowerCase(Locale.ROOT);
                return extensions.contains(ext);
            }
        }

        return false;
    }
}
