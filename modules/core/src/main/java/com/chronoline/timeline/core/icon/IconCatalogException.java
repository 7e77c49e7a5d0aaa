package com.chronoline.timeline.core.icon;

/**
 * Invalid icon configuration, such as a default category with no placeholder.
 */
public class IconCatalogException extends RuntimeException {

    public IconCatalogException(String message) {
        super(message);
    }

    public IconCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
