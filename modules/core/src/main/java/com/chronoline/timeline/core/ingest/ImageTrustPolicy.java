package com.chronoline.timeline.core.ingest;

/**
 * How a producer-supplied {@code image_url} is treated.
 */
public enum ImageTrustPolicy {
    /** Keep the supplied URL as-is, without any reachability check. */
    TRUST_SUPPLIED,
    /** Ignore supplied URLs and always use the category placeholder. */
    PLACEHOLDER_ONLY
}
