/**
 * Shared utilities for all timeline modules.
 *
 * <p>Contains {@link com.chronoline.timeline.util.Coercion} (loose value to number/text)
 * and {@link com.chronoline.timeline.util.GeoPoint}. No framework dependencies, only Jackson's tree model.
 */
package com.chronoline.timeline.util;
