/**
 * Closed enumerations shared across all timeline modules.
 *
 * <p>Labels are the lowercase wire values producers send and the store keeps.
 * This module has no dependencies.
 */
package com.chronoline.timeline.types;
