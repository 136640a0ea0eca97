package net.findmycard.service.image;

/**
 * When a background image preload may start.
 */
public enum PreloadPriority {
    /** Submitted to the preload executor right away. */
    IMMEDIATE,
    /** Submitted after the configured deferral delay. */
    DEFERRED
}
