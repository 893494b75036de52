/*
 * Copyright (c) 2025 Tracerr4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.tracerr4j.core.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable capture settings of a {@link Tracer}.
 *
 * @param frameCapacity initial size of the frame list; deeper stacks are still recorded in full
 * @param skipDepth     frames skipped above the capturer's own frame before recording starts
 */
public record CaptureConfig(int frameCapacity, int skipDepth) {
    public static final int DEFAULT_FRAME_CAPACITY = 20;
    public static final int DEFAULT_SKIP_DEPTH = 2;

    public static final String FRAME_CAPACITY_PROPERTY = "tracerr4j.frameCapacity";
    public static final String SKIP_DEPTH_PROPERTY = "tracerr4j.skipDepth";

    private static final Logger log = LoggerFactory.getLogger(CaptureConfig.class);

    public CaptureConfig {
        if (frameCapacity < 0) throw new IllegalArgumentException("frameCapacity must be >= 0: " + frameCapacity);
        if (skipDepth < 0) throw new IllegalArgumentException("skipDepth must be >= 0: " + skipDepth);
    }

    public static CaptureConfig defaults() {
        return new CaptureConfig(DEFAULT_FRAME_CAPACITY, DEFAULT_SKIP_DEPTH);
    }

    /**
     * Reads {@value #FRAME_CAPACITY_PROPERTY} and {@value #SKIP_DEPTH_PROPERTY}, falling back to the
     * defaults for missing, malformed or negative values. The result is a snapshot: later changes to the
     * system properties do not affect it.
     */
    public static CaptureConfig fromSystemProperties() {
        return new CaptureConfig(
                intProperty(FRAME_CAPACITY_PROPERTY, DEFAULT_FRAME_CAPACITY),
                intProperty(SKIP_DEPTH_PROPERTY, DEFAULT_SKIP_DEPTH));
    }

    public CaptureConfig withFrameCapacity(int frameCapacity) {
        return new CaptureConfig(frameCapacity, skipDepth);
    }

    public CaptureConfig withSkipDepth(int skipDepth) {
        return new CaptureConfig(frameCapacity, skipDepth);
    }

    private static int intProperty(String name, int fallback) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            int value = Integer.parseInt(raw.trim());
            if (value >= 0) return value;
            log.warn("Ignoring negative {}={}, using {}", name, raw, fallback);
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed {}={}, using {}", name, raw, fallback);
        }
        return fallback;
    }
}
