/*
 * Copyright (c) 2025 Tracerr4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.tracerr4j.core.capture;

import io.tracerr4j.core.api.CaptureConfig;
import io.tracerr4j.core.api.model.Frame;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Walks the current thread's stack and records it as {@link Frame}s, innermost first.
 *
 * <p>The capturer's own frame is always dropped; {@link CaptureConfig#skipDepth()} further frames
 * are dropped after it. With a skip depth of 0 the first recorded frame is the direct caller of
 * {@link #capture()}.</p>
 */
public final class FrameCapturer {
    private static final StackWalker WALKER = StackWalker.getInstance();
    /** Upper bound on the pre-sized list; the capacity is only a hint. */
    static final int MAX_PRESIZE = 1024;

    private final int frameCapacity;
    private final int skipDepth;

    public FrameCapturer(CaptureConfig config) {
        Objects.requireNonNull(config, "config");
        this.frameCapacity = config.frameCapacity();
        this.skipDepth = config.skipDepth();
    }

    /** Never fails; a skip deeper than the stack yields an empty list. */
    public List<Frame> capture() {
        return WALKER.walk(frames -> frames.skip(1L + skipDepth)
                .map(Frame::of)
                .collect(Collectors.toCollection(() -> new ArrayList<>(Math.min(frameCapacity, MAX_PRESIZE)))));
    }
}
