/*
 * Copyright (c) 2025 Tracerr4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.tracerr4j.core.api;

import io.tracerr4j.core.api.model.Frame;
import io.tracerr4j.core.error.TracedException;
import java.util.List;

/**
 * Static entry point backed by a process-wide {@link Tracer}.
 *
 * <p>The backing tracer is built on first use from {@link CaptureConfig#fromSystemProperties()}.
 * Changing {@value CaptureConfig#FRAME_CAPACITY_PROPERTY} or {@value CaptureConfig#SKIP_DEPTH_PROPERTY}
 * after that has no effect on it. Every static method here adds one frame, which the backing tracer
 * skips on top of the configured depth.</p>
 *
 * <pre>{@code
 * try {
 *     repository.save(order);
 * } catch (SQLException e) {
 *     throw Tracerr.wrap(e);
 * }
 * }</pre>
 */
public final class Tracerr {
    private Tracerr() {}

    private static final class Holder {
        private static final Tracer INSTANCE = Tracer.create(facadeConfig(CaptureConfig.fromSystemProperties()));
    }

    static CaptureConfig facadeConfig(CaptureConfig base) {
        return base.withSkipDepth(base.skipDepth() + 1);
    }

    /** Effective configuration of the backing tracer (its skip depth includes the facade frame). */
    public static CaptureConfig config() {
        return Holder.INSTANCE.config();
    }

    public static TracedException newError(String message, Object... args) {
        return Holder.INSTANCE.newError(message, args);
    }

    public static TracedException errorf(String format, Object... args) {
        return Holder.INSTANCE.errorf(format, args);
    }

    public static TracedException wrap(Throwable error) {
        return Holder.INSTANCE.wrap(error);
    }

    public static Throwable unwrap(Throwable error) {
        return Holder.INSTANCE.unwrap(error);
    }

    public static TracedException customError(Throwable error, List<Frame> frames) {
        return Holder.INSTANCE.customError(error, frames);
    }

    public static List<Frame> stackTrace(Throwable error) {
        return Holder.INSTANCE.stackTrace(error);
    }
}
