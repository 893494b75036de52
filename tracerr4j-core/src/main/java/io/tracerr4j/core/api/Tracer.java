/*
 * Copyright (c) 2025 Tracerr4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.tracerr4j.core.api;

import io.tracerr4j.core.api.model.Frame;
import io.tracerr4j.core.error.TracedException;
import java.util.List;

/**
 * Creates and wraps errors so that each carries the frames of the place it came from.
 *
 * <p>Use {@link Tracerr} for the process-wide default. Libraries that call a tracer through their own
 * helper method build one with {@link #create(CaptureConfig)} and a skip depth increased by the number
 * of helper frames, so the first captured frame is still their caller's call site.</p>
 */
public interface Tracer {

    /** Builds an independently configured tracer. */
    static Tracer create(CaptureConfig config) {
        return new DefaultTracer(config);
    }

    CaptureConfig config();

    /**
     * New error with the given message, formatted with {@link String#format} only when args are given.
     * A format that does not match its args leaves the message unformatted.
     */
    TracedException newError(String message, Object... args);

    /** New error with a {@link String#format}-formatted message; on a format mismatch the raw format is kept. */
    TracedException errorf(String format, Object... args);

    /**
     * Attaches a trace to {@code error}, reusing an existing one where possible.
     *
     * <ul>
     *   <li>{@code null} gives {@code null}.</li>
     *   <li>An error that already has a trace is returned as is.</li>
     *   <li>An error whose cause chain holds a traced error gets that error's frames.</li>
     *   <li>Anything else gets frames captured at the call site of this method.</li>
     * </ul>
     */
    TracedException wrap(Throwable error);

    /** The underlying error of a traced error, {@code error} itself otherwise, {@code null} for {@code null}. */
    Throwable unwrap(Throwable error);

    /** Builds a traced error from precomputed frames without capturing. */
    TracedException customError(Throwable error, List<Frame> frames);

    /** The frames of a traced error, an empty list for anything else including {@code null}. */
    List<Frame> stackTrace(Throwable error);
}
