/*
 * Copyright (c) 2025 Tracerr4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.tracerr4j.core.error;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.tracerr4j.core.api.HasStackTrace;
import io.tracerr4j.core.api.model.Frame;
import java.util.List;
import java.util.Objects;

/**
 * An error paired with the frames captured where it was created or first wrapped.
 *
 * <p>The message is the underlying error's message, unchanged. The underlying error is also the
 * {@linkplain #getCause() cause}, so the JDK's cause-chain tooling sees it. The JDK stack trace of
 * this exception is the captured frame list; no second stack walk happens on construction.</p>
 */
public class TracedException extends RuntimeException implements HasStackTrace {
    private static final long serialVersionUID = 1L;

    private final List<Frame> frames;

    public TracedException(Throwable error, List<Frame> frames) {
        super(Objects.requireNonNull(error, "error").getMessage(), error);
        this.frames = List.copyOf(Objects.requireNonNull(frames, "frames"));
        setStackTrace(this.frames.stream().map(Frame::toStackTraceElement).toArray(StackTraceElement[]::new));
    }

    @Override
    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "frames is an immutable List.copyOf snapshot")
    public List<Frame> frames() {
        return frames;
    }

    @Override
    public Throwable unwrap() {
        return getCause();
    }

    /** The captured frames replace the JVM stack, so there is nothing to fill in. */
    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
