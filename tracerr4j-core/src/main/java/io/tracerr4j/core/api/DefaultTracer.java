/*
 * Copyright (c) 2025 Tracerr4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.tracerr4j.core.api;

import io.tracerr4j.core.api.model.Frame;
import io.tracerr4j.core.capture.FrameCapturer;
import io.tracerr4j.core.error.MessageException;
import io.tracerr4j.core.error.TracedException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Stack depth matters here: every public method that captures calls {@link #trace(Throwable)}
 * directly, so the capturer sees exactly [trace, public method, caller] and the default skip
 * depth of 2 lands on the caller.
 */
@Slf4j
final class DefaultTracer implements Tracer {

    private final CaptureConfig config;
    private final FrameCapturer capturer;

    DefaultTracer(CaptureConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.capturer = new FrameCapturer(config);
    }

    @Override
    public CaptureConfig config() {
        return config;
    }

    @Override
    public TracedException newError(String message, Object... args) {
        String text = (args == null || args.length == 0) ? message : format(message, args);
        return trace(new MessageException(text));
    }

    @Override
    public TracedException errorf(String format, Object... args) {
        return trace(new MessageException(format(format, args)));
    }

    @Override
    public TracedException wrap(Throwable error) {
        if (error == null) return null;
        if (error instanceof TracedException traced) return traced;
        if (error instanceof HasStackTrace has) {
            Throwable underlying = has.unwrap();
            return new TracedException(underlying == null ? error : underlying, framesOf(has));
        }

        HasStackTrace inner = tracedCause(error);
        if (inner != null) {
            List<Frame> frames = framesOf(inner);
            log.trace("Reusing {} frames of traced cause for {}", frames.size(), error.getClass().getName());
            return new TracedException(error, frames);
        }
        return trace(error);
    }

    @Override
    public Throwable unwrap(Throwable error) {
        if (error == null) return null;
        if (error instanceof HasStackTrace has) return has.unwrap();
        return error;
    }

    @Override
    public TracedException customError(Throwable error, List<Frame> frames) {
        return new TracedException(error, frames);
    }

    @Override
    public List<Frame> stackTrace(Throwable error) {
        if (!(error instanceof HasStackTrace has)) return List.of();
        return framesOf(has);
    }

    @Override
    public String toString() {
        return "DefaultTracer" + config;
    }

    private TracedException trace(Throwable error) {
        List<Frame> frames = capturer.capture();
        if (log.isTraceEnabled()) {
            log.trace("Captured {} frames for {}", frames.size(), error.getClass().getName());
        }
        return new TracedException(error, frames);
    }

    /** First cause implementing {@link HasStackTrace} with frames; stops on a cycle. */
    private static HasStackTrace tracedCause(Throwable error) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.add(error);
        for (Throwable c = error.getCause(); c != null && seen.add(c); c = c.getCause()) {
            if (c instanceof HasStackTrace has && has.frames() != null) return has;
        }
        return null;
    }

    private static List<Frame> framesOf(HasStackTrace has) {
        List<Frame> frames = has.frames();
        return frames == null ? List.of() : frames;
    }

    /** Runs before {@link #trace(Throwable)}, so it never sits on the captured stack. */
    private static String format(String format, Object[] args) {
        try {
            return String.format(format, args);
        } catch (IllegalFormatException e) {
            log.debug("Keeping unformatted message '{}': {}", format, e.toString());
            return format;
        }
    }
}
