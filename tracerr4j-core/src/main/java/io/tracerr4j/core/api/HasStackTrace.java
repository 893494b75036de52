/*
 * Copyright (c) 2025 Tracerr4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.tracerr4j.core.api;

import io.tracerr4j.core.api.model.Frame;
import java.util.List;

/**
 * Capability of an exception that already carries a captured trace.
 * {@link Tracer#wrap(Throwable)} never captures again for such an exception.
 */
public interface HasStackTrace {
    /** Captured frames, innermost first. Never null. */
    List<Frame> frames();

    /** The error the trace was attached to. */
    Throwable unwrap();
}
