/*
 * Copyright (c) 2025 Tracerr4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.tracerr4j.core.error;

/** Plain error created by {@code newError}/{@code errorf}; the trace lives on the enclosing {@link TracedException}. */
public final class MessageException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public MessageException(String message) {
        super(message, null, false, false);
    }
}
