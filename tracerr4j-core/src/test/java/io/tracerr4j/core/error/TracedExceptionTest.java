/*
 * Copyright (c) 2025 Tracerr4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.tracerr4j.core.error;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tracerr4j.core.api.model.Frame;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TracedExceptionTest {

    private static final List<Frame> FRAMES = List.of(
            new Frame("com.acme.Repo.save", "com/acme/Repo.java", 31),
            new Frame("com.acme.Service.handle", "com/acme/Service.java", 12));

    @Test
    void messageAndCauseComeFromTheUnderlyingError() {
        SQLException sql = new SQLException("duplicate key");
        TracedException e = new TracedException(sql, FRAMES);

        assertEquals("duplicate key", e.getMessage());
        assertSame(sql, e.getCause());
        assertSame(sql, e.unwrap());
    }

    @Test
    void jdkStackTraceIsTheCapturedFrames() {
        TracedException e = new TracedException(new SQLException("x"), FRAMES);

        StackTraceElement[] expected = FRAMES.stream().map(Frame::toStackTraceElement).toArray(StackTraceElement[]::new);
        assertArrayEquals(expected, e.getStackTrace());

        StringWriter out = new StringWriter();
        e.printStackTrace(new PrintWriter(out));
        assertTrue(out.toString().contains("at com.acme.Repo.save(Repo.java:31)"), out.toString());
    }

    @Test
    void framesAreAnImmutableSnapshot() {
        List<Frame> source = new ArrayList<>(FRAMES);
        TracedException e = new TracedException(new SQLException("x"), source);
        source.clear();

        assertEquals(FRAMES, e.frames());
        assertThrows(UnsupportedOperationException.class, () -> e.frames().add(FRAMES.get(0)));
    }

    @Test
    void nullMessageIsKept() {
        assertNull(new TracedException(new IllegalStateException(), FRAMES).getMessage());
    }

    @Test
    void messageExceptionHasNoStackOfItsOwn() {
        assertEquals(0, new MessageException("plain").getStackTrace().length);
    }
}
