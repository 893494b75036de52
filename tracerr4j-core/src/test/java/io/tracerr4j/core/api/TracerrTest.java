/*
 * Copyright (c) 2025 Tracerr4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.tracerr4j.core.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tracerr4j.core.api.model.Frame;
import io.tracerr4j.core.error.TracedException;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

class TracerrTest {
    private static final String THIS = TracerrTest.class.getName();

    @Test
    void facadeCapturesAtTheCallerNotAtItself() {
        int expectedLine = new Throwable().getStackTrace()[0].getLineNumber() + 1;
        TracedException e = Tracerr.newError("boom");

        Frame top = Tracerr.stackTrace(e).get(0);
        assertEquals(THIS + ".facadeCapturesAtTheCallerNotAtItself", top.function());
        assertEquals("io/tracerr4j/core/api/TracerrTest.java", top.path());
        assertEquals(expectedLine, top.line());
    }

    @Test
    void facadeWrapAndErrorfCaptureAtTheCaller() {
        assertEquals(THIS + ".facadeWrapAndErrorfCaptureAtTheCaller",
                Tracerr.wrap(new IOException("x")).frames().get(0).function());
        assertEquals(THIS + ".facadeWrapAndErrorfCaptureAtTheCaller",
                Tracerr.errorf("%s", "x").frames().get(0).function());
    }

    @Test
    void facadeFollowsTheWrapProtocol() {
        TracedException inner = Tracerr.newError("boom");
        TracedException outer = Tracerr.wrap(new IllegalStateException("while starting", inner));

        assertEquals(Tracerr.stackTrace(inner), Tracerr.stackTrace(outer));
        assertSame(inner, Tracerr.wrap(inner));
        assertNull(Tracerr.wrap(null));
        assertNull(Tracerr.unwrap(null));
        assertTrue(Tracerr.stackTrace(null).isEmpty());

        List<Frame> frames = List.of(new Frame("main.f", "a.go", 10));
        IOException io = new IOException("custom");
        assertEquals(frames, Tracerr.stackTrace(Tracerr.customError(io, frames)));
        assertSame(io, Tracerr.unwrap(Tracerr.customError(io, frames)));
    }

    @Test
    void facadeSkipsOneExtraFrame() {
        assertEquals(new CaptureConfig(20, 3), Tracerr.facadeConfig(CaptureConfig.defaults()));
    }

    @Test
    void laterPropertyChangesDoNotReachTheDefaultTracer() {
        CaptureConfig before = Tracerr.config();
        try {
            System.setProperty(CaptureConfig.SKIP_DEPTH_PROPERTY, "9");
            System.setProperty(CaptureConfig.FRAME_CAPACITY_PROPERTY, "1");
            assertEquals(before, Tracerr.config());
            assertEquals(THIS + ".laterPropertyChangesDoNotReachTheDefaultTracer",
                    Tracerr.newError("still here").frames().get(0).function());
        } finally {
            System.clearProperty(CaptureConfig.SKIP_DEPTH_PROPERTY);
            System.clearProperty(CaptureConfig.FRAME_CAPACITY_PROPERTY);
        }
    }
}
