/*
 * Copyright (c) 2025 Tracerr4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.tracerr4j.core.api.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single call site of a captured trace.
 *
 * @param function fully qualified {@code ClassName.methodName}
 * @param path     source path derived from the package and file name, e.g. {@code com/acme/Orders.java}
 * @param line     line number as reported by the runtime (negative when unknown)
 */
public record Frame(String function, String path, int line) implements Serializable {
    public static final String UNKNOWN_SOURCE = "Unknown Source";

    public Frame {
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(path, "path");
    }

    public static Frame of(StackWalker.StackFrame f) {
        return new Frame(
                f.getClassName() + "." + f.getMethodName(), pathOf(f.getClassName(), f.getFileName()), f.getLineNumber());
    }

    public static Frame of(StackTraceElement el) {
        return new Frame(
                el.getClassName() + "." + el.getMethodName(),
                pathOf(el.getClassName(), el.getFileName()),
                el.getLineNumber());
    }

    /** Canonical rendering: {@code <path>:<line> <function>()}. */
    public String describe() {
        return path + ":" + line + " " + function + "()";
    }

    /** Converts back into a JDK element so {@link Throwable#printStackTrace()} shows this frame. */
    public StackTraceElement toStackTraceElement() {
        int dot = function.lastIndexOf('.');
        String className = dot > 0 ? function.substring(0, dot) : function;
        String methodName = dot > 0 ? function.substring(dot + 1) : "";
        String fileName = UNKNOWN_SOURCE.equals(path) ? null : path.substring(path.lastIndexOf('/') + 1);
        return new StackTraceElement(className, methodName, fileName, line);
    }

    @Override
    public String toString() {
        return describe();
    }

    private static String pathOf(String className, String fileName) {
        if (fileName == null) return UNKNOWN_SOURCE;
        int dot = className.lastIndexOf('.');
        if (dot < 0) return fileName; // default package
        return className.substring(0, dot).replace('.', '/') + "/" + fileName;
    }
}
