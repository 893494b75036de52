/*
 * Copyright (c) 2025 Tracerr4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.tracerr4j.print;

import java.nio.file.Path;
import java.util.List;

/**
 * Rendering settings of a {@link TracePrinter}.
 *
 * @param sourceBefore source lines shown above each frame's line (0 together with {@code sourceAfter} = no source)
 * @param sourceAfter  source lines shown below each frame's line
 * @param colorize     emit ANSI escapes
 * @param maxFrames    frames to print at most, 0 = all
 * @param hidePackages function prefixes to omit (counted in the omitted-frames footer)
 * @param sourceRoots  directories relative frame paths are resolved against
 */
public record PrintOptions(
        int sourceBefore,
        int sourceAfter,
        boolean colorize,
        int maxFrames,
        List<String> hidePackages,
        List<Path> sourceRoots) {

    public static final List<Path> DEFAULT_SOURCE_ROOTS = List.of(Path.of("src/main/java"), Path.of("src/test/java"));

    public PrintOptions {
        sourceBefore = Math.max(0, sourceBefore);
        sourceAfter = Math.max(0, sourceAfter);
        maxFrames = Math.max(0, maxFrames);
        hidePackages = (hidePackages == null ? List.of() : List.copyOf(hidePackages));
        sourceRoots = (sourceRoots == null ? DEFAULT_SOURCE_ROOTS : List.copyOf(sourceRoots));
    }

    public static PrintOptions defaults() {
        return new PrintOptions(0, 0, false, 0, List.of(), DEFAULT_SOURCE_ROOTS);
    }

    public boolean showSource() {
        return sourceBefore > 0 || sourceAfter > 0;
    }

    public PrintOptions withSource(int before, int after) {
        return new PrintOptions(before, after, colorize, maxFrames, hidePackages, sourceRoots);
    }

    public PrintOptions withColorize(boolean colorize) {
        return new PrintOptions(sourceBefore, sourceAfter, colorize, maxFrames, hidePackages, sourceRoots);
    }

    public PrintOptions withMaxFrames(int maxFrames) {
        return new PrintOptions(sourceBefore, sourceAfter, colorize, maxFrames, hidePackages, sourceRoots);
    }

    public PrintOptions withHidePackages(List<String> hidePackages) {
        return new PrintOptions(sourceBefore, sourceAfter, colorize, maxFrames, hidePackages, sourceRoots);
    }

    public PrintOptions withSourceRoots(List<Path> sourceRoots) {
        return new PrintOptions(sourceBefore, sourceAfter, colorize, maxFrames, hidePackages, sourceRoots);
    }
}
