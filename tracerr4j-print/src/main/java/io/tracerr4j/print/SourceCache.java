/*
 * Copyright (c) 2025 Tracerr4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.tracerr4j.print;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads source files once and keeps their lines; misses are cached too. */
final class SourceCache {
    private static final Logger log = LoggerFactory.getLogger(SourceCache.class);

    private final List<Path> roots;
    private final Map<String, Optional<List<String>>> files = new ConcurrentHashMap<>();

    SourceCache(List<Path> roots) {
        this.roots = List.copyOf(roots);
    }

    Optional<List<String>> lines(String path) {
        return files.computeIfAbsent(path, this::load);
    }

    private Optional<List<String>> load(String path) {
        final Path relative;
        try {
            relative = Path.of(path);
        } catch (InvalidPathException e) {
            log.debug("Not a file path: {}", path);
            return Optional.empty();
        }

        List<Path> candidates = relative.isAbsolute()
                ? List.of(relative)
                : roots.stream().map(r -> r.resolve(relative)).toList();
        for (Path c : candidates) {
            if (!Files.isRegularFile(c)) continue;
            try {
                return Optional.of(List.copyOf(Files.readAllLines(c, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                log.debug("Cannot read source file {}", c, e);
            }
        }
        log.debug("No readable source for {} under {}", path, roots);
        return Optional.empty();
    }
}
