/*
 * Copyright (c) 2025 Tracerr4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.tracerr4j.spring;

import io.tracerr4j.core.api.CaptureConfig;
import java.util.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "tracerr4j")
public class TracerrProperties {

    private boolean enabled = true;
    private int frameCapacity = CaptureConfig.DEFAULT_FRAME_CAPACITY;
    private int skipDepth = CaptureConfig.DEFAULT_SKIP_DEPTH;

    @Setter(lombok.AccessLevel.NONE)
    private Print print = new Print();

    public void setPrint(Print print) {
        this.print = (print == null) ? new Print() : print;
    }

    // ---- nested: print ----
    public static final class Print {
        @Setter
        @Getter
        private int sourceBefore = 0;

        @Setter
        @Getter
        private int sourceAfter = 0;

        @Setter
        @Getter
        private boolean colorize = false;

        @Setter
        @Getter
        private int maxFrames = 0; // 0 = all

        private List<String> hidePackages = new ArrayList<>();
        private List<String> sourceRoots = new ArrayList<>(List.of("src/main/java", "src/test/java"));

        public List<String> getHidePackages() {
            return Collections.unmodifiableList(hidePackages);
        }

        public void setHidePackages(List<String> v) {
            this.hidePackages = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }

        public List<String> getSourceRoots() {
            return Collections.unmodifiableList(sourceRoots);
        }

        public void setSourceRoots(List<String> v) {
            this.sourceRoots = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }
    }
}
