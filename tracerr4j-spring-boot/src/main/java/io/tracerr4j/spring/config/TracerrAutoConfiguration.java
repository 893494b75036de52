/*
 * Copyright (c) 2025 Tracerr4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.tracerr4j.spring.config;

import io.tracerr4j.core.api.CaptureConfig;
import io.tracerr4j.core.api.Tracer;
import io.tracerr4j.print.PrintOptions;
import io.tracerr4j.print.TracePrinter;
import io.tracerr4j.spring.TracerrProperties;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(TracerrProperties.class)
@ConditionalOnProperty(prefix = "tracerr4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TracerrAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(Tracer.class)
    public Tracer tracer(TracerrProperties props) {
        var config = new CaptureConfig(props.getFrameCapacity(), props.getSkipDepth());
        log.debug("tracerr4j: capture config {}", config);
        return Tracer.create(config);
    }

    @Bean
    @ConditionalOnMissingBean(TracePrinter.class)
    public TracePrinter tracePrinter(TracerrProperties props) {
        var p = props.getPrint();
        var options = PrintOptions.defaults()
                .withSource(p.getSourceBefore(), p.getSourceAfter())
                .withColorize(p.isColorize())
                .withMaxFrames(p.getMaxFrames())
                .withHidePackages(p.getHidePackages())
                .withSourceRoots(p.getSourceRoots().stream().map(Path::of).toList());
        log.debug("tracerr4j: print options {}", options);
        return new TracePrinter(options);
    }
}
