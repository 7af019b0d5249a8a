/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenTelemetry tracing for the coarse controller operations: loading the regression
 * forest and requesting a restart. Node events are never traced.
 *
 * <p>Read from environment variables, then system properties:
 * <ul>
 *   <li>{@code ARBOR_TRACING_ENABLED}: {@code true} to export spans (default {@code false})</li>
 *   <li>{@code ARBOR_TRACE_SAMPLING_RATIO}: 0.0 to 1.0 (default 1.0)</li>
 *   <li>{@code SERVICE_NAME}: resource name (default {@code arbor-restart})</li>
 * </ul>
 * Enabled spans go to the logging exporter.
 */
public final class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_SCOPE = "com.arbor.restart";
    private static final String DEFAULT_SERVICE = "arbor-restart";
    private static final AttributeKey<String> SERVICE_NAME_KEY = AttributeKey.stringKey("service.name");

    private final OpenTelemetry telemetry;
    private final Tracer tracer;
    private final SdkTracerProvider sdkProvider;

    private TracingService(OpenTelemetry telemetry, SdkTracerProvider sdkProvider) {
        this.telemetry = telemetry;
        this.sdkProvider = sdkProvider;
        this.tracer = telemetry.getTracer(INSTRUMENTATION_SCOPE);
    }

    private static final class Holder {
        static final TracingService SHARED = create();
    }

    /**
     * Process-wide service, created on first call.
     */
    public static TracingService getInstance() {
        return Holder.SHARED;
    }

    /**
     * Service whose tracer drops every span.
     */
    public static TracingService noop() {
        return new TracingService(OpenTelemetry.noop(), null);
    }

    private static TracingService create() {
        if (!Boolean.parseBoolean(setting("ARBOR_TRACING_ENABLED", "false"))) {
            logger.fine("Restart tracing disabled");
            return noop();
        }
        try {
            Resource resource = Resource.getDefault().merge(Resource.create(
                    Attributes.of(SERVICE_NAME_KEY, setting("SERVICE_NAME", DEFAULT_SERVICE))));
            SdkTracerProvider provider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .setSampler(Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(samplingRatio())).build())
                    .addSpanProcessor(BatchSpanProcessor.builder(LoggingSpanExporter.create())
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .build())
                    .build();

            TracingService service = new TracingService(
                    OpenTelemetrySdk.builder().setTracerProvider(provider).build(), provider);
            Runtime.getRuntime().addShutdownHook(new Thread(service::shutdown, "arbor-tracing-shutdown"));
            logger.info("Restart tracing enabled, spans go to the logging exporter");
            return service;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Could not set up OpenTelemetry, restart tracing disabled", e);
            return noop();
        }
    }

    private static double samplingRatio() {
        String raw = setting("ARBOR_TRACE_SAMPLING_RATIO", "1.0");
        try {
            return Math.max(0.0, Math.min(1.0, Double.parseDouble(raw)));
        } catch (NumberFormatException e) {
            logger.warning("Ignoring ARBOR_TRACE_SAMPLING_RATIO=" + raw + ", sampling every trace");
            return 1.0;
        }
    }

    /**
     * Flushes buffered spans. Does nothing for the no-op service.
     */
    public void shutdown() {
        if (sdkProvider == null) {
            return;
        }
        try {
            sdkProvider.shutdown().join(10, TimeUnit.SECONDS);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Restart tracing did not shut down cleanly", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return telemetry;
    }

    public boolean isEnabled() {
        return sdkProvider != null;
    }

    private static String setting(String key, String fallback) {
        String env = System.getenv(key);
        return env != null && !env.isEmpty() ? env : System.getProperty(key, fallback);
    }
}
