package com.mimecast.courier.metrics;

import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

/**
 * Global access to the metric registry for components without a wiring path to the endpoint.
 */
public final class MetricsRegistry {
    private static volatile PrometheusMeterRegistry prometheusRegistry;

    /**
     * Private constructor for utility class.
     */
    private MetricsRegistry() {
    }

    /**
     * Register the metric registry.
     *
     * @param prom Prometheus registry, null to unregister.
     */
    public static void register(PrometheusMeterRegistry prom) {
        prometheusRegistry = prom;
    }

    /**
     * Get the Prometheus registry.
     *
     * @return Prometheus registry, null if none registered.
     */
    public static PrometheusMeterRegistry getPrometheusRegistry() {
        return prometheusRegistry;
    }
}
