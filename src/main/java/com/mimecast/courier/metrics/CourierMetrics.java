package com.mimecast.courier.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Approval forwarding Micrometer metrics.
 *
 * <p>Counters for received events, sent, skipped and failed approvals, and attachment downloads.
 * <br>Calls are no-ops while no registry is registered.
 */
public final class CourierMetrics {
    private static final Logger log = LogManager.getLogger(CourierMetrics.class);

    static final String EVENTS_RECEIVED = "courier.events.received";
    static final String APPROVALS_SENT = "courier.approvals.sent";
    static final String APPROVALS_SKIPPED = "courier.approvals.skipped";
    static final String APPROVALS_FAILED = "courier.approvals.failed";
    static final String ATTACHMENTS_DOWNLOADED = "courier.attachments.downloaded";
    static final String ATTACHMENTS_FAILED = "courier.attachments.failed";

    /**
     * Private constructor for utility class.
     */
    private CourierMetrics() {
    }

    /**
     * Initialize untagged counters with zero values.
     * <p>This should be called during application startup so they show up before any traffic.
     */
    public static void initialize() {
        MeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
        if (registry == null) {
            log.warn("Cannot initialize metrics - Prometheus registry is null");
            return;
        }

        counter(registry, EVENTS_RECEIVED, "Number of webhook events received");
        counter(registry, APPROVALS_SENT, "Number of approvals forwarded by mail");
        counter(registry, ATTACHMENTS_DOWNLOADED, "Number of attachments downloaded");
        counter(registry, ATTACHMENTS_FAILED, "Number of attachment downloads failed");
        log.info("Courier metrics initialized");
    }

    /**
     * Increment the events received counter.
     */
    public static void incrementEventsReceived() {
        increment(EVENTS_RECEIVED, "Number of webhook events received");
    }

    /**
     * Increment the approvals sent counter.
     */
    public static void incrementApprovalsSent() {
        increment(APPROVALS_SENT, "Number of approvals forwarded by mail");
    }

    /**
     * Increment the approvals skipped counter.
     *
     * @param reason Skip reason.
     */
    public static void incrementApprovalsSkipped(String reason) {
        increment(APPROVALS_SKIPPED, "Number of approvals not forwarded", "reason", reason);
    }

    /**
     * Increment the approvals failed counter.
     *
     * @param exceptionType The simple name of the exception class.
     */
    public static void incrementApprovalsFailed(String exceptionType) {
        increment(APPROVALS_FAILED, "Number of approvals failed with an exception", "exception_type", exceptionType);
    }

    /**
     * Increment the attachments downloaded counter.
     */
    public static void incrementAttachmentsDownloaded() {
        increment(ATTACHMENTS_DOWNLOADED, "Number of attachments downloaded");
    }

    /**
     * Increment the attachments failed counter.
     */
    public static void incrementAttachmentsFailed() {
        increment(ATTACHMENTS_FAILED, "Number of attachment downloads failed");
    }

    private static void increment(String name, String description, String... tags) {
        try {
            MeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
            if (registry != null) {
                counter(registry, name, description, tags).increment();
            }
        } catch (Exception e) {
            log.warn("Failed to increment {} counter: {}", name, e.getMessage());
        }
    }

    private static Counter counter(MeterRegistry registry, String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(tags)
                .register(registry);
    }
}
