package com.mimecast.courier.approval;

import com.google.gson.JsonObject;
import com.mimecast.courier.feishu.RemoteApiException;
import com.mimecast.courier.metrics.CourierMetrics;
import jakarta.mail.MessagingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Approval event handler.
 *
 * <p>Filters webhook envelopes down to approved instance events and hands them to the processor.
 * <br>Failures are logged with the instance code and rethrown.
 */
public class ApprovalEventHandler {
    private static final Logger log = LogManager.getLogger(ApprovalEventHandler.class);

    private final ApprovalProcessor processor;

    /**
     * Constructs a new ApprovalEventHandler instance.
     *
     * @param processor ApprovalProcessor instance.
     */
    public ApprovalEventHandler(ApprovalProcessor processor) {
        this.processor = processor;
    }

    /**
     * Handles an event envelope.
     *
     * @param envelope Envelope JSON object.
     * @return ProcessingResult instance.
     * @throws RemoteApiException If an API call fails.
     * @throws MessagingException If mail delivery fails.
     */
    public ProcessingResult handle(JsonObject envelope) throws RemoteApiException, MessagingException {
        ApprovalEvent event = ApprovalEvent.fromEnvelope(envelope);

        if (!event.isInstanceEvent()) {
            log.info("Skipping non-instance event type: '{}'", event.eventType());
            return skip(ProcessingResult.SkipReason.NOT_INSTANCE_EVENT);
        }

        if (!event.isApproved()) {
            log.info("Skipping event with status: '{}' for instance {}", event.status(), event.instanceCode());
            return skip(ProcessingResult.SkipReason.NOT_APPROVED);
        }

        if (!event.hasInstanceCode()) {
            log.warn("No instance code found in approved event");
            return skip(ProcessingResult.SkipReason.NO_INSTANCE_CODE);
        }

        log.info("Processing approved instance: {}", event.instanceCode());
        try {
            return processor.process(event.instanceCode());
        } catch (RemoteApiException | MessagingException | RuntimeException e) {
            log.error("Error processing approval {}: {}", event.instanceCode(), e.getMessage());
            CourierMetrics.incrementApprovalsFailed(e.getClass().getSimpleName());
            throw e;
        }
    }

    private ProcessingResult skip(ProcessingResult.SkipReason reason) {
        CourierMetrics.incrementApprovalsSkipped(reason.tag());
        return ProcessingResult.skipped(reason);
    }
}
