package com.mimecast.courier.approval;

import com.mimecast.courier.attachment.AttachmentDescriptor;
import com.mimecast.courier.attachment.AttachmentDownloader;
import com.mimecast.courier.attachment.AttachmentResolver;
import com.mimecast.courier.feishu.ApprovalApi;
import com.mimecast.courier.feishu.ApprovalInstance;
import com.mimecast.courier.feishu.RemoteApiException;
import com.mimecast.courier.form.FormWalker;
import com.mimecast.courier.mail.MailDelivery;
import com.mimecast.courier.metrics.CourierMetrics;
import jakarta.mail.MessagingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Approval processor.
 *
 * <p>Forwards a single approved instance:
 * <ol>
 *   <li>Fetch the instance.</li>
 *   <li>Walk the form and derive title and amount.</li>
 *   <li>Route the category to a mailbox.</li>
 *   <li>Deduplicate and download attachments.</li>
 *   <li>Compose and send the notification.</li>
 * </ol>
 * <p>Missing destination, attachments or downloads end processing early with a skip.
 */
public class ApprovalProcessor {
    private static final Logger log = LogManager.getLogger(ApprovalProcessor.class);

    private final ApprovalApi api;
    private final FormWalker walker;
    private final FieldAggregator aggregator;
    private final CategoryRouter router;
    private final AttachmentDownloader downloader;
    private final NotificationComposer composer;
    private final MailDelivery delivery;

    /**
     * Constructs a new ApprovalProcessor instance.
     *
     * @param api        ApprovalApi instance.
     * @param walker     FormWalker instance.
     * @param aggregator FieldAggregator instance.
     * @param router     CategoryRouter instance.
     * @param downloader AttachmentDownloader instance.
     * @param composer   NotificationComposer instance.
     * @param delivery   MailDelivery instance.
     */
    public ApprovalProcessor(ApprovalApi api, FormWalker walker, FieldAggregator aggregator, CategoryRouter router,
                             AttachmentDownloader downloader, NotificationComposer composer, MailDelivery delivery) {
        this.api = api;
        this.walker = walker;
        this.aggregator = aggregator;
        this.router = router;
        this.downloader = downloader;
        this.composer = composer;
        this.delivery = delivery;
    }

    /**
     * Processes an approved instance.
     *
     * @param instanceCode Instance code.
     * @return ProcessingResult instance.
     * @throws RemoteApiException If an API call fails.
     * @throws MessagingException If mail delivery fails.
     */
    public ProcessingResult process(String instanceCode) throws RemoteApiException, MessagingException {
        ApprovalInstance instance = api.getApprovalInstance(instanceCode);
        String approvalName = instance.approvalName();
        log.info("Processing approval {} of type '{}'", instanceCode, approvalName);

        FormWalker.WalkResult walked = walker.walk(instance.form());
        ExtractedSummary summary = withTitle(aggregator.aggregate(walked.fields()), instance);

        Optional<String> destination = router.route(approvalName);
        if (destination.isEmpty()) {
            log.info("Approval '{}' not mapped to a mailbox, skipping instance {}", approvalName, instanceCode);
            return skip(ProcessingResult.SkipReason.NO_DESTINATION);
        }
        log.info("Approval type '{}' routed to {} for instance {}", approvalName, destination.get(), instanceCode);

        List<AttachmentDescriptor> attachments = AttachmentResolver.deduplicate(walked.attachments());
        if (attachments.isEmpty()) {
            log.info("No attachments found for instance {}", instanceCode);
            return skip(ProcessingResult.SkipReason.NO_ATTACHMENTS);
        }

        log.info("Found {} attachments for instance {}, downloading", attachments.size(), instanceCode);
        List<AttachmentDescriptor> downloaded = downloader.download(instanceCode, attachments);
        if (downloaded.isEmpty()) {
            log.warn("Failed to download any attachments for instance {}", instanceCode);
            return skip(ProcessingResult.SkipReason.NO_DOWNLOADS);
        }

        Notification notification = composer.compose(destination.get(), approvalName, summary, downloaded);
        delivery.sendNotification(notification.to(), notification.subject(), notification.body(), notification.attachments());
        log.info("Forwarded instance {} to {} with {} attachments", instanceCode, notification.to(), downloaded.size());

        CourierMetrics.incrementApprovalsSent();
        return ProcessingResult.sent(downloaded.size());
    }

    /**
     * Substitutes a missing title with the serial number, else the instance code.
     *
     * @param summary  ExtractedSummary instance.
     * @param instance ApprovalInstance instance.
     * @return ExtractedSummary with a title.
     */
    private ExtractedSummary withTitle(ExtractedSummary summary, ApprovalInstance instance) {
        if (!summary.title().isEmpty()) {
            return summary;
        }
        String title = instance.serialNumber() != null && !instance.serialNumber().isEmpty()
                ? instance.serialNumber()
                : instance.instanceCode();
        return new ExtractedSummary(title, summary.amount());
    }

    private ProcessingResult skip(ProcessingResult.SkipReason reason) {
        CourierMetrics.incrementApprovalsSkipped(reason.tag());
        return ProcessingResult.skipped(reason);
    }
}
