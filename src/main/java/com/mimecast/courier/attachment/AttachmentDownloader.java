package com.mimecast.courier.attachment;

import com.mimecast.courier.feishu.ApprovalApi;
import com.mimecast.courier.feishu.RemoteApiException;
import com.mimecast.courier.metrics.CourierMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Attachment downloader.
 *
 * <p>Resolves token-only descriptors to temporary URLs in a single batch call,
 * <br>then downloads every descriptor concurrently on the given executor.
 * <p>Failures are isolated per attachment and the failing descriptor is dropped.
 * <br>The returned list keeps the input order.
 */
public class AttachmentDownloader {
    private static final Logger log = LogManager.getLogger(AttachmentDownloader.class);

    private final ApprovalApi api;
    private final ExecutorService executor;

    /**
     * Constructs a new AttachmentDownloader instance.
     *
     * @param api      ApprovalApi instance.
     * @param executor Executor running the downloads.
     */
    public AttachmentDownloader(ApprovalApi api, ExecutorService executor) {
        this.api = api;
        this.executor = executor;
    }

    /**
     * Downloads attachments.
     *
     * @param instanceCode Approval instance the attachments belong to, for logging.
     * @param descriptors  Deduplicated descriptors.
     * @return Descriptors with content, in input order.
     * @throws RemoteApiException If the batch URL lookup fails.
     */
    public List<AttachmentDescriptor> download(String instanceCode, List<AttachmentDescriptor> descriptors) throws RemoteApiException {
        if (descriptors.isEmpty()) {
            return new ArrayList<>();
        }

        resolveUrls(descriptors);

        List<CompletableFuture<AttachmentDescriptor>> futures = new ArrayList<>();
        for (AttachmentDescriptor descriptor : descriptors) {
            if (!descriptor.hasDownloadUrl()) {
                log.warn("No download URL for attachment {} of instance {}", descriptor.getName(), instanceCode);
                CourierMetrics.incrementAttachmentsFailed();
                continue;
            }
            futures.add(CompletableFuture.supplyAsync(() -> fetch(instanceCode, descriptor), executor));
        }

        List<AttachmentDescriptor> downloaded = new ArrayList<>();
        for (CompletableFuture<AttachmentDescriptor> future : futures) {
            AttachmentDescriptor descriptor = future.join();
            if (descriptor != null) {
                downloaded.add(descriptor);
            }
        }

        return downloaded;
    }

    /**
     * Fills in download URLs for descriptors that only carry a file token.
     *
     * @param descriptors Descriptors.
     * @throws RemoteApiException If the batch URL lookup fails.
     */
    private void resolveUrls(List<AttachmentDescriptor> descriptors) throws RemoteApiException {
        Set<String> tokens = new LinkedHashSet<>();
        for (AttachmentDescriptor descriptor : descriptors) {
            if (descriptor.hasFileToken() && !descriptor.hasDownloadUrl()) {
                tokens.add(descriptor.getFileToken());
            }
        }

        if (tokens.isEmpty()) {
            return;
        }

        Map<String, String> urls = api.getFileDownloadUrls(tokens);
        for (AttachmentDescriptor descriptor : descriptors) {
            if (!descriptor.hasDownloadUrl() && urls.containsKey(descriptor.getFileToken())) {
                descriptor.setDownloadUrl(urls.get(descriptor.getFileToken()));
            }
        }
    }

    /**
     * Downloads a single attachment.
     *
     * @param instanceCode Approval instance code, for logging.
     * @param descriptor   Descriptor with download URL.
     * @return Descriptor with content, or null on failure.
     */
    private AttachmentDescriptor fetch(String instanceCode, AttachmentDescriptor descriptor) {
        try {
            descriptor.setContent(api.downloadFile(descriptor.getDownloadUrl()));
            log.debug("Downloaded attachment {} of instance {} ({} bytes)", descriptor.getName(), instanceCode,
                    descriptor.getContent().map(c -> c.length).orElse(0));
            CourierMetrics.incrementAttachmentsDownloaded();
            return descriptor;
        } catch (RemoteApiException | RuntimeException e) {
            log.warn("Failed to download attachment {} of instance {}: {}", descriptor.getName(), instanceCode, e.getMessage());
            CourierMetrics.incrementAttachmentsFailed();
            return null;
        }
    }
}
