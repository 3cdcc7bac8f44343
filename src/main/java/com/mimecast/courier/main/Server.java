package com.mimecast.courier.main;

import com.mimecast.courier.approval.*;
import com.mimecast.courier.attachment.AttachmentDownloader;
import com.mimecast.courier.attachment.AttachmentResolver;
import com.mimecast.courier.config.server.FeishuConfig;
import com.mimecast.courier.config.server.ServerConfig;
import com.mimecast.courier.endpoints.WebhookEndpoint;
import com.mimecast.courier.feishu.FeishuClient;
import com.mimecast.courier.form.FormParser;
import com.mimecast.courier.form.FormWalker;
import com.mimecast.courier.mail.SmtpMailDelivery;
import com.mimecast.courier.util.SecretDecoder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Courier server.
 *
 * <p>Loads configuration, wires the approval pipeline and starts the webhook endpoint.
 * <p>Events are processed on a fixed worker pool and attachment downloads on a second one.
 *
 * <p>The server is started by calling the static {@link #run(String)} method with the path
 * to the configuration directory.
 *
 * @see WebhookEndpoint
 * @see ApprovalProcessor
 */
public class Server {
    private static final Logger log = LogManager.getLogger(Server.class);

    private static ExecutorService eventExecutor;
    private static ExecutorService downloadExecutor;
    private static WebhookEndpoint endpoint;

    /**
     * Protected constructor.
     */
    private Server() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Initializes and starts the server.
     *
     * @param path The directory path containing the configuration files.
     * @throws ConfigurationException If there is an issue with the configuration files or the endpoint cannot bind.
     */
    public static void run(String path) throws ConfigurationException {
        try {
            Config.initServer(path, SecretDecoder.fromEnvironment());
        } catch (IOException e) {
            log.error("Failed to load configuration from {}: {}", path, e.getMessage());
            throw new ConfigurationException("Unable to load configuration: " + e.getMessage());
        }

        ServerConfig config = Config.getServer();
        eventExecutor = Executors.newFixedThreadPool(config.getEventWorkers());
        downloadExecutor = Executors.newFixedThreadPool(config.getDownloadWorkers());
        registerShutdownHook();

        endpoint = new WebhookEndpoint(new ApprovalEventHandler(processor(config)), eventExecutor);
        try {
            endpoint.start(config.getWebhook());
        } catch (IOException e) {
            log.error("Failed to start webhook endpoint: {}", e.getMessage());
            throw new ConfigurationException("Unable to start webhook endpoint: " + e.getMessage());
        }

        log.info("Courier started with {} event workers and {} download workers",
                config.getEventWorkers(), config.getDownloadWorkers());
    }

    /**
     * Wires the approval processor from configuration.
     *
     * @param config ServerConfig instance.
     * @return ApprovalProcessor instance.
     */
    static ApprovalProcessor processor(ServerConfig config) {
        FeishuConfig feishu = config.getFeishu();
        FeishuClient client = new FeishuClient.Builder()
                .withBaseUrl(feishu.getBaseUrl())
                .withAppId(feishu.getAppId())
                .withAppSecret(feishu.getAppSecret())
                .withTimeout(feishu.getTimeoutSeconds())
                .build();

        CategoryRouter router = new CategoryRouter(config.getCategories().getMappings());
        log.info("Loaded {} category mappings", config.getCategories().getMappings().size());

        return new ApprovalProcessor(
                client,
                new FormWalker(new FormParser(config.getForm().getMaxDepth()), new AttachmentResolver()),
                new FieldAggregator(config.getForm()),
                router,
                new AttachmentDownloader(client, downloadExecutor),
                new NotificationComposer(),
                new SmtpMailDelivery(config.getSmtp())
        );
    }

    /**
     * Registers a shutdown hook to ensure graceful termination of the server.
     */
    private static void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Service is shutting down.");

            if (endpoint != null) {
                endpoint.stop();
            }

            shutdown(eventExecutor);
            shutdown(downloadExecutor);

            log.info("Shutdown complete.");
        }));
    }

    private static void shutdown(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
