package com.hostledger.rentals.notify;

import com.hostledger.rentals.model.RentalLifecycleEvent;
import com.hostledger.rentals.util.JsonSupport;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Posts rendered lifecycle notifications to webhook targets.
 *
 * <p>Each (event, target) delivery runs on a bounded pool of {@code min(8, targets)} threads and is
 * retried on I/O failures and non-2xx responses with exponential backoff. A delivery that exhausts
 * its attempts is logged and reported as {@code false}; it never propagates.</p>
 */
public class WebhookNotifier implements Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(WebhookNotifier.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    static final int MAX_WORKERS = 8;

    private final List<NotificationTarget> targets;
    private final OkHttpClient client;
    private final Retry retry;
    private final ExecutorService executor;

    public WebhookNotifier(List<NotificationTarget> targets, Settings settings) {
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
        this.client = new OkHttpClient.Builder()
                .connectTimeout(settings.httpTimeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(settings.httpTimeoutMs, TimeUnit.MILLISECONDS)
                .writeTimeout(settings.httpTimeoutMs, TimeUnit.MILLISECONDS)
                .build();
        this.retry = Retry.of("webhook-delivery", RetryConfig.custom()
                .maxAttempts(Math.max(1, settings.maxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.initialBackoffMs, 2.0, Math.max(settings.initialBackoffMs, settings.maxBackoffMs)))
                .retryExceptions(IOException.class)
                .build());
        this.retry.getEventPublisher().onRetry(event -> LOG.warn(
                "Retrying webhook delivery (attempt {}): {}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
        this.executor = Executors.newFixedThreadPool(Math.min(MAX_WORKERS, Math.max(this.targets.size(), 1)));
    }

    /**
     * Schedules delivery of {@code event} to every target subscribed to its type. The returned
     * futures complete with the delivery outcome of each target.
     */
    public List<CompletableFuture<Boolean>> dispatch(RentalLifecycleEvent event) {
        List<CompletableFuture<Boolean>> deliveries = new ArrayList<>();
        if (event == null || event.eventType == null) {
            return deliveries;
        }
        NotificationMessage message = null;
        for (NotificationTarget target : targets) {
            if (!target.accepts(event.eventType)) {
                continue;
            }
            if (message == null) {
                message = EventMessageFormatter.format(event);
            }
            NotificationMessage payload = message;
            deliveries.add(CompletableFuture.supplyAsync(() -> deliver(target, payload), executor));
        }
        return deliveries;
    }

    boolean deliver(NotificationTarget target, NotificationMessage message) {
        byte[] body = JsonSupport.toJson(message).getBytes(StandardCharsets.UTF_8);
        try {
            retry.executeCheckedSupplier(() -> {
                post(target, body);
                return Boolean.TRUE;
            });
            LOG.debug("Delivered {} notification to {}", message.event, target.name);
            return true;
        } catch (IOException ex) {
            LOG.error("Notification delivery failed for {} after retries: {}", target.name, ex.getMessage());
            return false;
        } catch (RuntimeException ex) {
            LOG.error("Notification delivery failed for {}: {}", target.name, ex.toString());
            return false;
        } catch (Error err) {
            throw err;
        } catch (Throwable ex) {
            LOG.error("Notification delivery failed for {}: {}", target.name, ex.toString());
            return false;
        }
    }

    private void post(NotificationTarget target, byte[] body) throws IOException {
        Request request = new Request.Builder()
                .url(target.url)
                .post(RequestBody.create(body, JSON))
                .build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                String responseBody = response.body() != null ? response.body().string() : "";
                LOG.warn("Webhook {} responded with status {}: {}", target.name, response.code(), responseBody);
                throw new IOException("HTTP " + response.code() + " - " + responseBody);
            }
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Webhook deliveries still pending at shutdown; cancelling");
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    /**
     * Delivery tunables: attempts per (event, target), backoff bounds and the HTTP timeout.
     */
    public static final class Settings implements java.io.Serializable {
        private static final long serialVersionUID = 1L;

        public final int maxAttempts;
        public final long initialBackoffMs;
        public final long maxBackoffMs;
        public final long httpTimeoutMs;

        public Settings(int maxAttempts, long initialBackoffMs, long maxBackoffMs, long httpTimeoutMs) {
            this.maxAttempts = maxAttempts;
            this.initialBackoffMs = Math.max(10L, initialBackoffMs);
            this.maxBackoffMs = maxBackoffMs;
            this.httpTimeoutMs = httpTimeoutMs;
        }
    }
}
