package com.webspec.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webspec.comparison.ComparisonResult;
import com.webspec.comparison.ComparisonStatus;
import com.webspec.model.ExecutionResult;
import com.webspec.model.StepStatus;
import com.webspec.util.JsonSupport;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Posts run notifications to the configured webhooks.
 *
 * Each payload goes to every config subscribed to its event. A delivery is
 * attempted up to {@code retryCount} times (at least once) with a linear
 * back-off of {@code backoff * attempt} between attempts. Delivery failures are
 * reported as {@link DeliveryResult}s and logged; they never propagate.
 *
 * Thread-safe. The OkHttpClient is shared; per-webhook timeouts derive from it.
 */
public class WebhookNotifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);

    private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");
    static final Duration DEFAULT_BACKOFF = Duration.ofMillis(500);

    private final List<WebhookConfig> configs;
    private final OkHttpClient        httpClient;
    private final ObjectMapper        objectMapper;
    private final Duration            backoff;
    private final Clock               clock;

    public WebhookNotifier(List<WebhookConfig> configs) {
        this(configs, DEFAULT_BACKOFF, Clock.systemUTC());
    }

    public WebhookNotifier(List<WebhookConfig> configs, Duration backoff, Clock clock) {
        this.configs      = new ArrayList<>(configs);
        this.backoff      = backoff;
        this.clock        = clock;
        this.objectMapper = JsonSupport.json();
        this.httpClient   = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .writeTimeout(10, TimeUnit.SECONDS)
            .build();
    }

    /** Loads a YAML (or JSON) list of webhook configs. */
    public static WebhookNotifier fromConfigFile(Path path) throws IOException {
        ObjectMapper mapper = JsonSupport.forPath(path);
        List<WebhookConfig> loaded = mapper.readValue(path.toFile(),
            mapper.getTypeFactory().constructCollectionType(List.class, WebhookConfig.class));
        log.info("WebhookNotifier: loaded {} webhook(s) from {}", loaded.size(), path);
        return new WebhookNotifier(loaded);
    }

    public List<WebhookConfig> getConfigs() {
        return Collections.unmodifiableList(configs);
    }

    // ── Events ────────────────────────────────────────────────────────────────

    public List<DeliveryResult> notifyStart(ExecutionResult result) {
        return send(WebhookPayload.of(WebhookEvent.START, result, clock.instant()));
    }

    public List<DeliveryResult> notifyCompletion(ExecutionResult result) {
        return send(WebhookPayload.of(WebhookEvent.COMPLETION, result, clock.instant()));
    }

    public List<DeliveryResult> notifyFailure(ExecutionResult result) {
        return send(WebhookPayload.of(WebhookEvent.FAILURE, result, clock.instant()));
    }

    public List<DeliveryResult> notifySuccess(ExecutionResult result) {
        return send(WebhookPayload.of(WebhookEvent.SUCCESS, result, clock.instant()));
    }

    /**
     * Completion plus success or failure, depending on the result's status.
     * Pending and skipped results only send completion.
     */
    public List<DeliveryResult> notifyFinished(ExecutionResult result) {
        List<DeliveryResult> out = new ArrayList<>(notifyCompletion(result));
        if (result.getStatus() == StepStatus.FAILED) {
            out.addAll(notifyFailure(result));
        } else if (result.getStatus() == StepStatus.PASSED) {
            out.addAll(notifySuccess(result));
        }
        return out;
    }

    /** Sends a regression or improvement event; an unchanged comparison sends nothing. */
    public List<DeliveryResult> notifyComparison(ExecutionResult baseline, ExecutionResult current,
                                                 ComparisonResult comparison) {
        WebhookEvent event;
        if (comparison.status() == ComparisonStatus.REGRESSION) {
            event = WebhookEvent.REGRESSION;
        } else if (comparison.status() == ComparisonStatus.IMPROVEMENT) {
            event = WebhookEvent.IMPROVEMENT;
        } else {
            return List.of();
        }
        return send(WebhookPayload.of(event, current, clock.instant()).withComparison(baseline, comparison));
    }

    /** Delivers {@code payload} to every config subscribed to its event, in config order. */
    public List<DeliveryResult> send(WebhookPayload payload) {
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("WebhookNotifier: cannot serialise {} payload: {}", payload.event(), e.getOriginalMessage());
            return configs.stream()
                .filter(c -> c.isSubscribedTo(payload.event()))
                .map(c -> DeliveryResult.failed(c, 0, -1, "Serialization failed: " + e.getOriginalMessage()))
                .toList();
        }

        List<DeliveryResult> results = new ArrayList<>();
        for (WebhookConfig config : configs) {
            if (!config.isSubscribedTo(payload.event())) continue;
            DeliveryResult result = deliver(config, body);
            if (result.success()) {
                log.info("WebhookNotifier: {} sent to '{}' after {} attempt(s)",
                    payload.event(), config.getName(), result.attempts());
            } else {
                log.warn("WebhookNotifier: {} to '{}' failed after {} attempt(s): {}",
                    payload.event(), config.getName(), result.attempts(), result.error());
            }
            results.add(result);
        }
        return results;
    }

    // ── HTTP delivery with retry ──────────────────────────────────────────────

    private DeliveryResult deliver(WebhookConfig config, String body) {
        if (config.getUrl() == null || config.getUrl().isBlank()) {
            return DeliveryResult.failed(config, 0, -1, "No URL configured");
        }
        Request request;
        try {
            Request.Builder builder = new Request.Builder()
                .url(config.getUrl())
                .post(RequestBody.create(body, JSON_MEDIA_TYPE));
            for (Map.Entry<String, String> header : config.getHeaders().entrySet()) {
                builder.header(header.getKey(), header.getValue());
            }
            request = builder.build();
        } catch (IllegalArgumentException e) {
            return DeliveryResult.failed(config, 0, -1, "Invalid webhook request: " + e.getMessage());
        }

        OkHttpClient client = httpClient.newBuilder()
            .callTimeout(Math.max(1, config.getTimeoutSeconds()), TimeUnit.SECONDS)
            .build();

        int maxAttempts = Math.max(1, config.getRetryCount());
        int lastStatus  = -1;
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = client.newCall(request).execute()) {
                lastStatus = response.code();
                if (response.isSuccessful()) {
                    return DeliveryResult.delivered(config, attempt, lastStatus);
                }
                String responseBody = response.body() != null ? response.body().string() : "";
                lastError = "HTTP " + lastStatus + ": "
                    + responseBody.substring(0, Math.min(200, responseBody.length()));
            } catch (IOException e) {
                lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            }

            if (attempt < maxAttempts) {
                log.debug("WebhookNotifier: attempt {} to '{}' failed ({}), retrying", attempt, config.getName(), lastError);
                try {
                    Thread.sleep(backoff.toMillis() * attempt);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return DeliveryResult.failed(config, attempt, lastStatus, "Interrupted during retry wait");
                }
            }
        }
        return DeliveryResult.failed(config, maxAttempts, lastStatus, lastError);
    }
}
