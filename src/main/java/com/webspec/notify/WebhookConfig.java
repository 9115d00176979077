package com.webspec.notify;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One webhook endpoint. Defaults: subscribed to completion and failure, three
 * delivery attempts, 30 second call timeout.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookConfig {

    private String              url;
    private String              name    = "default";
    private List<WebhookEvent>  events  = new ArrayList<>(List.of(WebhookEvent.COMPLETION, WebhookEvent.FAILURE));
    private Map<String, String> headers = new LinkedHashMap<>();
    @JsonProperty("retry_count")
    private int                 retryCount     = 3;
    @JsonProperty("timeout_seconds")
    private long                timeoutSeconds = 30;

    public WebhookConfig() {}

    public WebhookConfig(String name, String url, List<WebhookEvent> events) {
        this.name   = name;
        this.url    = url;
        this.events = new ArrayList<>(events);
    }

    public boolean isSubscribedTo(WebhookEvent event) {
        return events.contains(event);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String              getUrl()            { return url; }
    public String              getName()           { return name; }
    public List<WebhookEvent>  getEvents()         { return events; }
    public Map<String, String> getHeaders()        { return headers; }
    public int                 getRetryCount()     { return retryCount; }
    public long                getTimeoutSeconds() { return timeoutSeconds; }

    // ── Setters ───────────────────────────────────────────────────────────────

    public void setUrl(String url)                         { this.url = url; }
    public void setName(String name)                       { this.name = name; }
    public void setEvents(List<WebhookEvent> events)       { this.events = events != null ? events : new ArrayList<>(); }
    public void setHeaders(Map<String, String> headers)    { this.headers = headers != null ? headers : new LinkedHashMap<>(); }
    public void setRetryCount(int retryCount)              { this.retryCount = retryCount; }
    public void setTimeoutSeconds(long timeoutSeconds)     { this.timeoutSeconds = timeoutSeconds; }

    @Override
    public String toString() {
        return String.format("WebhookConfig{name='%s', url='%s', events=%s, retries=%d}",
            name, url, events, retryCount);
    }
}
