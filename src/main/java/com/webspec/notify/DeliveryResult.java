package com.webspec.notify;

/**
 * Outcome of delivering one payload to one webhook.
 *
 * @param statusCode last HTTP status seen, or -1 if no response was received
 * @param error      null on success
 */
public record DeliveryResult(String webhookName, String url, boolean success, int attempts,
                             int statusCode, String error) {

    static DeliveryResult delivered(WebhookConfig config, int attempts, int statusCode) {
        return new DeliveryResult(config.getName(), config.getUrl(), true, attempts, statusCode, null);
    }

    static DeliveryResult failed(WebhookConfig config, int attempts, int statusCode, String error) {
        return new DeliveryResult(config.getName(), config.getUrl(), false, attempts, statusCode, error);
    }
}
