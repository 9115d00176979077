package com.webspec.alerts;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A channel ("webhook", "log", ...) that should hear about alerts from a config. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertNotification {

    private String  channel;
    private boolean enabled = true;

    public AlertNotification() {}

    public AlertNotification(String channel, boolean enabled) {
        this.channel = channel;
        this.enabled = enabled;
    }

    public String  getChannel() { return channel; }
    public boolean isEnabled()  { return enabled; }

    public void setChannel(String channel)   { this.channel = channel; }
    public void setEnabled(boolean enabled)  { this.enabled = enabled; }
}
