package com.starscape.photolog.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the stale-upload sweep.
 * Binds to app.reconciler.* properties from application.yml.
 * The sweep interval itself is read by the scheduler from app.reconciler.interval.
 */
@ConfigurationProperties(prefix = "app.reconciler")
public class ReconcilerProperties {

    private boolean enabled = true;
    private int staleThresholdHours = 1;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getStaleThresholdHours() {
        return staleThresholdHours;
    }

    public void setStaleThresholdHours(int staleThresholdHours) {
        this.staleThresholdHours = staleThresholdHours;
    }
}
