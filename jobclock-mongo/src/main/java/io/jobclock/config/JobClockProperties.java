package io.jobclock.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the scheduling engine.
 */
@ConfigurationProperties(prefix = "jobclock")
public class JobClockProperties {
    private int maxConcurrency = 10; // worker threads running handlers
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private boolean reconcileOnStart = true;
    private boolean autoStartup = true; // start with the application context
    private int storeUpdateAttempts = 3; // optimistic-lock retries per record
    private boolean ensureIndexesOnStartup = false;

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isReconcileOnStart() {
        return reconcileOnStart;
    }

    public void setReconcileOnStart(boolean reconcileOnStart) {
        this.reconcileOnStart = reconcileOnStart;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    public int getStoreUpdateAttempts() {
        return storeUpdateAttempts;
    }

    public void setStoreUpdateAttempts(int storeUpdateAttempts) {
        this.storeUpdateAttempts = storeUpdateAttempts;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
