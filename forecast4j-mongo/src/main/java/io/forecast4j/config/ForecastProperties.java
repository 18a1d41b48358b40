package io.forecast4j.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import io.forecast4j.core.CatchUpPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the forecast engine.
 */
@ConfigurationProperties(prefix = "forecast")
public class ForecastProperties {
    private boolean enabled = true;

    // driver
    private Duration tickInterval = Duration.ofSeconds(60);
    private Duration jobRefreshInterval = Duration.ofSeconds(30);
    private int maxConcurrentExecutions = 4;
    private CatchUpPolicy catchUpPolicy = CatchUpPolicy.LATEST_ONLY;
    private int maxMissedRuns = 10;
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);

    // weather cache
    private Duration stalenessWindow = Duration.ofMinutes(30);
    private boolean serveStaleOnError = false;
    private int dailyCallLimit = 0; // 0 = unlimited
    private Duration historyRetention = Duration.ofDays(30);

    // upstream fetch retry
    private int fetchMaxAttempts = 3;
    private Duration fetchInitialBackoff = Duration.ofSeconds(2);
    private Duration fetchMaxBackoff = Duration.ofSeconds(30);

    // fan-out
    private int deliveryMaxAttempts = 3;
    private Duration deliveryBackoff = Duration.ofMillis(500);
    private Duration deliveryTimeout = Duration.ofSeconds(10);
    private int deliveryParallelism = 8;

    // history backfill
    private boolean backfillEnabled = false;
    private String backfillCron = "0 3 * * *";
    private int backfillMaxDays = 7;
    private List<String> backfillFallbackCities = new ArrayList<>();
    private Duration backfillCallDelay = Duration.ofMillis(100);

    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public Duration getJobRefreshInterval() {
        return jobRefreshInterval;
    }

    public void setJobRefreshInterval(Duration jobRefreshInterval) {
        this.jobRefreshInterval = jobRefreshInterval;
    }

    public int getMaxConcurrentExecutions() {
        return maxConcurrentExecutions;
    }

    public void setMaxConcurrentExecutions(int maxConcurrentExecutions) {
        this.maxConcurrentExecutions = maxConcurrentExecutions;
    }

    public CatchUpPolicy getCatchUpPolicy() {
        return catchUpPolicy;
    }

    public void setCatchUpPolicy(CatchUpPolicy catchUpPolicy) {
        this.catchUpPolicy = catchUpPolicy;
    }

    public int getMaxMissedRuns() {
        return maxMissedRuns;
    }

    public void setMaxMissedRuns(int maxMissedRuns) {
        this.maxMissedRuns = maxMissedRuns;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public Duration getStalenessWindow() {
        return stalenessWindow;
    }

    public void setStalenessWindow(Duration stalenessWindow) {
        this.stalenessWindow = stalenessWindow;
    }

    public boolean isServeStaleOnError() {
        return serveStaleOnError;
    }

    public void setServeStaleOnError(boolean serveStaleOnError) {
        this.serveStaleOnError = serveStaleOnError;
    }

    public int getDailyCallLimit() {
        return dailyCallLimit;
    }

    public void setDailyCallLimit(int dailyCallLimit) {
        this.dailyCallLimit = dailyCallLimit;
    }

    public Duration getHistoryRetention() {
        return historyRetention;
    }

    public void setHistoryRetention(Duration historyRetention) {
        this.historyRetention = historyRetention;
    }

    public int getFetchMaxAttempts() {
        return fetchMaxAttempts;
    }

    public void setFetchMaxAttempts(int fetchMaxAttempts) {
        this.fetchMaxAttempts = fetchMaxAttempts;
    }

    public Duration getFetchInitialBackoff() {
        return fetchInitialBackoff;
    }

    public void setFetchInitialBackoff(Duration fetchInitialBackoff) {
        this.fetchInitialBackoff = fetchInitialBackoff;
    }

    public Duration getFetchMaxBackoff() {
        return fetchMaxBackoff;
    }

    public void setFetchMaxBackoff(Duration fetchMaxBackoff) {
        this.fetchMaxBackoff = fetchMaxBackoff;
    }

    public int getDeliveryMaxAttempts() {
        return deliveryMaxAttempts;
    }

    public void setDeliveryMaxAttempts(int deliveryMaxAttempts) {
        this.deliveryMaxAttempts = deliveryMaxAttempts;
    }

    public Duration getDeliveryBackoff() {
        return deliveryBackoff;
    }

    public void setDeliveryBackoff(Duration deliveryBackoff) {
        this.deliveryBackoff = deliveryBackoff;
    }

    public Duration getDeliveryTimeout() {
        return deliveryTimeout;
    }

    public void setDeliveryTimeout(Duration deliveryTimeout) {
        this.deliveryTimeout = deliveryTimeout;
    }

    public int getDeliveryParallelism() {
        return deliveryParallelism;
    }

    public void setDeliveryParallelism(int deliveryParallelism) {
        this.deliveryParallelism = deliveryParallelism;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public boolean isBackfillEnabled() {
        return backfillEnabled;
    }

    public void setBackfillEnabled(boolean backfillEnabled) {
        this.backfillEnabled = backfillEnabled;
    }

    public String getBackfillCron() {
        return backfillCron;
    }

    public void setBackfillCron(String backfillCron) {
        this.backfillCron = backfillCron;
    }

    public int getBackfillMaxDays() {
        return backfillMaxDays;
    }

    public void setBackfillMaxDays(int backfillMaxDays) {
        this.backfillMaxDays = backfillMaxDays;
    }

    public List<String> getBackfillFallbackCities() {
        return backfillFallbackCities;
    }

    public void setBackfillFallbackCities(List<String> backfillFallbackCities) {
        this.backfillFallbackCities = backfillFallbackCities;
    }

    public Duration getBackfillCallDelay() {
        return backfillCallDelay;
    }

    public void setBackfillCallDelay(Duration backfillCallDelay) {
        this.backfillCallDelay = backfillCallDelay;
    }
}
