package net.clipforge.config;

import java.time.Duration;
import net.clipforge.support.retry.RetrySettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

/**
 * Typed configuration for the remote video generation service and batch orchestration.
 */
@Component
@ConfigurationProperties(prefix = "clipforge.generation")
public class GenerationProperties {

    private String apiKey = "";
    private String baseUrl = "https://api.dev.runwayml.com";
    private String apiVersion = "2024-11-06";
    private Duration pollInterval = Duration.ofSeconds(10);
    private Duration maxWait = Duration.ofMinutes(10);
    private Duration requestTimeout = Duration.ofSeconds(180);
    private int jobMaxAttempts = 3;
    private Duration jobBaseBackoff = Duration.ofSeconds(1);
    private Duration downloadTimeout = Duration.ofMinutes(5);
    private DataSize maxDownloadSize = DataSize.ofMegabytes(512);
    private int submitsPerMinute = 10;
    private final Batch batch = new Batch();
    private final RateLimit rateLimit = new RateLimit();

    /**
     * Returns the bearer secret for the generation API. Blank disables generation.
     */
    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    /**
     * Returns the deadline for a single job, measured from its first poll.
     */
    public Duration getMaxWait() {
        return maxWait;
    }

    public void setMaxWait(Duration maxWait) {
        this.maxWait = maxWait;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public int getJobMaxAttempts() {
        return jobMaxAttempts;
    }

    public void setJobMaxAttempts(int jobMaxAttempts) {
        this.jobMaxAttempts = jobMaxAttempts;
    }

    public Duration getJobBaseBackoff() {
        return jobBaseBackoff;
    }

    public void setJobBaseBackoff(Duration jobBaseBackoff) {
        this.jobBaseBackoff = jobBaseBackoff;
    }

    public Duration getDownloadTimeout() {
        return downloadTimeout;
    }

    public void setDownloadTimeout(Duration downloadTimeout) {
        this.downloadTimeout = downloadTimeout;
    }

    public DataSize getMaxDownloadSize() {
        return maxDownloadSize;
    }

    public void setMaxDownloadSize(DataSize maxDownloadSize) {
        this.maxDownloadSize = maxDownloadSize;
    }

    /**
     * Returns the outbound job submission allowance enforced before calling the service.
     */
    public int getSubmitsPerMinute() {
        return submitsPerMinute;
    }

    public void setSubmitsPerMinute(int submitsPerMinute) {
        this.submitsPerMinute = submitsPerMinute;
    }

    public Batch getBatch() {
        return batch;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public RetrySettings jobRetrySettings() {
        return RetrySettings.withoutTimeout(jobMaxAttempts, jobBaseBackoff);
    }

    public static class Batch {

        private int maxConcurrency = 0;

        /**
         * Returns the cap on simultaneously running batch items; zero or less means unbounded.
         */
        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }
    }

    public static class RateLimit {

        private int requestsPerMinute = 20;
        private int requestsPerHour = 200;
        private long maximumTrackedOwners = 100_000L;

        public int getRequestsPerMinute() {
            return requestsPerMinute;
        }

        public void setRequestsPerMinute(int requestsPerMinute) {
            this.requestsPerMinute = requestsPerMinute;
        }

        public int getRequestsPerHour() {
            return requestsPerHour;
        }

        public void setRequestsPerHour(int requestsPerHour) {
            this.requestsPerHour = requestsPerHour;
        }

        public long getMaximumTrackedOwners() {
            return maximumTrackedOwners;
        }

        public void setMaximumTrackedOwners(long maximumTrackedOwners) {
            this.maximumTrackedOwners = maximumTrackedOwners;
        }
    }
}
