package net.clipforge.config;

import java.time.Duration;
import net.clipforge.support.retry.RetrySettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

/**
 * Typed configuration for chunked uploads and reconstruction.
 */
@Component
@ConfigurationProperties(prefix = "clipforge.upload")
public class UploadProperties {

    private DataSize partSize = DataSize.ofMegabytes(3);
    private int maxAttempts = 3;
    private Duration attemptTimeout = Duration.ofSeconds(180);
    private Duration baseBackoff = Duration.ofSeconds(1);
    private Duration interPartDelay = Duration.ofMillis(500);
    private int fetchConcurrency = 8;
    private boolean strictSizeCheck = false;
    private Duration signedUrlTtl = Duration.ofHours(1);
    private Duration maxSignedUrlTtl = Duration.ofDays(7);
    private String servePath = "/api/media/stream";

    /**
     * Returns the target size of each part; the last part may be smaller.
     */
    public DataSize getPartSize() {
        return partSize;
    }

    public void setPartSize(DataSize partSize) {
        this.partSize = partSize;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getAttemptTimeout() {
        return attemptTimeout;
    }

    public void setAttemptTimeout(Duration attemptTimeout) {
        this.attemptTimeout = attemptTimeout;
    }

    public Duration getBaseBackoff() {
        return baseBackoff;
    }

    public void setBaseBackoff(Duration baseBackoff) {
        this.baseBackoff = baseBackoff;
    }

    /**
     * Returns the pause between consecutive part uploads.
     */
    public Duration getInterPartDelay() {
        return interPartDelay;
    }

    public void setInterPartDelay(Duration interPartDelay) {
        this.interPartDelay = interPartDelay;
    }

    /**
     * Returns how many parts are fetched in parallel during reconstruction.
     */
    public int getFetchConcurrency() {
        return fetchConcurrency;
    }

    public void setFetchConcurrency(int fetchConcurrency) {
        this.fetchConcurrency = fetchConcurrency;
    }

    /**
     * Indicates if a reconstructed size that disagrees with the manifest is fatal.
     */
    public boolean isStrictSizeCheck() {
        return strictSizeCheck;
    }

    public void setStrictSizeCheck(boolean strictSizeCheck) {
        this.strictSizeCheck = strictSizeCheck;
    }

    public Duration getSignedUrlTtl() {
        return signedUrlTtl;
    }

    public void setSignedUrlTtl(Duration signedUrlTtl) {
        this.signedUrlTtl = signedUrlTtl;
    }

    public Duration getMaxSignedUrlTtl() {
        return maxSignedUrlTtl;
    }

    public void setMaxSignedUrlTtl(Duration maxSignedUrlTtl) {
        this.maxSignedUrlTtl = maxSignedUrlTtl;
    }

    /**
     * Returns the path of the endpoint that streams stored media back to clients.
     */
    public String getServePath() {
        return servePath;
    }

    public void setServePath(String servePath) {
        this.servePath = servePath;
    }

    public RetrySettings partRetrySettings() {
        return new RetrySettings(maxAttempts, attemptTimeout, baseBackoff);
    }
}
