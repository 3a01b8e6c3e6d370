package com.phillippitts.visqol.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for batch measurement.
 *
 * <p>Controls the size of the batch worker pool and how long a single pair may run. Defaults are
 * conservative but can be adjusted based on hardware and workload.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "visqol.batch")
public class BatchProperties {

    @Min(1)
    private int concurrency = Math.max(1, Runtime.getRuntime().availableProcessors());

    @Min(0)
    private int queueCapacity = 100;

    /** Zero disables the per-pair timeout. */
    @Min(0)
    private int perPairTimeoutSeconds = 600;

    @Min(1)
    private int keepAliveSeconds = 60;

    @NotBlank
    private String threadNamePrefix = "visqol-batch-";

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public int getPerPairTimeoutSeconds() {
        return perPairTimeoutSeconds;
    }

    public void setPerPairTimeoutSeconds(int perPairTimeoutSeconds) {
        this.perPairTimeoutSeconds = perPairTimeoutSeconds;
    }

    public int getKeepAliveSeconds() {
        return keepAliveSeconds;
    }

    public void setKeepAliveSeconds(int keepAliveSeconds) {
        this.keepAliveSeconds = keepAliveSeconds;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }
}
