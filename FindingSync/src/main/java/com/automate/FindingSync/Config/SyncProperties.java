package com.automate.FindingSync.Config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties("sync")
public class SyncProperties {

    public enum ConcurrentRunPolicy { REJECT, COALESCE }

    /** What happens when a sync is triggered for a project that is already running. */
    @NotNull
    private ConcurrentRunPolicy concurrentRunPolicy = ConcurrentRunPolicy.REJECT;

    @NotBlank
    private String trendDirectory = System.getProperty("user.home") + "/.findingsync/trends";

    @Min(2) @Max(1000)
    private int trendHistoryLimit = 100;

    @Positive
    private int trendPeriodDays = 90;

    private boolean saveTrendSnapshots = false;

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Executor executor = new Executor();

    @Data
    public static class Scheduler {
        private boolean enabled = false;

        @Min(1000)
        private long pollIntervalMs = 60000;
    }

    @Data
    public static class Executor {
        @Positive
        private int corePoolSize = 2;

        @Positive
        private int maxPoolSize = 4;

        @Positive
        private int queueCapacity = 100;
    }
}
