package com.statecheck.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "statecheck")
public class StatecheckProperties {

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Execution execution = new Execution();

    @Data
    public static class Cache {
        /**
         * Maximum time for a single signal read.
         */
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(5);

        /**
         * Polling interval while sampling a signal over a reduce period.
         */
        @NotNull
        private Duration sampleInterval = Duration.ofMillis(100);
    }

    @Data
    public static class Execution {
        private boolean parallel = true;

        /**
         * Deadline for one whole run; comparisons still pending are reported as missing.
         */
        @NotNull
        private Duration runTimeout = Duration.ofSeconds(60);

        @Min(1)
        private int workerThreads = 8;

        /**
         * Threads for blocking tool work, kept apart from the polling workers.
         */
        @Min(1)
        private int toolThreads = 4;
    }
}
