package com.incentives.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Engine tunables bound from the {@code incentives.*} namespace.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "incentives")
public class IncentivesProperties {

    @Valid
    private final Storage storage = new Storage();

    @Valid
    private final LiveLeaderboard liveLeaderboard = new LiveLeaderboard();

    @Valid
    private final Settlement settlement = new Settlement();

    @Valid
    private final Notifications notifications = new Notifications();

    @Data
    public static class Storage {
        @NotBlank
        private String root = "./data";
    }

    @Data
    public static class LiveLeaderboard {
        @Min(1)
        private int maxRetries = 5;

        @Min(1)
        @Max(10_000)
        private int batchSize = 100;
    }

    @Data
    public static class Settlement {
        /** How long a competition may sit in evaluating before it is reported as stuck. */
        @NotNull
        private Duration stuckAfter = Duration.ofMinutes(15);
    }

    @Data
    public static class Notifications {
        @Min(1)
        @Max(500)
        private int defaultLimit = 50;
    }
}
