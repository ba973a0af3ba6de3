package dev.feedbridge.bridge;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Main loop settings, bound from {@code feedbridge.loop.*}.
 *
 * @param interval sleep between cycles, at least one millisecond
 * @param parallelism worker threads for per-source work; 1 runs sources sequentially
 * @param enabled start the loop with the application
 */
@Validated
@ConfigurationProperties(prefix = "feedbridge.loop")
public record LoopProperties(
    @DefaultValue("60s") @NotNull @DurationMin(millis = 1) Duration interval,
    @DefaultValue("1") @Min(1) int parallelism,
    @DefaultValue("true") boolean enabled) {}
