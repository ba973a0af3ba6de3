package dev.feedbridge.bridge;

/**
 * Summary of one orchestrator cycle.
 *
 * @param sources sources attempted
 * @param failedSources sources that hit a configuration, session, fetch or refresh error
 * @param published entries published
 * @param publishFailures entries that failed to publish
 * @param swept sources whose sweep ran
 * @param cancelled the cycle stopped early on request
 */
public record CycleReport(
    int sources, int failedSources, int published, int publishFailures, int swept, boolean cancelled) {}
