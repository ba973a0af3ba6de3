package dev.feedbridge.publish;

/** Counts for one publish batch. {@code cancelled} is set when the batch stopped early. */
public record PublishReport(int published, int failed, boolean cancelled) {}
