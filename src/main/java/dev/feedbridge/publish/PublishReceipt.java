package dev.feedbridge.publish;

import org.jspecify.annotations.Nullable;

/** Identifier assigned by the read-later service, plus its content location if it sent one. */
public record PublishReceipt(String remoteId, @Nullable String contentLocation) {}
