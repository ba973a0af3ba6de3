package dev.feedbridge.state;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Local memory of one published item.
 *
 * @param title entry title at publish time
 * @param contentLocation location reported by the read-later service, if any
 * @param sourceUrl original entry URL
 * @param publishedAt when the item was published to the read-later service; retention counts
 *     from here
 */
public record TrackedItem(
    String title, @Nullable String contentLocation, String sourceUrl, Instant publishedAt) {}
