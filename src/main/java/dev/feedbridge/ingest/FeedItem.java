package dev.feedbridge.ingest;

import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** One entry of a parsed feed document. */
public record FeedItem(
    String url,
    String title,
    @Nullable Instant publishedAt,
    @Nullable Instant updatedAt,
    List<String> categories) {

  public FeedItem {
    categories = categories == null ? List.of() : List.copyOf(categories);
  }

  /** Published time, falling back to the updated time. */
  public @Nullable Instant effectiveTime() {
    return publishedAt != null ? publishedAt : updatedAt;
  }
}
