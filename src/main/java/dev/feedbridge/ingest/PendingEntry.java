package dev.feedbridge.ingest;

import dev.feedbridge.source.Destination;
import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A new entry waiting to be published in this cycle. Never persisted.
 *
 * @param sourceId owning source
 * @param url entry link
 * @param title entry title
 * @param publishedAt published (or updated) time used for ordering and the high-water mark
 * @param categories feed and entry categories, deduplicated in first-seen order
 * @param rawContent fetched article HTML for paywalled sources, otherwise {@code null}
 * @param destination where and how to publish
 * @param siteSanitizingCriteria the login site's selectors, used when the destination has none
 */
public record PendingEntry(
    String sourceId,
    String url,
    String title,
    Instant publishedAt,
    List<String> categories,
    @Nullable String rawContent,
    Destination destination,
    List<String> siteSanitizingCriteria) {

  public PendingEntry {
    categories = List.copyOf(categories);
    siteSanitizingCriteria =
        siteSanitizingCriteria == null ? List.of() : List.copyOf(siteSanitizingCriteria);
  }

  /** Copy carrying {@code content} in place of the fetched HTML. */
  public PendingEntry withRawContent(@Nullable String content) {
    return new PendingEntry(
        sourceId, url, title, publishedAt, categories, content, destination, siteSanitizingCriteria);
  }
}
