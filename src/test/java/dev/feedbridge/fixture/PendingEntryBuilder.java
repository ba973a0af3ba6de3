package dev.feedbridge.fixture;

import dev.feedbridge.ingest.PendingEntry;
import dev.feedbridge.source.Destination;
import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Test builder for {@link PendingEntry} with defaults for everything but the timestamp. */
public final class PendingEntryBuilder {

  private String sourceId = "example";
  private String url = "https://example.com/post";
  private String title = "A post";
  private Instant publishedAt = Instant.parse("2026-01-01T00:00:00Z");
  private List<String> categories = List.of();
  private @Nullable String rawContent;
  private Destination destination = SourceConfigBuilder.destination("main", null, null);
  private List<String> siteSanitizingCriteria = List.of();

  public PendingEntryBuilder sourceId(String sourceId) {
    this.sourceId = sourceId;
    return this;
  }

  public PendingEntryBuilder url(String url) {
    this.url = url;
    return this;
  }

  public PendingEntryBuilder title(String title) {
    this.title = title;
    return this;
  }

  public PendingEntryBuilder publishedAt(Instant publishedAt) {
    this.publishedAt = publishedAt;
    return this;
  }

  public PendingEntryBuilder publishedAt(String publishedAt) {
    return publishedAt(Instant.parse(publishedAt));
  }

  public PendingEntryBuilder categories(String... categories) {
    this.categories = List.of(categories);
    return this;
  }

  public PendingEntryBuilder rawContent(String rawContent) {
    this.rawContent = rawContent;
    return this;
  }

  public PendingEntryBuilder destination(Destination destination) {
    this.destination = destination;
    return this;
  }

  public PendingEntryBuilder siteSanitizingCriteria(String... criteria) {
    this.siteSanitizingCriteria = List.of(criteria);
    return this;
  }

  public PendingEntry build() {
    return new PendingEntry(
        sourceId, url, title, publishedAt, categories, rawContent, destination, siteSanitizingCriteria);
  }
}
