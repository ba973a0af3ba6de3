package dev.feedbridge.ingest;

import java.util.List;

/** A parsed feed: its own categories plus its entries in document order. */
public record FeedDocument(String title, List<String> categories, List<FeedItem> items) {

  public FeedDocument {
    categories = categories == null ? List.of() : List.copyOf(categories);
    items = List.copyOf(items);
  }
}
