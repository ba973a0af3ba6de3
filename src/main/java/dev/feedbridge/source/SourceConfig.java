package dev.feedbridge.source;

import org.jspecify.annotations.Nullable;

/**
 * A validated, runnable source. Every part is optional: a source may only keep a session alive
 * and push cookies downstream, or only poll a public feed.
 */
public record SourceConfig(
    String id,
    @Nullable FeedSettings feed,
    @Nullable LoginBinding login,
    @Nullable Destination destination,
    @Nullable RefreshSettings refresh) {

  public boolean hasFeed() {
    return feed != null;
  }

  public boolean hasLogin() {
    return login != null;
  }

  public boolean hasRefresh() {
    return refresh != null && !refresh.feedIds().isEmpty();
  }
}
