package dev.feedbridge.session;

import java.time.Instant;
import java.util.List;

/** The cookies captured by one login, replaced as a unit by the next. */
public record CookieCacheEntry(List<Cookie> cookies, Instant capturedAt) {

  public CookieCacheEntry {
    cookies = List.copyOf(cookies);
  }
}
