package dev.feedbridge.session;

import java.util.Optional;

/**
 * Captured cookies keyed by {@code credentialId-siteId}. Entries are replaced whole; cookies from
 * different logins are never merged.
 */
public interface CookieCache {

  Optional<CookieCacheEntry> get(String cacheKey);

  void put(String cacheKey, CookieCacheEntry entry);
}
