package dev.feedbridge.session;

import static org.assertj.core.api.Assertions.assertThat;

import dev.feedbridge.BaseIntegrationTest;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class JpaCookieCacheIT extends BaseIntegrationTest {

  private static final Instant CAPTURED = Instant.parse("2026-03-01T12:00:00Z");

  @Autowired private CookieCache cookieCache;

  @Test
  void missingKeyIsEmpty() {
    assertThat(cookieCache.get("nobody-nowhere")).isEmpty();
  }

  @Test
  void storesCookiesWithAllAttributes() {
    Cookie sid =
        new Cookie("sid", "abc", ".example.com", "/", CAPTURED.plusSeconds(3600), true, true);
    CookieCacheEntry entry = new CookieCacheEntry(List.of(sid, Cookie.of("lang", "en")), CAPTURED);

    cookieCache.put("alice-roundtrip", entry);

    assertThat(cookieCache.get("alice-roundtrip")).contains(entry);
  }

  @Test
  void newEntryReplacesOldOneWhole() {
    cookieCache.put(
        "alice-replace",
        new CookieCacheEntry(List.of(Cookie.of("sid", "old"), Cookie.of("csrf", "old")), CAPTURED));
    CookieCacheEntry fresh =
        new CookieCacheEntry(List.of(Cookie.of("sid", "new")), CAPTURED.plusSeconds(60));

    cookieCache.put("alice-replace", fresh);

    assertThat(cookieCache.get("alice-replace")).contains(fresh);
  }
}
