package dev.feedbridge.ingest.http;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** Recognises login redirects and paywall teasers in article responses. */
final class PaywallDetector {

  private static final Set<String> LOGIN_TOKENS = Set.of("login", "signin", "sign-in", "log-in");

  private static final List<String> PAYWALL_MARKERS =
      List.of(
          "class=\"paywall\"",
          "id=\"paywall\"",
          "class=\"gated-content\"",
          "id=\"gated-content\"",
          "<h2>sign in to continue reading</h2>",
          "<h2>subscribe to continue reading</h2>",
          "<h2>log in or subscribe to read more</h2>",
          "<div class=\"post-access-notice\"",
          "data-testid=\"paywall-overlay\"",
          "this post is for paid subscribers",
          "this post is for subscribers only",
          "only paid subscribers can read this post",
          "only members can read this post");

  private PaywallDetector() {}

  /** Whether a path segment is a login token or the query mentions one. */
  static boolean isLoginUrl(URI uri) {
    String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
    for (String segment : path.split("/")) {
      if (LOGIN_TOKENS.contains(segment)) {
        return true;
      }
    }
    String query = uri.getRawQuery() == null ? "" : uri.getRawQuery().toLowerCase(Locale.ROOT);
    return LOGIN_TOKENS.stream().anyMatch(query::contains);
  }

  /** The first paywall marker found in {@code html}, compared case-insensitively. */
  static Optional<String> paywallMarker(String html) {
    String lower = html.toLowerCase(Locale.ROOT);
    return PAYWALL_MARKERS.stream().filter(lower::contains).findFirst();
  }
}
