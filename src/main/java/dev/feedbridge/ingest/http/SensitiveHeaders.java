package dev.feedbridge.ingest.http;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Produces a log-safe copy of request headers. */
final class SensitiveHeaders {

  private static final Set<String> REDACTED =
      Set.of("authorization", "cookie", "proxy-authorization", "x-auth-token", "x-api-key");

  private SensitiveHeaders() {}

  static Map<String, String> redact(Map<String, String> headers) {
    Map<String, String> safe = new LinkedHashMap<>();
    headers.forEach(
        (name, value) ->
            safe.put(name, REDACTED.contains(name.toLowerCase(Locale.ROOT)) ? "<redacted>" : value));
    return safe;
  }
}
