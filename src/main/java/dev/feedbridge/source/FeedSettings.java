package dev.feedbridge.source;

import java.time.Duration;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Where and how often to poll a feed.
 *
 * @param url feed document URL
 * @param requiresAuth the feed document itself must be fetched with session cookies
 * @param paywalled article bodies must be fetched with session cookies and published as content
 * @param pollCadence time between polls; zero disables polling
 * @param initialLookback on the first poll, only entries newer than {@code now - initialLookback}
 *     are taken; {@code null} takes the full backlog
 * @param headers extra HTTP headers for content fetches, overriding the site's
 */
public record FeedSettings(
    String url,
    boolean requiresAuth,
    boolean paywalled,
    @DefaultValue("1h") Duration pollCadence,
    @Nullable Duration initialLookback,
    Map<String, String> headers) {

  static final Duration DEFAULT_POLL_CADENCE = Duration.ofHours(1);

  public FeedSettings {
    pollCadence = pollCadence == null ? DEFAULT_POLL_CADENCE : pollCadence;
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }
}
