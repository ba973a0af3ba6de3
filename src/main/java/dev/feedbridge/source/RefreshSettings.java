package dev.feedbridge.source;

import java.time.Duration;
import java.util.List;

/**
 * Pushes a source's session cookies to a downstream feed reader.
 *
 * @param target key of the configured refresh target (a Miniflux instance)
 * @param feedIds downstream feed ids receiving the cookies
 * @param cadence time between pushes; zero disables the periodic push
 */
public record RefreshSettings(String target, List<Long> feedIds, Duration cadence) {

  public RefreshSettings {
    feedIds = feedIds == null ? List.of() : List.copyOf(feedIds);
    cadence = cadence == null ? Duration.ZERO : cadence;
  }
}
