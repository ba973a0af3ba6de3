package dev.feedbridge.session;

import dev.feedbridge.state.SourceState;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of {@link SessionManager#ensureSession}.
 *
 * @param cookies cookies to use this cycle; empty for unauthenticated sources
 * @param capturedAt capture time of {@code cookies}, {@code null} when there are none
 * @param loggedIn a fresh login happened this cycle
 * @param reasons why a login was attempted; empty when the cache was reused
 * @param state the source state after session handling ({@code forcePoll} cleared on login)
 */
public record Session(
    List<Cookie> cookies,
    @Nullable Instant capturedAt,
    boolean loggedIn,
    Set<LoginReason> reasons,
    SourceState state) {

  public Session {
    cookies = List.copyOf(cookies);
    reasons = Set.copyOf(reasons);
  }

  public static Session anonymous(SourceState state) {
    return new Session(List.of(), null, false, Set.of(), state);
  }

  public boolean hasCookies() {
    return !cookies.isEmpty();
  }
}
