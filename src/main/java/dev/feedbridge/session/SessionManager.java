package dev.feedbridge.session;

import dev.feedbridge.schedule.DueScheduler;
import dev.feedbridge.source.LoginBinding;
import dev.feedbridge.source.SourceConfig;
import dev.feedbridge.state.SourceState;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides whether a source's cached session can be reused and logs in again when it cannot.
 *
 * <p>A fresh login is required when any {@link LoginReason} applies. The imminent-expiry check
 * looks ahead to the next poll and the next refresh through {@link DueScheduler#nextRunAt}, which
 * never consumes due state.
 *
 * <p>A successful login replaces the cache entry as a unit and clears {@code forcePoll}. A failed
 * login leaves the cache untouched; the source then continues on its previous cookies if they are
 * still usable, otherwise the failure propagates as {@link AuthenticationException}.
 *
 * <p>Logins are serialized per cache key, so sources sharing a credential and site log in once.
 */
@Service
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  private final CookieCache cookieCache;
  private final AuthenticatorRegistry authenticators;
  private final DueScheduler dueScheduler;
  private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  public SessionManager(
      CookieCache cookieCache, AuthenticatorRegistry authenticators, DueScheduler dueScheduler) {
    this.cookieCache = cookieCache;
    this.authenticators = authenticators;
    this.dueScheduler = dueScheduler;
  }

  /**
   * Returns the session a source should use this cycle, logging in first when required.
   *
   * @param source the resolved source
   * @param state the source's current state
   * @param now the cycle's clock reading
   * @throws AuthenticationException if a login was required, failed, and no usable cookies remain
   */
  public Session ensureSession(SourceConfig source, SourceState state, Instant now) {
    LoginBinding login = source.login();
    if (login == null) {
      return Session.anonymous(state);
    }
    String cacheKey = login.cacheKey();
    ReentrantLock lock = locks.computeIfAbsent(cacheKey, key -> new ReentrantLock());
    lock.lock();
    try {
      Optional<CookieCacheEntry> cached = cookieCache.get(cacheKey);
      Set<LoginReason> reasons = loginReasons(source, state, cached, now);
      if (reasons.isEmpty()) {
        CookieCacheEntry entry = cached.orElseThrow();
        log.debug("Reusing cached session {} for source {}", cacheKey, source.id());
        return new Session(entry.cookies(), entry.capturedAt(), false, Set.of(), state);
      }
      log.info("Logging in for source {} ({}): {}", source.id(), cacheKey, reasons);
      return login(source, login, state, cached, reasons, now);
    } finally {
      lock.unlock();
    }
  }

  /** Every reason that makes the cached entry unusable for this cycle; empty to reuse it. */
  Set<LoginReason> loginReasons(
      SourceConfig source, SourceState state, Optional<CookieCacheEntry> cached, Instant now) {
    Set<LoginReason> reasons = EnumSet.noneOf(LoginReason.class);
    if (state.forcePoll()) {
      reasons.add(LoginReason.FORCED);
    }
    if (cached.isEmpty() || cached.get().cookies().isEmpty()) {
      reasons.add(LoginReason.NO_CACHED_COOKIES);
      return reasons;
    }
    var site = source.login().site();
    List<Cookie> cookies = cached.get().cookies();
    if (!RequiredCookies.missing(site, cookies).isEmpty()) {
      reasons.add(LoginReason.REQUIRED_COOKIE_MISSING);
    }
    if (!RequiredCookies.expired(site, cookies, now).isEmpty()) {
      reasons.add(LoginReason.COOKIE_EXPIRED);
    }
    Optional<Instant> earliest = RequiredCookies.earliestExpiry(site, cookies);
    if (earliest.isPresent() && earliest.get().isAfter(now) && expiresBeforeNextRun(
        source, state, earliest.get())) {
      reasons.add(LoginReason.IMMINENT_EXPIRY);
    }
    return reasons;
  }

  private boolean expiresBeforeNextRun(SourceConfig source, SourceState state, Instant expiry) {
    if (source.hasFeed()) {
      Optional<Instant> nextPoll =
          dueScheduler.nextRunAt(state.lastPollAt(), source.feed().pollCadence());
      if (nextPoll.isPresent() && !expiry.isAfter(nextPoll.get())) {
        return true;
      }
    }
    if (source.hasRefresh()) {
      Optional<Instant> nextRefresh =
          dueScheduler.nextRunAt(state.lastRefreshAt(), source.refresh().cadence());
      return nextRefresh.isPresent() && !expiry.isAfter(nextRefresh.get());
    }
    return false;
  }

  private Session login(
      SourceConfig source,
      LoginBinding binding,
      SourceState state,
      Optional<CookieCacheEntry> cached,
      Set<LoginReason> reasons,
      Instant now) {
    List<Cookie> cookies;
    try {
      cookies =
          authenticators
              .forType(binding.site().loginType())
              .login(binding.site(), binding.credential());
    } catch (AuthenticationException e) {
      return degrade(source, binding, state, cached, reasons, now, e);
    }
    CookieCacheEntry entry = new CookieCacheEntry(cookies, now);
    cookieCache.put(binding.cacheKey(), entry);
    log.info(
        "Login for source {} captured cookies {}", source.id(), Cookies.names(entry.cookies()));
    return new Session(entry.cookies(), now, true, reasons, state.withForcePoll(false));
  }

  private Session degrade(
      SourceConfig source,
      LoginBinding binding,
      SourceState state,
      Optional<CookieCacheEntry> cached,
      Set<LoginReason> reasons,
      Instant now,
      AuthenticationException failure) {
    if (cached.isPresent() && usable(binding, cached.get(), now)) {
      log.warn(
          "Login for source {} failed, continuing with cookies captured at {}: {}",
          source.id(),
          cached.get().capturedAt(),
          failure.getMessage());
      CookieCacheEntry entry = cached.get();
      return new Session(entry.cookies(), entry.capturedAt(), false, reasons, state);
    }
    log.warn("Login for source {} failed and no usable cookies remain", source.id());
    throw failure;
  }

  private static boolean usable(LoginBinding binding, CookieCacheEntry entry, Instant now) {
    return !entry.cookies().isEmpty()
        && RequiredCookies.missing(binding.site(), entry.cookies()).isEmpty()
        && RequiredCookies.expired(binding.site(), entry.cookies(), now).isEmpty();
  }
}
