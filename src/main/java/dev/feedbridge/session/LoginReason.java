package dev.feedbridge.session;

/** Why a fresh login was required. */
public enum LoginReason {
  NO_CACHED_COOKIES,
  COOKIE_EXPIRED,
  REQUIRED_COOKIE_MISSING,
  /** A required cookie expires before the next poll or refresh would run. */
  IMMINENT_EXPIRY,
  FORCED
}
