package dev.feedbridge.source;

/** Discriminant selecting which {@code Authenticator} performs a site's login. */
public enum LoginType {
  /** Fill and submit the site's HTML login form. */
  FORM,
  /** Call the site's login endpoint directly, optionally after pre-login steps. */
  API
}
