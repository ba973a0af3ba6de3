package dev.feedbridge.sweep;

/** Looks up the {@link SyncTarget} for a configured account. */
public interface SyncTargets {

  /** @throws dev.feedbridge.source.ConfigurationException if the account is not configured */
  SyncTarget forAccount(String account);
}
