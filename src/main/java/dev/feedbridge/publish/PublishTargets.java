package dev.feedbridge.publish;

/** Looks up the {@link PublishTarget} for a configured account. */
public interface PublishTargets {

  /** @throws dev.feedbridge.source.ConfigurationException if the account is not configured */
  PublishTarget forAccount(String account);
}
