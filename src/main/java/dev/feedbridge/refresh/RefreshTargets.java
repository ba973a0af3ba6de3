package dev.feedbridge.refresh;

import dev.feedbridge.source.RefreshSettings;

/** Resolves the {@link RefreshTarget} described by a source's refresh settings. */
public interface RefreshTargets {

  /** @throws dev.feedbridge.source.ConfigurationException if the target is not configured */
  RefreshTarget forSettings(RefreshSettings settings);
}
