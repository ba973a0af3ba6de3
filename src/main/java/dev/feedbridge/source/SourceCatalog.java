package dev.feedbridge.source;

import java.util.List;

/** Lists configured sources and resolves them into validated {@link SourceConfig}s. */
public interface SourceCatalog {

  /** Ids of every configured source, in configuration order. */
  List<String> sourceIds();

  /**
   * Resolves a source, following its credential and site references.
   *
   * @throws ConfigurationException if the source is unknown or its configuration is inconsistent
   */
  SourceConfig resolve(String sourceId);
}
