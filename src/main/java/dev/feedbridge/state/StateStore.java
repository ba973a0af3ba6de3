package dev.feedbridge.state;

/** Durable storage of one {@link SourceState} per source id. */
public interface StateStore {

  /**
   * Loads a source's state, creating the initial state for an unknown source.
   *
   * @throws StatePersistenceException if the store cannot be read
   */
  SourceState load(String sourceId);

  /**
   * Replaces a source's state. The write is committed before this method returns.
   *
   * @throws StatePersistenceException if the write fails
   */
  void save(String sourceId, SourceState state);
}
