package dev.feedbridge.sweep;

import java.util.Collection;
import java.util.Set;

/** Remote-state operations of one read-later account. */
public interface SyncTarget {

  /**
   * Reports which of {@code remoteIds} the service no longer holds.
   *
   * @throws SyncException if the status call fails
   */
  Set<String> status(Collection<String> remoteIds);

  /**
   * Deletes one item.
   *
   * @throws SyncException if the item could not be deleted
   */
  void delete(String remoteId);
}
