package dev.feedbridge.state;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted per-source progress: the high-water mark, the last run of each timed operation, the
 * one-shot override flags and every published item not yet purged.
 *
 * <p>{@link Instant#EPOCH} means "never". All mutators return a new instance.
 */
public record SourceState(
    Instant highWaterMark,
    Instant lastPollAt,
    Instant lastRefreshAt,
    boolean forcePoll,
    boolean forceSyncAndPurge,
    Map<String, TrackedItem> trackedItems,
    int schemaVersion) {

  public static final int CURRENT_SCHEMA_VERSION = 1;

  public SourceState {
    highWaterMark = highWaterMark == null ? Instant.EPOCH : highWaterMark;
    lastPollAt = lastPollAt == null ? Instant.EPOCH : lastPollAt;
    lastRefreshAt = lastRefreshAt == null ? Instant.EPOCH : lastRefreshAt;
    trackedItems =
        trackedItems == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(trackedItems));
  }

  /** State of a source that has never run. */
  public static SourceState initial() {
    return new SourceState(
        Instant.EPOCH, Instant.EPOCH, Instant.EPOCH, false, false, Map.of(), CURRENT_SCHEMA_VERSION);
  }

  public SourceState withLastPollAt(Instant at) {
    return new SourceState(
        highWaterMark, at, lastRefreshAt, forcePoll, forceSyncAndPurge, trackedItems, schemaVersion);
  }

  public SourceState withLastRefreshAt(Instant at) {
    return new SourceState(
        highWaterMark, lastPollAt, at, forcePoll, forceSyncAndPurge, trackedItems, schemaVersion);
  }

  public SourceState withForcePoll(boolean force) {
    return new SourceState(
        highWaterMark, lastPollAt, lastRefreshAt, force, forceSyncAndPurge, trackedItems, schemaVersion);
  }

  public SourceState withForceSyncAndPurge(boolean force) {
    return new SourceState(
        highWaterMark, lastPollAt, lastRefreshAt, forcePoll, force, trackedItems, schemaVersion);
  }

  /**
   * Records a published item and raises the high-water mark to {@code entryPublishedAt} unless it
   * is already later.
   */
  public SourceState withPublished(String remoteId, TrackedItem item, Instant entryPublishedAt) {
    Map<String, TrackedItem> items = new LinkedHashMap<>(trackedItems);
    items.put(remoteId, item);
    Instant mark = entryPublishedAt.isAfter(highWaterMark) ? entryPublishedAt : highWaterMark;
    return new SourceState(
        mark, lastPollAt, lastRefreshAt, forcePoll, forceSyncAndPurge, items, schemaVersion);
  }

  public SourceState withoutTrackedItems(Collection<String> remoteIds) {
    if (remoteIds.isEmpty()) {
      return this;
    }
    Map<String, TrackedItem> items = new LinkedHashMap<>(trackedItems);
    remoteIds.forEach(items::remove);
    return new SourceState(
        highWaterMark, lastPollAt, lastRefreshAt, forcePoll, forceSyncAndPurge, items, schemaVersion);
  }
}
