package dev.feedbridge.sweep;

import dev.feedbridge.source.Destination;
import dev.feedbridge.source.SourceConfig;
import dev.feedbridge.state.SourceState;
import dev.feedbridge.state.StateStore;
import dev.feedbridge.state.TrackedItem;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reconciles a source's tracked items with the read-later service and purges expired ones.
 *
 * <p>Runs only while the source's {@code forceSyncAndPurge} flag is set. Sync drops every tracked
 * id the service reports deleted, without further calls. Retention deletes every item published
 * strictly before {@code now - retention}; an item exactly at the boundary is kept. A failed
 * delete keeps the item for a later sweep.
 *
 * <p>The flag is cleared once the sweep completes, even with failed deletes. A failing status call
 * aborts the sweep and leaves the flag set.
 */
@Service
public class SyncAndRetentionSweeper {

  private static final Logger log = LoggerFactory.getLogger(SyncAndRetentionSweeper.class);

  private final SyncTargets syncTargets;
  private final StateStore stateStore;
  private final Clock clock;

  public SyncAndRetentionSweeper(SyncTargets syncTargets, StateStore stateStore, Clock clock) {
    this.syncTargets = syncTargets;
    this.stateStore = stateStore;
    this.clock = clock;
  }

  /**
   * Sweeps one source if its flag is set.
   *
   * @throws SyncException if the status call fails; the flag stays set
   */
  public SweepReport sweep(SourceConfig source) {
    SourceState state = stateStore.load(source.id());
    if (!state.forceSyncAndPurge()) {
      return SweepReport.notRequested();
    }
    Destination destination = source.destination();
    if (destination == null) {
      stateStore.save(source.id(), state.withForceSyncAndPurge(false));
      return new SweepReport(true, 0, 0, 0);
    }
    SyncTarget target = syncTargets.forAccount(destination.account());

    Set<String> removedRemotely = sync(source, state, target);
    state = state.withoutTrackedItems(removedRemotely);

    List<String> purged = new ArrayList<>();
    int deleteFailures = 0;
    if (destination.retention() != null) {
      Instant cutoff = clock.instant().minus(destination.retention());
      for (Map.Entry<String, TrackedItem> item : state.trackedItems().entrySet()) {
        if (!item.getValue().publishedAt().isBefore(cutoff)) {
          continue;
        }
        try {
          target.delete(item.getKey());
          purged.add(item.getKey());
        } catch (SyncException e) {
          deleteFailures++;
          log.warn(
              "Failed to delete {} of source {}, keeping it: {}",
              item.getKey(),
              source.id(),
              e.getMessage());
        }
      }
      state = state.withoutTrackedItems(purged);
    }

    stateStore.save(source.id(), state.withForceSyncAndPurge(false));
    log.info(
        "Swept source {}: {} removed remotely, {} purged, {} deletes failed",
        source.id(),
        removedRemotely.size(),
        purged.size(),
        deleteFailures);
    return new SweepReport(true, removedRemotely.size(), purged.size(), deleteFailures);
  }

  private Set<String> sync(SourceConfig source, SourceState state, SyncTarget target) {
    if (state.trackedItems().isEmpty()) {
      return Set.of();
    }
    Set<String> reported = target.status(state.trackedItems().keySet());
    Set<String> removed = new HashSet<>(reported);
    removed.retainAll(state.trackedItems().keySet());
    if (!removed.isEmpty()) {
      log.info("Source {}: {} items were deleted remotely", source.id(), removed.size());
    }
    return removed;
  }
}
