package dev.feedbridge.sweep;

/**
 * Outcome of one sweep.
 *
 * @param ran the sweep was requested and completed
 * @param removedRemotely items the service reported deleted
 * @param purged items deleted for exceeding retention
 * @param deleteFailures retention deletes that failed and stay tracked
 */
public record SweepReport(boolean ran, int removedRemotely, int purged, int deleteFailures) {

  static SweepReport notRequested() {
    return new SweepReport(false, 0, 0, 0);
  }
}
