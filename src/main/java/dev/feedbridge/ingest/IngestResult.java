package dev.feedbridge.ingest;

import java.util.List;

/**
 * Entries found by one poll.
 *
 * @param entries new entries in feed order
 * @param dropped entries past the high-water mark that could not be prepared
 * @param sessionInvalidated a content fetch hit a login wall; the next cycle should log in again
 */
public record IngestResult(List<PendingEntry> entries, int dropped, boolean sessionInvalidated) {

  public IngestResult {
    entries = List.copyOf(entries);
  }
}
