package dev.feedbridge.publish;

import dev.feedbridge.ingest.PendingEntry;
import dev.feedbridge.source.ConfigurationException;
import dev.feedbridge.source.Destination;
import dev.feedbridge.state.SourceState;
import dev.feedbridge.state.StatePersistenceException;
import dev.feedbridge.state.StateStore;
import dev.feedbridge.state.TrackedItem;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Publishes a cycle's entries from every source in one chronological order.
 *
 * <p>Entries are sorted by published time (ties keep their collection order) and published one at
 * a time. After each success the owning source's state is reloaded, the new remote id is tracked,
 * the high-water mark is raised to the entry's time and the state is saved, all before the next
 * entry starts. A crash mid-batch can therefore only cause the in-flight entry to be published
 * again, never lose an entry.
 *
 * <p>A failed entry is logged and skipped; it does not move the high-water mark. The state store
 * failing ({@link StatePersistenceException}) aborts the batch.
 */
@Service
public class PublishPipeline {

  private static final Logger log = LoggerFactory.getLogger(PublishPipeline.class);

  private final PublishTargets publishTargets;
  private final StateStore stateStore;
  private final Clock clock;

  public PublishPipeline(PublishTargets publishTargets, StateStore stateStore, Clock clock) {
    this.publishTargets = publishTargets;
    this.stateStore = stateStore;
    this.clock = clock;
  }

  /**
   * Publishes {@code entries} oldest first.
   *
   * @param cancelled checked before each entry; an entry already in flight always completes
   */
  public PublishReport publishBatch(List<PendingEntry> entries, BooleanSupplier cancelled) {
    List<PendingEntry> ordered = new ArrayList<>(entries);
    ordered.sort(Comparator.comparing(PendingEntry::publishedAt));

    FolderResolver folders = new FolderResolver();
    int published = 0;
    int failed = 0;
    for (PendingEntry entry : ordered) {
      if (cancelled.getAsBoolean()) {
        log.info("Publishing cancelled with {} entries left", ordered.size() - published - failed);
        return new PublishReport(published, failed, true);
      }
      if (publishOne(entry, folders)) {
        published++;
      } else {
        failed++;
      }
    }
    if (!ordered.isEmpty()) {
      log.info("Published {} of {} entries ({} failed)", published, ordered.size(), failed);
    }
    return new PublishReport(published, failed, false);
  }

  private boolean publishOne(PendingEntry entry, FolderResolver folders) {
    Destination destination = entry.destination();
    PublishReceipt receipt;
    try {
      PublishTarget target = publishTargets.forAccount(destination.account());
      String folderId = null;
      if (destination.folder() != null && !destination.folder().isBlank()) {
        Optional<String> resolved = folders.resolve(destination.account(), target, destination.folder());
        folderId = resolved.orElse(null);
      }
      List<String> tags = TagComposer.compose(destination, entry.categories());
      receipt = target.publish(prepareContent(entry), tags, folderId);
    } catch (PublishException | ConfigurationException e) {
      log.warn(
          "Failed to publish {} from source {}: {}", entry.url(), entry.sourceId(), e.getMessage());
      return false;
    } catch (StatePersistenceException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Unexpected failure publishing {} from source {}", entry.url(), entry.sourceId(), e);
      return false;
    }

    SourceState state = stateStore.load(entry.sourceId());
    TrackedItem item =
        new TrackedItem(entry.title(), receipt.contentLocation(), entry.url(), clock.instant());
    stateStore.save(entry.sourceId(), state.withPublished(receipt.remoteId(), item, entry.publishedAt()));
    log.info(
        "Published {} from source {} as {} ({})",
        entry.url(),
        entry.sourceId(),
        receipt.remoteId(),
        entry.publishedAt());
    return true;
  }

  private static PendingEntry prepareContent(PendingEntry entry) {
    if (entry.rawContent() == null || !entry.destination().sanitizeContent()) {
      return entry;
    }
    return entry.withRawContent(
        HtmlSanitizer.sanitize(entry.rawContent(), HtmlSanitizer.criteriaFor(entry)));
  }
}
