package dev.feedbridge.bridge;

import dev.feedbridge.ingest.FeedIngestor;
import dev.feedbridge.ingest.FetchException;
import dev.feedbridge.ingest.IngestResult;
import dev.feedbridge.ingest.PendingEntry;
import dev.feedbridge.publish.PublishPipeline;
import dev.feedbridge.publish.PublishReport;
import dev.feedbridge.refresh.RefreshException;
import dev.feedbridge.refresh.RefreshTargets;
import dev.feedbridge.schedule.DueScheduler;
import dev.feedbridge.session.AuthenticationException;
import dev.feedbridge.session.Session;
import dev.feedbridge.session.SessionManager;
import dev.feedbridge.source.ConfigurationException;
import dev.feedbridge.source.SourceCatalog;
import dev.feedbridge.source.SourceConfig;
import dev.feedbridge.state.SourceState;
import dev.feedbridge.state.StatePersistenceException;
import dev.feedbridge.state.StateStore;
import dev.feedbridge.sweep.SweepReport;
import dev.feedbridge.sweep.SyncAndRetentionSweeper;
import dev.feedbridge.sweep.SyncException;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one bridge cycle over every configured source.
 *
 * <p>Each source moves through session check, optional login, optional poll and optional
 * downstream refresh independently; a failure in one source is logged and never blocks the
 * others. Entries from all sources are then published in one global chronological batch, and
 * finally sources flagged for sync and purge are swept.
 *
 * <p>With {@code feedbridge.loop.parallelism > 1} the per-source phase runs on a fixed pool and
 * the cycle waits for every source before publishing. Only {@link StatePersistenceException}
 * escapes a cycle.
 */
@Service
public class Orchestrator {

  private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

  private final SourceCatalog catalog;
  private final StateStore stateStore;
  private final SessionManager sessionManager;
  private final DueScheduler dueScheduler;
  private final FeedIngestor feedIngestor;
  private final RefreshTargets refreshTargets;
  private final PublishPipeline publishPipeline;
  private final SyncAndRetentionSweeper sweeper;
  private final Clock clock;
  private final @Nullable ExecutorService workers;

  public Orchestrator(
      SourceCatalog catalog,
      StateStore stateStore,
      SessionManager sessionManager,
      DueScheduler dueScheduler,
      FeedIngestor feedIngestor,
      RefreshTargets refreshTargets,
      PublishPipeline publishPipeline,
      SyncAndRetentionSweeper sweeper,
      Clock clock,
      LoopProperties loopProperties) {
    this.catalog = catalog;
    this.stateStore = stateStore;
    this.sessionManager = sessionManager;
    this.dueScheduler = dueScheduler;
    this.feedIngestor = feedIngestor;
    this.refreshTargets = refreshTargets;
    this.publishPipeline = publishPipeline;
    this.sweeper = sweeper;
    this.clock = clock;
    this.workers =
        loopProperties.parallelism() > 1
            ? Executors.newFixedThreadPool(
                loopProperties.parallelism(), new DaemonThreadFactory("feedbridge-source-"))
            : null;
  }

  @PreDestroy
  void shutdown() {
    if (workers != null) {
      workers.shutdown();
    }
  }

  /**
   * Runs one full cycle.
   *
   * @param cancelled checked between publish entries
   * @throws StatePersistenceException if state can no longer be saved
   */
  public CycleReport runCycle(BooleanSupplier cancelled) {
    Instant now = clock.instant();
    List<String> sourceIds = catalog.sourceIds();
    List<SourceOutcome> outcomes = processSources(sourceIds, now);

    List<PendingEntry> batch = new ArrayList<>();
    int failedSources = 0;
    for (SourceOutcome outcome : outcomes) {
      batch.addAll(outcome.entries());
      if (outcome.failed()) {
        failedSources++;
      }
    }

    PublishReport published = publishPipeline.publishBatch(batch, cancelled);
    if (published.cancelled()) {
      return new CycleReport(
          sourceIds.size(), failedSources, published.published(), published.failed(), 0, true);
    }

    int swept = 0;
    for (SourceOutcome outcome : outcomes) {
      if (outcome.source() != null && sweep(outcome.source())) {
        swept++;
      }
    }
    log.info(
        "Cycle finished: {} sources ({} failed), {} published, {} publish failures, {} swept",
        sourceIds.size(),
        failedSources,
        published.published(),
        published.failed(),
        swept);
    return new CycleReport(
        sourceIds.size(), failedSources, published.published(), published.failed(), swept, false);
  }

  private List<SourceOutcome> processSources(List<String> sourceIds, Instant now) {
    if (workers == null) {
      return sourceIds.stream().map(id -> processSource(id, now)).toList();
    }
    List<Callable<SourceOutcome>> tasks = new ArrayList<>();
    for (String id : sourceIds) {
      tasks.add(() -> processSource(id, now));
    }
    List<SourceOutcome> outcomes = new ArrayList<>();
    try {
      List<Future<SourceOutcome>> futures = workers.invokeAll(tasks);
      for (int i = 0; i < futures.size(); i++) {
        outcomes.add(await(futures.get(i), sourceIds.get(i)));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for source workers");
    }
    return outcomes;
  }

  private static SourceOutcome await(Future<SourceOutcome> future, String sourceId)
      throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      if (e.getCause() instanceof StatePersistenceException persistence) {
        throw persistence;
      }
      log.error("Source {} failed unexpectedly", sourceId, e.getCause());
      return SourceOutcome.failed(null);
    }
  }

  /** Session, poll and refresh for one source. Only {@link StatePersistenceException} escapes. */
  SourceOutcome processSource(String sourceId, Instant now) {
    try {
      return runSource(sourceId, now);
    } catch (StatePersistenceException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Source {} failed unexpectedly", sourceId, e);
      return SourceOutcome.failed(null);
    }
  }

  private SourceOutcome runSource(String sourceId, Instant now) {
    SourceConfig source;
    try {
      source = catalog.resolve(sourceId);
    } catch (ConfigurationException e) {
      log.warn("Skipping source {}: {}", sourceId, e.getMessage());
      return SourceOutcome.failed(null);
    }

    SourceState state = stateStore.load(sourceId);
    Session session;
    try {
      session = sessionManager.ensureSession(source, state, now);
    } catch (AuthenticationException | ConfigurationException e) {
      log.warn("No session for source {}, skipping poll and refresh: {}", sourceId, e.getMessage());
      return SourceOutcome.failed(source);
    }
    state = session.state();

    boolean failed = false;
    List<PendingEntry> entries = List.of();
    if (pollDue(source, state, now)) {
      try {
        IngestResult result = feedIngestor.fetchNewEntries(source, state.highWaterMark(), session);
        entries = result.entries();
        state = state.withLastPollAt(now);
        if (!source.hasLogin()) {
          state = state.withForcePoll(false);
        }
        if (result.sessionInvalidated()) {
          state = state.withForcePoll(true);
        }
      } catch (FetchException e) {
        log.warn("Poll of source {} failed: {}", sourceId, e.getMessage());
        failed = true;
      }
    }

    if (refreshDue(source, state, session, now)) {
      try {
        refreshTargets.forSettings(source.refresh()).refresh(session.cookies());
        state = state.withLastRefreshAt(now);
        log.info("Pushed cookies of source {} to {}", sourceId, source.refresh().target());
      } catch (RefreshException | ConfigurationException e) {
        log.warn("Refresh of source {} failed: {}", sourceId, e.getMessage());
        failed = true;
      }
    }

    stateStore.save(sourceId, state);
    return new SourceOutcome(source, entries, failed);
  }

  /** A successful login has already cleared {@code forcePoll}, so here it forces anonymous polls. */
  private boolean pollDue(SourceConfig source, SourceState state, Instant now) {
    if (!source.hasFeed()) {
      return false;
    }
    return state.forcePoll()
        || dueScheduler.isDue(state.lastPollAt(), source.feed().pollCadence(), now);
  }

  /** Due by cadence, or because the session cookies changed since the last push. */
  private boolean refreshDue(SourceConfig source, SourceState state, Session session, Instant now) {
    if (!source.hasRefresh() || !session.hasCookies()) {
      return false;
    }
    if (dueScheduler.nextRunAt(state.lastRefreshAt(), source.refresh().cadence()).isEmpty()) {
      return false;
    }
    boolean cookiesChanged =
        session.capturedAt() != null && session.capturedAt().isAfter(state.lastRefreshAt());
    return cookiesChanged
        || dueScheduler.isDue(state.lastRefreshAt(), source.refresh().cadence(), now);
  }

  private boolean sweep(SourceConfig source) {
    try {
      SweepReport report = sweeper.sweep(source);
      return report.ran();
    } catch (SyncException | ConfigurationException e) {
      log.warn("Sweep of source {} failed, will retry next cycle: {}", source.id(), e.getMessage());
      return false;
    } catch (StatePersistenceException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Sweep of source {} failed unexpectedly", source.id(), e);
      return false;
    }
  }

  record SourceOutcome(@Nullable SourceConfig source, List<PendingEntry> entries, boolean failed) {

    static SourceOutcome failed(@Nullable SourceConfig source) {
      return new SourceOutcome(source, List.of(), true);
    }
  }
}
