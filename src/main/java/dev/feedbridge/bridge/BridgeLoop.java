package dev.feedbridge.bridge;

import dev.feedbridge.state.StatePersistenceException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Repeats {@link Orchestrator#runCycle} on a single daemon thread, sleeping {@code
 * feedbridge.loop.interval} between cycles.
 *
 * <p>{@link #stop()} raises a flag that the publish step checks between entries, then waits for
 * the current cycle to return. A {@link StatePersistenceException} ends the loop and exits the
 * application with status 1; any other exception is logged and the next cycle runs as scheduled.
 */
@Component
public class BridgeLoop implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(BridgeLoop.class);

  private final Orchestrator orchestrator;
  private final LoopProperties properties;
  private final Runnable onFatal;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> cycleTask;
  private volatile boolean stopped;

  @Autowired
  public BridgeLoop(
      Orchestrator orchestrator, LoopProperties properties, ConfigurableApplicationContext context) {
    this(orchestrator, properties, () -> exitApplication(context));
  }

  BridgeLoop(Orchestrator orchestrator, LoopProperties properties, Runnable onFatal) {
    this.orchestrator = orchestrator;
    this.properties = properties;
    this.onFatal = onFatal;
  }

  @Override
  public synchronized void start() {
    if (cycleTask != null) {
      return;
    }
    stopped = false;
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("feedbridge-loop-"));
    cycleTask =
        scheduler.scheduleWithFixedDelay(
            this::runOnce, 0, properties.interval().toMillis(), TimeUnit.MILLISECONDS);
    log.info("Bridge loop started, interval {}", properties.interval());
  }

  /** Runs one cycle unless stopped. Called by the scheduler; tests may call it directly. */
  void runOnce() {
    if (stopped) {
      return;
    }
    try {
      CycleReport report = orchestrator.runCycle(() -> stopped);
      log.debug("Cycle report: {}", report);
    } catch (StatePersistenceException e) {
      log.error("State can no longer be persisted, stopping", e);
      stopped = true;
      onFatal.run();
    } catch (RuntimeException e) {
      log.error("Cycle failed unexpectedly, continuing with the next one", e);
    }
  }

  @Override
  public synchronized void stop() {
    stopped = true;
    if (cycleTask != null) {
      cycleTask.cancel(false);
      cycleTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
          log.warn("Bridge loop did not finish its cycle within 30s");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      scheduler = null;
    }
  }

  @Override
  public boolean isRunning() {
    return cycleTask != null;
  }

  @Override
  public boolean isAutoStartup() {
    return properties.enabled();
  }

  boolean isStopped() {
    return stopped;
  }

  private static void exitApplication(ConfigurableApplicationContext context) {
    // Closing the context stops this loop and waits for it, so exit from another thread.
    Thread exiter =
        new Thread(() -> System.exit(SpringApplication.exit(context, () -> 1)), "feedbridge-exit");
    exiter.start();
  }
}
