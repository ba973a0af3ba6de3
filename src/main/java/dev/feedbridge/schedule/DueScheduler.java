package dev.feedbridge.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Cadence arithmetic shared by polling and refreshing.
 *
 * <p>{@link Instant#EPOCH} is the "never ran" sentinel and is always due. A {@code null}, zero or
 * negative cadence disables the operation entirely. Neither method has side effects, so the session
 * lookahead can ask about the next poll without consuming it.
 */
@Component
public class DueScheduler {

  /**
   * Whether an operation last run at {@code lastRunAt} should run at {@code now}.
   *
   * @param lastRunAt last successful run, {@link Instant#EPOCH} if never
   * @param cadence time between runs; disabled when {@code null} or not positive
   * @param now current time
   * @return {@code true} when {@code now - lastRunAt >= cadence}
   */
  public boolean isDue(Instant lastRunAt, @Nullable Duration cadence, Instant now) {
    if (!enabled(cadence)) {
      return false;
    }
    if (lastRunAt == null || Instant.EPOCH.equals(lastRunAt)) {
      return true;
    }
    return !now.isBefore(lastRunAt.plus(cadence));
  }

  /**
   * When the operation next becomes due, or empty when the cadence disables it. A never-run
   * operation is due at {@link Instant#EPOCH}, i.e. immediately.
   */
  public Optional<Instant> nextRunAt(Instant lastRunAt, @Nullable Duration cadence) {
    if (!enabled(cadence)) {
      return Optional.empty();
    }
    if (lastRunAt == null || Instant.EPOCH.equals(lastRunAt)) {
      return Optional.of(Instant.EPOCH);
    }
    return Optional.of(lastRunAt.plus(cadence));
  }

  private static boolean enabled(@Nullable Duration cadence) {
    return cadence != null && !cadence.isZero() && !cadence.isNegative();
  }
}
