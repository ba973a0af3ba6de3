package dev.feedbridge.state;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class SourceStateTest {

  private static final Instant T1 = Instant.parse("2026-01-01T00:00:00Z");
  private static final Instant T2 = Instant.parse("2026-01-02T00:00:00Z");

  private static TrackedItem item(String url) {
    return new TrackedItem("title", null, url, T2);
  }

  @Test
  void initialStateHasNeverRun() {
    SourceState state = SourceState.initial();

    assertThat(state.highWaterMark()).isEqualTo(Instant.EPOCH);
    assertThat(state.lastPollAt()).isEqualTo(Instant.EPOCH);
    assertThat(state.lastRefreshAt()).isEqualTo(Instant.EPOCH);
    assertThat(state.trackedItems()).isEmpty();
    assertThat(state.schemaVersion()).isEqualTo(SourceState.CURRENT_SCHEMA_VERSION);
  }

  @Test
  void publishingOlderEntryTracksItButKeepsMark() {
    SourceState state =
        SourceState.initial()
            .withPublished("200", item("https://example.com/b"), T2)
            .withPublished("100", item("https://example.com/a"), T1);

    assertThat(state.highWaterMark()).isEqualTo(T2);
    assertThat(state.trackedItems()).containsOnlyKeys("200", "100");
  }

  @Test
  void removingTrackedItemsKeepsTheRest() {
    SourceState state =
        SourceState.initial()
            .withPublished("1", item("https://example.com/1"), T1)
            .withPublished("2", item("https://example.com/2"), T2)
            .withoutTrackedItems(List.of("1", "unknown"));

    assertThat(state.trackedItems()).containsOnlyKeys("2");
    assertThat(state.highWaterMark()).isEqualTo(T2);
  }

  @Test
  void flagsAreIndependent() {
    SourceState state = SourceState.initial().withForcePoll(true).withForceSyncAndPurge(true);

    assertThat(state.withForcePoll(false).forceSyncAndPurge()).isTrue();
    assertThat(state.withForceSyncAndPurge(false).forcePoll()).isTrue();
  }
}
