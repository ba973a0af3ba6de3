package dev.feedbridge.state;

import static org.assertj.core.api.Assertions.assertThat;

import dev.feedbridge.BaseIntegrationTest;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class JpaStateStoreIT extends BaseIntegrationTest {

  private static final Instant T1 = Instant.parse("2026-02-01T00:00:00Z");
  private static final Instant T2 = Instant.parse("2026-02-02T00:00:00Z");

  @Autowired private StateStore stateStore;
  @Autowired private SourceStateRepository repository;

  private static TrackedItem item(String url, Instant publishedAt) {
    return new TrackedItem("Title", null, url, publishedAt);
  }

  @Test
  void firstLoadPersistsInitialState() {
    SourceState state = stateStore.load("store-new");

    assertThat(state).isEqualTo(SourceState.initial());
    assertThat(repository.existsById("store-new")).isTrue();
  }

  @Test
  void savedStateSurvivesReload() {
    SourceState state =
        SourceState.initial()
            .withLastPollAt(T2)
            .withLastRefreshAt(T1)
            .withForcePoll(true)
            .withPublished("100", item("https://example.com/a", T1), T1)
            .withPublished("101", item("https://example.com/b", T2), T2);

    stateStore.save("store-roundtrip", state);

    SourceState loaded = stateStore.load("store-roundtrip");
    assertThat(loaded).isEqualTo(state);
    assertThat(loaded.highWaterMark()).isEqualTo(T2);
  }

  @Test
  void removedTrackedItemsAreDeleted() {
    SourceState state =
        SourceState.initial()
            .withPublished("1", item("https://example.com/1", T1), T1)
            .withPublished("2", item("https://example.com/2", T2), T2);
    stateStore.save("store-purge", state);

    stateStore.save(
        "store-purge", stateStore.load("store-purge").withoutTrackedItems(List.of("1")).withForceSyncAndPurge(false));

    assertThat(stateStore.load("store-purge").trackedItems()).containsOnlyKeys("2");
  }
}
