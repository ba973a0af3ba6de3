package dev.feedbridge;

import dev.feedbridge.session.CookieCacheRecord;
import dev.feedbridge.session.CookieCacheRepository;
import dev.feedbridge.state.SourceState;
import dev.feedbridge.state.SourceStateEntity;
import dev.feedbridge.state.SourceStateRepository;
import dev.feedbridge.state.StateStore;
import dev.feedbridge.state.TrackedItem;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compensates for ddl-auto=none by verifying each JPA entity
 * can be persisted and read back against the Flyway schema.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

    @Autowired
    private SourceStateRepository sourceStateRepository;

    @Autowired
    private CookieCacheRepository cookieCacheRepository;

    @Autowired
    private StateStore stateStore;

    @Test
    void sourceStateWithTrackedItemsRoundtripsAgainstFlywaySchema() {
        Instant published = Instant.parse("2026-03-01T10:00:00Z");
        SourceState state = SourceState.initial()
                .withLastPollAt(Instant.parse("2026-03-01T11:00:00Z"))
                .withPublished("100", new TrackedItem("Title", "https://www.instapaper.com/read/100",
                        "https://example.com/a", published), published);

        stateStore.save("drift-source", state);
        sourceStateRepository.flush();
        SourceStateEntity found = sourceStateRepository.findById("drift-source").orElseThrow();

        assertThat(found.getSourceId()).isEqualTo("drift-source");
        assertThat(found.getUpdatedAt()).isNotNull();
        assertThat(stateStore.load("drift-source")).isEqualTo(state);
    }

    @Test
    void cookieCacheRecordRoundtripsAgainstFlywaySchema() {
        Instant capturedAt = Instant.parse("2026-03-01T12:00:00Z");
        cookieCacheRepository.saveAndFlush(
                new CookieCacheRecord("alice-example", "[{\"name\":\"sid\",\"value\":\"x\"}]", capturedAt));

        CookieCacheRecord found = cookieCacheRepository.findById("alice-example").orElseThrow();

        assertThat(found.getCookies()).contains("\"sid\"");
        assertThat(found.getCapturedAt()).isEqualTo(capturedAt);
    }
}
