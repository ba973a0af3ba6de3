package dev.feedbridge.state;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapKeyColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JPA mapping of a {@link SourceState}.
 *
 * <p>Scalar fields live in {@code source_state}; tracked items in the child table
 * {@code tracked_item}, keyed by {@code (source_id, remote_id)}. "Never" is stored as
 * {@code 1970-01-01T00:00:00Z}, not null.
 *
 * <p>Maps to tables managed by Flyway migrations.
 */
@Entity
@Table(name = "source_state")
public class SourceStateEntity {

    @Id
    @Column(name = "source_id")
    private String sourceId;

    @Column(name = "high_water_mark", nullable = false)
    private Instant highWaterMark;

    @Column(name = "last_poll_at", nullable = false)
    private Instant lastPollAt;

    @Column(name = "last_refresh_at", nullable = false)
    private Instant lastRefreshAt;

    @Column(name = "force_poll", nullable = false)
    private boolean forcePoll;

    @Column(name = "force_sync_and_purge", nullable = false)
    private boolean forceSyncAndPurge;

    @Column(name = "schema_version", nullable = false)
    private int schemaVersion;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tracked_item", joinColumns = @JoinColumn(name = "source_id"))
    @MapKeyColumn(name = "remote_id")
    private Map<String, TrackedItemEmbeddable> trackedItems = new LinkedHashMap<>();

    protected SourceStateEntity() {
        // JPA requires no-arg constructor
    }

    public SourceStateEntity(String sourceId) {
        this.sourceId = sourceId;
    }

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        this.updatedAt = Instant.now();
    }

    /** Copies every field of {@code state} onto this entity, replacing its tracked items. */
    void apply(SourceState state) {
        this.highWaterMark = state.highWaterMark();
        this.lastPollAt = state.lastPollAt();
        this.lastRefreshAt = state.lastRefreshAt();
        this.forcePoll = state.forcePoll();
        this.forceSyncAndPurge = state.forceSyncAndPurge();
        this.schemaVersion = state.schemaVersion();
        this.trackedItems.keySet().retainAll(state.trackedItems().keySet());
        state.trackedItems().forEach((remoteId, item) ->
                this.trackedItems.put(remoteId, new TrackedItemEmbeddable(item)));
    }

    SourceState toState() {
        Map<String, TrackedItem> items = new LinkedHashMap<>();
        trackedItems.forEach((remoteId, item) -> items.put(remoteId, item.toTrackedItem()));
        return new SourceState(highWaterMark, lastPollAt, lastRefreshAt, forcePoll,
                forceSyncAndPurge, items, schemaVersion);
    }

    public String getSourceId() {
        return sourceId;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
