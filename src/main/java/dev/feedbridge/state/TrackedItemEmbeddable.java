package dev.feedbridge.state;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.time.Instant;

/** Row of the {@code tracked_item} table, owned by {@link SourceStateEntity}. */
@Embeddable
public class TrackedItemEmbeddable {

    @Column(nullable = false)
    private String title;

    @Column(name = "content_location")
    private String contentLocation;

    @Column(name = "source_url", nullable = false)
    private String sourceUrl;

    @Column(name = "published_at", nullable = false)
    private Instant publishedAt;

    protected TrackedItemEmbeddable() {
        // JPA requires no-arg constructor
    }

    TrackedItemEmbeddable(TrackedItem item) {
        this.title = item.title();
        this.contentLocation = item.contentLocation();
        this.sourceUrl = item.sourceUrl();
        this.publishedAt = item.publishedAt();
    }

    TrackedItem toTrackedItem() {
        return new TrackedItem(title, contentLocation, sourceUrl, publishedAt);
    }
}
