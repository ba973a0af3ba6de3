package dev.feedbridge.session;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Row of the {@code cookie_cache} table. Cookies are stored as a JSON array in {@code cookies}.
 *
 * <p>Maps to the {@code cookie_cache} table managed by Flyway migrations.
 */
@Entity
@Table(name = "cookie_cache")
public class CookieCacheRecord {

    @Id
    @Column(name = "cache_key")
    private String cacheKey;

    @Column(nullable = false, columnDefinition = "text")
    private String cookies;

    @Column(name = "captured_at", nullable = false)
    private Instant capturedAt;

    protected CookieCacheRecord() {
        // JPA requires no-arg constructor
    }

    public CookieCacheRecord(String cacheKey, String cookies, Instant capturedAt) {
        this.cacheKey = cacheKey;
        this.cookies = cookies;
        this.capturedAt = capturedAt;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public String getCookies() {
        return cookies;
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }
}
