package dev.feedbridge.session;

import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link CookieCacheRecord}. */
public interface CookieCacheRepository extends JpaRepository<CookieCacheRecord, String> {}
