package dev.feedbridge.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.feedbridge.state.StatePersistenceException;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * {@link CookieCache} stored in PostgreSQL. The cookie list is serialized with Jackson and the
 * row is merged in one statement, so readers see either the old entry or the new one.
 */
@Component
public class JpaCookieCache implements CookieCache {

  private static final TypeReference<List<Cookie>> COOKIE_LIST = new TypeReference<>() {};

  private final CookieCacheRepository repository;
  private final ObjectMapper objectMapper;

  public JpaCookieCache(CookieCacheRepository repository, ObjectMapper objectMapper) {
    this.repository = repository;
    this.objectMapper = objectMapper;
  }

  @Override
  public Optional<CookieCacheEntry> get(String cacheKey) {
    try {
      return repository.findById(cacheKey).map(this::toEntry);
    } catch (DataAccessException e) {
      throw new StatePersistenceException("Failed to read cookie cache " + cacheKey, e);
    }
  }

  @Override
  public void put(String cacheKey, CookieCacheEntry entry) {
    String json;
    try {
      json = objectMapper.writeValueAsString(entry.cookies());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize cookies for " + cacheKey, e);
    }
    try {
      repository.save(new CookieCacheRecord(cacheKey, json, entry.capturedAt()));
    } catch (DataAccessException e) {
      throw new StatePersistenceException("Failed to write cookie cache " + cacheKey, e);
    }
  }

  private CookieCacheEntry toEntry(CookieCacheRecord row) {
    try {
      return new CookieCacheEntry(
          objectMapper.readValue(row.getCookies(), COOKIE_LIST), row.getCapturedAt());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Corrupt cookie cache entry " + row.getCacheKey(), e);
    }
  }
}
