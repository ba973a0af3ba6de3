package dev.feedbridge.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link StateStore} backed by PostgreSQL through Spring Data JPA.
 *
 * <p>Each call runs in its own transaction through a {@link TransactionTemplate}, so a save has
 * been committed (or has failed with {@link StatePersistenceException}) by the time it returns.
 */
@Component
public class JpaStateStore implements StateStore {

  private static final Logger log = LoggerFactory.getLogger(JpaStateStore.class);

  private final SourceStateRepository repository;
  private final TransactionTemplate transactionTemplate;

  public JpaStateStore(
      SourceStateRepository repository, PlatformTransactionManager transactionManager) {
    this.repository = repository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  @Override
  public SourceState load(String sourceId) {
    try {
      return transactionTemplate.execute(
          status ->
              repository
                  .findById(sourceId)
                  .map(SourceStateEntity::toState)
                  .orElseGet(() -> createInitial(sourceId)));
    } catch (DataAccessException | TransactionException e) {
      throw new StatePersistenceException("Failed to load state for source " + sourceId, e);
    }
  }

  @Override
  public void save(String sourceId, SourceState state) {
    try {
      transactionTemplate.executeWithoutResult(
          status -> {
            SourceStateEntity entity =
                repository.findById(sourceId).orElseGet(() -> new SourceStateEntity(sourceId));
            entity.apply(state);
            repository.save(entity);
          });
    } catch (DataAccessException | TransactionException e) {
      throw new StatePersistenceException("Failed to save state for source " + sourceId, e);
    }
    log.debug(
        "Saved state for {}: highWaterMark={}, tracked={}",
        sourceId,
        state.highWaterMark(),
        state.trackedItems().size());
  }

  private SourceState createInitial(String sourceId) {
    SourceState initial = SourceState.initial();
    SourceStateEntity entity = new SourceStateEntity(sourceId);
    entity.apply(initial);
    repository.save(entity);
    log.info("Created initial state for source {}", sourceId);
    return initial;
  }
}
