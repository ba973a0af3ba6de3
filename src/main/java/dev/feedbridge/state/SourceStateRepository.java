package dev.feedbridge.state;

import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link SourceStateEntity}. */
public interface SourceStateRepository extends JpaRepository<SourceStateEntity, String> {}
