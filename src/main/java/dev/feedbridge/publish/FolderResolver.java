package dev.feedbridge.publish;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves folder titles to ids for one batch, creating missing folders. Results, including
 * failures, are memoised per (account, folder) so each folder costs at most one lookup and one
 * create per batch.
 */
class FolderResolver {

  private static final Logger log = LoggerFactory.getLogger(FolderResolver.class);

  private final Map<String, Optional<String>> resolved = new HashMap<>();

  Optional<String> resolve(String account, PublishTarget target, String folder) {
    return resolved.computeIfAbsent(account + "\u0000" + folder, key -> lookupOrCreate(target, folder));
  }

  private static Optional<String> lookupOrCreate(PublishTarget target, String folder) {
    try {
      Optional<String> existing = target.resolveFolder(folder);
      if (existing.isPresent()) {
        return existing;
      }
      try {
        String created = target.createFolder(folder);
        log.info("Created folder '{}' ({})", folder, created);
        return Optional.of(created);
      } catch (FolderAlreadyExistsException e) {
        return target.resolveFolder(folder);
      }
    } catch (PublishException e) {
      log.warn("Cannot resolve folder '{}', publishing without it: {}", folder, e.getMessage());
      return Optional.empty();
    }
  }
}
