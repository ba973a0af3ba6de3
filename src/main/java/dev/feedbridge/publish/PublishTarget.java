package dev.feedbridge.publish;

import dev.feedbridge.ingest.PendingEntry;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/** One read-later account. */
public interface PublishTarget {

  /**
   * Publishes an entry. {@code entry.rawContent()}, when present, is sent as the article body.
   *
   * @param folderId folder to file the entry in, {@code null} for the default list
   * @throws PublishException if the service does not return a remote id
   */
  PublishReceipt publish(PendingEntry entry, List<String> tags, @Nullable String folderId);

  /** Looks a folder up by title. */
  Optional<String> resolveFolder(String name);

  /**
   * Creates a folder.
   *
   * @throws FolderAlreadyExistsException if a folder with this title exists already
   */
  String createFolder(String name);
}
