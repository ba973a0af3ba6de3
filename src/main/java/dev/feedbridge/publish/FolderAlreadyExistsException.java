package dev.feedbridge.publish;

/** Folder creation lost a race with another creator; look the folder up again. */
public class FolderAlreadyExistsException extends PublishException {

  public FolderAlreadyExistsException(String folder) {
    super("Folder already exists: " + folder);
  }
}
