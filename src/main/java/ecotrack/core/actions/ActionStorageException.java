package ecotrack.core.actions;

import java.nio.file.Path;

public class ActionStorageException extends IllegalStateException {
  private final Path file;

  public ActionStorageException(String message, Path file, Throwable cause) {
    super(message + " " + file, cause);
    this.file = file;
  }

  public Path file() {
    return file;
  }
}
