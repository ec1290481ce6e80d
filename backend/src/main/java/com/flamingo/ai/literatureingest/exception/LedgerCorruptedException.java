package com.flamingo.ai.literatureingest.exception;

import java.nio.file.Path;

/** Exception thrown when the progress ledger file exists but cannot be read back. */
public class LedgerCorruptedException extends FatalIngestionException {

  private final Path path;

  public LedgerCorruptedException(Path path, String message, Throwable cause) {
    super("Progress ledger " + path + " is unreadable: " + message, cause);
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}
