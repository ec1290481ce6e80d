package com.flamingo.ai.literatureingest.exception;

import java.nio.file.Path;

/** Exception thrown when another run already holds the progress ledger. */
public class LedgerLockedException extends FatalIngestionException {

  private final Path path;

  public LedgerLockedException(Path path) {
    super("Progress ledger " + path + " is locked by another ingestion run");
    this.path = path;
  }

  public LedgerLockedException(Path path, Throwable cause) {
    super("Progress ledger " + path + " could not be locked", cause);
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}
