package com.flamingo.ai.literatureingest.exception;

import java.nio.file.Path;

/** Exception thrown when the progress ledger cannot be written, leaving no checkpoint. */
public class LedgerWriteException extends FatalIngestionException {

  public LedgerWriteException(Path path, Throwable cause) {
    super("Failed to write progress ledger " + path + ": " + cause.getMessage(), cause);
  }
}
