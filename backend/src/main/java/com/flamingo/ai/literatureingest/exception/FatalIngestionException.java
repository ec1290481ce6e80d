package com.flamingo.ai.literatureingest.exception;

/**
 * Base class for errors that abort the whole run.
 *
 * <p>Everything else is handled per record or per query and never stops the coordinator.
 */
public abstract class FatalIngestionException extends RuntimeException {

  protected FatalIngestionException(String message) {
    super(message);
  }

  protected FatalIngestionException(String message, Throwable cause) {
    super(message, cause);
  }
}
