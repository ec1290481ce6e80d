package com.flamingo.ai.literatureingest.exception;

/** Thrown when a worker thread is interrupted while waiting on a rate limiter, lock or network. */
public class IngestionInterruptedException extends RuntimeException {

  public IngestionInterruptedException(String message, InterruptedException cause) {
    super(message, cause);
  }
}
