package com.flamingo.ai.literatureingest.exception;

/** Exception thrown when the vector store cannot be reached at all. */
public class VectorStoreUnavailableException extends FatalIngestionException {

  public VectorStoreUnavailableException(String message) {
    super(message);
  }

  public VectorStoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
