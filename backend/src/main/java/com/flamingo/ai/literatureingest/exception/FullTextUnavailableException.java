package com.flamingo.ai.literatureingest.exception;

/** Exception thrown when an open-access full-text document cannot be obtained or read. */
public class FullTextUnavailableException extends RuntimeException {

  private final String fullTextId;

  public FullTextUnavailableException(String fullTextId, String message) {
    super(message);
    this.fullTextId = fullTextId;
  }

  public FullTextUnavailableException(String fullTextId, String message, Throwable cause) {
    super(message, cause);
    this.fullTextId = fullTextId;
  }

  public String getFullTextId() {
    return fullTextId;
  }
}
