package com.flamingo.ai.literatureingest.exception;

import java.util.Set;

/** Exception thrown when a batch of chunks cannot be written to the vector store. */
public class IndexingException extends RuntimeException {

  private final Set<String> recordIds;

  public IndexingException(Set<String> recordIds, String message) {
    super(message);
    this.recordIds = Set.copyOf(recordIds);
  }

  public IndexingException(Set<String> recordIds, String message, Throwable cause) {
    super(message, cause);
    this.recordIds = Set.copyOf(recordIds);
  }

  public Set<String> getRecordIds() {
    return recordIds;
  }
}
