package com.flamingo.ai.literatureingest.exception;

/** Exception thrown when a single record cannot be turned into indexable chunks. */
public class RecordProcessingException extends RuntimeException {

  private final String recordId;

  public RecordProcessingException(String recordId, String message) {
    super(message);
    this.recordId = recordId;
  }

  public RecordProcessingException(String recordId, String message, Throwable cause) {
    super(message, cause);
    this.recordId = recordId;
  }

  public String getRecordId() {
    return recordId;
  }
}
