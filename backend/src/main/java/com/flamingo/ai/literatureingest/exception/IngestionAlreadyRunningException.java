package com.flamingo.ai.literatureingest.exception;

/** Exception thrown when a run is requested while another run is still active. */
public class IngestionAlreadyRunningException extends RuntimeException {

  public IngestionAlreadyRunningException() {
    super("An ingestion run is already in progress");
  }
}
