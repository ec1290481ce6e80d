package com.flamingo.ai.literatureingest.pipeline;

import com.flamingo.ai.literatureingest.config.AsyncConfig;
import com.flamingo.ai.literatureingest.exception.FatalIngestionException;
import com.flamingo.ai.literatureingest.exception.IngestionAlreadyRunningException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/** Starts ingestion runs in the background for the REST API. */
@Service
@Slf4j
public class IngestionRunService {

  private final IngestionCoordinator coordinator;
  private final TaskExecutor runExecutor;

  public IngestionRunService(
      IngestionCoordinator coordinator,
      @Qualifier(AsyncConfig.INGESTION_RUN_EXECUTOR) TaskExecutor runExecutor) {
    this.coordinator = coordinator;
    this.runExecutor = runExecutor;
  }

  /**
   * Submits a run with the configured queries and credentials.
   *
   * @throws IngestionAlreadyRunningException if a run is active or about to start
   */
  public void startInBackground() {
    if (coordinator.isRunning()) {
      throw new IngestionAlreadyRunningException();
    }
    try {
      runExecutor.execute(this::runAndLog);
    } catch (TaskRejectedException e) {
      throw new IngestionAlreadyRunningException();
    }
  }

  private void runAndLog() {
    try {
      coordinator.run();
    } catch (IngestionAlreadyRunningException e) {
      log.warn("Background ingestion run not started: {}", e.getMessage());
    } catch (FatalIngestionException e) {
      log.error("Background ingestion run aborted: {}", e.getMessage(), e);
    } catch (RuntimeException e) {
      log.error("Background ingestion run failed: {}", e.getMessage(), e);
    }
  }
}
