package com.flamingo.ai.literatureingest.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Logs aggregate and per-worker progress while a run is active. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProgressMonitor {

  private final IngestionCoordinator coordinator;
  private final IngestionStats stats;

  @Scheduled(
      fixedDelayString = "${ingestion.monitor.interval:10s}",
      initialDelayString = "${ingestion.monitor.interval:10s}")
  public void logProgress() {
    if (!coordinator.isRunning()) {
      return;
    }
    log.info(
        "Ingestion progress: queries completed={} skipped={} failed={}, records downloaded={}"
            + " indexed={} failed={} skipped={}, full texts={}, chunks={}",
        stats.getQueriesCompleted(),
        stats.getQueriesSkipped(),
        stats.getQueriesFailed(),
        stats.getRecordsDownloaded(),
        stats.getRecordsIndexed(),
        stats.getRecordsFailed(),
        stats.getRecordsSkipped(),
        stats.getFullTextsRetrieved(),
        stats.getChunksIndexed());
    for (WorkerSnapshot worker : coordinator.workerSnapshots()) {
      log.info(
          "  {} [{}] {} query='{}' queries {}/{}, {} requests ({} req/s)",
          worker.name(),
          worker.credentialId(),
          worker.state(),
          worker.currentQuery(),
          worker.queriesProcessed(),
          worker.queriesAssigned(),
          worker.requests(),
          String.format("%.2f", worker.requestsPerSecond()));
    }
  }
}
