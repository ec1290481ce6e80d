package com.flamingo.ai.literatureingest.api.rest;

import com.flamingo.ai.literatureingest.api.dto.response.IngestionStatusResponse;
import com.flamingo.ai.literatureingest.api.dto.response.WorkerStatus;
import com.flamingo.ai.literatureingest.exception.VectorStoreUnavailableException;
import com.flamingo.ai.literatureingest.index.ChunkVectorStore;
import com.flamingo.ai.literatureingest.ledger.LedgerState;
import com.flamingo.ai.literatureingest.pipeline.IngestionCoordinator;
import com.flamingo.ai.literatureingest.pipeline.IngestionRunService;
import com.flamingo.ai.literatureingest.pipeline.IngestionStats;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for starting, stopping and monitoring ingestion runs. */
@RestController
@RequestMapping("/api/ingestion")
@RequiredArgsConstructor
@Slf4j
public class IngestionController {

  private final IngestionCoordinator coordinator;
  private final IngestionRunService runService;
  private final IngestionStats stats;
  private final ChunkVectorStore vectorStore;

  /** Returns ledger totals, live counters and per-worker state. */
  @GetMapping("/status")
  public ResponseEntity<IngestionStatusResponse> status() {
    LedgerState ledger = coordinator.ledgerState();
    return ResponseEntity.ok(
        IngestionStatusResponse.builder()
            .running(coordinator.isRunning())
            .completedQueries(ledger.completedQueries().size())
            .downloadedRecords(ledger.downloadedRecordIds().size())
            .indexedRecords(ledger.indexedRecordIds().size())
            .failedRecords(ledger.failedRecordIds().size())
            .counters(stats.snapshot())
            .workers(coordinator.workerSnapshots().stream().map(WorkerStatus::from).toList())
            .storedChunks(storedChunks())
            .lastRun(coordinator.lastSummary().orElse(null))
            .timestamp(Instant.now())
            .build());
  }

  /** Starts a run in the background; 409 when one is already active. */
  @PostMapping("/runs")
  public ResponseEntity<Map<String, Object>> startRun() {
    runService.startInBackground();
    log.info("Ingestion run started over REST");
    return ResponseEntity.accepted().body(Map.of("status", "STARTED"));
  }

  /** Asks the active run to stop after in-flight records. */
  @PostMapping("/stop")
  public ResponseEntity<Map<String, Object>> stop() {
    boolean running = coordinator.isRunning();
    coordinator.requestStop();
    return ResponseEntity.accepted()
        .body(Map.of("status", running ? "STOPPING" : "NOT_RUNNING"));
  }

  private Long storedChunks() {
    try {
      return vectorStore.countChunks();
    } catch (VectorStoreUnavailableException e) {
      log.warn("Chunk count unavailable: {}", e.getMessage());
      return null;
    }
  }
}
