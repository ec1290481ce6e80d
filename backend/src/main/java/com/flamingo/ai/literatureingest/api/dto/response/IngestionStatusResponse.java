package com.flamingo.ai.literatureingest.api.dto.response;

import com.flamingo.ai.literatureingest.pipeline.RunSummary;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for the ingestion status endpoint. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionStatusResponse {
  private boolean running;
  private int completedQueries;
  private int downloadedRecords;
  private int indexedRecords;
  private int failedRecords;

  /** Counters of the active or most recent run. */
  private Map<String, Long> counters;

  private List<WorkerStatus> workers;

  /** Chunks in the vector store, null when it cannot be reached. */
  private Long storedChunks;

  private RunSummary lastRun;
  private Instant timestamp;
}
