package com.flamingo.ai.literatureingest.pipeline;

import com.flamingo.ai.literatureingest.domain.enums.FailureCategory;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Outcome of one ingestion run. Partial success is the normal case. */
@Getter
@Builder
@ToString
public class RunSummary {

  private final Instant startedAt;
  private final Duration duration;

  private final long queriesCompleted;
  private final long queriesSkipped;
  private final long queriesFailed;

  private final long recordsDownloaded;
  private final long recordsIndexed;
  private final long recordsFailed;
  private final long recordsSkipped;
  private final long fullTextsRetrieved;
  private final long chunksIndexed;

  private final Map<FailureCategory, Long> failuresByCategory;

  /** Queries assigned to each credential ID, in credential order. */
  private final Map<String, Integer> queriesPerCredential;

  /** True when a stop request or fatal error ended the run before all queries were processed. */
  private final boolean interrupted;

  /** Message of the fatal error that aborted the run, or null. */
  private final String fatalError;

  private final int ledgerCompletedQueries;
  private final int ledgerDownloadedRecords;
  private final int ledgerIndexedRecords;
  private final int ledgerFailedRecords;
}
