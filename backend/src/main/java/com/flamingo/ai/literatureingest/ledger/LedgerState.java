package com.flamingo.ai.literatureingest.ledger;

import java.util.Set;

/**
 * Immutable view of the four ledger sets.
 *
 * @param completedQueries queries whose records all reached a terminal state
 * @param downloadedRecordIds records whose metadata was fetched
 * @param indexedRecordIds records whose chunks were all written
 * @param failedRecordIds records that failed permanently
 */
public record LedgerState(
    Set<String> completedQueries,
    Set<String> downloadedRecordIds,
    Set<String> indexedRecordIds,
    Set<String> failedRecordIds) {

  public LedgerState {
    completedQueries = Set.copyOf(completedQueries);
    downloadedRecordIds = Set.copyOf(downloadedRecordIds);
    indexedRecordIds = Set.copyOf(indexedRecordIds);
    failedRecordIds = Set.copyOf(failedRecordIds);
  }

  public static LedgerState empty() {
    return new LedgerState(Set.of(), Set.of(), Set.of(), Set.of());
  }
}
