package com.flamingo.ai.literatureingest.index;

import java.util.Set;

/**
 * Outcome of indexing a list of chunks.
 *
 * @param chunksIndexed chunks written successfully
 * @param failedRecordIds records with at least one batch that could not be written
 */
public record IndexResult(int chunksIndexed, Set<String> failedRecordIds) {

  public IndexResult {
    failedRecordIds = Set.copyOf(failedRecordIds);
  }

  public boolean hasFailed(String recordId) {
    return failedRecordIds.contains(recordId);
  }
}
