package com.flamingo.ai.literatureingest.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a metadata fetch: the records that parsed and a reason for each one that did not.
 *
 * @param records successfully parsed records, in request order
 * @param failures record ID to failure reason
 */
public record FetchResult(List<RecordMetadata> records, Map<String, String> failures) {

  public FetchResult {
    records = List.copyOf(records);
    failures = Map.copyOf(failures);
  }

  public static FetchResult empty() {
    return new FetchResult(List.of(), Map.of());
  }
}
