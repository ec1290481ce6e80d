package com.flamingo.ai.literatureingest.pubmed;

import com.flamingo.ai.literatureingest.credential.CredentialBinding;
import com.flamingo.ai.literatureingest.domain.model.FetchResult;
import java.util.List;

/** Retrieves bibliographic metadata for record IDs in batches. */
public interface RecordMetadataFetcher {

  /**
   * Fetches metadata for the given records.
   *
   * <p>Callers pass only IDs they have claimed in the progress ledger, so no ID is fetched twice.
   * A failure affects the IDs it concerns: records that parsed are returned and every other ID is
   * reported in {@link FetchResult#failures()}.
   *
   * @param recordIds IDs to fetch
   * @param credential credential whose rate limiter gates every request
   * @return parsed records and per-ID failures
   */
  FetchResult fetchMetadata(List<String> recordIds, CredentialBinding credential);
}
