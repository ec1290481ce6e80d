package com.flamingo.ai.literatureingest.pubmed;

import com.flamingo.ai.literatureingest.credential.CredentialBinding;
import java.util.List;

/** Runs one bibliographic search under one credential. */
public interface LiteratureSearchClient {

  /**
   * Searches the source for the given query.
   *
   * @param query the search term
   * @param credential credential whose rate limiter gates every request
   * @return matching record IDs in relevance order, without duplicates, bounded by the
   *     max-results cap
   */
  List<String> search(String query, CredentialBinding credential);
}
