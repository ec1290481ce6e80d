package com.flamingo.ai.literatureingest.domain.enums;

/** Lifecycle of an ingestion worker while it walks its assigned queries. */
public enum WorkerState {
  /** Waiting to start the next assigned query. */
  PENDING_QUERY,

  /** Running the search for the current query. */
  SEARCHING,

  /** Fetching metadata for the query's new record IDs. */
  FETCHING_METADATA,

  /** Downloading open-access full text for the current record. */
  RETRIEVING_FULLTEXT,

  /** Assembling and chunking the current record. */
  CHUNKING,

  /** Embedding and writing the current record's chunks. */
  INDEXING,

  /** Every record of the current query is indexed or failed. */
  QUERY_DONE,

  /** No assigned queries left, or the run was stopped. */
  WORKER_DONE
}
