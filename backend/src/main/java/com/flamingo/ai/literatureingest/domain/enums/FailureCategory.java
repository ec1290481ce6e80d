package com.flamingo.ai.literatureingest.domain.enums;

/** Error taxonomy used for retry decisions and the end-of-run summary. */
public enum FailureCategory {
  /** Timeouts, 5xx responses and connection resets. Retried with backoff. */
  TRANSIENT_NETWORK,

  /** HTTP 429 from the source. Retried with backoff, never fatal. */
  RATE_LIMIT,

  /** Malformed metadata, unreadable documents, failed index writes. Fails one record. */
  PERMANENT_RECORD,

  /** Search retries exhausted or the query was rejected. Fails one query. */
  PERMANENT_QUERY,

  /** Corrupt or locked ledger, unreachable vector store. Aborts the run. */
  FATAL
}
