package com.flamingo.ai.literatureingest.pipeline;

import com.flamingo.ai.literatureingest.credential.CredentialBinding;
import com.flamingo.ai.literatureingest.domain.enums.WorkerState;
import com.flamingo.ai.literatureingest.domain.model.AssembledDocument;
import com.flamingo.ai.literatureingest.domain.model.Chunk;
import com.flamingo.ai.literatureingest.domain.model.FetchResult;
import com.flamingo.ai.literatureingest.domain.model.RecordMetadata;
import com.flamingo.ai.literatureingest.exception.FatalIngestionException;
import com.flamingo.ai.literatureingest.exception.IngestionInterruptedException;
import com.flamingo.ai.literatureingest.exception.RecordProcessingException;
import com.flamingo.ai.literatureingest.index.IndexResult;
import com.flamingo.ai.literatureingest.ledger.ClaimResult;
import com.flamingo.ai.literatureingest.ledger.ProgressLedger;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Processes the queries assigned to one credential, one at a time.
 *
 * <p>For each query: search, claim the new record IDs in the ledger, fetch their metadata, then
 * retrieve full text, assemble, chunk and index each record. Record failures are recorded in the
 * ledger and never stop the query. A search that exhausts its retries fails the query only. A
 * query is marked complete once every one of its records is indexed or failed, including records
 * another worker was processing.
 *
 * <p>A stop request is honored between records. Fatal errors stop the whole run.
 */
@Slf4j
class IngestionWorker implements Runnable {

  static final String MDC_CREDENTIAL = "credential";

  private final String name;
  private final CredentialBinding credential;
  private final List<String> queries;
  private final PipelineStages stages;
  private final ProgressLedger ledger;
  private final IngestionStats stats;
  private final RunControl control;

  private final AtomicInteger queriesProcessed = new AtomicInteger();
  private volatile WorkerState state = WorkerState.PENDING_QUERY;
  private volatile String currentQuery;
  private volatile long startedNanos;

  IngestionWorker(
      int index,
      CredentialBinding credential,
      List<String> queries,
      PipelineStages stages,
      ProgressLedger ledger,
      IngestionStats stats,
      RunControl control) {
    this.name = "worker-" + index;
    this.credential = credential;
    this.queries = List.copyOf(queries);
    this.stages = stages;
    this.ledger = ledger;
    this.stats = stats;
    this.control = control;
  }

  @Override
  public void run() {
    startedNanos = System.nanoTime();
    MDC.put(MDC_CREDENTIAL, credential.getId());
    try {
      log.info("{} starting with {} assigned queries", name, queries.size());
      for (String query : queries) {
        if (control.isStopRequested()) {
          log.info("{} stopping before query '{}'", name, query);
          break;
        }
        processQuery(query);
        queriesProcessed.incrementAndGet();
      }
    } catch (FatalIngestionException e) {
      control.abort(e);
      throw e;
    } finally {
      ledger.releaseClaims(name);
      state = WorkerState.WORKER_DONE;
      currentQuery = null;
      log.info("{} done after {} queries", name, queriesProcessed.get());
      MDC.remove(MDC_CREDENTIAL);
    }
  }

  WorkerSnapshot snapshot() {
    long requests = credential.getRequestCount();
    double elapsedSeconds = startedNanos == 0 ? 0 : (System.nanoTime() - startedNanos) / 1e9;
    double rate = elapsedSeconds > 0 ? requests / elapsedSeconds : 0.0;
    return new WorkerSnapshot(
        name,
        credential.getId(),
        state,
        currentQuery,
        queries.size(),
        queriesProcessed.get(),
        requests,
        rate);
  }

  String getName() {
    return name;
  }

  WorkerState getState() {
    return state;
  }

  private void processQuery(String query) {
    state = WorkerState.PENDING_QUERY;
    currentQuery = query;
    if (ledger.isQueryComplete(query)) {
      log.debug("{} skipping completed query '{}'", name, query);
      stats.querySkipped();
      return;
    }

    state = WorkerState.SEARCHING;
    List<String> recordIds;
    try {
      recordIds = stages.searchClient().search(query, credential);
    } catch (FatalIngestionException | IngestionInterruptedException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn("{} search failed for query '{}': {}", name, query, e.getMessage());
      stats.queryFailed();
      return;
    }

    ClaimResult claim = ledger.claimForDownload(recordIds, name);
    stats.recordsSkipped(claim.alreadyProcessed().size());
    log.info(
        "{} query '{}': {} records, {} new, {} already processed, {} in flight elsewhere",
        name,
        query,
        recordIds.size(),
        claim.claimed().size(),
        claim.alreadyProcessed().size(),
        claim.inFlightElsewhere().size());

    boolean finished = claim.claimed().isEmpty() || processClaimed(query, claim.claimed());
    if (!finished) {
      ledger.releaseClaims(name);
      log.info("{} left query '{}' incomplete", name, query);
      return;
    }
    if (!claim.inFlightElsewhere().isEmpty()
        && !ledger.awaitProcessed(claim.inFlightElsewhere(), control::isStopRequested)) {
      log.info("{} left query '{}' incomplete, shared records were not finished", name, query);
      return;
    }

    ledger.recordQueryComplete(query);
    stats.queryCompleted();
    state = WorkerState.QUERY_DONE;
    log.info("{} completed query '{}'", name, query);
  }

  /** Returns false if a stop request interrupted the records. */
  private boolean processClaimed(String query, List<String> claimed) {
    state = WorkerState.FETCHING_METADATA;
    FetchResult fetched;
    try {
      fetched = stages.metadataFetcher().fetchMetadata(claimed, credential);
    } catch (FatalIngestionException | IngestionInterruptedException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn("{} metadata fetch failed for query '{}': {}", name, query, e.getMessage());
      fetched = FetchResult.empty();
    }

    Set<String> accountedFor = new HashSet<>();
    fetched
        .failures()
        .forEach(
            (recordId, reason) -> {
              log.warn("{} record {} failed during metadata fetch: {}", name, recordId, reason);
              markFailed(recordId);
              accountedFor.add(recordId);
            });

    for (RecordMetadata metadata : fetched.records()) {
      if (control.isStopRequested()) {
        return false;
      }
      if (accountedFor.add(metadata.recordId())) {
        processRecord(query, metadata);
      }
    }

    for (String recordId : claimed) {
      if (!accountedFor.contains(recordId)) {
        log.warn("{} record {} missing from metadata fetch result", name, recordId);
        markFailed(recordId);
      }
    }
    return true;
  }

  private void processRecord(String query, RecordMetadata metadata) {
    String recordId = metadata.recordId();
    try {
      state = WorkerState.RETRIEVING_FULLTEXT;
      String fullText = retrieveFullText(metadata).orElse(null);

      state = WorkerState.CHUNKING;
      AssembledDocument document = stages.assembler().assemble(metadata, fullText, query);
      List<Chunk> chunks = stages.chunker().chunk(document);
      if (chunks.isEmpty()) {
        throw new RecordProcessingException(recordId, "document produced no chunks");
      }

      state = WorkerState.INDEXING;
      IndexResult result = stages.indexer().index(chunks);
      stats.chunksIndexed(result.chunksIndexed());
      boolean indexed = !result.hasFailed(recordId);
      ledger.recordProcessed(recordId, indexed);
      stats.recordDownloaded();
      if (!indexed) {
        log.warn("{} record {} could not be indexed", name, recordId);
        stats.recordFailed();
        return;
      }
      stats.recordIndexed();
      log.debug("{} indexed record {} as {} chunks", name, recordId, chunks.size());
    } catch (FatalIngestionException | IngestionInterruptedException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn("{} record {} failed: {}", name, recordId, e.getMessage());
      markFailed(recordId);
    }
  }

  private Optional<String> retrieveFullText(RecordMetadata metadata) {
    if (!metadata.hasFullTextSource()) {
      return Optional.empty();
    }
    Optional<String> fullText;
    try {
      fullText = stages.fullTextRetriever().maybeFetchFullText(metadata);
    } catch (FatalIngestionException | IngestionInterruptedException e) {
      throw e;
    } catch (RuntimeException e) {
      log.info(
          "{} full text unavailable for record {}, indexing abstract only: {}",
          name,
          metadata.recordId(),
          e.getMessage());
      return Optional.empty();
    }
    fullText.ifPresent(text -> stats.fullTextRetrieved());
    return fullText;
  }

  private void markFailed(String recordId) {
    ledger.recordFailed(recordId);
    stats.recordFailed();
  }
}
