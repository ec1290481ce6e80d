package com.flamingo.ai.literatureingest.pipeline;

import com.flamingo.ai.literatureingest.config.IngestionConfig;
import com.flamingo.ai.literatureingest.credential.ConfiguredCredentials;
import com.flamingo.ai.literatureingest.credential.CredentialBinding;
import com.flamingo.ai.literatureingest.credential.CredentialPool;
import com.flamingo.ai.literatureingest.document.DocumentAssembler;
import com.flamingo.ai.literatureingest.document.chunking.DocumentChunker;
import com.flamingo.ai.literatureingest.domain.model.Credential;
import com.flamingo.ai.literatureingest.exception.FatalIngestionException;
import com.flamingo.ai.literatureingest.exception.IngestionAlreadyRunningException;
import com.flamingo.ai.literatureingest.exception.IngestionInterruptedException;
import com.flamingo.ai.literatureingest.fulltext.FullTextRetriever;
import com.flamingo.ai.literatureingest.index.ChunkIndexer;
import com.flamingo.ai.literatureingest.index.ChunkVectorStore;
import com.flamingo.ai.literatureingest.ledger.LedgerState;
import com.flamingo.ai.literatureingest.ledger.ProgressLedger;
import com.flamingo.ai.literatureingest.pubmed.LiteratureSearchClient;
import com.flamingo.ai.literatureingest.pubmed.RecordMetadataFetcher;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs one worker per credential over a fixed round-robin assignment of queries.
 *
 * <p>A run loads the ledger, so completed queries and already processed records are skipped and
 * an interrupted run resumes where its last flush left off. Only one run is active at a time.
 */
@Service
@Slf4j
public class IngestionCoordinator {

  private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(30);

  private final PipelineStages stages;
  private final ChunkVectorStore vectorStore;
  private final ProgressLedger ledger;
  private final IngestionStats stats;
  private final IngestionConfig ingestionConfig;
  private final QuerySource querySource;
  private final ConfiguredCredentials configuredCredentials;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private final AtomicBoolean running = new AtomicBoolean();
  private volatile RunControl control;
  private volatile List<IngestionWorker> workers = List.of();
  private volatile RunSummary lastSummary;

  @Autowired
  public IngestionCoordinator(
      LiteratureSearchClient searchClient,
      RecordMetadataFetcher metadataFetcher,
      FullTextRetriever fullTextRetriever,
      DocumentAssembler assembler,
      DocumentChunker chunker,
      ChunkIndexer indexer,
      ChunkVectorStore vectorStore,
      ProgressLedger ledger,
      IngestionStats stats,
      IngestionConfig ingestionConfig,
      QuerySource querySource,
      ConfiguredCredentials configuredCredentials,
      MeterRegistry meterRegistry) {
    this(
        new PipelineStages(
            searchClient, metadataFetcher, fullTextRetriever, assembler, chunker, indexer),
        vectorStore,
        ledger,
        stats,
        ingestionConfig,
        querySource,
        configuredCredentials,
        meterRegistry,
        Clock.systemUTC());
  }

  @VisibleForTesting
  IngestionCoordinator(
      PipelineStages stages,
      ChunkVectorStore vectorStore,
      ProgressLedger ledger,
      IngestionStats stats,
      IngestionConfig ingestionConfig,
      QuerySource querySource,
      ConfiguredCredentials configuredCredentials,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.stages = stages;
    this.vectorStore = vectorStore;
    this.ledger = ledger;
    this.stats = stats;
    this.ingestionConfig = ingestionConfig;
    this.querySource = querySource;
    this.configuredCredentials = configuredCredentials;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /** Runs the configured queries with the configured credentials. */
  public RunSummary run() {
    return run(querySource.load(), configuredCredentials.load());
  }

  /**
   * Runs the given queries, assigning {@code queries[i]} to {@code credentials[i mod K]}.
   *
   * @return the run summary, also when a stop request ended the run early
   * @throws IngestionAlreadyRunningException if a run is in progress
   * @throws FatalIngestionException if the ledger is unusable or the vector store unreachable
   */
  public RunSummary run(List<String> queries, List<Credential> credentials) {
    if (!running.compareAndSet(false, true)) {
      throw new IngestionAlreadyRunningException();
    }
    try {
      return execute(queries, credentials);
    } finally {
      workers = List.of();
      running.set(false);
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  /** Asks the active run to stop after each worker's in-flight record. */
  public void requestStop() {
    RunControl current = control;
    if (current != null && running.get()) {
      log.info("Stop requested for the active ingestion run");
      current.requestStop();
    }
  }

  public List<WorkerSnapshot> workerSnapshots() {
    return workers.stream().map(IngestionWorker::snapshot).toList();
  }

  public Optional<RunSummary> lastSummary() {
    return Optional.ofNullable(lastSummary);
  }

  /** Live ledger state during a run, otherwise what the ledger file holds. */
  public LedgerState ledgerState() {
    return ledger.isOpen() ? ledger.snapshot() : ledger.peek();
  }

  @PreDestroy
  public void shutdown() {
    if (!running.get()) {
      return;
    }
    requestStop();
    long deadline = System.nanoTime() + SHUTDOWN_WAIT.toNanos();
    try {
      while (running.get() && System.nanoTime() < deadline) {
        TimeUnit.MILLISECONDS.sleep(100);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (running.get()) {
      log.warn(
          "Ingestion run still active after waiting {}s for it to stop", SHUTDOWN_WAIT.toSeconds());
    }
  }

  private RunSummary execute(List<String> queries, List<Credential> credentials) {
    if (credentials.isEmpty()) {
      throw new IllegalArgumentException("At least one credential is required");
    }
    RunControl runControl = new RunControl();
    control = runControl;
    stats.reset();
    Instant startedAt = clock.instant();
    CredentialPool pool =
        CredentialPool.create(
            credentials, ingestionConfig.getRateLimit().getRequestsPerSecond(), meterRegistry);
    List<List<String>> assignment = QueryAssignment.roundRobin(queries, pool.size());
    log.info(
        "Starting ingestion run: {} queries across {} credentials", queries.size(), pool.size());

    try {
      vectorStore.verifyAvailable();
      stages.indexer().resetCircuit();
      ledger.load();
    } catch (FatalIngestionException e) {
      stats.fatal();
      ledger.close();
      log.error("Ingestion run aborted before start: {}", e.getMessage());
      throw e;
    }

    List<IngestionWorker> runWorkers = new ArrayList<>(pool.size());
    Map<String, Integer> queriesPerCredential = new LinkedHashMap<>();
    for (int i = 0; i < pool.size(); i++) {
      CredentialBinding binding = pool.get(i);
      runWorkers.add(
          new IngestionWorker(i, binding, assignment.get(i), stages, ledger, stats, runControl));
      queriesPerCredential.put(binding.getId(), assignment.get(i).size());
    }
    workers = List.copyOf(runWorkers);

    RuntimeException failure = runWorkers(runWorkers, runControl);
    try {
      ledger.close();
    } catch (FatalIngestionException e) {
      if (failure == null) {
        failure = e;
      } else {
        failure.addSuppressed(e);
      }
    }
    FatalIngestionException fatal = runControl.getFatal();
    if (fatal != null) {
      stats.fatal();
    }

    RunSummary summary =
        buildSummary(startedAt, queriesPerCredential, runControl, failure, ledger.snapshot());
    lastSummary = summary;
    logSummary(summary);
    if (failure != null) {
      throw failure;
    }
    return summary;
  }

  /** Returns the error that should end the run, or null. */
  private RuntimeException runWorkers(List<IngestionWorker> runWorkers, RunControl runControl) {
    ExecutorService executor =
        Executors.newFixedThreadPool(
            runWorkers.size(),
            new ThreadFactoryBuilder().setNameFormat("ingest-worker-%d").build());
    RuntimeException failure = null;
    try {
      List<Future<?>> futures = new ArrayList<>(runWorkers.size());
      for (IngestionWorker worker : runWorkers) {
        futures.add(executor.submit(worker));
      }
      for (Future<?> future : futures) {
        try {
          future.get();
        } catch (ExecutionException e) {
          Throwable cause = e.getCause();
          if (cause instanceof FatalIngestionException fatalCause) {
            runControl.abort(fatalCause);
          } else if (!(cause instanceof IngestionInterruptedException)) {
            runControl.requestStop();
            log.error("Ingestion worker failed unexpectedly", cause);
            if (failure == null) {
              failure = new IllegalStateException("Ingestion worker failed unexpectedly", cause);
            }
          }
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      runControl.requestStop();
      executor.shutdownNow();
      log.warn("Interrupted while waiting for ingestion workers");
    } finally {
      executor.shutdown();
      awaitTermination(executor);
    }
    FatalIngestionException fatal = runControl.getFatal();
    return fatal != null ? fatal : failure;
  }

  private static void awaitTermination(ExecutorService executor) {
    try {
      if (!executor.awaitTermination(SHUTDOWN_WAIT.toSeconds(), TimeUnit.SECONDS)) {
        log.warn("Ingestion workers did not terminate in time");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  private RunSummary buildSummary(
      Instant startedAt,
      Map<String, Integer> queriesPerCredential,
      RunControl runControl,
      RuntimeException failure,
      LedgerState ledgerState) {
    return RunSummary.builder()
        .startedAt(startedAt)
        .duration(Duration.between(startedAt, clock.instant()))
        .queriesCompleted(stats.getQueriesCompleted())
        .queriesSkipped(stats.getQueriesSkipped())
        .queriesFailed(stats.getQueriesFailed())
        .recordsDownloaded(stats.getRecordsDownloaded())
        .recordsIndexed(stats.getRecordsIndexed())
        .recordsFailed(stats.getRecordsFailed())
        .recordsSkipped(stats.getRecordsSkipped())
        .fullTextsRetrieved(stats.getFullTextsRetrieved())
        .chunksIndexed(stats.getChunksIndexed())
        .failuresByCategory(stats.getFailuresByCategory())
        .queriesPerCredential(Collections.unmodifiableMap(queriesPerCredential))
        .interrupted(runControl.isStopRequested())
        .fatalError(failure == null ? null : failure.getMessage())
        .ledgerCompletedQueries(ledgerState.completedQueries().size())
        .ledgerDownloadedRecords(ledgerState.downloadedRecordIds().size())
        .ledgerIndexedRecords(ledgerState.indexedRecordIds().size())
        .ledgerFailedRecords(ledgerState.failedRecordIds().size())
        .build();
  }

  private static void logSummary(RunSummary summary) {
    log.info(
        "Ingestion run {} in {}s: queries completed={} skipped={} failed={}, records"
            + " downloaded={} indexed={} failed={} skipped={}, full texts={}, chunks={}",
        summary.getFatalError() != null
            ? "aborted"
            : summary.isInterrupted() ? "stopped" : "finished",
        summary.getDuration().toSeconds(),
        summary.getQueriesCompleted(),
        summary.getQueriesSkipped(),
        summary.getQueriesFailed(),
        summary.getRecordsDownloaded(),
        summary.getRecordsIndexed(),
        summary.getRecordsFailed(),
        summary.getRecordsSkipped(),
        summary.getFullTextsRetrieved(),
        summary.getChunksIndexed());
    log.info(
        "Failures by category: {}; queries per credential: {}; ledger totals: {} queries, {}"
            + " downloaded, {} indexed, {} failed",
        summary.getFailuresByCategory(),
        summary.getQueriesPerCredential(),
        summary.getLedgerCompletedQueries(),
        summary.getLedgerDownloadedRecords(),
        summary.getLedgerIndexedRecords(),
        summary.getLedgerFailedRecords());
  }
}
