package com.flamingo.ai.literatureingest.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.literatureingest.config.IngestionConfig;
import com.flamingo.ai.literatureingest.exception.IngestionInterruptedException;
import com.flamingo.ai.literatureingest.exception.LedgerCorruptedException;
import com.flamingo.ai.literatureingest.exception.LedgerLockedException;
import com.flamingo.ai.literatureingest.exception.LedgerWriteException;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Durable checkpoint of ingestion progress, shared by all workers.
 *
 * <p>All state changes go through one lock. Record operations are flushed every {@code
 * flushEvery} operations and query completion always flushes. A flush unions the file's current
 * content into memory, writes a temp file next to the ledger and renames it over the ledger, so a
 * crash leaves either the old or the new file.
 *
 * <p>Besides the persisted sets the ledger keeps in-run claims: a record ID claimed by one worker
 * is not fetched by another, and a worker can wait for records another worker is processing.
 *
 * <p>{@link #load()} takes an exclusive OS lock on {@code <ledger>.lock}, held until {@link
 * #close()}.
 */
@Component
@Slf4j
public class ProgressLedger implements AutoCloseable {

  private static final long AWAIT_POLL_MILLIS = 250;

  private final Path path;
  private final Path lockPath;
  private final int flushEvery;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition claimsChanged = lock.newCondition();

  private final Set<String> completedQueries = new HashSet<>();
  private final Set<String> downloaded = new HashSet<>();
  private final Set<String> indexed = new HashSet<>();
  private final Set<String> failed = new HashSet<>();
  private final Map<String, String> claims = new HashMap<>();
  private int operationsSinceFlush;

  private FileChannel lockChannel;
  private FileLock fileLock;

  @Autowired
  public ProgressLedger(IngestionConfig ingestionConfig, ObjectMapper objectMapper) {
    this(
        Path.of(ingestionConfig.getLedger().getPath()),
        ingestionConfig.getLedger().getFlushEvery(),
        objectMapper,
        Clock.systemUTC());
  }

  @VisibleForTesting
  ProgressLedger(Path path, int flushEvery, ObjectMapper objectMapper, Clock clock) {
    if (flushEvery < 1) {
      throw new IllegalArgumentException("flushEvery must be positive: " + flushEvery);
    }
    this.path = path.toAbsolutePath();
    this.lockPath = this.path.resolveSibling(this.path.getFileName() + ".lock");
    this.flushEvery = flushEvery;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public Path getPath() {
    return path;
  }

  /**
   * Locks the ledger for this process and reads it into memory.
   *
   * @return the persisted state, empty when no file exists yet
   * @throws LedgerLockedException if another run holds the ledger
   * @throws LedgerCorruptedException if the file exists but cannot be parsed
   */
  public LedgerState load() {
    lock.lock();
    try {
      acquireFileLock();
      LedgerFile file;
      try {
        file = readFile();
      } catch (LedgerCorruptedException e) {
        releaseFileLock();
        throw e;
      }
      completedQueries.clear();
      downloaded.clear();
      indexed.clear();
      failed.clear();
      claims.clear();
      operationsSinceFlush = 0;
      if (file != null) {
        merge(file);
      }
      log.info(
          "Loaded progress ledger {}: {} completed queries, {} downloaded, {} indexed, {} failed",
          path,
          completedQueries.size(),
          downloaded.size(),
          indexed.size(),
          failed.size());
      return snapshotLocked();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reads the ledger without locking it or changing in-memory state.
   *
   * @throws LedgerCorruptedException if the file exists but cannot be parsed
   */
  public LedgerState peek() {
    LedgerFile file = readFile();
    if (file == null) {
      return LedgerState.empty();
    }
    return new LedgerState(
        Set.copyOf(file.getCompletedQueries()),
        Set.copyOf(file.getDownloadedRecordIds()),
        Set.copyOf(file.getIndexedRecordIds()),
        Set.copyOf(file.getFailedRecordIds()));
  }

  /**
   * Claims record IDs for fetching by {@code owner}. IDs are partitioned into claimed, already
   * processed and in flight elsewhere; only claimed IDs may be fetched.
   */
  public ClaimResult claimForDownload(Collection<String> recordIds, String owner) {
    List<String> claimed = new ArrayList<>();
    List<String> processed = new ArrayList<>();
    List<String> elsewhere = new ArrayList<>();
    lock.lock();
    try {
      for (String recordId : recordIds) {
        if (isProcessed(recordId)) {
          processed.add(recordId);
          continue;
        }
        String holder = claims.putIfAbsent(recordId, owner);
        if (holder == null || holder.equals(owner)) {
          claimed.add(recordId);
        } else {
          elsewhere.add(recordId);
        }
      }
    } finally {
      lock.unlock();
    }
    return new ClaimResult(claimed, processed, elsewhere);
  }

  /**
   * Marks a record downloaded. A download persisted without an outcome counts as processed on the
   * next load; the pipeline records both at once through {@link #recordProcessed}.
   */
  public void recordDownloaded(String recordId) {
    lock.lock();
    try {
      downloaded.add(recordId);
      countOperation();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Marks a record downloaded together with its outcome, indexed or failed, and releases its claim.
   * Both entries are added under one lock hold, so no flush can persist the download alone.
   */
  public void recordProcessed(String recordId, boolean indexedSuccessfully) {
    lock.lock();
    try {
      downloaded.add(recordId);
      if (indexedSuccessfully) {
        indexed.add(recordId);
      } else {
        failed.add(recordId);
      }
      claims.remove(recordId);
      claimsChanged.signalAll();
      countOperation();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Marks a record indexed and releases its claim.
   *
   * @throws IllegalStateException if the record was never recorded as downloaded
   */
  public void recordIndexed(String recordId) {
    lock.lock();
    try {
      if (!downloaded.contains(recordId)) {
        throw new IllegalStateException(
            "Record " + recordId + " cannot be indexed before it is downloaded");
      }
      indexed.add(recordId);
      claims.remove(recordId);
      claimsChanged.signalAll();
      countOperation();
    } finally {
      lock.unlock();
    }
  }

  /** Marks a record permanently failed and releases its claim. */
  public void recordFailed(String recordId) {
    lock.lock();
    try {
      failed.add(recordId);
      claims.remove(recordId);
      claimsChanged.signalAll();
      countOperation();
    } finally {
      lock.unlock();
    }
  }

  /** Marks a query complete and flushes. */
  public void recordQueryComplete(String query) {
    lock.lock();
    try {
      completedQueries.add(query);
      flushLocked();
    } finally {
      lock.unlock();
    }
  }

  public boolean isQueryComplete(String query) {
    lock.lock();
    try {
      return completedQueries.contains(query);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until none of the given records is claimed by another worker.
   *
   * @param recordIds records the caller depends on
   * @param stopRequested polled while waiting; the wait ends early once it returns true
   * @return true if every record is now processed, false if the wait was cut short or another
   *     worker gave a record up unprocessed
   */
  public boolean awaitProcessed(Collection<String> recordIds, BooleanSupplier stopRequested) {
    lock.lock();
    try {
      while (recordIds.stream().anyMatch(claims::containsKey)) {
        if (stopRequested.getAsBoolean()) {
          return false;
        }
        claimsChanged.await(AWAIT_POLL_MILLIS, TimeUnit.MILLISECONDS);
      }
      return recordIds.stream().allMatch(this::isProcessed);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IngestionInterruptedException("Interrupted waiting for records in flight", e);
    } finally {
      lock.unlock();
    }
  }

  /** Drops every claim held by {@code owner}, e.g. when its worker stops mid-query. */
  public void releaseClaims(String owner) {
    lock.lock();
    try {
      if (claims.values().removeIf(owner::equals)) {
        claimsChanged.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  public LedgerState snapshot() {
    lock.lock();
    try {
      return snapshotLocked();
    } finally {
      lock.unlock();
    }
  }

  /** Writes pending changes now. */
  public void flush() {
    lock.lock();
    try {
      flushLocked();
    } finally {
      lock.unlock();
    }
  }

  /** Flushes, clears claims and releases the file lock. Safe to call more than once. */
  @Override
  public void close() {
    lock.lock();
    try {
      if (fileLock == null) {
        return;
      }
      claims.clear();
      claimsChanged.signalAll();
      try {
        flushLocked();
      } finally {
        releaseFileLock();
      }
    } finally {
      lock.unlock();
    }
  }

  public boolean isOpen() {
    lock.lock();
    try {
      return fileLock != null;
    } finally {
      lock.unlock();
    }
  }

  private boolean isProcessed(String recordId) {
    return downloaded.contains(recordId) || indexed.contains(recordId) || failed.contains(recordId);
  }

  private void countOperation() {
    operationsSinceFlush++;
    if (operationsSinceFlush >= flushEvery) {
      flushLocked();
    }
  }

  private LedgerState snapshotLocked() {
    return new LedgerState(completedQueries, downloaded, indexed, failed);
  }

  private void merge(LedgerFile file) {
    completedQueries.addAll(file.getCompletedQueries());
    downloaded.addAll(file.getDownloadedRecordIds());
    indexed.addAll(file.getIndexedRecordIds());
    failed.addAll(file.getFailedRecordIds());
  }

  private void flushLocked() {
    LedgerFile onDisk = readFile();
    if (onDisk != null) {
      merge(onDisk);
    }
    LedgerFile file =
        LedgerFile.builder()
            .completedQueries(sorted(completedQueries))
            .downloadedRecordIds(sorted(downloaded))
            .indexedRecordIds(sorted(indexed))
            .failedRecordIds(sorted(failed))
            .updatedAt(clock.instant().toString())
            .build();
    Path temp = null;
    try {
      Files.createDirectories(path.getParent());
      temp = Files.createTempFile(path.getParent(), path.getFileName().toString(), ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), file);
      moveIntoPlace(temp);
      temp = null;
      operationsSinceFlush = 0;
      log.debug(
          "Flushed progress ledger: {} queries, {} downloaded, {} indexed, {} failed",
          completedQueries.size(),
          downloaded.size(),
          indexed.size(),
          failed.size());
    } catch (IOException e) {
      throw new LedgerWriteException(path, e);
    } finally {
      if (temp != null) {
        try {
          Files.deleteIfExists(temp);
        } catch (IOException e) {
          log.warn("Failed to delete temporary ledger file {}: {}", temp, e.getMessage());
        }
      }
    }
  }

  private void moveIntoPlace(Path temp) throws IOException {
    try {
      Files.move(
          temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.warn("Atomic rename not supported for {}, falling back to plain replace", path);
      Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /** Returns null when there is no ledger file yet. */
  private LedgerFile readFile() {
    if (!Files.exists(path)) {
      return null;
    }
    LedgerFile file;
    try {
      file = objectMapper.readValue(path.toFile(), LedgerFile.class);
    } catch (JsonProcessingException e) {
      throw new LedgerCorruptedException(path, e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new LedgerCorruptedException(path, e.getMessage(), e);
    }
    if (file == null) {
      throw new LedgerCorruptedException(path, "file holds no ledger object", null);
    }
    if (file.getCompletedQueries() == null
        || file.getDownloadedRecordIds() == null
        || file.getIndexedRecordIds() == null
        || file.getFailedRecordIds() == null) {
      throw new LedgerCorruptedException(path, "ledger sets must not be null", null);
    }
    return file;
  }

  private void acquireFileLock() {
    if (fileLock != null) {
      return;
    }
    FileChannel channel = null;
    try {
      Files.createDirectories(lockPath.getParent());
      channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
      FileLock acquired = channel.tryLock();
      if (acquired == null) {
        throw new LedgerLockedException(path);
      }
      lockChannel = channel;
      fileLock = acquired;
      channel = null;
    } catch (OverlappingFileLockException e) {
      throw new LedgerLockedException(path, e);
    } catch (IOException e) {
      throw new LedgerLockedException(path, e);
    } finally {
      if (channel != null) {
        closeQuietly(channel);
      }
    }
  }

  private void releaseFileLock() {
    try {
      if (fileLock != null) {
        fileLock.release();
      }
    } catch (IOException e) {
      log.warn("Failed to release ledger lock {}: {}", lockPath, e.getMessage());
    } finally {
      fileLock = null;
      if (lockChannel != null) {
        closeQuietly(lockChannel);
        lockChannel = null;
      }
    }
  }

  private void closeQuietly(FileChannel channel) {
    try {
      channel.close();
    } catch (IOException e) {
      log.warn("Failed to close ledger lock channel {}: {}", lockPath, e.getMessage());
    }
  }

  private static List<String> sorted(Set<String> values) {
    List<String> list = new ArrayList<>(values);
    list.sort(null);
    return list;
  }
}
