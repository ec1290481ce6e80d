package com.flamingo.ai.literatureingest.config;

import com.flamingo.ai.literatureingest.exception.FatalIngestionException;
import com.flamingo.ai.literatureingest.ledger.LedgerState;
import com.flamingo.ai.literatureingest.pipeline.IngestionCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Runs the command named by {@code ingestion.startup.command} once the application is up.
 *
 * <ul>
 *   <li>{@code run} starts (or resumes) an ingestion run
 *   <li>{@code status} logs the ledger totals
 * </ul>
 *
 * <p>With {@code ingestion.startup.exit-on-completion} the application exits afterwards, with
 * status 1 if the run was aborted by a fatal error.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngestionStartupRunner implements CommandLineRunner {

  private final IngestionCoordinator coordinator;
  private final IngestionConfig ingestionConfig;
  private final ConfigurableApplicationContext applicationContext;

  @Override
  public void run(String... args) {
    IngestionConfig.StartupCommand command = ingestionConfig.getStartup().getCommand();
    if (command == IngestionConfig.StartupCommand.NONE) {
      return;
    }
    int exitCode =
        switch (command) {
          case STATUS -> logStatus();
          case RUN -> runIngestion();
          case NONE -> 0;
        };
    if (ingestionConfig.getStartup().isExitOnCompletion()) {
      log.info("Startup command {} finished, exiting with status {}", command, exitCode);
      System.exit(SpringApplication.exit(applicationContext, () -> exitCode));
    }
  }

  private int runIngestion() {
    try {
      coordinator.run();
      return 0;
    } catch (FatalIngestionException e) {
      log.error("Ingestion run aborted: {}", e.getMessage(), e);
      return 1;
    }
  }

  private int logStatus() {
    try {
      LedgerState state = coordinator.ledgerState();
      log.info(
          "Ledger status: {} completed queries, {} downloaded, {} indexed, {} failed records",
          state.completedQueries().size(),
          state.downloadedRecordIds().size(),
          state.indexedRecordIds().size(),
          state.failedRecordIds().size());
      return 0;
    } catch (FatalIngestionException e) {
      log.error("Ledger unreadable: {}", e.getMessage());
      return 1;
    }
  }
}
