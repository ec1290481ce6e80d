package com.flamingo.ai.literatureingest.api.rest;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.literatureingest.exception.ApiError;
import com.flamingo.ai.literatureingest.exception.GlobalExceptionHandler;
import com.flamingo.ai.literatureingest.exception.IngestionAlreadyRunningException;
import com.flamingo.ai.literatureingest.exception.VectorStoreUnavailableException;
import com.flamingo.ai.literatureingest.index.ChunkVectorStore;
import com.flamingo.ai.literatureingest.ledger.LedgerState;
import com.flamingo.ai.literatureingest.pipeline.IngestionCoordinator;
import com.flamingo.ai.literatureingest.pipeline.IngestionRunService;
import com.flamingo.ai.literatureingest.pipeline.IngestionStats;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionController Tests")
class IngestionControllerTest {

  private MockMvc mockMvc;

  @Mock private IngestionCoordinator coordinator;
  @Mock private IngestionRunService runService;
  @Mock private ChunkVectorStore vectorStore;
  private IngestionStats stats;

  @BeforeEach
  void setUp() {
    MeterRegistry meterRegistry = new SimpleMeterRegistry();
    stats = new IngestionStats(meterRegistry);
    IngestionController controller =
        new IngestionController(coordinator, runService, stats, vectorStore);
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  private void stubStatus() {
    when(coordinator.ledgerState())
        .thenReturn(
            new LedgerState(
                Set.of("cataract"), Set.of("1", "2", "3"), Set.of("1", "2"), Set.of("3")));
    when(coordinator.workerSnapshots()).thenReturn(List.of());
    when(coordinator.lastSummary()).thenReturn(Optional.empty());
  }

  @Test
  @DisplayName("status reports ledger totals and stored chunks")
  void status_shouldReportLedgerTotals() throws Exception {
    stubStatus();
    when(coordinator.isRunning()).thenReturn(true);
    when(vectorStore.countChunks()).thenReturn(42L);
    stats.recordIndexed();

    mockMvc
        .perform(get("/api/ingestion/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.running").value(true))
        .andExpect(jsonPath("$.completedQueries").value(1))
        .andExpect(jsonPath("$.downloadedRecords").value(3))
        .andExpect(jsonPath("$.indexedRecords").value(2))
        .andExpect(jsonPath("$.failedRecords").value(1))
        .andExpect(jsonPath("$.storedChunks").value(42))
        .andExpect(jsonPath("$.workers").isEmpty());
  }

  @Test
  @DisplayName("status leaves stored chunks empty when the vector store is down")
  void status_shouldTolerateUnavailableStore() throws Exception {
    stubStatus();
    when(vectorStore.countChunks())
        .thenThrow(new VectorStoreUnavailableException("connection refused"));

    mockMvc
        .perform(get("/api/ingestion/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.indexedRecords").value(2))
        .andExpect(jsonPath("$.storedChunks").doesNotExist());
  }

  @Test
  @DisplayName("POST /runs starts a background run")
  void startRun_shouldReturnAccepted() throws Exception {
    mockMvc
        .perform(post("/api/ingestion/runs"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.status").value("STARTED"));

    verify(runService).startInBackground();
  }

  @Test
  @DisplayName("POST /runs answers 409 while a run is active")
  void startRun_shouldConflictWhenRunning() throws Exception {
    doThrow(new IngestionAlreadyRunningException()).when(runService).startInBackground();

    mockMvc
        .perform(post("/api/ingestion/runs"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value(ApiError.INGESTION_ALREADY_RUNNING));
  }

  @Test
  @DisplayName("POST /stop stops the active run")
  void stop_shouldStopActiveRun() throws Exception {
    when(coordinator.isRunning()).thenReturn(true);

    mockMvc
        .perform(post("/api/ingestion/stop"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.status").value("STOPPING"));

    verify(coordinator).requestStop();
  }

  @Test
  @DisplayName("POST /stop reports when nothing is running")
  void stop_shouldReportNotRunning() throws Exception {
    when(coordinator.isRunning()).thenReturn(false);

    mockMvc
        .perform(post("/api/ingestion/stop"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.status").value("NOT_RUNNING"));
  }
}
