package com.flamingo.ai.literatureingest.pipeline;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.literatureingest.exception.IngestionAlreadyRunningException;
import com.flamingo.ai.literatureingest.exception.VectorStoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionRunService")
class IngestionRunServiceTest {

  @Mock private IngestionCoordinator coordinator;

  private IngestionRunService runService;

  @BeforeEach
  void setUp() {
    runService = new IngestionRunService(coordinator, new SyncTaskExecutor());
  }

  @Test
  @DisplayName("runs the configured pipeline on the executor")
  void shouldRunCoordinator() {
    runService.startInBackground();

    verify(coordinator).run();
  }

  @Test
  @DisplayName("refuses to start while a run is active")
  void shouldRejectWhenRunning() {
    when(coordinator.isRunning()).thenReturn(true);

    assertThatThrownBy(() -> runService.startInBackground())
        .isInstanceOf(IngestionAlreadyRunningException.class);
    verify(coordinator, never()).run();
  }

  @Test
  @DisplayName("reports a full executor as an active run")
  void shouldMapRejectedTask() {
    TaskExecutor rejecting =
        task -> {
          throw new TaskRejectedException("queue full");
        };
    runService = new IngestionRunService(coordinator, rejecting);

    assertThatThrownBy(() -> runService.startInBackground())
        .isInstanceOf(IngestionAlreadyRunningException.class);
  }

  @Test
  @DisplayName("logs a fatal background failure instead of rethrowing it")
  void shouldContainFatalFailure() {
    when(coordinator.run()).thenThrow(new VectorStoreUnavailableException("store down"));

    assertThatCode(() -> runService.startInBackground()).doesNotThrowAnyException();
  }
}
