package com.flamingo.ai.literatureingest.api.dto.response;

import com.flamingo.ai.literatureingest.domain.enums.WorkerState;
import com.flamingo.ai.literatureingest.pipeline.WorkerSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for one worker's live state and throughput. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerStatus {
  private String name;
  private String credentialId;
  private WorkerState state;
  private String currentQuery;
  private int queriesAssigned;
  private int queriesProcessed;
  private long requests;
  private double requestsPerSecond;

  public static WorkerStatus from(WorkerSnapshot snapshot) {
    return WorkerStatus.builder()
        .name(snapshot.name())
        .credentialId(snapshot.credentialId())
        .state(snapshot.state())
        .currentQuery(snapshot.currentQuery())
        .queriesAssigned(snapshot.queriesAssigned())
        .queriesProcessed(snapshot.queriesProcessed())
        .requests(snapshot.requests())
        .requestsPerSecond(snapshot.requestsPerSecond())
        .build();
  }
}
