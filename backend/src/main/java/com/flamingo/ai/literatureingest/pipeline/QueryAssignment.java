package com.flamingo.ai.literatureingest.pipeline;

import java.util.ArrayList;
import java.util.List;

/** Fixed assignment of queries to workers. */
public final class QueryAssignment {

  private QueryAssignment() {}

  /**
   * Assigns {@code queries[i]} to worker {@code i mod workers}, keeping query order within each
   * worker. Worker loads differ by at most one query.
   */
  public static List<List<String>> roundRobin(List<String> queries, int workers) {
    if (workers < 1) {
      throw new IllegalArgumentException("At least one worker is required");
    }
    List<List<String>> assignment = new ArrayList<>(workers);
    for (int i = 0; i < workers; i++) {
      assignment.add(new ArrayList<>());
    }
    for (int i = 0; i < queries.size(); i++) {
      assignment.get(i % workers).add(queries.get(i));
    }
    return assignment.stream().map(List::copyOf).toList();
  }
}
