package com.flamingo.ai.literatureingest.pipeline;

import com.flamingo.ai.literatureingest.config.IngestionConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Configured queries followed by the queries file, in order, without duplicates. */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuerySource {

  private final IngestionConfig ingestionConfig;

  public List<String> load() {
    Set<String> queries = new LinkedHashSet<>();
    for (String query : ingestionConfig.getQueries()) {
      if (query != null && !query.isBlank()) {
        queries.add(query.strip());
      }
    }
    Path file = ingestionConfig.getQueriesFile();
    if (file != null) {
      queries.addAll(readFile(file));
    }
    log.debug("Loaded {} distinct queries", queries.size());
    return new ArrayList<>(queries);
  }

  private static List<String> readFile(Path file) {
    try {
      return Files.readAllLines(file, StandardCharsets.UTF_8).stream()
          .map(String::strip)
          .filter(line -> !line.isEmpty() && !line.startsWith("#"))
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read queries file " + file, e);
    }
  }
}
