package com.flamingo.ai.literatureingest.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.literatureingest.config.IngestionConfig;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("QuerySource")
class QuerySourceTest {

  @TempDir Path tempDir;

  private IngestionConfig config;
  private QuerySource querySource;

  @BeforeEach
  void setUp() {
    config = new IngestionConfig();
    querySource = new QuerySource(config);
  }

  @Test
  @DisplayName("keeps configured queries in order and drops blanks")
  void shouldKeepConfiguredOrder() {
    config.setQueries(List.of(" glaucoma ", "", "cataract", "  "));

    assertThat(querySource.load()).containsExactly("glaucoma", "cataract");
  }

  @Test
  @DisplayName("appends file queries, skipping comments and duplicates")
  void shouldAppendQueriesFile() throws Exception {
    Path file = tempDir.resolve("queries.txt");
    Files.writeString(file, "# retina\nmacular degeneration\n\nglaucoma\n  uveitis  \n");
    config.setQueries(List.of("glaucoma"));
    config.setQueriesFile(file);

    assertThat(querySource.load()).containsExactly("glaucoma", "macular degeneration", "uveitis");
  }

  @Test
  @DisplayName("fails when the queries file cannot be read")
  void shouldFailOnMissingFile() {
    config.setQueriesFile(tempDir.resolve("missing.txt"));

    assertThatThrownBy(() -> querySource.load())
        .isInstanceOf(UncheckedIOException.class)
        .hasMessageContaining("missing.txt");
  }
}
