package com.flamingo.ai.literatureingest.index;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Service for generating chunk embeddings with the configured LangChain4j embedding model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; stay well below for dense scientific notation
  private static final int MAX_CHARS_PER_EMBEDDING = 6000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a batch of passages in one model call.
   *
   * @param texts passages in chunk order
   * @return one vector per passage, same order
   */
  public List<List<Float>> embedPassages(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<TextSegment> segments = new ArrayList<>(texts.size());
      for (int i = 0; i < texts.size(); i++) {
        String text = texts.get(i);
        if (text.length() > MAX_CHARS_PER_EMBEDDING) {
          log.warn(
              "Passage {} too long for embedding, truncating from {} chars to {} chars",
              i,
              text.length(),
              MAX_CHARS_PER_EMBEDDING);
          text = text.substring(0, MAX_CHARS_PER_EMBEDDING);
        }
        segments.add(TextSegment.from(text));
      }

      Response<List<Embedding>> response = embeddingModel.embedAll(segments);
      List<Embedding> embeddings = response.content();
      if (embeddings == null || embeddings.size() != texts.size()) {
        throw new IllegalStateException(
            "Embedding model returned "
                + (embeddings == null ? 0 : embeddings.size())
                + " vectors for "
                + texts.size()
                + " passages");
      }

      List<List<Float>> results = new ArrayList<>(embeddings.size());
      for (Embedding embedding : embeddings) {
        float[] vector = embedding.vector();
        List<Float> values = new ArrayList<>(vector.length);
        for (float f : vector) {
          values.add(f);
        }
        results.add(values);
      }
      meterRegistry.counter("embedding.passages").increment(texts.size());
      return results;
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }
}
