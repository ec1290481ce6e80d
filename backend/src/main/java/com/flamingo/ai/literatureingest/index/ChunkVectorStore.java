package com.flamingo.ai.literatureingest.index;

import com.flamingo.ai.literatureingest.domain.model.Chunk;
import java.util.List;

/** Write side of the vector store holding embedded chunks. */
public interface ChunkVectorStore {

  /**
   * Checks that the store answers at all.
   *
   * @throws com.flamingo.ai.literatureingest.exception.VectorStoreUnavailableException if not
   */
  void verifyAvailable();

  /**
   * Writes chunks with their embeddings. Writing a chunk whose ID already exists replaces it.
   *
   * @param chunks chunks to write
   * @param embeddings one vector per chunk, same order
   * @throws com.flamingo.ai.literatureingest.exception.IndexingException if any chunk was rejected
   */
  void write(List<Chunk> chunks, List<List<Float>> embeddings);

  /** Number of chunks currently stored. */
  long countChunks();
}
