package com.flamingo.ai.literatureingest.document.chunking;

import com.flamingo.ai.literatureingest.domain.model.AssembledDocument;
import com.flamingo.ai.literatureingest.domain.model.Chunk;
import java.util.List;

/**
 * Splits an {@link AssembledDocument} into ordered chunks ready for embedding.
 *
 * <p>Implementations must be stateless, safe for concurrent use and deterministic: the same
 * document always yields the same chunks.
 */
public interface DocumentChunker {

  /**
   * Produces chunks from the document content.
   *
   * @param document the assembled document
   * @return ordered chunks, each carrying the document's metadata and its index
   */
  List<Chunk> chunk(AssembledDocument document);
}
