package com.flamingo.ai.literatureingest.document.chunking;

import com.flamingo.ai.literatureingest.config.IngestionConfig;
import com.flamingo.ai.literatureingest.domain.model.AssembledDocument;
import com.flamingo.ai.literatureingest.domain.model.Chunk;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Fixed-size character chunker that prefers paragraph, then line, then sentence, then word breaks.
 *
 * <p>Text is split on the coarsest separator present. Pieces that still exceed the chunk size are
 * split again with the next separator, down to single characters. Small pieces are merged back
 * into windows of at most {@code size} characters; each new window starts with up to {@code
 * overlap} characters carried over from the end of the previous one.
 */
@Service
@Slf4j
public class RecursiveCharacterChunker implements DocumentChunker {

  static final List<String> SEPARATORS = List.of("\n\n", "\n", ". ", " ", "");

  private final int chunkSize;
  private final int overlap;

  @Autowired
  public RecursiveCharacterChunker(IngestionConfig ingestionConfig) {
    this(ingestionConfig.getChunking().getSize(), ingestionConfig.getChunking().getOverlap());
  }

  @VisibleForTesting
  RecursiveCharacterChunker(int chunkSize, int overlap) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunk size must be positive");
    }
    if (overlap < 0 || overlap >= chunkSize) {
      throw new IllegalArgumentException("overlap must be in [0, chunk size)");
    }
    this.chunkSize = chunkSize;
    this.overlap = overlap;
  }

  @Override
  public List<Chunk> chunk(AssembledDocument document) {
    List<String> windows = splitText(document.content());
    List<Chunk> chunks = new ArrayList<>(windows.size());
    for (int i = 0; i < windows.size(); i++) {
      chunks.add(
          new Chunk(
              document.recordId(),
              i,
              windows.get(i),
              document.metadata(),
              document.query(),
              document.hasFullText()));
    }
    log.debug("Record {} produced {} chunks", document.recordId(), chunks.size());
    return List.copyOf(chunks);
  }

  @VisibleForTesting
  List<String> splitText(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return split(text, SEPARATORS);
  }

  private List<String> split(String text, List<String> separators) {
    String separator = separators.get(separators.size() - 1);
    List<String> finer = List.of();
    for (int i = 0; i < separators.size(); i++) {
      String candidate = separators.get(i);
      if (candidate.isEmpty()) {
        separator = candidate;
        break;
      }
      if (text.contains(candidate)) {
        separator = candidate;
        finer = separators.subList(i + 1, separators.size());
        break;
      }
    }

    List<String> windows = new ArrayList<>();
    List<String> small = new ArrayList<>();
    for (String piece : splitKeepingSeparator(text, separator)) {
      if (piece.length() < chunkSize) {
        small.add(piece);
        continue;
      }
      if (!small.isEmpty()) {
        windows.addAll(merge(small));
        small.clear();
      }
      if (finer.isEmpty()) {
        addIfNotBlank(windows, piece);
      } else {
        windows.addAll(split(piece, finer));
      }
    }
    if (!small.isEmpty()) {
      windows.addAll(merge(small));
    }
    return windows;
  }

  /** Splits before every separator occurrence, so each piece after the first starts with it. */
  private static List<String> splitKeepingSeparator(String text, String separator) {
    List<String> pieces = new ArrayList<>();
    if (separator.isEmpty()) {
      text.codePoints().forEach(cp -> pieces.add(new String(Character.toChars(cp))));
      return pieces;
    }
    int start = 0;
    int index = text.indexOf(separator);
    while (index >= 0) {
      if (index > start) {
        pieces.add(text.substring(start, index));
      }
      start = index;
      index = text.indexOf(separator, index + separator.length());
    }
    if (start < text.length()) {
      pieces.add(text.substring(start));
    }
    return pieces;
  }

  private List<String> merge(List<String> pieces) {
    List<String> windows = new ArrayList<>();
    Deque<String> current = new ArrayDeque<>();
    int total = 0;
    for (String piece : pieces) {
      int length = piece.length();
      if (total + length > chunkSize && !current.isEmpty()) {
        addIfNotBlank(windows, String.join("", current));
        while (total > overlap || (total + length > chunkSize && total > 0)) {
          total -= current.removeFirst().length();
        }
      }
      current.addLast(piece);
      total += length;
    }
    addIfNotBlank(windows, String.join("", current));
    return windows;
  }

  private static void addIfNotBlank(List<String> windows, String window) {
    String stripped = window.strip();
    if (!stripped.isEmpty()) {
      windows.add(stripped);
    }
  }
}
