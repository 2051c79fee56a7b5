package com.flamingo.ai.agenticrag.service.rag.chunking;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Recursive character splitter that tracks exact offsets.
 *
 * <p>The text is cut on the first separator level that brings pieces under {@code chunkSize}:
 * paragraph breaks, then line breaks, then sentence ends, then whitespace, and finally fixed-width
 * character cuts. Separators stay attached to the piece before them, so the pieces tile the source
 * without gaps. Adjacent pieces are then merged into windows of at most {@code chunkSize}
 * characters, and each window after the first starts with up to {@code chunkOverlap} characters of
 * whole trailing pieces from the window before it.
 *
 * <p>Needs no external service and is deterministic for a given text and configuration.
 */
@Component
@Slf4j
public class StructuralChunkingStrategy implements ChunkingStrategy {

  private static final List<Pattern> SEPARATORS =
      List.of(
          Pattern.compile("\\n[ \\t]*\\n\\s*"),
          Pattern.compile("\\n"),
          Pattern.compile("(?<=[.!?])\\s+"),
          Pattern.compile("\\s+"));

  @Override
  public List<TextSpan> split(String content, ChunkingConfig config) {
    return split(content, 0, content.length(), config.chunkSize(), config.chunkOverlap());
  }

  @Override
  public SplitMethod method() {
    return SplitMethod.STRUCTURAL;
  }

  /**
   * Splits the range {@code [start, end)} of the content.
   *
   * @param content source text
   * @param start inclusive start of the range
   * @param end exclusive end of the range
   * @param chunkSize maximum window length
   * @param chunkOverlap maximum repeated trailing context, less than {@code chunkSize}
   * @return trimmed, non-empty windows in ascending order
   */
  public List<TextSpan> split(String content, int start, int end, int chunkSize, int chunkOverlap) {
    List<TextSpan> pieces = new ArrayList<>();
    collectPieces(content, start, end, 0, chunkSize, pieces);

    List<TextSpan> windows = merge(pieces, chunkSize, chunkOverlap);
    List<TextSpan> result = new ArrayList<>(windows.size());
    for (TextSpan window : windows) {
      TextSpan trimmed = window.trim(content);
      // A window that adds only whitespace after its overlap repeats the previous chunk
      if (trimmed != null
          && (result.isEmpty() || trimmed.end() > result.get(result.size() - 1).end())) {
        result.add(trimmed);
      }
    }
    log.debug(
        "Structural split of {} chars produced {} pieces and {} chunks",
        end - start,
        pieces.size(),
        result.size());
    return result;
  }

  private void collectPieces(
      String text, int start, int end, int level, int chunkSize, List<TextSpan> out) {
    if (end - start <= chunkSize) {
      out.add(new TextSpan(start, end));
      return;
    }
    if (level == SEPARATORS.size()) {
      cutByCharacters(text, start, end, chunkSize, out);
      return;
    }

    Matcher matcher = SEPARATORS.get(level).matcher(text).region(start, end);
    int pieceStart = start;
    while (matcher.find()) {
      int cut = matcher.end();
      if (cut <= pieceStart || cut >= end) {
        continue;
      }
      collectPieces(text, pieceStart, cut, level + 1, chunkSize, out);
      pieceStart = cut;
    }
    collectPieces(text, pieceStart, end, level + 1, chunkSize, out);
  }

  private void cutByCharacters(
      String text, int start, int end, int chunkSize, List<TextSpan> out) {
    int pieceStart = start;
    while (pieceStart < end) {
      int cut = Math.min(pieceStart + chunkSize, end);
      // never separate a surrogate pair
      if (cut < end && cut - 1 > pieceStart && Character.isHighSurrogate(text.charAt(cut - 1))) {
        cut--;
      }
      out.add(new TextSpan(pieceStart, cut));
      pieceStart = cut;
    }
  }

  private List<TextSpan> merge(List<TextSpan> pieces, int chunkSize, int chunkOverlap) {
    List<TextSpan> windows = new ArrayList<>();
    Deque<TextSpan> current = new ArrayDeque<>();

    for (TextSpan piece : pieces) {
      if (!current.isEmpty() && piece.end() - current.peekFirst().start() > chunkSize) {
        windows.add(new TextSpan(current.peekFirst().start(), current.peekLast().end()));
        while (!current.isEmpty()
            && (current.peekLast().end() - current.peekFirst().start() > chunkOverlap
                || piece.end() - current.peekFirst().start() > chunkSize)) {
          current.pollFirst();
        }
      }
      current.addLast(piece);
    }
    if (!current.isEmpty()) {
      windows.add(new TextSpan(current.peekFirst().start(), current.peekLast().end()));
    }
    return windows;
  }
}
