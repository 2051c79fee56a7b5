package com.flamingo.ai.agenticrag.service.rag.chunking;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Enforces chunk size bounds on the output of any strategy.
 *
 * <p>Spans longer than {@code maxChunkSize} are re-split structurally without overlap. Spans
 * shorter than {@code minChunkSize} are then merged into the previous span, or into the next one
 * when there is no previous span or the merge would exceed {@code maxChunkSize}. A short span stays
 * as it is when it is the only span or when neither merge fits under the cap.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChunkPostProcessor {

  private final StructuralChunkingStrategy structuralChunkingStrategy;

  public List<TextSpan> apply(String content, List<TextSpan> spans, ChunkingConfig config) {
    List<TextSpan> bounded = enforceMaxSize(content, spans, config.maxChunkSize());
    return mergeUndersized(bounded, config.minChunkSize(), config.maxChunkSize());
  }

  private List<TextSpan> enforceMaxSize(String content, List<TextSpan> spans, int maxChunkSize) {
    List<TextSpan> result = new ArrayList<>(spans.size());
    for (TextSpan span : spans) {
      if (span.length() <= maxChunkSize) {
        result.add(span);
        continue;
      }
      List<TextSpan> parts =
          structuralChunkingStrategy.split(content, span.start(), span.end(), maxChunkSize, 0);
      log.debug(
          "Re-split oversized span of {} chars into {} parts", span.length(), parts.size());
      result.addAll(parts);
    }
    return result;
  }

  private List<TextSpan> mergeUndersized(List<TextSpan> spans, int minChunkSize, int maxChunkSize) {
    List<TextSpan> merged = new ArrayList<>(spans);
    int i = 0;
    while (i < merged.size() && merged.size() > 1) {
      TextSpan span = merged.get(i);
      if (span.length() >= minChunkSize) {
        i++;
        continue;
      }
      if (i > 0 && fits(merged.get(i - 1), span, maxChunkSize)) {
        TextSpan previous = merged.get(i - 1);
        merged.set(i - 1, new TextSpan(previous.start(), Math.max(previous.end(), span.end())));
        merged.remove(i);
        i--;
      } else if (i + 1 < merged.size() && fits(span, merged.get(i + 1), maxChunkSize)) {
        TextSpan next = merged.get(i + 1);
        merged.set(i, new TextSpan(span.start(), Math.max(span.end(), next.end())));
        merged.remove(i + 1);
      } else {
        i++;
      }
    }
    return merged;
  }

  private boolean fits(TextSpan first, TextSpan second, int maxChunkSize) {
    return Math.max(first.end(), second.end()) - first.start() <= maxChunkSize;
  }
}
