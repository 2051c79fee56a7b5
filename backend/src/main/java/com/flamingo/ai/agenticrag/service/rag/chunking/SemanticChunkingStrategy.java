package com.flamingo.ai.agenticrag.service.rag.chunking;

import com.flamingo.ai.agenticrag.config.RagConfig;
import com.flamingo.ai.agenticrag.service.rag.embedding.EmbeddingGenerator;
import com.google.common.annotations.VisibleForTesting;
import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Splits at points of maximal semantic discontinuity.
 *
 * <p>Every sentence is embedded together with its immediate neighbours, and the cosine distance
 * between consecutive windows is measured. A new chunk starts wherever that distance exceeds the
 * configured percentile of all distances in the document, so contiguous sentences stay together
 * while their similarity remains above the threshold.
 *
 * <p>Falls back to {@link StructuralChunkingStrategy} when the text has too few sentences, when
 * embedding fails, or when the distances carry no signal.
 */
@Component
@Slf4j
public class SemanticChunkingStrategy implements ChunkingStrategy {

  private static final int MIN_SENTENCES = 3;

  private final EmbeddingGenerator embeddingGenerator;
  private final StructuralChunkingStrategy fallback;
  private final double breakpointPercentile;

  @Autowired
  public SemanticChunkingStrategy(
      EmbeddingGenerator embeddingGenerator,
      StructuralChunkingStrategy fallback,
      RagConfig ragConfig) {
    this(embeddingGenerator, fallback, ragConfig.getChunking().getBreakpointPercentile());
  }

  @VisibleForTesting
  SemanticChunkingStrategy(
      EmbeddingGenerator embeddingGenerator,
      StructuralChunkingStrategy fallback,
      double breakpointPercentile) {
    if (breakpointPercentile <= 0 || breakpointPercentile > 100) {
      throw new IllegalArgumentException(
          "Breakpoint percentile must be in (0, 100]: " + breakpointPercentile);
    }
    this.embeddingGenerator = embeddingGenerator;
    this.fallback = fallback;
    this.breakpointPercentile = breakpointPercentile;
  }

  @Override
  public List<TextSpan> split(String content, ChunkingConfig config) {
    List<TextSpan> sentences = sentences(content);
    if (sentences.size() < MIN_SENTENCES) {
      log.debug("Only {} sentence(s), using structural splitting", sentences.size());
      return fallback.split(content, config);
    }

    List<float[]> vectors;
    try {
      vectors = embeddingGenerator.embedTexts(windows(content, sentences));
    } catch (RuntimeException e) {
      log.warn(
          "Semantic splitting unavailable, falling back to structural splitting: {}",
          e.getMessage());
      return fallback.split(content, config);
    }

    double[] distances = new double[sentences.size() - 1];
    for (int i = 0; i < distances.length; i++) {
      distances[i] = 1.0 - cosineSimilarity(vectors.get(i), vectors.get(i + 1));
    }
    double threshold = percentile(distances, breakpointPercentile);
    if (!(threshold > 0.0)) {
      log.warn(
          "No semantic signal across {} sentences, using structural splitting",
          sentences.size());
      return fallback.split(content, config);
    }

    List<TextSpan> groups = new ArrayList<>();
    int groupStart = sentences.get(0).start();
    for (int i = 0; i < distances.length; i++) {
      if (distances[i] > threshold) {
        groups.add(new TextSpan(groupStart, sentences.get(i).end()));
        groupStart = sentences.get(i + 1).start();
      }
    }
    groups.add(new TextSpan(groupStart, sentences.get(sentences.size() - 1).end()));

    log.debug(
        "Semantic split of {} sentences at threshold {} produced {} groups",
        sentences.size(),
        String.format("%.4f", threshold),
        groups.size());
    return groups;
  }

  @Override
  public SplitMethod method() {
    return SplitMethod.SEMANTIC;
  }

  /** Sentence ranges of the content, trimmed, blank ones dropped. */
  @VisibleForTesting
  static List<TextSpan> sentences(String content) {
    BreakIterator iterator = BreakIterator.getSentenceInstance(Locale.ROOT);
    iterator.setText(content);
    List<TextSpan> sentences = new ArrayList<>();
    int start = iterator.first();
    for (int end = iterator.next(); end != BreakIterator.DONE; start = end, end = iterator.next()) {
      TextSpan sentence = new TextSpan(start, end).trim(content);
      if (sentence != null) {
        sentences.add(sentence);
      }
    }
    return sentences;
  }

  private List<String> windows(String content, List<TextSpan> sentences) {
    List<String> windows = new ArrayList<>(sentences.size());
    int last = sentences.size() - 1;
    for (int i = 0; i <= last; i++) {
      int from = sentences.get(Math.max(0, i - 1)).start();
      int to = sentences.get(Math.min(last, i + 1)).end();
      windows.add(content.substring(from, to));
    }
    return windows;
  }

  @VisibleForTesting
  static double cosineSimilarity(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalStateException(
          "Vector dimensions differ: " + a.length + " vs " + b.length);
    }
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      normA += a[i] * a[i];
      normB += b[i] * b[i];
    }
    if (normA == 0 || normB == 0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  /** Linear-interpolated percentile, {@code p} in (0, 100]. */
  @VisibleForTesting
  static double percentile(double[] values, double p) {
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    double rank = p / 100.0 * (sorted.length - 1);
    int lower = (int) Math.floor(rank);
    int upper = (int) Math.ceil(rank);
    return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
  }
}
