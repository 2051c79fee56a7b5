package com.flamingo.ai.agenticrag.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkPostProcessor Tests")
class ChunkPostProcessorTest {

  private ChunkPostProcessor postProcessor;

  @BeforeEach
  void setUp() {
    postProcessor = new ChunkPostProcessor(new StructuralChunkingStrategy());
  }

  @Test
  @DisplayName("Should re-split spans longer than the maximum")
  void shouldResplitOversizedSpans() {
    String content = "word ".repeat(100);
    ChunkingConfig config = new ChunkingConfig(1000, 0, 10, 100, false);

    List<TextSpan> result = postProcessor.apply(content, List.of(new TextSpan(0, 499)), config);

    assertThat(result).hasSize(5);
    assertThat(result).allSatisfy(span -> assertThat(span.length()).isLessThanOrEqualTo(100));
    assertThat(result.get(0).start()).isZero();
    assertThat(result.get(result.size() - 1).end()).isEqualTo(499);
  }

  @Test
  @DisplayName("Should merge an undersized span into the previous one")
  void shouldMergeUndersizedSpanIntoPrevious() {
    String content = "a".repeat(50) + " " + "b".repeat(5);
    ChunkingConfig config = new ChunkingConfig(1000, 0, 10, 100, false);

    List<TextSpan> result =
        postProcessor.apply(
            content, List.of(new TextSpan(0, 50), new TextSpan(51, 56)), config);

    assertThat(result).containsExactly(new TextSpan(0, 56));
  }

  @Test
  @DisplayName("Should merge a leading undersized span into the next one")
  void shouldMergeLeadingUndersizedSpanIntoNext() {
    String content = "b".repeat(5) + " " + "a".repeat(50);
    ChunkingConfig config = new ChunkingConfig(1000, 0, 10, 100, false);

    List<TextSpan> result =
        postProcessor.apply(content, List.of(new TextSpan(0, 5), new TextSpan(6, 56)), config);

    assertThat(result).containsExactly(new TextSpan(0, 56));
  }

  @Test
  @DisplayName("Should keep an undersized span when merging would exceed the maximum")
  void shouldKeepUndersizedSpanWhenMergeWouldExceedMaximum() {
    String content = "a".repeat(95) + " " + "b".repeat(5);
    ChunkingConfig config = new ChunkingConfig(1000, 0, 10, 100, false);

    List<TextSpan> result =
        postProcessor.apply(
            content, List.of(new TextSpan(0, 95), new TextSpan(96, 101)), config);

    assertThat(result).containsExactly(new TextSpan(0, 95), new TextSpan(96, 101));
  }

  @Test
  @DisplayName("Should keep a single undersized span")
  void shouldKeepSingleUndersizedSpan() {
    ChunkingConfig config = new ChunkingConfig(1000, 0, 10, 100, false);

    List<TextSpan> result = postProcessor.apply("tiny", List.of(new TextSpan(0, 4)), config);

    assertThat(result).containsExactly(new TextSpan(0, 4));
  }
}
