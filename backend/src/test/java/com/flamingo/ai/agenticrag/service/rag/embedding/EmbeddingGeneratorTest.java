package com.flamingo.ai.agenticrag.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.agenticrag.exception.EmbeddingException;
import com.flamingo.ai.agenticrag.service.rag.model.DocumentChunk;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingGenerator Tests")
class EmbeddingGeneratorTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  @Mock private EmbeddingModel embeddingModel;

  private SimpleMeterRegistry meterRegistry;
  private EmbeddingGenerator generator;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    EmbeddingModelProvider provider =
        new EmbeddingModelProvider("test-model", name -> embeddingModel);
    generator =
        new EmbeddingGenerator(
            provider, meterRegistry, 2, 50, 2, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  /** Answers each segment with {@code [length, 1]} so results can be matched to inputs. */
  private void answerWithLengthVectors() {
    when(embeddingModel.embedAll(anyList()))
        .thenAnswer(
            invocation -> {
              List<TextSegment> segments = invocation.getArgument(0);
              List<Embedding> embeddings = new ArrayList<>();
              for (TextSegment segment : segments) {
                embeddings.add(Embedding.from(new float[] {segment.text().length(), 1f}));
              }
              return Response.from(embeddings);
            });
  }

  private static List<DocumentChunk> chunks(String... contents) {
    List<DocumentChunk> chunks = new ArrayList<>();
    int offset = 0;
    for (int i = 0; i < contents.length; i++) {
      String content = contents[i];
      chunks.add(
          DocumentChunk.of(i, offset, offset + content.length(), content, Map.of("source", "s")));
      offset += content.length();
    }
    return chunks;
  }

  @Nested
  @DisplayName("Chunk embedding")
  class ChunkEmbedding {

    @Test
    @DisplayName("Should batch texts into the minimum number of calls")
    void shouldBatchTextsIntoMinimumNumberOfCalls() {
      answerWithLengthVectors();

      generator.embed(chunks("a", "bb", "ccc", "dddd", "eeeee"));

      verify(embeddingModel, times(3)).embedAll(anyList());
    }

    @Test
    @DisplayName("Should preserve input order")
    void shouldPreserveInputOrder() {
      answerWithLengthVectors();

      List<DocumentChunk> result = generator.embed(chunks("a", "bb", "ccc", "dddd", "eeeee"));

      assertThat(result).hasSize(5);
      for (int i = 0; i < result.size(); i++) {
        assertThat(result.get(i).embedding()).containsExactly((float) (i + 1), 1f);
        assertThat(result.get(i).index()).isEqualTo(i);
      }
    }

    @Test
    @DisplayName("Should add model and timestamp metadata without touching content")
    void shouldAddEmbeddingMetadata() {
      answerWithLengthVectors();
      List<DocumentChunk> input = chunks("alpha", "beta");

      List<DocumentChunk> result = generator.embed(input, "test-model");

      assertThat(result.get(0).metadata())
          .containsEntry("source", "s")
          .containsEntry(EmbeddingGenerator.EMBEDDING_MODEL_KEY, "test-model")
          .containsEntry(EmbeddingGenerator.EMBEDDING_GENERATED_AT_KEY, "2026-01-01T00:00:00Z");
      assertThat(result.get(1).content()).isEqualTo("beta");
      assertThat(result.get(1).startChar()).isEqualTo(input.get(1).startChar());
      assertThat(input.get(0).embedding()).isNull();
      assertThat(meterRegistry.counter("embedding.requests.success", "type", "chunks").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should return empty list without calling the backend")
    void shouldReturnEmptyListWithoutCallingBackend() {
      assertThat(generator.embed(List.of())).isEmpty();
      verify(embeddingModel, never()).embedAll(anyList());
    }

    @Test
    @DisplayName("Should truncate long texts for the backend call only")
    @SuppressWarnings("unchecked")
    void shouldTruncateLongTextsForBackendOnly() {
      answerWithLengthVectors();
      String longText = "x".repeat(80);

      List<DocumentChunk> result = generator.embed(chunks(longText));

      ArgumentCaptor<List<TextSegment>> captor = ArgumentCaptor.forClass(List.class);
      verify(embeddingModel).embedAll(captor.capture());
      assertThat(captor.getValue().get(0).text()).hasSize(50);
      assertThat(result.get(0).content()).isEqualTo(longText);
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("Should fail the whole call when any batch fails")
    void shouldFailWholeCallWhenAnyBatchFails() {
      AtomicInteger calls = new AtomicInteger();
      when(embeddingModel.embedAll(anyList()))
          .thenAnswer(
              invocation -> {
                if (calls.incrementAndGet() == 2) {
                  throw new RuntimeException("rate limited");
                }
                List<TextSegment> segments = invocation.getArgument(0);
                List<Embedding> embeddings = new ArrayList<>();
                for (int i = 0; i < segments.size(); i++) {
                  embeddings.add(Embedding.from(new float[] {1f, 2f}));
                }
                return Response.from(embeddings);
              });

      assertThatThrownBy(() -> generator.embed(chunks("a", "b", "c", "d")))
          .isInstanceOf(EmbeddingException.class)
          .hasMessageContaining("rate limited");
    }

    @Test
    @DisplayName("Should fail when the backend returns fewer vectors than texts")
    void shouldFailOnVectorCountMismatch() {
      when(embeddingModel.embedAll(anyList()))
          .thenReturn(Response.from(List.of(Embedding.from(new float[] {1f}))));

      assertThatThrownBy(() -> generator.embed(chunks("a", "b")))
          .isInstanceOf(EmbeddingException.class)
          .hasMessageContaining("1 vectors for 2 texts");
    }

    @Test
    @DisplayName("Should fail when the backend returns mixed dimensions")
    void shouldFailOnMixedDimensions() {
      when(embeddingModel.embedAll(anyList()))
          .thenReturn(
              Response.from(
                  List.of(
                      Embedding.from(new float[] {1f, 2f}), Embedding.from(new float[] {1f}))));

      assertThatThrownBy(() -> generator.embed(chunks("a", "b")))
          .isInstanceOf(EmbeddingException.class)
          .hasMessageContaining("mixed dimensions");
    }
  }

  @Nested
  @DisplayName("Query and text embedding")
  class QueryEmbedding {

    @Test
    @DisplayName("Should embed a query")
    void shouldEmbedQuery() {
      when(embeddingModel.embed(anyString()))
          .thenReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f, 0.3f})));

      List<Float> result = generator.embedQuery("What is hybrid search?");

      assertThat(result).containsExactly(0.1f, 0.2f, 0.3f);
      assertThat(meterRegistry.counter("embedding.requests.success", "type", "query").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject a blank query")
    void shouldRejectBlankQuery() {
      assertThatThrownBy(() -> generator.embedQuery("  "))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should wrap backend errors for queries")
    void shouldWrapBackendErrorsForQueries() {
      when(embeddingModel.embed(anyString())).thenThrow(new IllegalStateException("timeout"));

      assertThatThrownBy(() -> generator.embedQuery("query"))
          .isInstanceOf(EmbeddingException.class)
          .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should embed raw texts in order")
    void shouldEmbedRawTextsInOrder() {
      answerWithLengthVectors();

      List<float[]> vectors = generator.embedTexts(List.of("one", "three", "fifteen"));

      assertThat(vectors).hasSize(3);
      assertThat(vectors.get(0)[0]).isEqualTo(3f);
      assertThat(vectors.get(2)[0]).isEqualTo(7f);
    }
  }
}
