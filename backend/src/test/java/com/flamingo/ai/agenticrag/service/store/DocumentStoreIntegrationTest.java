package com.flamingo.ai.agenticrag.service.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.agenticrag.exception.StorageException;
import com.flamingo.ai.agenticrag.service.rag.embedding.EmbeddingModelProvider;
import com.flamingo.ai.agenticrag.service.rag.model.DocumentChunk;
import com.flamingo.ai.agenticrag.service.rag.model.DocumentSummary;
import com.flamingo.ai.agenticrag.service.rag.model.SearchResult;
import com.flamingo.ai.agenticrag.service.rag.model.SourceDocument;
import com.flamingo.ai.agenticrag.service.rag.retrieval.RetrievalEngine;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/** Runs the store and the search queries against PostgreSQL with pgvector. */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("DocumentStore Integration Tests")
class DocumentStoreIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>(
          DockerImageName.parse("pgvector/pgvector:pg16").asCompatibleSubstituteFor("postgres"));

  @DynamicPropertySource
  static void datasourceProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
  }

  @MockitoBean private EmbeddingModelProvider embeddingModelProvider;

  @Autowired private DocumentStore documentStore;
  @Autowired private RetrievalEngine retrievalEngine;

  @BeforeEach
  void setUp() {
    documentStore.deleteAll();
  }

  /** Builds one chunk per text, each separated from the next by a single space. */
  private static SourceDocumentWithChunks document(
      String source, List<String> texts, List<List<Float>> vectors) {
    StringBuilder content = new StringBuilder();
    List<DocumentChunk> chunks = new ArrayList<>();
    for (int i = 0; i < texts.size(); i++) {
      if (i > 0) {
        content.append(' ');
      }
      int start = content.length();
      content.append(texts.get(i));
      chunks.add(
          new DocumentChunk(
              i,
              start,
              content.length(),
              texts.get(i),
              DocumentChunk.estimateTokens(texts.get(i)),
              vectors.get(i),
              Map.of("source", source, "chunk_index", i)));
    }
    return new SourceDocumentWithChunks(
        new SourceDocument("Title of " + source, source, content.toString(), Map.of("pages", 1)),
        chunks);
  }

  private UUID save(SourceDocumentWithChunks document) {
    return documentStore.save(document.document(), document.chunks());
  }

  private static SourceDocumentWithChunks retryGuide() {
    return document(
        "docs/retries.md",
        List.of(
            "Payment retries use exponential backoff.",
            "The cafeteria opens at nine.",
            "Retries stop after five attempts."),
        List.of(List.of(1f, 0f, 0f), List.of(0f, 1f, 0f), List.of(0.9f, 0.1f, 0f)));
  }

  @Test
  @DisplayName("Should store a document and return its chunks in index order")
  void shouldStoreDocumentAndChunks() {
    UUID id = save(retryGuide());

    assertThat(documentStore.get(id))
        .hasValueSatisfying(
            stored -> {
              assertThat(stored.title()).isEqualTo("Title of docs/retries.md");
              assertThat(stored.metadata()).containsEntry("pages", 1);
            });
    List<DocumentChunk> chunks = documentStore.getChunks(id);
    assertThat(chunks).extracting(DocumentChunk::index).containsExactly(0, 1, 2);
    assertThat(chunks.get(2).embedding()).containsExactly(0.9f, 0.1f, 0f);
    assertThat(chunks.get(1).content()).isEqualTo("The cafeteria opens at nine.");
  }

  @Test
  @DisplayName("Should read a document together with its chunks")
  void shouldReadDocumentWithChunks() {
    UUID first = save(retryGuide());
    UUID second =
        save(
            document(
                "docs/retries.md",
                List.of("Retries were rewritten."),
                List.of(List.of(0f, 0f, 1f))));

    assertThat(documentStore.getWithChunks(first)).isEmpty();
    assertThat(documentStore.getWithChunks(second))
        .hasValueSatisfying(
            detail -> {
              assertThat(detail.document().id()).isEqualTo(second);
              assertThat(detail.chunks())
                  .extracting(DocumentChunk::content)
                  .containsExactly("Retries were rewritten.");
            });
  }

  @Test
  @DisplayName("Should leave nothing behind when one chunk is rejected")
  void shouldRollBackWhenOneChunkIsRejected() {
    SourceDocumentWithChunks broken =
        document(
            "docs/broken.md",
            List.of("First chunk text.", "Second chunk text.", "Third chunk text."),
            List.of(List.of(1f, 0f, 0f), List.of(0f, 1f, 0f), List.of(1f, 0f)));

    assertThatThrownBy(() -> save(broken))
        .isInstanceOfSatisfying(
            StorageException.class,
            e -> {
              assertThat(e.getDocumentId()).isNotNull();
              assertThat(documentStore.get(e.getDocumentId())).isEmpty();
            });
    assertThat(documentStore.countDocuments()).isZero();
    assertThat(documentStore.countChunks()).isZero();
  }

  @Test
  @DisplayName("Should replace a document stored under the same source")
  void shouldReplaceDocumentWithSameSource() {
    UUID first = save(retryGuide());
    UUID second =
        save(
            document(
                "docs/retries.md",
                List.of("Retries were rewritten."),
                List.of(List.of(0f, 0f, 1f))));

    assertThat(documentStore.get(first)).isEmpty();
    assertThat(documentStore.getChunks(second)).hasSize(1);
    assertThat(documentStore.countDocuments()).isEqualTo(1);
    assertThat(documentStore.countChunks()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should list documents with chunk counts")
  void shouldListDocumentsWithChunkCounts() {
    save(retryGuide());
    save(document("docs/other.md", List.of("Only chunk."), List.of(List.of(0f, 1f, 0f))));

    List<DocumentSummary> summaries = documentStore.list(10, 0);

    assertThat(summaries)
        .extracting(DocumentSummary::source, DocumentSummary::chunkCount)
        .containsExactlyInAnyOrder(
            tuple("docs/retries.md", 3L),
            tuple("docs/other.md", 1L));
    assertThat(documentStore.list(1, 1)).hasSize(1);
    assertThat(documentStore.list(10, 2)).isEmpty();
  }

  @Test
  @DisplayName("Should delete every document and chunk")
  void shouldDeleteEverything() {
    save(retryGuide());

    documentStore.deleteAll();

    assertThat(documentStore.countDocuments()).isZero();
    assertThat(documentStore.countChunks()).isZero();
  }

  @Test
  @DisplayName("Should rank chunks by cosine similarity")
  void shouldRankByCosineSimilarity() {
    save(retryGuide());

    List<SearchResult> results = retrievalEngine.vectorSearch(List.of(1f, 0f, 0f), 2);

    assertThat(results)
        .extracting(SearchResult::content)
        .containsExactly(
            "Payment retries use exponential backoff.", "Retries stop after five attempts.");
    assertThat(results.get(0).score()).isCloseTo(1.0, within(1e-6));
    assertThat(results.get(0).documentSource()).isEqualTo("docs/retries.md");
    assertThat(results.get(0).metadata()).containsEntry("chunk_index", 0);
  }

  @Test
  @DisplayName("Should match stemmed keywords")
  void shouldMatchStemmedKeywords() {
    save(retryGuide());

    List<SearchResult> results = retrievalEngine.lexicalSearch("retry", 10);

    assertThat(results)
        .extracting(SearchResult::content)
        .containsExactlyInAnyOrder(
            "Payment retries use exponential backoff.", "Retries stop after five attempts.");
    assertThat(results).allSatisfy(r -> assertThat(r.score()).isBetween(0.0, 1.0));
  }

  @Test
  @DisplayName("Should rank hybrid results like vector search at text weight 0")
  void shouldRankHybridLikeVectorAtWeightZero() {
    save(retryGuide());
    List<Float> query = List.of(0f, 1f, 0f);

    List<SearchResult> vector = retrievalEngine.vectorSearch(query, 3);
    List<SearchResult> hybrid = retrievalEngine.hybridSearch(query, "retry", 3, 0.0);

    assertThat(hybrid)
        .extracting(SearchResult::chunkId)
        .containsExactlyElementsOf(vector.stream().map(SearchResult::chunkId).toList());
  }

  @Test
  @DisplayName("Should only return keyword matches at text weight 1")
  void shouldReturnOnlyKeywordMatchesAtWeightOne() {
    save(retryGuide());

    List<SearchResult> hybrid =
        retrievalEngine.hybridSearch(List.of(0f, 1f, 0f), "retry", 3, 1.0);

    assertThat(hybrid)
        .extracting(SearchResult::content)
        .doesNotContain("The cafeteria opens at nine.")
        .hasSize(2);
  }

  private record SourceDocumentWithChunks(SourceDocument document, List<DocumentChunk> chunks) {}
}
