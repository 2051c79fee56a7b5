package com.flamingo.ai.agenticrag.domain.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.agenticrag.config.RagConfig;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
@DisplayName("VectorSchemaInitializer Tests")
class VectorSchemaInitializerTest {

  @Mock private JdbcTemplate jdbcTemplate;

  private RagConfig ragConfig;
  private VectorSchemaInitializer initializer;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    ragConfig.getEmbedding().setDimensions(3);
    initializer = new VectorSchemaInitializer(jdbcTemplate, ragConfig);
  }

  @Test
  @DisplayName("Should size the embedding column from configuration")
  void shouldSizeEmbeddingColumn() throws IOException {
    List<String> statements = VectorSchemaInitializer.statements(3);

    assertThat(statements.get(0)).isEqualTo("CREATE EXTENSION IF NOT EXISTS vector");
    assertThat(String.join("\n", statements))
        .contains("vector(3)")
        .contains("hnsw (embedding vector_cosine_ops)")
        .doesNotContain(VectorSchemaInitializer.DIMENSIONS_TOKEN);
  }

  @Test
  @DisplayName("Should execute every statement and accept a matching column")
  void shouldExecuteStatements() throws IOException {
    when(jdbcTemplate.queryForList(anyString(), eq(Integer.class))).thenReturn(List.of(3));

    initializer.initSchema();

    for (String statement : VectorSchemaInitializer.statements(3)) {
      verify(jdbcTemplate).execute(statement);
    }
  }

  @Test
  @DisplayName("Should fail startup when the stored dimension differs")
  void shouldFailOnDimensionMismatch() {
    when(jdbcTemplate.queryForList(anyString(), eq(Integer.class))).thenReturn(List.of(1536));

    assertThatThrownBy(() -> initializer.initSchema())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("1536");
  }

  @Test
  @DisplayName("Should reject a non-positive dimension before touching the database")
  void shouldRejectNonPositiveDimension() {
    ragConfig.getEmbedding().setDimensions(0);

    assertThatThrownBy(() -> initializer.initSchema()).isInstanceOf(IllegalStateException.class);
    verify(jdbcTemplate, never()).execute(anyString());
  }
}
