package com.flamingo.ai.agenticrag.domain.schema;

import com.flamingo.ai.agenticrag.config.RagConfig;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the pgvector extension, tables and indexes at startup.
 *
 * <p>The embedding column is sized from {@code rag.embedding.dimensions}. Startup fails when an
 * existing column was created with a different dimension, since every insert would be rejected.
 */
@Component
@ConditionalOnProperty(
    prefix = "rag.schema",
    name = "initialize",
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class VectorSchemaInitializer {

  static final String SCHEMA_LOCATION = "db/schema.sql";
  static final String DIMENSIONS_TOKEN = "{{EMBEDDING_DIMENSIONS}}";

  private static final String COLUMN_DIMENSIONS_SQL =
      "SELECT a.atttypmod FROM pg_attribute a "
          + "WHERE a.attrelid = 'chunks'::regclass AND a.attname = 'embedding' "
          + "AND NOT a.attisdropped";

  private final JdbcTemplate jdbcTemplate;
  private final RagConfig ragConfig;

  @PostConstruct
  public void initSchema() {
    int dimensions = ragConfig.getEmbedding().getDimensions();
    if (dimensions <= 0) {
      throw new IllegalStateException("rag.embedding.dimensions must be positive: " + dimensions);
    }
    try {
      for (String statement : statements(dimensions)) {
        jdbcTemplate.execute(statement);
      }
      validateDimensions(dimensions);
      log.info("Vector schema ready with {} embedding dimensions", dimensions);
    } catch (DataAccessException | IOException e) {
      log.error("Failed to initialize vector schema: {}", e.getMessage(), e);
      throw new IllegalStateException("Failed to initialize vector schema", e);
    }
  }

  /** Schema statements with the embedding dimension substituted. */
  static List<String> statements(int dimensions) throws IOException {
    String template;
    try (InputStream in = new ClassPathResource(SCHEMA_LOCATION).getInputStream()) {
      template = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
    String sql = template.replace(DIMENSIONS_TOKEN, Integer.toString(dimensions));
    return Arrays.stream(sql.split(";"))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }

  private void validateDimensions(int expected) {
    List<Integer> actual = jdbcTemplate.queryForList(COLUMN_DIMENSIONS_SQL, Integer.class);
    if (actual.isEmpty()) {
      throw new IllegalStateException("Column chunks.embedding is missing");
    }
    if (actual.get(0) != expected) {
      throw new IllegalStateException(
          "Column chunks.embedding has "
              + actual.get(0)
              + " dimensions but rag.embedding.dimensions is "
              + expected
              + "; drop the table or change the configuration");
    }
  }
}
