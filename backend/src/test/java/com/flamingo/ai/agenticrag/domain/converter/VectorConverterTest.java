package com.flamingo.ai.agenticrag.domain.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VectorConverter Tests")
class VectorConverterTest {

  private final VectorConverter converter = new VectorConverter();

  @Test
  @DisplayName("Should format vectors in pgvector text form")
  void shouldFormatVectors() {
    assertThat(converter.convertToDatabaseColumn(new float[] {0.5f, -1.0f, 2.25f}))
        .isEqualTo("[0.5,-1.0,2.25]");
    assertThat(VectorConverter.toLiteral(List.of(0.1f, 0.2f))).isEqualTo("[0.1,0.2]");
    assertThat(converter.convertToDatabaseColumn(null)).isNull();
  }

  @Test
  @DisplayName("Should parse pgvector output")
  void shouldParsePgvectorOutput() {
    assertThat(converter.convertToEntityAttribute("[0.5,-1,2.25]"))
        .containsExactly(0.5f, -1.0f, 2.25f);
    assertThat(converter.convertToEntityAttribute(" [ 1 , 2 ] ")).containsExactly(1f, 2f);
    assertThat(converter.convertToEntityAttribute(null)).isNull();
  }

  @Test
  @DisplayName("Should reject malformed values")
  void shouldRejectMalformedValues() {
    assertThatThrownBy(() -> converter.convertToEntityAttribute("0.5,1"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> converter.convertToEntityAttribute("[0.5,abc]"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasCauseInstanceOf(NumberFormatException.class);
  }
}
