package com.flamingo.ai.agenticrag.domain.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.List;

/**
 * JPA converter between {@code float[]} and the pgvector text form {@code [x1,x2,...]}.
 *
 * <p>The column is written with a {@code ?::vector} cast and read back as text.
 */
@Converter
public class VectorConverter implements AttributeConverter<float[], String> {

  @Override
  public String convertToDatabaseColumn(float[] attribute) {
    if (attribute == null) {
      return null;
    }
    StringBuilder sb = new StringBuilder(attribute.length * 10).append('[');
    for (int i = 0; i < attribute.length; i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append(attribute[i]);
    }
    return sb.append(']').toString();
  }

  @Override
  public float[] convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return null;
    }
    String trimmed = dbData.trim();
    if (!trimmed.startsWith("[") || !trimmed.endsWith("]")) {
      throw new IllegalArgumentException("Not a vector literal: " + abbreviate(trimmed));
    }
    String body = trimmed.substring(1, trimmed.length() - 1).trim();
    if (body.isEmpty()) {
      return new float[0];
    }
    String[] parts = body.split(",");
    float[] vector = new float[parts.length];
    try {
      for (int i = 0; i < parts.length; i++) {
        vector[i] = Float.parseFloat(parts[i].trim());
      }
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a vector literal: " + abbreviate(trimmed), e);
    }
    return vector;
  }

  /** Formats a query embedding for a {@code CAST(:embedding AS vector)} parameter. */
  public static String toLiteral(List<Float> vector) {
    StringBuilder sb = new StringBuilder(vector.size() * 10).append('[');
    for (int i = 0; i < vector.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append(vector.get(i));
    }
    return sb.append(']').toString();
  }

  private static String abbreviate(String value) {
    return value.length() <= 40 ? value : value.substring(0, 40) + "...";
  }
}
