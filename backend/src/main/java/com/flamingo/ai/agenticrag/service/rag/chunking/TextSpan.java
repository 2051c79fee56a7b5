package com.flamingo.ai.agenticrag.service.rag.chunking;

/**
 * Half-open character range {@code [start, end)} of a source text.
 *
 * @param start inclusive start offset
 * @param end exclusive end offset
 */
public record TextSpan(int start, int end) {

  public TextSpan {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
    }
  }

  public int length() {
    return end - start;
  }

  public String of(String text) {
    return text.substring(start, end);
  }

  /**
   * Narrows the span so it neither starts nor ends with whitespace.
   *
   * @return the trimmed span, or {@code null} when the span holds only whitespace
   */
  public TextSpan trim(String text) {
    int s = start;
    int e = end;
    while (s < e && Character.isWhitespace(text.charAt(s))) {
      s++;
    }
    while (e > s && Character.isWhitespace(text.charAt(e - 1))) {
      e--;
    }
    return s == e ? null : new TextSpan(s, e);
  }
}
