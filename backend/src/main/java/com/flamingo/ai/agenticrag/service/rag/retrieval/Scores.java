package com.flamingo.ai.agenticrag.service.rag.retrieval;

/** Score helpers for retrieval results. */
final class Scores {

  private Scores() {}

  /** Clamps a raw score into {@code [0.0, 1.0]}; null and NaN become 0. */
  static double clamp(Double raw) {
    if (raw == null || raw.isNaN()) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, raw));
  }

  static double orZero(Double raw) {
    return raw == null || raw.isNaN() ? 0.0 : raw;
  }
}
