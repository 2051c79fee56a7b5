package com.flamingo.ai.agenticrag.domain.enums;

/** Retrieval method requested by a search. */
public enum SearchType {
  VECTOR,
  LEXICAL,
  HYBRID
}
