package com.flamingo.ai.agenticrag.service.ingestion;

import com.flamingo.ai.agenticrag.service.rag.model.SourceDocument;
import java.nio.file.Path;

/** Turns a file into text ready for chunking. */
public interface DocumentTextExtractor {

  /**
   * Extracts the text and metadata of a file.
   *
   * @param path file to read
   * @return the document, with {@code source} set to the path
   * @throws com.flamingo.ai.agenticrag.exception.ExtractionException if the file is missing or
   *     cannot be parsed
   */
  SourceDocument extract(Path path);
}
