package com.flamingo.ai.agenticrag.service.ingestion;

import com.flamingo.ai.agenticrag.exception.ExtractionException;
import com.flamingo.ai.agenticrag.service.rag.model.SourceDocument;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.PagedText;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

/**
 * {@link DocumentTextExtractor} backed by Apache Tika.
 *
 * <p>Markdown and plain-text files are read as UTF-8 so their structure survives unchanged. Other
 * formats (PDF, DOCX, HTML) go through Tika's {@link AutoDetectParser}.
 */
@Service
@Slf4j
public class TikaDocumentTextExtractor implements DocumentTextExtractor {

  public static final String TITLE_KEY = "title";
  public static final String SOURCE_KEY = "source";
  public static final String CONTENT_TYPE_KEY = "content_type";
  public static final String PAGES_KEY = "pages";

  private static final Set<String> TEXT_EXTENSIONS = Set.of("md", "markdown", "txt");

  private final Tika tika = new Tika();

  @Override
  public SourceDocument extract(Path path) {
    if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
      throw new ExtractionException(path, "File does not exist or is not readable: " + path);
    }

    try {
      Map<String, Object> metadata = new LinkedHashMap<>();
      String content;
      String title = null;

      if (TEXT_EXTENSIONS.contains(extension(path))) {
        content = Files.readString(path, StandardCharsets.UTF_8);
        metadata.put(CONTENT_TYPE_KEY, tika.detect(path));
      } else {
        Metadata tikaMetadata = new Metadata();
        BodyContentHandler handler = new BodyContentHandler(-1);
        try (InputStream in = Files.newInputStream(path)) {
          new AutoDetectParser().parse(in, handler, tikaMetadata, new ParseContext());
        }
        content = handler.toString();
        title = tikaMetadata.get(TikaCoreProperties.TITLE);
        metadata.put(CONTENT_TYPE_KEY, tikaMetadata.get(Metadata.CONTENT_TYPE));
        Integer pages = tikaMetadata.getInt(PagedText.N_PAGES);
        if (pages != null) {
          metadata.put(PAGES_KEY, pages);
        }
      }

      if (title == null || title.isBlank()) {
        title = baseName(path);
      }
      metadata.put(TITLE_KEY, title);
      metadata.put(SOURCE_KEY, path.toString());

      log.debug("Extracted {} chars from {}", content.length(), path);
      return new SourceDocument(title, path.toString(), content, metadata);
    } catch (IOException | TikaException | SAXException e) {
      log.error("Text extraction failed for {}: {}", path, e.getMessage());
      throw new ExtractionException(path, "Failed to extract text: " + e.getMessage(), e);
    }
  }

  static String extension(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  private static String baseName(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot <= 0 ? name : name.substring(0, dot);
  }
}
