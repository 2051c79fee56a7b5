package com.flamingo.ai.agenticrag.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.agenticrag.exception.ExtractionException;
import com.flamingo.ai.agenticrag.service.rag.model.SourceDocument;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("TikaDocumentTextExtractor Tests")
class TikaDocumentTextExtractorTest {

  @TempDir Path folder;

  private final TikaDocumentTextExtractor extractor = new TikaDocumentTextExtractor();

  @Test
  @DisplayName("Should read Markdown verbatim and title it after the file")
  void shouldReadMarkdownVerbatim() throws IOException {
    String markdown = "# Setup\n\n- install\n- configure\n\n```\nrun --fast\n```\n";
    Path file = Files.writeString(folder.resolve("setup-guide.md"), markdown);

    SourceDocument document = extractor.extract(file);

    assertThat(document.content()).isEqualTo(markdown);
    assertThat(document.title()).isEqualTo("setup-guide");
    assertThat(document.source()).isEqualTo(file.toString());
    assertThat(document.metadata())
        .containsEntry(TikaDocumentTextExtractor.TITLE_KEY, "setup-guide")
        .containsKey(TikaDocumentTextExtractor.CONTENT_TYPE_KEY);
  }

  @Test
  @DisplayName("Should extract HTML text and title")
  void shouldExtractHtmlTextAndTitle() throws IOException {
    Path file =
        Files.writeString(
            folder.resolve("page.html"),
            "<html><head><title>Guide</title></head>"
                + "<body><p>Hybrid search blends signals.</p></body></html>");

    SourceDocument document = extractor.extract(file);

    assertThat(document.title()).isEqualTo("Guide");
    assertThat(document.content()).contains("Hybrid search blends signals.");
    assertThat((String) document.metadata().get(TikaDocumentTextExtractor.CONTENT_TYPE_KEY))
        .startsWith("text/html");
  }

  @Test
  @DisplayName("Should fail for a missing file")
  void shouldFailForMissingFile() {
    Path missing = folder.resolve("missing.pdf");

    assertThatThrownBy(() -> extractor.extract(missing))
        .isInstanceOf(ExtractionException.class)
        .hasMessageContaining("missing.pdf");
  }

  @Test
  @DisplayName("Should lower-case extensions")
  void shouldLowerCaseExtensions() {
    assertThat(TikaDocumentTextExtractor.extension(Path.of("README.MD"))).isEqualTo("md");
    assertThat(TikaDocumentTextExtractor.extension(Path.of("Makefile"))).isEmpty();
  }
}
