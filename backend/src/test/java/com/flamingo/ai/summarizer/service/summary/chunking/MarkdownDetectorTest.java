package com.flamingo.ai.summarizer.service.summary.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MarkdownDetector Tests")
class MarkdownDetectorTest {

  private final MarkdownDetector detector = new MarkdownDetector();

  @Test
  @DisplayName("should detect a heading on the first line")
  void shouldDetectLeadingHeading() {
    assertThat(detector.looksLikeMarkdown("# Title\nSome text.")).isTrue();
  }

  @Test
  @DisplayName("should detect lists, links, emphasis and tables")
  void shouldDetectCommonMarkup() {
    assertThat(detector.looksLikeMarkdown("Intro\n- first\n- second")).isTrue();
    assertThat(detector.looksLikeMarkdown("See [the docs](https://example.com).")).isTrue();
    assertThat(detector.looksLikeMarkdown("This is **important**.")).isTrue();
    assertThat(detector.looksLikeMarkdown("Table\n| a | b |\n|---|---|")).isTrue();
    assertThat(detector.looksLikeMarkdown("Run `mvn test` first.")).isTrue();
  }

  @Test
  @DisplayName("should not flag plain prose")
  void shouldIgnorePlainProse() {
    assertThat(detector.looksLikeMarkdown("Plain prose. Two sentences, one comma.")).isFalse();
    assertThat(detector.looksLikeMarkdown(null)).isFalse();
    assertThat(detector.looksLikeMarkdown("")).isFalse();
  }

  @Test
  @DisplayName("should only sample the beginning of long text")
  void shouldOnlySampleBeginning() {
    String text = "plain words ".repeat(1000) + "\n# Late heading";

    assertThat(text.length()).isGreaterThan(MarkdownDetector.SAMPLE_CHARS);
    assertThat(detector.looksLikeMarkdown(text)).isFalse();
  }
}
