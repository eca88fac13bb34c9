package com.flamingo.ai.summarizer.service.prompt;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PromptTemplates Tests")
class PromptTemplatesTest {

  @Test
  @DisplayName("should replace placeholders with trimmed keys")
  void shouldSubstituteTrimmedKeys() {
    String result =
        PromptTemplates.substitute(
            "Title: {{ title }}\n{{content}}", Map.of("title", "Report", "content", "Body"));

    assertThat(result).isEqualTo("Title: Report\nBody");
  }

  @Test
  @DisplayName("should leave unresolved placeholders verbatim")
  void shouldLeaveUnresolvedPlaceholders() {
    String result =
        PromptTemplates.substitute("{{known}} and {{unknown}}", Map.of("known", "value"));

    assertThat(result).isEqualTo("value and {{unknown}}");
  }

  @Test
  @DisplayName("should insert values containing regex replacement characters literally")
  void shouldQuoteReplacementValues() {
    String result = PromptTemplates.substitute("Cost: {{price}}", Map.of("price", "$5 \\ unit"));

    assertThat(result).isEqualTo("Cost: $5 \\ unit");
  }

  @Test
  @DisplayName("should return the template unchanged without variables")
  void shouldReturnTemplate_whenNoVariables() {
    assertThat(PromptTemplates.substitute("Hi {{name}}", Map.of())).isEqualTo("Hi {{name}}");
    assertThat(PromptTemplates.substitute(null, Map.of("a", "b"))).isEmpty();
  }

  @Test
  @DisplayName("should detect a placeholder by key")
  void shouldDetectPlaceholder() {
    assertThat(PromptTemplates.hasPlaceholder("Text: {{ content }}", "content")).isTrue();
    assertThat(PromptTemplates.hasPlaceholder("Text: {{title}}", "content")).isFalse();
    assertThat(PromptTemplates.hasPlaceholder(null, "content")).isFalse();
  }
}
