package com.flamingo.ai.summarizer.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.summarizer.api.rest.HealthController;
import com.flamingo.ai.summarizer.api.rest.SummaryController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests to verify API endpoints stay where clients expect them.
 *
 * <ul>
 *   <li>POST /api/summaries - Summarize a document
 *   <li>GET /health - Health check with backend mode
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("SummaryController API contract")
  class SummaryControllerContract {

    @Test
    @DisplayName("should be mapped to /api/summaries")
    void shouldBeMappedToApiSummaries() {
      RequestMapping mapping = SummaryController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/summaries");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /health")
    void shouldBeMappedToHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/health");
    }
  }
}
