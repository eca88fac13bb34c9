package com.flamingo.ai.summarizer.api.rest;

import com.flamingo.ai.summarizer.service.summary.backend.GenerationBackend;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final GenerationBackend generationBackend;

  /** Returns a simple health check response, including which backend is in use. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "doc-summarizer");
    health.put("backend", generationBackend.description());
    health.put("mode", generationBackend.isSimulated() ? "simulated" : "live");
    return ResponseEntity.ok(health);
  }
}
