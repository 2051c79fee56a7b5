package com.flamingo.ai.agenticrag.api.rest;

import com.flamingo.ai.agenticrag.api.dto.response.SystemStats;
import com.flamingo.ai.agenticrag.service.store.DocumentStore;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and knowledge base statistics. */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

  private final DocumentStore documentStore;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "agentic-rag");
    return ResponseEntity.ok(health);
  }

  /** Returns document and chunk counts. */
  @GetMapping("/stats")
  public ResponseEntity<SystemStats> stats() {
    return ResponseEntity.ok(
        SystemStats.builder()
            .totalDocuments(documentStore.countDocuments())
            .totalChunks(documentStore.countChunks())
            .timestamp(LocalDateTime.now())
            .build());
  }
}
