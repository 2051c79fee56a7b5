package com.flamingo.ai.agenticrag.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.agenticrag.service.store.DocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("HealthController Tests")
class HealthControllerTest {

  @Mock private DocumentStore documentStore;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc = MockMvcBuilders.standaloneSetup(new HealthController(documentStore)).build();
  }

  @Test
  @DisplayName("Should report the service as up")
  void shouldReportServiceUp() throws Exception {
    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(jsonPath("$.service").value("agentic-rag"));
  }

  @Test
  @DisplayName("Should report document and chunk counts")
  void shouldReportCounts() throws Exception {
    when(documentStore.countDocuments()).thenReturn(3L);
    when(documentStore.countChunks()).thenReturn(42L);

    mockMvc
        .perform(get("/api/health/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalDocuments").value(3))
        .andExpect(jsonPath("$.totalChunks").value(42));
  }
}
