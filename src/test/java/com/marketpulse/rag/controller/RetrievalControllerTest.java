package com.marketpulse.rag.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpulse.rag.config.RetrievalProperties;
import com.marketpulse.rag.exception.EmbeddingException;
import com.marketpulse.rag.exception.ServiceNotReadyException;
import com.marketpulse.rag.exception.ValidationException;
import com.marketpulse.rag.model.AddDocumentsResult;
import com.marketpulse.rag.model.HealthStatus;
import com.marketpulse.rag.model.IndexStats;
import com.marketpulse.rag.model.RetrievalResult;
import com.marketpulse.rag.service.RetrievalService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RetrievalController.class)
@Import(RetrievalControllerTest.PropertiesConfig.class)
class RetrievalControllerTest {

    @TestConfiguration
    @EnableConfigurationProperties(RetrievalProperties.class)
    static class PropertiesConfig {
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private RetrievalService retrievalService;

    private static RetrievalResult cameraResult() {
        return new RetrievalResult(0, 0.82, 1, "Camera crashes on zoom", "Camera", "Zoom", "Bug", "Crash", "Play Store");
    }

    @Test
    @DisplayName("POST /retrieve should return ranked results in snake_case")
    void retrieve_ShouldReturnResults() throws Exception {
        when(retrievalService.retrieve("camera crash", 1, null)).thenReturn(List.of(cameraResult()));

        mockMvc.perform(post("/retrieve")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RetrieveRequest("camera crash", 1, null))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.query").value("camera crash"))
            .andExpect(jsonPath("$.results[0].id").value(0))
            .andExpect(jsonPath("$.results[0].rank").value(1))
            .andExpect(jsonPath("$.results[0].score").value(0.82))
            .andExpect(jsonPath("$.results[0].module").value("Camera"))
            .andExpect(jsonPath("$.results[0].sub_module").value("Zoom"))
            .andExpect(jsonPath("$.results[0].issue_type").value("Bug"))
            .andExpect(jsonPath("$.results[0].sub_issue_type").value("Crash"))
            .andExpect(jsonPath("$.results[0].source").value("Play Store"));
    }

    @Test
    @DisplayName("POST /retrieve without k should use the configured default")
    void retrieve_ShouldApplyDefaultK() throws Exception {
        when(retrievalService.retrieve(anyString(), anyInt(), any())).thenReturn(List.of());

        mockMvc.perform(post("/retrieve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"battery\",\"filter\":{\"module\":\"Battery\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.results").isEmpty());

        verify(retrievalService).retrieve(eq("battery"), eq(3), eq(Map.of("module", "Battery")));
    }

    @Test
    @DisplayName("POST /retrieve should return 400 for a blank query")
    void retrieve_ShouldRejectBlankQuery() throws Exception {
        mockMvc.perform(post("/retrieve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value(400))
            .andExpect(jsonPath("$.message").exists());

        verifyNoInteractions(retrievalService);
    }

    @Test
    @DisplayName("POST /retrieve should return 400 for k out of range")
    void retrieve_ShouldRejectInvalidK() throws Exception {
        mockMvc.perform(post("/retrieve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"camera\",\"k\":0}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(retrievalService);
    }

    @Test
    @DisplayName("POST /retrieve should return 400 for malformed JSON")
    void retrieve_ShouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/retrieve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Malformed JSON request body"));
    }

    @Test
    @DisplayName("POST /retrieve should return 503 when embeddings are unavailable")
    void retrieve_ShouldReturn503OnEmbeddingFailure() throws Exception {
        when(retrievalService.retrieve(anyString(), anyInt(), any()))
            .thenThrow(new EmbeddingException("Embedding provider unavailable"));

        mockMvc.perform(post("/retrieve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"camera\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.message").value("Embedding provider unavailable"));
    }

    @Test
    @DisplayName("POST /retrieve should return 503 before the index is loaded")
    void retrieve_ShouldReturn503WhenNotReady() throws Exception {
        when(retrievalService.retrieve(anyString(), anyInt(), any())).thenThrow(new ServiceNotReadyException());

        mockMvc.perform(post("/retrieve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"camera\"}"))
            .andExpect(status().isServiceUnavailable());
    }

    @Test
    @DisplayName("POST /add_documents should map snake_case fields and report counts")
    void addDocuments_ShouldReturnCounts() throws Exception {
        when(retrievalService.addDocuments(any(), eq("Play Store")))
            .thenReturn(new AddDocumentsResult(1, 1, 0, "Play Store", 10));

        mockMvc.perform(post("/add_documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {
                      "source": "Play Store",
                      "documents": [
                        {"content": "Camera crashes on zoom", "module": "Camera", "sub_module": "Zoom",
                         "issue_type": "Bug", "sub_issue_type": "Crash"},
                        {"content": "", "module": "Camera"}
                      ]
                    }
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.added_count").value(1))
            .andExpect(jsonPath("$.skipped_count").value(1))
            .andExpect(jsonPath("$.failed_count").value(0))
            .andExpect(jsonPath("$.source").value("Play Store"))
            .andExpect(jsonPath("$.total_documents").value(10));

        verify(retrievalService).addDocuments(argThat(docs ->
            docs.size() == 2
                && "Zoom".equals(docs.get(0).subModule())
                && "Crash".equals(docs.get(0).subIssueType())), eq("Play Store"));
    }

    @Test
    @DisplayName("POST /add_documents should return 400 for an empty list")
    void addDocuments_ShouldRejectEmptyList() throws Exception {
        mockMvc.perform(post("/add_documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documents\":[]}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(retrievalService);
    }

    @Test
    @DisplayName("POST /add_documents should surface service validation errors as 400")
    void addDocuments_ShouldMapValidationException() throws Exception {
        when(retrievalService.addDocuments(any(), isNull()))
            .thenThrow(new ValidationException("No documents provided"));

        mockMvc.perform(post("/add_documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documents\":[{\"content\":\"Camera\"}]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("No documents provided"));
    }

    @Test
    @DisplayName("GET /health should return 200 when healthy")
    void health_ShouldReturn200() throws Exception {
        when(retrievalService.healthCheck())
            .thenReturn(new HealthStatus(HealthStatus.HEALTHY, 2, 2, true, 384, true, null));

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.documents_count").value(2))
            .andExpect(jsonPath("$.index_size").value(2))
            .andExpect(jsonPath("$.embedding_model_ready").value(true));
    }

    @Test
    @DisplayName("GET /health should return 503 when inconsistent")
    void health_ShouldReturn503WhenUnhealthy() throws Exception {
        when(retrievalService.healthCheck())
            .thenReturn(new HealthStatus(HealthStatus.UNHEALTHY, 3, 2, true, 384, false, null));

        mockMvc.perform(get("/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.consistent").value(false));
    }

    @Test
    void documentCount_ShouldReturnCount() throws Exception {
        when(retrievalService.documentCount()).thenReturn(5);

        mockMvc.perform(get("/documents/count"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(5));
    }

    @Test
    void stats_ShouldReturnIndexStats() throws Exception {
        when(retrievalService.stats())
            .thenReturn(new IndexStats(5, 5, "all-minilm-l6-v2", 384, 7, 3, 7, OffsetDateTime.now()));

        mockMvc.perform(get("/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.embedding_model").value("all-minilm-l6-v2"))
            .andExpect(jsonPath("$.index_dimension").value(384))
            .andExpect(jsonPath("$.cache_hits").value(3));
    }

    @Test
    @DisplayName("Unexpected errors should return a generic 500")
    void unexpectedError_ShouldReturn500() throws Exception {
        when(retrievalService.documentCount()).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/documents/count"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }
}
