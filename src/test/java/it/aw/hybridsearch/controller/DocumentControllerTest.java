package it.aw.hybridsearch.controller;

import it.aw.hybridsearch.exception.IndexingFailedException;
import it.aw.hybridsearch.model.ChunkingConfig;
import it.aw.hybridsearch.model.DocumentEmbeddingSet;
import it.aw.hybridsearch.model.DocumentSource;
import it.aw.hybridsearch.model.EmbeddingRecord;
import it.aw.hybridsearch.model.IndexOutcome;
import it.aw.hybridsearch.model.IndexedDocument;
import it.aw.hybridsearch.model.StoreStats;
import it.aw.hybridsearch.service.IndexingService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DocumentController.class)
class DocumentControllerTest {

    @TestConfiguration
    static class Defaults {
        @Bean
        ChunkingConfig defaultChunkingConfig() {
            return ChunkingConfig.defaults();
        }
    }

    @Autowired
    private MockMvc mvc;

    @MockBean
    private IndexingService indexingService;

    private static DocumentEmbeddingSet set(String documentId) {
        return DocumentEmbeddingSet.of(documentId, "acme", "test-model", 2,
                List.of(new EmbeddingRecord(documentId + "_chunk_0", 0, new float[]{1f, 0f}, documentId, "acme")),
                Set.of(documentId + "_chunk_1"));
    }

    @Test
    void indexesADocument() throws Exception {
        when(indexingService.indexDocument(any(), any(), anyBoolean())).thenReturn(set("rfp"));

        mvc.perform(post("/api/documents/rfp/index")
                        .header("X-Tenant-Id", "acme")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text": "Cloud security requirements.", "tags": ["rfp"],
                                 "documentDate": "2024-03-01", "forceReprocess": true, "targetTokens": 800}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentId").value("rfp"))
                .andExpect(jsonPath("$.totalChunks").value(2))
                .andExpect(jsonPath("$.partialFailure").value(true))
                .andExpect(jsonPath("$.failedChunkIds[0]").value("rfp_chunk_1"));

        ArgumentCaptor<DocumentSource> source = ArgumentCaptor.forClass(DocumentSource.class);
        ArgumentCaptor<ChunkingConfig> config = ArgumentCaptor.forClass(ChunkingConfig.class);
        verify(indexingService).indexDocument(source.capture(), config.capture(), eq(true));
        assertThat(source.getValue().tenantId()).isEqualTo("acme");
        assertThat(source.getValue().metadata().documentDate()).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(config.getValue().targetChunkTokens()).isEqualTo(800);
        assertThat(config.getValue().overlapTokens()).isEqualTo(200);
    }

    @Test
    void conflictingTenantsAreRejected() throws Exception {
        mvc.perform(post("/api/documents/rfp/index")
                        .header("X-Tenant-Id", "acme")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tenantId\": \"globex\", \"text\": \"text\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        verify(indexingService, never()).indexDocument(any(), any(), anyBoolean());
    }

    @Test
    void missingTenantIsRejected() throws Exception {
        mvc.perform(get("/api/documents"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void invalidChunkingParametersAreRejected() throws Exception {
        mvc.perform(post("/api/documents/rfp/index")
                        .header("X-Tenant-Id", "acme")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"text\", \"targetTokens\": 100, \"overlapTokens\": 150}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void majorityFailureIsReportedAsBadGateway() throws Exception {
        when(indexingService.indexDocument(any(), any(), anyBoolean()))
                .thenThrow(new IndexingFailedException("rfp", "acme", 2, 3, Set.of("rfp_chunk_0")));

        mvc.perform(post("/api/documents/rfp/index")
                        .header("X-Tenant-Id", "acme")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"text\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error.code").value("INDEXING_FAILED"))
                .andExpect(jsonPath("$.error.details.totalBatches").value(3));
    }

    @Test
    void batchIndexingReturnsOneSummaryPerDocument() throws Exception {
        when(indexingService.indexAll(anyList(), any(), anyBoolean())).thenReturn(List.of(
                IndexOutcome.success(set("a")),
                IndexOutcome.failure("b", "acme", "VALIDATION_ERROR", "Il documento b non contiene testo")));

        mvc.perform(post("/api/documents/index")
                        .header("X-Tenant-Id", "acme")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"documents": [{"documentId": "a", "text": "first"}, {"documentId": "b", "text": ""}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].documentId").value("a"))
                .andExpect(jsonPath("$[1].errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    void ingestsAnUploadedFile() throws Exception {
        when(indexingService.ingest(any(), eq("acme"), isNull(), any(), any(), any(), eq(false)))
                .thenReturn(set("notes.txt"));
        MockMultipartFile file = new MockMultipartFile("file", "notes.txt", "text/plain",
                "Cloud security requirements.".getBytes(StandardCharsets.UTF_8));

        mvc.perform(multipart("/api/documents/ingest").file(file).header("X-Tenant-Id", "acme"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentId").value("notes.txt"));
    }

    @Test
    void emptyUploadIsRejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "empty.txt", "text/plain", new byte[0]);

        mvc.perform(multipart("/api/documents/ingest").file(file).header("X-Tenant-Id", "acme"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void documentLookupReturns404WhenAbsent() throws Exception {
        when(indexingService.find("acme", "missing")).thenReturn(Optional.empty());
        when(indexingService.find("acme", "rfp")).thenReturn(Optional.of(new IndexedDocument("acme", "rfp",
                "test-model", 2, 3, 3, false, List.of(), 1500, 200, LocalDateTime.of(2024, 5, 2, 10, 0))));

        mvc.perform(get("/api/documents/missing").header("X-Tenant-Id", "acme"))
                .andExpect(status().isNotFound());
        mvc.perform(get("/api/documents/rfp").header("X-Tenant-Id", "acme"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalChunks").value(3));
    }

    @Test
    void deleteReturns204ThenNotFound() throws Exception {
        when(indexingService.deleteDocument("acme", "rfp")).thenReturn(true, false);

        mvc.perform(delete("/api/documents/rfp").header("X-Tenant-Id", "acme"))
                .andExpect(status().isNoContent());
        mvc.perform(delete("/api/documents/rfp").header("X-Tenant-Id", "acme"))
                .andExpect(status().isNotFound());
    }

    @Test
    void exposesStatsAndCleanup() throws Exception {
        when(indexingService.stats()).thenReturn(new StoreStats(2, 10, 1, "test-model", 2, 4, 7, 3));
        when(indexingService.cleanupOrphans()).thenReturn(1);

        mvc.perform(get("/api/documents/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalChunks").value(10))
                .andExpect(jsonPath("$.cacheHits").value(7));
        mvc.perform(post("/api/documents/maintenance/cleanup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orphanDocumentsRemoved").value(1));
    }
}
