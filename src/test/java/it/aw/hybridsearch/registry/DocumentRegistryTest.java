package it.aw.hybridsearch.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.hybridsearch.model.DocumentKey;
import it.aw.hybridsearch.model.IndexedDocument;
import org.duckdb.DuckDBConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.DriverManager;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentRegistryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 2, 10, 30, 0);

    private DuckDBConnection root;
    private DocumentRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        root = (DuckDBConnection) DriverManager.getConnection("jdbc:duckdb:");
        registry = new DocumentRegistry(root, new ObjectMapper());
        registry.init();
    }

    @AfterEach
    void tearDown() throws Exception {
        registry.close();
        root.close();
    }

    private static IndexedDocument document(String tenant, String id, int chunks, List<String> failed, LocalDateTime at) {
        return new IndexedDocument(tenant, id, "all-minilm-l6-v2-q", 384, chunks, chunks - failed.size(),
                !failed.isEmpty(), failed, 1500, 200, at);
    }

    @Test
    void registerAndFind() {
        registry.register(document("acme", "rfp", 4, List.of("rfp_chunk_3"), NOW));

        IndexedDocument found = registry.find("acme", "rfp").orElseThrow();

        assertThat(found.totalChunks()).isEqualTo(4);
        assertThat(found.embeddedChunks()).isEqualTo(3);
        assertThat(found.partialFailure()).isTrue();
        assertThat(found.failedChunkIds()).containsExactly("rfp_chunk_3");
        assertThat(found.indexedAt()).isEqualTo(NOW);
        assertThat(registry.find("globex", "rfp")).isEmpty();
    }

    @Test
    void registeringAgainReplacesTheEntry() {
        registry.register(document("acme", "rfp", 4, List.of(), NOW));
        registry.register(document("acme", "rfp", 6, List.of(), NOW.plusHours(1)));

        assertThat(registry.totalDocuments()).isEqualTo(1);
        assertThat(registry.find("acme", "rfp").orElseThrow().totalChunks()).isEqualTo(6);
    }

    @Test
    void listsByTenantNewestFirst() {
        registry.register(document("acme", "old", 1, List.of(), NOW));
        registry.register(document("acme", "new", 1, List.of(), NOW.plusDays(1)));
        registry.register(document("globex", "other", 1, List.of(), NOW));

        assertThat(registry.findByTenant("acme")).extracting(IndexedDocument::documentId)
                .containsExactly("new", "old");
        assertThat(registry.keys()).contains(new DocumentKey("globex", "other"));
    }

    @Test
    void removeReportsWhetherTheDocumentExisted() {
        registry.register(document("acme", "rfp", 1, List.of(), NOW));

        assertThat(registry.remove("acme", "rfp")).isTrue();
        assertThat(registry.remove("acme", "rfp")).isFalse();
    }

    @Test
    void removeTenantLeavesOtherTenants() {
        registry.register(document("acme", "a", 1, List.of(), NOW));
        registry.register(document("acme", "b", 1, List.of(), NOW));
        registry.register(document("globex", "a", 1, List.of(), NOW));

        assertThat(registry.removeTenant("acme")).isEqualTo(2);
        assertThat(registry.totalDocuments()).isEqualTo(1);
    }
}
