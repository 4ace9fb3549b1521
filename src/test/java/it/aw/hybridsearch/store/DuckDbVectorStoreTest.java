package it.aw.hybridsearch.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.hybridsearch.exception.StoreException;
import it.aw.hybridsearch.exception.ValidationException;
import it.aw.hybridsearch.model.Chunk;
import it.aw.hybridsearch.model.DateRange;
import it.aw.hybridsearch.model.DocumentKey;
import it.aw.hybridsearch.model.DocumentMetadata;
import it.aw.hybridsearch.model.EmbeddingRecord;
import it.aw.hybridsearch.model.SearchFilters;
import it.aw.hybridsearch.model.SearchResult;
import org.duckdb.DuckDBConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.DriverManager;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DuckDbVectorStoreTest {

    private DuckDBConnection root;
    private DuckDbVectorStore store;

    @BeforeEach
    void setUp() throws Exception {
        root = (DuckDBConnection) DriverManager.getConnection("jdbc:duckdb:");
        store = new DuckDbVectorStore(root, new ObjectMapper());
        store.init();
    }

    @AfterEach
    void tearDown() throws Exception {
        store.close();
        root.close();
    }

    private static Chunk chunk(String documentId, int index, String text) {
        return new Chunk(Chunk.idFor(documentId, index), index, text, 0, text.length(), 3,
                List.of("cloud"), "Overview");
    }

    private static DocumentMetadata metadata(List<String> tags, LocalDate date) {
        return new DocumentMetadata(tags, List.of("541512"), date, List.of());
    }

    private void put(String tenant, String document, int index, float[] vector) {
        store.store(tenant, document, chunk(document, index, "text of " + document + " " + index), vector,
                metadata(List.of(), null));
    }

    @Test
    void queryReturnsCandidatesBySimilarity() {
        put("acme", "a", 0, new float[]{1f, 0f});
        put("acme", "b", 0, new float[]{0.6f, 0.8f});
        put("acme", "c", 0, new float[]{0f, 1f});

        List<SearchResult> results = store.query("acme", new float[]{1f, 0f}, SearchFilters.forTenant("acme"), 10, 0.5);

        assertThat(results).extracting(SearchResult::documentId).containsExactly("a", "b");
        assertThat(results.get(0).vectorScore()).isCloseTo(1.0, within(1e-5));
        assertThat(results.get(1).vectorScore()).isCloseTo(0.6, within(1e-5));
        assertThat(results.get(0).keywords()).containsExactly("cloud");
        assertThat(results.get(0).metadata()).containsEntry("sectionTitle", "Overview");
    }

    @Test
    void queryNeverCrossesTenants() {
        put("acme", "shared", 0, new float[]{1f, 0f});
        put("globex", "shared", 0, new float[]{1f, 0f});
        put("globex", "other", 0, new float[]{1f, 0f});

        List<SearchResult> results = store.query("acme", new float[]{1f, 0f}, SearchFilters.forTenant("acme"), 10, 0.0);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).text()).isEqualTo("text of shared 0");
    }

    @Test
    void interruptedSearchIsAbortedAndStoreStaysUsable() {
        put("acme", "a", 0, new float[]{1f, 0f});

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> store.query("acme", new float[]{1f, 0f}, SearchFilters.forTenant("acme"), 10, 0.0))
                    .isInstanceOf(StoreException.class);
        } finally {
            Thread.interrupted();
        }

        assertThat(store.query("acme", new float[]{1f, 0f}, SearchFilters.forTenant("acme"), 10, 0.0)).hasSize(1);
    }

    @Test
    void cancelQueryWithoutRunningQueryDoesNothing() {
        assertThat(store.cancelQuery(Thread.currentThread())).isFalse();

        put("acme", "a", 0, new float[]{1f, 0f});
        store.query("acme", new float[]{1f, 0f}, SearchFilters.forTenant("acme"), 10, 0.0);

        assertThat(store.cancelQuery(Thread.currentThread())).isFalse();
    }

    @Test
    void filtersMustBelongToTheQueriedTenant() {
        assertThatThrownBy(() -> store.query("acme", new float[]{1f, 0f}, SearchFilters.forTenant("globex"), 10, 0.0))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void appliesDocumentTagAndDateFilters() {
        store.store("acme", "rfp-1", chunk("rfp-1", 0, "first"), new float[]{1f, 0f},
                metadata(List.of("rfp", "cloud"), LocalDate.of(2024, 3, 1)));
        store.store("acme", "rfp-2", chunk("rfp-2", 0, "second"), new float[]{1f, 0f},
                metadata(List.of("rfi"), LocalDate.of(2023, 6, 1)));
        store.store("acme", "rfp-3", chunk("rfp-3", 0, "third"), new float[]{1f, 0f},
                metadata(List.of("rfp"), null));
        float[] q = {1f, 0f};

        assertThat(store.query("acme", q, new SearchFilters("acme", "rfp-2", null, null, null), 10, 0.0))
                .extracting(SearchResult::documentId).containsExactly("rfp-2");
        assertThat(store.query("acme", q, new SearchFilters("acme", null, List.of("rfp-1", "rfp-3"), null, null), 10, 0.0))
                .extracting(SearchResult::documentId).containsExactly("rfp-1", "rfp-3");
        assertThat(store.query("acme", q, new SearchFilters("acme", null, null, List.of("rfp"), null), 10, 0.0))
                .extracting(SearchResult::documentId).containsExactly("rfp-1", "rfp-3");
        assertThat(store.query("acme", q, new SearchFilters("acme", null, null, null,
                new DateRange(LocalDate.of(2024, 1, 1), null)), 10, 0.0))
                .extracting(SearchResult::documentId).containsExactly("rfp-1");
    }

    @Test
    void vectorsOfDifferentDimensionsAreIgnored() {
        put("acme", "small", 0, new float[]{1f, 0f});
        put("acme", "large", 0, new float[]{1f, 0f, 0f});

        assertThat(store.query("acme", new float[]{1f, 0f, 0f}, SearchFilters.forTenant("acme"), 10, 0.0))
                .extracting(SearchResult::documentId).containsExactly("large");
    }

    @Test
    void topKLimitsResultsWithStableTieOrder() {
        for (int i = 0; i < 5; i++) put("acme", "doc", i, new float[]{1f, 0f});

        assertThat(store.query("acme", new float[]{1f, 0f}, SearchFilters.forTenant("acme"), 3, 0.0))
                .extracting(SearchResult::sequenceIndex).containsExactly(0, 1, 2);
    }

    @Test
    void storingTheSameChunkTwiceReplacesIt() {
        put("acme", "doc", 0, new float[]{1f, 0f});
        put("acme", "doc", 0, new float[]{0f, 1f});

        List<EmbeddingRecord> records = store.records("acme", "doc");

        assertThat(records).hasSize(1);
        assertThat(records.get(0).vector()).containsExactly(0f, 1f);
        assertThat(records.get(0).chunkId()).isEqualTo("doc_chunk_0");
    }

    @Test
    void deleteIsIdempotent() {
        put("acme", "doc", 0, new float[]{1f, 0f});
        put("acme", "doc", 1, new float[]{1f, 0f});

        assertThat(store.delete("acme", "doc")).isEqualTo(2);
        assertThat(store.delete("acme", "doc")).isZero();
        assertThat(store.records("acme", "doc")).isEmpty();
    }

    @Test
    void tenantLevelOperations() {
        put("acme", "a", 0, new float[]{1f, 0f});
        put("acme", "b", 0, new float[]{1f, 0f});
        put("globex", "a", 0, new float[]{1f, 0f});

        assertThat(store.countChunks()).isEqualTo(3);
        assertThat(store.countTenants()).isEqualTo(2);
        assertThat(store.documentKeys()).containsExactly(
                new DocumentKey("acme", "a"), new DocumentKey("acme", "b"), new DocumentKey("globex", "a"));

        assertThat(store.deleteTenant("acme")).isEqualTo(2);
        assertThat(store.countTenants()).isEqualTo(1);
    }

    @Test
    void rejectsNonFiniteVectors() {
        assertThatThrownBy(() -> DuckDbVectorStore.vectorLiteral(new float[]{Float.NaN}))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> DuckDbVectorStore.vectorLiteral(new float[0]))
                .isInstanceOf(ValidationException.class);
    }
}
