package it.aw.hybridsearch.retrieval;

import it.aw.hybridsearch.embedding.EmbeddingProvider;
import it.aw.hybridsearch.embedding.EmbeddingResult;
import it.aw.hybridsearch.exception.ProviderErrorKind;
import it.aw.hybridsearch.exception.ProviderException;
import it.aw.hybridsearch.exception.ValidationException;
import it.aw.hybridsearch.model.HybridResult;
import it.aw.hybridsearch.model.SearchFilters;
import it.aw.hybridsearch.model.SearchOptions;
import it.aw.hybridsearch.model.SearchResult;
import it.aw.hybridsearch.store.VectorStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HybridRetrieverTest {

    private final EmbeddingProvider provider = mock(EmbeddingProvider.class);
    private final VectorStore store = mock(VectorStore.class);
    private final HybridRetriever retriever = new HybridRetriever(provider, store, new KeywordScorer(), 2);

    private static SearchResult candidate(String documentId, int index, String text, double score) {
        return new SearchResult(documentId, documentId + "_chunk_" + index, index, text, score, List.of(), Map.of());
    }

    @BeforeEach
    void setUp() {
        when(provider.embed(anyList())).thenReturn(EmbeddingResult.ok(List.of(new float[]{1f, 0f})));
    }

    @Test
    void keywordEvidenceLiftsAChunkAboveAStrongerVectorMatch() {
        List<SearchResult> pool = List.of(
                candidate("a", 0, "Hosting platform and delivery schedule for the agency portal.", 0.80),
                candidate("b", 0, "Cloud security compliance requirements for the hosting platform.", 0.75),
                candidate("c", 0, "Invoicing terms and payment milestones for every deliverable.", 0.70));
        when(store.query(eq("acme"), any(), any(), eq(20), eq(0.1))).thenReturn(pool);

        List<HybridResult> results = retriever.search("cloud security compliance",
                SearchFilters.forTenant("acme"), SearchOptions.defaults());

        assertThat(results).extracting(HybridResult::documentId).containsExactly("b", "a", "c");
        HybridResult top = results.get(0);
        assertThat(top.matchedTerms()).containsExactly("cloud", "compliance", "security");
        assertThat(top.keywordScore()).isGreaterThan(0);
        assertThat(results.get(1).keywordScore()).isZero();
    }

    @Test
    void fusedScoreIsTheWeightedSumOfBothScores() {
        List<SearchResult> pool = List.of(
                candidate("a", 0, "cloud cloud security", 0.9),
                candidate("a", 1, "compliance review", 0.4),
                candidate("b", 0, "nothing relevant here", 0.6));
        SearchOptions options = SearchOptions.of(10, 0.0, true, 0.6, null, null, null, true);

        List<HybridResult> results = retriever.rank("cloud security compliance", pool, options);

        assertThat(results).hasSize(3);
        for (HybridResult r : results) {
            assertThat(r.keywordScore()).isBetween(0.0, 1.0);
            assertThat(r.fusedScore()).isCloseTo(0.6 * r.vectorScore() + 0.4 * r.keywordScore(), within(1e-9));
            assertThat(r.fusedScore()).isLessThanOrEqualTo(1.0);
        }
        for (int i = 1; i < results.size(); i++) {
            assertThat(results.get(i - 1).fusedScore()).isGreaterThanOrEqualTo(results.get(i).fusedScore());
        }
    }

    @Test
    void vectorOnlySearchIgnoresKeywords() {
        List<SearchResult> pool = List.of(
                candidate("a", 0, "cloud security compliance", 0.72),
                candidate("b", 0, "unrelated text", 0.91));
        SearchOptions options = SearchOptions.of(null, null, false, null, null, null, null, null);
        when(store.query(eq("acme"), any(), any(), eq(20), eq(0.7))).thenReturn(pool);

        List<HybridResult> results = retriever.search("cloud security compliance",
                SearchFilters.forTenant("acme"), options);

        assertThat(results).extracting(HybridResult::documentId).containsExactly("b", "a");
        assertThat(results).allSatisfy(r -> {
            assertThat(r.keywordScore()).isZero();
            assertThat(r.fusedScore()).isEqualTo(r.vectorScore());
        });
    }

    @Test
    void tiesAreBrokenByVectorScoreThenPosition() {
        List<SearchResult> pool = List.of(
                candidate("b", 1, "plain text", 0.5),
                candidate("b", 0, "plain text", 0.5),
                candidate("a", 3, "plain text", 0.5));
        SearchOptions options = SearchOptions.of(10, 0.0, true, null, null, null, null, true);

        List<HybridResult> results = retriever.rank("zebra", pool, options);

        assertThat(results).extracting(HybridResult::chunkId).containsExactly("a_chunk_3", "b_chunk_0", "b_chunk_1");
    }

    @Test
    void resultsAreLimitedToTopK() {
        List<SearchResult> pool = List.of(
                candidate("a", 0, "one", 0.9), candidate("a", 1, "two", 0.8), candidate("a", 2, "three", 0.7));
        SearchOptions options = SearchOptions.of(2, 0.0, true, null, null, null, null, true);

        assertThat(retriever.rank("query", pool, options)).hasSize(2);
    }

    @Test
    void explicitKeywordsAreMatched() {
        List<SearchResult> pool = List.of(candidate("a", 0, "The contracting officer approves changes.", 0.5));
        SearchOptions options = SearchOptions.of(10, 0.0, true, null, null, List.of("contracting officer"), null, true);

        HybridResult result = retriever.rank("approval", pool, options).get(0);

        assertThat(result.matchedTerms()).contains("contracting officer");
        assertThat(retriever.explain(result, options)).contains("contracting officer");
    }

    @Test
    void queryEmbeddingFailureIsAProviderError() {
        when(provider.embed(anyList())).thenReturn(EmbeddingResult.err(ProviderErrorKind.NETWORK, "connection refused"));

        assertThatThrownBy(() -> retriever.search("cloud", SearchFilters.forTenant("acme"), SearchOptions.defaults()))
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> assertThat(((ProviderException) e).getKind()).isEqualTo(ProviderErrorKind.NETWORK));
    }

    @Test
    void blankQueryIsRejected() {
        assertThatThrownBy(() -> retriever.search("  ", SearchFilters.forTenant("acme"), SearchOptions.defaults()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void storeIsQueriedWithTheTenantOfTheFilters() {
        when(store.query(any(), any(), any(), eq(20), eq(0.1))).thenReturn(List.of());

        retriever.search("cloud", SearchFilters.forTenant("globex"), SearchOptions.defaults());

        verify(store).query(eq("globex"), any(), eq(SearchFilters.forTenant("globex")), eq(20), eq(0.1));
    }
}
