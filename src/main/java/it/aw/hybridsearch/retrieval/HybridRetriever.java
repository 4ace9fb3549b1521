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
import it.aw.hybridsearch.model.SearchStats;
import it.aw.hybridsearch.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Ricerca ibrida: candidati dal vector store per l'embedding della query, punteggio keyword
 * per ogni candidato ({@link KeywordScorer}) e fusione lineare
 * {@code fusedScore = vectorWeight · vectorScore + keywordWeight · keywordScore}.
 * <p>
 * Un candidato senza termini corrispondenti non viene escluso: ha keywordScore 0 e
 * scende in classifica. A parità di fusedScore vince il vectorScore più alto, poi
 * documentId e sequenceIndex per un ordine stabile.
 */
public class HybridRetriever {

    private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);

    private static final Comparator<HybridResult> RANKING = Comparator
            .comparingDouble(HybridResult::fusedScore).reversed()
            .thenComparing(Comparator.comparingDouble(HybridResult::vectorScore).reversed())
            .thenComparing(HybridResult::documentId)
            .thenComparingInt(HybridResult::sequenceIndex);

    private final EmbeddingProvider embeddingProvider;
    private final VectorStore vectorStore;
    private final KeywordScorer keywordScorer;
    private final int candidateMultiplier;

    public HybridRetriever(EmbeddingProvider embeddingProvider, VectorStore vectorStore,
                           KeywordScorer keywordScorer, int candidateMultiplier) {
        this.embeddingProvider = embeddingProvider;
        this.vectorStore = vectorStore;
        this.keywordScorer = keywordScorer;
        this.candidateMultiplier = Math.max(1, candidateMultiplier);
    }

    /**
     * Esegue la ricerca.
     *
     * @return al più {@code options.topK()} risultati in ordine di fusedScore decrescente
     */
    public List<HybridResult> search(String query, SearchFilters filters, SearchOptions options) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("La query non può essere vuota");
        }
        float[] queryVector = embedQuery(query);
        int candidates = options.topK() * candidateMultiplier;
        List<SearchResult> pool = vectorStore.query(filters.tenantId(), queryVector, filters,
                candidates, options.minScore());
        if (Thread.currentThread().isInterrupted()) {
            log.debug("Ricerca interrotta dopo la query vettoriale");
            return List.of();
        }
        List<HybridResult> ranked = rank(query, pool, options);
        log.debug("Ricerca tenant {}: {} candidati, {} risultati", filters.tenantId(), pool.size(), ranked.size());
        return ranked;
    }

    /** Punteggio keyword, fusione e ordinamento di un insieme di candidati già recuperati. */
    public List<HybridResult> rank(String query, List<SearchResult> pool, SearchOptions options) {
        List<String> terms = options.hybridSearch()
                ? KeywordScorer.queryTerms(query, options.keywords())
                : List.of();

        List<List<String>> tokens = new ArrayList<>(pool.size());
        long totalTokens = 0;
        for (SearchResult candidate : pool) {
            List<String> candidateTokens = KeywordScorer.tokenize(candidate.text());
            tokens.add(candidateTokens);
            totalTokens += candidateTokens.size();
        }
        double avgDocLen = pool.isEmpty() ? 1.0 : Math.max(1.0, (double) totalTokens / pool.size());

        List<HybridResult> results = new ArrayList<>(pool.size());
        for (int i = 0; i < pool.size(); i++) {
            SearchResult candidate = pool.get(i);
            KeywordScorer.Match match = KeywordScorer.Match.NONE;
            if (!terms.isEmpty()) {
                match = options.enableBm25()
                        ? keywordScorer.bm25(tokens.get(i), candidate.keywords(), terms, avgDocLen, options.keywordBoost())
                        : keywordScorer.simple(tokens.get(i), candidate.keywords(), terms, options.keywordBoost());
            }
            double vectorScore = clamp(candidate.vectorScore());
            double fused = Math.min(1.0,
                    options.vectorWeight() * vectorScore + options.keywordWeight() * match.score());
            results.add(HybridResult.of(candidate, match.score(), fused, match.matchedTerms()));
        }
        results.sort(RANKING);
        return results.size() > options.topK() ? List.copyOf(results.subList(0, options.topK())) : List.copyOf(results);
    }

    private float[] embedQuery(String query) {
        EmbeddingResult result = embeddingProvider.embed(List.of(query));
        if (!result.isOk()) {
            throw new ProviderException(result.errorKind(), "Embedding della query fallito: " + result.detail());
        }
        if (result.vectors().size() != 1) {
            throw new ProviderException(ProviderErrorKind.INVALID_RESPONSE,
                    "Embedding della query: attesi 1 vettore, ricevuti " + result.vectors().size());
        }
        return result.vectors().get(0);
    }

    public SearchStats stats(List<HybridResult> results) {
        return SearchStats.of(results);
    }

    /** Spiegazione testuale della fusione per un risultato. */
    public String explain(HybridResult result, SearchOptions options) {
        String terms = result.matchedTerms().isEmpty() ? "nessuno" : String.join(", ", result.matchedTerms());
        return String.format(Locale.ROOT,
                "vettoriale %.3f × %.2f + keyword %.3f × %.2f = %.3f (termini: %s)",
                result.vectorScore(), options.vectorWeight(),
                result.keywordScore(), options.keywordWeight(),
                result.fusedScore(), terms);
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
