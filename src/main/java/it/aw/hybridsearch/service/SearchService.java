package it.aw.hybridsearch.service;

import it.aw.hybridsearch.cache.ResultCache;
import it.aw.hybridsearch.exception.HybridSearchException;
import it.aw.hybridsearch.exception.SearchTimeoutException;
import it.aw.hybridsearch.exception.ValidationException;
import it.aw.hybridsearch.model.HybridResult;
import it.aw.hybridsearch.model.SearchFilters;
import it.aw.hybridsearch.model.SearchOutcome;
import it.aw.hybridsearch.model.SearchOptions;
import it.aw.hybridsearch.model.SearchStats;
import it.aw.hybridsearch.retrieval.HybridRetriever;
import it.aw.hybridsearch.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestratore delle ricerche: cache davanti al {@link HybridRetriever} e deadline per chiamata.
 * <p>
 * Se il retriever non risponde entro {@code search.timeout-ms} la chiamata viene cancellata
 * (interrupt del worker e annullamento della query DuckDB in corso) e si tenta la cache
 * con la stessa chiave; solo se anche la cache è vuota il chiamante riceve {@link SearchTimeoutException}.
 */
@Service
public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private final HybridRetriever retriever;
    private final ResultCache cache;
    private final VectorStore vectorStore;
    private final ExecutorService searchExecutor;
    private final long timeoutMs;

    public SearchService(HybridRetriever retriever,
                         ResultCache cache,
                         VectorStore vectorStore,
                         @Qualifier("searchExecutor") ExecutorService searchExecutor,
                         @Value("${search.timeout-ms:5000}") long timeoutMs) {
        this.retriever = retriever;
        this.cache = cache;
        this.vectorStore = vectorStore;
        this.searchExecutor = searchExecutor;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Cerca i chunk più rilevanti per la query nel perimetro dei filtri.
     *
     * @return risultati in ordine di fusedScore decrescente, con la loro provenienza
     */
    public SearchOutcome search(String query, SearchFilters filters, SearchOptions options) {
        if (filters == null) {
            throw new ValidationException("tenantId obbligatorio per ogni ricerca");
        }
        if (query == null || query.isBlank()) {
            throw new ValidationException("La query non può essere vuota", Map.of("tenantId", filters.tenantId()));
        }
        SearchOptions effective = options != null ? options : SearchOptions.defaults();
        String key = cache.keyFor(query, filters, effective);

        Optional<List<HybridResult>> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Ricerca tenant {} servita dalla cache", filters.tenantId());
            return new SearchOutcome(cached.get(), SearchOutcome.Source.CACHE);
        }

        AtomicReference<Thread> worker = new AtomicReference<>();
        Future<List<HybridResult>> future = searchExecutor.submit(() -> {
            worker.set(Thread.currentThread());
            try {
                return retriever.search(query, filters, effective);
            } finally {
                synchronized (worker) {
                    worker.set(null);
                }
            }
        });
        List<HybridResult> results;
        try {
            results = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancel(future, worker);
            Optional<List<HybridResult>> fallback = cache.get(key);
            if (fallback.isPresent()) {
                log.warn("Ricerca tenant {} oltre {} ms: restituiti risultati dalla cache", filters.tenantId(), timeoutMs);
                return new SearchOutcome(fallback.get(), SearchOutcome.Source.STALE_FALLBACK);
            }
            log.warn("Ricerca tenant {} oltre {} ms, nessun risultato in cache", filters.tenantId(), timeoutMs);
            throw new SearchTimeoutException(filters.tenantId(), timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new HybridSearchException("SEARCH_ERROR", "Errore durante la ricerca", 500,
                    Map.of("tenantId", filters.tenantId()), cause);
        } catch (InterruptedException e) {
            cancel(future, worker);
            Thread.currentThread().interrupt();
            throw new HybridSearchException("SEARCH_INTERRUPTED", "Ricerca interrotta", 503,
                    Map.of("tenantId", filters.tenantId()), e);
        }

        if (cache.isCacheable(query, results)) {
            cache.put(key, filters.tenantId(), results);
        }
        return new SearchOutcome(results, SearchOutcome.Source.LIVE);
    }

    /**
     * Un interrupt non ferma una query DuckDB già in esecuzione: la query del worker
     * viene annullata esplicitamente.
     * Il lock su {@code worker} impedisce che il thread passi a un'altra ricerca nel frattempo.
     */
    private void cancel(Future<?> future, AtomicReference<Thread> worker) {
        synchronized (worker) {
            Thread thread = worker.get();
            future.cancel(true);
            if (thread != null && vectorStore.cancelQuery(thread)) {
                log.debug("Query vettoriale annullata per deadline superata");
            }
        }
    }

    public SearchStats stats(List<HybridResult> results) {
        return retriever.stats(results);
    }

    public String explain(HybridResult result, SearchOptions options) {
        return retriever.explain(result, options);
    }
}
