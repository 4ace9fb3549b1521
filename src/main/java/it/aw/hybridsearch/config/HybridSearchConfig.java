package it.aw.hybridsearch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.hybridsearch.cache.ResultCache;
import it.aw.hybridsearch.chunking.TextSegmenter;
import it.aw.hybridsearch.embedding.BatchEmbedder;
import it.aw.hybridsearch.embedding.EmbeddingProvider;
import it.aw.hybridsearch.model.ChunkingConfig;
import it.aw.hybridsearch.retrieval.HybridRetriever;
import it.aw.hybridsearch.retrieval.KeywordScorer;
import it.aw.hybridsearch.store.VectorStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Assembla i componenti della pipeline a partire da application.properties.
 * <p>
 * Tre pool distinti: {@code indexingExecutor} limita i documenti indicizzati in parallelo,
 * {@code embeddingExecutor} esegue le chiamate al provider sotto timeout,
 * {@code searchExecutor} esegue le ricerche sotto deadline.
 * La chiusura dei pool e della cache è in {@link StoreLifecycle}.
 */
@Configuration
public class HybridSearchConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ChunkingConfig defaultChunkingConfig(
            @Value("${chunking.target-tokens:1500}") int targetTokens,
            @Value("${chunking.overlap-tokens:200}") int overlapTokens,
            @Value("${chunking.min-tokens:500}") int minTokens,
            @Value("${chunking.preserve-boundaries:true}") boolean preserveBoundaries,
            @Value("${chunking.semantic:true}") boolean semantic) {
        return new ChunkingConfig(targetTokens, overlapTokens, minTokens, preserveBoundaries, semantic);
    }

    @Bean
    public ExecutorService indexingExecutor(@Value("${indexing.workers:4}") int workers) {
        return Executors.newFixedThreadPool(workers, named("indexing"));
    }

    @Bean
    public ExecutorService embeddingExecutor(@Value("${indexing.workers:4}") int workers) {
        // un worker di indicizzazione ha al più una chiamata in corso, più quelle scadute ancora vive
        return Executors.newFixedThreadPool(workers * 2, named("embedding"));
    }

    @Bean
    public ExecutorService searchExecutor(@Value("${search.workers:8}") int workers) {
        return Executors.newFixedThreadPool(workers, named("search"));
    }

    @Bean
    public BatchEmbedder batchEmbedder(EmbeddingProvider embeddingProvider,
                                       VectorStore vectorStore,
                                       TextSegmenter segmenter,
                                       @Qualifier("embeddingExecutor") ExecutorService embeddingExecutor,
                                       @Value("${embedding.batch-size:100}") int batchSize,
                                       @Value("${embedding.timeout-ms:60000}") long timeoutMs,
                                       @Value("${embedding.max-attempts:2}") int maxAttempts,
                                       @Value("${embedding.retry-backoff-ms:500}") long retryBackoffMs) {
        return new BatchEmbedder(embeddingProvider, vectorStore, segmenter, embeddingExecutor,
                new BatchEmbedder.Settings(batchSize, timeoutMs, maxAttempts, retryBackoffMs));
    }

    @Bean
    public KeywordScorer keywordScorer() {
        return new KeywordScorer();
    }

    @Bean
    public HybridRetriever hybridRetriever(EmbeddingProvider embeddingProvider,
                                           VectorStore vectorStore,
                                           KeywordScorer keywordScorer,
                                           @Value("${search.candidate-multiplier:1}") int candidateMultiplier) {
        return new HybridRetriever(embeddingProvider, vectorStore, keywordScorer, candidateMultiplier);
    }

    @Bean
    public ResultCache resultCache(Clock clock,
                                   ObjectMapper objectMapper,
                                   @Value("${cache.ttl-ms:300000}") long ttlMs,
                                   @Value("${cache.sweep-interval-ms:120000}") long sweepIntervalMs,
                                   @Value("${cache.max-entries:1000}") int maxEntries,
                                   @Value("${cache.max-results:100}") int maxResults) {
        return new ResultCache(new ResultCache.Settings(Duration.ofMillis(ttlMs), Duration.ofMillis(sweepIntervalMs),
                maxEntries, maxResults), clock, objectMapper);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
