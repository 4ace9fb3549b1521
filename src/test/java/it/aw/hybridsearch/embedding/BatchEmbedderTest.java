package it.aw.hybridsearch.embedding;

import it.aw.hybridsearch.chunking.TextSegmenter;
import it.aw.hybridsearch.chunking.TokenEstimator;
import it.aw.hybridsearch.exception.IndexingFailedException;
import it.aw.hybridsearch.exception.ProviderErrorKind;
import it.aw.hybridsearch.model.Chunk;
import it.aw.hybridsearch.model.DocumentEmbeddingSet;
import it.aw.hybridsearch.model.DocumentMetadata;
import it.aw.hybridsearch.store.VectorStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class BatchEmbedderTest {

    private static final String SENTENCE = "cat dog sun map red box cup pen hat fox.";

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final VectorStore vectorStore = mock(VectorStore.class);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    /** Provider programmabile: la risposta dipende dal numero di chiamata (1-based). */
    static class ScriptedProvider implements EmbeddingProvider {

        final List<List<String>> calls = new CopyOnWriteArrayList<>();
        private final BiFunction<Integer, List<String>, EmbeddingResult> script;
        private final int maxTokensPerItem;

        ScriptedProvider(int maxTokensPerItem, BiFunction<Integer, List<String>, EmbeddingResult> script) {
            this.maxTokensPerItem = maxTokensPerItem;
            this.script = script;
        }

        @Override
        public EmbeddingResult embed(List<String> texts) {
            calls.add(texts);
            return script.apply(calls.size(), texts);
        }

        @Override public String model() { return "test-model"; }
        @Override public int dimensions() { return 2; }
        @Override public int maxTokensPerItem() { return maxTokensPerItem; }
        @Override public int maxBatchSize() { return 100; }
    }

    static EmbeddingResult unitVectors(List<String> texts) {
        List<float[]> vectors = new ArrayList<>();
        texts.forEach(t -> vectors.add(new float[]{1f, 0f}));
        return EmbeddingResult.ok(vectors);
    }

    private static List<Chunk> chunks(int count) {
        List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            chunks.add(new Chunk(Chunk.idFor("doc", i), i, SENTENCE, i * 41, i * 41 + 40,
                    TokenEstimator.estimate(SENTENCE), List.of(), null));
        }
        return chunks;
    }

    private BatchEmbedder embedder(ScriptedProvider provider, BatchEmbedder.Settings settings) {
        return new BatchEmbedder(provider, vectorStore, new TextSegmenter(), executor, settings);
    }

    @Test
    void allBatchesSucceed() {
        ScriptedProvider provider = new ScriptedProvider(8192, (n, texts) -> unitVectors(texts));

        DocumentEmbeddingSet set = embedder(provider, new BatchEmbedder.Settings(5, 2000, 1, 0))
                .embedAndStore(chunks(10), "doc", "acme", DocumentMetadata.empty());

        assertThat(set.totalChunks()).isEqualTo(10);
        assertThat(set.records()).hasSize(10);
        assertThat(set.partialFailure()).isFalse();
        assertThat(set.model()).isEqualTo("test-model");
        assertThat(provider.calls).hasSize(2);
        verify(vectorStore, times(2)).storeAll(eq("acme"), eq("doc"), anyList(), any());
    }

    @Test
    void failedBatchIsRecordedAndProcessingContinues() {
        ScriptedProvider provider = new ScriptedProvider(8192, (n, texts) -> n == 2
                ? EmbeddingResult.err(ProviderErrorKind.INVALID_INPUT, "input rifiutato")
                : unitVectors(texts));

        DocumentEmbeddingSet set = embedder(provider, new BatchEmbedder.Settings(5, 2000, 3, 0))
                .embedAndStore(chunks(10), "doc", "acme", DocumentMetadata.empty());

        assertThat(set.partialFailure()).isTrue();
        assertThat(set.failedChunkIds()).containsExactly(
                "doc_chunk_5", "doc_chunk_6", "doc_chunk_7", "doc_chunk_8", "doc_chunk_9");
        assertThat(set.records()).hasSize(5);
        assertThat(set.totalChunks()).isEqualTo(10);
        // errore non ritentabile: una sola chiamata per il secondo batch
        assertThat(provider.calls).hasSize(2);
        verify(vectorStore, times(1)).storeAll(eq("acme"), eq("doc"), anyList(), any());
    }

    @Test
    void majorityOfFailedBatchesAbortsIndexing() {
        ScriptedProvider provider = new ScriptedProvider(8192, (n, texts) -> n == 1
                ? unitVectors(texts)
                : EmbeddingResult.err(ProviderErrorKind.QUOTA, "quota esaurita"));

        BatchEmbedder embedder = embedder(provider, new BatchEmbedder.Settings(5, 2000, 1, 0));

        assertThatThrownBy(() -> embedder.embedAndStore(chunks(15), "doc", "acme", DocumentMetadata.empty()))
                .isInstanceOf(IndexingFailedException.class)
                .satisfies(e -> assertThat(((IndexingFailedException) e).getFailedChunkIds()).hasSize(10));
    }

    @Test
    void transientErrorsAreRetried() {
        ScriptedProvider provider = new ScriptedProvider(8192, (n, texts) -> n == 1
                ? EmbeddingResult.err(ProviderErrorKind.RATE_LIMIT, "429")
                : unitVectors(texts));

        DocumentEmbeddingSet set = embedder(provider, new BatchEmbedder.Settings(10, 2000, 2, 0))
                .embedAndStore(chunks(4), "doc", "acme", DocumentMetadata.empty());

        assertThat(set.partialFailure()).isFalse();
        assertThat(provider.calls).hasSize(2);
    }

    @Test
    void slowProviderCallTimesOutAndFailsTheBatch() {
        ScriptedProvider provider = new ScriptedProvider(8192, (n, texts) -> {
            if (n == 1) {
                try {
                    Thread.sleep(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return unitVectors(texts);
        });

        DocumentEmbeddingSet set = embedder(provider, new BatchEmbedder.Settings(2, 100, 1, 0))
                .embedAndStore(chunks(4), "doc", "acme", DocumentMetadata.empty());

        assertThat(set.failedChunkIds()).containsExactly("doc_chunk_0", "doc_chunk_1");
        assertThat(set.records()).hasSize(2);
    }

    @Test
    void oversizedChunkIsSplitAndItsVectorsAveraged() {
        String text = String.join(" ", java.util.Collections.nCopies(15, SENTENCE));
        Chunk big = new Chunk("doc_chunk_0", 0, text, 0, text.length(), TokenEstimator.estimate(text), List.of(), null);
        ScriptedProvider provider = new ScriptedProvider(100, (n, texts) -> unitVectors(texts));

        DocumentEmbeddingSet set = embedder(provider, new BatchEmbedder.Settings(5, 2000, 1, 0))
                .embedAndStore(List.of(big), "doc", "acme", DocumentMetadata.empty());

        assertThat(provider.calls).hasSize(1);
        assertThat(provider.calls.get(0).size()).isGreaterThan(1);
        provider.calls.get(0).forEach(piece -> assertThat(TokenEstimator.estimate(piece)).isLessThanOrEqualTo(90));
        assertThat(set.records()).hasSize(1);
        assertThat(set.records().get(0).vector()).containsExactly(1f, 0f);
    }

    @Test
    void averageIsRenormalised() {
        float[] average = BatchEmbedder.average(List.of(new float[]{1f, 0f}, new float[]{0f, 1f}));

        assertThat((double) average[0]).isCloseTo(Math.sqrt(0.5), within(1e-6));
        assertThat((double) average[1]).isCloseTo(Math.sqrt(0.5), within(1e-6));
    }

    @Test
    void emptyChunkListProducesEmptySet() {
        ScriptedProvider provider = new ScriptedProvider(8192, (n, texts) -> unitVectors(texts));

        DocumentEmbeddingSet set = embedder(provider, new BatchEmbedder.Settings(5, 2000, 1, 0))
                .embedAndStore(List.of(), "doc", "acme", DocumentMetadata.empty());

        assertThat(set.totalChunks()).isZero();
        assertThat(provider.calls).isEmpty();
        verify(vectorStore, never()).storeAll(any(), any(), anyList(), any());
    }
}
