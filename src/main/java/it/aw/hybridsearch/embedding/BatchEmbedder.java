package it.aw.hybridsearch.embedding;

import it.aw.hybridsearch.chunking.TextSegmenter;
import it.aw.hybridsearch.chunking.TokenEstimator;
import it.aw.hybridsearch.exception.IndexingFailedException;
import it.aw.hybridsearch.exception.ProviderErrorKind;
import it.aw.hybridsearch.exception.ProviderException;
import it.aw.hybridsearch.model.Chunk;
import it.aw.hybridsearch.model.ChunkingConfig;
import it.aw.hybridsearch.model.DocumentEmbeddingSet;
import it.aw.hybridsearch.model.DocumentMetadata;
import it.aw.hybridsearch.model.EmbeddingRecord;
import it.aw.hybridsearch.store.VectorEntry;
import it.aw.hybridsearch.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Trasforma i chunk di un documento in vettori e li salva nel {@link VectorStore}.
 * <p>
 * I batch di un documento sono processati in sequenza. Un batch fallito viene registrato
 * (tutti i suoi chunk finiscono in failedChunkIds) e l'elaborazione prosegue: solo se
 * fallisce più della metà dei batch l'operazione termina con {@link IndexingFailedException}.
 * <p>
 * Pre-flight: un chunk oltre il 90% del limite per-item del provider viene diviso in pezzi
 * entro l'85% con la stessa accumulazione per frasi del {@link TextSegmenter}; i vettori
 * dei pezzi vengono poi mediati e rinormalizzati in un unico vettore per il chunk originale.
 */
public class BatchEmbedder {

    private static final Logger log = LoggerFactory.getLogger(BatchEmbedder.class);

    private static final double SAFETY_RATIO = 0.90;
    private static final double RESPLIT_RATIO = 0.85;

    /**
     * @param batchSize      chunk per batch
     * @param timeoutMs      deadline di ogni chiamata al provider
     * @param maxAttempts    tentativi per i fallimenti transitori (timeout, rete, rate limit)
     * @param retryBackoffMs attesa base tra i tentativi, moltiplicata per il numero di tentativo
     */
    public record Settings(int batchSize, long timeoutMs, int maxAttempts, long retryBackoffMs) {

        public Settings {
            if (batchSize < 1) throw new IllegalArgumentException("batchSize deve essere >= 1 (ricevuto: " + batchSize + ")");
            if (timeoutMs < 1) throw new IllegalArgumentException("timeoutMs deve essere >= 1 (ricevuto: " + timeoutMs + ")");
            if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts deve essere >= 1 (ricevuto: " + maxAttempts + ")");
        }
    }

    private final EmbeddingProvider provider;
    private final VectorStore vectorStore;
    private final TextSegmenter segmenter;
    private final ExecutorService executor;
    private final Settings settings;

    public BatchEmbedder(EmbeddingProvider provider, VectorStore vectorStore, TextSegmenter segmenter,
                         ExecutorService executor, Settings settings) {
        this.provider = provider;
        this.vectorStore = vectorStore;
        this.segmenter = segmenter;
        this.executor = executor;
        this.settings = settings;
    }

    /**
     * Calcola e salva i vettori dei chunk.
     *
     * @return esito con eventuale fallimento parziale; mai un'eccezione per fallimenti parziali
     * @throws IndexingFailedException se fallisce più della metà dei batch
     */
    public DocumentEmbeddingSet embedAndStore(List<Chunk> chunks, String documentId, String tenantId,
                                              DocumentMetadata metadata) {
        if (chunks.isEmpty()) {
            return DocumentEmbeddingSet.empty(documentId, tenantId, provider.model(), provider.dimensions());
        }
        List<List<Chunk>> batches = partition(chunks, settings.batchSize());
        List<EmbeddingRecord> records = new ArrayList<>(chunks.size());
        Set<String> failed = new LinkedHashSet<>();
        int failedBatches = 0;

        log.info("Embedding documento {} (tenant {}): {} chunk in {} batch", documentId, tenantId,
                chunks.size(), batches.size());
        for (int b = 0; b < batches.size(); b++) {
            List<Chunk> batch = batches.get(b);
            try {
                List<float[]> vectors = embedBatch(batch);
                List<VectorEntry> entries = new ArrayList<>(batch.size());
                List<EmbeddingRecord> batchRecords = new ArrayList<>(batch.size());
                for (int i = 0; i < batch.size(); i++) {
                    Chunk chunk = batch.get(i);
                    entries.add(new VectorEntry(chunk, vectors.get(i)));
                    batchRecords.add(new EmbeddingRecord(chunk.id(), chunk.sequenceIndex(), vectors.get(i),
                            documentId, tenantId));
                }
                vectorStore.storeAll(tenantId, documentId, entries, metadata);
                records.addAll(batchRecords);
            } catch (RuntimeException e) {
                failedBatches++;
                batch.forEach(chunk -> failed.add(chunk.id()));
                log.warn("Batch {}/{} del documento {} fallito ({} chunk): {}",
                        b + 1, batches.size(), documentId, batch.size(), e.getMessage());
            }
        }

        if (failedBatches * 2 > batches.size()) {
            log.error("Documento {}: {}/{} batch falliti, indicizzazione interrotta",
                    documentId, failedBatches, batches.size());
            throw new IndexingFailedException(documentId, tenantId, failedBatches, batches.size(), failed);
        }
        if (failedBatches > 0) {
            log.warn("Documento {} indicizzato parzialmente: {} chunk non indicizzati", documentId, failed.size());
        }
        int dimensions = records.isEmpty() ? provider.dimensions() : records.get(0).dimensions();
        return DocumentEmbeddingSet.of(documentId, tenantId, provider.model(), dimensions, records, failed);
    }

    public String model() {
        return provider.model();
    }

    public int dimensions() {
        return provider.dimensions();
    }

    /** Un vettore per chunk del batch, nello stesso ordine. */
    private List<float[]> embedBatch(List<Chunk> batch) {
        int safeLimit = (int) (provider.maxTokensPerItem() * SAFETY_RATIO);
        List<String> texts = new ArrayList<>();
        List<Integer> owners = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            for (String piece : preflight(batch.get(i), safeLimit)) {
                texts.add(piece);
                owners.add(i);
            }
        }
        // verifica finale: nessun pezzo oltre la soglia arriva al provider
        for (String text : texts) {
            int tokens = TokenEstimator.estimate(text);
            if (tokens > safeLimit) {
                throw new ProviderException(ProviderErrorKind.INVALID_INPUT,
                        "testo di " + tokens + " token stimati oltre il limite di " + safeLimit);
            }
        }

        List<float[]> vectors = new ArrayList<>(texts.size());
        int slice = Math.max(1, provider.maxBatchSize());
        for (int from = 0; from < texts.size(); from += slice) {
            vectors.addAll(callWithRetry(texts.subList(from, Math.min(from + slice, texts.size()))));
        }

        List<float[]> merged = new ArrayList<>(batch.size());
        int cursor = 0;
        for (int i = 0; i < batch.size(); i++) {
            List<float[]> pieces = new ArrayList<>();
            while (cursor < owners.size() && owners.get(cursor) == i) {
                pieces.add(vectors.get(cursor++));
            }
            merged.add(pieces.size() == 1 ? pieces.get(0) : average(pieces));
        }
        return merged;
    }

    private List<String> preflight(Chunk chunk, int safeLimit) {
        if (chunk.estimatedTokenCount() <= safeLimit) {
            return List.of(chunk.text());
        }
        int target = Math.max(1, (int) (provider.maxTokensPerItem() * RESPLIT_RATIO));
        List<String> pieces = segmenter.segment(chunk.id(), chunk.text(), new ChunkingConfig(target, 0, 0, false, true))
                .stream().map(Chunk::text).toList();
        log.debug("Chunk {} ({} token stimati) diviso in {} pezzi", chunk.id(), chunk.estimatedTokenCount(), pieces.size());
        return pieces;
    }

    private List<float[]> callWithRetry(List<String> texts) {
        List<String> payload = List.copyOf(texts);
        for (int attempt = 1; ; attempt++) {
            EmbeddingResult result = callWithTimeout(payload);
            if (result.isOk()) {
                if (result.vectors().size() != payload.size()) {
                    throw new ProviderException(ProviderErrorKind.INVALID_RESPONSE,
                            "attesi " + payload.size() + " vettori, ricevuti " + result.vectors().size());
                }
                return result.vectors();
            }
            ProviderErrorKind kind = result.errorKind();
            if (!kind.isRetryable() || attempt >= settings.maxAttempts()) {
                throw new ProviderException(kind, result.detail());
            }
            log.warn("Chiamata embedding fallita ({}), tentativo {}/{}: {}",
                    kind, attempt, settings.maxAttempts(), result.detail());
            sleep(settings.retryBackoffMs() * attempt);
        }
    }

    private EmbeddingResult callWithTimeout(List<String> texts) {
        Future<EmbeddingResult> future = executor.submit(() -> provider.embed(texts));
        try {
            return future.get(settings.timeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return EmbeddingResult.err(ProviderErrorKind.TIMEOUT,
                    "nessuna risposta entro " + settings.timeoutMs() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return EmbeddingResult.err(LangChain4jEmbeddingProvider.classify(cause), String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderErrorKind.UNEXPECTED, "embedding interrotto", e);
        }
    }

    private static void sleep(long millis) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderErrorKind.UNEXPECTED, "embedding interrotto", e);
        }
    }

    /** Media componente per componente, rinormalizzata a norma 1. */
    static float[] average(List<float[]> vectors) {
        int dims = vectors.get(0).length;
        double[] sum = new double[dims];
        for (float[] v : vectors) {
            if (v.length != dims) {
                throw new ProviderException(ProviderErrorKind.INVALID_RESPONSE,
                        "dimensioni incoerenti tra i pezzi: " + v.length + " vs " + dims);
            }
            for (int i = 0; i < dims; i++) sum[i] += v[i];
        }
        double norm = 0;
        for (double s : sum) norm += s * s;
        norm = Math.sqrt(norm);
        float[] result = new float[dims];
        for (int i = 0; i < dims; i++) {
            result[i] = (float) (norm > 0 ? sum[i] / norm : sum[i] / vectors.size());
        }
        return result;
    }

    private static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> partitions = new ArrayList<>((items.size() + size - 1) / size);
        for (int from = 0; from < items.size(); from += size) {
            partitions.add(items.subList(from, Math.min(from + size, items.size())));
        }
        return partitions;
    }
}
