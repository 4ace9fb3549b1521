package it.aw.hybridsearch.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Esito dell'indicizzazione di un documento.
 * <p>
 * Invarianti verificate alla costruzione:
 * {@code partialFailure == !failedChunkIds.isEmpty()} e
 * {@code totalChunks == records.size() + failedChunkIds.size()}.
 */
public record DocumentEmbeddingSet(
        String documentId,
        String tenantId,
        String model,
        int dimensions,
        int totalChunks,
        List<EmbeddingRecord> records,
        boolean partialFailure,
        Set<String> failedChunkIds
) {

    public DocumentEmbeddingSet {
        records = List.copyOf(records);
        failedChunkIds = Collections.unmodifiableSet(new LinkedHashSet<>(failedChunkIds));
        if (partialFailure == failedChunkIds.isEmpty()) {
            throw new IllegalArgumentException("partialFailure (" + partialFailure
                    + ") incoerente con failedChunkIds (" + failedChunkIds.size() + ")");
        }
        if (totalChunks != records.size() + failedChunkIds.size()) {
            throw new IllegalArgumentException("totalChunks (" + totalChunks + ") diverso da record ("
                    + records.size() + ") + falliti (" + failedChunkIds.size() + ")");
        }
    }

    public static DocumentEmbeddingSet of(String documentId, String tenantId, String model, int dimensions,
                                          List<EmbeddingRecord> records, Set<String> failedChunkIds) {
        return new DocumentEmbeddingSet(documentId, tenantId, model, dimensions,
                records.size() + failedChunkIds.size(), records, !failedChunkIds.isEmpty(), failedChunkIds);
    }

    public static DocumentEmbeddingSet empty(String documentId, String tenantId, String model, int dimensions) {
        return of(documentId, tenantId, model, dimensions, List.of(), Set.of());
    }
}
