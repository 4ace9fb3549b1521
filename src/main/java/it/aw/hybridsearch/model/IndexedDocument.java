package it.aw.hybridsearch.model;

import java.time.LocalDateTime;
import java.util.List;

/** Riga del registry: riepilogo di un documento indicizzato per un tenant. */
public record IndexedDocument(
        String tenantId,
        String documentId,
        String model,
        int dimensions,
        int totalChunks,
        int embeddedChunks,
        boolean partialFailure,
        List<String> failedChunkIds,
        int targetChunkTokens,
        int overlapTokens,
        LocalDateTime indexedAt
) {

    public IndexedDocument {
        failedChunkIds = failedChunkIds == null ? List.of() : List.copyOf(failedChunkIds);
    }

    public static IndexedDocument from(DocumentEmbeddingSet set, ChunkingConfig config, LocalDateTime indexedAt) {
        return new IndexedDocument(set.tenantId(), set.documentId(), set.model(), set.dimensions(),
                set.totalChunks(), set.records().size(), set.partialFailure(),
                List.copyOf(set.failedChunkIds()), config.targetChunkTokens(), config.overlapTokens(), indexedAt);
    }
}
