package it.aw.hybridsearch.exception;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Più della metà dei batch di un documento non è stata indicizzata.
 * I fallimenti parziali non arrivano mai qui: restano nel flag partialFailure
 * del DocumentEmbeddingSet.
 */
public class IndexingFailedException extends HybridSearchException {

    private final Set<String> failedChunkIds;

    public IndexingFailedException(String documentId, String tenantId,
                                   int failedBatches, int totalBatches, Set<String> failedChunkIds) {
        super("INDEXING_FAILED",
                "Indicizzazione fallita per il documento " + documentId + ": "
                        + failedBatches + "/" + totalBatches + " batch falliti",
                502,
                Map.of("documentId", documentId,
                        "tenantId", tenantId,
                        "failedBatches", failedBatches,
                        "totalBatches", totalBatches,
                        "failedChunkIds", List.copyOf(failedChunkIds)));
        this.failedChunkIds = Set.copyOf(failedChunkIds);
    }

    public Set<String> getFailedChunkIds() {
        return failedChunkIds;
    }
}
