package it.aw.hybridsearch.controller;

import it.aw.hybridsearch.model.DocumentEmbeddingSet;
import it.aw.hybridsearch.model.IndexOutcome;

import java.util.List;

/** Esito di indicizzazione restituito dall'API, senza i vettori. */
public record IndexSummary(
        String documentId,
        String tenantId,
        String model,
        Integer dimensions,
        Integer totalChunks,
        Integer embeddedChunks,
        Boolean partialFailure,
        List<String> failedChunkIds,
        String errorCode,
        String errorMessage
) {

    public static IndexSummary from(DocumentEmbeddingSet set) {
        return new IndexSummary(set.documentId(), set.tenantId(), set.model(), set.dimensions(),
                set.totalChunks(), set.records().size(), set.partialFailure(),
                List.copyOf(set.failedChunkIds()), null, null);
    }

    public static IndexSummary from(IndexOutcome outcome) {
        if (outcome.succeeded()) return from(outcome.embeddingSet());
        return new IndexSummary(outcome.documentId(), outcome.tenantId(), null, null, null, null, null,
                List.of(), outcome.errorCode(), outcome.errorMessage());
    }
}
