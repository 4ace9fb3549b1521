package it.aw.hybridsearch.model;

import java.util.List;
import java.util.Map;

/**
 * Candidato restituito dal vector store.
 *
 * @param vectorScore similarità coseno riportata in [0, 1]
 * @param keywords    keyword estratte dal chunk in fase di segmentazione
 */
public record SearchResult(String documentId,
                           String chunkId,
                           int sequenceIndex,
                           String text,
                           double vectorScore,
                           List<String> keywords,
                           Map<String, Object> metadata) {

    public SearchResult {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
