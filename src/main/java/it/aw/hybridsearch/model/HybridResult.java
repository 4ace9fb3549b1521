package it.aw.hybridsearch.model;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.Collections;

/**
 * Risultato di ricerca con punteggio fuso:
 * {@code fusedScore = vectorWeight * vectorScore + keywordWeight * keywordScore}, limitato a 1.0.
 */
public record HybridResult(String documentId,
                           String chunkId,
                           int sequenceIndex,
                           String text,
                           double vectorScore,
                           double keywordScore,
                           double fusedScore,
                           Set<String> matchedTerms,
                           List<String> keywords,
                           Map<String, Object> metadata) {

    public HybridResult {
        matchedTerms = matchedTerms == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(matchedTerms));
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HybridResult of(SearchResult candidate, double keywordScore, double fusedScore, Set<String> matchedTerms) {
        return new HybridResult(candidate.documentId(), candidate.chunkId(), candidate.sequenceIndex(),
                candidate.text(), candidate.vectorScore(), keywordScore, fusedScore, matchedTerms,
                candidate.keywords(), candidate.metadata());
    }
}
