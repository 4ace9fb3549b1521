package it.aw.hybridsearch.model;

import java.util.List;

/**
 * Medie dei punteggi su un insieme di risultati.
 *
 * @param keywordCoverage frazione di risultati con almeno un termine corrispondente
 */
public record SearchStats(int totalResults,
                          double averageVectorScore,
                          double averageKeywordScore,
                          double averageFusedScore,
                          double keywordCoverage) {

    public static SearchStats of(List<HybridResult> results) {
        if (results.isEmpty()) {
            return new SearchStats(0, 0, 0, 0, 0);
        }
        int n = results.size();
        double vector = 0;
        double keyword = 0;
        double fused = 0;
        int withTerms = 0;
        for (HybridResult r : results) {
            vector += r.vectorScore();
            keyword += r.keywordScore();
            fused += r.fusedScore();
            if (!r.matchedTerms().isEmpty()) withTerms++;
        }
        return new SearchStats(n, vector / n, keyword / n, fused / n, (double) withTerms / n);
    }
}
