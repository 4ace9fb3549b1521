package it.aw.hybridsearch.model;

import it.aw.hybridsearch.exception.ValidationException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Opzioni effettive di una ricerca, già risolte rispetto ai default.
 * <p>
 * La somma dei pesi è sempre 1.0: il costruttore rifiuta combinazioni diverse.
 * Con {@code hybridSearch = false} i pesi effettivi sono (1.0, 0.0).
 */
public record SearchOptions(int topK,
                            double minScore,
                            boolean hybridSearch,
                            double vectorWeight,
                            double keywordWeight,
                            List<String> keywords,
                            double keywordBoost,
                            boolean enableBm25) {

    public static final int DEFAULT_TOP_K = 10;
    public static final int MAX_TOP_K = 100;
    public static final double DEFAULT_MIN_SCORE_HYBRID = 0.1;
    public static final double DEFAULT_MIN_SCORE_VECTOR = 0.7;
    public static final double DEFAULT_VECTOR_WEIGHT = 0.7;
    public static final double DEFAULT_KEYWORD_WEIGHT = 0.3;
    public static final double DEFAULT_KEYWORD_BOOST = 1.5;

    private static final double WEIGHT_TOLERANCE = 1e-6;

    public SearchOptions {
        if (topK < 1 || topK > MAX_TOP_K) {
            throw new ValidationException("topK deve essere tra 1 e " + MAX_TOP_K + " (ricevuto: " + topK + ")");
        }
        if (minScore < 0 || minScore > 1) {
            throw new ValidationException("minScore deve essere tra 0 e 1 (ricevuto: " + minScore + ")");
        }
        if (vectorWeight < 0 || keywordWeight < 0 || vectorWeight > 1 || keywordWeight > 1) {
            throw new ValidationException("I pesi devono essere compresi tra 0 e 1");
        }
        if (Math.abs(vectorWeight + keywordWeight - 1.0) > WEIGHT_TOLERANCE) {
            throw new ValidationException("vectorWeight + keywordWeight deve essere 1.0 (ricevuto: "
                    + vectorWeight + " + " + keywordWeight + ")");
        }
        if (keywordBoost < 1) {
            throw new ValidationException("keywordBoost deve essere >= 1 (ricevuto: " + keywordBoost + ")");
        }
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public static SearchOptions defaults() {
        return of(null, null, null, null, null, null, null, null);
    }

    /**
     * Risolve le opzioni di una richiesta: i valori null prendono il default.
     * Se è indicato un solo peso, l'altro è il suo complemento a 1.
     */
    public static SearchOptions of(Integer topK, Double minScore, Boolean hybridSearch,
                                   Double vectorWeight, Double keywordWeight,
                                   List<String> keywords, Double keywordBoost, Boolean enableBm25) {
        boolean hybrid = hybridSearch == null || hybridSearch;
        double vw;
        double kw;
        if (!hybrid) {
            vw = 1.0;
            kw = 0.0;
        } else if (vectorWeight != null && keywordWeight != null) {
            vw = vectorWeight;
            kw = keywordWeight;
        } else if (vectorWeight != null) {
            vw = vectorWeight;
            kw = 1.0 - vectorWeight;
        } else if (keywordWeight != null) {
            kw = keywordWeight;
            vw = 1.0 - keywordWeight;
        } else {
            vw = DEFAULT_VECTOR_WEIGHT;
            kw = DEFAULT_KEYWORD_WEIGHT;
        }
        double min = minScore != null ? minScore : (hybrid ? DEFAULT_MIN_SCORE_HYBRID : DEFAULT_MIN_SCORE_VECTOR);
        return new SearchOptions(
                topK != null ? topK : DEFAULT_TOP_K,
                min,
                hybrid,
                vw,
                kw,
                keywords,
                keywordBoost != null ? keywordBoost : DEFAULT_KEYWORD_BOOST,
                enableBm25 == null || enableBm25);
    }

    public Map<String, Object> canonical() {
        Map<String, Object> map = new TreeMap<>();
        map.put("topK", topK);
        map.put("minScore", minScore);
        map.put("hybridSearch", hybridSearch);
        map.put("vectorWeight", vectorWeight);
        map.put("keywordWeight", keywordWeight);
        map.put("keywords", new TreeSet<>(keywords.stream().map(k -> k.toLowerCase(Locale.ROOT).trim()).toList()));
        map.put("keywordBoost", keywordBoost);
        map.put("enableBm25", enableBm25);
        return map;
    }
}
