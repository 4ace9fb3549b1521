package it.aw.hybridsearch.model;

import it.aw.hybridsearch.exception.ValidationException;

/**
 * Parametri di segmentazione per una singola indicizzazione.
 * <p>
 * Le dimensioni sono espresse in token stimati (vedi {@code TokenEstimator}),
 * non in token reali del modello.
 *
 * @param preserveBoundaries se true i confini di sezione (paragrafi, heading) chiudono il chunk
 * @param semanticMode       se false si usa la segmentazione a finestre di caratteri
 */
public record ChunkingConfig(int targetChunkTokens,
                             int overlapTokens,
                             int minChunkTokens,
                             boolean preserveBoundaries,
                             boolean semanticMode) {

    public static final int DEFAULT_TARGET_TOKENS  = 1500;
    public static final int DEFAULT_OVERLAP_TOKENS = 200;
    public static final int DEFAULT_MIN_TOKENS     = 500;

    /** Costruttore compatto con validazione. */
    public ChunkingConfig {
        if (targetChunkTokens <= 0) {
            throw new ValidationException("targetChunkTokens deve essere > 0 (ricevuto: " + targetChunkTokens + ")");
        }
        if (overlapTokens < 0) {
            throw new ValidationException("overlapTokens deve essere >= 0 (ricevuto: " + overlapTokens + ")");
        }
        if (overlapTokens >= targetChunkTokens) {
            throw new ValidationException(
                    "overlapTokens (" + overlapTokens + ") deve essere < targetChunkTokens (" + targetChunkTokens + ")");
        }
        if (minChunkTokens < 0 || minChunkTokens > targetChunkTokens) {
            throw new ValidationException(
                    "minChunkTokens (" + minChunkTokens + ") deve essere tra 0 e targetChunkTokens (" + targetChunkTokens + ")");
        }
    }

    public static ChunkingConfig defaults() {
        return new ChunkingConfig(DEFAULT_TARGET_TOKENS, DEFAULT_OVERLAP_TOKENS, DEFAULT_MIN_TOKENS, true, true);
    }

    /**
     * Applica i valori di una richiesta sopra questa configurazione; i null mantengono
     * il valore corrente. Overlap e minimo non indicati vengono ridotti entro il nuovo target.
     */
    public ChunkingConfig override(Integer target, Integer overlap, Integer min,
                                   Boolean preserve, Boolean semantic) {
        if (target == null && overlap == null && min == null && preserve == null && semantic == null) {
            return this;
        }
        int t = target != null ? target : targetChunkTokens;
        int o = overlap != null ? overlap : Math.min(overlapTokens, Math.max(0, t - 1));
        int m = min != null ? min : Math.min(minChunkTokens, t);
        return new ChunkingConfig(t, o, m,
                preserve != null ? preserve : preserveBoundaries,
                semantic != null ? semantic : semanticMode);
    }
}
