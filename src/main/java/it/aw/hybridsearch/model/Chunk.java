package it.aw.hybridsearch.model;

import java.util.List;

/**
 * Porzione contigua del testo di un documento: unità di embedding e di ricerca.
 * <p>
 * {@code text} coincide con {@code documentText.substring(startOffset, endOffset)}.
 * L'id è derivato da (documentId, sequenceIndex), quindi una re-indicizzazione
 * forzata sovrascrive i chunk invece di duplicarli.
 *
 * @param sectionTitle heading attivo all'inizio del chunk, null se il documento non ne ha
 */
public record Chunk(
        String id,
        int sequenceIndex,
        String text,
        int startOffset,
        int endOffset,
        int estimatedTokenCount,
        List<String> extractedKeywords,
        String sectionTitle
) {

    public Chunk {
        extractedKeywords = extractedKeywords == null ? List.of() : List.copyOf(extractedKeywords);
    }

    public static String idFor(String documentId, int sequenceIndex) {
        return documentId + "_chunk_" + sequenceIndex;
    }
}
