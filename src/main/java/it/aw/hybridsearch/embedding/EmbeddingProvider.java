package it.aw.hybridsearch.embedding;

import java.util.List;

/**
 * Provider esterno di embedding. Un vettore per testo, nello stesso ordine.
 */
public interface EmbeddingProvider {

    EmbeddingResult embed(List<String> texts);

    /** Nome del modello, salvato con l'esito dell'indicizzazione. */
    String model();

    int dimensions();

    /** Limite di token per singolo testo accettato dal modello. */
    int maxTokensPerItem();

    /** Numero massimo di testi per chiamata. */
    int maxBatchSize();
}
