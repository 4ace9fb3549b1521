package it.aw.hybridsearch.model;

import java.util.List;

/** Risultati di una ricerca con l'indicazione della loro provenienza. */
public record SearchOutcome(List<HybridResult> results, Source source) {

    public enum Source {
        /** Calcolati dal retriever in questa richiesta. */
        LIVE,
        /** Serviti dalla cache prima di interrogare il retriever. */
        CACHE,
        /** Serviti dalla cache dopo il superamento della deadline. */
        STALE_FALLBACK
    }

    public SearchOutcome {
        results = List.copyOf(results);
    }
}
