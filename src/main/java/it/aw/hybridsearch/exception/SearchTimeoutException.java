package it.aw.hybridsearch.exception;

import java.util.Map;

/** Deadline di ricerca superata e nessun risultato in cache da restituire al suo posto. */
public class SearchTimeoutException extends HybridSearchException {

    public SearchTimeoutException(String tenantId, long timeoutMs) {
        super("SEARCH_TIMEOUT",
                "Ricerca scaduta dopo " + timeoutMs + " ms, riprovare tra qualche istante",
                504,
                Map.of("tenantId", tenantId, "timeoutMs", timeoutMs));
    }
}
