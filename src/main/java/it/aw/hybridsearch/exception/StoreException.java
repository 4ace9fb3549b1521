package it.aw.hybridsearch.exception;

import java.util.Map;

/** Operazione sul database DuckDB (vettori o registry) fallita. */
public class StoreException extends HybridSearchException {

    public StoreException(String message, Map<String, Object> details) {
        this(message, details, null);
    }

    public StoreException(String message, Throwable cause) {
        this(message, Map.of(), cause);
    }

    public StoreException(String message, Map<String, Object> details, Throwable cause) {
        super("STORE_ERROR", message, 500, details, cause);
    }
}
