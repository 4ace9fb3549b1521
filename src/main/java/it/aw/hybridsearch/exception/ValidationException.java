package it.aw.hybridsearch.exception;

import java.util.Map;

/** Input non valido: filtri malformati, tenantId mancante, opzioni incoerenti. */
public class ValidationException extends HybridSearchException {

    public ValidationException(String message) {
        this(message, Map.of());
    }

    public ValidationException(String message, Map<String, Object> details) {
        super("VALIDATION_ERROR", message, 400, details);
    }
}
