package it.aw.hybridsearch.exception;

import java.util.Map;

/**
 * Radice della gerarchia di errori della pipeline di indicizzazione e ricerca.
 * <p>
 * Ogni errore porta un codice stabile, lo status HTTP con cui viene esposto
 * da {@link GlobalExceptionHandler} e una mappa di dettagli (documentId, tenantId,
 * chunk falliti...) sufficiente a un orchestratore esterno per ritentare.
 */
public class HybridSearchException extends RuntimeException {

    private final String code;
    private final int status;
    private final Map<String, Object> details;

    public HybridSearchException(String code, String message, int status, Map<String, Object> details) {
        this(code, message, status, details, null);
    }

    public HybridSearchException(String code, String message, int status,
                                 Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public String getCode() {
        return code;
    }

    public int getStatus() {
        return status;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
