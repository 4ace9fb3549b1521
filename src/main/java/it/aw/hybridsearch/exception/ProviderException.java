package it.aw.hybridsearch.exception;

import java.util.Map;

/** Chiamata al provider di embedding fallita, in modo transitorio o definitivo. */
public class ProviderException extends HybridSearchException {

    private final ProviderErrorKind kind;

    public ProviderException(ProviderErrorKind kind, String message) {
        this(kind, message, null);
    }

    public ProviderException(ProviderErrorKind kind, String message, Throwable cause) {
        super("PROVIDER_ERROR", message, 502, Map.of("kind", kind.name(), "retryable", kind.isRetryable()), cause);
        this.kind = kind;
    }

    public ProviderErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
