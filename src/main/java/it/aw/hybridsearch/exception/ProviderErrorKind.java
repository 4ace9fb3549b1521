package it.aw.hybridsearch.exception;

/**
 * Classificazione dei fallimenti del provider di embedding.
 * I primi tre tipi sono transitori e vengono ritentati dal BatchEmbedder.
 */
public enum ProviderErrorKind {
    TIMEOUT(true),
    NETWORK(true),
    RATE_LIMIT(true),
    INVALID_INPUT(false),
    QUOTA(false),
    INVALID_RESPONSE(false),
    UNEXPECTED(false);

    private final boolean retryable;

    ProviderErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
