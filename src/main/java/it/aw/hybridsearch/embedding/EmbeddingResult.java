package it.aw.hybridsearch.embedding;

import it.aw.hybridsearch.exception.ProviderErrorKind;

import java.util.List;

/**
 * Esito di una chiamata al provider: {@code ok(vectors)} oppure {@code err(kind, detail)}.
 * I fallimenti attesi (timeout, rate limit, quota) viaggiano come valore, non come eccezione.
 */
public record EmbeddingResult(List<float[]> vectors, ProviderErrorKind errorKind, String detail) {

    public static EmbeddingResult ok(List<float[]> vectors) {
        return new EmbeddingResult(List.copyOf(vectors), null, null);
    }

    public static EmbeddingResult err(ProviderErrorKind kind, String detail) {
        return new EmbeddingResult(List.of(), kind, detail);
    }

    public boolean isOk() {
        return errorKind == null;
    }
}
