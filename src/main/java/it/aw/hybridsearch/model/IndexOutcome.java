package it.aw.hybridsearch.model;

/**
 * Esito per documento di un'indicizzazione multipla: embeddingSet valorizzato
 * in caso di successo, altrimenti codice e messaggio dell'errore.
 */
public record IndexOutcome(String documentId, String tenantId, DocumentEmbeddingSet embeddingSet,
                           String errorCode, String errorMessage) {

    public static IndexOutcome success(DocumentEmbeddingSet set) {
        return new IndexOutcome(set.documentId(), set.tenantId(), set, null, null);
    }

    public static IndexOutcome failure(String documentId, String tenantId, String errorCode, String errorMessage) {
        return new IndexOutcome(documentId, tenantId, null, errorCode, errorMessage);
    }

    public boolean succeeded() {
        return embeddingSet != null;
    }
}
