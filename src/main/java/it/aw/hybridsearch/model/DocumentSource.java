package it.aw.hybridsearch.model;

/** Documento pronto per l'indicizzazione, già associato al suo tenant. */
public record DocumentSource(String documentId, String tenantId, String text, DocumentMetadata metadata) {

    public DocumentSource {
        metadata = metadata == null ? DocumentMetadata.empty() : metadata;
    }
}
