package it.aw.hybridsearch.store;

import it.aw.hybridsearch.model.Chunk;
import it.aw.hybridsearch.model.DocumentKey;
import it.aw.hybridsearch.model.DocumentMetadata;
import it.aw.hybridsearch.model.EmbeddingRecord;
import it.aw.hybridsearch.model.SearchFilters;
import it.aw.hybridsearch.model.SearchResult;

import java.util.List;
import java.util.Set;

/**
 * Persistenza delle tuple (chunk, vettore, metadati) e ricerca per similarità.
 * <p>
 * Il tenantId è un predicato obbligatorio di ogni lettura: nessuna query può
 * restituire record salvati per un altro tenant.
 */
public interface VectorStore {

    /** Inserisce o sostituisce il vettore di un chunk (chiave: tenant, documento, chunkId). */
    void store(String tenantId, String documentId, Chunk chunk, float[] vector, DocumentMetadata metadata);

    /** Come {@link #store} per più chunk dello stesso documento, in un'unica transazione. */
    void storeAll(String tenantId, String documentId, List<VectorEntry> entries, DocumentMetadata metadata);

    /**
     * Chunk più simili al vettore, in ordine di score decrescente.
     * Lo score è la similarità coseno riportata in [0, 1].
     */
    List<SearchResult> query(String tenantId, float[] vector, SearchFilters filters, int topK, double minScore);

    /**
     * Annulla la query in esecuzione sul thread indicato, se ce n'è una.
     *
     * @return true se una query è stata annullata
     */
    boolean cancelQuery(Thread worker);

    /** Record salvati per un documento, in ordine di sequenceIndex. */
    List<EmbeddingRecord> records(String tenantId, String documentId);

    /** Rimuove i vettori di un documento. Idempotente: restituisce 0 se non c'era nulla. */
    int delete(String tenantId, String documentId);

    int deleteTenant(String tenantId);

    Set<DocumentKey> documentKeys();

    long countChunks();

    int countTenants();
}
