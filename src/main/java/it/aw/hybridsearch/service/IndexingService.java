package it.aw.hybridsearch.service;

import it.aw.hybridsearch.cache.ResultCache;
import it.aw.hybridsearch.chunking.TextSegmenter;
import it.aw.hybridsearch.embedding.BatchEmbedder;
import it.aw.hybridsearch.exception.HybridSearchException;
import it.aw.hybridsearch.exception.IndexingFailedException;
import it.aw.hybridsearch.exception.ValidationException;
import it.aw.hybridsearch.model.Chunk;
import it.aw.hybridsearch.model.ChunkingConfig;
import it.aw.hybridsearch.model.DocumentEmbeddingSet;
import it.aw.hybridsearch.model.DocumentKey;
import it.aw.hybridsearch.model.DocumentMetadata;
import it.aw.hybridsearch.model.DocumentSource;
import it.aw.hybridsearch.model.EmbeddingRecord;
import it.aw.hybridsearch.model.IndexOutcome;
import it.aw.hybridsearch.model.IndexedDocument;
import it.aw.hybridsearch.model.StoreStats;
import it.aw.hybridsearch.registry.DocumentRegistry;
import it.aw.hybridsearch.service.DocumentParser.ParsedText;
import it.aw.hybridsearch.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Gestisce il ciclo di vita dei documenti indicizzati.
 * <p>
 * Pipeline di {@link #indexDocument}:
 * <ol>
 *   <li>skip se il documento è già nel registry e la re-indicizzazione non è forzata</li>
 *   <li>cancellazione dei vettori precedenti del documento</li>
 *   <li>segmentazione ({@link TextSegmenter})</li>
 *   <li>embedding + store ({@link BatchEmbedder}), con eventuale fallimento parziale</li>
 *   <li>registrazione nel {@link DocumentRegistry} e invalidazione della cache del tenant</li>
 * </ol>
 * Documenti diversi possono essere indicizzati in parallelo sul pool {@code indexingExecutor};
 * i batch di uno stesso documento restano sequenziali.
 */
@Service
public class IndexingService {

    private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

    private final TextSegmenter segmenter;
    private final BatchEmbedder embedder;
    private final VectorStore vectorStore;
    private final DocumentRegistry registry;
    private final ResultCache cache;
    private final ExecutorService indexingExecutor;
    private final ChunkingConfig defaultConfig;
    private final Clock clock;

    public IndexingService(TextSegmenter segmenter,
                           BatchEmbedder embedder,
                           VectorStore vectorStore,
                           DocumentRegistry registry,
                           ResultCache cache,
                           @Qualifier("indexingExecutor") ExecutorService indexingExecutor,
                           ChunkingConfig defaultConfig,
                           Clock clock) {
        this.segmenter = segmenter;
        this.embedder = embedder;
        this.vectorStore = vectorStore;
        this.registry = registry;
        this.cache = cache;
        this.indexingExecutor = indexingExecutor;
        this.defaultConfig = defaultConfig;
        this.clock = clock;
    }

    // -------------------------------------------------------------------------
    // Indicizzazione
    // -------------------------------------------------------------------------

    /**
     * Indicizza un documento.
     *
     * @param config         parametri di segmentazione, null per i default configurati
     * @param forceReprocess se false un documento già indicizzato non viene rielaborato
     * @throws IndexingFailedException se fallisce più della metà dei batch; i vettori
     *                                 già scritti per il documento vengono rimossi
     */
    public DocumentEmbeddingSet indexDocument(DocumentSource source, ChunkingConfig config, boolean forceReprocess) {
        validate(source);
        String tenantId = source.tenantId();
        String documentId = source.documentId();
        ChunkingConfig effective = config != null ? config : defaultConfig;

        Optional<IndexedDocument> existing = registry.find(tenantId, documentId);
        if (existing.isPresent() && !forceReprocess) {
            log.info("Documento {} (tenant {}) già indicizzato, nessuna rielaborazione", documentId, tenantId);
            return fromRegistry(existing.get());
        }

        log.info("Inizio indicizzazione: {} (tenant {}) target={}, overlap={}, force={}",
                documentId, tenantId, effective.targetChunkTokens(), effective.overlapTokens(), forceReprocess);
        int removed = vectorStore.delete(tenantId, documentId);
        if (removed > 0) {
            log.debug("Rimossi {} vettori precedenti di {}", removed, documentId);
        }

        List<Chunk> chunks = segmenter.segment(documentId, source.text(), effective);
        DocumentEmbeddingSet set;
        try {
            set = embedder.embedAndStore(chunks, documentId, tenantId, source.metadata());
        } catch (IndexingFailedException e) {
            vectorStore.delete(tenantId, documentId);
            registry.remove(tenantId, documentId);
            cache.invalidateTenant(tenantId);
            throw e;
        }

        registry.register(IndexedDocument.from(set, effective, LocalDateTime.now(clock)));
        cache.invalidateTenant(tenantId);
        log.info("Indicizzazione completata: {} (tenant {}) {} chunk, {} falliti",
                documentId, tenantId, set.totalChunks(), set.failedChunkIds().size());
        return set;
    }

    /** Indicizzazione asincrona sul pool dei documenti. */
    public CompletableFuture<DocumentEmbeddingSet> indexAsync(DocumentSource source, ChunkingConfig config,
                                                              boolean forceReprocess) {
        return CompletableFuture.supplyAsync(() -> indexDocument(source, config, forceReprocess), indexingExecutor);
    }

    /**
     * Indicizza più documenti in parallelo. L'errore di un documento non interrompe gli altri:
     * finisce nel suo {@link IndexOutcome}.
     */
    public List<IndexOutcome> indexAll(List<DocumentSource> sources, ChunkingConfig config, boolean forceReprocess) {
        List<CompletableFuture<DocumentEmbeddingSet>> futures = new ArrayList<>(sources.size());
        for (DocumentSource source : sources) {
            futures.add(indexAsync(source, config, forceReprocess));
        }
        List<IndexOutcome> outcomes = new ArrayList<>(sources.size());
        for (int i = 0; i < sources.size(); i++) {
            DocumentSource source = sources.get(i);
            try {
                outcomes.add(IndexOutcome.success(futures.get(i).join()));
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                String code = cause instanceof HybridSearchException h ? h.getCode() : "INTERNAL_ERROR";
                log.warn("Indicizzazione di {} fallita: {}", source.documentId(), cause.getMessage());
                outcomes.add(IndexOutcome.failure(source.documentId(), source.tenantId(), code, cause.getMessage()));
            }
        }
        long failed = outcomes.stream().filter(o -> !o.succeeded()).count();
        log.info("Indicizzazione multipla: {} documenti, {} falliti", outcomes.size(), failed);
        return outcomes;
    }

    /**
     * Indicizza un file caricato (PDF o testo). Se documentId è null si usa il nome del file.
     */
    public DocumentEmbeddingSet ingest(MultipartFile file, String tenantId, String documentId,
                                       List<String> tags, LocalDate documentDate,
                                       ChunkingConfig config, boolean forceReprocess) throws IOException {
        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : "unknown";
        String id = documentId != null && !documentId.isBlank() ? documentId : filename;
        ParsedText parsed;
        try (InputStream is = file.getInputStream()) {
            parsed = DocumentParser.parse(is, file.getContentType(), filename);
        }
        log.debug("File {} ({}): {} caratteri, {} pagine", filename, file.getContentType(),
                parsed.text().length(), parsed.pages().size());
        DocumentMetadata metadata = new DocumentMetadata(tags, List.of(), documentDate, parsed.pages());
        return indexDocument(new DocumentSource(id, tenantId, parsed.text(), metadata), config, forceReprocess);
    }

    // -------------------------------------------------------------------------
    // Cancellazione e manutenzione
    // -------------------------------------------------------------------------

    /** Idempotente. @return true se il documento era presente nel registry o nello store */
    public boolean deleteDocument(String tenantId, String documentId) {
        requireTenant(tenantId);
        int vectors = vectorStore.delete(tenantId, documentId);
        boolean registered = registry.remove(tenantId, documentId);
        cache.invalidateTenant(tenantId);
        log.info("Documento {} (tenant {}) rimosso: {} vettori", documentId, tenantId, vectors);
        return registered || vectors > 0;
    }

    /** Rimuove tutti i vettori e le voci di registry del tenant. @return documenti rimossi dal registry */
    public int deleteTenant(String tenantId) {
        requireTenant(tenantId);
        int vectors = vectorStore.deleteTenant(tenantId);
        int documents = registry.removeTenant(tenantId);
        cache.invalidateTenant(tenantId);
        log.info("Tenant {} rimosso: {} documenti, {} vettori", tenantId, documents, vectors);
        return documents;
    }

    /** Rimuove dallo store i vettori di documenti assenti dal registry. @return documenti ripuliti */
    public int cleanupOrphans() {
        Set<DocumentKey> orphans = new LinkedHashSet<>(vectorStore.documentKeys());
        orphans.removeAll(registry.keys());
        for (DocumentKey key : orphans) {
            vectorStore.delete(key.tenantId(), key.documentId());
            cache.invalidateTenant(key.tenantId());
        }
        if (!orphans.isEmpty()) {
            log.warn("Pulizia: rimossi i vettori di {} documenti orfani", orphans.size());
        }
        return orphans.size();
    }

    // -------------------------------------------------------------------------
    // Consultazione
    // -------------------------------------------------------------------------

    public Optional<IndexedDocument> find(String tenantId, String documentId) {
        requireTenant(tenantId);
        return registry.find(tenantId, documentId);
    }

    public List<IndexedDocument> list(String tenantId) {
        requireTenant(tenantId);
        return registry.findByTenant(tenantId);
    }

    public StoreStats stats() {
        return new StoreStats(
                registry.totalDocuments(),
                vectorStore.countChunks(),
                vectorStore.countTenants(),
                embedder.model(),
                embedder.dimensions(),
                cache.size(),
                cache.hits(),
                cache.misses());
    }

    // -------------------------------------------------------------------------

    private DocumentEmbeddingSet fromRegistry(IndexedDocument document) {
        List<EmbeddingRecord> records = vectorStore.records(document.tenantId(), document.documentId());
        Set<String> failed = new LinkedHashSet<>(document.failedChunkIds());
        return DocumentEmbeddingSet.of(document.documentId(), document.tenantId(), document.model(),
                document.dimensions(), records, failed);
    }

    private static void validate(DocumentSource source) {
        if (source == null) {
            throw new ValidationException("Documento mancante");
        }
        requireTenant(source.tenantId());
        if (source.documentId() == null || source.documentId().isBlank()) {
            throw new ValidationException("documentId obbligatorio", Map.of("tenantId", source.tenantId()));
        }
        if (source.text() == null || source.text().isBlank()) {
            throw new ValidationException("Il documento " + source.documentId() + " non contiene testo",
                    Map.of("tenantId", source.tenantId(), "documentId", source.documentId()));
        }
    }

    private static void requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("tenantId obbligatorio");
        }
    }
}
