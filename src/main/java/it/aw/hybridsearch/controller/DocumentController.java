package it.aw.hybridsearch.controller;

import it.aw.hybridsearch.model.ChunkingConfig;
import it.aw.hybridsearch.model.DocumentMetadata;
import it.aw.hybridsearch.model.DocumentSource;
import it.aw.hybridsearch.model.IndexedDocument;
import it.aw.hybridsearch.model.StoreStats;
import it.aw.hybridsearch.exception.ValidationException;
import it.aw.hybridsearch.service.IndexingService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Espone indicizzazione, consultazione e cancellazione dei documenti.
 *
 * Endpoint disponibili:
 *   POST   /api/documents/{documentId}/index   — indicizza il testo di un documento
 *   POST   /api/documents/index                — indicizza più documenti in parallelo
 *   POST   /api/documents/ingest               — indicizza un file (PDF o testo)
 *   GET    /api/documents                      — documenti indicizzati del tenant
 *   GET    /api/documents/stats                — statistiche aggregate
 *   GET    /api/documents/{documentId}         — dettaglio di un documento
 *   DELETE /api/documents/{documentId}         — rimuove un documento dall'indice
 *   POST   /api/documents/maintenance/cleanup  — rimuove i vettori orfani
 *
 * Il tenant arriva dall'header X-Tenant-Id o dal campo tenantId.
 * Gli errori sono tradotti da GlobalExceptionHandler.
 */
@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    private final IndexingService indexingService;
    private final ChunkingConfig defaultConfig;

    public DocumentController(IndexingService indexingService, ChunkingConfig defaultConfig) {
        this.indexingService = indexingService;
        this.defaultConfig = defaultConfig;
    }

    // -------------------------------------------------------------------------
    // POST /api/documents/{documentId}/index
    // -------------------------------------------------------------------------

    /**
     * Indicizza il testo di un documento. Un documento già indicizzato non viene
     * rielaborato se forceReprocess non è true.
     *
     * Esempio:
     *   curl -X POST http://localhost:8889/api/documents/rfp-2024-17/index \
     *        -H "X-Tenant-Id: acme" -H "Content-Type: application/json" \
     *        -d '{"text": "...", "tags": ["rfp"], "forceReprocess": true}'
     */
    @PostMapping("/{documentId}/index")
    public ResponseEntity<IndexSummary> index(
            @PathVariable String documentId,
            @RequestHeader(value = Tenants.HEADER, required = false) String tenantHeader,
            @RequestBody IndexRequest request) {
        String tenantId = Tenants.resolve(tenantHeader, request.tenantId());
        ChunkingConfig config = defaultConfig.override(request.targetTokens(), request.overlapTokens(),
                request.minTokens(), request.preserveBoundaries(), request.semanticMode());
        DocumentMetadata metadata = new DocumentMetadata(request.tags(), request.categoryIdentifiers(),
                request.documentDate(), List.of());
        DocumentSource source = new DocumentSource(documentId, tenantId, request.text(), metadata);
        return ResponseEntity.ok(IndexSummary.from(
                indexingService.indexDocument(source, config, Boolean.TRUE.equals(request.forceReprocess()))));
    }

    // -------------------------------------------------------------------------
    // POST /api/documents/index
    // -------------------------------------------------------------------------

    /**
     * Indicizza più documenti dello stesso tenant. Il fallimento di un documento
     * compare nel suo esito senza interrompere gli altri.
     */
    @PostMapping("/index")
    public ResponseEntity<List<IndexSummary>> indexAll(
            @RequestHeader(value = Tenants.HEADER, required = false) String tenantHeader,
            @RequestBody BatchIndexRequest request) {
        String tenantId = Tenants.resolve(tenantHeader, request.tenantId());
        if (request.documents() == null || request.documents().isEmpty()) {
            throw new ValidationException("Nessun documento da indicizzare");
        }
        List<DocumentSource> sources = request.documents().stream()
                .map(item -> new DocumentSource(item.documentId(), tenantId, item.text(),
                        new DocumentMetadata(item.tags(), item.categoryIdentifiers(), item.documentDate(), List.of())))
                .toList();
        List<IndexSummary> summaries = indexingService
                .indexAll(sources, defaultConfig, Boolean.TRUE.equals(request.forceReprocess()))
                .stream().map(IndexSummary::from).toList();
        return ResponseEntity.ok(summaries);
    }

    // -------------------------------------------------------------------------
    // POST /api/documents/ingest
    // -------------------------------------------------------------------------

    /**
     * Indicizza un file caricato. Se documentId è omesso si usa il nome del file.
     *
     * Esempio:
     *   curl -X POST "http://localhost:8889/api/documents/ingest?targetTokens=800&overlapTokens=100" \
     *        -H "X-Tenant-Id: acme" -F "file=@bando.pdf" -F "tags=rfp"
     */
    @PostMapping("/ingest")
    public ResponseEntity<IndexSummary> ingest(
            @RequestParam("file") MultipartFile file,
            @RequestHeader(value = Tenants.HEADER, required = false) String tenantHeader,
            @RequestParam(value = "tenantId", required = false) String tenantParam,
            @RequestParam(value = "documentId", required = false) String documentId,
            @RequestParam(value = "tags", required = false) List<String> tags,
            @RequestParam(value = "documentDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate documentDate,
            @RequestParam(value = "targetTokens", required = false) Integer targetTokens,
            @RequestParam(value = "overlapTokens", required = false) Integer overlapTokens,
            @RequestParam(value = "minTokens", required = false) Integer minTokens,
            @RequestParam(value = "forceReprocess", defaultValue = "false") boolean forceReprocess) throws IOException {
        String tenantId = Tenants.resolve(tenantHeader, tenantParam);
        if (file.isEmpty()) {
            throw new ValidationException("File vuoto");
        }
        ChunkingConfig config = defaultConfig.override(targetTokens, overlapTokens, minTokens, null, null);
        return ResponseEntity.ok(IndexSummary.from(
                indexingService.ingest(file, tenantId, documentId, tags, documentDate, config, forceReprocess)));
    }

    // -------------------------------------------------------------------------
    // GET /api/documents
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl -H "X-Tenant-Id: acme" http://localhost:8889/api/documents
     */
    @GetMapping
    public ResponseEntity<List<IndexedDocument>> listDocuments(
            @RequestHeader(value = Tenants.HEADER, required = false) String tenantHeader,
            @RequestParam(value = "tenantId", required = false) String tenantParam) {
        return ResponseEntity.ok(indexingService.list(Tenants.resolve(tenantHeader, tenantParam)));
    }

    // -------------------------------------------------------------------------
    // GET /api/documents/stats
    // -------------------------------------------------------------------------

    /**
     * Statistiche aggregate: documenti, chunk, tenant, modello, stato della cache.
     *
     * Esempio:
     *   curl http://localhost:8889/api/documents/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<StoreStats> stats() {
        return ResponseEntity.ok(indexingService.stats());
    }

    // -------------------------------------------------------------------------
    // GET /api/documents/{documentId}
    // -------------------------------------------------------------------------

    @GetMapping("/{documentId}")
    public ResponseEntity<IndexedDocument> getDocument(
            @PathVariable String documentId,
            @RequestHeader(value = Tenants.HEADER, required = false) String tenantHeader,
            @RequestParam(value = "tenantId", required = false) String tenantParam) {
        return indexingService.find(Tenants.resolve(tenantHeader, tenantParam), documentId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    // -------------------------------------------------------------------------
    // DELETE /api/documents/{documentId}
    // -------------------------------------------------------------------------

    /**
     * Rimuove vettori e voce di registry del documento.
     *
     * Esempio:
     *   curl -X DELETE -H "X-Tenant-Id: acme" http://localhost:8889/api/documents/rfp-2024-17
     */
    @DeleteMapping("/{documentId}")
    public ResponseEntity<Void> deleteDocument(
            @PathVariable String documentId,
            @RequestHeader(value = Tenants.HEADER, required = false) String tenantHeader,
            @RequestParam(value = "tenantId", required = false) String tenantParam) {
        boolean removed = indexingService.deleteDocument(Tenants.resolve(tenantHeader, tenantParam), documentId);
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    // -------------------------------------------------------------------------
    // POST /api/documents/maintenance/cleanup
    // -------------------------------------------------------------------------

    @PostMapping("/maintenance/cleanup")
    public ResponseEntity<Map<String, Integer>> cleanup() {
        return ResponseEntity.ok(Map.of("orphanDocumentsRemoved", indexingService.cleanupOrphans()));
    }
}
