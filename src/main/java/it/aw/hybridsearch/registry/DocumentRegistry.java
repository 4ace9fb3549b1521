package it.aw.hybridsearch.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.hybridsearch.exception.StoreException;
import it.aw.hybridsearch.model.DocumentKey;
import it.aw.hybridsearch.model.IndexedDocument;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.io.IOException;
import java.sql.*;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registro dei documenti indicizzati per tenant, persistito nella tabella
 * {@code indexed_documents} dello stesso file DuckDB che contiene i vettori.
 * <p>
 * È la fonte di verità per lo skip delle re-indicizzazioni non forzate e per la
 * pulizia dei vettori orfani. Connessione propria, accesso sincronizzato.
 * <p>
 * Migrazione schema: se all'avvio mancano colonne richieste la tabella viene ricreata.
 * I documenti esistenti devono essere re-indicizzati.
 */
@Component
public class DocumentRegistry {

    private static final Logger log = LoggerFactory.getLogger(DocumentRegistry.class);

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS indexed_documents (
                tenant_id        VARCHAR   NOT NULL,
                document_id      VARCHAR   NOT NULL,
                model            VARCHAR   NOT NULL,
                dimensions       INTEGER   NOT NULL,
                total_chunks     INTEGER   NOT NULL,
                embedded_chunks  INTEGER   NOT NULL,
                partial_failure  BOOLEAN   NOT NULL,
                failed_chunk_ids VARCHAR   NOT NULL,
                target_tokens    INTEGER   NOT NULL,
                overlap_tokens   INTEGER   NOT NULL,
                indexed_at       TIMESTAMP NOT NULL,
                PRIMARY KEY (tenant_id, document_id)
            )
            """;

    private static final Set<String> REQUIRED_COLUMNS = Set.of(
            "tenant_id", "document_id", "embedded_chunks", "failed_chunk_ids", "target_tokens");

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final DuckDBConnection rootConnection;
    private final ObjectMapper objectMapper;
    private Connection conn;

    public DocumentRegistry(DuckDBConnection rootConnection, ObjectMapper objectMapper) {
        this.rootConnection = rootConnection;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    void init() throws SQLException {
        conn = rootConnection.duplicate();
        migrateIfNeeded();
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE);
        }
        log.info("DocumentRegistry: tabella 'indexed_documents' pronta");
    }

    /** Rileva schema obsoleto e ricrea la tabella se necessario. */
    private void migrateIfNeeded() throws SQLException {
        Set<String> existing = new HashSet<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT column_name FROM information_schema.columns WHERE table_name = 'indexed_documents'")) {
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) existing.add(rs.getString(1));
            }
        }
        if (!existing.isEmpty() && !existing.containsAll(REQUIRED_COLUMNS)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("DROP TABLE IF EXISTS indexed_documents");
            }
            log.warn("DocumentRegistry: schema obsoleto rilevato, tabella 'indexed_documents' ricreata. " +
                     "Re-indicizzare i documenti esistenti.");
        }
    }

    @PreDestroy
    void close() {
        try {
            if (conn != null && !conn.isClosed()) conn.close();
        } catch (SQLException e) {
            log.warn("Errore chiusura connessione DuckDB registry: {}", e.getMessage());
        }
    }

    public synchronized void register(IndexedDocument document) {
        String sql = """
                INSERT INTO indexed_documents
                    (tenant_id, document_id, model, dimensions, total_chunks, embedded_chunks, partial_failure,
                     failed_chunk_ids, target_tokens, overlap_tokens, indexed_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (tenant_id, document_id) DO UPDATE SET
                    model            = EXCLUDED.model,
                    dimensions       = EXCLUDED.dimensions,
                    total_chunks     = EXCLUDED.total_chunks,
                    embedded_chunks  = EXCLUDED.embedded_chunks,
                    partial_failure  = EXCLUDED.partial_failure,
                    failed_chunk_ids = EXCLUDED.failed_chunk_ids,
                    target_tokens    = EXCLUDED.target_tokens,
                    overlap_tokens   = EXCLUDED.overlap_tokens,
                    indexed_at       = EXCLUDED.indexed_at
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, document.tenantId());
            ps.setString(2, document.documentId());
            ps.setString(3, document.model());
            ps.setInt(4, document.dimensions());
            ps.setInt(5, document.totalChunks());
            ps.setInt(6, document.embeddedChunks());
            ps.setBoolean(7, document.partialFailure());
            ps.setString(8, objectMapper.writeValueAsString(document.failedChunkIds()));
            ps.setInt(9, document.targetChunkTokens());
            ps.setInt(10, document.overlapTokens());
            ps.setTimestamp(11, Timestamp.valueOf(document.indexedAt()));
            ps.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new StoreException("Errore salvataggio documento nel registry",
                    Map.of("tenantId", document.tenantId(), "documentId", document.documentId()), e);
        }
    }

    public synchronized Optional<IndexedDocument> find(String tenantId, String documentId) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM indexed_documents WHERE tenant_id = ? AND document_id = ?")) {
            ps.setString(1, tenantId);
            ps.setString(2, documentId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(toDocument(rs));
            }
        } catch (SQLException | IOException e) {
            throw new StoreException("Errore lettura documento dal registry",
                    Map.of("tenantId", tenantId, "documentId", documentId), e);
        }
        return Optional.empty();
    }

    public synchronized List<IndexedDocument> findByTenant(String tenantId) {
        List<IndexedDocument> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM indexed_documents WHERE tenant_id = ? ORDER BY indexed_at DESC, document_id")) {
            ps.setString(1, tenantId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) result.add(toDocument(rs));
            }
        } catch (SQLException | IOException e) {
            throw new StoreException("Errore lettura registry", Map.of("tenantId", tenantId), e);
        }
        return result;
    }

    public synchronized Set<DocumentKey> keys() {
        Set<DocumentKey> keys = new LinkedHashSet<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT tenant_id, document_id FROM indexed_documents")) {
            while (rs.next()) keys.add(new DocumentKey(rs.getString(1), rs.getString(2)));
        } catch (SQLException e) {
            throw new StoreException("Errore lettura chiavi del registry", e);
        }
        return keys;
    }

    /** @return true se il documento era presente */
    public synchronized boolean remove(String tenantId, String documentId) {
        try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM indexed_documents WHERE tenant_id = ? AND document_id = ?")) {
            ps.setString(1, tenantId);
            ps.setString(2, documentId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Errore rimozione documento dal registry",
                    Map.of("tenantId", tenantId, "documentId", documentId), e);
        }
    }

    public synchronized int removeTenant(String tenantId) {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM indexed_documents WHERE tenant_id = ?")) {
            ps.setString(1, tenantId);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Errore rimozione tenant dal registry", Map.of("tenantId", tenantId), e);
        }
    }

    public synchronized int totalDocuments() {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM indexed_documents")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Errore conteggio documenti", e);
        }
    }

    private IndexedDocument toDocument(ResultSet rs) throws SQLException, IOException {
        return new IndexedDocument(
                rs.getString("tenant_id"),
                rs.getString("document_id"),
                rs.getString("model"),
                rs.getInt("dimensions"),
                rs.getInt("total_chunks"),
                rs.getInt("embedded_chunks"),
                rs.getBoolean("partial_failure"),
                objectMapper.readValue(rs.getString("failed_chunk_ids"), STRING_LIST),
                rs.getInt("target_tokens"),
                rs.getInt("overlap_tokens"),
                rs.getTimestamp("indexed_at").toLocalDateTime()
        );
    }
}
