package it.aw.hybridsearch.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.hybridsearch.exception.StoreException;
import it.aw.hybridsearch.exception.ValidationException;
import it.aw.hybridsearch.model.Chunk;
import it.aw.hybridsearch.model.DocumentKey;
import it.aw.hybridsearch.model.DocumentMetadata;
import it.aw.hybridsearch.model.EmbeddingRecord;
import it.aw.hybridsearch.model.SearchFilters;
import it.aw.hybridsearch.model.SearchResult;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link VectorStore} su DuckDB: i vettori stanno in una colonna {@code FLOAT[]} della tabella
 * {@code chunk_vectors} e la similarità è calcolata con {@code list_cosine_similarity}.
 * <p>
 * Il componente usa una propria connessione duplicata dalla connessione radice;
 * l'accesso è sincronizzato (DuckDBConnection non è thread-safe).
 * <p>
 * La tabella non ha chiave primaria: l'upsert è DELETE + INSERT nella stessa transazione,
 * perché DuckDB verifica i vincoli di unicità prima della fine della transazione.
 */
@Component
public class DuckDbVectorStore implements VectorStore {

    private static final Logger log = LoggerFactory.getLogger(DuckDbVectorStore.class);

    private static final String CREATE_VECTORS = """
            CREATE TABLE IF NOT EXISTS chunk_vectors (
                tenant_id     VARCHAR   NOT NULL,
                document_id   VARCHAR   NOT NULL,
                chunk_index   INTEGER   NOT NULL,
                chunk_id      VARCHAR   NOT NULL,
                content       VARCHAR   NOT NULL,
                keywords      VARCHAR   NOT NULL,
                metadata      VARCHAR   NOT NULL,
                embedding     FLOAT[]   NOT NULL,
                document_date DATE,
                created_at    TIMESTAMP NOT NULL
            )
            """;

    private static final String CREATE_TAGS = """
            CREATE TABLE IF NOT EXISTS document_tags (
                tenant_id   VARCHAR NOT NULL,
                document_id VARCHAR NOT NULL,
                tag         VARCHAR NOT NULL
            )
            """;

    private static final String INSERT_VECTOR = """
            INSERT INTO chunk_vectors
                (tenant_id, document_id, chunk_index, chunk_id, content, keywords, metadata, embedding, document_date, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, CAST(string_split(?, ',') AS FLOAT[]), CAST(? AS DATE), current_timestamp)
            """;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> METADATA_MAP = new TypeReference<>() {};

    private final DuckDBConnection rootConnection;
    private final ObjectMapper objectMapper;
    /** Query di ricerca in corso, per thread: {@link #cancelQuery} le raggiunge senza il monitor. */
    private final Map<Thread, Statement> runningQueries = new ConcurrentHashMap<>();
    private Connection conn;

    public DuckDbVectorStore(DuckDBConnection rootConnection, ObjectMapper objectMapper) {
        this.rootConnection = rootConnection;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    void init() throws SQLException {
        conn = rootConnection.duplicate();
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_VECTORS);
            stmt.execute(CREATE_TAGS);
        }
        log.info("DuckDbVectorStore: tabelle 'chunk_vectors' e 'document_tags' pronte");
    }

    @PreDestroy
    void close() {
        try {
            if (conn != null && !conn.isClosed()) conn.close();
        } catch (SQLException e) {
            log.warn("Errore chiusura connessione DuckDB vector store: {}", e.getMessage());
        }
    }

    // -------------------------------------------------------------------------
    // Scrittura
    // -------------------------------------------------------------------------

    @Override
    public void store(String tenantId, String documentId, Chunk chunk, float[] vector, DocumentMetadata metadata) {
        storeAll(tenantId, documentId, List.of(new VectorEntry(chunk, vector)), metadata);
    }

    @Override
    public synchronized void storeAll(String tenantId, String documentId, List<VectorEntry> entries,
                                      DocumentMetadata metadata) {
        if (entries.isEmpty()) return;
        try {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement delete = conn.prepareStatement(
                        "DELETE FROM chunk_vectors WHERE tenant_id = ? AND document_id = ? AND chunk_id = ?");
                     PreparedStatement insert = conn.prepareStatement(INSERT_VECTOR)) {
                    for (VectorEntry entry : entries) {
                        Chunk chunk = entry.chunk();
                        delete.setString(1, tenantId);
                        delete.setString(2, documentId);
                        delete.setString(3, chunk.id());
                        delete.executeUpdate();

                        insert.setString(1, tenantId);
                        insert.setString(2, documentId);
                        insert.setInt(3, chunk.sequenceIndex());
                        insert.setString(4, chunk.id());
                        insert.setString(5, chunk.text());
                        insert.setString(6, objectMapper.writeValueAsString(chunk.extractedKeywords()));
                        insert.setString(7, objectMapper.writeValueAsString(metadata.forChunk(chunk)));
                        insert.setString(8, vectorLiteral(entry.vector()));
                        if (metadata.documentDate() != null) {
                            insert.setString(9, metadata.documentDate().toString());
                        } else {
                            insert.setNull(9, Types.VARCHAR);
                        }
                        insert.executeUpdate();
                    }
                }
                replaceTags(tenantId, documentId, metadata.tags());
                conn.commit();
            } catch (SQLException | JsonProcessingException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new StoreException("Errore salvataggio vettori del documento " + documentId,
                    Map.of("tenantId", tenantId, "documentId", documentId), e);
        }
        log.debug("Salvati {} vettori per {}/{}", entries.size(), tenantId, documentId);
    }

    private void replaceTags(String tenantId, String documentId, List<String> tags) throws SQLException {
        try (PreparedStatement delete = conn.prepareStatement(
                "DELETE FROM document_tags WHERE tenant_id = ? AND document_id = ?")) {
            delete.setString(1, tenantId);
            delete.setString(2, documentId);
            delete.executeUpdate();
        }
        if (tags.isEmpty()) return;
        try (PreparedStatement insert = conn.prepareStatement(
                "INSERT INTO document_tags (tenant_id, document_id, tag) VALUES (?, ?, ?)")) {
            for (String tag : new LinkedHashSet<>(tags)) {
                insert.setString(1, tenantId);
                insert.setString(2, documentId);
                insert.setString(3, tag);
                insert.executeUpdate();
            }
        }
    }

    // -------------------------------------------------------------------------
    // Ricerca
    // -------------------------------------------------------------------------

    @Override
    public synchronized List<SearchResult> query(String tenantId, float[] vector, SearchFilters filters,
                                                 int topK, double minScore) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("tenantId obbligatorio per interrogare il vector store");
        }
        if (filters != null && !tenantId.equals(filters.tenantId())) {
            throw new ValidationException("tenantId dei filtri diverso da quello della query");
        }
        List<Object> params = new ArrayList<>();
        StringBuilder where = new StringBuilder("tenant_id = ? AND len(embedding) = ?");
        params.add(vectorLiteral(vector));
        params.add(tenantId);
        params.add(vector.length);
        if (filters != null) {
            if (filters.documentId() != null) {
                where.append(" AND document_id = ?");
                params.add(filters.documentId());
            }
            if (!filters.documentIds().isEmpty()) {
                where.append(" AND document_id IN (").append(placeholders(filters.documentIds().size())).append(')');
                params.addAll(filters.documentIds());
            }
            if (!filters.categoryTags().isEmpty()) {
                where.append(" AND document_id IN (SELECT document_id FROM document_tags WHERE tenant_id = ? AND tag IN (")
                        .append(placeholders(filters.categoryTags().size())).append("))");
                params.add(tenantId);
                params.addAll(filters.categoryTags());
            }
            if (filters.dateRange() != null && filters.dateRange().from() != null) {
                where.append(" AND document_date >= CAST(? AS DATE)");
                params.add(filters.dateRange().from().toString());
            }
            if (filters.dateRange() != null && filters.dateRange().to() != null) {
                where.append(" AND document_date <= CAST(? AS DATE)");
                params.add(filters.dateRange().to().toString());
            }
        }
        params.add(minScore);
        params.add(topK);

        String sql = """
                SELECT * FROM (
                    SELECT document_id, chunk_id, chunk_index, content, keywords, metadata,
                           LEAST(GREATEST(COALESCE(list_cosine_similarity(embedding, CAST(string_split(?, ',') AS FLOAT[])), 0), 0), 1) AS score
                    FROM chunk_vectors
                    WHERE %s
                ) candidates
                WHERE score >= ?
                ORDER BY score DESC, document_id, chunk_index
                LIMIT ?
                """.formatted(where);

        Thread worker = Thread.currentThread();
        if (worker.isInterrupted()) {
            throw new StoreException("Ricerca vettoriale annullata prima dell'esecuzione", Map.of("tenantId", tenantId));
        }
        List<SearchResult> results = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            runningQueries.put(worker, ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(new SearchResult(
                            rs.getString("document_id"),
                            rs.getString("chunk_id"),
                            rs.getInt("chunk_index"),
                            rs.getString("content"),
                            rs.getDouble("score"),
                            objectMapper.readValue(rs.getString("keywords"), STRING_LIST),
                            objectMapper.readValue(rs.getString("metadata"), METADATA_MAP)));
                }
            }
        } catch (SQLException | IOException e) {
            throw new StoreException("Errore ricerca vettoriale", Map.of("tenantId", tenantId), e);
        } finally {
            runningQueries.remove(worker);
        }
        return results;
    }

    /** Non sincronizzato: deve poter interrompere la query che detiene il monitor. */
    @Override
    public boolean cancelQuery(Thread worker) {
        Statement statement = runningQueries.get(worker);
        if (statement == null) {
            return false;
        }
        try {
            statement.cancel();
            log.info("DuckDbVectorStore: query annullata sul thread {}", worker.getName());
            return true;
        } catch (SQLException e) {
            log.warn("DuckDbVectorStore: annullamento query fallito sul thread {}: {}", worker.getName(), e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized List<EmbeddingRecord> records(String tenantId, String documentId) {
        List<EmbeddingRecord> records = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT chunk_id, chunk_index, CAST(embedding AS VARCHAR) AS embedding_text " +
                "FROM chunk_vectors WHERE tenant_id = ? AND document_id = ? ORDER BY chunk_index")) {
            ps.setString(1, tenantId);
            ps.setString(2, documentId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    float[] vector = objectMapper.readValue(rs.getString("embedding_text"), float[].class);
                    records.add(new EmbeddingRecord(rs.getString("chunk_id"), rs.getInt("chunk_index"),
                            vector, documentId, tenantId));
                }
            }
        } catch (SQLException | IOException e) {
            throw new StoreException("Errore lettura vettori del documento " + documentId,
                    Map.of("tenantId", tenantId, "documentId", documentId), e);
        }
        return records;
    }

    // -------------------------------------------------------------------------
    // Cancellazione
    // -------------------------------------------------------------------------

    @Override
    public synchronized int delete(String tenantId, String documentId) {
        try (PreparedStatement vectors = conn.prepareStatement(
                "DELETE FROM chunk_vectors WHERE tenant_id = ? AND document_id = ?");
             PreparedStatement tags = conn.prepareStatement(
                     "DELETE FROM document_tags WHERE tenant_id = ? AND document_id = ?")) {
            vectors.setString(1, tenantId);
            vectors.setString(2, documentId);
            int removed = vectors.executeUpdate();
            tags.setString(1, tenantId);
            tags.setString(2, documentId);
            tags.executeUpdate();
            return removed;
        } catch (SQLException e) {
            throw new StoreException("Errore cancellazione vettori del documento " + documentId,
                    Map.of("tenantId", tenantId, "documentId", documentId), e);
        }
    }

    @Override
    public synchronized int deleteTenant(String tenantId) {
        try (PreparedStatement vectors = conn.prepareStatement("DELETE FROM chunk_vectors WHERE tenant_id = ?");
             PreparedStatement tags = conn.prepareStatement("DELETE FROM document_tags WHERE tenant_id = ?")) {
            vectors.setString(1, tenantId);
            int removed = vectors.executeUpdate();
            tags.setString(1, tenantId);
            tags.executeUpdate();
            return removed;
        } catch (SQLException e) {
            throw new StoreException("Errore cancellazione vettori del tenant " + tenantId,
                    Map.of("tenantId", tenantId), e);
        }
    }

    // -------------------------------------------------------------------------
    // Statistiche
    // -------------------------------------------------------------------------

    @Override
    public synchronized Set<DocumentKey> documentKeys() {
        Set<DocumentKey> keys = new LinkedHashSet<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT DISTINCT tenant_id, document_id FROM chunk_vectors ORDER BY tenant_id, document_id")) {
            while (rs.next()) keys.add(new DocumentKey(rs.getString(1), rs.getString(2)));
        } catch (SQLException e) {
            throw new StoreException("Errore lettura documenti del vector store", e);
        }
        return keys;
    }

    @Override
    public synchronized long countChunks() {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM chunk_vectors")) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Errore conteggio chunk", e);
        }
    }

    @Override
    public synchronized int countTenants() {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(DISTINCT tenant_id) FROM chunk_vectors")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Errore conteggio tenant", e);
        }
    }

    // -------------------------------------------------------------------------

    /** Vettore come lista "f1,f2,..." convertita lato SQL con string_split + CAST. */
    static String vectorLiteral(float[] vector) {
        if (vector.length == 0) {
            throw new ValidationException("vettore vuoto");
        }
        StringBuilder sb = new StringBuilder(vector.length * 10);
        for (int i = 0; i < vector.length; i++) {
            if (!Float.isFinite(vector[i])) {
                throw new ValidationException("vettore con valori non finiti in posizione " + i);
            }
            if (i > 0) sb.append(',');
            sb.append(vector[i]);
        }
        return sb.toString();
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object value = params.get(i);
            if (value instanceof Integer v) ps.setInt(i + 1, v);
            else if (value instanceof Double v) ps.setDouble(i + 1, v);
            else ps.setString(i + 1, (String) value);
        }
    }
}
