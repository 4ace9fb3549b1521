package it.aw.hybridsearch.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import it.aw.hybridsearch.model.HybridResult;
import it.aw.hybridsearch.model.SearchFilters;
import it.aw.hybridsearch.model.SearchOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Cache dei risultati di ricerca, limitata in durata (TTL) e in numero di voci.
 * <p>
 * Chiave: SHA-256 del JSON canonico (chiavi ordinate) di query normalizzata, filtri e opzioni
 * effettive. Le voci scadute vengono rimosse da un task periodico avviato da {@link #start()}
 * e fermato da {@link #close()}; a capacità piena si elimina la voce più vecchia per creazione.
 * <p>
 * Tutti gli accessi alla tabella passano dal monitor dell'istanza, sweep compreso.
 * I chiamanti ricevono sempre copie, mai le liste interne.
 */
public class ResultCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    public static final int MIN_QUERY_LENGTH = 3;
    public static final int MAX_QUERY_LENGTH = 500;

    /**
     * @param ttl           durata di default delle voci
     * @param sweepInterval intervallo della pulizia periodica
     * @param maxEntries    numero massimo di voci
     * @param maxResults    oltre questo numero di risultati la query non viene messa in cache
     */
    public record Settings(Duration ttl, Duration sweepInterval, int maxEntries, int maxResults) {

        public Settings {
            if (maxEntries < 1) throw new IllegalArgumentException("maxEntries deve essere >= 1 (ricevuto: " + maxEntries + ")");
            if (ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("ttl deve essere positivo");
        }

        public static Settings defaults() {
            return new Settings(Duration.ofMinutes(5), Duration.ofMinutes(2), 1000, 100);
        }
    }

    private final Settings settings;
    private final Clock clock;
    private final ObjectMapper keyMapper;
    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();

    private ScheduledExecutorService sweeper;
    private long hits;
    private long misses;

    public ResultCache(Settings settings, Clock clock, ObjectMapper objectMapper) {
        this.settings = settings;
        this.clock = clock;
        this.keyMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    // -------------------------------------------------------------------------
    // Chiavi
    // -------------------------------------------------------------------------

    public static String normalize(String query) {
        return query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
    }

    /** Chiave stabile: query che differiscono solo per maiuscole o spazi esterni collidono. */
    public String keyFor(String query, SearchFilters filters, SearchOptions options) {
        Map<String, Object> signature = new TreeMap<>();
        signature.put("query", normalize(query));
        signature.put("filters", filters.canonical());
        signature.put("options", options.canonical());
        try {
            byte[] json = keyMapper.writeValueAsBytes(signature);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Impossibile calcolare la chiave di cache", e);
        }
    }

    public boolean isCacheable(String query, List<HybridResult> results) {
        int length = normalize(query).length();
        return length >= MIN_QUERY_LENGTH && length <= MAX_QUERY_LENGTH && results.size() <= settings.maxResults();
    }

    // -------------------------------------------------------------------------
    // Get / Put
    // -------------------------------------------------------------------------

    /** Risultati ancora validi per la chiave, oppure vuoto. Una voce scaduta conta come miss. */
    public synchronized Optional<List<HybridResult>> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(List.copyOf(entry.results()));
    }

    public void put(String key, String tenantId, List<HybridResult> results) {
        put(key, tenantId, results, settings.ttl());
    }

    /** Inserisce o sostituisce la voce; a capacità piena elimina la più vecchia. */
    public synchronized void put(String key, String tenantId, List<HybridResult> results, Duration ttl) {
        if (results.size() > settings.maxResults()) {
            log.debug("Risultati non messi in cache: {} oltre il limite di {}", results.size(), settings.maxResults());
            return;
        }
        entries.remove(key);
        if (entries.size() >= settings.maxEntries()) {
            Iterator<String> oldest = entries.keySet().iterator();
            String evicted = oldest.next();
            oldest.remove();
            log.debug("Cache piena: eliminata la voce {}", evicted);
        }
        entries.put(key, new CacheEntry(key, tenantId, results, clock.instant(), ttl));
    }

    // -------------------------------------------------------------------------
    // Pulizia
    // -------------------------------------------------------------------------

    /** Rimuove le voci scadute. @return numero di voci rimosse */
    public synchronized int cleanup() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Cache: rimosse {} voci scadute, {} rimanenti", removed, entries.size());
        }
        return removed;
    }

    /** Elimina le voci del tenant (dopo indicizzazione o cancellazione di un suo documento). */
    public synchronized int invalidateTenant(String tenantId) {
        int before = entries.size();
        entries.values().removeIf(entry -> entry.tenantId().equals(tenantId));
        return before - entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long hits() {
        return hits;
    }

    public synchronized long misses() {
        return misses;
    }

    // -------------------------------------------------------------------------
    // Ciclo di vita dello sweep
    // -------------------------------------------------------------------------

    public synchronized void start() {
        if (sweeper != null) return;
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "result-cache-sweeper");
            t.setDaemon(true);
            return t;
        });
        long interval = settings.sweepInterval().toMillis();
        sweeper.scheduleWithFixedDelay(this::sweep, interval, interval, TimeUnit.MILLISECONDS);
        log.info("ResultCache: pulizia ogni {} ms, TTL {} ms, max {} voci",
                interval, settings.ttl().toMillis(), settings.maxEntries());
    }

    private void sweep() {
        try {
            cleanup();
        } catch (RuntimeException e) {
            log.warn("Pulizia cache fallita: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        ScheduledExecutorService toStop;
        synchronized (this) {
            toStop = sweeper;
            sweeper = null;
        }
        if (toStop != null) {
            toStop.shutdownNow();
            log.info("ResultCache: pulizia periodica fermata");
        }
    }
}
