package it.aw.hybridsearch.cache;

import it.aw.hybridsearch.model.HybridResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Voce della cache: risultati di una query per un tenant, con istante di creazione e TTL. */
public record CacheEntry(String key, String tenantId, List<HybridResult> results, Instant createdAt, Duration ttl) {

    public CacheEntry {
        results = List.copyOf(results);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(createdAt.plus(ttl));
    }
}
