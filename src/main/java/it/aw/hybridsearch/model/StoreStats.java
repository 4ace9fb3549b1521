package it.aw.hybridsearch.model;

/**
 * Statistiche aggregate esposte da GET /api/documents/stats.
 */
public record StoreStats(
        int totalDocuments,
        long totalChunks,
        int tenants,
        String embeddingModel,
        int dimensions,
        int cachedQueries,
        long cacheHits,
        long cacheMisses
) {}
