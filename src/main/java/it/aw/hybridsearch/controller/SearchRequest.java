package it.aw.hybridsearch.controller;

import java.time.LocalDate;
import java.util.List;

/**
 * Corpo di POST /api/search. Tutto tranne {@code query} è opzionale; il tenant può
 * arrivare anche dall'header X-Tenant-Id.
 *
 * @param explain se true ogni risultato riporta la spiegazione del punteggio
 */
public record SearchRequest(
        String query,
        String tenantId,
        String documentId,
        List<String> documentIds,
        List<String> categoryTags,
        LocalDate dateFrom,
        LocalDate dateTo,
        Integer topK,
        Double minScore,
        Boolean hybridSearch,
        Double vectorWeight,
        Double keywordWeight,
        List<String> keywords,
        Double keywordBoost,
        Boolean enableBm25,
        Boolean explain
) {}
