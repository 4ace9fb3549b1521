package it.aw.hybridsearch.controller;

import java.time.LocalDate;
import java.util.List;

/**
 * Corpo di POST /api/documents/{documentId}/index. I parametri di chunking sono
 * opzionali: se omessi valgono quelli configurati in application.properties.
 */
public record IndexRequest(
        String tenantId,
        String text,
        List<String> tags,
        List<String> categoryIdentifiers,
        LocalDate documentDate,
        Boolean forceReprocess,
        Integer targetTokens,
        Integer overlapTokens,
        Integer minTokens,
        Boolean preserveBoundaries,
        Boolean semanticMode
) {}
