package it.aw.hybridsearch.controller;

import java.time.LocalDate;
import java.util.List;

/** Corpo di POST /api/documents/index: più documenti dello stesso tenant. */
public record BatchIndexRequest(String tenantId, List<Item> documents, Boolean forceReprocess) {

    public record Item(String documentId, String text, List<String> tags,
                       List<String> categoryIdentifiers, LocalDate documentDate) {}
}
