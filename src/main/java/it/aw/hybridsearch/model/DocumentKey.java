package it.aw.hybridsearch.model;

/** Coppia (tenant, documento) che identifica un documento indicizzato. */
public record DocumentKey(String tenantId, String documentId) {}
