package it.aw.hybridsearch.controller;

import it.aw.hybridsearch.exception.ValidationException;

import java.util.Map;

/**
 * Risoluzione del tenant di una richiesta: header {@value #HEADER} oppure campo della richiesta.
 * Il valore è già autorizzato a monte e viene solo verificato per coerenza.
 */
final class Tenants {

    static final String HEADER = "X-Tenant-Id";

    private Tenants() {}

    static String resolve(String header, String field) {
        boolean hasHeader = header != null && !header.isBlank();
        boolean hasField = field != null && !field.isBlank();
        if (hasHeader && hasField && !header.equals(field)) {
            throw new ValidationException("tenantId della richiesta diverso dall'header " + HEADER,
                    Map.of("header", header, "field", field));
        }
        if (hasHeader) return header;
        if (hasField) return field;
        throw new ValidationException("tenantId obbligatorio (header " + HEADER + " o campo tenantId)");
    }
}
