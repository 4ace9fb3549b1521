package it.aw.hybridsearch.model;

import it.aw.hybridsearch.exception.ValidationException;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Filtri di una ricerca. Il tenantId è obbligatorio: una query senza tenant
 * viene rifiutata, mai completata con un valore di default.
 */
public record SearchFilters(String tenantId,
                            String documentId,
                            List<String> documentIds,
                            List<String> categoryTags,
                            DateRange dateRange) {

    public SearchFilters {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("tenantId obbligatorio per ogni ricerca");
        }
        documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
        categoryTags = categoryTags == null ? List.of() : List.copyOf(categoryTags);
    }

    public static SearchFilters forTenant(String tenantId) {
        return new SearchFilters(tenantId, null, null, null, null);
    }

    /**
     * Rappresentazione con ordine stabile (chiavi e liste ordinate),
     * usata per derivare la chiave di cache.
     */
    public Map<String, Object> canonical() {
        Map<String, Object> map = new TreeMap<>();
        map.put("tenantId", tenantId);
        if (documentId != null) map.put("documentId", documentId);
        if (!documentIds.isEmpty()) map.put("documentIds", new TreeSet<>(documentIds));
        if (!categoryTags.isEmpty()) map.put("categoryTags", new TreeSet<>(categoryTags));
        if (dateRange != null) {
            map.put("dateFrom", dateRange.from() == null ? null : dateRange.from().toString());
            map.put("dateTo", dateRange.to() == null ? null : dateRange.to().toString());
        }
        return map;
    }
}
