package it.aw.hybridsearch.controller;

import it.aw.hybridsearch.service.IndexingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * DELETE /api/tenants/{tenantId}: rimuove tutti i documenti e i vettori del tenant.
 *
 * Esempio:
 *   curl -X DELETE http://localhost:8889/api/tenants/acme
 */
@RestController
@RequestMapping("/api/tenants")
public class TenantController {

    private final IndexingService indexingService;

    public TenantController(IndexingService indexingService) {
        this.indexingService = indexingService;
    }

    @DeleteMapping("/{tenantId}")
    public ResponseEntity<Map<String, Object>> deleteTenant(@PathVariable String tenantId) {
        int documents = indexingService.deleteTenant(tenantId);
        return ResponseEntity.ok(Map.of("tenantId", tenantId, "documentsRemoved", documents));
    }
}
