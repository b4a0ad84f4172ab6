package com.tradestore.api.controller;

import com.tradestore.domain.model.TableSchemaReport;
import com.tradestore.service.SchemaInspectionService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** {@code GET /api/schema} -- per-table drift report against the expected column set. */
@RestController
@RequestMapping("/api/schema")
public class SchemaController {

    private final SchemaInspectionService schemaInspectionService;

    public SchemaController(SchemaInspectionService schemaInspectionService) {
        this.schemaInspectionService = schemaInspectionService;
    }

    @GetMapping
    public ResponseEntity<List<TableSchemaReport>> report() {
        return ResponseEntity.ok(schemaInspectionService.inspect());
    }
}
