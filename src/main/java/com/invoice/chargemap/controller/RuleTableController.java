package com.invoice.chargemap.controller;

import com.invoice.chargemap.model.RuleTableSummary;
import com.invoice.chargemap.service.RuleTableService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/rules")
@Slf4j
public class RuleTableController {

    private final RuleTableService ruleTableService;

    public RuleTableController(RuleTableService ruleTableService) {
        this.ruleTableService = ruleTableService;
    }

    @GetMapping
    public ResponseEntity<RuleTableSummary> current() {
        return ResponseEntity.ok(RuleTableSummary.of(ruleTableService.current()));
    }

    /**
     * Re-reads the curated tables after they were edited. A malformed table is
     * rejected (422) and the rules in use stay unchanged.
     */
    @PostMapping("/reload")
    public ResponseEntity<RuleTableSummary> reload() {
        return ResponseEntity.ok(RuleTableSummary.of(ruleTableService.reload()));
    }
}
