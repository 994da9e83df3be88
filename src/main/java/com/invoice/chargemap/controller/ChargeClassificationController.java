package com.invoice.chargemap.controller;

import com.invoice.chargemap.exception.RuleTablesNotLoadedException;
import com.invoice.chargemap.model.ClassificationBatchResult;
import com.invoice.chargemap.model.DocumentClassificationResult;
import com.invoice.chargemap.model.InvoiceDocument;
import com.invoice.chargemap.model.LineItem;
import com.invoice.chargemap.service.DocumentAiLineItemParser;
import com.invoice.chargemap.service.LineItemClassificationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api/charges")
@Slf4j
public class ChargeClassificationController {

    private final LineItemClassificationService classificationService;
    private final DocumentAiLineItemParser documentParser;

    public ChargeClassificationController(LineItemClassificationService classificationService,
                                          DocumentAiLineItemParser documentParser) {
        this.classificationService = classificationService;
        this.documentParser = documentParser;
    }

    /**
     * Classifies already-extracted line items. Lines no rule covers come back
     * as "unclassified" and are counted in the report; they are not errors.
     */
    @PostMapping("/classify")
    public ResponseEntity<ClassificationBatchResult> classify(@RequestBody List<LineItem> items) {
        return ResponseEntity.ok(classificationService.classifyAll(items));
    }

    /**
     * Upload one Document AI invoice JSON. Header and line items are read from
     * the entities, then every line is classified.
     */
    @PostMapping("/classify/document")
    public ResponseEntity<DocumentClassificationResult> classifyDocument(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "vendor", required = false) String vendor) {

        if (file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded document is empty");
        }

        try {
            String json = new String(file.getBytes(), StandardCharsets.UTF_8);
            InvoiceDocument document = documentParser.parse(json, vendor);
            return ResponseEntity.ok(classificationService.classifyDocument(document));
        } catch (IllegalArgumentException | RuleTablesNotLoadedException e) {
            throw e;
        } catch (Exception e) {
            log.error("Classification failed for {}", file.getOriginalFilename(), e);
            return ResponseEntity.internalServerError()
                    .body(DocumentClassificationResult.error(e.getMessage()));
        }
    }
}
