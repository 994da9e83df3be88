package com.invoice.chargemap.model;

import lombok.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
public class DocumentClassificationResult {

    private String vendorName;
    private String accountNumber;
    private String invoiceNumber;
    private String invoiceDate;
    private BigDecimal totalAmount;
    private long snapshotVersion;
    private List<ClassifiedLineItem> items = new ArrayList<>();
    private ClassificationReport report;
    private List<String> warnings = new ArrayList<>();
    private String status = "SUCCESS";

    public static DocumentClassificationResult of(InvoiceDocument document, ClassificationBatchResult batch) {
        DocumentClassificationResult r = new DocumentClassificationResult();
        r.vendorName = document.getVendorName();
        r.accountNumber = document.getAccountNumber();
        r.invoiceNumber = document.getInvoiceNumber();
        r.invoiceDate = document.getInvoiceDate();
        r.totalAmount = document.getTotalAmount();
        r.snapshotVersion = batch.getSnapshotVersion();
        r.items = batch.getItems();
        r.report = batch.getReport();
        if (r.items.isEmpty()) {
            r.status = "EMPTY";
            r.warnings.add("Document contains no line items");
        }
        return r;
    }

    public static DocumentClassificationResult error(String reason) {
        DocumentClassificationResult r = new DocumentClassificationResult();
        r.status = "ERROR";
        r.warnings.add(reason);
        return r;
    }
}
