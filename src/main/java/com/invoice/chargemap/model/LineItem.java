package com.invoice.chargemap.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * One invoice line as handed over by the extraction step. Never mutated:
 * classification wraps it in a {@link ClassifiedLineItem}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LineItem {

    String vendorName;
    String accountIdentifier;
    String invoiceNumber;
    String rawDescription;
    BigDecimal amount;
    BigDecimal quantity;
    BigDecimal unitPrice;
    String serviceDate;                // as printed on the invoice

    // Whole OCR mention of the line; equipment/material fall back to it
    String fullText;
}
