package com.invoice.chargemap.model;

import lombok.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Header and line items read from one Document AI invoice JSON.
 */
@Data
public class InvoiceDocument {

    private String accountNumber;
    private String invoiceNumber;
    private String invoiceDate;
    private String vendorName;
    private String locationCode;
    private String serviceAddress;
    private BigDecimal totalAmount;
    private List<LineItem> lineItems = new ArrayList<>();
}
