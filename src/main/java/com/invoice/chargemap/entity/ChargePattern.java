package com.invoice.chargemap.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * A curated (vendor, invoice pattern) → charge type rule.
 *
 * The table is append-only: declaration order is the id order, and rules are
 * evaluated by priority ascending, then id ascending.
 */
@Entity
@Table(name = "charge_patterns")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChargePattern {

    public static final int VENDOR_PRIORITY = 1;
    public static final int DEFAULT_PRIORITY = 99;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** NULL means the rule applies to any vendor. */
    @Column(name = "vendor_name")
    private String vendorName;

    @Column(name = "invoice_pattern", nullable = false, length = 500)
    private String invoicePattern;

    @Column(name = "charge_type", nullable = false)
    private String chargeType;

    @Column(name = "service_type")
    private String serviceType;        // 'Recurring', 'On Call', ...

    @Column(nullable = false)
    private int priority;

    // Provenance only: how many joined invoice lines backed this rule
    @Column(name = "sample_count", nullable = false)
    private int sampleCount;
}
