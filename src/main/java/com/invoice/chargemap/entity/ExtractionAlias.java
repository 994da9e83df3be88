package com.invoice.chargemap.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * One canonical equipment or material label and the regexes that recognise it.
 *
 * Rows of one kind are evaluated in sort_order (then id) and the first row with
 * any matching expression wins, so narrower patterns must sort before broad ones:
 *
 *   10  28YD Split Body   ["\\bSPLIT\\s*BODY\\s*28\\s*YD\\b"]
 *   20  $1YD Compactor    ["\\b(\\d+)\\s*YA?RD?S?\\s*(COMPACTOR|COMP)\\b"]
 *   90  $1YD              ["\\b(\\d+)\\s*YA?RD?S?\\b"]
 *
 * A label may reference capture groups of the matching expression as $1..$9.
 */
@Entity
@Table(name = "extraction_aliases",
       uniqueConstraints = @UniqueConstraint(columnNames = {"kind", "canonical_label"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionAlias {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AliasKind kind;

    @Column(name = "canonical_label", nullable = false)
    private String canonicalLabel;

    @Column(name = "match_expressions", nullable = false, length = 2000)
    private String matchExpressions;   // JSON array of regexes, parsed when the tables are compiled

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    public enum AliasKind { EQUIPMENT, MATERIAL }
}
