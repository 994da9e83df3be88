package com.invoice.chargemap.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * One billed service on an account. An account can carry several of these,
 * one per physical container / material contract.
 */
@Entity
@Table(name = "account_services",
       uniqueConstraints = @UniqueConstraint(
               columnNames = {"account_identifier", "equipment_label", "material_label"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountService {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_identifier", nullable = false)
    private String accountIdentifier;

    @Column(name = "equipment_label", nullable = false)
    private String equipmentLabel;     // '30YD Compactor'

    @Column(name = "material_label", nullable = false)
    private String materialLabel;      // 'Trash', 'OCC'

    @Column(name = "service_id", nullable = false)
    private String serviceId;
}
