package com.invoice.chargemap.model;

import lombok.Value;

import java.time.Instant;

@Value
public class RuleTableSummary {

    long version;
    Instant loadedAt;
    int equipmentAliases;
    int materialAliases;
    int vendorSpecificRules;
    int defaultRules;
    int serviceEntries;
    int accounts;

    public static RuleTableSummary of(RuleSnapshot snapshot) {
        int defaults = (int) snapshot.getChargeRules().stream()
                .filter(rule -> rule.getScope().isWildcard())
                .count();
        return new RuleTableSummary(
                snapshot.getVersion(),
                snapshot.getLoadedAt(),
                snapshot.getEquipmentAliases().size(),
                snapshot.getMaterialAliases().size(),
                snapshot.getChargeRules().size() - defaults,
                defaults,
                snapshot.getServiceMap().size(),
                snapshot.getServiceMap().accountCount());
    }
}
