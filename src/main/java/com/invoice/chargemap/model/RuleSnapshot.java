package com.invoice.chargemap.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Everything a classification run reads, compiled once and never mutated.
 * A reload publishes a new snapshot instead of changing this one.
 */
@Value
@Builder
public class RuleSnapshot {

    long version;
    Instant loadedAt;
    List<AliasRule> equipmentAliases;
    List<AliasRule> materialAliases;

    /** Already sorted by {@link ChargeRule#EVALUATION_ORDER}. */
    List<ChargeRule> chargeRules;

    AccountServiceMap serviceMap;
}
