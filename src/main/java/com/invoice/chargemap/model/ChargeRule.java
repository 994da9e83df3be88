package com.invoice.chargemap.model;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.regex.Pattern;

/**
 * Compiled form of one charge_patterns row.
 */
@Value
@Builder
public class ChargeRule {

    /** Total evaluation order: priority, then declaration sequence. */
    public static final Comparator<ChargeRule> EVALUATION_ORDER =
            Comparator.comparingInt(ChargeRule::getPriority)
                    .thenComparingLong(ChargeRule::getSequence);

    Long ruleId;
    VendorScope scope;
    Pattern pattern;
    String chargeType;
    String serviceType;
    int priority;
    long sequence;
    int sampleCount;
}
