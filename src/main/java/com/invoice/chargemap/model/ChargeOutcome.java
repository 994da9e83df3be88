package com.invoice.chargemap.model;

import lombok.Value;

@Value
public class ChargeOutcome {

    private static final ChargeOutcome UNCLASSIFIED =
            new ChargeOutcome(ClassifiedLineItem.UNCLASSIFIED, null, MatchTier.UNCLASSIFIED, null);

    String chargeType;
    String serviceType;
    MatchTier matchTier;
    Long ruleId;

    public static ChargeOutcome matched(ChargeRule rule) {
        MatchTier tier = rule.getScope().isWildcard() ? MatchTier.DEFAULT : MatchTier.VENDOR_SPECIFIC;
        return new ChargeOutcome(rule.getChargeType(), rule.getServiceType(), tier, rule.getRuleId());
    }

    public static ChargeOutcome unclassified() {
        return UNCLASSIFIED;
    }
}
