package com.invoice.chargemap.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ClassifiedLineItem {

    /** Stands in for any label or charge type the rules could not determine. */
    public static final String UNCLASSIFIED = "Unclassified";

    LineItem lineItem;
    String normalizedText;
    String parsedEquipment;
    String parsedMaterial;
    String chargeType;
    String serviceType;
    MatchTier matchTier;
    Long matchedRuleId;
    ServiceResolution.Status resolution;
    String resolvedServiceId;
    List<String> candidateServiceIds;

    @JsonIgnore
    public boolean isUnclassified() {
        return matchTier == MatchTier.UNCLASSIFIED;
    }

    @JsonIgnore
    public boolean isAmbiguous() {
        return resolution == ServiceResolution.Status.AMBIGUOUS;
    }
}
