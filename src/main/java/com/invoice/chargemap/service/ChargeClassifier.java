package com.invoice.chargemap.service;

import com.invoice.chargemap.model.ChargeOutcome;
import com.invoice.chargemap.model.ChargeRule;
import com.invoice.chargemap.model.LineItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Resolves a line to a standardized charge type with the curated pattern rules.
 *
 * Vendor scope is a hard filter: a rule for another vendor is never considered,
 * however well its pattern matches. Among the remaining rules the first one in
 * (priority, declaration) order whose pattern is found in the text wins.
 */
@Service
@Slf4j
public class ChargeClassifier {

    /**
     * @param rules charge rules sorted by {@link ChargeRule#EVALUATION_ORDER}
     * @return the winning rule's outcome, or the unclassified outcome; never null
     */
    public ChargeOutcome classify(LineItem item, String normalizedText, List<ChargeRule> rules) {
        if (normalizedText == null || normalizedText.isEmpty()) {
            return ChargeOutcome.unclassified();
        }

        String vendor = item.getVendorName();
        for (ChargeRule rule : rules) {
            if (!rule.getScope().appliesTo(vendor)) continue;

            if (rule.getPattern().matcher(normalizedText).find()) {
                log.trace("Rule #{} ({}) matched '{}' for vendor {}",
                        rule.getRuleId(), rule.getChargeType(), normalizedText, vendor);
                return ChargeOutcome.matched(rule);
            }
        }

        log.debug("No charge rule matched '{}' for vendor {}", normalizedText, vendor);
        return ChargeOutcome.unclassified();
    }
}
