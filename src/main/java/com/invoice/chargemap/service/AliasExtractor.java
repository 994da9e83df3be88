package com.invoice.chargemap.service;

import com.invoice.chargemap.model.AliasRule;
import com.invoice.chargemap.model.ClassifiedLineItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps normalized line text to a canonical equipment or material label.
 *
 * Rules are tried strictly in table order and the first rule with any matching
 * expression wins; there is no scoring. Overlapping aliases are therefore
 * resolved by putting the narrower one first ("SPLIT BODY 28YD" before "28YD").
 */
@Service
@Slf4j
public class AliasExtractor {

    private static final Pattern GROUP_REFERENCE = Pattern.compile("\\$(\\d)");

    /**
     * Returns the label of the first matching rule, or
     * {@link ClassifiedLineItem#UNCLASSIFIED} when nothing matches.
     */
    public String extract(String normalizedText, List<AliasRule> rules) {
        if (normalizedText == null || normalizedText.isEmpty()) {
            return ClassifiedLineItem.UNCLASSIFIED;
        }

        for (AliasRule rule : rules) {
            for (Pattern expression : rule.getMatchExpressions()) {
                Matcher m = expression.matcher(normalizedText);
                if (m.find()) {
                    String label = expandLabel(rule.getCanonicalLabel(), m);
                    log.trace("'{}' matched alias #{} -> {}", normalizedText, rule.getSourceId(), label);
                    return label;
                }
            }
        }
        return ClassifiedLineItem.UNCLASSIFIED;
    }

    // ─── LABEL TEMPLATES ───────────────────────────────────────────────

    /**
     * Substitutes $1..$9 with the groups of the match. A reference to a group
     * the expression does not have, or one that did not participate, becomes "".
     */
    static String expandLabel(String template, Matcher match) {
        if (template.indexOf('$') < 0) return template;

        Matcher ref = GROUP_REFERENCE.matcher(template);
        StringBuilder label = new StringBuilder();
        while (ref.find()) {
            int group = Integer.parseInt(ref.group(1));
            String value = group <= match.groupCount() ? match.group(group) : null;
            ref.appendReplacement(label, Matcher.quoteReplacement(value == null ? "" : value.trim()));
        }
        ref.appendTail(label);
        return label.toString().trim();
    }
}
