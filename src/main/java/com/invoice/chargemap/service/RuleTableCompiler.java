package com.invoice.chargemap.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoice.chargemap.entity.AccountService;
import com.invoice.chargemap.entity.ChargePattern;
import com.invoice.chargemap.entity.ExtractionAlias;
import com.invoice.chargemap.exception.RuleTableException;
import com.invoice.chargemap.model.*;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns the rows of the curated tables into an immutable {@link RuleSnapshot}.
 * Any bad row fails the whole compilation; nothing is skipped.
 */
@Service
public class RuleTableCompiler {

    static final String ALIAS_TABLE = "extraction_aliases";
    static final String CHARGE_TABLE = "charge_patterns";
    static final String SERVICE_TABLE = "account_services";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    /**
     * @param equipment equipment aliases in evaluation order
     * @param material  material aliases in evaluation order
     * @param charges   charge patterns; rows of equal priority must be in declaration order
     */
    public RuleSnapshot compile(long version,
                                List<ExtractionAlias> equipment,
                                List<ExtractionAlias> material,
                                List<ChargePattern> charges,
                                List<AccountService> services) {
        return RuleSnapshot.builder()
                .version(version)
                .loadedAt(Instant.now())
                .equipmentAliases(compileAliases(equipment))
                .materialAliases(compileAliases(material))
                .chargeRules(compileChargeRules(charges))
                .serviceMap(compileServiceMap(services))
                .build();
    }

    // ─── ALIASES ───────────────────────────────────────────────────────

    List<AliasRule> compileAliases(List<ExtractionAlias> rows) {
        List<AliasRule> rules = new ArrayList<>(rows.size());
        Set<String> labels = new HashSet<>();

        for (ExtractionAlias row : rows) {
            if (isBlank(row.getCanonicalLabel())) {
                throw new RuleTableException(ALIAS_TABLE, row.getId(), "canonical_label is blank");
            }
            if (!labels.add(row.getKind() + "|" + row.getCanonicalLabel().trim())) {
                throw new RuleTableException(ALIAS_TABLE, row.getId(),
                        "duplicate " + row.getKind() + " label '" + row.getCanonicalLabel() + "'");
            }
            List<String> expressions = parseExpressions(row);
            if (expressions.isEmpty()) {
                throw new RuleTableException(ALIAS_TABLE, row.getId(), "no match_expressions");
            }

            List<Pattern> compiled = new ArrayList<>(expressions.size());
            for (String expression : expressions) {
                compiled.add(compilePattern(ALIAS_TABLE, row.getId(), expression));
            }
            rules.add(new AliasRule(row.getId(), row.getCanonicalLabel().trim(), List.copyOf(compiled)));
        }
        return List.copyOf(rules);
    }

    // ─── CHARGE RULES ──────────────────────────────────────────────────

    List<ChargeRule> compileChargeRules(List<ChargePattern> rows) {
        List<ChargeRule> rules = new ArrayList<>(rows.size());
        long sequence = 0;

        for (ChargePattern row : rows) {
            if (isBlank(row.getChargeType())) {
                throw new RuleTableException(CHARGE_TABLE, row.getId(), "charge_type is blank");
            }
            rules.add(ChargeRule.builder()
                    .ruleId(row.getId())
                    .scope(VendorScope.of(row.getVendorName()))
                    .pattern(compilePattern(CHARGE_TABLE, row.getId(), row.getInvoicePattern()))
                    .chargeType(row.getChargeType().trim())
                    .serviceType(isBlank(row.getServiceType()) ? null : row.getServiceType().trim())
                    .priority(row.getPriority())
                    .sequence(sequence++)
                    .sampleCount(row.getSampleCount())
                    .build());
        }

        rules.sort(ChargeRule.EVALUATION_ORDER);
        return List.copyOf(rules);
    }

    // ─── SERVICE MAP ───────────────────────────────────────────────────

    AccountServiceMap compileServiceMap(List<AccountService> rows) {
        List<AccountServiceMap.Entry> entries = new ArrayList<>(rows.size());
        Set<String> keys = new HashSet<>();

        for (AccountService row : rows) {
            if (isBlank(row.getAccountIdentifier()) || isBlank(row.getEquipmentLabel())
                    || isBlank(row.getMaterialLabel())) {
                throw new RuleTableException(SERVICE_TABLE, row.getId(), "incomplete composite key");
            }
            if (isBlank(row.getServiceId())) {
                throw new RuleTableException(SERVICE_TABLE, row.getId(), "service_id is blank");
            }
            String key = AccountServiceMap.key(row.getAccountIdentifier()) + "|"
                    + AccountServiceMap.key(row.getEquipmentLabel()) + "|"
                    + AccountServiceMap.key(row.getMaterialLabel());
            if (!keys.add(key)) {
                throw new RuleTableException(SERVICE_TABLE, row.getId(), "duplicate key " + key);
            }
            entries.add(new AccountServiceMap.Entry(
                    row.getAccountIdentifier().trim(),
                    row.getEquipmentLabel().trim(),
                    row.getMaterialLabel().trim(),
                    row.getServiceId().trim()));
        }
        return AccountServiceMap.of(entries);
    }

    // ─── HELPERS ───────────────────────────────────────────────────────

    private static List<String> parseExpressions(ExtractionAlias row) {
        String json = row.getMatchExpressions();
        if (isBlank(json)) return List.of();
        try {
            List<String> expressions = MAPPER.readValue(json, STRING_LIST);
            return expressions == null ? List.of() : expressions;
        } catch (JsonProcessingException e) {
            throw new RuleTableException(ALIAS_TABLE, row.getId(),
                    "match_expressions is not a JSON array of strings: " + json, e);
        }
    }

    private static Pattern compilePattern(String table, Long rowId, String regex) {
        if (isBlank(regex)) {
            throw new RuleTableException(table, rowId, "blank pattern");
        }
        try {
            return Pattern.compile(regex, FLAGS);
        } catch (PatternSyntaxException e) {
            throw new RuleTableException(table, rowId, "invalid pattern '" + regex + "': " + e.getDescription(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
