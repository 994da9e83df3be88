package com.invoice.chargemap.service;

import com.invoice.chargemap.entity.ChargePattern;
import com.invoice.chargemap.fixtures.TestFixtures;
import com.invoice.chargemap.model.ChargeOutcome;
import com.invoice.chargemap.model.ChargeRule;
import com.invoice.chargemap.model.ClassifiedLineItem;
import com.invoice.chargemap.model.MatchTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static com.invoice.chargemap.fixtures.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ChargeClassifier Tests")
class ChargeClassifierTest {

    private final ChargeClassifier classifier = new ChargeClassifier();
    private final RuleTableCompiler compiler = new RuleTableCompiler();

    private List<ChargeRule> rules;

    @BeforeEach
    void setUp() {
        rules = compiler.compileChargeRules(TestFixtures.chargePatterns());
    }

    @Test
    @DisplayName("Should classify through a default rule")
    void shouldMatchDefaultRule() {
        ChargeOutcome outcome = classifier.classify(
                line("Rumpke", ACCOUNT, "x"), "42YD COMPACTOR MONTHLY FEE", rules);

        assertThat(outcome.getChargeType()).isEqualTo("Monthly Service Commercial");
        assertThat(outcome.getServiceType()).isEqualTo("Recurring");
        assertThat(outcome.getMatchTier()).isEqualTo(MatchTier.DEFAULT);
        assertThat(outcome.getRuleId()).isEqualTo(102L);
    }

    @Test
    @DisplayName("Should let a vendor rule win over an earlier-declared default rule")
    void shouldPreferVendorRule() {
        ChargeOutcome outcome = classifier.classify(
                line(LAWRENCE, ACCOUNT, "x"), "30YD COMPACTOR OCC HAUL", rules);

        assertThat(outcome.getChargeType()).isEqualTo("Empty & Return");
        assertThat(outcome.getMatchTier()).isEqualTo(MatchTier.VENDOR_SPECIFIC);
        assertThat(outcome.getRuleId()).isEqualTo(105L);
    }

    @Test
    @DisplayName("Should compare vendor names ignoring case and padding")
    void shouldMatchVendorLoosely() {
        ChargeOutcome outcome = classifier.classify(
                line("  LAWRENCE WASTE ", ACCOUNT, "x"), "HAUL", rules);

        assertThat(outcome.getMatchTier()).isEqualTo(MatchTier.VENDOR_SPECIFIC);
    }

    @Test
    @DisplayName("Should never apply another vendor's rule")
    void shouldIgnoreOtherVendorsRules() {
        List<ChargeRule> vendorOnly = compiler.compileChargeRules(List.of(
                vendorRule(1L, "Boren Brothers LLC", "\\bHAUL\\b", "Swap", "On Call"),
                vendorRule(2L, LAWRENCE, "\\bCOMPACTOR\\b", "Compactor Service", null)));

        ChargeOutcome outcome = classifier.classify(line(LAWRENCE, ACCOUNT, "x"), "30YD HAUL", vendorOnly);

        assertThat(outcome.getMatchTier()).isEqualTo(MatchTier.UNCLASSIFIED);
        assertThat(outcome.getChargeType()).isEqualTo(ClassifiedLineItem.UNCLASSIFIED);
    }

    @Test
    @DisplayName("Should break priority ties by declaration order")
    void shouldBreakTiesByDeclarationOrder() {
        List<ChargeRule> tied = compiler.compileChargeRules(List.of(
                defaultRule(7L, "\\bFEE\\b", "First", null),
                defaultRule(8L, "MONTHLY", "Second", null)));

        assertThat(classifier.classify(line("Any", ACCOUNT, "x"), "MONTHLY FEE", tied).getChargeType())
                .isEqualTo("First");
    }

    @Test
    @DisplayName("Should order by priority value, not by scope")
    void shouldOrderByPriorityValue() {
        ChargePattern promotedDefault = defaultRule(9L, "\\bHAUL\\b", "Promoted Haul", null);
        promotedDefault.setPriority(0);
        List<ChargePattern> rows = new ArrayList<>(TestFixtures.chargePatterns());
        rows.add(promotedDefault);

        ChargeOutcome outcome = classifier.classify(
                line(LAWRENCE, ACCOUNT, "x"), "HAUL", compiler.compileChargeRules(rows));

        assertThat(outcome.getChargeType()).isEqualTo("Promoted Haul");
        assertThat(outcome.getMatchTier()).isEqualTo(MatchTier.DEFAULT);
    }

    @Test
    @DisplayName("Should return unclassified for text no rule covers")
    void shouldReturnUnclassified() {
        ChargeOutcome outcome = classifier.classify(line("Rumpke", ACCOUNT, "x"), "LOCK BAR INSTALL", rules);

        assertThat(outcome).isEqualTo(ChargeOutcome.unclassified());
        assertThat(outcome.getRuleId()).isNull();
        assertThat(classifier.classify(line(null, null, null), "", rules).getMatchTier())
                .isEqualTo(MatchTier.UNCLASSIFIED);
    }

    @Test
    @DisplayName("Should give identical results under concurrent use")
    void shouldBeDeterministicUnderConcurrency() throws Exception {
        List<String> texts = List.of("30YD COMPACTOR OCC HAUL", "MONTHLY FEE", "FUEL", "OCC BALER", "NOTHING");
        List<ChargeOutcome> expected = texts.stream()
                .map(t -> classifier.classify(line(LAWRENCE, ACCOUNT, "x"), t, rules))
                .toList();

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<List<ChargeOutcome>>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(pool.submit(() -> texts.stream()
                        .map(t -> classifier.classify(line(LAWRENCE, ACCOUNT, "x"), t, rules))
                        .toList()));
            }
            for (Future<List<ChargeOutcome>> future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS)).isEqualTo(expected);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
