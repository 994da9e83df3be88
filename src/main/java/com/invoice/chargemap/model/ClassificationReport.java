package com.invoice.chargemap.model;

import lombok.*;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Aggregates over one classified batch, used to decide where the rule tables
 * need new patterns: which vendors leave lines unclassified, and which
 * accounts cannot be mapped to a single service.
 */
@Data
public class ClassificationReport {

    static final String UNKNOWN_VENDOR = "(unknown vendor)";
    static final String NO_ACCOUNT = "(no account)";

    private int totalLines;
    private int vendorSpecificMatches;
    private int defaultMatches;
    private int unclassifiedLines;
    private int resolvedServices;
    private int ambiguousServices;
    private int unresolvedServices;
    private double coverage;                          // % of lines with a charge type
    private Map<String, Long> unclassifiedByVendor = new TreeMap<>();
    private Map<String, Long> ambiguousByAccount = new TreeMap<>();
    private Map<String, Long> notFoundByAccount = new TreeMap<>();
    private Map<String, List<DescriptionCount>> topUnclassifiedDescriptions = new TreeMap<>();

    public static ClassificationReport summarize(List<ClassifiedLineItem> items, int sampleLimit) {
        ClassificationReport report = new ClassificationReport();
        report.totalLines = items.size();

        Map<String, Map<String, DescriptionTally>> unclassifiedTallies = new TreeMap<>();

        for (ClassifiedLineItem item : items) {
            LineItem line = item.getLineItem();
            String vendor = orDefault(line.getVendorName(), UNKNOWN_VENDOR);
            String account = orDefault(line.getAccountIdentifier(), NO_ACCOUNT);

            switch (item.getMatchTier()) {
                case VENDOR_SPECIFIC -> report.vendorSpecificMatches++;
                case DEFAULT -> report.defaultMatches++;
                case UNCLASSIFIED -> {
                    report.unclassifiedLines++;
                    report.unclassifiedByVendor.merge(vendor, 1L, Long::sum);
                    unclassifiedTallies
                            .computeIfAbsent(vendor, v -> new HashMap<>())
                            .computeIfAbsent(item.getNormalizedText(), d -> new DescriptionTally())
                            .add(line.getAmount());
                }
            }

            switch (item.getResolution()) {
                case RESOLVED -> report.resolvedServices++;
                case AMBIGUOUS -> {
                    report.ambiguousServices++;
                    report.ambiguousByAccount.merge(account, 1L, Long::sum);
                }
                case NOT_FOUND -> {
                    report.unresolvedServices++;
                    report.notFoundByAccount.merge(account, 1L, Long::sum);
                }
            }
        }

        unclassifiedTallies.forEach((vendor, tallies) ->
                report.topUnclassifiedDescriptions.put(vendor, topDescriptions(tallies, sampleLimit)));

        int classified = report.vendorSpecificMatches + report.defaultMatches;
        report.coverage = report.totalLines == 0 ? 0.0 : (classified * 100.0) / report.totalLines;
        return report;
    }

    private static List<DescriptionCount> topDescriptions(Map<String, DescriptionTally> tallies, int limit) {
        return tallies.entrySet().stream()
                .map(e -> new DescriptionCount(e.getKey(), e.getValue().count, e.getValue().totalAmount))
                .sorted(Comparator.comparingLong(DescriptionCount::getCount).reversed()
                        .thenComparing(DescriptionCount::getDescription))
                .limit(Math.max(limit, 0))
                .collect(Collectors.toList());
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    @Value
    public static class DescriptionCount {
        String description;
        long count;
        BigDecimal totalAmount;
    }

    private static final class DescriptionTally {
        private long count;
        private BigDecimal totalAmount = BigDecimal.ZERO;

        void add(BigDecimal amount) {
            count++;
            if (amount != null) {
                totalAmount = totalAmount.add(amount);
            }
        }
    }
}
