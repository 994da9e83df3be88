package com.invoice.chargemap.service;

import com.invoice.chargemap.config.ChargeMappingProperties;
import com.invoice.chargemap.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Stream;

/**
 * Top-level pipeline: normalize → extract equipment/material → classify
 * charge → resolve service, one line at a time.
 *
 * Each line is a pure function of its input and the snapshot, so a batch may
 * run on a parallel stream. The snapshot is taken once per batch.
 */
@Service
@Slf4j
public class LineItemClassificationService {

    private final RuleTableService ruleTableService;
    private final TokenNormalizer normalizer;
    private final AliasExtractor aliasExtractor;
    private final ChargeClassifier chargeClassifier;
    private final ServiceDisambiguator disambiguator;
    private final ChargeMappingProperties properties;

    public LineItemClassificationService(RuleTableService ruleTableService,
                                         TokenNormalizer normalizer,
                                         AliasExtractor aliasExtractor,
                                         ChargeClassifier chargeClassifier,
                                         ServiceDisambiguator disambiguator,
                                         ChargeMappingProperties properties) {
        this.ruleTableService = ruleTableService;
        this.normalizer = normalizer;
        this.aliasExtractor = aliasExtractor;
        this.chargeClassifier = chargeClassifier;
        this.disambiguator = disambiguator;
        this.properties = properties;
    }

    public ClassifiedLineItem classify(LineItem item) {
        return classify(item, ruleTableService.current());
    }

    public ClassificationBatchResult classifyAll(List<LineItem> items) {
        RuleSnapshot snapshot = ruleTableService.current();

        ChargeMappingProperties.Batch batch = properties.getBatch();
        boolean parallel = batch.isParallelEnabled() && items.size() >= batch.getParallelThreshold();
        Stream<LineItem> stream = parallel ? items.parallelStream() : items.stream();

        // toList() keeps encounter order on a parallel stream too
        List<ClassifiedLineItem> classified = stream
                .map(item -> classify(item, snapshot))
                .toList();

        ClassificationReport report = ClassificationReport.summarize(
                classified, properties.getReport().getUnclassifiedSampleLimit());

        log.info("Classified {} lines against rules v{}{}: {} vendor-specific, {} default, {} unclassified, {} ambiguous",
                classified.size(), snapshot.getVersion(), parallel ? " (parallel)" : "",
                report.getVendorSpecificMatches(), report.getDefaultMatches(),
                report.getUnclassifiedLines(), report.getAmbiguousServices());

        return new ClassificationBatchResult(snapshot.getVersion(), classified, report);
    }

    public DocumentClassificationResult classifyDocument(InvoiceDocument document) {
        ClassificationBatchResult batch = classifyAll(document.getLineItems());
        return DocumentClassificationResult.of(document, batch);
    }

    ClassifiedLineItem classify(LineItem item, RuleSnapshot snapshot) {
        String normalized = normalizer.normalize(description(item));

        String equipment = extractWithFallback(normalized, item, snapshot.getEquipmentAliases());
        String material = extractWithFallback(normalized, item, snapshot.getMaterialAliases());

        ChargeOutcome charge = chargeClassifier.classify(item, normalized, snapshot.getChargeRules());
        ServiceResolution resolution = disambiguator.resolve(
                item.getAccountIdentifier(), equipment, material, snapshot.getServiceMap());

        log.debug("'{}' -> equipment={}, material={}, charge={} [{}], service={} {}",
                normalized, equipment, material, charge.getChargeType(), charge.getMatchTier(),
                resolution.getStatus(), resolution.getCandidateServiceIds());

        return ClassifiedLineItem.builder()
                .lineItem(item)
                .normalizedText(normalized)
                .parsedEquipment(equipment)
                .parsedMaterial(material)
                .chargeType(charge.getChargeType())
                .serviceType(charge.getServiceType())
                .matchTier(charge.getMatchTier())
                .matchedRuleId(charge.getRuleId())
                .resolution(resolution.getStatus())
                .resolvedServiceId(resolution.getServiceId())
                .candidateServiceIds(resolution.getCandidateServiceIds())
                .build();
    }

    /** The raw description, or the cleaned OCR text when the line has none. */
    private String description(LineItem item) {
        String raw = item.getRawDescription();
        if ((raw == null || raw.isBlank()) && item.getFullText() != null) {
            return normalizer.cleanDescription(item.getFullText());
        }
        return raw;
    }

    /**
     * The description first; when it yields nothing, the whole OCR text of the line.
     */
    private String extractWithFallback(String normalized, LineItem item, List<AliasRule> rules) {
        String label = aliasExtractor.extract(normalized, rules);
        if (ClassifiedLineItem.UNCLASSIFIED.equals(label) && item.getFullText() != null) {
            label = aliasExtractor.extract(normalizer.normalize(item.getFullText()), rules);
        }
        return label;
    }
}
