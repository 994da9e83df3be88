package com.invoice.chargemap.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoice.chargemap.model.InvoiceDocument;
import com.invoice.chargemap.model.LineItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Reads the entity JSON produced by the Document AI invoice processor.
 *
 * Entities sit at the top level or under "document". Header entities are
 * recognised by keywords in their type; each "line_item" entity carries its
 * fields as properties:
 *
 *     { "type": "line_item", "mentionText": "30YD COMPACTOR HAUL 1 185.00",
 *       "properties": [
 *         { "type": "line_item/description", "mentionText": "30YD COMPACTOR HAUL" },
 *         { "type": "line_item/amount", "normalizedValue": { "moneyValue": { "units": "185" } } } ] }
 */
@Service
@Slf4j
public class DocumentAiLineItemParser {

    private static final BigDecimal NANOS = BigDecimal.valueOf(1_000_000_000L);

    private final ObjectMapper objectMapper;
    private final TokenNormalizer normalizer;

    public DocumentAiLineItemParser(ObjectMapper objectMapper, TokenNormalizer normalizer) {
        this.objectMapper = objectMapper;
        this.normalizer = normalizer;
    }

    /**
     * @param json          Document AI output
     * @param vendorOverride used when the document names no supplier; may be null
     * @throws IllegalArgumentException if the input is not JSON
     */
    public InvoiceDocument parse(String json, String vendorOverride) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document is not valid JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode entities = entitiesOf(root);
        InvoiceDocument document = new InvoiceDocument();

        // 1. Header
        for (JsonNode entity : entities) {
            readHeaderEntity(entity, document);
        }
        if (isBlank(document.getVendorName()) && !isBlank(vendorOverride)) {
            document.setVendorName(vendorOverride.trim());
        }

        // 2. Line items
        for (JsonNode entity : entities) {
            if ("line_item".equals(entity.path("type").asText())) {
                LineItem item = readLineItem(entity, document);
                if (item != null) {
                    document.getLineItems().add(item);
                }
            }
        }

        log.info("Parsed invoice {} ({}): {} line items",
                document.getInvoiceNumber(), document.getVendorName(), document.getLineItems().size());
        return document;
    }

    private JsonNode entitiesOf(JsonNode root) {
        if (root.has("entities")) return root.get("entities");
        return root.path("document").path("entities");
    }

    // ─── HEADER ────────────────────────────────────────────────────────

    private void readHeaderEntity(JsonNode entity, InvoiceDocument document) {
        String type = entity.path("type").asText("").toLowerCase(Locale.ROOT);
        String mention = entity.path("mentionText").asText("").trim();

        if (type.contains("account") && type.contains("number")) {
            document.setAccountNumber(mention);
        } else if (type.contains("invoice") && (type.contains("number") || type.contains("id"))) {
            document.setInvoiceNumber(mention);
        } else if (type.contains("invoice") && type.contains("date")) {
            document.setInvoiceDate(mention);
        } else if (type.contains("supplier") || type.contains("vendor")) {
            document.setVendorName(mention);
        } else if (type.contains("location")) {
            document.setLocationCode(mention);
        } else if (type.contains("service") && type.contains("address")) {
            document.setServiceAddress(mention);
        } else if (type.equals("total_amount") || type.equals("amount_due") || type.equals("total_due")) {
            document.setTotalAmount(parseMoney(entity));
        }
    }

    // ─── LINE ITEMS ────────────────────────────────────────────────────

    private LineItem readLineItem(JsonNode entity, InvoiceDocument document) {
        String fullText = entity.path("mentionText").asText("").trim();
        String description = null;
        BigDecimal amount = null;
        BigDecimal quantity = null;
        BigDecimal unitPrice = null;
        String serviceDate = null;

        for (JsonNode prop : entity.path("properties")) {
            String type = prop.path("type").asText("").toLowerCase(Locale.ROOT);

            if (type.contains("description")) {
                description = prop.path("mentionText").asText("").trim();
            } else if (type.equals("line_item/amount")) {
                amount = parseMoney(prop);
            } else if (type.contains("quantity")) {
                quantity = parseQuantity(prop);
            } else if (type.contains("unit_price")) {
                unitPrice = parseMoney(prop);
            } else if (type.contains("date")) {
                serviceDate = prop.path("mentionText").asText("").trim();
            }
        }

        String finalDescription = isBlank(description) ? normalizer.cleanDescription(fullText) : description;
        if (isBlank(finalDescription) && amount == null) {
            log.debug("Skipped line item without description or amount: {}", fullText);
            return null;
        }

        return LineItem.builder()
                .vendorName(document.getVendorName())
                .accountIdentifier(document.getAccountNumber())
                .invoiceNumber(document.getInvoiceNumber())
                .rawDescription(finalDescription)
                .amount(amount)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .serviceDate(serviceDate)
                .fullText(fullText)
                .build();
    }

    // ─── VALUE PARSING ─────────────────────────────────────────────────

    /**
     * moneyValue {units, nanos} when present, otherwise the digits of the mention.
     */
    BigDecimal parseMoney(JsonNode prop) {
        JsonNode money = prop.path("normalizedValue").path("moneyValue");
        if (!money.isMissingNode()) {
            BigDecimal units = parseNumber(money.path("units").asText(""), "[^\\d\\-]");
            BigDecimal nanos = BigDecimal.valueOf(money.path("nanos").asLong(0)).divide(NANOS);
            return (units == null ? BigDecimal.ZERO : units).add(nanos).setScale(2, RoundingMode.HALF_UP);
        }
        return parseNumber(prop.path("mentionText").asText(""), "[^\\d.\\-]");
    }

    private BigDecimal parseQuantity(JsonNode prop) {
        JsonNode floatValue = prop.path("normalizedValue").path("floatValue");
        if (floatValue.isNumber()) {
            return floatValue.decimalValue();
        }
        return parseNumber(prop.path("mentionText").asText(""), ",");
    }

    private BigDecimal parseNumber(String mention, String stripRegex) {
        String digits = mention.replaceAll(stripRegex, "").trim();
        if (digits.isEmpty()) return null;
        try {
            return new BigDecimal(digits);
        } catch (NumberFormatException e) {
            log.debug("Failed to parse '{}' as a number", mention);
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
