package com.invoice.chargemap.service;

import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalises invoice text before any pattern is applied, so that
 * "30 Yd. Compactor -- Haul" and "30 YD COMPACTOR HAUL" look alike.
 */
@Service
public class TokenNormalizer {

    private static final Pattern UNICODE_DASH = Pattern.compile("[\\u2010-\\u2015\\u2212]");
    private static final Pattern NON_DECIMAL_PERIOD = Pattern.compile("(?<!\\d)\\.|\\.(?!\\d)");
    private static final Pattern HYPHEN_RUN = Pattern.compile("-{2,}");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

    // cleanDescription
    private static final Pattern DATE = Pattern.compile("\\d{1,2}[/\\-]\\d{1,2}[/\\-]\\d{2,4}");
    private static final Pattern MONEY = Pattern.compile("\\$?\\d+\\.\\d{2}\\b");
    private static final Pattern DECIMAL = Pattern.compile("\\b\\d+\\.\\d+\\b");
    private static final Pattern TRAILING_NUMBER = Pattern.compile("\\s+\\d+\\s*$");
    private static final Pattern EDGE_NOISE = Pattern.compile("^[\\s-]+|[\\s-]+$");

    /**
     * Upper-cases, unifies dashes, drops periods that are not decimal points,
     * turns hyphen runs into a space and collapses whitespace.
     * Total and idempotent; null becomes "".
     */
    public String normalize(String raw) {
        if (raw == null) return "";

        String text = raw.toUpperCase(Locale.ROOT);
        text = UNICODE_DASH.matcher(text).replaceAll("-");
        text = NON_DECIMAL_PERIOD.matcher(text).replaceAll("");
        text = HYPHEN_RUN.matcher(text).replaceAll(" ");
        text = WHITESPACE.matcher(text).replaceAll(" ");
        return text.trim();
    }

    /**
     * Strips dates, dollar amounts and trailing counts from an OCR line so the
     * remaining words can serve as a description. Case is left alone.
     */
    public String cleanDescription(String fullText) {
        if (fullText == null) return "";

        String text = DATE.matcher(fullText).replaceAll("");
        text = MONEY.matcher(text).replaceAll("");
        text = DECIMAL.matcher(text).replaceAll("");
        text = TRAILING_NUMBER.matcher(text).replaceAll("");
        text = WHITESPACE.matcher(text).replaceAll(" ");
        return EDGE_NOISE.matcher(text).replaceAll("");
    }
}
