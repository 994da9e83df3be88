package com.invoice.chargemap.model;

import lombok.Value;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Compiled form of one extraction_aliases row.
 */
@Value
public class AliasRule {

    Long sourceId;
    String canonicalLabel;
    List<Pattern> matchExpressions;
}
