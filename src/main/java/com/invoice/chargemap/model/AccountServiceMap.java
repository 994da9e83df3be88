package com.invoice.chargemap.model;

import lombok.Value;

import java.util.*;

/**
 * Read-only (account, equipment, material) → service id lookup.
 * Keys compare trimmed and case-insensitively.
 */
public final class AccountServiceMap {

    private static final AccountServiceMap EMPTY = new AccountServiceMap(List.of());

    private final Map<String, List<Entry>> entriesByAccount;
    private final int size;

    private AccountServiceMap(List<Entry> entries) {
        Map<String, List<Entry>> grouped = new LinkedHashMap<>();
        for (Entry entry : entries) {
            grouped.computeIfAbsent(key(entry.getAccountIdentifier()), k -> new ArrayList<>()).add(entry);
        }
        grouped.replaceAll((account, list) -> List.copyOf(list));
        this.entriesByAccount = Collections.unmodifiableMap(grouped);
        this.size = entries.size();
    }

    public static AccountServiceMap of(List<Entry> entries) {
        return new AccountServiceMap(entries);
    }

    public static AccountServiceMap empty() {
        return EMPTY;
    }

    /** Entries of one account in table order; empty for an unknown or blank account. */
    public List<Entry> entriesFor(String accountIdentifier) {
        if (accountIdentifier == null || accountIdentifier.isBlank()) return List.of();
        return entriesByAccount.getOrDefault(key(accountIdentifier), List.of());
    }

    public int size() {
        return size;
    }

    public int accountCount() {
        return entriesByAccount.size();
    }

    public static String key(String value) {
        return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    }

    @Value
    public static class Entry {
        String accountIdentifier;
        String equipmentLabel;
        String materialLabel;
        String serviceId;

        public boolean hasEquipment(String equipment) {
            return key(equipmentLabel).equals(key(equipment));
        }

        public boolean hasMaterial(String material) {
            return key(materialLabel).equals(key(material));
        }
    }
}
