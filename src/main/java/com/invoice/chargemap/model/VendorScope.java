package com.invoice.chargemap.model;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Locale;

/**
 * Which vendors a charge rule applies to: one named vendor, or any vendor.
 * The wildcard is its own type so a vendor can never collide with it by name.
 */
public abstract class VendorScope {

    private VendorScope() {
    }

    /** A blank or null vendor name means "any vendor". */
    public static VendorScope of(String vendorName) {
        if (vendorName == null || vendorName.isBlank()) {
            return Wildcard.INSTANCE;
        }
        return new Specific(vendorName.trim());
    }

    public static VendorScope wildcard() {
        return Wildcard.INSTANCE;
    }

    public abstract boolean appliesTo(String vendorName);

    public abstract boolean isWildcard();

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Specific extends VendorScope {

        String vendorName;

        @Override
        public boolean appliesTo(String candidate) {
            return candidate != null && vendorKey(vendorName).equals(vendorKey(candidate));
        }

        @Override
        public boolean isWildcard() {
            return false;
        }

        private static String vendorKey(String name) {
            return name.trim().toUpperCase(Locale.ROOT);
        }
    }

    public static final class Wildcard extends VendorScope {

        private static final Wildcard INSTANCE = new Wildcard();

        private Wildcard() {
        }

        @Override
        public boolean appliesTo(String vendorName) {
            return true;
        }

        @Override
        public boolean isWildcard() {
            return true;
        }

        @Override
        public String toString() {
            return "VendorScope.Wildcard";
        }
    }
}
