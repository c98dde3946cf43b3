package com.uitgo.proximity.model;

import java.util.Locale;

/**
 * How a radius query finds its candidates
 */
public enum SearchStrategy {
    
    /** Brute-force scan over every stored point */
    FLAT_SCAN,
    
    /** Bounded lookup through the H3 cell membership index */
    HIERARCHICAL;
    
    /**
     * Parses the flag forms used in configuration and on the wire:
     * {@code flat-scan}, {@code flatScan}, {@code FLAT_SCAN}, {@code hierarchical}.
     */
    public static SearchStrategy fromFlag(String flag) {
        if (flag == null || flag.isBlank()) {
            throw new IllegalArgumentException("Search strategy flag is empty");
        }
        String normalized = flag.trim().replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "flatscan":
            case "flat":
                return FLAT_SCAN;
            case "hierarchical":
            case "h3":
                return HIERARCHICAL;
            default:
                throw new IllegalArgumentException("Unknown search strategy: " + flag);
        }
    }
}
