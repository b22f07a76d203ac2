package com.example.protocolrebuild.partition;

import java.util.Comparator;
import java.util.List;

/**
 * Nodes per section keyed on the serialized size of the whole document: small documents get
 * more nodes per section, large ones fewer. Documents larger than every tier use
 * {@code fallbackNodesPerSection}.
 */
public final class SectionSizeTable {

    public record Tier(int maxDocumentChars, int nodesPerSection) {
        public Tier {
            if (maxDocumentChars <= 0 || nodesPerSection <= 0) {
                throw new IllegalArgumentException("tier bounds must be positive");
            }
        }
    }

    private final List<Tier> tiers;
    private final int fallbackNodesPerSection;

    public SectionSizeTable(List<Tier> tiers, int fallbackNodesPerSection) {
        if (fallbackNodesPerSection <= 0) {
            throw new IllegalArgumentException("fallbackNodesPerSection must be positive");
        }
        this.tiers = tiers.stream().sorted(Comparator.comparingInt(Tier::maxDocumentChars)).toList();
        this.fallbackNodesPerSection = fallbackNodesPerSection;
    }

    /** 3 nodes up to 20 000 chars, 2 up to 60 000, then 1. */
    public static SectionSizeTable defaults() {
        return new SectionSizeTable(List.of(new Tier(20_000, 3), new Tier(60_000, 2)), 1);
    }

    public int nodesPerSection(int documentChars) {
        for (Tier tier : tiers) {
            if (documentChars <= tier.maxDocumentChars()) {
                return tier.nodesPerSection();
            }
        }
        return fallbackNodesPerSection;
    }
}
