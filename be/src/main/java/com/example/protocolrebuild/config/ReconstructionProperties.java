package com.example.protocolrebuild.config;

import com.example.protocolrebuild.partition.SectionSizeTable;
import com.example.protocolrebuild.regeneration.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Retry budgets and section sizing, bound from {@code reconstruction.*}:
 * <pre>
 * reconstruction:
 *   max-attempts: 3
 *   max-transient-retries: 3
 *   initial-backoff: 1s
 *   backoff-multiplier: 2.0
 *   max-backoff: 8s
 *   max-section-chars: 12000
 *   size-tiers:
 *     - max-document-chars: 20000
 *       nodes-per-section: 3
 *     - max-document-chars: 60000
 *       nodes-per-section: 2
 *   fallback-nodes-per-section: 1
 *   regenerate-unaffected-sections: false
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "reconstruction")
@Data
public class ReconstructionProperties {

    /** Attempts per section whose response is malformed or fails validation. */
    private int maxAttempts = 3;

    /** Extra calls per section after transient oracle failures. */
    private int maxTransientRetries = 3;

    private Duration initialBackoff = Duration.ofSeconds(1);

    private double backoffMultiplier = 2.0;

    private Duration maxBackoff = Duration.ofSeconds(8);

    /** Serialized length a section should stay under so the oracle's answer fits its output budget. */
    private int maxSectionChars = 12_000;

    private List<SizeTier> sizeTiers = new ArrayList<>(List.of(new SizeTier(20_000, 3), new SizeTier(60_000, 2)));

    /** Nodes per section for documents larger than every tier. */
    private int fallbackNodesPerSection = 1;

    /** Send sections without suggestions to the oracle too. */
    private boolean regenerateUnaffectedSections = false;

    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(maxAttempts, maxTransientRetries, initialBackoff, backoffMultiplier, maxBackoff);
    }

    public SectionSizeTable toSizeTable() {
        List<SectionSizeTable.Tier> tiers = sizeTiers.stream()
                .map(t -> new SectionSizeTable.Tier(t.getMaxDocumentChars(), t.getNodesPerSection()))
                .toList();
        return new SectionSizeTable(tiers, fallbackNodesPerSection);
    }

    @Data
    public static class SizeTier {

        private int maxDocumentChars;

        private int nodesPerSection;

        public SizeTier() {
        }

        public SizeTier(int maxDocumentChars, int nodesPerSection) {
            this.maxDocumentChars = maxDocumentChars;
            this.nodesPerSection = nodesPerSection;
        }
    }
}
