package com.leadpipeline.agent;

/**
 * How enrichment fits around lead generation
 */
public enum EnrichmentMode {
    /**
     * Leads come out of generation already enriched; ENRICHED leads get messages next
     */
    INLINE,

    /**
     * ENRICHED leads still wait for a separate enrichment pass
     */
    DEFERRED
}
