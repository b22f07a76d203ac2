package com.example.protocolrebuild.validation;

/**
 * Taxonomy of validation and oracle failures.
 */
public enum ErrorKind {
    /** Caller-supplied document or suggestion is unusable. */
    INPUT,
    /** No extraction strategy produced structured data from the oracle response. */
    MALFORMED_OUTPUT,
    /** Missing or invented node ids, or a field shape violation. */
    SECTION_STRUCTURE,
    /** Expression rejected by the grammar or identifier check. */
    EXPRESSION_SAFETY,
    /** Network, rate-limit or server-side oracle failure. */
    TRANSIENT_ORACLE,
    /** Non-retriable oracle client failure. */
    ORACLE,
    /** Post-assembly invariant violation. */
    CROSS_REFERENCE
}
