package com.example.protocolrebuild.regeneration;

/**
 * The external text generator that rewrites one section at a time. Responses are untrusted:
 * they may drop fields, wrap the payload in prose, or stop mid-value.
 */
public interface RewriteOracle {

    /**
     * @throws TransientOracleException for network, rate-limit and server-side failures worth retrying
     * @throws OracleException           for anything that will not succeed on retry
     */
    String rewrite(SectionRequest request);
}
