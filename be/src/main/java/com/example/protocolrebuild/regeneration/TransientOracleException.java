package com.example.protocolrebuild.regeneration;

/**
 * Oracle failure that may succeed on a later call: timeouts, rate limits, 5xx responses.
 */
public class TransientOracleException extends OracleException {

    public TransientOracleException(String message) {
        super(message);
    }

    public TransientOracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
