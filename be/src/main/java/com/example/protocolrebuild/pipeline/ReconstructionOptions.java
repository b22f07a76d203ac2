package com.example.protocolrebuild.pipeline;

import com.example.protocolrebuild.document.ProtocolVersion;
import com.example.protocolrebuild.regeneration.CancellationSignal;

import java.util.Objects;

/**
 * @param highestKnownVersion highest version already stored for this protocol, or {@code null}
 * @param cancellation        caller-side abort
 */
public record ReconstructionOptions(ProtocolVersion highestKnownVersion, CancellationSignal cancellation) {

    public ReconstructionOptions {
        Objects.requireNonNull(cancellation, "cancellation");
    }

    public static ReconstructionOptions defaults() {
        return new ReconstructionOptions(null, CancellationSignal.none());
    }
}
