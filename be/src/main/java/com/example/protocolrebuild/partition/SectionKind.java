package com.example.protocolrebuild.partition;

public enum SectionKind {
    /** Carries only version and changelog. */
    METADATA,
    NODES
}
