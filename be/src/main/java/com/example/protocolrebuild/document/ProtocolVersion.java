package com.example.protocolrebuild.document;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered major.minor.patch version tuple. Reconstruction always increments at least the patch.
 */
public record ProtocolVersion(int major, int minor, int patch) implements Comparable<ProtocolVersion> {

    /** Assumed when a document carries no version at all. */
    public static final ProtocolVersion INITIAL = new ProtocolVersion(1, 0, 0);

    private static final Pattern FORMAT = Pattern.compile("^v?(\\d+)\\.(\\d+)\\.(\\d+)$");
    private static final Comparator<ProtocolVersion> ORDER = Comparator
            .comparingInt(ProtocolVersion::major)
            .thenComparingInt(ProtocolVersion::minor)
            .thenComparingInt(ProtocolVersion::patch);

    public ProtocolVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("version components must be non-negative");
        }
    }

    /**
     * Parses {@code 1.2.3} or {@code v1.2.3}.
     *
     * @throws DocumentFormatException if the value is not a three-part numeric version
     */
    public static ProtocolVersion parse(String value) {
        if (value == null || value.isBlank()) {
            throw new DocumentFormatException("version is required");
        }
        Matcher m = FORMAT.matcher(value.trim());
        if (!m.matches()) {
            throw new DocumentFormatException("version must be MAJOR.MINOR.PATCH: " + value);
        }
        try {
            return new ProtocolVersion(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
        } catch (NumberFormatException e) {
            throw new DocumentFormatException("version component out of range: " + value);
        }
    }

    public ProtocolVersion nextPatch() {
        return new ProtocolVersion(major, minor, patch + 1);
    }

    public ProtocolVersion nextMinor() {
        return new ProtocolVersion(major, minor + 1, 0);
    }

    public ProtocolVersion nextMajor() {
        return new ProtocolVersion(major + 1, 0, 0);
    }

    public boolean isAfter(ProtocolVersion other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(ProtocolVersion other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
