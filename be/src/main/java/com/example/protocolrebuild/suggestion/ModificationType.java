package com.example.protocolrebuild.suggestion;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ModificationType {
    ADD, MODIFY, REMOVE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ModificationType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.wireName().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
