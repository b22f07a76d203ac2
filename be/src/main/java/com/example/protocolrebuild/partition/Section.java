package com.example.protocolrebuild.partition;

import com.example.protocolrebuild.suggestion.Suggestion;

import java.util.List;

/**
 * A contiguous run of nodes regenerated as one unit. Index 0 is always the metadata section;
 * node sections follow in document order from 1.
 */
public record Section(int index, SectionKind kind, List<String> nodeIds, List<Suggestion> suggestions, int serializedLength) {
    public Section {
        nodeIds = List.copyOf(nodeIds);
        suggestions = List.copyOf(suggestions);
    }

    public boolean hasSuggestions() {
        return !suggestions.isEmpty();
    }

    public String label() {
        return "section[" + index + "]";
    }
}
