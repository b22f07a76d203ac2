package com.example.protocolrebuild.suggestion;

import java.util.List;

public record PreflightResult(List<Suggestion> accepted, List<RejectedSuggestion> rejected) {
    public PreflightResult {
        accepted = List.copyOf(accepted);
        rejected = List.copyOf(rejected);
    }
}
