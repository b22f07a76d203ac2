package com.example.protocolrebuild.api.v1.dto;

import java.util.List;

public record RevisionListResponse(List<RevisionListItem> revisions) {}
