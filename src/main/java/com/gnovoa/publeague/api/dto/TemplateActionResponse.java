package com.gnovoa.publeague.api.dto;

import java.util.List;

public record TemplateActionResponse(
        String divisionId,
        String action,
        int affected,
        List<CommittedItem> matches
) {
    public record CommittedItem(long templateId, long matchId) {}
}
