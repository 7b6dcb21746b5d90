package com.gnovoa.publeague.api.dto;

import java.util.List;

/** Preview of the freshly persisted rows together with what the constraint checks found. */
public record GenerationResponse(
        SchedulePreviewResponse preview,
        boolean acceptable,
        List<ViolationItem> violations
) {
    public record ViolationItem(String code, String description, Integer weekNumber, String message, boolean advisory) {}
}
