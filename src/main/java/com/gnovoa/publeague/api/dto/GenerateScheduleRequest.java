package com.gnovoa.publeague.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalDate;
import java.util.List;

/**
 * Body of a generate or regenerate call. Either {@code weeks} is given, or the division type's
 * default season is laid out from {@code startDate}.
 */
public record GenerateScheduleRequest(
        LocalDate startDate,
        Boolean withPractice,
        @Valid List<WeekItem> weeks
) {
    public record WeekItem(
            LocalDate date,
            @NotBlank String weekType,
            @NotNull @Positive Integer weekOrder,
            @Positive Integer playoffRound,
            Boolean practiceSession,
            String description
    ) {
        public boolean practice() {
            return Boolean.TRUE.equals(practiceSession);
        }
    }

    public boolean practiceRequested() {
        return Boolean.TRUE.equals(withPractice);
    }
}
