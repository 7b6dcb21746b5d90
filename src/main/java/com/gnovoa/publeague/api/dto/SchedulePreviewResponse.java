package com.gnovoa.publeague.api.dto;

import com.gnovoa.publeague.model.DivisionType;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

public record SchedulePreviewResponse(
        String divisionId,
        DivisionType divisionType,
        int totalRows,
        List<WeekItem> weeks
) {
    public record WeekItem(int weekNumber, LocalDate date, String label, List<Entry> entries) {}

    public record Entry(
            Long templateId,
            int homeTeamId,
            String homeTeam,
            int awayTeamId,
            String awayTeam,
            LocalTime time,
            String field,
            int matchOrder,
            String weekType,
            boolean specialWeek,
            boolean practice,
            boolean playoff,
            Integer playoffRound,
            Integer eventTeamId,
            String eventName
    ) {}
}
