package com.gnovoa.publeague.schedule;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * One line of a generated, not yet committed, schedule.
 *
 * <p>{@code templateId} is null until the row is persisted. {@code eventTeamId} points at the
 * placeholder team labelling a fun, tournament or bye week and is null otherwise.
 */
public record ScheduleTemplateRow(
        Long templateId,
        String divisionId,
        int weekNumber,
        int homeTeamId,
        int awayTeamId,
        LocalDate scheduledDate,
        LocalTime scheduledTime,
        String fieldName,
        int matchOrder,
        String weekType,
        boolean specialWeek,
        boolean practice,
        boolean playoff,
        Integer playoffRound,
        Integer eventTeamId,
        boolean committed
) {
    public boolean isPlaceholder() {
        return homeTeamId == awayTeamId;
    }

    public ScheduleTemplateRow withTemplateId(long id) {
        return new ScheduleTemplateRow(id, divisionId, weekNumber, homeTeamId, awayTeamId, scheduledDate,
                scheduledTime, fieldName, matchOrder, weekType, specialWeek, practice, playoff, playoffRound,
                eventTeamId, committed);
    }

    public ScheduleTemplateRow asCommitted() {
        return new ScheduleTemplateRow(templateId, divisionId, weekNumber, homeTeamId, awayTeamId, scheduledDate,
                scheduledTime, fieldName, matchOrder, weekType, specialWeek, practice, playoff, playoffRound,
                eventTeamId, true);
    }
}
