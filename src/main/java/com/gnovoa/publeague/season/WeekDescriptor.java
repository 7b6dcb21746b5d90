package com.gnovoa.publeague.season;

import com.gnovoa.publeague.schedule.WeekType;

import java.time.LocalDate;
import java.util.Optional;

/**
 * One week of a season as supplied by the caller. {@code weekType} is kept as the raw tag so that
 * unrecognised values can be reported instead of failing the whole season.
 */
public record WeekDescriptor(
        LocalDate date,
        String weekType,
        int weekOrder,
        Integer playoffRound,
        boolean practiceSession,
        String description
) {
    public static WeekDescriptor of(LocalDate date, WeekType type, int weekOrder) {
        return new WeekDescriptor(date, type.name(), weekOrder, null, false, null);
    }

    public static WeekDescriptor practice(LocalDate date, int weekOrder) {
        return new WeekDescriptor(date, WeekType.REGULAR.name(), weekOrder, null, true, "Practice session");
    }

    public static WeekDescriptor playoff(LocalDate date, int weekOrder, int round) {
        return new WeekDescriptor(date, WeekType.PLAYOFF.name(), weekOrder, round, false, "Playoffs round " + round);
    }

    public Optional<WeekType> type() {
        return WeekType.parse(weekType);
    }
}
