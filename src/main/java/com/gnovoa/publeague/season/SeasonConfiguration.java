package com.gnovoa.publeague.season;

import com.gnovoa.publeague.model.DivisionType;
import com.gnovoa.publeague.schedule.WeekType;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Shape of a season for one division type.
 *
 * @param practiceWeeks 1-based regular weeks that open with a practice session
 */
public record SeasonConfiguration(
        DivisionType divisionType,
        int regularSeasonWeeks,
        int playoffWeeks,
        boolean hasFunWeek,
        boolean hasTstWeek,
        boolean hasBonusWeek,
        Set<Integer> practiceWeeks
) {
    public SeasonConfiguration {
        practiceWeeks = practiceWeeks == null ? Set.of() : Set.copyOf(practiceWeeks);
    }

    public boolean hasPracticeSessions() {
        return !practiceWeeks.isEmpty();
    }

    /**
     * Lays the season out one week apart from {@code startDate}: regular weeks first, then the
     * tournament, fun and bonus weeks when present, then numbered playoff weeks.
     */
    public List<WeekDescriptor> toWeekDescriptors(LocalDate startDate) {
        List<WeekDescriptor> weeks = new ArrayList<>();
        LocalDate date = startDate;
        int order = 1;

        for (int i = 1; i <= regularSeasonWeeks; i++) {
            weeks.add(practiceWeeks.contains(i)
                    ? WeekDescriptor.practice(date, order)
                    : WeekDescriptor.of(date, WeekType.REGULAR, order));
            order++;
            date = date.plusWeeks(1);
        }
        if (hasTstWeek) {
            weeks.add(WeekDescriptor.of(date, WeekType.TST, order++));
            date = date.plusWeeks(1);
        }
        if (hasFunWeek) {
            weeks.add(WeekDescriptor.of(date, WeekType.FUN, order++));
            date = date.plusWeeks(1);
        }
        if (hasBonusWeek) {
            weeks.add(WeekDescriptor.of(date, WeekType.BONUS, order++));
            date = date.plusWeeks(1);
        }
        for (int round = 1; round <= playoffWeeks; round++) {
            weeks.add(WeekDescriptor.playoff(date, order++, round));
            date = date.plusWeeks(1);
        }
        return weeks;
    }
}
