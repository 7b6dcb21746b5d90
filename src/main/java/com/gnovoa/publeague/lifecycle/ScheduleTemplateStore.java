package com.gnovoa.publeague.lifecycle;

import com.gnovoa.publeague.schedule.ScheduleTemplateRow;

import java.util.Collection;
import java.util.List;

/**
 * Storage for generated template rows. Every mutating call is applied completely or not at all.
 */
public interface ScheduleTemplateStore {

    /** Inserts rows and returns them with their assigned template ids. */
    List<ScheduleTemplateRow> saveAll(List<ScheduleTemplateRow> rows);

    List<ScheduleTemplateRow> findByDivision(String divisionId);

    List<ScheduleTemplateRow> findByIds(String divisionId, Collection<Long> templateIds);

    void markCommitted(Collection<Long> templateIds);

    /** Swaps every uncommitted row of the division for {@code rows}, returning the saved rows. */
    List<ScheduleTemplateRow> replaceUncommitted(String divisionId, List<ScheduleTemplateRow> rows);

    /** Removes the given uncommitted rows and returns how many were removed. */
    int deleteUncommitted(Collection<Long> templateIds);
}
