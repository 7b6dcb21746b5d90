package com.gnovoa.publeague.season;

import com.gnovoa.publeague.model.DivisionType;
import com.gnovoa.publeague.schedule.MatchSlot;
import com.gnovoa.publeague.schedule.ScheduleTemplateRow;
import com.gnovoa.publeague.schedule.ViolationReport;

import java.util.List;

/** Everything one generation run produced: the rows, the raw pairings and the findings. */
public record SeasonPlan(
        String divisionId,
        DivisionType divisionType,
        List<List<MatchSlot>> pairings,
        List<ScheduleTemplateRow> rows,
        ViolationReport report
) {}
