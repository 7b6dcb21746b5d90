package com.gnovoa.publeague.generation;

import com.gnovoa.publeague.exception.DivisionNotFoundException;
import com.gnovoa.publeague.exception.SchedulingException;
import com.gnovoa.publeague.lifecycle.TemplateLifecycle;
import com.gnovoa.publeague.model.DivisionType;
import com.gnovoa.publeague.rosters.DivisionRoster;
import com.gnovoa.publeague.rosters.RosterResolver;
import com.gnovoa.publeague.rosters.TeamDirectory;
import com.gnovoa.publeague.schedule.ConstraintValidator;
import com.gnovoa.publeague.schedule.ScheduleAudit;
import com.gnovoa.publeague.schedule.ScheduleTemplateRow;
import com.gnovoa.publeague.schedule.WeekType;
import com.gnovoa.publeague.season.SeasonConfigurations;
import com.gnovoa.publeague.season.SeasonPlan;
import com.gnovoa.publeague.season.WeekDescriptor;
import com.gnovoa.publeague.season.WeekPlanBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.SortedMap;

/**
 * Runs one generation per call: roster, pairings, placement, rows, and optionally persistence.
 *
 * <p>Holds no state between calls, so different divisions can be generated concurrently.
 */
public final class SeasonGenerationService {

    private static final Logger log = LoggerFactory.getLogger(SeasonGenerationService.class);

    /** Result of a generation. {@code persisted} is empty for dry runs. */
    public record Generation(SeasonPlan plan, RosterResolver roster, List<ScheduleTemplateRow> persisted) {}

    private final TeamDirectory directory;
    private final WeekPlanBuilder planBuilder;
    private final TemplateLifecycle lifecycle;
    private final ConstraintValidator validator;

    public SeasonGenerationService(TeamDirectory directory, WeekPlanBuilder planBuilder,
                                   TemplateLifecycle lifecycle, ConstraintValidator validator) {
        this.directory = directory;
        this.planBuilder = planBuilder;
        this.lifecycle = lifecycle;
        this.validator = validator;
    }

    public DivisionType divisionType(String divisionId) {
        return division(divisionId).type();
    }

    public RosterResolver roster(String divisionId) {
        DivisionRoster division = division(divisionId);
        return RosterResolver.of(divisionId, division.teams(), directory);
    }

    /**
     * Generates a season from explicit weeks, or from the division type defaults when
     * {@code weeks} is empty.
     */
    public Generation generate(String divisionId, List<WeekDescriptor> weeks, LocalDate startDate,
                               boolean withPractice, boolean persist) {
        Generation built = build(divisionId, weeks, startDate, withPractice);
        if (!persist) return built;
        return new Generation(built.plan(), built.roster(), lifecycle.persist(built.plan().rows()));
    }

    /**
     * Builds a new season and only then replaces every uncommitted row of the division with it.
     * A season that fails to build leaves the stored rows untouched.
     */
    public Generation regenerate(String divisionId, List<WeekDescriptor> weeks, LocalDate startDate, boolean withPractice) {
        Generation built = build(divisionId, weeks, startDate, withPractice);
        List<ScheduleTemplateRow> persisted = lifecycle.replaceUncommitted(divisionId, built.plan().rows());
        log.info("Regenerated division {} with {} row(s)", divisionId, persisted.size());
        return new Generation(built.plan(), built.roster(), persisted);
    }

    private Generation build(String divisionId, List<WeekDescriptor> weeks, LocalDate startDate, boolean withPractice) {
        DivisionRoster division = division(divisionId);
        RosterResolver roster = RosterResolver.of(divisionId, division.teams(), directory);

        List<WeekDescriptor> plannedWeeks = weeks;
        if (plannedWeeks == null || plannedWeeks.isEmpty()) {
            if (startDate == null) {
                throw new SchedulingException("MISSING_START_DATE", "A start date is required when no weeks are given");
            }
            plannedWeeks = SeasonConfigurations.defaults(division.type(), withPractice).toWeekDescriptors(startDate);
        }

        log.info("Generating {} week(s) for division {} ({}, {} real team(s))",
                plannedWeeks.size(), divisionId, division.type(), roster.realTeams().size());
        SeasonPlan plan = planBuilder.build(division.type(), roster, plannedWeeks);
        if (!plan.report().isAcceptable()) {
            log.warn("Division {} season has hard constraint violations: {}", divisionId, plan.report().hardViolations());
        }
        return new Generation(plan, roster, List.of());
    }

    public SortedMap<Integer, List<ScheduleTemplateRow>> preview(String divisionId) {
        division(divisionId);
        return lifecycle.preview(divisionId);
    }

    /** Audits the uncommitted regular season rows of a division. */
    public ScheduleAudit audit(String divisionId) {
        RosterResolver roster = roster(divisionId);
        List<ScheduleTemplateRow> regular = lifecycle.preview(divisionId).values().stream()
                .flatMap(List::stream)
                .filter(r -> WeekType.REGULAR.name().equals(r.weekType()) && !r.isPlaceholder())
                .toList();
        int weeks = (int) regular.stream().mapToInt(ScheduleTemplateRow::weekNumber).distinct().count();
        return validator.checkScheduleConstraints(regular, roster.realTeams().size(), weeks);
    }

    public List<TemplateLifecycle.CommittedMatch> commit(String divisionId, List<Long> templateIds) {
        division(divisionId);
        return lifecycle.commit(divisionId, templateIds);
    }

    public int delete(String divisionId, List<Long> templateIds) {
        division(divisionId);
        return lifecycle.delete(divisionId, templateIds);
    }

    private DivisionRoster division(String divisionId) {
        return directory.division(divisionId).orElseThrow(() -> new DivisionNotFoundException(divisionId));
    }
}
