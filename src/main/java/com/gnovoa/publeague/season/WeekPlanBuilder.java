package com.gnovoa.publeague.season;

import com.gnovoa.publeague.exception.MissingWeekDateException;
import com.gnovoa.publeague.model.DivisionType;
import com.gnovoa.publeague.model.Team;
import com.gnovoa.publeague.rosters.RosterResolver;
import com.gnovoa.publeague.schedule.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.*;

/**
 * Turns a list of week descriptors into schedule template rows.
 *
 * <p>Regular weeks consume the next weekly pairing in order. Playoff, fun, tournament, bye and
 * bonus weeks produce one same-team placeholder row per real team. Weeks with a type nobody
 * recognises are logged, reported and skipped.
 */
public final class WeekPlanBuilder {

    private static final Logger log = LoggerFactory.getLogger(WeekPlanBuilder.class);

    private static final int PRACTICE_MATCHES = 2;

    private final PairingGenerator generator;
    private final TimeSlotAndFieldAssigner assigner;
    private final ConstraintValidator validator;

    public WeekPlanBuilder(PairingGenerator generator, TimeSlotAndFieldAssigner assigner, ConstraintValidator validator) {
        this.generator = generator;
        this.assigner = assigner;
        this.validator = validator;
    }

    /** Per-run state while walking the weeks. */
    private final class Run {
        final String divisionId;
        final DivisionType type;
        final RosterResolver roster;
        final List<LocalTime> slots;
        final Iterator<List<MatchSlot>> pairings;
        final BalanceLedger balance = new BalanceLedger();
        final ViolationReport report;
        final List<ScheduleTemplateRow> rows = new ArrayList<>();
        final List<List<SlotAssignment>> fullWeeks = new ArrayList<>();
        int playoffWeeksSeen = 0;

        Run(DivisionType type, RosterResolver roster, List<List<MatchSlot>> pairings, ViolationReport report) {
            this.divisionId = roster.divisionId();
            this.type = type;
            this.roster = roster;
            this.slots = assigner.timeSlots(type, roster.realTeams().size());
            this.pairings = pairings.iterator();
            this.report = report;
        }
    }

    /**
     * Builds every row of the season.
     *
     * @throws com.gnovoa.publeague.exception.InvalidTeamCountException if the division does not have
     *     4 or 8 real teams and the season has regular weeks
     * @throws MissingWeekDateException if a week that produces rows has no date
     */
    public SeasonPlan build(DivisionType type, RosterResolver roster, List<WeekDescriptor> weeks) {
        ViolationReport report = new ViolationReport();
        int pairingWeeks = (int) weeks.stream().filter(w -> consumesPairing(type, w)).count();
        List<List<MatchSlot>> pairings = pairingWeeks == 0
                ? List.of()
                : generator.generate(roster.realTeamIds(), pairingWeeks, report);

        Run run = new Run(type, roster, pairings, report);
        for (WeekDescriptor week : weeks) {
            Optional<WeekType> weekType = week.type();
            if (weekType.isEmpty()) {
                log.warn("Skipping week {} with unknown type '{}'", week.weekOrder(), week.weekType());
                report.add(ConstraintCode.UNKNOWN_WEEK_TYPE, week.weekOrder(), "Unknown week type '" + week.weekType() + "', no rows created");
                continue;
            }
            switch (weekType.get()) {
                case REGULAR -> {
                    if (week.practiceSession() && type == DivisionType.CLASSIC) practiceWeek(run, week);
                    else {
                        if (week.practiceSession()) {
                            log.warn("Week {}: practice sessions are only scheduled for Classic divisions", week.weekOrder());
                        }
                        regularWeek(run, week);
                    }
                }
                case MIXED -> {
                    if (type == DivisionType.PREMIER) playoffWeek(run, week);
                    else if (type == DivisionType.CLASSIC) regularWeek(run, week);
                    else log.warn("Week {}: mixed weeks are not supported for {} divisions", week.weekOrder(), type);
                }
                case PRACTICE -> practiceWeek(run, week);
                case PLAYOFF -> playoffWeek(run, week);
                case FUN, TST, BYE, BONUS -> placeholderWeek(run, week, weekType.get());
            }
        }

        if (!run.fullWeeks.isEmpty()) {
            report.merge(validator.validateAssignments(run.fullWeeks, roster.realTeamIds()));
        }
        log.info("Built {} row(s) over {} week(s) for division {} ({} hard, {} advisory finding(s))",
                run.rows.size(), weeks.size(), run.divisionId, report.hardViolations().size(), report.advisoryViolations().size());
        return new SeasonPlan(run.divisionId, type, pairings, List.copyOf(run.rows), report);
    }

    static boolean consumesPairing(DivisionType type, WeekDescriptor week) {
        Optional<WeekType> t = week.type();
        if (t.isEmpty()) return false;
        return switch (t.get()) {
            case REGULAR, PRACTICE -> true;
            case MIXED -> type == DivisionType.CLASSIC;
            default -> false;
        };
    }

    private void regularWeek(Run run, WeekDescriptor week) {
        LocalDate date = requireDate(week);
        List<MatchSlot> matches = nextPairing(run, week);
        if (matches == null) return;

        List<SlotAssignment> placed = assigner.assignWeek(matches, run.slots, run.balance);
        run.fullWeeks.add(placed);
        for (SlotAssignment a : placed) {
            run.rows.add(row(run, week, date, a.homeTeamId(), a.awayTeamId(), a.time(), a.field(), a.matchOrder(),
                    WeekType.REGULAR.name(), false, false, false, null, null));
        }
    }

    /**
     * First slot: one practice row per field. Second slot: the first two pairings of the week,
     * which between them cover each team once in a 4-team division.
     */
    private void practiceWeek(Run run, WeekDescriptor week) {
        LocalDate date = requireDate(week);
        List<MatchSlot> matches = nextPairing(run, week);
        if (matches == null) return;

        List<MatchSlot> playing = matches.subList(0, Math.min(PRACTICE_MATCHES, matches.size()));
        List<String> fields = assigner.fields();
        LocalTime practiceTime = run.slots.get(0);
        LocalTime gameTime = run.slots.get(Math.min(1, run.slots.size() - 1));

        for (int i = 0; i < PRACTICE_MATCHES; i++) {
            int team = playing.isEmpty()
                    ? run.roster.realTeams().get(i % run.roster.realTeams().size()).teamId()
                    : playing.get(i % playing.size()).homeTeamId();
            run.rows.add(row(run, week, date, team, team, practiceTime, fields.get(i % fields.size()), 1,
                    WeekType.PRACTICE.name(), true, true, false, null, null));
        }
        for (int i = 0; i < playing.size(); i++) {
            MatchSlot m = playing.get(i);
            run.rows.add(row(run, week, date, m.homeTeamId(), m.awayTeamId(), gameTime, fields.get(i % fields.size()), 2,
                    WeekType.REGULAR.name(), false, false, false, null, null));
        }
    }

    private void playoffWeek(Run run, WeekDescriptor week) {
        run.playoffWeeksSeen++;
        int round = week.playoffRound() != null ? week.playoffRound() : run.playoffWeeksSeen;
        placeholderRows(run, week, WeekType.PLAYOFF, true, round, null);
    }

    private void placeholderWeek(Run run, WeekDescriptor week, WeekType type) {
        Integer eventTeamId = switch (type) {
            case FUN -> run.roster.placeholder(RosterResolver.FUN_WEEK).map(Team::teamId).orElse(null);
            case TST -> run.roster.placeholder(RosterResolver.TST).map(Team::teamId).orElse(null);
            case BYE -> run.roster.placeholder(RosterResolver.BYE).map(Team::teamId).orElse(null);
            default -> null;
        };
        placeholderRows(run, week, type, false, null, eventTeamId);
    }

    /** One home==away row per real team, spread two per slot across the fields. */
    private void placeholderRows(Run run, WeekDescriptor week, WeekType type, boolean playoff, Integer round,
                                 Integer eventTeamId) {
        LocalDate date = requireDate(week);
        List<String> fields = assigner.fields();
        List<Team> teams = run.roster.realTeams();
        for (int i = 0; i < teams.size(); i++) {
            int team = teams.get(i).teamId();
            LocalTime time = run.slots.get((i / fields.size()) % run.slots.size());
            run.rows.add(row(run, week, date, team, team, time, fields.get(i % fields.size()), 1,
                    type.name(), true, false, playoff, round, eventTeamId));
        }
        log.debug("Week {}: {} placeholder row(s) for {}", week.weekOrder(), teams.size(), type);
    }

    private List<MatchSlot> nextPairing(Run run, WeekDescriptor week) {
        if (!run.pairings.hasNext()) {
            log.warn("Week {}: no pairings left, nothing scheduled", week.weekOrder());
            return null;
        }
        return run.pairings.next();
    }

    private static LocalDate requireDate(WeekDescriptor week) {
        if (week.date() == null) throw new MissingWeekDateException(week.weekOrder());
        return week.date();
    }

    private static ScheduleTemplateRow row(Run run, WeekDescriptor week, LocalDate date, int home, int away,
                                           LocalTime time, String field, int order, String weekType,
                                           boolean special, boolean practice, boolean playoff, Integer round,
                                           Integer eventTeamId) {
        return new ScheduleTemplateRow(null, run.divisionId, week.weekOrder(), home, away, date, time, field, order,
                weekType, special, practice, playoff, round, eventTeamId, false);
    }
}
