package com.gnovoa.publeague.schedule;

import com.gnovoa.publeague.exception.InvalidTeamCountException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Generates weekly pairings for 4-team and 8-team divisions.
 *
 * <p>Provides:
 * <ul>
 *   <li>4 teams: a 3-week rotation in which every pair meets twice, repeated for as many weeks
 *   as requested</li>
 *   <li>8 teams: a fixed 7-week double round-robin where every team plays two back-to-back games
 *   a week</li>
 * </ul>
 *
 * <p>Team ids are sorted ascending before they are mapped onto the tables, so the same roster
 * always yields the same season.
 */
public final class PairingGenerator {

    private static final Logger log = LoggerFactory.getLogger(PairingGenerator.class);

    private final ConstraintValidator validator;
    private final int maxRetryAttempts;

    public PairingGenerator(ConstraintValidator validator, int maxRetryAttempts) {
        this.validator = validator;
        this.maxRetryAttempts = maxRetryAttempts;
    }

    /**
     * Creates the pairings for {@code weeksCount} regular weeks.
     *
     * @param teamIds exactly 4 or 8 team ids
     * @return one list of pairings per week
     * @throws InvalidTeamCountException if there are not 4 or 8 teams
     * @throws com.gnovoa.publeague.exception.InvalidWeekNumberException if an 8-team season asks for
     *     more than 7 weeks
     */
    public List<List<MatchSlot>> generate(List<Integer> teamIds, int weeksCount) {
        return generate(teamIds, weeksCount, new ViolationReport());
    }

    /** Same as {@link #generate(List, int)}, recording constraint findings into {@code report}. */
    public List<List<MatchSlot>> generate(List<Integer> teamIds, int weeksCount, ViolationReport report) {
        int n = teamIds.size();
        if (n != PairingTables.CLASSIC_TEAM_COUNT && n != PairingTables.PREMIER_TEAM_COUNT) {
            throw new InvalidTeamCountException(n);
        }
        if (new HashSet<>(teamIds).size() != n) {
            throw new IllegalArgumentException("Duplicate team ids in " + teamIds);
        }
        List<Integer> sorted = teamIds.stream().sorted().toList();

        List<List<MatchSlot>> weeks = n == PairingTables.PREMIER_TEAM_COUNT
                ? premierSeason(sorted, weeksCount, report)
                : classicSeason(sorted, weeksCount);

        report.merge(validator.validateFinalSchedule(weeks, sorted));
        log.info("Generated {} week(s) of pairings for {} teams ({} finding(s))", weeks.size(), n, report.violations().size());
        return weeks;
    }

    private List<List<MatchSlot>> classicSeason(List<Integer> sorted, int weeksCount) {
        if (weeksCount % PairingTables.CLASSIC_CYCLE != 0) {
            log.warn("{} weeks is not a multiple of {}; the last rotation is incomplete", weeksCount, PairingTables.CLASSIC_CYCLE);
        }
        List<List<MatchSlot>> weeks = new ArrayList<>(weeksCount);
        for (int week = 0; week < weeksCount; week++) {
            weeks.add(PairingTables.classicWeek(week, sorted));
        }
        return weeks;
    }

    /**
     * Walks the 8-team table week by week. Each week is checked for two games per team and no
     * repeat of last week's opponents; a failing week is swapped for another unused table week
     * and checked again, up to {@code maxRetryAttempts} times. If nothing passes, the original
     * week is kept and the failures go to the report.
     */
    private List<List<MatchSlot>> premierSeason(List<Integer> sorted, int weeksCount, ViolationReport report) {
        PairingLedger ledger = new PairingLedger(sorted);
        Deque<Integer> remaining = new ArrayDeque<>();
        for (int i = 0; i < PairingTables.PREMIER_WEEKS; i++) remaining.add(i);

        List<List<MatchSlot>> weeks = new ArrayList<>(weeksCount);
        for (int week = 0; week < weeksCount; week++) {
            int preferred = remaining.isEmpty() ? week : remaining.peekFirst();
            List<MatchSlot> matches = PairingTables.premierWeek(preferred, sorted);
            int chosen = preferred;

            List<Violation> problems = validator.weekViolations(week + 1, matches, sorted, ledger.lastWeekOpponents());
            if (!problems.isEmpty()) {
                log.warn("Week {} failed validation ({} issue(s)), trying alternate rotations", week + 1, problems.size());
                List<Integer> alternates = new ArrayList<>(remaining);
                alternates.remove(Integer.valueOf(preferred));
                int attempts = 0;
                for (int alt : alternates) {
                    if (attempts++ >= maxRetryAttempts) break;
                    List<MatchSlot> candidate = PairingTables.premierWeek(alt, sorted);
                    if (validator.validateWeek(candidate, sorted, ledger.lastWeekOpponents())) {
                        log.info("Week {} uses table week {} instead of {}", week + 1, alt, preferred);
                        matches = candidate;
                        chosen = alt;
                        problems = List.of();
                        break;
                    }
                }
                problems.forEach(v -> report.add(v.code(), v.weekNumber(), v.message()));
            }

            remaining.remove(Integer.valueOf(chosen));
            ledger.record(matches);
            weeks.add(matches);
        }
        if (log.isDebugEnabled()) {
            for (int team : sorted) {
                log.debug("Team {}: {} home, {} away, {} distinct opponent(s)",
                        team, ledger.homeGames(team), ledger.awayGames(team), ledger.opponentsOf(team).size());
            }
        }
        return weeks;
    }
}
