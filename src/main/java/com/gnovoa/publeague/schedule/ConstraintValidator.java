package com.gnovoa.publeague.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalTime;
import java.util.*;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Checks generated weeks and whole seasons against C1..C6.
 *
 * <p>Stateless. Every finding is logged and returned; nothing is thrown.
 */
public final class ConstraintValidator {

    private static final Logger log = LoggerFactory.getLogger(ConstraintValidator.class);

    static final int GAMES_PER_WEEK = 2;

    /** A game reduced to what the checks need. */
    private record Game(int week, int home, int away, int slotIndex, int slotsInWeek, String field) {}

    /**
     * Checks C2 (exactly two games per team) and C3 (no opponent from last week) for one week.
     *
     * @param priorWeekOpponents opponents per team in the previous week, empty for the first week
     */
    public boolean validateWeek(List<MatchSlot> matches, Collection<Integer> teamIds,
                                Map<Integer, Set<Integer>> priorWeekOpponents) {
        return weekViolations(null, matches, teamIds, priorWeekOpponents).isEmpty();
    }

    public List<Violation> weekViolations(Integer weekNumber, List<MatchSlot> matches, Collection<Integer> teamIds,
                                          Map<Integer, Set<Integer>> priorWeekOpponents) {
        List<Violation> out = new ArrayList<>();
        Map<Integer, Integer> games = new HashMap<>();
        Map<Integer, Set<Integer>> opponents = new HashMap<>();
        for (MatchSlot m : matches) {
            if (m.isSpecialEvent()) continue;
            games.merge(m.homeTeamId(), 1, Integer::sum);
            games.merge(m.awayTeamId(), 1, Integer::sum);
            opponents.computeIfAbsent(m.homeTeamId(), k -> new HashSet<>()).add(m.awayTeamId());
            opponents.computeIfAbsent(m.awayTeamId(), k -> new HashSet<>()).add(m.homeTeamId());
        }

        for (int team : teamIds) {
            int played = games.getOrDefault(team, 0);
            if (played != GAMES_PER_WEEK) {
                out.add(new Violation(ConstraintCode.C2_BACK_TO_BACK, weekNumber,
                        "Team " + team + " plays " + played + " games, expected " + GAMES_PER_WEEK));
            }
            Set<Integer> repeated = new TreeSet<>(opponents.getOrDefault(team, Set.of()));
            repeated.retainAll(priorWeekOpponents.getOrDefault(team, Set.of()));
            if (!repeated.isEmpty()) {
                out.add(new Violation(ConstraintCode.C3_NO_IMMEDIATE_REMATCH, weekNumber,
                        "Team " + team + " faces " + repeated + " again straight after last week"));
            }
        }
        out.forEach(v -> log.debug("Week check failed: {}", v));
        return out;
    }

    /**
     * Recomputes the season-wide pairing checks.
     *
     * <p>8 teams: C1 over the whole season (pairs meet at most twice, exactly twice once the 7
     * weeks are complete) and, for a complete season only, C4 home/away balance. 4 teams: every pair twice in every complete
     * 3-week block, with a trailing partial block reported as advisory.
     */
    public ViolationReport validateFinalSchedule(List<List<MatchSlot>> allWeeks, List<Integer> teamIds) {
        ViolationReport report = new ViolationReport();
        if (teamIds.size() == PairingTables.CLASSIC_TEAM_COUNT) {
            validateClassicSeason(allWeeks, teamIds, report);
        } else {
            boolean fullSeason = allWeeks.size() == PairingTables.PREMIER_WEEKS;
            checkPairs(allWeeks, teamIds, fullSeason, null, report);
            // Home/away only evens out over the whole table.
            if (fullSeason) checkHomeAway(allWeeks, teamIds, report);
        }
        report.violations().forEach(v -> log.warn("Season check: {}", v));
        return report;
    }

    private void validateClassicSeason(List<List<MatchSlot>> allWeeks, List<Integer> teamIds, ViolationReport report) {
        int cycle = PairingTables.CLASSIC_CYCLE;
        int completeBlocks = allWeeks.size() / cycle;
        for (int b = 0; b < completeBlocks; b++) {
            List<List<MatchSlot>> block = allWeeks.subList(b * cycle, (b + 1) * cycle);
            checkPairs(block, teamIds, true, "weeks " + (b * cycle + 1) + "-" + (b + 1) * cycle, report);
            checkHomeAway(block, teamIds, report);
        }
        int trailing = allWeeks.size() % cycle;
        if (trailing != 0) {
            report.add(ConstraintCode.PARTIAL_CYCLE, null,
                    "Last " + trailing + " week(s) cover part of a " + cycle + "-week rotation, pair balance not guaranteed");
        }
        for (int w = 0; w < allWeeks.size(); w++) {
            weekViolations(w + 1, allWeeks.get(w), teamIds, Map.of())
                    .forEach(v -> report.add(v.code(), v.weekNumber(), v.message()));
        }
    }

    private void checkPairs(List<List<MatchSlot>> weeks, List<Integer> teamIds, boolean requireExactlyTwice,
                            String scope, ViolationReport report) {
        Map<String, Integer> pairs = new HashMap<>();
        weeks.forEach(w -> w.stream().filter(m -> !m.isSpecialEvent())
                .forEach(m -> pairs.merge(m.pairKey(), 1, Integer::sum)));
        List<Integer> sorted = teamIds.stream().sorted().toList();
        for (int i = 0; i < sorted.size(); i++) {
            for (int j = i + 1; j < sorted.size(); j++) {
                String key = MatchSlot.pairKey(sorted.get(i), sorted.get(j));
                int n = pairs.getOrDefault(key, 0);
                boolean bad = requireExactlyTwice ? n != 2 : n > 2;
                if (bad) {
                    report.add(ConstraintCode.C1_DOUBLE_ROUND_ROBIN, null,
                            "Pair " + key + " meets " + n + " time(s)" + (scope == null ? "" : " in " + scope));
                }
            }
        }
    }

    private void checkHomeAway(List<List<MatchSlot>> weeks, List<Integer> teamIds, ViolationReport report) {
        Map<Integer, Integer> home = new HashMap<>();
        Map<Integer, Integer> away = new HashMap<>();
        weeks.forEach(w -> w.stream().filter(m -> !m.isSpecialEvent()).forEach(m -> {
            home.merge(m.homeTeamId(), 1, Integer::sum);
            away.merge(m.awayTeamId(), 1, Integer::sum);
        }));
        for (int team : teamIds) {
            int h = home.getOrDefault(team, 0);
            int a = away.getOrDefault(team, 0);
            if (!balanced(h, a)) {
                report.add(ConstraintCode.C4_HOME_AWAY_BALANCE, null,
                        "Team " + team + " has " + h + " home and " + a + " away games");
            }
        }
    }

    /**
     * Checks placed weeks for C2 windows, C5 field balance and C6 early/late balance.
     *
     * @param weeks one assignment list per regular week, in season order
     */
    public ViolationReport validateAssignments(List<List<SlotAssignment>> weeks, List<Integer> teamIds) {
        List<Game> games = new ArrayList<>();
        for (int w = 0; w < weeks.size(); w++) {
            int slots = (int) weeks.get(w).stream().mapToInt(SlotAssignment::slotIndex).distinct().count();
            for (SlotAssignment a : weeks.get(w)) {
                games.add(new Game(w + 1, a.homeTeamId(), a.awayTeamId(), a.slotIndex(), Math.max(slots, 1), a.field()));
            }
        }
        ViolationReport report = new ViolationReport();
        checkWindows(games, teamIds, report);
        checkFields(games, teamIds, report);
        checkEarlyLate(games, teamIds, report);
        report.violations().forEach(v -> log.warn("Placement check: {}", v));
        return report;
    }

    private void checkWindows(List<Game> games, List<Integer> teamIds, ViolationReport report) {
        Map<Integer, List<Game>> byWeek = games.stream().collect(Collectors.groupingBy(Game::week, TreeMap::new, Collectors.toList()));
        byWeek.forEach((week, weekGames) -> {
            for (int team : teamIds) {
                List<Integer> slots = weekGames.stream()
                        .filter(g -> g.home() == team || g.away() == team)
                        .map(Game::slotIndex).sorted().toList();
                if (slots.size() != GAMES_PER_WEEK) {
                    report.add(ConstraintCode.C2_BACK_TO_BACK, week,
                            "Team " + team + " plays " + slots.size() + " games, expected " + GAMES_PER_WEEK);
                    continue;
                }
                int first = slots.get(0);
                int second = slots.get(1);
                int slotsInWeek = weekGames.get(0).slotsInWeek();
                boolean sameWindow = slotsInWeek < 4 || first / 2 == second / 2;
                if (second - first != 1 || !sameWindow) {
                    report.add(ConstraintCode.C2_BACK_TO_BACK, week,
                            "Team " + team + " plays in slots " + (first + 1) + " and " + (second + 1) + ", not back-to-back");
                }
            }
        });
    }

    private void checkFields(List<Game> games, List<Integer> teamIds, ViolationReport report) {
        Set<String> fields = games.stream().map(Game::field).collect(Collectors.toCollection(TreeSet::new));
        if (fields.size() < 2) return;
        for (int team : teamIds) {
            Map<String, Integer> counts = new TreeMap<>();
            fields.forEach(f -> counts.put(f, 0));
            games.stream().filter(g -> g.home() == team || g.away() == team)
                    .forEach(g -> counts.merge(g.field(), 1, Integer::sum));
            int total = counts.values().stream().mapToInt(Integer::intValue).sum();
            int max = Collections.max(counts.values());
            int min = Collections.min(counts.values());
            int allowed = total % fields.size() == 0 ? 0 : 1;
            if (max - min > allowed) {
                report.add(ConstraintCode.C5_FIELD_BALANCE, null, "Team " + team + " field split " + counts);
            }
        }
    }

    private void checkEarlyLate(List<Game> games, List<Integer> teamIds, ViolationReport report) {
        List<Game> windowed = games.stream().filter(g -> g.slotsInWeek() >= 4).toList();
        if (windowed.isEmpty()) return;
        for (int team : teamIds) {
            Map<Integer, Boolean> earlyByWeek = new TreeMap<>();
            windowed.stream().filter(g -> g.home() == team || g.away() == team)
                    .forEach(g -> earlyByWeek.putIfAbsent(g.week(), g.slotIndex() < g.slotsInWeek() / 2));
            long early = earlyByWeek.values().stream().filter(Boolean::booleanValue).count();
            long late = earlyByWeek.size() - early;
            if (Math.abs(early - late) > 1) {
                report.add(ConstraintCode.C6_TIME_BALANCE, null,
                        "Team " + team + " has " + early + " early and " + late + " late windows");
            }
        }
    }

    /**
     * Audits persisted or previewed rows of a regular season. Placeholder rows are ignored.
     * Four-team seasons are checked per complete 3-week rotation and skip the rematch check.
     *
     * @param teamCount number of real teams expected in the division
     * @param weeksCount number of regular weeks expected
     */
    public ScheduleAudit checkScheduleConstraints(List<ScheduleTemplateRow> rows, int teamCount, int weeksCount) {
        List<ScheduleTemplateRow> matches = rows.stream().filter(r -> !r.isPlaceholder()).toList();
        int expected = teamCount * weeksCount;
        List<String> messages = new ArrayList<>();
        if (matches.size() != expected) {
            messages.add("Schedule has " + matches.size() + " matches, expected " + expected);
        }

        Map<Integer, List<ScheduleTemplateRow>> byWeek = matches.stream()
                .collect(Collectors.groupingBy(ScheduleTemplateRow::weekNumber, TreeMap::new, Collectors.toList()));
        List<Game> games = new ArrayList<>();
        List<List<MatchSlot>> weeks = new ArrayList<>();
        byWeek.forEach((week, weekRows) -> {
            List<LocalTime> times = weekRows.stream().map(ScheduleTemplateRow::scheduledTime)
                    .filter(Objects::nonNull).distinct().sorted().toList();
            List<MatchSlot> slots = new ArrayList<>();
            for (ScheduleTemplateRow r : weekRows) {
                int slot = r.scheduledTime() == null ? 0 : times.indexOf(r.scheduledTime());
                games.add(new Game(week, r.homeTeamId(), r.awayTeamId(), slot, Math.max(times.size(), 1), r.fieldName()));
                slots.add(new MatchSlot(r.homeTeamId(), r.awayTeamId()));
            }
            weeks.add(slots);
        });

        List<Integer> teamIds = matches.stream()
                .flatMap(r -> Stream.of(r.homeTeamId(), r.awayTeamId()))
                .distinct().sorted().toList();

        ViolationReport c1 = new ViolationReport();
        if (teamIds.size() != teamCount) {
            c1.add(ConstraintCode.C1_DOUBLE_ROUND_ROBIN, null,
                    "Schedule involves " + teamIds.size() + " teams, expected " + teamCount);
        }
        boolean classic = teamCount == PairingTables.CLASSIC_TEAM_COUNT;
        if (classic) {
            forEachClassicBlock(weeks, (scope, block) -> checkPairs(block, teamIds, true, scope, c1));
        } else {
            checkPairs(weeks, teamIds, true, null, c1);
        }

        ViolationReport c2 = new ViolationReport();
        checkWindows(games, teamIds, c2);

        ViolationReport c3 = new ViolationReport();
        for (int w = 1; w < weeks.size() && !classic; w++) {
            Map<Integer, Set<Integer>> prior = opponents(weeks.get(w - 1));
            Map<Integer, Set<Integer>> current = opponents(weeks.get(w));
            for (int team : teamIds) {
                Set<Integer> repeated = new TreeSet<>(current.getOrDefault(team, Set.of()));
                repeated.retainAll(prior.getOrDefault(team, Set.of()));
                if (!repeated.isEmpty()) {
                    c3.add(ConstraintCode.C3_NO_IMMEDIATE_REMATCH, w + 1,
                            "Team " + team + " faces " + repeated + " in consecutive weeks");
                }
            }
        }

        ViolationReport c4 = new ViolationReport();
        if (classic) {
            forEachClassicBlock(weeks, (scope, block) -> checkHomeAway(block, teamIds, c4));
        } else {
            checkHomeAway(weeks, teamIds, c4);
        }
        ViolationReport c5 = new ViolationReport();
        checkFields(games, teamIds, c5);
        ViolationReport c6 = new ViolationReport();
        checkEarlyLate(games, teamIds, c6);

        for (ViolationReport r : List.of(c1, c2, c3, c4, c5, c6)) messages.addAll(r.messages());
        return new ScheduleAudit(matches.size(), expected,
                c1.isEmpty() && !matches.isEmpty(), c2.isEmpty(), c3.isEmpty(), c4.isEmpty(), c5.isEmpty(), c6.isEmpty(),
                List.copyOf(messages));
    }

    private static void forEachClassicBlock(List<List<MatchSlot>> weeks,
                                            BiConsumer<String, List<List<MatchSlot>>> check) {
        int cycle = PairingTables.CLASSIC_CYCLE;
        for (int b = 0; b < weeks.size() / cycle; b++) {
            check.accept("weeks " + (b * cycle + 1) + "-" + (b + 1) * cycle, weeks.subList(b * cycle, (b + 1) * cycle));
        }
    }

    private static Map<Integer, Set<Integer>> opponents(List<MatchSlot> week) {
        Map<Integer, Set<Integer>> out = new HashMap<>();
        for (MatchSlot m : week) {
            out.computeIfAbsent(m.homeTeamId(), k -> new HashSet<>()).add(m.awayTeamId());
            out.computeIfAbsent(m.awayTeamId(), k -> new HashSet<>()).add(m.homeTeamId());
        }
        return out;
    }

    private static boolean balanced(int home, int away) {
        int total = home + away;
        return Math.abs(home - away) <= total % 2;
    }
}
