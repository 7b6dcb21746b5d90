package com.gnovoa.publeague.schedule;

import java.time.LocalTime;
import java.util.*;

/**
 * Per-run field and clock history per team, used to nudge later weeks towards an even split.
 */
public final class BalanceLedger {

    private final Map<Integer, Map<String, Integer>> fieldCounts = new HashMap<>();
    private final Map<Integer, List<LocalTime>> timeHistory = new HashMap<>();
    private final Map<Integer, Integer> earlyWindows = new HashMap<>();
    private final Map<Integer, Integer> lateWindows = new HashMap<>();

    public void record(List<SlotAssignment> week, int slotsPerWeek) {
        Set<Integer> early = new HashSet<>();
        Set<Integer> late = new HashSet<>();
        for (SlotAssignment a : week) {
            for (int team : new int[] {a.homeTeamId(), a.awayTeamId()}) {
                fieldCounts.computeIfAbsent(team, k -> new HashMap<>()).merge(a.field(), 1, Integer::sum);
                timeHistory.computeIfAbsent(team, k -> new ArrayList<>()).add(a.time());
                if (slotsPerWeek >= 4) {
                    if (a.slotIndex() < slotsPerWeek / 2) early.add(team);
                    else late.add(team);
                }
            }
        }
        early.forEach(t -> earlyWindows.merge(t, 1, Integer::sum));
        late.forEach(t -> lateWindows.merge(t, 1, Integer::sum));
    }

    public int fieldCount(int teamId, String field) {
        return fieldCounts.getOrDefault(teamId, Map.of()).getOrDefault(field, 0);
    }

    public int earlyWindows(int teamId) {
        return earlyWindows.getOrDefault(teamId, 0);
    }

    public int lateWindows(int teamId) {
        return lateWindows.getOrDefault(teamId, 0);
    }

    public List<LocalTime> times(int teamId) {
        return Collections.unmodifiableList(timeHistory.getOrDefault(teamId, List.of()));
    }
}
