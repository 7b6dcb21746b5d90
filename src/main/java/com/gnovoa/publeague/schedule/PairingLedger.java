package com.gnovoa.publeague.schedule;

import java.util.*;

/**
 * Running counters threaded through one pairing run: who each team has met, home and away
 * totals, how often each pair has met, and last week's opponents.
 */
public final class PairingLedger {

    private final Map<Integer, Set<Integer>> opponentHistory = new HashMap<>();
    private final Map<Integer, Integer> homeCount = new HashMap<>();
    private final Map<Integer, Integer> awayCount = new HashMap<>();
    private final Map<String, Integer> pairCounts = new HashMap<>();
    private Map<Integer, Set<Integer>> lastWeekOpponents = Map.of();

    public PairingLedger(Collection<Integer> teamIds) {
        for (int id : teamIds) {
            opponentHistory.put(id, new HashSet<>());
            homeCount.put(id, 0);
            awayCount.put(id, 0);
        }
    }

    public void record(List<MatchSlot> week) {
        Map<Integer, Set<Integer>> thisWeek = new HashMap<>();
        for (MatchSlot m : week) {
            if (m.isSpecialEvent()) continue;
            opponentHistory.computeIfAbsent(m.homeTeamId(), k -> new HashSet<>()).add(m.awayTeamId());
            opponentHistory.computeIfAbsent(m.awayTeamId(), k -> new HashSet<>()).add(m.homeTeamId());
            homeCount.merge(m.homeTeamId(), 1, Integer::sum);
            awayCount.merge(m.awayTeamId(), 1, Integer::sum);
            pairCounts.merge(m.pairKey(), 1, Integer::sum);
            thisWeek.computeIfAbsent(m.homeTeamId(), k -> new HashSet<>()).add(m.awayTeamId());
            thisWeek.computeIfAbsent(m.awayTeamId(), k -> new HashSet<>()).add(m.homeTeamId());
        }
        lastWeekOpponents = thisWeek;
    }

    public Map<Integer, Set<Integer>> lastWeekOpponents() {
        return Collections.unmodifiableMap(lastWeekOpponents);
    }

    public Set<Integer> opponentsOf(int teamId) {
        return Collections.unmodifiableSet(opponentHistory.getOrDefault(teamId, Set.of()));
    }

    public int homeGames(int teamId) {
        return homeCount.getOrDefault(teamId, 0);
    }

    public int awayGames(int teamId) {
        return awayCount.getOrDefault(teamId, 0);
    }

    public int pairCount(int a, int b) {
        return pairCounts.getOrDefault(MatchSlot.pairKey(a, b), 0);
    }
}
