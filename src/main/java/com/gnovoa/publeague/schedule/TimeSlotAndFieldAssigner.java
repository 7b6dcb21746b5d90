package com.gnovoa.publeague.schedule;

import com.gnovoa.publeague.model.DivisionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalTime;
import java.util.*;

/**
 * Places a week's pairings on the clock and on fields.
 *
 * <p>Two matches run per time slot, one on each field. Premier divisions play at fixed times
 * 08:20, 09:30, 10:40 and 11:50; Classic divisions at 13:10 and 14:20. Other division types get
 * evenly spaced slots from the configured start time.
 */
public final class TimeSlotAndFieldAssigner {

    private static final Logger log = LoggerFactory.getLogger(TimeSlotAndFieldAssigner.class);

    public static final List<LocalTime> PREMIER_TIMES = List.of(
            LocalTime.of(8, 20), LocalTime.of(9, 30), LocalTime.of(10, 40), LocalTime.of(11, 50));
    public static final List<LocalTime> CLASSIC_TIMES = List.of(
            LocalTime.of(13, 10), LocalTime.of(14, 20));

    private static final int MATCHES_PER_SLOT = 2;

    private final List<String> fields;
    private final LocalTime defaultStart;
    private final int matchDurationMinutes;

    public TimeSlotAndFieldAssigner(List<String> fields, LocalTime defaultStart, int matchDurationMinutes) {
        if (fields == null || fields.isEmpty()) throw new IllegalArgumentException("At least one field is required");
        this.fields = List.copyOf(fields);
        this.defaultStart = defaultStart;
        this.matchDurationMinutes = matchDurationMinutes;
    }

    public List<String> fields() {
        return fields;
    }

    /** Clock times for one match day of the given division. */
    public List<LocalTime> timeSlots(DivisionType type, int teamCount) {
        if (type == DivisionType.PREMIER) return PREMIER_TIMES;
        if (type == DivisionType.CLASSIC) return CLASSIC_TIMES;

        List<LocalTime> slots = new ArrayList<>(teamCount);
        LocalTime t = defaultStart;
        for (int i = 0; i < Math.max(teamCount, 1); i++) {
            slots.add(t);
            t = t.plusMinutes(matchDurationMinutes);
        }
        return slots;
    }

    /**
     * Assigns each match a time, field and per-team match order.
     *
     * <p>4 matches over 2 slots and 8 matches over 4 slots are laid out two per slot in the given
     * order, first match of a slot on the first field. Any other shape falls back to two matches
     * per slot with the field alternating by index.
     */
    public List<SlotAssignment> assign(List<MatchSlot> matches, List<LocalTime> timeSlots) {
        if (timeSlots.isEmpty()) throw new IllegalArgumentException("No time slots available");
        int n = matches.size();
        boolean fixedLayout = (n == 4 && timeSlots.size() == 2) || (n == 8 && timeSlots.size() == 4);
        if (!fixedLayout) {
            log.debug("No fixed layout for {} matches over {} slots, using generic assignment", n, timeSlots.size());
        }

        Map<Integer, Integer> gamesSoFar = new HashMap<>();
        List<SlotAssignment> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            MatchSlot m = matches.get(i);
            int slot = fixedLayout ? i / MATCHES_PER_SLOT : (i / MATCHES_PER_SLOT) % timeSlots.size();
            String field = fixedLayout ? fields.get((i % MATCHES_PER_SLOT) % fields.size()) : fields.get(i % fields.size());

            int order = gamesSoFar.merge(m.homeTeamId(), 1, Integer::sum);
            gamesSoFar.merge(m.awayTeamId(), 1, Integer::sum);
            out.add(new SlotAssignment(m.homeTeamId(), m.awayTeamId(), timeSlots.get(slot), field, order, slot));
        }
        return out;
    }

    /**
     * Assigns a regular week and records it in {@code ledger}. Four-slot weeks go through
     * {@link #balancePremierTimeSlots} first.
     */
    public List<SlotAssignment> assignWeek(List<MatchSlot> matches, List<LocalTime> timeSlots, BalanceLedger ledger) {
        List<SlotAssignment> week = assign(matches, timeSlots);
        if (timeSlots.size() == 4 && matches.size() == 8) {
            week = balancePremierTimeSlots(week, timeSlots, ledger);
        }
        ledger.record(week, timeSlots.size());
        return week;
    }

    /**
     * Best-effort early/late rebalancing for four-slot days.
     *
     * <p>Each team plays both its games inside the early window (slots 1-2) or the late window
     * (slots 3-4). If moving the whole early window to the late one and back lowers the combined
     * early/late skew of the teams so far, the two windows are exchanged. Fields and back-to-back
     * pairs are kept. This is greedy and may leave some imbalance.
     */
    public List<SlotAssignment> balancePremierTimeSlots(List<SlotAssignment> week, List<LocalTime> timeSlots,
                                                        BalanceLedger ledger) {
        Set<Integer> earlyTeams = new HashSet<>();
        Set<Integer> lateTeams = new HashSet<>();
        for (SlotAssignment a : week) {
            Set<Integer> target = a.slotIndex() < 2 ? earlyTeams : lateTeams;
            target.add(a.homeTeamId());
            target.add(a.awayTeamId());
        }
        if (skewAfter(earlyTeams, lateTeams, ledger) <= skewAfter(lateTeams, earlyTeams, ledger)) {
            return week;
        }

        log.debug("Swapping early and late windows to even out time slots");
        List<SlotAssignment> swapped = new ArrayList<>(week.size());
        for (SlotAssignment a : week) {
            int slot = (a.slotIndex() + 2) % 4;
            swapped.add(a.moveTo(slot, timeSlots.get(slot), a.matchOrder()));
        }
        swapped.sort(Comparator.comparingInt(SlotAssignment::slotIndex));
        return swapped;
    }

    private static int skewAfter(Set<Integer> early, Set<Integer> late, BalanceLedger ledger) {
        int skew = 0;
        Set<Integer> all = new HashSet<>(early);
        all.addAll(late);
        for (int team : all) {
            int e = ledger.earlyWindows(team) + (early.contains(team) ? 1 : 0);
            int l = ledger.lateWindows(team) + (late.contains(team) ? 1 : 0);
            skew += Math.abs(e - l);
        }
        return skew;
    }
}
