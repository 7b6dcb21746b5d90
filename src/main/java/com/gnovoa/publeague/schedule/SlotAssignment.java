package com.gnovoa.publeague.schedule;

import java.time.LocalTime;

/**
 * A pairing placed on the clock and a field. {@code matchOrder} is 1 or 2 for the first or
 * second game of the day; {@code slotIndex} is the 0-based position of {@code time} in the
 * week's slot list.
 */
public record SlotAssignment(
        int homeTeamId,
        int awayTeamId,
        LocalTime time,
        String field,
        int matchOrder,
        int slotIndex
) {
    public boolean involves(int teamId) {
        return homeTeamId == teamId || awayTeamId == teamId;
    }

    SlotAssignment moveTo(int newSlotIndex, LocalTime newTime, int newMatchOrder) {
        return new SlotAssignment(homeTeamId, awayTeamId, newTime, field, newMatchOrder, newSlotIndex);
    }
}
