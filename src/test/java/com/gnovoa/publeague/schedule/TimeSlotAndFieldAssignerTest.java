package com.gnovoa.publeague.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.publeague.model.DivisionType;
import java.time.LocalTime;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TimeSlotAndFieldAssignerTest {

  private static final List<Integer> EIGHT = List.of(1, 2, 3, 4, 5, 6, 7, 8);

  private final TimeSlotAndFieldAssigner assigner =
      new TimeSlotAndFieldAssigner(List.of("North", "South"), LocalTime.of(8, 20), 70);

  @Test
  void fixedClockTimesPerDivision() {
    assertThat(assigner.timeSlots(DivisionType.PREMIER, 8))
        .containsExactly(LocalTime.of(8, 20), LocalTime.of(9, 30), LocalTime.of(10, 40), LocalTime.of(11, 50));
    assertThat(assigner.timeSlots(DivisionType.CLASSIC, 4))
        .containsExactly(LocalTime.of(13, 10), LocalTime.of(14, 20));
  }

  @Test
  @DisplayName("Divisions without fixed times get one slot per team from the start time")
  void genericSlots() {
    List<LocalTime> slots = assigner.timeSlots(DivisionType.ECS_FC, 8);

    assertThat(slots).hasSize(8);
    assertThat(slots.get(0)).isEqualTo(LocalTime.of(8, 20));
    assertThat(slots.get(1)).isEqualTo(LocalTime.of(9, 30));
    assertThat(slots.get(7)).isEqualTo(LocalTime.of(16, 30));
  }

  @Test
  void premierLayout() {
    List<SlotAssignment> placed =
        assigner.assign(PairingTables.premierWeek(0, EIGHT), TimeSlotAndFieldAssigner.PREMIER_TIMES);

    assertThat(placed).hasSize(8);
    assertThat(placed).extracting(SlotAssignment::time)
        .containsExactly(
            LocalTime.of(8, 20), LocalTime.of(8, 20), LocalTime.of(9, 30), LocalTime.of(9, 30),
            LocalTime.of(10, 40), LocalTime.of(10, 40), LocalTime.of(11, 50), LocalTime.of(11, 50));
    assertThat(placed).extracting(SlotAssignment::field)
        .containsExactly("North", "South", "North", "South", "North", "South", "North", "South");
    assertThat(placed.get(0).matchOrder()).isEqualTo(1);
    assertThat(placed.get(2).matchOrder()).as("team 1 second game").isEqualTo(2);
  }

  @Test
  void classicLayout() {
    List<SlotAssignment> placed =
        assigner.assign(PairingTables.classicWeek(0, List.of(1, 2, 3, 4)), TimeSlotAndFieldAssigner.CLASSIC_TIMES);

    assertThat(placed).extracting(SlotAssignment::slotIndex).containsExactly(0, 0, 1, 1);
    assertThat(placed).extracting(SlotAssignment::field).containsExactly("North", "South", "North", "South");
  }

  @Test
  @DisplayName("Other shapes place two matches per slot and alternate fields")
  void genericLayout() {
    List<MatchSlot> matches = List.of(new MatchSlot(1, 2), new MatchSlot(3, 4), new MatchSlot(1, 3));

    List<SlotAssignment> placed = assigner.assign(matches, TimeSlotAndFieldAssigner.PREMIER_TIMES);

    assertThat(placed).extracting(SlotAssignment::slotIndex).containsExactly(0, 0, 1);
    assertThat(placed).extracting(SlotAssignment::field).containsExactly("North", "South", "North");
  }

  @Test
  void noSlotsIsAnError() {
    assertThatThrownBy(() -> assigner.assign(List.of(new MatchSlot(1, 2)), List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Teams that already played early are moved to the late window")
  void windowsSwapWhenSkewed() {
    BalanceLedger ledger = new BalanceLedger();
    List<MatchSlot> week = PairingTables.premierWeek(0, EIGHT);
    assigner.assignWeek(week, TimeSlotAndFieldAssigner.PREMIER_TIMES, ledger);

    List<SlotAssignment> second = assigner.assignWeek(week, TimeSlotAndFieldAssigner.PREMIER_TIMES, ledger);

    assertThat(second.get(0).homeTeamId()).isEqualTo(5);
    assertThat(second.get(0).time()).isEqualTo(LocalTime.of(8, 20));
    assertThat(second.get(0).field()).isEqualTo("North");
    assertThat(ledger.earlyWindows(1)).isEqualTo(1);
    assertThat(ledger.lateWindows(1)).isEqualTo(1);
    assertThat(new ConstraintValidator().validateAssignments(List.of(second), EIGHT).has(ConstraintCode.C2_BACK_TO_BACK))
        .isFalse();
  }

  @Test
  void balancedHistoryKeepsLayout() {
    BalanceLedger ledger = new BalanceLedger();
    List<SlotAssignment> first =
        assigner.assignWeek(PairingTables.premierWeek(0, EIGHT), TimeSlotAndFieldAssigner.PREMIER_TIMES, ledger);

    assertThat(first.get(0)).isEqualTo(
        new SlotAssignment(1, 2, LocalTime.of(8, 20), "North", 1, 0));
    assertThat(ledger.fieldCount(1, "North")).isEqualTo(2);
    assertThat(ledger.times(1)).containsExactly(LocalTime.of(8, 20), LocalTime.of(9, 30));
  }
}
