package com.gnovoa.publeague.season;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.publeague.exception.UnknownDivisionTypeException;
import com.gnovoa.publeague.model.DivisionType;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class SeasonConfigurationsTest {

  private static final LocalDate START = LocalDate.of(2025, 3, 2);

  @Test
  void premierSeasonLayout() {
    List<WeekDescriptor> weeks = SeasonConfigurations.defaults(DivisionType.PREMIER).toWeekDescriptors(START);

    assertThat(weeks).extracting(WeekDescriptor::weekType)
        .containsExactly("REGULAR", "REGULAR", "REGULAR", "REGULAR", "REGULAR", "REGULAR", "REGULAR",
            "TST", "FUN", "BONUS", "PLAYOFF", "PLAYOFF");
    assertThat(weeks).extracting(WeekDescriptor::weekOrder).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12);
    assertThat(weeks.get(11).date()).isEqualTo(START.plusWeeks(11));
    assertThat(weeks.get(10).playoffRound()).isEqualTo(1);
    assertThat(weeks.get(11).playoffRound()).isEqualTo(2);
  }

  @Test
  void classicWithPractice() {
    SeasonConfiguration config = SeasonConfigurations.defaults(DivisionType.CLASSIC, true);
    List<WeekDescriptor> weeks = config.toWeekDescriptors(START);

    assertThat(config.hasPracticeSessions()).isTrue();
    assertThat(weeks).hasSize(9);
    assertThat(weeks).extracting(WeekDescriptor::practiceSession)
        .containsExactly(true, true, false, false, false, false, false, false, false);
  }

  @Test
  void ecsFcMirrorsClassicWithoutExtras() {
    SeasonConfiguration config = SeasonConfigurations.defaults("ecs_fc", true);

    assertThat(config.regularSeasonWeeks()).isEqualTo(8);
    assertThat(config.playoffWeeks()).isEqualTo(1);
    assertThat(config.hasPracticeSessions()).isFalse();
    assertThat(config.hasFunWeek() || config.hasTstWeek() || config.hasBonusWeek()).isFalse();
  }

  @Test
  void unknownDivisionType() {
    assertThatThrownBy(() -> SeasonConfigurations.defaults("Womens", false))
        .isInstanceOf(UnknownDivisionTypeException.class)
        .hasMessage("Unknown league type: Womens");
  }
}
