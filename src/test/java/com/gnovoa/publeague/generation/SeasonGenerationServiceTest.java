package com.gnovoa.publeague.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.publeague.exception.DivisionNotFoundException;
import com.gnovoa.publeague.exception.MissingWeekDateException;
import com.gnovoa.publeague.exception.SchedulingException;
import com.gnovoa.publeague.lifecycle.InMemoryMatchCreator;
import com.gnovoa.publeague.lifecycle.InMemoryScheduleTemplateStore;
import com.gnovoa.publeague.lifecycle.TemplateLifecycle;
import com.gnovoa.publeague.model.DivisionType;
import com.gnovoa.publeague.model.Team;
import com.gnovoa.publeague.rosters.DivisionRoster;
import com.gnovoa.publeague.rosters.RosterCatalog;
import com.gnovoa.publeague.schedule.ConstraintValidator;
import com.gnovoa.publeague.schedule.PairingGenerator;
import com.gnovoa.publeague.schedule.ScheduleAudit;
import com.gnovoa.publeague.schedule.TimeSlotAndFieldAssigner;
import com.gnovoa.publeague.schedule.WeekType;
import com.gnovoa.publeague.season.WeekDescriptor;
import com.gnovoa.publeague.season.WeekPlanBuilder;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SeasonGenerationServiceTest {

  private static final LocalDate START = LocalDate.of(2025, 3, 2);

  private InMemoryMatchCreator creator;
  private SeasonGenerationService service;

  private static DivisionRoster roster(String id, DivisionType type, int firstId, int count) {
    List<Team> teams =
        IntStream.range(0, count).mapToObj(i -> new Team(firstId + i, id + "-" + i, id)).toList();
    return new DivisionRoster(id, id, type, teams);
  }

  @BeforeEach
  void setUp() {
    ConstraintValidator validator = new ConstraintValidator();
    WeekPlanBuilder builder =
        new WeekPlanBuilder(
            new PairingGenerator(validator, 6),
            new TimeSlotAndFieldAssigner(List.of("North", "South"), LocalTime.of(8, 20), 70),
            validator);
    creator = new InMemoryMatchCreator();
    RosterCatalog catalog =
        new RosterCatalog(List.of(
            roster("premier", DivisionType.PREMIER, 101, 8),
            roster("classic", DivisionType.CLASSIC, 201, 4)));
    service =
        new SeasonGenerationService(
            catalog, builder, new TemplateLifecycle(new InMemoryScheduleTemplateStore(), creator), validator);
  }

  @Test
  @DisplayName("Default premier season is persisted and passes the audit")
  void generatePremierDefaults() {
    SeasonGenerationService.Generation gen = service.generate("premier", List.of(), START, false, true);

    assertThat(gen.persisted()).hasSize(96).allMatch(r -> r.templateId() != null);
    assertThat(gen.plan().report().isAcceptable()).isTrue();
    assertThat(service.preview("premier")).hasSize(12);

    ScheduleAudit audit = service.audit("premier");
    assertThat(audit.expectedMatches()).isEqualTo(56);
    assertThat(audit.allConstraintsSatisfied()).isTrue();
  }

  @Test
  void dryRunPersistsNothing() {
    SeasonGenerationService.Generation gen = service.generate("classic", List.of(), START, true, false);

    assertThat(gen.plan().rows()).isNotEmpty();
    assertThat(gen.persisted()).isEmpty();
    assertThat(service.preview("classic")).isEmpty();
  }

  @Test
  void classicAuditChecksEachRotation() {
    service.generate("classic", List.of(), START, false, true);

    ScheduleAudit audit = service.audit("classic");

    assertThat(audit.totalMatches()).isEqualTo(32);
    assertThat(audit.hardConstraintsSatisfied()).isTrue();
  }

  @Test
  @DisplayName("Regenerate replaces uncommitted rows and keeps committed ones")
  void regenerateKeepsCommittedRows() {
    var first = service.generate("premier", List.of(), START, false, true);
    long committedId = first.persisted().get(0).templateId();
    service.commit("premier", List.of(committedId));

    var second = service.regenerate("premier", List.of(), START, false);

    assertThat(second.persisted()).hasSize(96);
    assertThat(service.preview("premier").values().stream().mapToInt(List::size).sum()).isEqualTo(96);
    assertThat(creator.created()).hasSize(1);
    assertThat(service.delete("premier", null)).isEqualTo(96);
  }

  @Test
  @DisplayName("A regenerate that fails to build keeps the previous uncommitted season")
  void failedRegenerateKeepsPreviousRows() {
    service.generate("classic", List.of(), START, false, true);
    int before = service.preview("classic").values().stream().mapToInt(List::size).sum();
    List<WeekDescriptor> undated = List.of(WeekDescriptor.of(null, WeekType.REGULAR, 1));

    assertThatThrownBy(() -> service.regenerate("classic", undated, START, false))
        .isInstanceOf(MissingWeekDateException.class);
    assertThatThrownBy(() -> service.regenerate("classic", null, null, false))
        .isInstanceOf(SchedulingException.class);

    assertThat(before).isPositive();
    assertThat(service.preview("classic").values().stream().mapToInt(List::size).sum()).isEqualTo(before);
  }

  @Test
  @DisplayName("Practice weeks give up half of one rotation, which the classic audit reports")
  void classicPracticeSeasonAudit() {
    service.generate("classic", List.of(), START, true, true);

    ScheduleAudit audit = service.audit("classic");

    assertThat(audit.totalMatches()).isEqualTo(28);
    assertThat(audit.expectedMatches()).isEqualTo(32);
    assertThat(audit.c1DoubleRoundRobin()).isFalse();
    assertThat(audit.c2BackToBack()).isFalse();
    assertThat(audit.c3NoImmediateRematch()).isTrue();
    assertThat(audit.violations()).anyMatch(m -> m.contains("plays 1 games, expected 2"));
    assertThat(audit.violations()).anyMatch(m -> m.contains("in weeks 1-3"));
    assertThat(audit.violations()).noneMatch(m -> m.contains("in weeks 4-6"));
    assertThat(audit.hardConstraintsSatisfied()).isFalse();
  }

  @Test
  void unknownDivision() {
    assertThatThrownBy(() -> service.generate("nope", List.of(), START, false, true))
        .isInstanceOf(DivisionNotFoundException.class);
    assertThatThrownBy(() -> service.preview("nope")).isInstanceOf(DivisionNotFoundException.class);
  }

  @Test
  void startDateNeededWithoutWeeks() {
    assertThatThrownBy(() -> service.generate("premier", null, null, false, true))
        .isInstanceOf(SchedulingException.class)
        .hasMessageContaining("start date");
  }
}
