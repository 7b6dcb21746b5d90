package com.gnovoa.publeague.rosters;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.publeague.model.DivisionType;
import com.gnovoa.publeague.model.Team;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RosterCatalogTest {

  @TempDir Path dir;

  private final ObjectMapper mapper = new ObjectMapper();

  private SchedulerProperties props(Map<String, String> files) {
    return new SchedulerProperties(
        List.of("North", "South"), LocalTime.of(8, 20), 70, 6,
        new SchedulerProperties.Rosters(dir.toString(), files));
  }

  private void write(String file, String json) throws IOException {
    Files.writeString(dir.resolve(file), json);
  }

  @Test
  void loadsRostersFromJson() throws IOException {
    write("classic.json", """
        {"divisionId":"classic","name":"Classic","type":"CLASSIC",
         "teams":[{"teamId":1,"name":"A"},{"teamId":2,"name":"B"},{"teamId":3,"name":"C"},{"teamId":4,"name":"D"}]}
        """);

    RosterCatalog catalog = new RosterCatalog(mapper, props(Map.of("classic", "classic.json")));

    DivisionRoster roster = catalog.division("classic").orElseThrow();
    assertThat(roster.type()).isEqualTo(DivisionType.CLASSIC);
    assertThat(roster.teams()).extracting(Team::divisionId).containsOnly("classic");
    assertThat(catalog.findTeam(3)).map(Team::name).contains("C");
    assertThat(catalog.division("premier")).isEmpty();
  }

  @Test
  void missingFileFailsFast() {
    assertThatThrownBy(() -> new RosterCatalog(mapper, props(Map.of("classic", "nope.json"))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("classic");
  }

  @Test
  void divisionIdMustMatchKey() throws IOException {
    write("x.json", """
        {"divisionId":"other","name":"X","type":"CLASSIC","teams":[]}
        """);

    assertThatThrownBy(() -> new RosterCatalog(mapper, props(Map.of("classic", "x.json"))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("mismatch");
  }

  private static List<Team> teams(int firstId, int count) {
    return IntStream.range(0, count).mapToObj(i -> new Team(firstId + i, "T" + (firstId + i), null)).toList();
  }

  @Test
  void duplicateTeamIdsAcrossDivisions() {
    List<DivisionRoster> rosters = List.of(
        new DivisionRoster("a", "A", DivisionType.CLASSIC, teams(1, 4)),
        new DivisionRoster("b", "B", DivisionType.CLASSIC, teams(4, 4)));

    assertThatThrownBy(() -> new RosterCatalog(rosters))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Duplicate team id 4");
  }

  @Test
  void nonPositiveIdsRejected() {
    List<DivisionRoster> rosters =
        List.of(new DivisionRoster("a", "A", DivisionType.CLASSIC, List.of(new Team(-3, "Neg", null))));

    assertThatThrownBy(() -> new RosterCatalog(rosters)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("A roster whose team count does not fit its division type is rejected at load")
  void teamCountMustFitDivisionType() {
    List<DivisionRoster> eightTeamClassic =
        List.of(new DivisionRoster("classic", "Classic", DivisionType.CLASSIC, teams(1, 8)));
    List<DivisionRoster> shortPremier =
        List.of(new DivisionRoster("premier", "Premier", DivisionType.PREMIER, teams(1, 7)));

    assertThatThrownBy(() -> new RosterCatalog(eightTeamClassic))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must have exactly 4 teams, found 8");
    assertThatThrownBy(() -> new RosterCatalog(shortPremier))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must have exactly 8 teams, found 7");
  }

  @Test
  void placeholderTeamsAreNotCounted() {
    List<Team> withFunWeek = new ArrayList<>(teams(1, 4));
    withFunWeek.add(new Team(90, RosterResolver.FUN_WEEK, null));

    RosterCatalog catalog =
        new RosterCatalog(List.of(new DivisionRoster("classic", "Classic", DivisionType.CLASSIC, withFunWeek)));

    assertThat(catalog.division("classic").orElseThrow().teams()).hasSize(5);
  }
}
