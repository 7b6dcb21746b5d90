package com.gnovoa.publeague.rosters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.publeague.model.Team;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads division rosters from the local filesystem and serves them as the team store.
 *
 * <p>Rosters are configured via {@code scheduler.rosters.baseDir} and {@code
 * scheduler.rosters.files.*} and are expected to be JSON matching {@link DivisionRoster}.
 *
 * <p>All rosters are kept in memory. The catalog is constructed once at application startup and
 * fails fast if any roster file is missing or invalid.
 */
public final class RosterCatalog implements TeamDirectory {

  private static final Logger log = LoggerFactory.getLogger(RosterCatalog.class);

  /** In-memory roster cache by division id. */
  private final Map<String, DivisionRoster> rosters = new LinkedHashMap<>();

  private final Map<Integer, Team> teamsById = new HashMap<>();

  /**
   * Loads all configured rosters into memory.
   *
   * @param mapper Jackson mapper used to deserialize JSON roster files
   * @param props scheduler properties (includes roster file locations)
   * @throws IllegalStateException if a roster file cannot be read or parsed
   * @throws IllegalArgumentException if roster content is invalid (wrong division id, duplicate
   *     or non-positive team ids, team count not fitting the division type)
   */
  public RosterCatalog(ObjectMapper mapper, SchedulerProperties props) {
    Path baseDir = Path.of(props.rosters().baseDir()).toAbsolutePath().normalize();

    props
        .rosters()
        .files()
        .forEach(
            (divisionId, fileName) -> {
              Path p = baseDir.resolve(fileName).normalize();
              DivisionRoster roster;
              try (var in = Files.newInputStream(p)) {
                roster = mapper.readValue(in, DivisionRoster.class);
              } catch (Exception e) {
                throw new IllegalStateException(
                    "Failed to load roster " + divisionId + " from " + p, e);
              }
              register(roster, divisionId, p.toString());
            });
    log.info("Loaded {} division roster(s) from {}", rosters.size(), baseDir);
  }

  /** Builds a catalog from rosters already in memory. */
  public RosterCatalog(List<DivisionRoster> divisionRosters) {
    divisionRosters.forEach(r -> register(r, r.divisionId(), "<memory>"));
  }

  @Override
  public Optional<DivisionRoster> division(String divisionId) {
    return Optional.ofNullable(rosters.get(divisionId));
  }

  @Override
  public Optional<Team> findTeam(int teamId) {
    return Optional.ofNullable(teamsById.get(teamId));
  }

  private void register(DivisionRoster roster, String expectedDivisionId, String source) {
    validate(roster, expectedDivisionId, source);
    List<Team> teams =
        roster.teams().stream().map(t -> t.inDivision(expectedDivisionId)).toList();
    DivisionRoster normalized =
        new DivisionRoster(expectedDivisionId, roster.name(), roster.type(), teams);
    rosters.put(expectedDivisionId, normalized);
    teams.forEach(t -> teamsById.put(t.teamId(), t));
  }

  /**
   * Validates a roster:
   *
   * <ul>
   *   <li>Roster division id must match the configured key
   *   <li>Division type must be present
   *   <li>Team ids must be positive and unique across the catalog
   *   <li>Real team count must match the division type (placeholder teams not counted)
   * </ul>
   */
  private void validate(DivisionRoster roster, String expectedDivisionId, String source) {
    if (!expectedDivisionId.equals(roster.divisionId())) {
      throw new IllegalArgumentException("Roster division mismatch in " + source);
    }
    if (roster.type() == null) {
      throw new IllegalArgumentException(
          "Division " + expectedDivisionId + " has no type (file " + source + ")");
    }
    if (roster.teams() == null) {
      throw new IllegalArgumentException(
          "Division " + expectedDivisionId + " has no teams (file " + source + ")");
    }
    Set<Integer> seen = new HashSet<>();
    roster
        .teams()
        .forEach(
            t -> {
              if (t.teamId() <= 0) {
                throw new IllegalArgumentException(
                    "Team " + t.name() + " must have a positive id (file " + source + ")");
              }
              if (teamsById.containsKey(t.teamId()) || !seen.add(t.teamId())) {
                throw new IllegalArgumentException(
                    "Duplicate team id " + t.teamId() + " (file " + source + ")");
              }
            });
    long realTeams =
        roster.teams().stream()
            .filter(t -> !RosterResolver.PLACEHOLDER_NAMES.contains(t.name()))
            .count();
    if (realTeams != roster.type().teamCount()) {
      throw new IllegalArgumentException(
          "Division "
              + expectedDivisionId
              + " ("
              + roster.type()
              + ") must have exactly "
              + roster.type().teamCount()
              + " teams, found "
              + realTeams
              + " (file "
              + source
              + ")");
    }
  }
}
