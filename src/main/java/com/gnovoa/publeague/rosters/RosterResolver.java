package com.gnovoa.publeague.rosters;

import com.gnovoa.publeague.model.Team;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Splits a division's teams into the real teams that get fixtures and the placeholder teams used
 * to label special weeks.
 *
 * <p>Older seasons stored "FUN WEEK", "BYE" and "TST" as real team rows. Those rows are never
 * scheduled. When a division still has one of them it is reused as the placeholder, otherwise a
 * virtual team with a negative id is created for this run only. Virtual ids start at
 * {@value #FIRST_PLACEHOLDER_ID} and decrease.
 */
public final class RosterResolver {

    private static final Logger log = LoggerFactory.getLogger(RosterResolver.class);

    public static final String FUN_WEEK = "FUN WEEK";
    public static final String BYE = "BYE";
    public static final String TST = "TST";

    /** Placeholder names, in the order their virtual ids are handed out. */
    public static final List<String> PLACEHOLDER_NAMES = List.of(FUN_WEEK, BYE, TST);

    public static final int FIRST_PLACEHOLDER_ID = -1000;

    private final String divisionId;
    private final TeamDirectory directory;
    private final List<Team> realTeams;
    private final Map<String, Team> placeholdersByName;
    private final Team[] virtualTeams;

    private RosterResolver(String divisionId, TeamDirectory directory, List<Team> divisionTeams) {
        this.divisionId = divisionId;
        this.directory = directory;

        List<Team> real = new ArrayList<>();
        Map<String, Team> legacy = new HashMap<>();
        for (Team t : divisionTeams) {
            if (PLACEHOLDER_NAMES.contains(t.name())) legacy.putIfAbsent(t.name(), t);
            else real.add(t);
        }
        this.realTeams = List.copyOf(real);

        Map<String, Team> placeholders = new LinkedHashMap<>();
        List<Team> virtual = new ArrayList<>();
        int nextId = FIRST_PLACEHOLDER_ID;
        for (String name : PLACEHOLDER_NAMES) {
            Team existing = legacy.get(name);
            if (existing != null) {
                log.debug("Division {} still has a stored '{}' team (id {}), reusing it", divisionId, name, existing.teamId());
                placeholders.put(name, existing);
                continue;
            }
            Team synthetic = new Team(nextId--, name, divisionId);
            placeholders.put(name, synthetic);
            virtual.add(synthetic);
        }
        this.placeholdersByName = Collections.unmodifiableMap(placeholders);
        this.virtualTeams = virtual.toArray(new Team[0]);
    }

    public static RosterResolver of(String divisionId, List<Team> divisionTeams, TeamDirectory directory) {
        return new RosterResolver(divisionId, directory, divisionTeams);
    }

    public String divisionId() {
        return divisionId;
    }

    /** Teams that receive fixtures, in roster order. */
    public List<Team> realTeams() {
        return realTeams;
    }

    public List<Integer> realTeamIds() {
        return realTeams.stream().map(Team::teamId).toList();
    }

    /** Teams created by this resolver. Never persisted. */
    public List<Team> virtualTeams() {
        return List.of(virtualTeams);
    }

    public Optional<Team> placeholder(String name) {
        return Optional.ofNullable(placeholdersByName.get(name));
    }

    /**
     * Looks a team up by id. Negative ids are answered from this run's virtual teams, everything
     * else goes to the team directory.
     */
    public Optional<Team> lookup(int teamId) {
        if (teamId < 0) {
            int index = FIRST_PLACEHOLDER_ID - teamId;
            if (index < 0 || index >= virtualTeams.length) return Optional.empty();
            return Optional.of(virtualTeams[index]);
        }
        for (Team t : realTeams) {
            if (t.teamId() == teamId) return Optional.of(t);
        }
        for (Team t : placeholdersByName.values()) {
            if (t.teamId() == teamId) return Optional.of(t);
        }
        return directory == null ? Optional.empty() : directory.findTeam(teamId);
    }

    public String teamName(int teamId) {
        return lookup(teamId).map(Team::name).orElse("Unknown");
    }
}
