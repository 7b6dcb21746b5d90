package com.gnovoa.publeague.rosters;

import com.gnovoa.publeague.model.Team;

import java.util.Optional;

/**
 * Read side of the team store. Only real (positive id) teams are ever returned from here.
 */
public interface TeamDirectory {

    Optional<DivisionRoster> division(String divisionId);

    Optional<Team> findTeam(int teamId);
}
