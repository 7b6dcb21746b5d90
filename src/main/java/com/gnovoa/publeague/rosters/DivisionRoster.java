package com.gnovoa.publeague.rosters;

import com.gnovoa.publeague.model.DivisionType;
import com.gnovoa.publeague.model.Team;

import java.util.List;

public record DivisionRoster(
        String divisionId,
        String name,
        DivisionType type,
        List<Team> teams
) {}
