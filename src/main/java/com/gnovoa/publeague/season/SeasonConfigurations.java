package com.gnovoa.publeague.season;

import com.gnovoa.publeague.model.DivisionType;

import java.util.Set;

/** Default season shapes per division type. */
public final class SeasonConfigurations {

    /** Regular weeks that carry a practice session when a Classic season asks for them. */
    public static final Set<Integer> CLASSIC_PRACTICE_WEEKS = Set.of(1, 2);

    private SeasonConfigurations() {
    }

    public static SeasonConfiguration defaults(DivisionType type) {
        return defaults(type, false);
    }

    /**
     * @param withPractice only honoured for Classic divisions
     */
    public static SeasonConfiguration defaults(DivisionType type, boolean withPractice) {
        return switch (type) {
            case PREMIER -> new SeasonConfiguration(DivisionType.PREMIER, 7, 2, true, true, true, Set.of());
            case CLASSIC -> new SeasonConfiguration(DivisionType.CLASSIC, 8, 1, false, false, false,
                    withPractice ? CLASSIC_PRACTICE_WEEKS : Set.of());
            case ECS_FC -> new SeasonConfiguration(DivisionType.ECS_FC, 8, 1, false, false, false, Set.of());
        };
    }

    public static SeasonConfiguration defaults(String divisionType, boolean withPractice) {
        return defaults(DivisionType.fromName(divisionType), withPractice);
    }
}
