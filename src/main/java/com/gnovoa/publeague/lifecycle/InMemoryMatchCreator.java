package com.gnovoa.publeague.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** Records created matches in memory. Stands in for the match service when none is wired. */
public final class InMemoryMatchCreator implements MatchCreator {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMatchCreator.class);

    public record CreatedMatch(
            long matchId,
            LocalDate date,
            LocalTime time,
            String field,
            int homeTeamId,
            int awayTeamId,
            int weekNumber,
            String weekType,
            boolean special,
            boolean playoff,
            Integer playoffRound
    ) {}

    private final AtomicLong ids = new AtomicLong(1);
    private final List<CreatedMatch> created = Collections.synchronizedList(new ArrayList<>());

    @Override
    public long createMatch(LocalDate date, LocalTime time, String field, int homeTeamId, int awayTeamId,
                            int weekNumber, String weekType, boolean special, boolean playoff, Integer playoffRound) {
        long id = ids.getAndIncrement();
        created.add(new CreatedMatch(id, date, time, field, homeTeamId, awayTeamId, weekNumber, weekType,
                special, playoff, playoffRound));
        log.debug("Created match {} week {} {} vs {} at {} {}", id, weekNumber, homeTeamId, awayTeamId, time, field);
        return id;
    }

    @Override
    public void deleteMatch(long matchId) {
        if (!created.removeIf(m -> m.matchId() == matchId)) {
            throw new IllegalArgumentException("Unknown match " + matchId);
        }
        log.debug("Deleted match {}", matchId);
    }

    public List<CreatedMatch> created() {
        synchronized (created) {
            return List.copyOf(created);
        }
    }
}
