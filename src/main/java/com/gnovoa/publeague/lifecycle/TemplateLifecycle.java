package com.gnovoa.publeague.lifecycle;

import com.gnovoa.publeague.exception.SchedulingException;
import com.gnovoa.publeague.exception.TemplateNotFoundException;
import com.gnovoa.publeague.schedule.ScheduleTemplateRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Preview, persist, commit and delete for template rows.
 *
 * <p>Committed rows are read-only from here: commit skips them and delete leaves them alone.
 */
public final class TemplateLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TemplateLifecycle.class);

    private static final Comparator<ScheduleTemplateRow> ROW_ORDER = Comparator
            .comparingInt(ScheduleTemplateRow::weekNumber)
            .thenComparing(ScheduleTemplateRow::scheduledTime, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(ScheduleTemplateRow::fieldName, Comparator.nullsLast(Comparator.naturalOrder()));

    public record CommittedMatch(long templateId, long matchId) {}

    private final ScheduleTemplateStore store;
    private final MatchCreator matchCreator;

    public TemplateLifecycle(ScheduleTemplateStore store, MatchCreator matchCreator) {
        this.store = store;
        this.matchCreator = matchCreator;
    }

    /** Uncommitted rows of a division grouped by week number, each week ordered by time and field. */
    public SortedMap<Integer, List<ScheduleTemplateRow>> preview(String divisionId) {
        return store.findByDivision(divisionId).stream()
                .filter(r -> !r.committed())
                .sorted(ROW_ORDER)
                .collect(Collectors.groupingBy(ScheduleTemplateRow::weekNumber, TreeMap::new, Collectors.toList()));
    }

    public List<ScheduleTemplateRow> persist(List<ScheduleTemplateRow> rows) {
        List<ScheduleTemplateRow> saved = store.saveAll(rows);
        log.info("Persisted {} uncommitted template row(s)", saved.size());
        return saved;
    }

    /** Replaces all uncommitted rows of a division in one store call. Committed rows are kept. */
    public List<ScheduleTemplateRow> replaceUncommitted(String divisionId, List<ScheduleTemplateRow> rows) {
        List<ScheduleTemplateRow> saved = store.replaceUncommitted(divisionId, rows);
        log.info("Replaced uncommitted rows of division {} with {} new row(s)", divisionId, saved.size());
        return saved;
    }

    /**
     * Creates a real match for each targeted uncommitted row, then marks the rows committed.
     *
     * <p>Rows are only flagged once every match has been created. If a match creation or the
     * final flagging fails, the matches created so far are deleted again and every row stays
     * uncommitted, so the commit can simply be retried.
     *
     * @param templateIds rows to commit; null or empty commits every uncommitted row of the division
     * @throws TemplateNotFoundException if any of the given ids does not belong to the division
     */
    public List<CommittedMatch> commit(String divisionId, Collection<Long> templateIds) {
        List<ScheduleTemplateRow> targets = targets(divisionId, templateIds);
        List<CommittedMatch> out = new ArrayList<>();
        for (ScheduleTemplateRow r : targets) {
            if (r.committed()) {
                log.debug("Template {} already committed, skipping", r.templateId());
                continue;
            }
            try {
                long matchId = matchCreator.createMatch(r.scheduledDate(), r.scheduledTime(), r.fieldName(),
                        r.homeTeamId(), r.awayTeamId(), r.weekNumber(), r.weekType(),
                        r.specialWeek(), r.playoff(), r.playoffRound());
                out.add(new CommittedMatch(r.templateId(), matchId));
            } catch (RuntimeException e) {
                throw rollBack(out, new SchedulingException("COMMIT_FAILED",
                        "Creating the match for template " + r.templateId() + " failed; no rows were committed", e));
            }
        }
        try {
            store.markCommitted(out.stream().map(CommittedMatch::templateId).toList());
        } catch (RuntimeException e) {
            throw rollBack(out, new SchedulingException("COMMIT_FAILED",
                    "Flagging " + out.size() + " template row(s) as committed failed", e));
        }
        log.info("Committed {} template row(s) for division {}", out.size(), divisionId);
        return out;
    }

    /**
     * Deletes uncommitted rows.
     *
     * @param templateIds rows to delete; null or empty deletes every uncommitted row of the division
     * @return number of rows removed
     */
    public int delete(String divisionId, Collection<Long> templateIds) {
        List<ScheduleTemplateRow> targets = targets(divisionId, templateIds);
        List<Long> deletable = targets.stream().filter(r -> !r.committed()).map(ScheduleTemplateRow::templateId).toList();
        if (deletable.size() < targets.size()) {
            log.warn("Ignoring {} committed row(s) in delete request for division {}", targets.size() - deletable.size(), divisionId);
        }
        int removed = store.deleteUncommitted(deletable);
        log.info("Deleted {} template row(s) for division {}", removed, divisionId);
        return removed;
    }

    /** Deletes the matches created by a failed commit, newest first. Undo failures are attached as suppressed. */
    private SchedulingException rollBack(List<CommittedMatch> created, SchedulingException failure) {
        for (int i = created.size() - 1; i >= 0; i--) {
            long matchId = created.get(i).matchId();
            try {
                matchCreator.deleteMatch(matchId);
            } catch (RuntimeException e) {
                log.error("Could not delete match {} after a failed commit", matchId, e);
                failure.addSuppressed(e);
            }
        }
        log.warn("Commit rolled back, deleted {} created match(es)", created.size());
        return failure;
    }

    private List<ScheduleTemplateRow> targets(String divisionId, Collection<Long> templateIds) {
        if (templateIds == null || templateIds.isEmpty()) {
            return store.findByDivision(divisionId).stream().filter(r -> !r.committed()).sorted(ROW_ORDER).toList();
        }
        Set<Long> wanted = new LinkedHashSet<>(templateIds);
        List<ScheduleTemplateRow> found = store.findByIds(divisionId, wanted);
        if (found.size() != wanted.size()) {
            Set<Long> missing = new LinkedHashSet<>(wanted);
            found.forEach(r -> missing.remove(r.templateId()));
            throw new TemplateNotFoundException(divisionId, missing);
        }
        return found;
    }
}
