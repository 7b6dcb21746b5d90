package com.gnovoa.publeague.lifecycle;

import com.gnovoa.publeague.schedule.ScheduleTemplateRow;

import java.util.*;

/** Keeps template rows in memory, keyed by template id. */
public final class InMemoryScheduleTemplateStore implements ScheduleTemplateStore {

    private final Map<Long, ScheduleTemplateRow> rows = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public synchronized List<ScheduleTemplateRow> saveAll(List<ScheduleTemplateRow> newRows) {
        checkNew(newRows);
        return insert(newRows);
    }

    @Override
    public synchronized List<ScheduleTemplateRow> replaceUncommitted(String divisionId, List<ScheduleTemplateRow> newRows) {
        checkNew(newRows);
        for (ScheduleTemplateRow r : newRows) {
            if (!r.divisionId().equals(divisionId)) {
                throw new IllegalArgumentException("Row for division " + r.divisionId() + " in replacement of " + divisionId);
            }
        }
        rows.values().removeIf(r -> r.divisionId().equals(divisionId) && !r.committed());
        return insert(newRows);
    }

    private static void checkNew(List<ScheduleTemplateRow> newRows) {
        for (ScheduleTemplateRow r : newRows) {
            if (r.templateId() != null) throw new IllegalArgumentException("Row already persisted: " + r.templateId());
            if (r.divisionId() == null) throw new IllegalArgumentException("Row without division in week " + r.weekNumber());
        }
    }

    private List<ScheduleTemplateRow> insert(List<ScheduleTemplateRow> newRows) {
        List<ScheduleTemplateRow> saved = new ArrayList<>(newRows.size());
        for (ScheduleTemplateRow r : newRows) {
            ScheduleTemplateRow withId = r.withTemplateId(nextId++);
            rows.put(withId.templateId(), withId);
            saved.add(withId);
        }
        return saved;
    }

    @Override
    public synchronized List<ScheduleTemplateRow> findByDivision(String divisionId) {
        return rows.values().stream().filter(r -> r.divisionId().equals(divisionId)).toList();
    }

    @Override
    public synchronized List<ScheduleTemplateRow> findByIds(String divisionId, Collection<Long> templateIds) {
        return templateIds.stream()
                .map(rows::get)
                .filter(Objects::nonNull)
                .filter(r -> r.divisionId().equals(divisionId))
                .toList();
    }

    @Override
    public synchronized void markCommitted(Collection<Long> templateIds) {
        for (Long id : templateIds) {
            if (!rows.containsKey(id)) throw new IllegalArgumentException("Unknown template " + id);
        }
        templateIds.forEach(id -> rows.computeIfPresent(id, (k, r) -> r.asCommitted()));
    }

    @Override
    public synchronized int deleteUncommitted(Collection<Long> templateIds) {
        int removed = 0;
        for (Long id : templateIds) {
            ScheduleTemplateRow r = rows.get(id);
            if (r != null && !r.committed()) {
                rows.remove(id);
                removed++;
            }
        }
        return removed;
    }
}
