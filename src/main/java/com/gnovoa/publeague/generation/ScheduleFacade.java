package com.gnovoa.publeague.generation;

import com.gnovoa.publeague.api.dto.GenerateScheduleRequest;
import com.gnovoa.publeague.api.dto.GenerationResponse;
import com.gnovoa.publeague.api.dto.SchedulePreviewResponse;
import com.gnovoa.publeague.api.dto.TemplateActionResponse;
import com.gnovoa.publeague.model.DivisionType;
import com.gnovoa.publeague.rosters.RosterResolver;
import com.gnovoa.publeague.schedule.ScheduleAudit;
import com.gnovoa.publeague.schedule.ScheduleTemplateRow;
import com.gnovoa.publeague.schedule.WeekType;
import com.gnovoa.publeague.season.WeekDescriptor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.SortedMap;

/** Maps between the REST DTOs and {@link SeasonGenerationService}. */
@Component
public final class ScheduleFacade {

    private final SeasonGenerationService service;

    public ScheduleFacade(SeasonGenerationService service) {
        this.service = service;
    }

    public GenerationResponse generate(String divisionId, GenerateScheduleRequest request) {
        var gen = service.generate(divisionId, descriptors(request), request.startDate(), request.practiceRequested(), true);
        return toResponse(divisionId, gen);
    }

    public GenerationResponse regenerate(String divisionId, GenerateScheduleRequest request) {
        var gen = service.regenerate(divisionId, descriptors(request), request.startDate(), request.practiceRequested());
        return toResponse(divisionId, gen);
    }

    public SchedulePreviewResponse preview(String divisionId) {
        return preview(divisionId, service.roster(divisionId), service.preview(divisionId));
    }

    public ScheduleAudit audit(String divisionId) {
        return service.audit(divisionId);
    }

    public TemplateActionResponse commit(String divisionId, List<Long> templateIds) {
        var committed = service.commit(divisionId, templateIds);
        var items = committed.stream()
                .map(c -> new TemplateActionResponse.CommittedItem(c.templateId(), c.matchId()))
                .toList();
        return new TemplateActionResponse(divisionId, "COMMIT", items.size(), items);
    }

    public TemplateActionResponse delete(String divisionId, List<Long> templateIds) {
        int removed = service.delete(divisionId, templateIds);
        return new TemplateActionResponse(divisionId, "DELETE", removed, List.of());
    }

    private GenerationResponse toResponse(String divisionId, SeasonGenerationService.Generation gen) {
        var violations = gen.plan().report().violations().stream()
                .map(v -> new GenerationResponse.ViolationItem(v.code().label(), v.code().description(),
                        v.weekNumber(), v.message(), v.advisory()))
                .toList();
        return new GenerationResponse(
                preview(divisionId, gen.roster(), service.preview(divisionId)),
                gen.plan().report().isAcceptable(),
                violations
        );
    }

    private static List<WeekDescriptor> descriptors(GenerateScheduleRequest request) {
        if (request.weeks() == null) return List.of();
        return request.weeks().stream()
                .map(w -> new WeekDescriptor(w.date(), w.weekType(), w.weekOrder(), w.playoffRound(),
                        w.practice(), w.description()))
                .toList();
    }

    private SchedulePreviewResponse preview(String divisionId, RosterResolver roster,
                                            SortedMap<Integer, List<ScheduleTemplateRow>> weeks) {
        DivisionType type = service.divisionType(divisionId);
        var items = weeks.entrySet().stream()
                .map(e -> new SchedulePreviewResponse.WeekItem(
                        e.getKey(),
                        e.getValue().isEmpty() ? null : e.getValue().get(0).scheduledDate(),
                        weekLabel(e.getValue()),
                        e.getValue().stream().map(r -> entry(r, roster)).toList()
                ))
                .toList();
        int total = weeks.values().stream().mapToInt(List::size).sum();
        return new SchedulePreviewResponse(divisionId, type, total, items);
    }

    private static SchedulePreviewResponse.Entry entry(ScheduleTemplateRow r, RosterResolver roster) {
        String eventName = r.isPlaceholder() ? label(r.weekType()) : null;
        return new SchedulePreviewResponse.Entry(
                r.templateId(),
                r.homeTeamId(),
                roster.teamName(r.homeTeamId()),
                r.awayTeamId(),
                roster.teamName(r.awayTeamId()),
                r.scheduledTime(),
                r.fieldName(),
                r.matchOrder(),
                r.weekType(),
                r.specialWeek(),
                r.practice(),
                r.playoff(),
                r.playoffRound(),
                r.eventTeamId(),
                eventName
        );
    }

    private static String weekLabel(List<ScheduleTemplateRow> rows) {
        if (rows.stream().anyMatch(ScheduleTemplateRow::practice)) return WeekType.PRACTICE.displayName();
        return rows.isEmpty() ? null : label(rows.get(0).weekType());
    }

    private static String label(String weekType) {
        return WeekType.parse(weekType).map(WeekType::displayName).orElse(weekType);
    }
}
