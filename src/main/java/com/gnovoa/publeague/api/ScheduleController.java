package com.gnovoa.publeague.api;

import com.gnovoa.publeague.api.dto.GenerateScheduleRequest;
import com.gnovoa.publeague.api.dto.GenerationResponse;
import com.gnovoa.publeague.api.dto.SchedulePreviewResponse;
import com.gnovoa.publeague.api.dto.TemplateActionResponse;
import com.gnovoa.publeague.generation.ScheduleFacade;
import com.gnovoa.publeague.schedule.ScheduleAudit;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/divisions/{divisionId}/schedule")
public class ScheduleController {

    private final ScheduleFacade facade;

    public ScheduleController(ScheduleFacade facade) {
        this.facade = facade;
    }

    @PostMapping("/generate")
    public ResponseEntity<GenerationResponse> generate(@PathVariable String divisionId,
                                                       @Valid @RequestBody GenerateScheduleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(facade.generate(divisionId, request));
    }

    @PostMapping("/regenerate")
    public ResponseEntity<GenerationResponse> regenerate(@PathVariable String divisionId,
                                                         @Valid @RequestBody GenerateScheduleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(facade.regenerate(divisionId, request));
    }

    @GetMapping("/preview")
    public SchedulePreviewResponse preview(@PathVariable String divisionId) {
        return facade.preview(divisionId);
    }

    @GetMapping("/audit")
    public ScheduleAudit audit(@PathVariable String divisionId) {
        return facade.audit(divisionId);
    }

    @PostMapping("/commit")
    public TemplateActionResponse commit(@PathVariable String divisionId,
                                         @RequestParam(required = false) List<Long> templateIds) {
        return facade.commit(divisionId, templateIds);
    }

    @DeleteMapping
    public TemplateActionResponse delete(@PathVariable String divisionId,
                                         @RequestParam(required = false) List<Long> templateIds) {
        return facade.delete(divisionId, templateIds);
    }
}
