package dev.changeguard.controller;

import dev.changeguard.domain.enums.ValidationStatus;
import dev.changeguard.dto.response.ValidationResponse;
import dev.changeguard.dto.response.ValidationStatsResponse;
import dev.changeguard.service.ValidationQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/validations")
public class ValidationController {
    private final ValidationQueryService queryService;
    public ValidationController(ValidationQueryService queryService) { this.queryService = queryService; }

    @GetMapping("/{changeId}")
    public ResponseEntity<ValidationResponse> getValidation(@PathVariable String changeId) {
        return queryService.findByChangeId(changeId).map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build());
    }

    @GetMapping(params = "componentType")
    public List<ValidationResponse> getByComponentType(@RequestParam String componentType,
                                                       @RequestParam(defaultValue = "50") int limit) {
        return queryService.findByComponentType(componentType, limit);
    }

    @GetMapping(params = "!componentType")
    public List<ValidationResponse> getRecent(@RequestParam(defaultValue = "COMPLETED") ValidationStatus status,
                                              @RequestParam(defaultValue = "7") int days,
                                              @RequestParam(defaultValue = "50") int limit) {
        return queryService.findRecentByStatus(status, days, limit);
    }

    @GetMapping("/stats")
    public ValidationStatsResponse getStats(@RequestParam(defaultValue = "7") int days) {
        return queryService.stats(days);
    }
}
