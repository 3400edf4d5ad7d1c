package com.example.servicedesk.controller;

import com.example.servicedesk.domain.FilterRule;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.filter.FilterDecision;
import com.example.servicedesk.service.NotificationConfigService;
import com.example.servicedesk.service.NotificationIngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Filter Rule REST API Controller.
 */
@RestController
@RequestMapping("/api/filter-rules")
@RequiredArgsConstructor
public class FilterRuleController {

    private final NotificationConfigService configService;
    private final NotificationIngestionService ingestionService;

    @GetMapping
    public ResponseEntity<List<FilterRule>> listRules(@RequestParam(required = false) String ownerUserId) {
        return ResponseEntity.ok(configService.listFilterRules(ownerUserId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<FilterRule> getRule(@PathVariable String id) {
        return ResponseEntity.ok(configService.getFilterRule(id));
    }

    @PostMapping
    public ResponseEntity<FilterRule> createRule(@RequestBody FilterRule rule,
                                                 @RequestHeader(value = Actors.HEADER, required = false) String actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(configService.createFilterRule(rule, Actors.orDefault(actor)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<FilterRule> updateRule(@PathVariable String id, @RequestBody FilterRule rule,
                                                 @RequestHeader(value = Actors.HEADER, required = false) String actor) {
        return ResponseEntity.ok(configService.updateFilterRule(id, rule, Actors.orDefault(actor)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> deleteRule(@PathVariable String id,
                                                          @RequestHeader(value = Actors.HEADER, required = false) String actor) {
        configService.deleteFilterRule(id, Actors.orDefault(actor));
        return ResponseEntity.ok(Map.of("status", "deleted", "id", id));
    }

    /** Dry run: the decision the event would get right now. */
    @PostMapping("/evaluate")
    public ResponseEntity<FilterDecision> evaluate(@RequestBody NotificationEvent event) {
        return ResponseEntity.ok(ingestionService.preview(event));
    }
}
