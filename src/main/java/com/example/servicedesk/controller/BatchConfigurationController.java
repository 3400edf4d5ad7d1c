package com.example.servicedesk.controller;

import com.example.servicedesk.domain.BatchConfiguration;
import com.example.servicedesk.service.NotificationConfigService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Batch Configuration REST API Controller.
 */
@RestController
@RequestMapping("/api/batch-configs")
@RequiredArgsConstructor
public class BatchConfigurationController {

    private final NotificationConfigService configService;

    @GetMapping
    public ResponseEntity<List<BatchConfiguration>> listConfigurations() {
        return ResponseEntity.ok(configService.listBatchConfigurations());
    }

    @GetMapping("/{batchKey}")
    public ResponseEntity<BatchConfiguration> getConfiguration(@PathVariable String batchKey) {
        return ResponseEntity.ok(configService.getBatchConfiguration(batchKey));
    }

    @PostMapping
    public ResponseEntity<BatchConfiguration> createConfiguration(@RequestBody BatchConfiguration config,
                                                                  @RequestHeader(value = Actors.HEADER, required = false) String actor) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(configService.createBatchConfiguration(config, Actors.orDefault(actor)));
    }

    @PutMapping("/{batchKey}")
    public ResponseEntity<BatchConfiguration> updateConfiguration(@PathVariable String batchKey,
                                                                  @RequestBody BatchConfiguration config,
                                                                  @RequestHeader(value = Actors.HEADER, required = false) String actor) {
        return ResponseEntity.ok(configService.updateBatchConfiguration(batchKey, config, Actors.orDefault(actor)));
    }

    @DeleteMapping("/{batchKey}")
    public ResponseEntity<Map<String, String>> deleteConfiguration(@PathVariable String batchKey,
                                                                   @RequestHeader(value = Actors.HEADER, required = false) String actor) {
        configService.deleteBatchConfiguration(batchKey, Actors.orDefault(actor));
        return ResponseEntity.ok(Map.of("status", "deleted", "batchKey", batchKey));
    }
}
