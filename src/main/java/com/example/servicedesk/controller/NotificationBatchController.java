package com.example.servicedesk.controller;

import com.example.servicedesk.batching.BatchStatistics;
import com.example.servicedesk.batching.BatchingEngine;
import com.example.servicedesk.domain.BatchStatus;
import com.example.servicedesk.domain.NotificationBatch;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Notification Batch REST API Controller.
 */
@RestController
@RequestMapping("/api/batches")
@RequiredArgsConstructor
public class NotificationBatchController {

    private final BatchingEngine batchingEngine;

    @GetMapping
    public ResponseEntity<List<NotificationBatch>> listBatches(
            @RequestParam(defaultValue = "pending") String status,
            @RequestParam(required = false) String batchKey) {
        if (batchKey != null) {
            return ResponseEntity.ok(batchingEngine.getBatchesForKey(batchKey));
        }
        return ResponseEntity.ok(batchingEngine.getBatches(BatchStatus.valueOf(status.trim().toUpperCase(Locale.ROOT))));
    }

    @GetMapping("/{id}")
    public ResponseEntity<NotificationBatch> getBatch(@PathVariable String id) {
        return ResponseEntity.ok(batchingEngine.getBatch(id));
    }

    @PostMapping("/{id}/flush")
    public ResponseEntity<Map<String, Object>> flushBatch(@PathVariable String id) {
        boolean flushed = batchingEngine.flush(id);
        return ResponseEntity.ok(Map.of("id", id, "flushed", flushed));
    }

    @GetMapping("/stats")
    public ResponseEntity<BatchStatistics> getStats() {
        return ResponseEntity.ok(batchingEngine.getStatistics());
    }
}
