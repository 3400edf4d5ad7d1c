package com.example.servicedesk.batching;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchStatistics {

    /** batchKey -> status -> batch count */
    private Map<String, Map<String, Long>> batchesByKeyAndStatus;

    private int pendingBatches;

    /** Events sitting in pending batches */
    private long pendingNotifications;

    /** Delayed events not yet released into a batch */
    private int deferredEvents;

    private int activeConfigurations;
}
