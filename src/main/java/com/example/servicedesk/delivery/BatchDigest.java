package com.example.servicedesk.delivery;

import com.example.servicedesk.domain.NotificationPriority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Human-readable summary of a batch, sent alongside its notifications.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchDigest {
    private String batchId;
    private String batchKey;
    private String groupKey;
    private String title;
    private String message;
    private NotificationPriority priority;
    private int notificationCount;
    private Map<String, Integer> countsByType;
    private List<String> targetUserIds;
}
