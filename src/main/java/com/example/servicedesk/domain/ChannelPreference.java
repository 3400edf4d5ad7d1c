package com.example.servicedesk.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How one user wants a single delivery channel used.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChannelPreference {

    @Builder.Default
    private boolean enabled = true;

    /** Lowest priority sent over this channel; null accepts every priority */
    private NotificationPriority minPriority;

    /** true silences the channel during the user's quiet hours */
    @Builder.Default
    private boolean respectsQuietHours = true;

    public boolean accepts(NotificationPriority priority) {
        if (!enabled) {
            return false;
        }
        return minPriority == null || (priority != null && priority.isAtLeast(minPriority));
    }
}
