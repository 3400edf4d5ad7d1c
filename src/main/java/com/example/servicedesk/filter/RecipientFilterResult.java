package com.example.servicedesk.filter;

import com.example.servicedesk.domain.NotificationEvent;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

/**
 * The event narrowed to the recipients whose preferences accept it.
 */
@Data
@AllArgsConstructor
public class RecipientFilterResult {

    /** Narrowed event; null when every target user was dropped */
    private NotificationEvent event;

    /** Dropped user id to the reason, in target order */
    private Map<String, String> droppedRecipients;

    public boolean isBlocked() {
        return event == null;
    }
}
