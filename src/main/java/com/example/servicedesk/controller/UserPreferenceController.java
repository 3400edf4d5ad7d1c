package com.example.servicedesk.controller;

import com.example.servicedesk.domain.UserNotificationPreferences;
import com.example.servicedesk.service.UserPreferenceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Notification preferences of one recipient.
 */
@RestController
@RequestMapping("/api/users/{userId}/preferences")
@RequiredArgsConstructor
public class UserPreferenceController {

    private final UserPreferenceService preferenceService;

    @GetMapping
    public ResponseEntity<UserNotificationPreferences> getPreferences(@PathVariable String userId) {
        return ResponseEntity.ok(preferenceService.get(userId));
    }

    @PutMapping
    public ResponseEntity<UserNotificationPreferences> savePreferences(@PathVariable String userId,
                                                                       @RequestBody UserNotificationPreferences preferences,
                                                                       @RequestHeader(value = Actors.HEADER, required = false) String actor) {
        return ResponseEntity.ok(preferenceService.save(userId, preferences, Actors.orDefault(actor)));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, String>> deletePreferences(@PathVariable String userId,
                                                                 @RequestHeader(value = Actors.HEADER, required = false) String actor) {
        preferenceService.delete(userId, Actors.orDefault(actor));
        return ResponseEntity.ok(Map.of("status", "deleted", "userId", userId));
    }
}
