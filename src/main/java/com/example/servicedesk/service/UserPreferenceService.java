package com.example.servicedesk.service;

import com.example.servicedesk.domain.UserNotificationPreferences;
import com.example.servicedesk.exception.EntityNotFoundException;
import com.example.servicedesk.repository.UserNotificationPreferencesRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;

/**
 * Per-user notification preferences. Saving replaces the whole record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserPreferenceService {

    private final UserNotificationPreferencesRepository preferencesRepository;
    private final ConfigurationValidator validator;
    private final AuditService auditService;
    private final Clock clock;

    public UserNotificationPreferences get(String userId) {
        return preferencesRepository.findById(userId)
                .orElseThrow(() -> new EntityNotFoundException("UserNotificationPreferences", userId));
    }

    public UserNotificationPreferences save(String userId, UserNotificationPreferences preferences, String actor) {
        preferences.setUserId(userId);
        validator.validate(preferences);
        preferences.setUpdatedAt(clock.instant());
        UserNotificationPreferences saved = preferencesRepository.save(preferences);
        log.info("Notification preferences saved for {}", userId);
        auditService.log(actor, "USER_PREFERENCES_UPDATED", userId, Map.of(
                "quiet_hours", saved.isQuietHoursEnabled(),
                "working_hours", saved.isWorkingHoursEnabled()));
        return saved;
    }

    public void delete(String userId, String actor) {
        UserNotificationPreferences existing = get(userId);
        preferencesRepository.delete(existing);
        auditService.log(actor, "USER_PREFERENCES_DELETED", userId, Map.of());
    }
}
