package com.example.servicedesk.filter;

import com.example.servicedesk.domain.ChannelPreference;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.domain.UserNotificationPreferences;
import com.example.servicedesk.repository.UserNotificationPreferencesRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Checks each target user's own preferences before the filter rules run.
 *
 * Per user, in order: category opt-out, channel and priority preferences, quiet hours,
 * working hours, then hourly and daily limits. Users that fail a check are removed from the
 * targets; the channels left on the event are those still wanted by at least one remaining user.
 * An event without target users passes untouched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecipientPreferenceFilter {

    public static final String CHANNELS_KEY = "channels";
    public static final String DEFAULT_CHANNEL = "in_app";

    private final UserNotificationPreferencesRepository preferencesRepository;
    private final RecipientFrequencyTracker frequencyTracker;

    public RecipientFilterResult apply(NotificationEvent event, Instant now) {
        Set<String> targets = event.getTargetUserIds() == null ? Set.of() : event.getTargetUserIds().stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (targets.isEmpty()) {
            return new RecipientFilterResult(event, Map.of());
        }
        Map<String, UserNotificationPreferences> preferences = preferencesRepository.findAllById(targets)
                .stream()
                .collect(Collectors.toMap(UserNotificationPreferences::getUserId, Function.identity()));

        List<String> requestedChannels = channelsOf(event);
        List<String> kept = new ArrayList<>();
        Set<String> keptChannels = new LinkedHashSet<>();
        Map<String, String> dropped = new LinkedHashMap<>();

        for (String userId : targets) {
            UserNotificationPreferences userPreferences = preferences.get(userId);
            if (userPreferences == null) {
                kept.add(userId);
                keptChannels.addAll(requestedChannels);
                continue;
            }
            UserCheck check = check(event, requestedChannels, userPreferences, now);
            if (check.reason() != null) {
                log.debug("Event {} ({}) dropped for {}: {}", event.getId(), event.getType(), userId, check.reason());
                dropped.put(userId, check.reason());
            } else {
                kept.add(userId);
                keptChannels.addAll(check.channels());
            }
        }

        if (kept.isEmpty()) {
            return new RecipientFilterResult(null, dropped);
        }
        if (dropped.isEmpty() && keptChannels.equals(new LinkedHashSet<>(requestedChannels))) {
            return new RecipientFilterResult(event, dropped);
        }
        NotificationEvent narrowed = event.toBuilder()
                .targetUserIds(kept)
                .payload(new LinkedHashMap<>(event.getPayload() != null ? event.getPayload() : Map.of()))
                .build();
        if (!keptChannels.equals(new LinkedHashSet<>(requestedChannels))) {
            narrowed.getPayload().put(CHANNELS_KEY, List.copyOf(keptChannels));
        }
        return new RecipientFilterResult(narrowed, dropped);
    }

    private UserCheck check(NotificationEvent event, List<String> requestedChannels,
                            UserNotificationPreferences preferences, Instant now) {
        String category = NotificationCategories.of(event.getType());
        if (preferences.getDisabledCategories() != null && preferences.getDisabledCategories().contains(category)) {
            return UserCheck.drop("Category " + category + " disabled");
        }

        Map<String, ChannelPreference> channelPreferences =
                preferences.getChannels() != null ? preferences.getChannels() : Map.of();
        List<String> channels = requestedChannels;
        if (!channelPreferences.isEmpty()) {
            channels = requestedChannels.stream()
                    .filter(channel -> channelPreferences.containsKey(channel)
                            && channelPreferences.get(channel).accepts(event.getPriority()))
                    .toList();
            if (channels.isEmpty()) {
                return UserCheck.drop("No allowed channels");
            }
        }

        ZonedDateTime userTime = now.atZone(zoneOf(preferences));
        LocalTime timeOfDay = userTime.toLocalTime().truncatedTo(ChronoUnit.MINUTES);

        if (preferences.isQuietHoursEnabled()
                && isQuietTime(timeOfDay, preferences.getQuietHoursStart(), preferences.getQuietHoursEnd())) {
            channels = channels.stream()
                    .filter(channel -> {
                        ChannelPreference channelPreference = channelPreferences.get(channel);
                        return channelPreference != null && !channelPreference.isRespectsQuietHours();
                    })
                    .toList();
            if (channels.isEmpty()) {
                return UserCheck.drop("Quiet hours active");
            }
        }

        if (preferences.isWorkingHoursEnabled()) {
            Collection<?> days = preferences.getWorkingDays() != null ? preferences.getWorkingDays() : Set.of();
            if (!days.contains(userTime.getDayOfWeek())) {
                return UserCheck.drop("Outside working days");
            }
            if (timeOfDay.isBefore(preferences.getWorkingHoursStart())
                    || timeOfDay.isAfter(preferences.getWorkingHoursEnd())) {
                return UserCheck.drop("Outside working hours");
            }
        }

        if (preferences.getMaxPerHour() != null && frequencyTracker.countSince(preferences.getUserId(),
                now.minus(Duration.ofHours(1))) >= preferences.getMaxPerHour()) {
            return UserCheck.drop("Hourly limit reached");
        }
        if (preferences.getMaxPerDay() != null && frequencyTracker.countSince(preferences.getUserId(),
                now.minus(Duration.ofDays(1))) >= preferences.getMaxPerDay()) {
            return UserCheck.drop("Daily limit reached");
        }
        return new UserCheck(channels, null);
    }

    /** Both bounds inclusive; a window whose start is not before its end wraps past midnight. */
    static boolean isQuietTime(LocalTime time, LocalTime start, LocalTime end) {
        if (start.isBefore(end)) {
            return !time.isBefore(start) && !time.isAfter(end);
        }
        return !time.isBefore(start) || !time.isAfter(end);
    }

    private ZoneId zoneOf(UserNotificationPreferences preferences) {
        if (preferences.getTimezone() == null || preferences.getTimezone().isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(preferences.getTimezone());
        } catch (DateTimeException e) {
            log.warn("Unknown timezone '{}' for user {}, using UTC", preferences.getTimezone(), preferences.getUserId());
            return ZoneOffset.UTC;
        }
    }

    static List<String> channelsOf(NotificationEvent event) {
        Object value = event.getPayload() != null ? event.getPayload().get(CHANNELS_KEY) : null;
        if (value instanceof Collection<?> channels && !channels.isEmpty()) {
            return channels.stream().map(String::valueOf).distinct().toList();
        }
        return List.of(DEFAULT_CHANNEL);
    }

    private record UserCheck(List<String> channels, String reason) {

        static UserCheck drop(String reason) {
            return new UserCheck(List.of(), reason);
        }
    }
}
