package com.example.servicedesk.domain;

import com.example.servicedesk.domain.json.ChannelPreferenceMapConverter;
import com.example.servicedesk.domain.json.DayOfWeekSetConverter;
import com.example.servicedesk.domain.json.StringSetConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * What one recipient agrees to receive, checked per target user before the filter rules.
 * A user without a stored row receives everything.
 */
@Entity
@Table(name = "user_notification_preferences")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserNotificationPreferences {

    @Id
    @Column(name = "user_id")
    private String userId;

    /** Categories such as comments or sla_warnings the user opted out of */
    @Convert(converter = StringSetConverter.class)
    @Column(name = "disabled_categories", length = 2048)
    @Builder.Default
    private Set<String> disabledCategories = new LinkedHashSet<>();

    /** Keyed by channel name; empty means every channel is accepted */
    @Convert(converter = ChannelPreferenceMapConverter.class)
    @Column(name = "channel_preferences", length = 4096)
    @Builder.Default
    private Map<String, ChannelPreference> channels = new LinkedHashMap<>();

    @Column(name = "quiet_hours_enabled")
    private boolean quietHoursEnabled;

    @Column(name = "quiet_hours_start")
    @Builder.Default
    private LocalTime quietHoursStart = LocalTime.of(22, 0);

    @Column(name = "quiet_hours_end")
    @Builder.Default
    private LocalTime quietHoursEnd = LocalTime.of(8, 0);

    /** IANA zone the quiet and working hours are read in */
    @Column(name = "zone_id")
    @Builder.Default
    private String timezone = "UTC";

    @Column(name = "working_hours_enabled")
    private boolean workingHoursEnabled;

    @Column(name = "working_hours_start")
    @Builder.Default
    private LocalTime workingHoursStart = LocalTime.of(9, 0);

    @Column(name = "working_hours_end")
    @Builder.Default
    private LocalTime workingHoursEnd = LocalTime.of(18, 0);

    @Convert(converter = DayOfWeekSetConverter.class)
    @Column(name = "working_days", length = 512)
    @Builder.Default
    private Set<DayOfWeek> workingDays = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);

    /** null for no hourly limit */
    @Column(name = "max_per_hour")
    private Integer maxPerHour;

    /** null for no daily limit */
    @Column(name = "max_per_day")
    private Integer maxPerDay;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
