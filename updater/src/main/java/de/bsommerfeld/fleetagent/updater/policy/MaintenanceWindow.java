package de.bsommerfeld.fleetagent.updater.policy;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Set;

/**
 * Local time-of-day window in which the scheduler may start an update check.
 * A window whose end lies before its start wraps midnight. Days use
 * 0 = Sunday through 6 = Saturday; an empty set allows every day.
 */
public record MaintenanceWindow(boolean enabled, int startHour, int startMinute, int endHour, int endMinute,
        String timezone, Set<Integer> daysOfWeek) {

    public static final MaintenanceWindow DISABLED = new MaintenanceWindow(false, 0, 0, 0, 0, "UTC", Set.of());

    public MaintenanceWindow {
        timezone = timezone == null || timezone.isBlank() ? "UTC" : timezone.trim();
        daysOfWeek = daysOfWeek == null ? Set.of() : Set.copyOf(daysOfWeek);
    }

    /**
     * @return true when the window is disabled or {@code instant} falls
     *         inside it
     */
    public boolean allows(Instant instant) {
        if (!enabled) {
            return true;
        }
        ZonedDateTime local = instant.atZone(zone());

        // DayOfWeek is ISO (Monday = 1); the wire format counts from Sunday = 0
        int day = local.getDayOfWeek().getValue() % 7;
        if (!daysOfWeek.isEmpty() && !daysOfWeek.contains(day)) {
            return false;
        }

        int now = local.getHour() * 60 + local.getMinute();
        int start = startHour * 60 + startMinute;
        int end = endHour * 60 + endMinute;
        if (start <= end) {
            return now >= start && now < end;
        }
        return now >= start || now < end;
    }

    private ZoneId zone() {
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            return ZoneOffset.UTC;
        }
    }
}
