package de.bsommerfeld.fleetagent.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Time-of-day window in which scheduled update checks may run.
 * Days use 0 = Sunday through 6 = Saturday; an empty list allows every day.
 */
public class MaintenanceWindowConfig {

    @JsonProperty("enabled")
    private boolean enabled = false;

    @JsonProperty("start-hour")
    private int startHour = 2;

    @JsonProperty("start-minute")
    private int startMinute = 0;

    @JsonProperty("end-hour")
    private int endHour = 5;

    @JsonProperty("end-minute")
    private int endMinute = 0;

    @JsonProperty("timezone")
    private String timezone = "UTC";

    @JsonProperty("days-of-week")
    private List<Integer> daysOfWeek = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getStartHour() {
        return startHour;
    }

    public void setStartHour(int startHour) {
        this.startHour = startHour;
    }

    public int getStartMinute() {
        return startMinute;
    }

    public void setStartMinute(int startMinute) {
        this.startMinute = startMinute;
    }

    public int getEndHour() {
        return endHour;
    }

    public void setEndHour(int endHour) {
        this.endHour = endHour;
    }

    public int getEndMinute() {
        return endMinute;
    }

    public void setEndMinute(int endMinute) {
        this.endMinute = endMinute;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public List<Integer> getDaysOfWeek() {
        return daysOfWeek;
    }

    public void setDaysOfWeek(List<Integer> daysOfWeek) {
        this.daysOfWeek = daysOfWeek;
    }
}
