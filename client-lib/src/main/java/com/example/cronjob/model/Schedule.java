package com.example.cronjob.model;

import com.example.cronjob.schedule.ScheduleSerializer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Recurrence rule of a job. Each list holds the units in which the job runs;
 * {@code [-1]} means every unit.
 *
 * <p>Empty lists and an empty timezone are replaced by {@link #EVERY_UNIT} and
 * {@link #DEFAULT_TIMEZONE} when the schedule is written to JSON (see {@link #withDefaults()}).
 * Reading a schedule keeps whatever the service returned.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(using = ScheduleSerializer.class)
public class Schedule {

    public static final String DEFAULT_TIMEZONE = "Europe/Paris";
    public static final int EVERY = -1;
    public static final List<Integer> EVERY_UNIT = List.of(EVERY);

    private String timezone;

    @Builder.Default
    private List<Integer> hours = new ArrayList<>();        // 0-23

    @JsonProperty("mdays")
    @Builder.Default
    private List<Integer> monthDays = new ArrayList<>();    // 1-31

    @Builder.Default
    private List<Integer> minutes = new ArrayList<>();      // 0-59

    @Builder.Default
    private List<Integer> months = new ArrayList<>();       // 1-12

    @JsonProperty("wdays")
    @Builder.Default
    private List<Integer> weekDays = new ArrayList<>();     // 0-6, 0 = Sunday

    /** Every minute of every day in {@link #DEFAULT_TIMEZONE}. */
    public static Schedule everyMinute() {
        return Schedule.builder().build().withDefaults();
    }

    /**
     * Deep copy with the defaults filled in. This instance is left untouched.
     */
    public Schedule withDefaults() {
        return Schedule.builder()
                .timezone(timezone == null || timezone.isEmpty() ? DEFAULT_TIMEZONE : timezone)
                .hours(orEvery(hours))
                .monthDays(orEvery(monthDays))
                .minutes(orEvery(minutes))
                .months(orEvery(months))
                .weekDays(orEvery(weekDays))
                .build();
    }

    private static List<Integer> orEvery(List<Integer> values) {
        if (values == null || values.isEmpty()) {
            return new ArrayList<>(EVERY_UNIT);
        }
        return new ArrayList<>(values);
    }
}
