package com.example.cronjob.schedule;

import com.example.cronjob.CronJobJson;
import com.example.cronjob.model.Schedule;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class ScheduleSerializerTest {

    private final ObjectMapper mapper = CronJobJson.newMapper();

    @Test
    public void emptyScheduleIsWrittenWithDefaults() throws Exception {
        Schedule empty = Schedule.builder().timezone("").build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(empty));

        assertThat(json.get("timezone").asText(), is("Europe/Paris"));
        for (String field : List.of("hours", "mdays", "minutes", "months", "wdays")) {
            assertThat(field, json.get(field).size(), is(1));
            assertThat(field, json.get(field).get(0).asInt(), is(-1));
        }
    }

    @Test
    public void nullFieldsAreWrittenWithDefaults() throws Exception {
        Schedule s = new Schedule(null, null, null, null, null, null);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(s));

        assertThat(json.get("timezone").asText(), is(Schedule.DEFAULT_TIMEZONE));
        assertThat(json.get("wdays").get(0).asInt(), is(Schedule.EVERY));
    }

    @Test
    public void populatedFieldsAreLeftAlone() throws Exception {
        Schedule s = Schedule.builder()
                .timezone("UTC")
                .minutes(List.of(0, 30))
                .hours(List.of(9, 17))
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(s));

        assertThat(json.get("timezone").asText(), is("UTC"));
        assertThat(json.get("minutes").get(0).asInt(), is(0));
        assertThat(json.get("minutes").get(1).asInt(), is(30));
        assertThat(json.get("hours").size(), is(2));
        assertThat(json.get("mdays").get(0).asInt(), is(-1));
        assertThat(json.get("months").get(0).asInt(), is(-1));
    }

    @Test
    public void serializingDoesNotMutateTheOriginal() throws Exception {
        Schedule original = Schedule.builder().hours(new ArrayList<>(List.of(4))).build();

        String first = mapper.writeValueAsString(original);
        String second = mapper.writeValueAsString(original);

        assertThat(second, is(first));
        assertThat(original.getTimezone(), is(nullValue()));
        assertThat(original.getMinutes().isEmpty(), is(true));
        assertThat(original.getHours(), is(List.of(4)));
    }

    @Test
    public void withDefaultsReturnsDeepCopy() {
        Schedule original = Schedule.builder().minutes(new ArrayList<>(List.of(5))).build();

        Schedule copy = original.withDefaults();
        copy.getMinutes().add(10);
        copy.getHours().add(3);

        assertThat(original.getMinutes(), is(List.of(5)));
        assertThat(original.getHours().isEmpty(), is(true));
    }

    @Test
    public void nullEntriesInsideAListAreRejected() {
        Schedule s = Schedule.builder().hours(Arrays.asList(1, null)).build();

        JsonMappingException e = assertThrows(JsonMappingException.class, () -> mapper.writeValueAsString(s));

        assertThat(e.getMessage(), containsString("hours"));
        assertThat(s.getHours(), is(Arrays.asList(1, null)));
    }

    @Test
    public void decodingDoesNotFillDefaults() throws Exception {
        Schedule s = mapper.readValue("{\"timezone\": \"\", \"hours\": [], \"mdays\": [2]}", Schedule.class);

        assertThat(s.getTimezone(), is(""));
        assertThat(s.getHours().isEmpty(), is(true));
        assertThat(s.getMonthDays(), is(List.of(2)));
        assertThat(s.getMinutes().isEmpty(), is(true));
    }

    @Test
    public void everyMinuteMatchesEveryUnit() {
        Schedule s = Schedule.everyMinute();

        assertThat(s.getTimezone(), is(Schedule.DEFAULT_TIMEZONE));
        assertThat(s.getMinutes(), is(Schedule.EVERY_UNIT));
        assertThat(s.getWeekDays(), is(Schedule.EVERY_UNIT));
    }
}
