package com.example.cronjob.model;

import com.example.cronjob.CronJobJson;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class TimestampsTest {

    private final ObjectMapper mapper = CronJobJson.newMapper();

    @Test
    public void secondsZeroIsTheEpoch() {
        assertThat(Seconds.of(0).toInstant(), is(Instant.EPOCH));
    }

    @Test
    public void millisecondsConvertToInstant() {
        assertThat(Milliseconds.of(1500).toInstant(), is(Instant.EPOCH.plusMillis(1500)));
    }

    @Test
    public void microsecondsConvertToInstant() {
        assertThat(Microseconds.of(2_500_000).toInstant(), is(Instant.EPOCH.plusMillis(2500)));
    }

    @Test
    public void durationsUseTheSameUnit() {
        assertThat(Seconds.of(30).toDuration(), is(Duration.ofSeconds(30)));
        assertThat(Milliseconds.of(250).toDuration(), is(Duration.ofMillis(250)));
        assertThat(Microseconds.of(1500).toDuration(), is(Duration.ofNanos(1_500_000)));
    }

    @Test
    public void writtenAsBareNumbers() throws Exception {
        assertThat(mapper.writeValueAsString(Seconds.of(1700000000L)), is("1700000000"));
        assertThat(mapper.writeValueAsString(Microseconds.of(12)), is("12"));
    }

    @Test
    public void readFromNumbers() throws Exception {
        assertThat(mapper.readValue("1700000000", Seconds.class), is(Seconds.of(1700000000L)));
        assertThat(mapper.readValue("1500", Milliseconds.class).toInstant(), is(Instant.ofEpochMilli(1500)));
    }

    @Test
    public void valueEquality() {
        assertThat(Seconds.of(5), is(Seconds.of(5)));
        assertThat(Seconds.of(5).hashCode(), is(Seconds.of(5).hashCode()));
        assertThat(Seconds.of(5).equals(Milliseconds.of(5)), is(false));
    }
}
