package com.example.cronjob.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Unix timestamp (or duration) in microseconds. Used by the curl-style timings in
 * {@link HistoryItemStats}.
 */
public final class Microseconds {
    private final long value;

    private Microseconds(long value) {
        this.value = value;
    }

    @JsonCreator
    public static Microseconds of(long value) {
        return new Microseconds(value);
    }

    @JsonValue
    public long value() {
        return value;
    }

    public Instant toInstant() {
        return Instant.EPOCH.plus(value, ChronoUnit.MICROS);
    }

    public Duration toDuration() {
        return Duration.of(value, ChronoUnit.MICROS);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Microseconds && ((Microseconds) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return value + "us";
    }
}
