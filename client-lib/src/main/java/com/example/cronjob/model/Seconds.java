package com.example.cronjob.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.time.Instant;

/**
 * Unix timestamp (or duration) in seconds, as sent by the API.
 */
public final class Seconds {
    private final long value;

    private Seconds(long value) {
        this.value = value;
    }

    @JsonCreator
    public static Seconds of(long value) {
        return new Seconds(value);
    }

    @JsonValue
    public long value() {
        return value;
    }

    public Instant toInstant() {
        return Instant.ofEpochSecond(value);
    }

    public Duration toDuration() {
        return Duration.ofSeconds(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Seconds && ((Seconds) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return value + "s";
    }
}
