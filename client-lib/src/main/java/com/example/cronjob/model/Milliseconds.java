package com.example.cronjob.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.time.Instant;

/**
 * Unix timestamp (or duration) in milliseconds.
 */
public final class Milliseconds {
    private final long value;

    private Milliseconds(long value) {
        this.value = value;
    }

    @JsonCreator
    public static Milliseconds of(long value) {
        return new Milliseconds(value);
    }

    @JsonValue
    public long value() {
        return value;
    }

    public Instant toInstant() {
        return Instant.ofEpochMilli(value);
    }

    public Duration toDuration() {
        return Duration.ofMillis(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Milliseconds && ((Milliseconds) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return value + "ms";
    }
}
