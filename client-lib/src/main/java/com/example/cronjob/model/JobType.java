package com.example.cronjob.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum JobType {

    DEFAULT(0),
    MONITORING(1);     // used in a status monitor

    private final int code;

    JobType(int code) {
        this.code = code;
    }

    @JsonValue
    public int getCode() {
        return code;
    }

    @JsonCreator
    public static JobType fromCode(int code) {
        for (JobType t : values()) {
            if (t.code == code) {
                return t;
            }
        }
        throw new IllegalArgumentException("unknown job type code: " + code);
    }
}
