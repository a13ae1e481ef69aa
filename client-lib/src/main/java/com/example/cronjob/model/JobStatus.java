package com.example.cronjob.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Execution status of a job run. Integer-coded on the wire.
 */
public enum JobStatus {

    UNKNOWN(0),                    // not executed yet
    OK(1),
    FAILED_DNS(2),
    FAILED_COULD_NOT_CONNECT(3),
    FAILED_HTTP_ERROR(4),
    FAILED_TIMEOUT(5),
    FAILED_TOO_MUCH_RESPONSE(6),
    FAILED_INVALID_URL(7),
    FAILED_INTERNAL_ERROR(8),
    FAILED_UNKNOWN_REASON(9);

    private final int code;

    JobStatus(int code) {
        this.code = code;
    }

    @JsonValue
    public int getCode() {
        return code;
    }

    public boolean isFailure() {
        return code >= FAILED_DNS.code;
    }

    /**
     * Codes the service may add later decode as {@link #UNKNOWN}.
     */
    @JsonCreator
    public static JobStatus fromCode(int code) {
        for (JobStatus s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        return UNKNOWN;
    }
}
