package com.example.cronjob.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * HTTP method the service uses when calling the job URL.
 */
public enum RequestMethod {

    GET(0),
    POST(1),
    OPTIONS(2),
    HEAD(3),
    PUT(4),
    DELETE(5),
    TRACE(6),
    CONNECT(7),
    PATCH(8);

    private final int code;

    RequestMethod(int code) {
        this.code = code;
    }

    @JsonValue
    public int getCode() {
        return code;
    }

    @JsonCreator
    public static RequestMethod fromCode(int code) {
        for (RequestMethod m : values()) {
            if (m.code == code) {
                return m;
            }
        }
        throw new IllegalArgumentException("unknown request method code: " + code);
    }
}
