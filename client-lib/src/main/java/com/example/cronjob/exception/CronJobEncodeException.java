package com.example.cronjob.exception;

public class CronJobEncodeException extends CronJobException {
    public CronJobEncodeException(String what, Throwable cause) {
        super("Could not encode " + what + ": " + cause.getMessage(), cause);
    }
}
