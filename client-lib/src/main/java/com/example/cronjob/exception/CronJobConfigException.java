package com.example.cronjob.exception;

public class CronJobConfigException extends CronJobException {
    public CronJobConfigException(String message) {
        super(message, null);
    }

    public CronJobConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
