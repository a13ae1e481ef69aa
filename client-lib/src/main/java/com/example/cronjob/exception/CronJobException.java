package com.example.cronjob.exception;

/**
 * Base type of every error raised by {@link com.example.cronjob.CronJobClient}.
 */
public class CronJobException extends RuntimeException {
    public CronJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
