package com.example.cronjob.exception;

/**
 * The request could not be sent or the response could not be read (DNS, connect, timeout,
 * interrupted call).
 */
public class CronJobTransportException extends CronJobException {
    public CronJobTransportException(String method, String path, Throwable cause) {
        super(method + " " + path + " failed: " + cause, cause);
    }
}
