package com.example.cronjob.exception;

/**
 * The response body did not decode into the expected type.
 */
public class CronJobDecodeException extends CronJobException {
    private final int statusCode;

    public CronJobDecodeException(String method, String path, int statusCode, Throwable cause) {
        super(message(method, path, statusCode, cause.getMessage()), cause);
        this.statusCode = statusCode;
    }

    public CronJobDecodeException(String method, String path, int statusCode, String reason) {
        super(message(method, path, statusCode, reason), null);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    private static String message(String method, String path, int statusCode, String reason) {
        return "Could not decode response of " + method + " " + path + " (HTTP " + statusCode + "): " + reason;
    }
}
