package com.example.cronjob;

import com.example.cronjob.exception.CronJobConfigException;
import lombok.Builder;
import lombok.Value;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

/**
 * Options recognised by {@link CronJobClient}.
 *
 * <ul>
 *   <li>{@code transport}: HTTP client used for every call. When unset the client builds one
 *       whose connect timeout is {@code timeout}.</li>
 *   <li>{@code timeout}: request timeout applied to every call (default 5 seconds).</li>
 *   <li>{@code baseUrl}: API endpoint (default {@value #DEFAULT_BASE_URL}).</li>
 *   <li>{@code metrics}: metrics hook (default no-op).</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class CronJobClientConfig {
    public static final String DEFAULT_BASE_URL = "https://api.cron-job.org";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    HttpClient transport;

    @Builder.Default
    Duration timeout = DEFAULT_TIMEOUT;

    @Builder.Default
    String baseUrl = DEFAULT_BASE_URL;

    @Builder.Default
    CronJobMetrics metrics = CronJobMetrics.noop();

    public static CronJobClientConfig defaults() {
        return builder().build();
    }

    public static CronJobClientConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Reads {@code CRONJOB_BASE_URL} and {@code CRONJOB_TIMEOUT_SECONDS}; missing keys keep
     * their defaults.
     */
    public static CronJobClientConfig fromEnv(Map<String, String> env) {
        String baseUrl = env(env, "CRONJOB_BASE_URL", DEFAULT_BASE_URL);
        String timeoutSeconds = env(env, "CRONJOB_TIMEOUT_SECONDS", String.valueOf(DEFAULT_TIMEOUT.getSeconds()));
        long seconds;
        try {
            seconds = Long.parseLong(timeoutSeconds.trim());
        } catch (NumberFormatException e) {
            throw new CronJobConfigException("CRONJOB_TIMEOUT_SECONDS must be a number, got: " + timeoutSeconds, e);
        }
        if (seconds <= 0) {
            throw new CronJobConfigException("CRONJOB_TIMEOUT_SECONDS must be > 0, got: " + seconds);
        }
        return builder()
                .baseUrl(baseUrl)
                .timeout(Duration.ofSeconds(seconds))
                .build();
    }

    private static String env(Map<String, String> env, String k, String d) {
        String v = env.get(k);
        return v == null || v.isBlank() ? d : v;
    }
}
