package com.example.cronjob;

/**
 * Minimal metrics hook for CronJobClient. Default is no-op.
 */
public interface CronJobMetrics {
    void incRequest(String op);

    /** kind is one of "transport", "decode", "encode". */
    void incFailure(String op, String kind);

    void observeRequestLatencySeconds(String op, double seconds);

    static CronJobMetrics noop() {
        return new CronJobMetrics() {
            public void incRequest(String op) {
            }

            public void incFailure(String op, String kind) {
            }

            public void observeRequestLatencySeconds(String op, double seconds) {
            }
        };
    }
}
