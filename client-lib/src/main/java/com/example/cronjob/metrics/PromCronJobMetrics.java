package com.example.cronjob.metrics;

import com.example.cronjob.CronJobMetrics;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;

/**
 * Prometheus-backed implementation of CronJobMetrics.
 */
public class PromCronJobMetrics implements CronJobMetrics {
    private final Counter requests;
    private final Counter failures;
    private final Histogram requestLatencySeconds;

    public PromCronJobMetrics(CollectorRegistry registry) {
        this.requests = Counter.build()
                .name("cronjob_client_requests_total")
                .help("Total cron-job.org API requests")
                .labelNames("op")
                .register(registry);
        this.failures = Counter.build()
                .name("cronjob_client_failures_total")
                .help("Total failed cron-job.org API calls")
                .labelNames("op", "kind")
                .register(registry);
        this.requestLatencySeconds = Histogram.build()
                .name("cronjob_client_request_latency_seconds")
                .help("Latency of cron-job.org API requests in seconds")
                .buckets(0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0)
                .labelNames("op")
                .register(registry);
    }

    @Override
    public void incRequest(String op) {
        requests.labels(op).inc();
    }

    @Override
    public void incFailure(String op, String kind) {
        failures.labels(op, kind).inc();
    }

    @Override
    public void observeRequestLatencySeconds(String op, double seconds) {
        requestLatencySeconds.labels(op).observe(seconds);
    }
}
