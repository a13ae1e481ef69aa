package com.example.cronjob;

import com.example.cronjob.api.HistoryDetailsResponse;
import com.example.cronjob.api.JobCreateResponse;
import com.example.cronjob.api.JobDetailsResponse;
import com.example.cronjob.api.JobListResponse;
import com.example.cronjob.api.JobRequest;
import com.example.cronjob.exception.CronJobConfigException;
import com.example.cronjob.exception.CronJobDecodeException;
import com.example.cronjob.exception.CronJobEncodeException;
import com.example.cronjob.exception.CronJobTransportException;
import com.example.cronjob.model.DetailedJob;
import com.example.cronjob.model.HistoryItem;
import com.example.cronjob.model.Job;
import com.example.cronjob.model.JobHistory;
import com.example.cronjob.model.Schedule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Client for the cron-job.org REST API.
 * Implements:
 * - listJobs()                       GET    /jobs
 * - getJob(id)                       GET    /jobs/{id}
 * - createJob(job)                   PUT    /jobs
 * - updateJob(id, job)               PATCH  /jobs/{id}
 * - deleteJob(id)                    DELETE /jobs/{id}
 * - getJobHistory(id)                GET    /jobs/{id}/history
 * - getHistoryDetails(id, hid)       GET    /jobs/{id}/history/{hid}
 *
 * Notes:
 * - Every call sends exactly one request and blocks until the response body is read or the
 *   configured timeout expires. The timeout bounds the whole exchange. Nothing is retried.
 * - HTTP status codes are not interpreted; the body is decoded whatever the status.
 * - Instances hold no per-call state and can be shared between threads.
 */
@Slf4j
public class CronJobClient {
    private static final String JSON = "application/json";

    private final String apiKey;
    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient transport;
    private final CronJobMetrics metrics;
    private final ObjectMapper mapper;

    public CronJobClient(String apiKey) {
        this(apiKey, CronJobClientConfig.defaults());
    }

    public CronJobClient(String apiKey, CronJobClientConfig config) {
        CronJobClientConfig c = (config == null ? CronJobClientConfig.defaults() : config);
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.baseUrl = (c.getBaseUrl() == null ? CronJobClientConfig.DEFAULT_BASE_URL : c.getBaseUrl());
        this.timeout = (c.getTimeout() == null ? CronJobClientConfig.DEFAULT_TIMEOUT : c.getTimeout());
        if (timeout.isZero() || timeout.isNegative()) {
            throw new CronJobConfigException("timeout must be > 0, got: " + timeout);
        }
        this.transport = (c.getTransport() != null
                ? c.getTransport()
                : HttpClient.newBuilder()
                        .connectTimeout(timeout)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build());
        this.metrics = (c.getMetrics() == null ? CronJobMetrics.noop() : c.getMetrics());
        this.mapper = CronJobJson.newMapper();
    }

    /**
     * Lists all jobs of the account. The {@code some_failed} flag of the response is not
     * returned; it is only logged.
     */
    public List<Job> listJobs() {
        JobListResponse r = call("list_jobs", newRequest("GET", null, "jobs"), JobListResponse.class);
        if (r.isSomeFailed()) {
            log.warn("[cronjob] job listing is incomplete: some jobs could not be retrieved");
        }
        return r.getJobs() == null ? Collections.emptyList() : r.getJobs();
    }

    public DetailedJob getJob(int jobId) {
        JobDetailsResponse r = call("get_job", newRequest("GET", null, "jobs", jobId), JobDetailsResponse.class);
        return r.getJobDetails() == null ? new DetailedJob() : r.getJobDetails();
    }

    /**
     * Creates a new job. Each call creates another job, even for identical input.
     * A job without a schedule is created with {@link Schedule#everyMinute()}; {@code job}
     * itself is left unchanged.
     *
     * @return the identifier assigned by the service
     */
    public int createJob(DetailedJob job) {
        byte[] body = encode("create_job", new JobRequest(withSchedule(job)));
        JobCreateResponse r = call("create_job", newRequest("PUT", body, "jobs"), JobCreateResponse.class);
        return r.getJobId();
    }

    /**
     * Updates an existing job. Only the non-null fields of {@code job} are sent.
     */
    public void updateJob(int jobId, DetailedJob job) {
        byte[] body = encode("update_job", new JobRequest(job));
        discard("update_job", newRequest("PATCH", body, "jobs", jobId));
    }

    private static DetailedJob withSchedule(DetailedJob job) {
        DetailedJob d = (job == null ? new DetailedJob() : job);
        Job inner = (d.getJob() == null ? new Job() : d.getJob());
        if (inner.getSchedule() != null) {
            return d;
        }
        return d.toBuilder()
                .job(inner.toBuilder().schedule(Schedule.everyMinute()).build())
                .build();
    }

    public void deleteJob(int jobId) {
        discard("delete_job", newRequest("DELETE", null, "jobs", jobId));
    }

    public JobHistory getJobHistory(int jobId) {
        return call("get_job_history", newRequest("GET", null, "jobs", jobId, "history"), JobHistory.class);
    }

    public HistoryItem getHistoryDetails(int jobId, int historyId) {
        return historyDetails(newRequest("GET", null, "jobs", jobId, "history", historyId));
    }

    /**
     * Same as {@link #getHistoryDetails(int, int)}, addressed by {@link HistoryItem#getIdentifier()}.
     *
     * @throws IllegalArgumentException if {@code identifier} is empty or not a single path segment
     */
    public HistoryItem getHistoryDetails(int jobId, String identifier) {
        Objects.requireNonNull(identifier, "identifier");
        if (identifier.isEmpty()) {
            throw new IllegalArgumentException("identifier is empty");
        }
        checkSegment(identifier);
        return historyDetails(newRequest("GET", null, "jobs", jobId, "history", identifier));
    }

    private HistoryItem historyDetails(HttpRequest request) {
        HistoryDetailsResponse r = call("get_history_details", request, HistoryDetailsResponse.class);
        return r.getJobHistoryDetails() == null ? new HistoryItem() : r.getJobHistoryDetails();
    }

    /**
     * Builds an authenticated request. Path parts are rendered with {@link String#valueOf(Object)}
     * and joined onto the path of the base URL. Empty parts are skipped.
     *
     * @param body request payload, or null for none
     * @throws IllegalArgumentException if a part contains {@code /} or is {@code .} or {@code ..}
     */
    public HttpRequest newRequest(String method, byte[] body, Object... pathParts) {
        return HttpRequest.newBuilder()
                .uri(resolve(pathParts))
                .timeout(timeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", JSON)
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
    }

    private URI resolve(Object... pathParts) {
        URI base;
        try {
            base = new URI(baseUrl);
        } catch (URISyntaxException e) {
            throw new CronJobConfigException("Malformed base URL: " + baseUrl, e);
        }
        if (base.getScheme() == null || base.getHost() == null) {
            throw new CronJobConfigException("Base URL must be absolute, got: " + baseUrl);
        }
        String path = Stream.concat(
                        Arrays.stream((base.getPath() == null ? "" : base.getPath()).split("/")),
                        Arrays.stream(pathParts).map(String::valueOf).map(CronJobClient::checkSegment))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining("/", "/", ""));
        try {
            return new URI(base.getScheme(), base.getAuthority(), path, null, null);
        } catch (URISyntaxException e) {
            throw new CronJobConfigException("Cannot build request URL from " + baseUrl + " and " + path, e);
        }
    }

    private static String checkSegment(String segment) {
        if (segment.indexOf('/') >= 0 || segment.equals(".") || segment.equals("..")) {
            throw new IllegalArgumentException("not a single path segment: '" + segment + "'");
        }
        return segment;
    }

    private byte[] encode(String op, Object payload) {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            metrics.incFailure(op, "encode");
            throw new CronJobEncodeException("request body of " + op, e);
        }
    }

    private <T> T call(String op, HttpRequest request, Class<T> responseType) {
        HttpResponse<byte[]> response = send(op, request, HttpResponse.BodyHandlers.ofByteArray());
        T value;
        try {
            value = mapper.readValue(response.body(), responseType);
        } catch (IOException e) {
            metrics.incFailure(op, "decode");
            throw new CronJobDecodeException(request.method(), request.uri().getPath(), response.statusCode(), e);
        }
        if (value == null) {
            metrics.incFailure(op, "decode");
            throw new CronJobDecodeException(request.method(), request.uri().getPath(), response.statusCode(),
                    "body is JSON null");
        }
        return value;
    }

    private void discard(String op, HttpRequest request) {
        send(op, request, HttpResponse.BodyHandlers.discarding());
    }

    /**
     * Sends {@code request} and waits for the complete response, body included, for at most
     * the configured timeout.
     */
    private <B> HttpResponse<B> send(String op, HttpRequest request, HttpResponse.BodyHandler<B> handler) {
        metrics.incRequest(op);
        String path = request.uri().getPath();
        long t0 = System.nanoTime();
        CompletableFuture<HttpResponse<B>> future = transport.sendAsync(request, handler);
        try {
            HttpResponse<B> response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            int status = response.statusCode();
            if (status >= 400) {
                log.warn("[cronjob] {} {} returned HTTP {}", request.method(), path, status);
            } else {
                log.debug("[cronjob] {} {} -> {} in {} ms", request.method(), path, status,
                        (System.nanoTime() - t0) / 1_000_000);
            }
            return response;
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.incFailure(op, "transport");
            HttpTimeoutException timedOut = new HttpTimeoutException("no complete response within " + timeout);
            timedOut.initCause(e);
            throw new CronJobTransportException(request.method(), path, timedOut);
        } catch (ExecutionException e) {
            metrics.incFailure(op, "transport");
            Throwable cause = (e.getCause() == null ? e : e.getCause());
            throw new CronJobTransportException(request.method(), path, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            metrics.incFailure(op, "transport");
            throw new CronJobTransportException(request.method(), path, e);
        } finally {
            metrics.observeRequestLatencySeconds(op, (System.nanoTime() - t0) / 1_000_000_000.0);
        }
    }
}
