package com.example.cronjob.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary of a cron job, as returned by the job listing.
 *
 * <p>Fields left {@code null} are not sent, so a job passed to an update only carries
 * the properties that were set.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Job {
    private Integer jobId;
    private Boolean enabled;
    private String title;
    private Boolean saveResponses;        // store response headers/body of each run
    private String url;
    private JobStatus lastStatus;
    private Milliseconds lastDuration;
    private Seconds lastExecution;
    private Seconds nextExecution;        // null when no prediction is available
    private JobType type;
    private Seconds requestTimeout;
    private Schedule schedule;
    private RequestMethod requestMethod;
}
