package com.example.cronjob.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One past execution of a job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HistoryItem {
    private Integer jobId;
    private String identifier;
    private Seconds date;
    private Seconds datePlanned;
    private Milliseconds jitter;
    private String url;                   // job URL at the time of execution
    private Milliseconds duration;
    private JobStatus status;
    private String statusText;
    private Integer httpStatus;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String headers;               // raw response headers, null if not saved

    private String body;
    private HistoryItemStats stats;
}
