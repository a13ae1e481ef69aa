package com.example.cronjob.api;

import com.example.cronjob.model.Job;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobListResponse {
    private List<Job> jobs;

    @JsonProperty("some_failed")
    private boolean someFailed;
}
