package com.example.cronjob.api;

import com.example.cronjob.model.DetailedJob;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of create and update calls: {@code {"job": {...}}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobRequest {
    private DetailedJob job;
}
