package com.example.cronjob.api;

import com.example.cronjob.model.HistoryItem;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HistoryDetailsResponse {
    private HistoryItem jobHistoryDetails;
}
