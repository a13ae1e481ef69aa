package com.example.cronjob.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Timing breakdown of a run, each value measured from the start of the transfer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HistoryItemStats {
    private Microseconds nameLookup;
    private Microseconds connect;
    private Microseconds appConnect;      // TLS handshake, 0 without TLS
    private Microseconds preTransfer;
    private Microseconds startTransfer;   // first response byte
    private Microseconds total;
}
