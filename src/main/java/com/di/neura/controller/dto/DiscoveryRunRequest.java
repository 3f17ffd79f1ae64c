package com.di.neura.controller.dto;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST /api/discovery/run}. Every field is optional; absent
 * fields fall back to {@code neura.discovery.*} configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryRunRequest {

    private String dataRoot;
    private String manifestPath;

    @Positive
    private Integer workers;

    /** ISO-8601, e.g. {@code 2024-05-17T12:34:56Z}. */
    private String since;

    private Boolean fullHash;

    /** Accepts {@code 000} or {@code chunk-000}. */
    private List<String> onlyChunks;
}
