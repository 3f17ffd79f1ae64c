package com.di.neura.controller.dto;

import com.di.neura.discovery.DiscoveryResult;
import com.di.neura.discovery.model.ManifestRow;
import com.di.neura.discovery.model.Status;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * REST response for a discovery run: counts plus the actionable rows.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryRunResponse {
    private String runId;
    private String manifestPath;
    private int rowCount;
    private int actionableCount;
    private Map<Status, Integer> statusCounts;
    private long bytesFingerprinted;
    private long durationMs;
    private List<ManifestRow> actionableRows;

    public static DiscoveryRunResponse from(DiscoveryResult result) {
        return DiscoveryRunResponse.builder()
                .runId(result.getRunId())
                .manifestPath(result.getManifestPath().toString())
                .rowCount(result.getManifest().getRowCount())
                .actionableCount(result.getActionableRows().size())
                .statusCounts(result.getStatusCounts())
                .bytesFingerprinted(result.getBytesFingerprinted())
                .durationMs(result.getDurationMs())
                .actionableRows(result.getActionableRows())
                .build();
    }
}
