package com.di.neura.controller;

import com.di.neura.config.DiscoveryProperties;
import com.di.neura.controller.dto.DiscoveryRunRequest;
import com.di.neura.controller.dto.DiscoveryRunResponse;
import com.di.neura.discovery.DiscoveryOrchestrator;
import com.di.neura.discovery.DiscoveryRequest;
import com.di.neura.discovery.DiscoveryResult;
import com.di.neura.discovery.manifest.ManifestStore;
import com.di.neura.discovery.model.Manifest;
import com.di.neura.discovery.model.ManifestRow;
import com.di.neura.discovery.model.Status;
import com.di.neura.util.InputValidator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * REST API for running discovery and reading the persisted manifest.
 *
 * <pre>
 *   POST /api/discovery/run                     run one discovery pass
 *   GET  /api/discovery/manifest?path=&amp;status=  persisted snapshot, optionally filtered
 *   GET  /api/discovery/manifest/actionable      actionable rows of the snapshot
 * </pre>
 */
@Slf4j
@RestController
@RequestMapping("/api/discovery")
@RequiredArgsConstructor
public class DiscoveryController {

    private final DiscoveryOrchestrator orchestrator;
    private final ManifestStore         manifestStore;
    private final DiscoveryProperties   properties;

    /**
     * Example: POST /api/discovery/run {"onlyChunks": ["000"], "workers": 8}
     */
    @PostMapping(value = "/run", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DiscoveryRunResponse> run(@Valid @RequestBody(required = false) DiscoveryRunRequest body) {
        DiscoveryRequest request = toDiscoveryRequest(body);
        log.info("[API] discovery run requested: root={} chunks={}", request.getDataRoot(), request.getOnlyChunks());
        DiscoveryResult result = orchestrator.run(request);
        return ResponseEntity.ok(DiscoveryRunResponse.from(result));
    }

    @GetMapping(value = "/manifest", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Manifest> getManifest(@RequestParam(required = false) String path,
                                                @RequestParam(required = false) Status status) {
        Optional<Manifest> loaded = manifestStore.load(resolveManifestPath(path));
        if (loaded.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        Manifest manifest = loaded.get();
        if (status == null) {
            return ResponseEntity.ok(manifest);
        }
        List<ManifestRow> rows = manifest.getRows().stream()
                .filter(r -> r.getStatus() == status)
                .toList();
        return ResponseEntity.ok(Manifest.builder()
                .formatVersion(manifest.getFormatVersion())
                .generatedAt(manifest.getGeneratedAt())
                .dataRoot(manifest.getDataRoot())
                .rowCount(rows.size())
                .rows(rows)
                .build());
    }

    @GetMapping(value = "/manifest/actionable", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ManifestRow>> getActionable(@RequestParam(required = false) String path) {
        return manifestStore.load(resolveManifestPath(path))
                .map(m -> ResponseEntity.ok(manifestStore.selectActionable(m)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    DiscoveryRequest toDiscoveryRequest(DiscoveryRunRequest body) {
        DiscoveryRequest.DiscoveryRequestBuilder builder = properties.toRequestBuilder();
        if (body == null) {
            return builder.build();
        }
        if (body.getDataRoot() != null) builder.dataRoot(InputValidator.validatePath(body.getDataRoot(), "dataRoot"));
        if (body.getManifestPath() != null) builder.manifestPath(InputValidator.validatePath(body.getManifestPath(), "manifestPath"));
        if (body.getWorkers() != null) builder.workers(body.getWorkers());
        if (body.getSince() != null) builder.since(InputValidator.parseSince(body.getSince()));
        if (body.getFullHash() != null) builder.fullHash(body.getFullHash());
        if (body.getOnlyChunks() != null) builder.onlyChunks(InputValidator.normalizeChunks(body.getOnlyChunks()));
        return builder.build();
    }

    private Path resolveManifestPath(String path) {
        return InputValidator.validatePath(path != null ? path : properties.getManifestPath(), "path");
    }
}
