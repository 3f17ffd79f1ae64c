package com.di.neura.discovery;

import com.di.neura.config.DiscoveryProperties;
import com.di.neura.discovery.manifest.ActionableRowExporter;
import com.di.neura.discovery.model.ManifestRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Optional one-shot discovery when the application starts
 * ({@code neura.discovery.run-on-startup=true}).
 *
 * <p>Output, in order of precedence:
 * <ul>
 *   <li>{@code emit-jsonl}: actionable rows as JSON Lines on stdout, for piping into validation;</li>
 *   <li>{@code print-all}: every manifest row logged;</li>
 *   <li>otherwise: a per-status summary.</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiscoveryStartupRunner implements ApplicationRunner {

    private final DiscoveryProperties   properties;
    private final DiscoveryOrchestrator orchestrator;
    private final ActionableRowExporter exporter;

    private PrintStream stdout = System.out;

    void setStdout(PrintStream stdout) {
        this.stdout = stdout;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRunOnStartup()) {
            log.debug("[STARTUP] run-on-startup disabled");
            return;
        }
        DiscoveryResult result = orchestrator.run(properties.toRequestBuilder().build());

        if (properties.isEmitJsonl()) {
            Writer out = new OutputStreamWriter(stdout, StandardCharsets.UTF_8);
            int n = exporter.writeJsonLines(result.getActionableRows(), out);
            log.info("[STARTUP] emitted {} actionable row(s) as JSON Lines", n);
        } else if (properties.isPrintAll()) {
            for (ManifestRow row : result.getManifest().getRows()) {
                log.info("[STARTUP] {} {} fp={} bytes={}", row.getKey(), row.getStatus(),
                         row.getFingerprint(), row.getBytesTotal());
            }
        } else {
            log.info("[STARTUP] discovery {}: {} actionable of {} row(s), counts={}, manifest={}",
                     result.getRunId(), result.getActionableRows().size(),
                     result.getManifest().getRowCount(), result.getStatusCounts(), result.getManifestPath());
        }
    }
}
