package com.di.neura.config;

import com.di.neura.discovery.fingerprint.Fingerprinter;
import com.di.neura.discovery.fingerprint.StabilityChecker;
import com.di.neura.discovery.manifest.ActionableRowExporter;
import com.di.neura.discovery.manifest.ManifestStore;
import com.di.neura.discovery.status.StatusResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the discovery engine's plain-Java collaborators from {@link DiscoveryProperties}.
 */
@Slf4j
@Configuration
public class DiscoveryConfig {

    @Bean
    public Fingerprinter fingerprinter(DiscoveryProperties props) {
        return new Fingerprinter(props.getSampleBytes());
    }

    @Bean
    public StabilityChecker stabilityChecker(DiscoveryProperties props) {
        log.info("Stability check: files >= {} bytes sampled {}ms apart",
                 props.getStabilityMinBytes(), props.getStabilityPauseMs());
        return new StabilityChecker(props.getStabilityMinBytes(), Duration.ofMillis(props.getStabilityPauseMs()));
    }

    @Bean
    public StatusResolver statusResolver() {
        return new StatusResolver();
    }

    @Bean
    public ManifestStore manifestStore() {
        return new ManifestStore();
    }

    @Bean
    public ActionableRowExporter actionableRowExporter() {
        return new ActionableRowExporter();
    }
}
