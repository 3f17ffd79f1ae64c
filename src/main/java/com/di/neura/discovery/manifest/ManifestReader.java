package com.di.neura.discovery.manifest;

import com.di.neura.discovery.model.Manifest;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Reads and deserialises a {@link Manifest} snapshot from disk.
 */
@Slf4j
public class ManifestReader {

    private final ObjectMapper objectMapper;

    public ManifestReader() {
        this.objectMapper = ManifestJson.newObjectMapper();
    }

    /**
     * @return the snapshot at {@code path}, or empty when no snapshot exists yet (first run)
     * @throws ManifestStoreException when the file exists but cannot be read or parsed
     */
    public Optional<Manifest> read(Path path) {
        if (!Files.exists(path)) {
            log.info("[MANIFEST-READ] no previous snapshot at {}", path);
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(path)) {
            Manifest manifest = objectMapper.readValue(in, Manifest.class);
            if (manifest.getRows() == null) {
                manifest.setRows(new ArrayList<>());
            }
            log.debug("[MANIFEST-READ] {} rows from {}", manifest.getRows().size(), path);
            return Optional.of(manifest);
        } catch (IOException e) {
            throw new ManifestStoreException("Failed to read manifest " + path, e);
        }
    }
}
