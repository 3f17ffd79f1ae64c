package com.di.neura.discovery.manifest;

import com.di.neura.discovery.model.Manifest;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Serialises a {@link Manifest} to JSON and replaces the snapshot atomically.
 *
 * <pre>
 *   1. write   &lt;dir&gt;/&lt;name&gt;.&lt;random&gt;.tmp   (same directory = same volume)
 *   2. fsync   the temp file
 *   3. rename  temp → &lt;dir&gt;/&lt;name&gt;           (ATOMIC_MOVE, REPLACE_EXISTING)
 * </pre>
 * Readers of the canonical path only ever see the previous or the new
 * snapshot in full. On any failure the temp file is removed and the previous
 * snapshot is left as it was.
 */
@Slf4j
public class ManifestWriter {

    private final ObjectMapper objectMapper;

    public ManifestWriter() {
        this.objectMapper = ManifestJson.newObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(Manifest manifest, Path path) {
        Path target = path.toAbsolutePath().normalize();
        Path dir = target.getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, target.getFileName().toString() + ".", ".tmp");
            writeSynced(manifest, tmp);
            moveIntoPlace(tmp, target);
            log.info("[MANIFEST] written {} rows → {}", manifest.getRowCount(), target);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(tmp);
            throw new ManifestStoreException("Failed to write manifest " + target, e);
        }
    }

    private void writeSynced(Manifest manifest, Path tmp) throws IOException {
        ByteBuffer json = ByteBuffer.wrap(objectMapper.writeValueAsBytes(manifest));
        try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            while (json.hasRemaining()) {
                ch.write(json);
            }
            ch.force(true);
        }
    }

    /** Rename hook; a failure here leaves the canonical path untouched. */
    void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            throw new IOException("Filesystem does not support atomic rename in " + target.getParent(), e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("[MANIFEST] could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
