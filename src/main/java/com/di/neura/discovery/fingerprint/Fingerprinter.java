package com.di.neura.discovery.fingerprint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Computes per-file and per-episode content identities.
 *
 * <h3>Per file</h3>
 * <pre>
 *   sampled (default):  sha256( head[0, sample) || tail[size - sample, size) )
 *                       tail only when size &gt; 2 * sample
 *   full:               sha256( whole file, streamed in 1 MiB reads )
 * </pre>
 * Size and modification time are recorded alongside the digest, so appends and
 * truncations are detected even when the sampled bytes do not change.
 *
 * <h3>Per episode</h3>
 * {@link #combine(Map)} serialises the parts with sorted keys into canonical
 * JSON and digests the result, so the output does not depend on map order.
 *
 * <p>Stateless and thread-safe.
 */
@Slf4j
public class Fingerprinter {

    public static final int DEFAULT_SAMPLE_BYTES = 64 * 1024;

    public static final String ALGO_SAMPLED = "size+mtime+sha256(head|tail)-v1";
    public static final String ALGO_FULL    = "size+mtime+sha256(full)-v1";

    private static final int FULL_READ_BUFFER = 1024 * 1024;

    private final int          sampleBytes;
    private final ObjectMapper canonicalMapper;

    public Fingerprinter() {
        this(DEFAULT_SAMPLE_BYTES);
    }

    public Fingerprinter(int sampleBytes) {
        if (sampleBytes <= 0) {
            throw new IllegalArgumentException("sampleBytes must be positive, got: " + sampleBytes);
        }
        this.sampleBytes = sampleBytes;
        this.canonicalMapper = new ObjectMapper()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public int getSampleBytes() {
        return sampleBytes;
    }

    /** The {@code fingerprint_algo} tag recorded on rows produced in the given mode. */
    public static String algorithmTag(boolean fullHash) {
        return fullHash ? ALGO_FULL : ALGO_SAMPLED;
    }

    /* ------------------------------------------------------------------ */
    /* Per file                                                             */
    /* ------------------------------------------------------------------ */

    public FileFingerprint fingerprintFile(Path file, boolean fullHash) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        long size = attrs.size();
        long mtimeNanos = attrs.lastModifiedTime().to(TimeUnit.NANOSECONDS);

        MessageDigest sha = newSha256();
        if (fullHash) {
            digestWhole(file, sha);
        } else {
            digestSampled(file, size, sha);
        }
        String hex = HexFormat.of().formatHex(sha.digest());
        log.trace("[FINGERPRINT] {} size={} full={} sha={}", file, size, fullHash, hex);
        return new FileFingerprint(size, mtimeNanos, hex);
    }

    private void digestSampled(Path file, long size, MessageDigest sha) throws IOException {
        try (SeekableByteChannel ch = Files.newByteChannel(file, StandardOpenOption.READ)) {
            readInto(ch, 0L, sampleBytes, sha);
            if (size > 2L * sampleBytes) {
                readInto(ch, size - sampleBytes, sampleBytes, sha);
            }
        }
    }

    private static void readInto(SeekableByteChannel ch, long position, int length, MessageDigest sha) throws IOException {
        ch.position(position);
        ByteBuffer buf = ByteBuffer.allocate(length);
        while (buf.hasRemaining()) {
            if (ch.read(buf) < 0) break;
        }
        buf.flip();
        sha.update(buf);
    }

    private static void digestWhole(Path file, MessageDigest sha) throws IOException {
        byte[] buf = new byte[FULL_READ_BUFFER];
        try (InputStream in = Files.newInputStream(file)) {
            int n;
            while ((n = in.read(buf)) > 0) {
                sha.update(buf, 0, n);
            }
        }
    }

    /* ------------------------------------------------------------------ */
    /* Per episode                                                          */
    /* ------------------------------------------------------------------ */

    /**
     * Combines named per-file fingerprints into one episode fingerprint.
     * Any change to a constituent (content, size, mtime, presence) changes the result.
     */
    public String combine(Map<String, FileFingerprint> parts) {
        Map<String, Map<String, Object>> canonical = new TreeMap<>();
        parts.forEach((name, fp) -> {
            Map<String, Object> value = new TreeMap<>();
            value.put("mtime_ns", fp.mtimeNanos());
            value.put("sha", fp.sha());
            value.put("size", fp.size());
            canonical.put(name, value);
        });
        try {
            byte[] json = canonicalMapper.writeValueAsString(canonical).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(newSha256().digest(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise fingerprint parts", e);
        }
    }

    private static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
