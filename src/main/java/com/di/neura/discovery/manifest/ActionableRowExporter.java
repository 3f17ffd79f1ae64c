package com.di.neura.discovery.manifest;

import com.di.neura.discovery.model.ManifestRow;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Collection;

/**
 * Writes manifest rows as JSON Lines (one object per line, snake_case fields),
 * the format the validation stage reads from stdin.
 */
public class ActionableRowExporter {

    private final ObjectMapper objectMapper = ManifestJson.newObjectMapper();

    public int writeJsonLines(Collection<ManifestRow> rows, Writer out) {
        int n = 0;
        try {
            for (ManifestRow row : rows) {
                out.write(objectMapper.writeValueAsString(row));
                out.write('\n');
                n++;
            }
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON lines", e);
        }
        return n;
    }
}
