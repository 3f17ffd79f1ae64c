package com.di.neura.discovery.fs;

import java.nio.file.Path;
import java.util.OptionalInt;

/**
 * Naming rules shared by trajectory and video files:
 * {@code episode_<6-digit-index>.<ext>}.
 */
public final class EpisodeFileNames {

    public static final String CHUNK_DIR_PREFIX = "chunk-";
    public static final String EPISODE_PREFIX = "episode_";
    public static final String VIDEO_EXTENSION = "mp4";

    private EpisodeFileNames() {}

    /**
     * Parses the episode index from the last {@code _}-separated token of the
     * file stem. Empty when the token is not a non-negative integer.
     */
    public static OptionalInt parseEpisodeIndex(Path file) {
        Path name = file.getFileName();
        if (name == null) return OptionalInt.empty();
        String stem = stem(name.toString());
        String token = stem.substring(stem.lastIndexOf('_') + 1);
        if (token.isEmpty()) return OptionalInt.empty();
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(token));
        } catch (NumberFormatException e) {
            // digits only, so this is an overflow
            return OptionalInt.empty();
        }
    }

    public static String episodeFileName(int episodeIndex, String extension) {
        return EPISODE_PREFIX + String.format("%06d", episodeIndex) + "." + extension;
    }

    public static String chunkDirName(String chunk) {
        return CHUNK_DIR_PREFIX + chunk;
    }

    /** {@code chunk-003} -> {@code 003}; the id is what follows the last dash. */
    public static String chunkIdFromDirName(String dirName) {
        return dirName.substring(dirName.lastIndexOf('-') + 1);
    }

    static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
