package com.di.neura.discovery.fs;

import java.nio.file.Path;
import java.util.List;

/**
 * Read-only view of an episode data tree:
 * <pre>
 *   &lt;root&gt;/data/chunk-&lt;chunk&gt;/episode_NNNNNN.&lt;ext&gt;
 *   &lt;root&gt;/videos/chunk-&lt;chunk&gt;/&lt;camera-view&gt;/episode_NNNNNN.mp4
 * </pre>
 * Non-existent directories yield empty listings; existence of individual
 * files is checked by callers.
 */
public interface EpisodeFileSystem {

    Path root();

    /** Chunk ids, lexicographically sorted. */
    List<String> listChunks();

    /** Trajectory files of one chunk, sorted by file name. */
    List<Path> listTrajectoryFiles(String chunk);

    /** Video files of one camera view of one chunk, sorted by file name. */
    List<Path> listVideoFiles(String chunk, CameraView view);

    /** Expected video location. Pure: performs no I/O. */
    Path videoPath(String chunk, CameraView view, int episodeIndex);
}
