package com.di.neura.discovery.status;

import com.di.neura.discovery.model.ManifestRow;
import com.di.neura.discovery.model.Status;

import java.util.Objects;

/**
 * Derives an episode's lifecycle status. Rules, first match wins:
 * <ol>
 *   <li>fingerprinting failed                          → {@link Status#ERROR}</li>
 *   <li>any existing file still being written          → {@link Status#PENDING}</li>
 *   <li>front or wrist video absent                    → {@link Status#MISSING_SIDE}</li>
 *   <li>no previous fingerprint                        → {@link Status#NEW}</li>
 *   <li>same fingerprint under the same algorithm      → {@link Status#UNCHANGED}</li>
 *   <li>otherwise                                      → {@link Status#CHANGED}</li>
 * </ol>
 * A previous fingerprint recorded under a different {@code fingerprint_algo}
 * never compares equal.
 */
public class StatusResolver {

    public Status resolve(EpisodeObservation obs) {
        if (obs.getFailure() != null || obs.getFingerprint() == null) {
            return Status.ERROR;
        }
        if (obs.anyExistingFileUnstable()) {
            return Status.PENDING;
        }
        if (obs.anyVideoMissing()) {
            return Status.MISSING_SIDE;
        }
        return compare(obs.getFingerprint(), obs.getFingerprintAlgo(),
                       obs.getPreviousFingerprint(), obs.getPreviousFingerprintAlgo());
    }

    /**
     * Applies the previous-run comparison to a row produced without knowledge
     * of the previous manifest. Only rows that reached the comparison step
     * ({@link Status#NEW}) are affected; every other status already won an
     * earlier rule.
     */
    public ManifestRow reconcile(ManifestRow current, ManifestRow previous) {
        if (current.getStatus() != Status.NEW || previous == null) {
            return current;
        }
        Status status = compare(current.getFingerprint(), current.getFingerprintAlgo(),
                                previous.getFingerprint(), previous.getFingerprintAlgo());
        return status == current.getStatus() ? current : current.toBuilder().status(status).build();
    }

    private static Status compare(String fingerprint, String algo, String previousFingerprint, String previousAlgo) {
        if (previousFingerprint == null) {
            return Status.NEW;
        }
        if (previousFingerprint.equals(fingerprint) && Objects.equals(previousAlgo, algo)) {
            return Status.UNCHANGED;
        }
        return Status.CHANGED;
    }
}
