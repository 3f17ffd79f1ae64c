package com.di.neura.discovery.status;

import com.di.neura.discovery.model.ManifestRow;
import com.di.neura.discovery.model.Status;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StatusResolver Tests")
class StatusResolverTest {

    private static final String ALGO = "size+mtime+sha256(head|tail)-v1";

    private final StatusResolver resolver = new StatusResolver();

    // ============================================================================
    // Priority
    // ============================================================================

    @Test
    @DisplayName("Fingerprint failure wins over pending and missing side")
    void testResolve_ErrorFirst() {
        EpisodeObservation obs = complete()
                .trajectoryStable(false)
                .wristExists(false)
                .fingerprint(null)
                .failure(new IOException("boom"))
                .build();

        assertEquals(Status.ERROR, resolver.resolve(obs));
    }

    @Test
    @DisplayName("Missing fingerprint without an exception is still an error")
    void testResolve_NullFingerprint() {
        assertEquals(Status.ERROR, resolver.resolve(complete().fingerprint(null).build()));
    }

    @Test
    @DisplayName("Unstable files win over a missing side")
    void testResolve_PendingBeforeMissingSide() {
        EpisodeObservation obs = complete().frontStable(false).wristExists(false).build();
        assertEquals(Status.PENDING, resolver.resolve(obs));
    }

    @Test
    @DisplayName("An absent file's stability flag is ignored")
    void testResolve_AbsentFileNotPending() {
        EpisodeObservation obs = complete().wristExists(false).wristStable(false).build();
        assertEquals(Status.MISSING_SIDE, resolver.resolve(obs));
    }

    @Test
    @DisplayName("Missing side wins over the previous-run comparison")
    void testResolve_MissingSideIgnoresPrevious() {
        EpisodeObservation obs = complete().frontExists(false)
                .previousFingerprint("fp").previousFingerprintAlgo(ALGO).build();
        assertEquals(Status.MISSING_SIDE, resolver.resolve(obs));
    }

    // ============================================================================
    // Previous-run comparison
    // ============================================================================

    @Test
    @DisplayName("No previous fingerprint means NEW")
    void testResolve_New() {
        assertEquals(Status.NEW, resolver.resolve(complete().build()));
    }

    @Test
    @DisplayName("Same fingerprint under the same algorithm means UNCHANGED")
    void testResolve_Unchanged() {
        EpisodeObservation obs = complete().previousFingerprint("fp").previousFingerprintAlgo(ALGO).build();
        assertEquals(Status.UNCHANGED, resolver.resolve(obs));
    }

    @Test
    @DisplayName("Different fingerprint means CHANGED")
    void testResolve_Changed() {
        EpisodeObservation obs = complete().previousFingerprint("other").previousFingerprintAlgo(ALGO).build();
        assertEquals(Status.CHANGED, resolver.resolve(obs));
    }

    @Test
    @DisplayName("Same fingerprint under a different algorithm means CHANGED")
    void testResolve_AlgorithmMismatch() {
        EpisodeObservation obs = complete()
                .previousFingerprint("fp")
                .previousFingerprintAlgo("size+mtime+sha256(full)-v1")
                .build();
        assertEquals(Status.CHANGED, resolver.resolve(obs));
    }

    // ============================================================================
    // Reconcile
    // ============================================================================

    @Test
    @DisplayName("Reconcile turns NEW into UNCHANGED or CHANGED against the previous row")
    void testReconcile_NewRows() {
        ManifestRow current = row(Status.NEW, "fp");

        assertSame(current, resolver.reconcile(current, null));
        assertEquals(Status.UNCHANGED, resolver.reconcile(current, row(Status.NEW, "fp")).getStatus());
        assertEquals(Status.CHANGED, resolver.reconcile(current, row(Status.UNCHANGED, "old")).getStatus());
    }

    @Test
    @DisplayName("Reconcile keeps statuses decided before the comparison")
    void testReconcile_KeepsEarlierStatuses() {
        ManifestRow previous = row(Status.NEW, "fp");
        for (Status s : new Status[] {Status.PENDING, Status.MISSING_SIDE, Status.ERROR}) {
            ManifestRow current = row(s, "fp");
            assertSame(current, resolver.reconcile(current, previous));
        }
    }

    @Test
    @DisplayName("Previous row without a fingerprint leaves the row NEW")
    void testReconcile_PreviousWithoutFingerprint() {
        ManifestRow current = row(Status.NEW, "fp");
        assertEquals(Status.NEW, resolver.reconcile(current, row(Status.ERROR, null)).getStatus());
    }

    private static EpisodeObservation.EpisodeObservationBuilder complete() {
        return EpisodeObservation.builder()
                .trajectoryExists(true).trajectoryStable(true)
                .frontExists(true).frontStable(true)
                .wristExists(true).wristStable(true)
                .fingerprint("fp")
                .fingerprintAlgo(ALGO);
    }

    private static ManifestRow row(Status status, String fingerprint) {
        return ManifestRow.builder()
                .chunk("000").episodeIndex(1)
                .fingerprint(fingerprint).fingerprintAlgo(ALGO)
                .status(status)
                .build();
    }
}
