package com.pharmacy.fraud.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Read-only view of the claim data shared by every detector of one run.
 * The claim list is copied on construction and cannot be modified afterwards.
 */
public final class DatasetSnapshot {

    private final String snapshotId;
    private final Instant capturedAt;
    private final List<ClaimRecord> claims;

    public DatasetSnapshot(String snapshotId, Instant capturedAt, List<ClaimRecord> claims) {
        this.snapshotId = Objects.requireNonNull(snapshotId, "snapshotId");
        this.capturedAt = Objects.requireNonNull(capturedAt, "capturedAt");
        this.claims = List.copyOf(claims);
    }

    public static DatasetSnapshot of(List<ClaimRecord> claims) {
        return new DatasetSnapshot(UUID.randomUUID().toString(), Instant.now(), claims);
    }

    public static DatasetSnapshot empty() {
        return of(List.of());
    }

    public String getSnapshotId() {
        return snapshotId;
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }

    public List<ClaimRecord> getClaims() {
        return claims;
    }

    public int size() {
        return claims.size();
    }
}
