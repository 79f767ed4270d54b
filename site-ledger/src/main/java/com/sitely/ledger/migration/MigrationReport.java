package com.sitely.ledger.migration;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one pass of the legacy migration.
 */
@Data
public class MigrationReport {

    public enum Status {
        /** Legacy migration switched off by configuration. */
        DISABLED,
        /** Completion flag was already set; nothing read. */
        ALREADY_COMPLETE,
        /** Every record processed; completion flag written. */
        COMPLETED,
        /** At least one record failed; flag withheld so the next start retries. */
        INCOMPLETE
    }

    private Status status;
    private int inserted;
    private int alreadyPresent;
    private int failed;
    private final List<String> failedRecords = new ArrayList<>();
    /** Records with no site to attach to; skipped for good, so they do not block completion. */
    private int unassigned;
    private final List<String> unassignedRecords = new ArrayList<>();

    public static MigrationReport of(Status status) {
        MigrationReport report = new MigrationReport();
        report.setStatus(status);
        return report;
    }

    void recordInserted() {
        inserted++;
    }

    void recordAlreadyPresent() {
        alreadyPresent++;
    }

    void recordFailure(String legacyKey, String recordId) {
        failed++;
        failedRecords.add(legacyKey + "#" + (recordId == null ? "?" : recordId));
    }

    void recordUnassigned(String legacyKey, String recordId) {
        unassigned++;
        unassignedRecords.add(legacyKey + "#" + (recordId == null ? "?" : recordId));
    }

    public boolean isClean() {
        return failed == 0;
    }
}
