package com.quantbacktest.factorbacktester.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;

/**
 * Result of loading one trading day: a usable snapshot, a recoverable skip, or a fatal timeline violation.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SnapshotOutcome {

    public enum Kind {
        ACCEPTED,
        SKIPPED,
        FATAL
    }

    Kind kind;
    LocalDate date;
    DataSnapshot snapshot;
    String reason;

    public static SnapshotOutcome accepted(DataSnapshot snapshot) {
        return new SnapshotOutcome(Kind.ACCEPTED, snapshot.getTimestamp(), snapshot, null);
    }

    public static SnapshotOutcome skipped(LocalDate date, String reason) {
        return new SnapshotOutcome(Kind.SKIPPED, date, null, reason);
    }

    public static SnapshotOutcome fatal(LocalDate date, String reason) {
        return new SnapshotOutcome(Kind.FATAL, date, null, reason);
    }

    public boolean isAccepted() {
        return kind == Kind.ACCEPTED;
    }
}
