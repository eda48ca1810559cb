package com.mtg.decksync.sync;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcomes of a batch run, in processing order.
 *
 * @param outcomes     one outcome per processed deck
 * @param notProcessed decks skipped because the run was aborted
 */
public record SyncReport(List<SyncOutcome> outcomes, List<Path> notProcessed) {

    public SyncReport {
        outcomes = List.copyOf(outcomes);
        notProcessed = List.copyOf(notProcessed);
    }

    public boolean aborted() {
        return !notProcessed.isEmpty()
                || outcomes.stream().anyMatch(o -> o.failure() == FailureKind.AUTH);
    }

    public boolean allSucceeded() {
        return !aborted() && outcomes.stream().allMatch(SyncOutcome::isSuccess);
    }

    public int exitCode() {
        return allSucceeded() ? 0 : 1;
    }

    /**
     * Remote deck ids that local files no longer reference.
     */
    public List<String> orphanedRemoteIds() {
        return outcomes.stream()
                .map(SyncOutcome::orphanedRemoteId)
                .filter(Objects::nonNull)
                .toList();
    }

    public long count(SyncState state) {
        return outcomes.stream().filter(o -> o.state() == state).count();
    }
}
