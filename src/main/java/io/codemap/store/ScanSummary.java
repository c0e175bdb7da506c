package io.codemap.store;

import io.codemap.model.ModuleIdentifier;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one rescan.
 *
 * @param discovered Modules the provider enumerated
 * @param normalized Modules normalized and stored
 * @param failed     Modules skipped because they could not be resolved or normalized
 * @param duration   Wall time of the pass
 */
public record ScanSummary(
    int discovered,
    int normalized,
    List<ModuleIdentifier> failed,
    Duration duration
) {
    public ScanSummary {
        failed = List.copyOf(failed);
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
