package com.cardioclaw.engine.lifecycle;

import java.util.List;

/**
 * @param archived one-shots moved to the completed ledger
 * @param errors   problems that kept the pass from finishing or an entry from
 *                 being judged
 */
public record ArchiveResult(int archived, List<String> errors) {

    public ArchiveResult {
        errors = List.copyOf(errors);
    }

    public static ArchiveResult empty() {
        return new ArchiveResult(0, List.of());
    }

    public static ArchiveResult failed(String error) {
        return new ArchiveResult(0, List.of(error));
    }
}
