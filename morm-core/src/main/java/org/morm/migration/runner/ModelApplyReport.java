package org.morm.migration.runner;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.morm.exception.ApplyException;

import java.util.List;

@Getter
@Builder
@ToString
public class ModelApplyReport {
    private final String model;
    @Builder.Default private final List<Long> appliedSequences = List.of();
    /** Units left queued because an earlier one failed. */
    @Builder.Default private final List<Long> skippedSequences = List.of();
    private final Long failedSequence;
    private final ApplyException failure;
    private final long lastAppliedSequence;

    public boolean isSuccess() {
        return failure == null;
    }
}
