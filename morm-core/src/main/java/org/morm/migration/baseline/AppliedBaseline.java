package org.morm.migration.baseline;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.morm.model.SchemaSnapshot;

/**
 * The last applied snapshot of a model together with the sequence that produced it.
 * Both are written in one file so they can not disagree after a crash.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppliedBaseline {
    private SchemaSnapshot snapshot;
    private long lastAppliedSequence;
    private String snapshotHash;
    private String savedAt;
}
