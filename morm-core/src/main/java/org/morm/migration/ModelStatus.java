package org.morm.migration;

import java.util.List;

/**
 * @param pendingChanges whether the declaration has changes no unit covers yet
 */
public record ModelStatus(String model, String table, long lastAppliedSequence,
                          List<Long> queued, List<Long> failed, boolean pendingChanges) {
}
