package org.morm.migration;

/**
 * Decides whether a planned migration gets written. Used for the interactive confirmation of
 * {@code generate}.
 */
@FunctionalInterface
public interface ChangeReview {
    ChangeReview AUTO_APPROVE = planned -> true;

    boolean approve(PlannedMigration planned);
}
