package org.morm.migration.contributor;

import org.morm.migration.dialect.DdlDialect;
import org.morm.naming.Naming;

import java.util.List;

/**
 * Renders one change into statements. Lower priority runs first; contributors with the same
 * priority keep the order in which they were added.
 */
public interface DdlContributor {
    int priority();

    void contribute(List<String> statements, DdlDialect dialect, Naming naming);
}
