package org.morm.naming;

/**
 * Derived identifiers for constraints and indexes. Create and drop statements must use the
 * same names, so implementations have to be deterministic.
 */
public interface Naming {
    String uniqueGroupConstraint(String table, String groupName);
    String fieldUniqueConstraint(String table, String fieldName);
    String indexName(String table, String fieldName, String kind);
}
