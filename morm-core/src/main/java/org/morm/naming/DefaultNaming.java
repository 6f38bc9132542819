package org.morm.naming;

public class DefaultNaming implements Naming {

    @Override
    public String uniqueGroupConstraint(String table, String groupName) {
        return "__UNQ_" + table + "_" + groupName + "__";
    }

    @Override
    public String fieldUniqueConstraint(String table, String fieldName) {
        return "__UQ_" + table + "_" + fieldName + "__";
    }

    @Override
    public String indexName(String table, String fieldName, String kind) {
        return "__IDX_" + table + "_" + fieldName + "_" + kind + "__";
    }
}
