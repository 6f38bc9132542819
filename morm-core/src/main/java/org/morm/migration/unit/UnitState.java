package org.morm.migration.unit;

public enum UnitState {
    QUEUED,
    APPLIED,
    FAILED
}
