package com.recalc.core.service.model;

/**
 * Kind of mutation that produced a change element.
 */
public enum EditType {
    CREATED,
    UPDATED,
    DELETED;

    /**
     * True for creations and updates, the edits that leave a live row behind.
     */
    public boolean isCreateOrUpdate() {
        return this == CREATED || this == UPDATED;
    }
}
