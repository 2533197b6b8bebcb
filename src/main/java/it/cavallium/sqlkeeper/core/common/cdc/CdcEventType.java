package it.cavallium.sqlkeeper.core.common.cdc;

public enum CdcEventType {
    INSERT,
    UPDATE,
    DELETE,
    /**
     * Subscription-only wildcard that matches every change type
     */
    ALL;

    public boolean matches(CdcEventType changeType) {
        return this == ALL || this == changeType;
    }
}
