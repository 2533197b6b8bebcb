package it.cavallium.sqlkeeper.core.common.cdc;

@FunctionalInterface
public interface CdcCallback {

    void onChange(CdcChange change);
}
