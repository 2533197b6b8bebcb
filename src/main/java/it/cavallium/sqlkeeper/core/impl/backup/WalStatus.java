package it.cavallium.sqlkeeper.core.impl.backup;

public record WalStatus(boolean walMode, boolean walFileExists, long walSizeBytes, String checkpointInfo) {}
