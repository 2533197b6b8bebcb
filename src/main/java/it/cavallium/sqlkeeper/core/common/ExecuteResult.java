package it.cavallium.sqlkeeper.core.common;

public record ExecuteResult(long rowCount) {}
