package it.cavallium.sqlkeeper.core.impl.replica;

public record HealthCheckResult(String name, boolean healthy, long latencyMs) {}
