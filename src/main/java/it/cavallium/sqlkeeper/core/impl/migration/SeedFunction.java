package it.cavallium.sqlkeeper.core.impl.migration;

@FunctionalInterface
public interface SeedFunction {

	void seed(SeedContext ctx);
}
