package it.cavallium.sqlkeeper.core.impl.migration;

import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Migrations defined in code. Each registry is owned by the caller that builds the managers around it.
 */
public class MigrationRegistry {

	private static final Pattern VERSION = Pattern.compile("^\\d{14}$");
	private static final Pattern NAME = Pattern.compile("^[a-z0-9_]+$");

	private final TreeMap<String, MigrationFile> migrations = new TreeMap<>();

	public synchronized MigrationRegistry register(String version, String name, Migration migration) {
		if (!VERSION.matcher(version).matches()) {
			throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_ARGUMENT, "Migration version must be 14 digits: " + version);
		}
		if (!NAME.matcher(name).matches()) {
			throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_ARGUMENT, "Invalid migration name: " + name);
		}
		if (migrations.containsKey(version)) {
			throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_ARGUMENT, "Migration version already registered: " + version);
		}
		migrations.put(version, MigrationFile.ofRegistered(version, name, migration));
		return this;
	}

	/**
	 * @return the registered migrations sorted by version
	 */
	public synchronized List<MigrationFile> list() {
		return new ArrayList<>(migrations.values());
	}

	public synchronized boolean isEmpty() {
		return migrations.isEmpty();
	}

	public synchronized void reset() {
		migrations.clear();
	}
}
