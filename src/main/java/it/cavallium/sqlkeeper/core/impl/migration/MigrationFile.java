package it.cavallium.sqlkeeper.core.impl.migration;

import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import it.cavallium.sqlkeeper.core.impl.XXHash32;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/**
 * A discovered migration: either a SQL file on disk or a migration registered in code.
 */
public record MigrationFile(String version, String name, @Nullable Path path, @Nullable Migration registered) {

	public static MigrationFile ofPath(String version, String name, Path path) {
		return new MigrationFile(version, name, path, null);
	}

	public static MigrationFile ofRegistered(String version, String name, Migration migration) {
		return new MigrationFile(version, name, null, migration);
	}

	public boolean isFile() {
		return path != null;
	}

	public String id() {
		return version + "_" + name;
	}

	public Migration load() {
		if (registered != null) {
			return registered;
		}
		return SqlFileMigration.parse(path.getFileName().toString(), readSource());
	}

	/**
	 * @return the file contents, or null for registered migrations
	 */
	public @Nullable String readSource() {
		var bytes = readBytes();
		return bytes != null ? new String(bytes, StandardCharsets.UTF_8) : null;
	}

	/**
	 * @return xxHash32 of the file bytes as 8 hex digits, or an empty string for registered migrations
	 */
	public String checksum() {
		var bytes = readBytes();
		return bytes != null ? XXHash32.getInstance().hashHex(bytes) : "";
	}

	private byte[] readBytes() {
		if (path == null) {
			return null;
		}
		try {
			return Files.readAllBytes(path);
		} catch (IOException e) {
			throw SqlKeeperException.of(SqlKeeperErrorType.MIGRATION_LOAD_ERROR, "Can't read migration " + path, e);
		}
	}
}
