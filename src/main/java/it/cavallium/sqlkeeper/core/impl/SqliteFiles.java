package it.cavallium.sqlkeeper.core.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * File helpers for SQLite databases in WAL mode, whose state is split between the main file and its sidecars.
 */
public final class SqliteFiles {

	private SqliteFiles() {
	}

	public static Path walPath(Path database) {
		return database.resolveSibling(database.getFileName() + "-wal");
	}

	public static Path shmPath(Path database) {
		return database.resolveSibling(database.getFileName() + "-shm");
	}

	/**
	 * Copy a database with its write-ahead log over {@code target}.
	 * The shared-memory index of the target is removed: SQLite rebuilds it from the log on the next open.
	 */
	public static void copyDatabase(Path source, Path target) throws IOException {
		var parent = target.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
		var sourceWal = walPath(source);
		if (Files.exists(sourceWal)) {
			Files.copy(sourceWal, walPath(target), StandardCopyOption.REPLACE_EXISTING);
		} else {
			Files.deleteIfExists(walPath(target));
		}
		Files.deleteIfExists(shmPath(target));
	}

	/**
	 * Remove the sidecars of a database whose main file has just been replaced
	 */
	public static void deleteSidecars(Path database) throws IOException {
		Files.deleteIfExists(walPath(database));
		Files.deleteIfExists(shmPath(database));
	}

	/**
	 * Delete a database together with its sidecars
	 */
	public static void deleteDatabase(Path database) throws IOException {
		Files.deleteIfExists(database);
		deleteSidecars(database);
	}
}
