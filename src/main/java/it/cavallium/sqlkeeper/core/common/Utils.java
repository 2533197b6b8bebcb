package it.cavallium.sqlkeeper.core.common;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

public class Utils {

	/**
	 * Fixed-width UTC timestamps, so that stored values sort lexicographically in time order.
	 */
	private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
			.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
			.withZone(ZoneOffset.UTC);

	public static String formatTimestamp(Instant instant) {
		return TIMESTAMP_FORMAT.format(instant);
	}

	@Contract("null -> null; !null -> !null")
	public static Instant parseTimestamp(@Nullable Object value) {
		if (value == null) {
			return null;
		}
		return Instant.parse(value.toString());
	}

	public static String quoteIdentifier(String identifier) {
		return "\"" + identifier.replace("\"", "\"\"") + "\"";
	}

	public static String quoteLiteral(String value) {
		return "'" + value.replace("'", "''") + "'";
	}

	/**
	 * Delete a file, logging instead of failing
	 * @return true if the file existed and was deleted
	 */
	public static boolean deleteBestEffort(@Nullable Path path, Logger logger) {
		if (path == null) {
			return false;
		}
		try {
			return Files.deleteIfExists(path);
		} catch (IOException e) {
			logger.warn("Failed to delete {}: {}", path, e.getMessage());
			return false;
		}
	}

	public static long numberToLong(@Nullable Object value) {
		if (value == null) {
			return 0L;
		} else if (value instanceof Number number) {
			return number.longValue();
		} else {
			return Long.parseLong(value.toString());
		}
	}
}
