package it.cavallium.sqlkeeper.core.impl.backup;

import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs command line tools such as {@code pg_dump} and {@code psql} without a shell, with a hard timeout.
 */
public final class ExternalProcess {

	private static final Logger LOG = LoggerFactory.getLogger("db.backups.process");
	private static final int MAX_STDERR_CHARS = 4000;

	private ExternalProcess() {
	}

	/**
	 * @param stdin  file fed to the standard input, or null for none
	 * @param stdout file that receives the standard output, or null to capture and return it
	 * @return the captured standard output, or an empty string when {@code stdout} is set
	 */
	public static String run(List<String> command, @Nullable Path stdin, @Nullable Path stdout, Duration timeout) {
		var tool = command.get(0);
		Path stderrFile = null;
		Path stdoutFile = stdout;
		boolean captureStdout = stdout == null;
		Process process = null;
		try {
			stderrFile = Files.createTempFile("sqlkeeper-stderr", ".log");
			if (captureStdout) {
				stdoutFile = Files.createTempFile("sqlkeeper-stdout", ".log");
			}
			var builder = new ProcessBuilder(command)
					.redirectOutput(stdoutFile.toFile())
					.redirectError(stderrFile.toFile());
			if (stdin != null) {
				builder.redirectInput(stdin.toFile());
			} else {
				builder.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
			}
			LOG.debug("Running {}", tool);
			process = builder.start();
			if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
				kill(process);
				throw SqlKeeperException.of(SqlKeeperErrorType.EXTERNAL_TOOL_TIMEOUT,
						tool + " did not finish within " + timeout.toSeconds() + "s and was killed");
			}
			int exitCode = process.exitValue();
			if (exitCode != 0) {
				throw SqlKeeperException.of(SqlKeeperErrorType.EXTERNAL_TOOL_FAILED,
						tool + " failed with exit code " + exitCode + ": " + readStderr(stderrFile));
			}
			return captureStdout ? Files.readString(stdoutFile, StandardCharsets.UTF_8) : "";
		} catch (IOException e) {
			throw SqlKeeperException.of(SqlKeeperErrorType.EXTERNAL_TOOL_FAILED, "Failed to run " + tool, e);
		} catch (InterruptedException e) {
			if (process != null) {
				kill(process);
			}
			Thread.currentThread().interrupt();
			throw SqlKeeperException.of(SqlKeeperErrorType.EXTERNAL_TOOL_FAILED, "Interrupted while running " + tool, e);
		} finally {
			deleteTemp(stderrFile);
			if (captureStdout) {
				deleteTemp(stdoutFile);
			}
		}
	}

	private static void kill(Process process) {
		process.descendants().forEach(ProcessHandle::destroyForcibly);
		process.destroyForcibly();
	}

	private static String readStderr(Path stderrFile) {
		try {
			var text = Files.readString(stderrFile, StandardCharsets.UTF_8).strip();
			return text.length() > MAX_STDERR_CHARS ? text.substring(0, MAX_STDERR_CHARS) + "..." : text;
		} catch (IOException e) {
			return "<stderr unavailable: " + e.getMessage() + ">";
		}
	}

	private static java.io.File nullDevice() {
		return new java.io.File(System.getProperty("os.name").startsWith("Windows") ? "NUL" : "/dev/null");
	}

	private static void deleteTemp(@Nullable Path path) {
		if (path == null) {
			return;
		}
		try {
			Files.deleteIfExists(path);
		} catch (IOException e) {
			LOG.debug("Failed to delete temporary file {}: {}", path, e.getMessage());
		}
	}
}
