package it.cavallium.sqlkeeper.core.impl.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import it.cavallium.sqlkeeper.core.impl.backup.ExternalProcess;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ExternalProcessTest {

	@TempDir
	Path dir;

	@Test
	void capturesStdout() {
		assertEquals("hello\n", ExternalProcess.run(List.of("echo", "hello"), null, null, Duration.ofSeconds(10)));
	}

	@Test
	void redirectsFiles() throws IOException {
		var input = Files.writeString(dir.resolve("in.txt"), "line one\nline two\n");
		var output = dir.resolve("out.txt");
		assertEquals("", ExternalProcess.run(List.of("cat"), input, output, Duration.ofSeconds(10)));
		assertEquals("line one\nline two\n", Files.readString(output));
	}

	@Test
	void nonZeroExitIncludesStderr() {
		var ex = assertThrows(SqlKeeperException.class, () -> ExternalProcess.run(
				List.of("sh", "-c", "echo broken >&2; exit 3"), null, null, Duration.ofSeconds(10)));
		assertEquals(SqlKeeperErrorType.EXTERNAL_TOOL_FAILED, ex.getErrorUniqueId());
		assertTrue(ex.getMessage().contains("exit code 3"));
		assertTrue(ex.getMessage().contains("broken"));
	}

	@Test
	void missingTool() {
		var ex = assertThrows(SqlKeeperException.class, () -> ExternalProcess.run(
				List.of("sqlkeeper-no-such-tool"), null, null, Duration.ofSeconds(10)));
		assertEquals(SqlKeeperErrorType.EXTERNAL_TOOL_FAILED, ex.getErrorUniqueId());
	}

	@Test
	void timeoutKillsTheProcess() {
		var ex = assertThrows(SqlKeeperException.class, () -> ExternalProcess.run(
				List.of("sleep", "30"), null, null, Duration.ofMillis(200)));
		assertEquals(SqlKeeperErrorType.EXTERNAL_TOOL_TIMEOUT, ex.getErrorUniqueId());
	}
}
