package it.cavallium.sqlkeeper.core.config;

import java.nio.file.Path;
import java.time.Duration;
import org.github.gestalt.config.exceptions.GestaltException;

public interface BackupsConfig {

	Path directory() throws GestaltException;

	int maxBackups() throws GestaltException;

	int retentionDays() throws GestaltException;

	boolean compression() throws GestaltException;

	Duration externalToolTimeout() throws GestaltException;

	String pgDumpCommand() throws GestaltException;

	String psqlCommand() throws GestaltException;
}
