package it.cavallium.sqlkeeper.core.config;

import java.nio.file.Path;
import java.time.Duration;
import org.github.gestalt.config.exceptions.GestaltException;

public interface ReplicasConfig {

	Path directory() throws GestaltException;

	Duration syncInterval() throws GestaltException;
}
