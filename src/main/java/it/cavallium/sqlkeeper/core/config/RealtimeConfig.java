package it.cavallium.sqlkeeper.core.config;

import java.time.Duration;
import org.github.gestalt.config.exceptions.GestaltException;

public interface RealtimeConfig {

	Duration pollInterval() throws GestaltException;

	Duration presenceHeartbeat() throws GestaltException;

	Duration presenceTimeout() throws GestaltException;
}
