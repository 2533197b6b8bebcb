package it.cavallium.sqlkeeper.core.impl.realtime;

import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import it.cavallium.sqlkeeper.core.config.RealtimeConfig;
import java.time.Duration;
import org.github.gestalt.config.exceptions.GestaltException;

/**
 * @param pollInterval delay between two change-data-capture cycles
 * @param presenceHeartbeat delay between two presence sweeps
 * @param presenceTimeout idle time after which a presence entry is evicted
 */
public record RealtimeSettings(Duration pollInterval, Duration presenceHeartbeat, Duration presenceTimeout) {

	public static final Duration MIN_POLL_INTERVAL = Duration.ofMillis(100);

	public static RealtimeSettings defaults() {
		return new RealtimeSettings(Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofSeconds(60));
	}

	public static RealtimeSettings of(RealtimeConfig config) {
		try {
			return new RealtimeSettings(config.pollInterval(), config.presenceHeartbeat(), config.presenceTimeout());
		} catch (GestaltException e) {
			throw SqlKeeperException.of(SqlKeeperErrorType.CONFIG_ERROR, "Invalid realtime config", e);
		}
	}

	public RealtimeSettings withPollInterval(Duration pollInterval) {
		return new RealtimeSettings(pollInterval, presenceHeartbeat, presenceTimeout);
	}

	public RealtimeSettings withPresence(Duration presenceHeartbeat, Duration presenceTimeout) {
		return new RealtimeSettings(pollInterval, presenceHeartbeat, presenceTimeout);
	}
}
