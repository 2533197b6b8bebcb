package it.cavallium.sqlkeeper.core.resources;

import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import java.io.InputStream;
import org.jetbrains.annotations.NotNull;

public class DefaultConfig {

	public static final String RESOURCE_NAME = "default.conf";

	@NotNull
	public static InputStream getDefaultConfig() {
		var stream = DefaultConfig.class.getResourceAsStream(RESOURCE_NAME);
		if (stream == null) {
			throw SqlKeeperException.of(SqlKeeperErrorType.CONFIG_ERROR, "Missing default config resource: " + RESOURCE_NAME);
		}
		return stream;
	}
}
