package it.cavallium.sqlkeeper.core.config;

import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import it.cavallium.sqlkeeper.core.resources.DefaultConfig;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.github.gestalt.config.builder.GestaltBuilder;
import org.github.gestalt.config.builder.SourceBuilder;
import org.github.gestalt.config.exceptions.GestaltException;
import org.github.gestalt.config.source.FileConfigSourceBuilder;
import org.github.gestalt.config.source.InputStreamConfigSourceBuilder;

public class ConfigParser {

	public static final String ROOT_PATH = "sqlkeeper";

	private final GestaltBuilder gsb;
	private final List<SourceBuilder<?, ?>> sourceBuilders = new ArrayList<>();

	public ConfigParser() {
		gsb = new GestaltBuilder();
		gsb
				.setTreatMissingArrayIndexAsError(false)
				.setTreatMissingDiscretionaryValuesAsErrors(false)
				.setTreatMissingValuesAsErrors(false)
				.addDefaultConfigLoaders()
				.addDefaultDecoders();
	}

	public static SqlKeeperConfig parse(Path configPath) {
		var parser = new ConfigParser();
		if (configPath != null) {
			parser.addSource(configPath);
		}
		return parser.parse();
	}

	public static SqlKeeperConfig parseDefault() {
		var parser = new ConfigParser();
		return parser.parse();
	}

	public void addSource(Path path) {
		if (path != null) {
			sourceBuilders.add(FileConfigSourceBuilder.builder().setPath(path));
		}
	}

	public SqlKeeperConfig parse() {
		try {
			gsb.addSource(InputStreamConfigSourceBuilder
					.builder()
					.setConfig(DefaultConfig.getDefaultConfig())
					.setFormat("conf")
					.build());
			for (SourceBuilder<?, ?> sourceBuilder : sourceBuilders) {
				gsb.addSource(sourceBuilder.build());
			}
			var gestalt = gsb.build();
			gestalt.loadConfigs();

			return gestalt.getConfig(ROOT_PATH, SqlKeeperConfig.class);
		} catch (GestaltException ex) {
			throw SqlKeeperException.of(SqlKeeperErrorType.CONFIG_ERROR, ex);
		}
	}
}
