package it.cavallium.sqlkeeper.core.impl.migration;

import it.cavallium.sqlkeeper.core.common.SqlExecutor;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import it.cavallium.sqlkeeper.core.common.SqlStatements;
import java.util.regex.Pattern;

/**
 * Migration read from a SQL file with a {@code -- migrate:up} section and a {@code -- migrate:down} section.
 */
public final class SqlFileMigration implements Migration {

	public static final String UP_MARKER = "-- migrate:up";
	public static final String DOWN_MARKER = "-- migrate:down";

	private static final Pattern MARKER = Pattern.compile("(?im)^[ \\t]*--[ \\t]*migrate:(up|down)[ \\t]*$");

	private final String upSql;
	private final String downSql;

	private SqlFileMigration(String upSql, String downSql) {
		this.upSql = upSql;
		this.downSql = downSql;
	}

	/**
	 * @param fileName used in error messages
	 */
	public static SqlFileMigration parse(String fileName, String content) {
		var matcher = MARKER.matcher(content);
		int upStart = -1;
		int upMarker = -1;
		int downStart = -1;
		int downMarker = -1;
		while (matcher.find()) {
			boolean up = matcher.group(1).equalsIgnoreCase("up");
			if (up ? upMarker != -1 : downMarker != -1) {
				throw SqlKeeperException.of(SqlKeeperErrorType.MIGRATION_LOAD_ERROR,
						"Migration " + fileName + " declares the " + matcher.group(1).toLowerCase() + " section twice");
			}
			if (up) {
				upMarker = matcher.start();
				upStart = matcher.end();
			} else {
				downMarker = matcher.start();
				downStart = matcher.end();
			}
		}
		if (upMarker == -1) {
			throw SqlKeeperException.of(SqlKeeperErrorType.MIGRATION_LOAD_ERROR,
					"Migration " + fileName + " is missing the \"" + UP_MARKER + "\" section");
		}
		if (downMarker == -1) {
			throw SqlKeeperException.of(SqlKeeperErrorType.MIGRATION_LOAD_ERROR,
					"Migration " + fileName + " is missing the \"" + DOWN_MARKER + "\" section");
		}
		String upSql;
		String downSql;
		if (upMarker < downMarker) {
			upSql = content.substring(upStart, downMarker);
			downSql = content.substring(downStart);
		} else {
			downSql = content.substring(downStart, upMarker);
			upSql = content.substring(upStart);
		}
		return new SqlFileMigration(upSql.strip(), downSql.strip());
	}

	/**
	 * Render a migration file
	 */
	public static String render(String header, String upSql, String downSql) {
		var sb = new StringBuilder();
		if (!header.isEmpty()) {
			sb.append(header);
			if (!header.endsWith("\n")) {
				sb.append('\n');
			}
			sb.append('\n');
		}
		sb.append(UP_MARKER).append('\n');
		if (!upSql.isEmpty()) {
			sb.append(upSql).append('\n');
		}
		sb.append('\n').append(DOWN_MARKER).append('\n');
		if (!downSql.isEmpty()) {
			sb.append(downSql).append('\n');
		}
		return sb.toString();
	}

	public String upSql() {
		return upSql;
	}

	public String downSql() {
		return downSql;
	}

	@Override
	public void up(SqlExecutor db) {
		run(db, upSql);
	}

	@Override
	public void down(SqlExecutor db) {
		run(db, downSql);
	}

	private static void run(SqlExecutor db, String script) {
		for (String statement : SqlStatements.split(script)) {
			db.execute(statement);
		}
	}
}
