package it.cavallium.sqlkeeper.core.common;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits SQL scripts into single statements.
 */
public final class SqlStatements {

	private SqlStatements() {
	}

	/**
	 * Split {@code sql} on semicolons that are outside quoted strings and identifiers.
	 * Line comments ({@code -- ...}) are removed, quoted text is kept verbatim, and empty statements are dropped.
	 */
	public static List<String> split(String sql) {
		var statements = new ArrayList<String>();
		var current = new StringBuilder();
		char quote = 0;
		int i = 0;
		int length = sql.length();
		while (i < length) {
			char c = sql.charAt(i);
			if (quote != 0) {
				current.append(c);
				if (c == quote) {
					// doubled quote is an escaped quote
					if (i + 1 < length && sql.charAt(i + 1) == quote) {
						current.append(quote);
						i++;
					} else {
						quote = 0;
					}
				}
			} else if (c == '\'' || c == '"') {
				quote = c;
				current.append(c);
			} else if (c == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
				int newLine = sql.indexOf('\n', i);
				if (newLine == -1) {
					break;
				}
				current.append('\n');
				i = newLine;
			} else if (c == ';') {
				addStatement(statements, current);
				current.setLength(0);
			} else {
				current.append(c);
			}
			i++;
		}
		addStatement(statements, current);
		return statements;
	}

	private static void addStatement(List<String> statements, StringBuilder current) {
		var statement = current.toString().trim();
		if (!statement.isEmpty()) {
			statements.add(statement);
		}
	}
}
