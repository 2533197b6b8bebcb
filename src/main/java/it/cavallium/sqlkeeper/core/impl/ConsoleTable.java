package it.cavallium.sqlkeeper.core.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plain text table used by the command line launcher.
 */
public class ConsoleTable {

	public enum Align {
		LEFT,
		RIGHT
	}

	private final List<String> headers = new ArrayList<>();
	private final List<Align> alignments = new ArrayList<>();
	private final List<List<String>> rows = new ArrayList<>();

	public ConsoleTable column(String header) {
		return column(header, Align.LEFT);
	}

	public ConsoleTable column(String header, Align align) {
		headers.add(header);
		alignments.add(align);
		return this;
	}

	/**
	 * Add a row; null cells are rendered as {@code -}
	 */
	public ConsoleTable row(Object... cells) {
		var row = new ArrayList<String>(cells.length);
		for (Object cell : cells) {
			row.add(Objects.toString(cell, "-"));
		}
		rows.add(row);
		return this;
	}

	public boolean isEmpty() {
		return rows.isEmpty();
	}

	@Override
	public String toString() {
		int columns = headers.size();
		for (List<String> row : rows) {
			columns = Math.max(columns, row.size());
		}
		if (columns == 0) {
			return "";
		}

		int[] widths = new int[columns];
		measure(widths, headers);
		for (List<String> row : rows) {
			measure(widths, row);
		}

		var sb = new StringBuilder();
		appendBorder(sb, widths);
		if (!headers.isEmpty()) {
			appendCells(sb, widths, headers);
			appendBorder(sb, widths);
		}
		for (List<String> row : rows) {
			appendCells(sb, widths, row);
		}
		appendBorder(sb, widths);
		return sb.toString();
	}

	private static void measure(int[] widths, List<String> cells) {
		for (int i = 0; i < cells.size(); i++) {
			widths[i] = Math.max(widths[i], cells.get(i).length());
		}
	}

	private void appendCells(StringBuilder sb, int[] widths, List<String> cells) {
		sb.append('|');
		for (int i = 0; i < widths.length; i++) {
			var cell = i < cells.size() ? cells.get(i) : "";
			var padding = " ".repeat(widths[i] - cell.length());
			sb.append(' ');
			if (i < alignments.size() && alignments.get(i) == Align.RIGHT) {
				sb.append(padding).append(cell);
			} else {
				sb.append(cell).append(padding);
			}
			sb.append(" |");
		}
		sb.append('\n');
	}

	private static void appendBorder(StringBuilder sb, int[] widths) {
		sb.append('+');
		for (int width : widths) {
			sb.append("-".repeat(width + 2)).append('+');
		}
		sb.append('\n');
	}
}
