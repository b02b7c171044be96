package org.metricshub.noeta.backend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Noeta
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import static org.metricshub.noeta.backend.PythonWriter.names;
import static org.metricshub.noeta.backend.PythonWriter.text;
import static org.metricshub.noeta.backend.PythonWriter.value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.metricshub.noeta.frontend.ast.Reference;
import org.metricshub.noeta.frontend.ast.SortKey;
import org.metricshub.noeta.frontend.ast.Statement;
import org.metricshub.noeta.frontend.ast.StatementKind;

/**
 * Templates of column selection, row slicing, renaming and sorting.
 */
final class SelectionTemplates {

	private static final Pattern SLICE = Pattern.compile("-?\\d*:-?\\d*");

	private static final Map<String, String> DTYPES = new HashMap<String, String>();

	static {
		DTYPES.put("numeric", "number");
		DTYPES.put("number", "number");
		DTYPES.put("string", "object");
		DTYPES.put("object", "object");
		DTYPES.put("datetime", "datetime");
		DTYPES.put("bool", "bool");
		DTYPES.put("boolean", "bool");
		DTYPES.put("category", "category");
	}

	private SelectionTemplates() {}

	static void register(Map<StatementKind, CodeGenerator.Template> templates) {
		templates.put(StatementKind.SELECT, SelectionTemplates::select);
		templates.put(StatementKind.SELECT_BY_TYPE, SelectionTemplates::selectByType);
		templates.put(StatementKind.HEAD, (s, out) -> rows(s, out, "head", "first"));
		templates.put(StatementKind.TAIL, (s, out) -> rows(s, out, "tail", "last"));
		templates.put(StatementKind.ILOC, SelectionTemplates::iloc);
		templates.put(StatementKind.LOC, SelectionTemplates::loc);
		templates.put(StatementKind.RENAME, SelectionTemplates::rename);
		templates.put(StatementKind.REORDER, SelectionTemplates::reorder);
		templates.put(StatementKind.SORT, SelectionTemplates::sort);
		templates.put(StatementKind.SORT_INDEX, SelectionTemplates::sortIndex);
	}

	private static void select(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String target = statement.hasResultAlias() ? CodeGenerator.alias(statement) : source;
		out.dataset(statement, source + "[" + names(statement.getColumns()) + "].copy()",
				"Selected {len(" + target + ".columns)} columns from " + text(source), "Selected Columns");
	}

	private static void selectByType(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String type = CodeGenerator.text(statement, "type", "numeric").toLowerCase(Locale.ROOT);
		String dtype = DTYPES.containsKey(type) ? DTYPES.get(type) : type;
		String target = statement.hasResultAlias() ? CodeGenerator.alias(statement) : source;
		out.dataset(statement, source + ".select_dtypes(include=[" + PythonWriter.quote(dtype) + "])",
				"Selected {len(" + target + ".columns)} " + text(type) + " columns from " + text(source),
				"Columns of type " + type);
	}

	private static void rows(Statement statement, CodeGenerator out, String method, String which) {
		String source = CodeGenerator.source(statement);
		String n = CodeGenerator.param(statement, "n", Long.valueOf(5));
		String alias = statement.hasResultAlias() ? CodeGenerator.alias(statement) : source;
		out.dataset(statement, source + "." + method + "(" + n + ")",
				"Created alias " + text(alias) + " with " + which + " " + text(n) + " rows",
				which.substring(0, 1).toUpperCase(Locale.ROOT) + which.substring(1) + " " + n + " rows of " + source);
	}

	private static void iloc(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String indexer = slice(statement.getValue("rows"));
		if (statement.hasParameter("columns")) {
			indexer += ", " + slice(statement.getValue("columns"));
		}
		String target = statement.hasResultAlias() ? CodeGenerator.alias(statement) : source;
		out.dataset(statement, source + ".iloc[" + indexer + "]",
				"Selected {len(" + target + ")} rows by position from " + text(source), "Selected Rows");
	}

	private static void loc(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String rows = statement.hasParameter("rows") ? slice(statement.getValue("rows")) : ":";
		String columns = statement.getColumns().isEmpty() ? ":" : names(statement.getColumns());
		String target = statement.hasResultAlias() ? CodeGenerator.alias(statement) : source;
		out.dataset(statement, source + ".loc[" + rows + ", " + columns + "]",
				"Selected {len(" + target + ")} rows by label from " + text(source), "Selected Rows");
	}

	private static void rename(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		out.dataset(statement, source + ".rename(columns=" + CodeGenerator.param(statement, "mapping", null) + ")",
				"Renamed columns of " + text(source), "Renamed Result");
	}

	private static void reorder(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		Object order = statement.getValue("order");
		String columns = order instanceof List ? value(order) : "[" + value(order) + "]";
		out.dataset(statement, source + "[" + columns + "]", "Reordered columns of " + text(source),
				"Reordered Result");
	}

	private static void sort(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		List<Reference> columns = new ArrayList<Reference>();
		List<Object> ascending = new ArrayList<Object>();
		List<String> described = new ArrayList<String>();
		for (SortKey key : statement.getSortKeys()) {
			columns.add(key.getColumn());
			ascending.add(Boolean.valueOf(!key.isDescending()));
			described.add(key.getColumn().getName() + (key.isDescending() ? " desc" : ""));
		}
		out.dataset(statement,
				source + ".sort_values(by=" + names(columns) + ", ascending=" + value(ascending) + ").copy()",
				"Sorted " + text(source) + " by " + text(String.join(", ", described)), "Sorted Result");
	}

	private static void sortIndex(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		out.dataset(statement, source + ".sort_index(ascending=" + CodeGenerator.param(statement, "ascending", Boolean.TRUE)
				+ ")", "Sorted " + text(source) + " by index", "Sorted Result");
	}

	/**
	 * Renders a row or column indexer: {@code [start, end]} becomes
	 * {@code start:end}, a written slice such as {@code "0:10"} is kept, and
	 * anything else is a literal; a missing indexer selects everything.
	 */
	static String slice(Object indexer) {
		if (indexer == null) {
			return ":";
		}
		if (indexer instanceof List && ((List<?>) indexer).size() == 2) {
			List<?> bounds = (List<?>) indexer;
			return bound(bounds.get(0)) + ":" + bound(bounds.get(1));
		}
		if (indexer instanceof String && SLICE.matcher((String) indexer).matches()) {
			return (String) indexer;
		}
		return value(indexer);
	}

	private static String bound(Object bound) {
		return bound == null ? "" : value(bound);
	}
}
