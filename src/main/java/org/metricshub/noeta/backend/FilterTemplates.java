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

import static org.metricshub.noeta.backend.PythonWriter.column;
import static org.metricshub.noeta.backend.PythonWriter.names;
import static org.metricshub.noeta.backend.PythonWriter.text;
import static org.metricshub.noeta.backend.PythonWriter.value;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.metricshub.noeta.frontend.ast.Statement;
import org.metricshub.noeta.frontend.ast.StatementKind;

/**
 * Templates of row filtering, sampling and missing-value handling.
 */
final class FilterTemplates {

	private FilterTemplates() {}

	static void register(Map<StatementKind, CodeGenerator.Template> templates) {
		templates.put(StatementKind.FILTER, FilterTemplates::filter);
		templates.put(StatementKind.FILTER_BETWEEN, (s, out) -> mask(s, out,
				".between(" + CodeGenerator.param(s, "min", null) + ", " + CodeGenerator.param(s, "max", null) + ")",
				"is between " + text(CodeGenerator.param(s, "min", null)) + " and "
						+ text(CodeGenerator.param(s, "max", null))));
		templates.put(StatementKind.FILTER_ISIN, (s, out) -> mask(s, out,
				".isin(" + CodeGenerator.param(s, "values", null) + ")", "is in the given values"));
		templates.put(StatementKind.FILTER_CONTAINS, (s, out) -> stringMask(s, out, "contains"));
		templates.put(StatementKind.FILTER_STARTSWITH, (s, out) -> stringMask(s, out, "starts_with"));
		templates.put(StatementKind.FILTER_ENDSWITH, (s, out) -> stringMask(s, out, "ends_with"));
		templates.put(StatementKind.FILTER_REGEX, (s, out) -> stringMask(s, out, "matches"));
		templates.put(StatementKind.FILTER_NULL, (s, out) -> mask(s, out, ".isnull()", "is null"));
		templates.put(StatementKind.FILTER_NOTNULL, (s, out) -> mask(s, out, ".notnull()", "is not null"));
		templates.put(StatementKind.FILTER_DUPLICATES, FilterTemplates::filterDuplicates);
		templates.put(StatementKind.SAMPLE, FilterTemplates::sample);
		templates.put(StatementKind.DROPNA, FilterTemplates::dropna);
		templates.put(StatementKind.FILLNA, FilterTemplates::fillna);
		templates.put(StatementKind.DROP_DUPLICATES, FilterTemplates::dropDuplicates);
		templates.put(StatementKind.FILTER_GROUPS, FilterTemplates::filterGroups);
	}

	private static void filter(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String condition = PythonWriter.condition(statement.getWhere(), source);
		String target = statement.hasResultAlias() ? CodeGenerator.alias(statement) : source;
		out.dataset(statement, source + "[" + condition + "].copy()",
				"Filtered " + text(source) + ": {len(" + target + ")} rows match condition", "Filtered Result");
	}

	private static void mask(Statement statement, CodeGenerator out, String test, String description) {
		String source = CodeGenerator.source(statement);
		String name = CodeGenerator.columnName(statement);
		String target = statement.hasResultAlias() ? CodeGenerator.alias(statement) : source;
		out.dataset(statement, source + "[" + column(source, name) + test + "].copy()",
				"Filtered {len(" + target + ")} rows where " + text(name) + " " + description, "Filtered Result");
	}

	private static void stringMask(Statement statement, CodeGenerator out, String operator) {
		String pattern = CodeGenerator.text(statement, "pattern", "");
		mask(statement, out, PythonWriter.stringMatch(operator, pattern),
				operator.replace('_', ' ') + " " + text(PythonWriter.quote(pattern)));
	}

	private static String duplicated(Statement statement) {
		Object subset = statement.getValue("subset");
		StringBuilder arguments = new StringBuilder();
		if (subset != null) {
			arguments.append("subset=").append(subset instanceof List ? value(subset) : "[" + value(subset) + "]")
					.append(", ");
		}
		return arguments.append("keep=").append(CodeGenerator.param(statement, "keep", "first")).toString();
	}

	private static void filterDuplicates(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String target = statement.hasResultAlias() ? CodeGenerator.alias(statement) : source;
		out.dataset(statement, source + "[" + source + ".duplicated(" + duplicated(statement) + ")].copy()",
				"Found {len(" + target + ")} duplicate rows in " + text(source), "Duplicate Rows");
	}

	private static void dropDuplicates(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String target = statement.hasResultAlias() ? CodeGenerator.alias(statement) : source;
		out.dataset(statement, source + ".drop_duplicates(" + duplicated(statement) + ").reset_index(drop=True)",
				"Removed {len(" + source + ") - len(" + target + ")} duplicate rows", "Result after dropping duplicates");
	}

	private static void sample(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String n = CodeGenerator.param(statement, "n", Long.valueOf(5));
		String expression = statement.isSet("random")
				? source + ".sample(n=" + n + ", random_state=42)"
				: source + ".head(" + n + ")";
		String alias = statement.hasResultAlias() ? CodeGenerator.alias(statement) : source;
		out.dataset(statement, expression + ".copy()",
				"Created alias " + text(alias) + " with " + text(n) + " sampled rows",
				"Sample of " + n + " rows from " + source);
	}

	private static void dropna(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		StringBuilder arguments = new StringBuilder();
		if (!statement.getColumns().isEmpty()) {
			arguments.append("subset=").append(names(statement.getColumns()));
		}
		if (statement.hasParameter("how")) {
			arguments.append(arguments.length() > 0 ? ", " : "").append("how=")
					.append(CodeGenerator.param(statement, "how", null));
		}
		String target = statement.hasResultAlias() ? CodeGenerator.alias(statement) : source;
		out.dataset(statement, source + ".dropna(" + arguments + ").copy()",
				"Dropped NA values: {len(" + source + ") - len(" + target + ")} rows removed",
				"Result after dropping NA");
	}

	private static void fillna(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String name = statement.getColumn() == null ? null : CodeGenerator.columnName(statement);
		String method = CodeGenerator.text(statement, "method", null);
		String report;
		if (method != null) {
			report = "Filled NA values in " + text(name == null ? source : name) + " using method: "
					+ text(method.toLowerCase(Locale.ROOT));
		} else {
			report = "Filled NA values in " + text(name == null ? source : name) + " with: "
					+ text(CodeGenerator.param(statement, "value", Long.valueOf(0)));
		}
		out.frame(statement, report, "Result after filling NA", frame -> {
			String target = name == null ? frame : column(frame, name);
			String original = name == null ? source : column(source, name);
			out.line(target + " = " + target + fill(statement, method, original, name == null));
		});
	}

	/**
	 * @param original the unfilled column or frame, the statistics of which
	 *        fill the gaps
	 * @return the filling call, e.g. {@code .fillna(0)} or {@code .ffill()}
	 * @throws IllegalStateException for a method the analyzer rejects
	 */
	private static String fill(Statement statement, String method, String original, boolean wholeFrame) {
		String statistics = wholeFrame ? "numeric_only=True" : "";
		if (method == null) {
			return ".fillna(" + CodeGenerator.param(statement, "value", Long.valueOf(0)) + ")";
		}
		switch (method.toLowerCase(Locale.ROOT)) {
		case "mean":
			return ".fillna(" + original + ".mean(" + statistics + "))";
		case "median":
			return ".fillna(" + original + ".median(" + statistics + "))";
		case "mode":
			return ".fillna(" + original + ".mode().iloc[0])";
		case "forward":
		case "ffill":
			return ".ffill()";
		case "backward":
		case "bfill":
			return ".bfill()";
		default:
			throw new IllegalStateException("Unknown fill method " + method);
		}
	}

	private static void filterGroups(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String condition = CodeGenerator.text(statement, "condition", "True");
		String lambda = condition.replace("count", "len(x)").replace("sum", "x.sum()").replace("mean", "x.mean()");
		out.dataset(statement, source + ".groupby(" + names(statement.getGroupBy()) + ").filter(lambda x: " + lambda + ")",
				"Filtered groups where " + text(condition), "Filtered Groups");
	}
}
