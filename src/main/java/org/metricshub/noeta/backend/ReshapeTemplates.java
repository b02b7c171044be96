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
import static org.metricshub.noeta.backend.PythonWriter.nameOrNames;
import static org.metricshub.noeta.backend.PythonWriter.quote;
import static org.metricshub.noeta.backend.PythonWriter.strings;
import static org.metricshub.noeta.backend.PythonWriter.text;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.metricshub.noeta.frontend.ast.Aggregation;
import org.metricshub.noeta.frontend.ast.Reference;
import org.metricshub.noeta.frontend.ast.Statement;
import org.metricshub.noeta.frontend.ast.StatementKind;

/**
 * Templates of grouping, pivoting, melting, resampling and index statements.
 */
final class ReshapeTemplates {

	private ReshapeTemplates() {}

	static void register(Map<StatementKind, CodeGenerator.Template> templates) {
		templates.put(StatementKind.GROUPBY, ReshapeTemplates::groupby);
		templates.put(StatementKind.PIVOT, ReshapeTemplates::pivot);
		templates.put(StatementKind.PIVOT_TABLE, ReshapeTemplates::pivotTable);
		templates.put(StatementKind.MELT, ReshapeTemplates::melt);
		templates.put(StatementKind.STACK, (s, out) -> simple(s, out,
				".stack(" + (s.hasParameter("level") ? "level=" + CodeGenerator.param(s, "level", null) : "") + ")",
				"Stacked", "Stacked Result"));
		templates.put(StatementKind.UNSTACK, (s, out) -> simple(s, out,
				".unstack(level=" + CodeGenerator.param(s, "level", Long.valueOf(-1)) + CodeGenerator.keyword(s, "fill_value")
						+ ")",
				"Unstacked", "Unstacked Result"));
		templates.put(StatementKind.TRANSPOSE, (s, out) -> simple(s, out, ".T.copy()", "Transposed", "Transposed Result"));
		templates.put(StatementKind.CROSSTAB, ReshapeTemplates::crosstab);
		templates.put(StatementKind.RESAMPLE, ReshapeTemplates::resample);
		templates.put(StatementKind.SET_INDEX, (s, out) -> simple(s, out,
				".set_index(" + quote(CodeGenerator.columnName(s)) + ", drop="
						+ CodeGenerator.param(s, "drop", Boolean.TRUE) + ")",
				"Set index of", "Indexed Result"));
		templates.put(StatementKind.RESET_INDEX, (s, out) -> simple(s, out,
				".reset_index(drop=" + CodeGenerator.param(s, "drop", Boolean.FALSE) + ")", "Reset index of",
				"Reset Index Result"));
		templates.put(StatementKind.SET_MULTIINDEX, (s, out) -> simple(s, out,
				".set_index(" + names(s.getColumns()) + ")", "Set multi-index of", "Indexed Result"));
		templates.put(StatementKind.REINDEX, (s, out) -> simple(s, out,
				".reindex(" + CodeGenerator.param(s, "index", null) + ")", "Reindexed", "Reindexed Result"));
	}

	/**
	 * A dataset computed by calling {@code call} on the source.
	 */
	private static void simple(Statement statement, CodeGenerator out, String call, String verb, String title) {
		String source = CodeGenerator.source(statement);
		out.dataset(statement, source + call, verb + " " + text(source), title);
	}

	private static void groupby(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String keys = names(statement.getGroupBy());
		List<String> described = new ArrayList<String>();
		for (Reference reference : statement.getGroupBy()) {
			described.add(reference.getName());
		}
		String target = statement.hasResultAlias() ? CodeGenerator.alias(statement) : source;
		String report = "Grouped by [" + text(String.join(", ", described)) + "]: {len(" + target + ")} groups";

		if (statement.getAggregations().isEmpty()) {
			out.dataset(statement, source + ".groupby(" + keys + ").size().reset_index(name='count')", report,
					"Grouped Result");
			return;
		}
		Map<String, List<String>> functions = new LinkedHashMap<String, List<String>>();
		for (Aggregation aggregation : statement.getAggregations()) {
			String function = aggregation.getFunction().toLowerCase(Locale.ROOT);
			if ("avg".equals(function) || "average".equals(function)) {
				function = "mean";
			}
			functions.computeIfAbsent(aggregation.getColumn().getName(), k -> new ArrayList<String>()).add(function);
		}
		StringBuilder dictionary = new StringBuilder("{");
		for (Map.Entry<String, List<String>> entry : functions.entrySet()) {
			if (dictionary.length() > 1) {
				dictionary.append(", ");
			}
			dictionary.append(quote(entry.getKey())).append(": ").append(strings(entry.getValue()));
		}
		dictionary.append('}');
		String grouped = source + ".groupby(" + keys + ").agg(" + dictionary + ").reset_index()";
		out.dataset(statement, grouped, report, "Grouped Result");
		if (statement.hasResultAlias()) {
			String alias = CodeGenerator.alias(statement);
			out.line(alias + ".columns = ['_'.join(col).strip('_') if isinstance(col, tuple) else col for col in "
					+ alias + ".columns]");
		}
	}

	private static void pivot(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		out.dataset(statement, source + ".pivot(index=" + CodeGenerator.param(statement, "index", null) + ", columns="
				+ nameOrNames(statement.getColumns()) + ", values=" + CodeGenerator.param(statement, "values", null) + ")",
				"Pivoted " + text(source), "Pivot Result");
	}

	private static void pivotTable(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		out.dataset(statement, "pd.pivot_table(" + source + ", index=" + CodeGenerator.param(statement, "index", null)
				+ ", columns=" + nameOrNames(statement.getColumns()) + ", values="
				+ CodeGenerator.param(statement, "values", null) + ", aggfunc="
				+ CodeGenerator.param(statement, "aggfunc", "mean") + CodeGenerator.keyword(statement, "fill_value") + ")",
				"Created pivot table from " + text(source), "Pivot Table Result");
	}

	private static void melt(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		out.dataset(statement, "pd.melt(" + source + ", id_vars=" + CodeGenerator.param(statement, "id_vars", null)
				+ CodeGenerator.keyword(statement, "value_vars") + ", var_name="
				+ CodeGenerator.param(statement, "var_name", "variable") + ", value_name="
				+ CodeGenerator.param(statement, "value_name", "value") + ")",
				"Melted " + text(source), "Melted Result");
	}

	private static void crosstab(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String rows = PythonWriter.column(source, CodeGenerator.text(statement, "rows", null));
		String columns = PythonWriter.column(source, statement.getColumns().get(0).getName());
		StringBuilder arguments = new StringBuilder(rows).append(", ").append(columns);
		if (statement.hasParameter("values")) {
			arguments.append(", values=").append(PythonWriter.column(source, CodeGenerator.text(statement, "values", null)))
					.append(", aggfunc=").append(CodeGenerator.param(statement, "aggfunc", "sum"));
		}
		out.dataset(statement, "pd.crosstab(" + arguments + ")", "Created crosstab from " + text(source),
				"Crosstab Result");
	}

	private static void resample(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String rule = CodeGenerator.param(statement, "rule", null);
		String function = CodeGenerator.text(statement, "aggfunc", "mean").toLowerCase(Locale.ROOT);
		String expression;
		if (statement.getColumn() != null) {
			expression = source + ".resample(" + rule + ")[" + quote(CodeGenerator.columnName(statement)) + "]."
					+ function + "().reset_index()";
		} else {
			expression = source + ".resample(" + rule + ")." + function + "(numeric_only=True).reset_index()";
		}
		out.dataset(statement, expression, "Resampled " + text(source) + " with rule " + text(rule), "Resampled Result");
	}
}
