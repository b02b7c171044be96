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
import static org.metricshub.noeta.backend.PythonWriter.quote;
import static org.metricshub.noeta.backend.PythonWriter.text;

import java.util.Locale;
import java.util.Map;
import org.metricshub.noeta.frontend.ast.Mutation;
import org.metricshub.noeta.frontend.ast.Reference;
import org.metricshub.noeta.frontend.ast.Statement;
import org.metricshub.noeta.frontend.ast.StatementKind;

/**
 * Templates of cleaning, binning, ranking, window, cumulative and
 * user-defined column transforms.
 */
final class TransformTemplates {

	private TransformTemplates() {}

	static void register(Map<StatementKind, CodeGenerator.Template> templates) {
		// Cleaning
		ColumnTemplates.derived(templates, StatementKind.ISNULL, "Flagged missing values of", (s, c) -> c + ".isnull()");
		ColumnTemplates.derived(templates, StatementKind.NOTNULL, "Flagged present values of", (s, c) -> c + ".notnull()");
		ColumnTemplates.inPlace(templates, StatementKind.FILL_FORWARD, "Forward filled", (s, c) -> c + ".ffill()");
		ColumnTemplates.inPlace(templates, StatementKind.FILL_BACKWARD, "Backward filled", (s, c) -> c + ".bfill()");
		ColumnTemplates.inPlace(templates, StatementKind.FILL_MEAN, "Filled with the mean",
				(s, c) -> c + ".fillna(" + c + ".mean())");
		ColumnTemplates.inPlace(templates, StatementKind.FILL_MEDIAN, "Filled with the median",
				(s, c) -> c + ".fillna(" + c + ".median())");
		ColumnTemplates.inPlace(templates, StatementKind.FILL_MODE, "Filled with the mode",
				(s, c) -> c + ".fillna(" + c + ".mode().iloc[0])");
		ColumnTemplates.inPlace(templates, StatementKind.INTERPOLATE, "Interpolated",
				(s, c) -> c + ".interpolate(method=" + CodeGenerator.param(s, "method", "linear") + ")");
		templates.put(StatementKind.DUPLICATED, TransformTemplates::duplicated);

		// Binning and ranking
		ColumnTemplates.inPlace(templates, StatementKind.QCUT, "Binned into quantiles",
				(s, c) -> "pd.qcut(" + c + ", q=" + CodeGenerator.param(s, "q", Long.valueOf(4))
						+ CodeGenerator.keyword(s, "labels") + ", duplicates='drop')");
		ColumnTemplates.inPlace(templates, StatementKind.CUT, "Binned",
				(s, c) -> "pd.cut(" + c + ", bins=" + CodeGenerator.param(s, "bins", Long.valueOf(5))
						+ CodeGenerator.keyword(s, "labels") + ", include_lowest=True)");
		ColumnTemplates.inPlace(templates, StatementKind.BINNING, "Binned",
				(s, c) -> "pd.cut(" + c + ", bins=" + CodeGenerator.param(s, "bins", Long.valueOf(5)) + ")");
		ColumnTemplates.inPlace(templates, StatementKind.RANK, "Ranked",
				(s, c) -> c + ".rank(method=" + CodeGenerator.param(s, "method", "average") + ", ascending="
						+ CodeGenerator.param(s, "ascending", Boolean.TRUE) + ", pct="
						+ CodeGenerator.param(s, "pct", Boolean.FALSE) + ")");

		// Grouped windows
		templates.put(StatementKind.GROUP_TRANSFORM, TransformTemplates::groupTransform);
		templates.put(StatementKind.WINDOW_RANK, (s, out) -> window(s, out, "Ranked",
				".rank(method=" + CodeGenerator.param(s, "method", "min") + ", ascending="
						+ CodeGenerator.param(s, "ascending", Boolean.TRUE) + ")"));
		templates.put(StatementKind.WINDOW_LAG, (s, out) -> window(s, out, "Lagged",
				".shift(" + CodeGenerator.param(s, "periods", Long.valueOf(1)) + ")"));
		templates.put(StatementKind.WINDOW_LEAD, (s, out) -> window(s, out, "Led",
				".shift(-" + CodeGenerator.param(s, "periods", Long.valueOf(1)) + ")"));

		// Rolling, expanding and cumulative
		ColumnTemplates.inPlace(templates, StatementKind.ROLLING, "Applied rolling window to",
				(s, c) -> c + ".rolling(window=" + CodeGenerator.param(s, "window", Long.valueOf(3)) + ")."
						+ CodeGenerator.text(s, "function", "mean").toLowerCase(Locale.ROOT) + "()");
		for (StatementKind kind : StatementKind.values()) {
			String suffix = kind.getColumnSuffix();
			if (suffix == null) {
				continue;
			}
			if (suffix.startsWith("_rolling_")) {
				String function = suffix.substring("_rolling_".length());
				ColumnTemplates.derived(templates, kind, "Computed rolling " + function + " of",
						(s, c) -> c + ".rolling(window=" + CodeGenerator.param(s, "window", Long.valueOf(3)) + ")."
								+ function + "()");
			} else if (suffix.startsWith("_expanding_")) {
				String function = suffix.substring("_expanding_".length());
				ColumnTemplates.derived(templates, kind, "Computed expanding " + function + " of",
						(s, c) -> c + ".expanding()." + function + "()");
			} else if (suffix.startsWith("_cum")) {
				String function = suffix.substring(1);
				ColumnTemplates.derived(templates, kind, "Computed " + function + " of", (s, c) -> c + "." + function + "()");
			}
		}
		ColumnTemplates.derived(templates, StatementKind.PCT_CHANGE, "Computed percent change of",
				(s, c) -> c + ".pct_change(periods=" + CodeGenerator.param(s, "periods", Long.valueOf(1)) + ")");
		ColumnTemplates.derived(templates, StatementKind.DIFF, "Computed difference of",
				(s, c) -> c + ".diff(periods=" + CodeGenerator.param(s, "periods", Long.valueOf(1)) + ")");
		ColumnTemplates.inPlace(templates, StatementKind.SHIFT, "Shifted",
				(s, c) -> c + ".shift(periods=" + CodeGenerator.param(s, "periods", Long.valueOf(1))
						+ CodeGenerator.keyword(s, "fill_value") + ")");

		// User-defined transforms
		templates.put(StatementKind.APPLY_ROW, TransformTemplates::applyRow);
		ColumnTemplates.inPlace(templates, StatementKind.APPLY_COLUMN, "Applied function to",
				(s, c) -> c + ".apply(" + CodeGenerator.text(s, "function", "lambda x: x") + ")");
		templates.put(StatementKind.APPLYMAP, TransformTemplates::applymap);
		templates.put(StatementKind.APPLY, TransformTemplates::apply);
		templates.put(StatementKind.MAP, TransformTemplates::map);
		ColumnTemplates.inPlace(templates, StatementKind.MAP_VALUES, "Mapped values of",
				(s, c) -> c + ".map(" + CodeGenerator.param(s, "mapping", null) + ")");
		templates.put(StatementKind.ASSIGN, TransformTemplates::assign);
		templates.put(StatementKind.MUTATE, TransformTemplates::mutate);
	}

	private static void duplicated(Statement statement, CodeGenerator out) {
		String added = statement.getDerivedColumn();
		String subset = statement.getColumns().isEmpty() ? "" : "subset=" + names(statement.getColumns()) + ", ";
		out.column(statement, added,
				frame -> frame + ".duplicated(" + subset + "keep=" + CodeGenerator.param(statement, "keep", "first") + ")",
				"Flagged duplicate rows in " + text(added), "Duplicated Result");
	}

	private static void groupTransform(Statement statement, CodeGenerator out) {
		String name = CodeGenerator.columnName(statement);
		String function = CodeGenerator.text(statement, "function", "mean");
		out.column(statement, name,
				frame -> frame + ".groupby(" + names(statement.getGroupBy()) + ")[" + quote(name) + "].transform("
						+ quote(function) + ")",
				"Applied " + text(function) + " transform to " + text(name) + " within groups", "Group Transform Result");
	}

	/**
	 * Adds the derived column of a window statement, partitioned by the
	 * {@code by} columns when given.
	 */
	private static void window(Statement statement, CodeGenerator out, String verb, String call) {
		String name = CodeGenerator.columnName(statement);
		String added = statement.getDerivedColumn();
		out.column(statement, added, frame -> {
			if (statement.getGroupBy().isEmpty()) {
				return column(frame, name) + call;
			}
			return frame + ".groupby(" + names(statement.getGroupBy()) + ")[" + quote(name) + "]" + call;
		}, verb + " " + text(name) + " into " + text(added), "Window Result");
	}

	private static void applyRow(Statement statement, CodeGenerator out) {
		String function = CodeGenerator.text(statement, "function", "lambda row: row");
		out.column(statement, "applied_result", frame -> frame + ".apply(" + function + ", axis=1)",
				"Applied row function to " + text(CodeGenerator.source(statement)), "Apply Result");
	}

	private static void applymap(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		out.dataset(statement, source + ".map(" + CodeGenerator.text(statement, "function", "lambda x: x") + ")",
				"Applied element-wise function to " + text(source), "Apply Result");
	}

	private static void apply(Statement statement, CodeGenerator out) {
		out.frame(statement, "Applied transformation to " + text(String.valueOf(statement.getColumns().size()))
				+ " columns", "Apply Result", frame -> {
					for (Reference reference : statement.getColumns()) {
						String current = column(frame, reference.getName());
						out.line(current + " = " + transformed(statement, frame, current));
					}
				});
	}

	private static void map(Statement statement, CodeGenerator out) {
		String name = CodeGenerator.columnName(statement);
		out.column(statement, name, frame -> transformed(statement, frame, column(frame, name)),
				"Mapped " + text(name), "Map Result");
	}

	/**
	 * @return the {@code with transform} expression over {@code current}, or
	 *         the {@code mapping} or {@code function} parameter applied to it
	 */
	private static String transformed(Statement statement, String frame, String current) {
		if (statement.getTransform() != null) {
			return PythonWriter.expression(statement.getTransform(), frame, current);
		}
		if (statement.hasParameter("mapping")) {
			return current + ".map(" + CodeGenerator.param(statement, "mapping", null) + ")";
		}
		return current + ".apply(" + CodeGenerator.text(statement, "function", "lambda x: x") + ")";
	}

	private static void assign(Statement statement, CodeGenerator out) {
		String name = CodeGenerator.columnName(statement);
		String value = CodeGenerator.param(statement, "value", null);
		out.column(statement, name, frame -> value, "Assigned " + text(value) + " to " + text(name), "Assign Result");
	}

	private static void mutate(Statement statement, CodeGenerator out) {
		out.frame(statement, "Added/modified " + statement.getMutations().size() + " columns", "Mutated Result",
				frame -> {
					for (Mutation mutation : statement.getMutations()) {
						String target = column(frame, mutation.getColumn().getName());
						if (mutation.getExpression() != null) {
							out.line(target + " = " + PythonWriter.expression(mutation.getExpression(), frame, null));
						} else {
							out.line(target + " = " + frame + ".eval(" + quote(mutation.getText()) + ")");
						}
					}
				});
	}
}
