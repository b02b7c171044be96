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

import java.util.Locale;
import java.util.Map;
import org.metricshub.noeta.frontend.ast.Statement;
import org.metricshub.noeta.frontend.ast.StatementKind;

/**
 * Templates of statements that only print statistics, checks and test results.
 */
final class AnalysisTemplates {

	private AnalysisTemplates() {}

	static void register(Map<StatementKind, CodeGenerator.Template> templates) {
		templates.put(StatementKind.DESCRIBE, AnalysisTemplates::describe);
		templates.put(StatementKind.SUMMARY, AnalysisTemplates::summary);
		templates.put(StatementKind.INFO, (s, out) -> {
			out.title("Dataset Info for " + CodeGenerator.source(s));
			out.line(CodeGenerator.source(s) + ".info()");
		});
		templates.put(StatementKind.UNIQUE, (s, out) -> {
			out.line("_unique = " + selected(s) + ".unique()");
			out.title("Unique values in column " + CodeGenerator.columnName(s));
			out.line("print(_unique)");
			out.report("Count: {len(_unique)}");
		});
		templates.put(StatementKind.VALUE_COUNTS, (s, out) -> {
			out.line("_counts = " + selected(s) + ".value_counts(normalize=" + flag(s, "normalize") + ", ascending="
					+ flag(s, "ascending") + ")");
			out.title("Value counts for column " + CodeGenerator.columnName(s));
			out.line("print(_counts)");
		});
		templates.put(StatementKind.OUTLIERS, AnalysisTemplates::outliers);
		templates.put(StatementKind.QUANTILE, (s, out) -> {
			out.line("_quantile = " + selected(s) + ".quantile(" + CodeGenerator.param(s, "q", null) + ")");
			out.report(PythonWriter.text(CodeGenerator.text(s, "q", "") + " quantile of " + CodeGenerator.columnName(s))
					+ ": {_quantile:.4f}");
		});
		templates.put(StatementKind.HYPOTHESIS, AnalysisTemplates::hypothesis);
		templates.put(StatementKind.COUNT_NA, (s, out) -> {
			out.title("Missing values in " + CodeGenerator.source(s));
			out.line("print(" + CodeGenerator.source(s) + ".isnull().sum())");
		});
		templates.put(StatementKind.COUNT_DUPLICATES, (s, out) -> {
			String subset = s.getColumns().isEmpty() ? "" : "subset=" + names(s.getColumns());
			out.line("print('Duplicate count:', " + CodeGenerator.source(s) + ".duplicated(" + subset + ").sum())");
		});
		templates.put(StatementKind.ASSERT_UNIQUE, (s, out) -> check(s, out, selected(s) + ".is_unique",
				"Duplicate values found in column ", " has unique values"));
		templates.put(StatementKind.ASSERT_NO_NULLS, (s, out) -> check(s, out, "not " + selected(s) + ".isnull().any()",
				"Null values found in column ", " has no null values"));
		templates.put(StatementKind.ASSERT_RANGE, AnalysisTemplates::assertRange);
		templates.put(StatementKind.ANY, (s, out) -> reduce(s, out, "any", "Any True in column "));
		templates.put(StatementKind.ALL, (s, out) -> reduce(s, out, "all", "All True in column "));
		templates.put(StatementKind.COUNT_TRUE, (s, out) -> reduce(s, out, "sum", "Count of True values in column "));
	}

	/**
	 * @return {@code source['column']}
	 */
	private static String selected(Statement statement) {
		return column(CodeGenerator.source(statement), CodeGenerator.columnName(statement));
	}

	private static String flag(Statement statement, String name) {
		return statement.isSet(name) ? "True" : "False";
	}

	private static void describe(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		if (statement.getColumns().isEmpty()) {
			out.title("Descriptive Statistics for " + source);
			out.line("print(" + source + ".describe())");
		} else {
			String selection = names(statement.getColumns());
			out.title("Descriptive Statistics for " + selection);
			out.line("print(" + source + "[" + selection + "].describe())");
		}
	}

	private static void summary(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		out.title("Dataset Summary for " + source);
		out.report("Shape: {" + source + ".shape}");
		out.report("Columns: {list(" + source + ".columns)}");
		out.line("print('\\nData types:')");
		out.line("print(" + source + ".dtypes)");
		out.line("print('\\nMissing values:')");
		out.line("print(" + source + ".isnull().sum())");
	}

	private static void outliers(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String method = CodeGenerator.text(statement, "method", "iqr").toLowerCase(Locale.ROOT);
		out.line("# Detect outliers using " + method + " method");
		out.line("for _col in " + names(statement.getColumns()) + ":");
		if ("zscore".equals(method)) {
			String threshold = CodeGenerator.param(statement, "threshold", Long.valueOf(3));
			out.line("    _z = np.abs(stats.zscore(" + source + "[_col].dropna()))");
			out.line("    _outliers = int(np.sum(_z > " + threshold + "))");
			out.line("    print(f'Outliers in {_col} (|z| > " + threshold + "): {_outliers} values')");
		} else {
			String threshold = CodeGenerator.param(statement, "threshold", Double.valueOf(1.5));
			out.line("    _q1 = " + source + "[_col].quantile(0.25)");
			out.line("    _q3 = " + source + "[_col].quantile(0.75)");
			out.line("    _iqr = _q3 - _q1");
			out.line("    _outliers = " + source + "[(" + source + "[_col] < _q1 - " + threshold + " * _iqr) | ("
					+ source + "[_col] > _q3 + " + threshold + " * _iqr)]");
			out.line("    print(f'Outliers in {_col}: {len(_outliers)} rows')");
		}
	}

	private static void hypothesis(Statement statement, CodeGenerator out) {
		String first = statement.getSources().get(0).getName();
		String second = statement.getSources().get(1).getName();
		String test = CodeGenerator.text(statement, "test", "ttest").toLowerCase(Locale.ROOT);
		String call;
		String label;
		if ("welch".equals(test)) {
			call = "stats.ttest_ind(" + first + "[_col].dropna(), " + second + "[_col].dropna(), equal_var=False)";
			label = "Welch t-test";
		} else if ("mannwhitney".equals(test) || "mannwhitneyu".equals(test)) {
			call = "stats.mannwhitneyu(" + first + "[_col].dropna(), " + second + "[_col].dropna())";
			label = "Mann-Whitney U test";
		} else if ("ks".equals(test) || "ks_2samp".equals(test)) {
			call = "stats.ks_2samp(" + first + "[_col].dropna(), " + second + "[_col].dropna())";
			label = "Kolmogorov-Smirnov test";
		} else {
			call = "stats.ttest_ind(" + first + "[_col].dropna(), " + second + "[_col].dropna())";
			label = "T-test";
		}
		out.line("# Hypothesis testing");
		if (statement.getColumns().isEmpty()) {
			out.line("_columns = [c for c in " + first + ".select_dtypes(include=['number']).columns if c in " + second
					+ ".columns]");
		} else {
			out.line("_columns = " + names(statement.getColumns()));
		}
		out.line("for _col in _columns:");
		out.line("    _stat, _p = " + call);
		out.line("    print(f'" + label + " for {_col}: statistic={_stat:.4f}, p-value={_p:.4f}')");
	}

	private static void check(Statement statement, CodeGenerator out, String predicate, String failure,
			String success) {
		String name = CodeGenerator.columnName(statement);
		out.line("assert " + predicate + ", " + quote(failure + name));
		out.line("print(" + quote("Assertion passed: Column " + name + success) + ")");
	}

	private static void assertRange(Statement statement, CodeGenerator out) {
		String name = CodeGenerator.columnName(statement);
		String selected = selected(statement);
		boolean hasMin = statement.getValue("min") != null;
		boolean hasMax = statement.getValue("max") != null;
		String min = CodeGenerator.param(statement, "min", null);
		String max = CodeGenerator.param(statement, "max", null);
		if (hasMin && hasMax) {
			out.line("assert " + selected + ".between(" + min + ", " + max + ").all(), "
					+ quote("Values outside range [" + min + ", " + max + "] in column " + name));
			out.line("print(" + quote("Assertion passed: Column " + name + " values are within range [" + min + ", "
					+ max + "]") + ")");
		} else if (hasMin) {
			out.line("assert (" + selected + " >= " + min + ").all(), "
					+ quote("Values below minimum " + min + " in column " + name));
			out.line("print(" + quote("Assertion passed: Column " + name + " values are >= " + min) + ")");
		} else if (hasMax) {
			out.line("assert (" + selected + " <= " + max + ").all(), "
					+ quote("Values above maximum " + max + " in column " + name));
			out.line("print(" + quote("Assertion passed: Column " + name + " values are <= " + max) + ")");
		} else {
			out.line("print(" + quote("No bounds given for column " + name) + ")");
		}
	}

	private static void reduce(Statement statement, CodeGenerator out, String function, String label) {
		out.line("_result = " + selected(statement) + "." + function + "()");
		out.line("print(" + quote(label + CodeGenerator.columnName(statement) + ":") + ", _result)");
	}
}
