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
import static org.metricshub.noeta.backend.PythonWriter.value;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiFunction;
import org.metricshub.noeta.frontend.ast.Reference;
import org.metricshub.noeta.frontend.ast.Statement;
import org.metricshub.noeta.frontend.ast.StatementKind;

/**
 * Templates of the single-column math, string, date, conversion, encoding
 * and scaling statements.
 * <p>
 * Most of them rewrite their column in place; the date part extractions,
 * {@code concat} and {@code date_diff} add the column named by
 * {@link Statement#getDerivedColumn()}.
 */
final class ColumnTemplates {

	private static final Map<StatementKind, String> SCALERS = new EnumMap<StatementKind, String>(StatementKind.class);
	private static final Map<String, String> NORMALIZERS = new HashMap<String, String>();
	private static final Map<String, String> DATE_PARTS = new HashMap<String, String>();

	static {
		SCALERS.put(StatementKind.STANDARD_SCALE, "StandardScaler");
		SCALERS.put(StatementKind.MINMAX_SCALE, "MinMaxScaler");
		SCALERS.put(StatementKind.ROBUST_SCALE, "RobustScaler");
		SCALERS.put(StatementKind.MAXABS_SCALE, "MaxAbsScaler");

		NORMALIZERS.put("zscore", "StandardScaler");
		NORMALIZERS.put("standard", "StandardScaler");
		NORMALIZERS.put("minmax", "MinMaxScaler");
		NORMALIZERS.put("robust", "RobustScaler");
		NORMALIZERS.put("maxabs", "MaxAbsScaler");

		DATE_PARTS.put("weekofyear", "isocalendar().week");
		DATE_PARTS.put("week", "isocalendar().week");
		DATE_PARTS.put("weekday", "dayofweek");
	}

	private ColumnTemplates() {}

	static void register(Map<StatementKind, CodeGenerator.Template> templates) {
		// Math
		inPlace(templates, StatementKind.ROUND, "Rounded",
				(s, c) -> c + ".round(" + CodeGenerator.param(s, "decimals", Long.valueOf(0)) + ")");
		inPlace(templates, StatementKind.ABS, "Computed absolute value of", (s, c) -> c + ".abs()");
		inPlace(templates, StatementKind.SQRT, "Computed square root of", (s, c) -> "np.sqrt(" + c + ")");
		inPlace(templates, StatementKind.POWER, "Raised to a power",
				(s, c) -> "np.power(" + c + ", " + CodeGenerator.param(s, "exponent", Long.valueOf(2)) + ")");
		inPlace(templates, StatementKind.LOG, "Computed logarithm of", ColumnTemplates::log);
		inPlace(templates, StatementKind.CEIL, "Computed ceiling of", (s, c) -> "np.ceil(" + c + ")");
		inPlace(templates, StatementKind.FLOOR, "Computed floor of", (s, c) -> "np.floor(" + c + ")");

		// Strings
		inPlace(templates, StatementKind.UPPER, "Converted to uppercase", (s, c) -> c + ".str.upper()");
		inPlace(templates, StatementKind.LOWER, "Converted to lowercase", (s, c) -> c + ".str.lower()");
		inPlace(templates, StatementKind.TITLE, "Converted to title case", (s, c) -> c + ".str.title()");
		inPlace(templates, StatementKind.CAPITALIZE, "Capitalized", (s, c) -> c + ".str.capitalize()");
		inPlace(templates, StatementKind.STRIP, "Stripped", (s, c) -> c + ".str.strip(" + chars(s) + ")");
		inPlace(templates, StatementKind.LSTRIP, "Stripped leading characters of",
				(s, c) -> c + ".str.lstrip(" + chars(s) + ")");
		inPlace(templates, StatementKind.RSTRIP, "Stripped trailing characters of",
				(s, c) -> c + ".str.rstrip(" + chars(s) + ")");
		inPlace(templates, StatementKind.REPLACE, "Replaced text in", (s, c) -> c + ".str.replace("
				+ CodeGenerator.param(s, "old", "") + ", " + CodeGenerator.param(s, "new", "") + ", regex=False)");
		inPlace(templates, StatementKind.SUBSTRING, "Extracted substring of", (s, c) -> c + ".str["
				+ CodeGenerator.param(s, "start", Long.valueOf(0)) + ":"
				+ (s.hasParameter("end") ? CodeGenerator.param(s, "end", null) : "") + "]");
		inPlace(templates, StatementKind.LENGTH, "Computed length of", (s, c) -> c + ".str.len()");
		inPlace(templates, StatementKind.EXTRACT_REGEX, "Extracted pattern from", ColumnTemplates::extractRegex);
		inPlace(templates, StatementKind.FIND, "Found substring position in",
				(s, c) -> c + ".str.find(" + CodeGenerator.param(s, "substring", "") + ")");
		templates.put(StatementKind.SPLIT, ColumnTemplates::split);
		templates.put(StatementKind.CONCAT, ColumnTemplates::concat);

		// Dates
		inPlace(templates, StatementKind.PARSE_DATETIME, "Parsed dates in",
				(s, c) -> "pd.to_datetime(" + c + CodeGenerator.keyword(s, "format") + ")");
		for (StatementKind kind : StatementKind.values()) {
			if (kind == StatementKind.EXTRACT || kind.name().startsWith("EXTRACT_") && kind != StatementKind.EXTRACT_REGEX) {
				templates.put(kind, ColumnTemplates::extractPart);
			}
		}
		templates.put(StatementKind.DATE_DIFF, ColumnTemplates::dateDiff);
		inPlace(templates, StatementKind.DATE_ADD, "Shifted dates forward in", (s, c) -> c + " + " + offset(s));
		inPlace(templates, StatementKind.DATE_SUBTRACT, "Shifted dates backward in", (s, c) -> c + " - " + offset(s));
		inPlace(templates, StatementKind.FORMAT_DATETIME, "Formatted dates in",
				(s, c) -> c + ".dt.strftime(" + CodeGenerator.param(s, "format", "%Y-%m-%d") + ")");

		// Conversion and encoding
		inPlace(templates, StatementKind.ASTYPE, "Converted type of",
				(s, c) -> c + ".astype(" + CodeGenerator.param(s, "dtype", "object") + ")");
		inPlace(templates, StatementKind.TO_NUMERIC, "Converted to numeric",
				(s, c) -> "pd.to_numeric(" + c + ", errors=" + CodeGenerator.param(s, "errors", "coerce") + ")");
		templates.put(StatementKind.ONE_HOT_ENCODE, ColumnTemplates::oneHotEncode);
		templates.put(StatementKind.LABEL_ENCODE, ColumnTemplates::labelEncode);
		inPlace(templates, StatementKind.ORDINAL_ENCODE, "Ordinal encoded", ColumnTemplates::ordinalEncode);
		templates.put(StatementKind.TARGET_ENCODE, ColumnTemplates::targetEncode);

		// Scaling
		for (StatementKind kind : SCALERS.keySet()) {
			templates.put(kind, (s, out) -> scale(s, out, SCALERS.get(s.getKind()), columnsOf(s)));
		}
		templates.put(StatementKind.NORMALIZE, ColumnTemplates::normalize);
	}

	/**
	 * Registers a statement that rewrites its column with {@code operation},
	 * which receives the statement and the rendered column.
	 */
	static void inPlace(Map<StatementKind, CodeGenerator.Template> templates, StatementKind kind, String verb,
			BiFunction<Statement, String, String> operation) {
		templates.put(kind, (statement, out) -> {
			String name = CodeGenerator.columnName(statement);
			out.column(statement, name, frame -> operation.apply(statement, column(frame, name)),
					verb + " " + text(name), verb + " Result");
		});
	}

	/**
	 * Registers a statement that adds its derived column, computed by
	 * {@code operation} from the statement and the rendered operand column.
	 */
	static void derived(Map<StatementKind, CodeGenerator.Template> templates, StatementKind kind, String verb,
			BiFunction<Statement, String, String> operation) {
		templates.put(kind, (statement, out) -> {
			String name = CodeGenerator.columnName(statement);
			String added = statement.getDerivedColumn();
			out.column(statement, added, frame -> operation.apply(statement, column(frame, name)),
					verb + " " + text(name) + " into " + text(added), verb + " Result");
		});
	}

	private static String log(Statement statement, String column) {
		Object base = statement.getValue("base");
		if (base == null || "e".equals(base)) {
			return "np.log(" + column + ")";
		}
		if (base instanceof Number && ((Number) base).doubleValue() == 10) {
			return "np.log10(" + column + ")";
		}
		if (base instanceof Number && ((Number) base).doubleValue() == 2) {
			return "np.log2(" + column + ")";
		}
		return "np.log(" + column + ") / np.log(" + value(base) + ")";
	}

	private static String chars(Statement statement) {
		return statement.hasParameter("chars") ? CodeGenerator.param(statement, "chars", null) : "";
	}

	private static String extractRegex(Statement statement, String column) {
		String pattern = CodeGenerator.param(statement, "pattern", "");
		Object group = statement.getValue("group");
		if (group instanceof Long) {
			// regex groups are numbered from 1, extracted frame columns from 0
			return column + ".str.extract(" + pattern + ", expand=True)[" + (((Long) group).longValue() - 1) + "]";
		}
		if (group != null) {
			return column + ".str.extract(" + pattern + ", expand=True)[" + value(group) + "]";
		}
		return column + ".str.extract(" + pattern + ", expand=False)";
	}

	private static void split(Statement statement, CodeGenerator out) {
		String name = CodeGenerator.columnName(statement);
		String delimiter = CodeGenerator.param(statement, "delimiter", " ");
		out.frame(statement, "Split " + text(name) + " on " + text(delimiter), "Split Result", frame -> {
			out.line("_split = " + column(frame, name) + ".str.split(" + delimiter + ", expand=True)");
			out.line("_split.columns = [" + quote(name + "_") + " + str(i) for i in range(_split.shape[1])]");
			out.line(frame + " = pd.concat([" + frame + ", _split], axis=1)");
		});
	}

	private static void concat(Statement statement, CodeGenerator out) {
		String separator = CodeGenerator.param(statement, "separator", " ");
		String added = statement.getDerivedColumn();
		out.column(statement, added,
				frame -> frame + "[" + names(statement.getColumns()) + "].astype(str).agg(" + separator + ".join, axis=1)",
				"Concatenated " + text(String.valueOf(statement.getColumns().size())) + " columns into " + text(added),
				"Concatenated Result");
	}

	private static void extractPart(Statement statement, CodeGenerator out) {
		String part = statement.getKind() == StatementKind.EXTRACT
				? CodeGenerator.text(statement, "part", "year").toLowerCase(Locale.ROOT)
				: statement.getKind().getColumnSuffix().substring(1);
		String property = DATE_PARTS.containsKey(part) ? DATE_PARTS.get(part) : part;
		String name = CodeGenerator.columnName(statement);
		String added = statement.getDerivedColumn();
		out.column(statement, added, frame -> column(frame, name) + ".dt." + property,
				"Extracted " + text(part) + " from " + text(name) + " into " + text(added), "Extracted Result");
	}

	private static void dateDiff(Statement statement, CodeGenerator out) {
		String start = CodeGenerator.text(statement, "start", null);
		String end = CodeGenerator.text(statement, "end", null);
		String unit = CodeGenerator.text(statement, "unit", "days").toLowerCase(Locale.ROOT);
		String added = statement.getDerivedColumn();
		out.column(statement, added, frame -> {
			String delta = "(" + column(frame, end) + " - " + column(frame, start) + ")";
			switch (unit) {
			case "hours":
				return delta + ".dt.total_seconds() / 3600";
			case "minutes":
				return delta + ".dt.total_seconds() / 60";
			case "seconds":
				return delta + ".dt.total_seconds()";
			case "weeks":
				return delta + ".dt.days / 7";
			default:
				return delta + ".dt.days";
			}
		}, "Computed " + text(unit) + " between " + text(start) + " and " + text(end), "Date Difference Result");
	}

	/**
	 * @return {@code pd.DateOffset(days=n)}, the unit defaulting to days
	 */
	private static String offset(Statement statement) {
		String unit = CodeGenerator.text(statement, "unit", "days").toLowerCase(Locale.ROOT);
		if (!unit.endsWith("s")) {
			unit += "s";
		}
		return "pd.DateOffset(" + unit + "=" + CodeGenerator.param(statement, "value", Long.valueOf(0)) + ")";
	}

	private static void oneHotEncode(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String name = CodeGenerator.columnName(statement);
		String target = statement.hasResultAlias() ? CodeGenerator.alias(statement) : source;
		out.dataset(statement,
				"pd.get_dummies(" + source + ", columns=[" + quote(name) + "]" + CodeGenerator.keyword(statement, "prefix")
						+ ")",
				"One-hot encoded " + text(name) + ": {len(" + target + ".columns)} columns", "One-Hot Encoded Result");
	}

	private static void labelEncode(Statement statement, CodeGenerator out) {
		String name = CodeGenerator.columnName(statement);
		out.require("from sklearn.preprocessing import LabelEncoder");
		out.frame(statement, "Label encoded " + text(name), "Label Encoded Result", frame -> {
			out.line("_encoder = LabelEncoder()");
			out.line(column(frame, name) + " = _encoder.fit_transform(" + column(frame, name) + ".astype(str))");
		});
	}

	private static String ordinalEncode(Statement statement, String column) {
		if (statement.hasParameter("order")) {
			return column + ".map({v: i for i, v in enumerate(" + CodeGenerator.param(statement, "order", null) + ")})";
		}
		return column + ".astype('category').cat.codes";
	}

	private static void targetEncode(Statement statement, CodeGenerator out) {
		String name = CodeGenerator.columnName(statement);
		String target = CodeGenerator.text(statement, "target", null);
		out.column(statement, name,
				frame -> column(frame, name) + ".map(" + frame + ".groupby(" + quote(name) + ")[" + quote(target)
						+ "].mean())",
				"Target encoded " + text(name) + " with the mean of " + text(target), "Target Encoded Result");
	}

	private static void normalize(Statement statement, CodeGenerator out) {
		String method = CodeGenerator.text(statement, "method", "zscore").toLowerCase(Locale.ROOT);
		String scaler = NORMALIZERS.containsKey(method) ? NORMALIZERS.get(method) : "StandardScaler";
		scale(statement, out, scaler, columnsOf(statement));
	}

	private static void scale(Statement statement, CodeGenerator out, String scaler, List<String> columns) {
		out.require("from sklearn.preprocessing import " + scaler);
		// no column named: every numeric column
		String selection = columns.isEmpty() ? "_numeric" : PythonWriter.strings(columns);
		String scaled = columns.isEmpty() ? "numeric columns" : String.join(", ", columns);
		out.frame(statement, "Scaled " + text(scaled) + " with " + scaler, "Scaled Result",
				frame -> {
					if (columns.isEmpty()) {
						out.line("_numeric = " + frame + ".select_dtypes(include=['number']).columns");
					}
					out.line("_scaler = " + scaler + "()");
					out.line(frame + "[" + selection + "] = _scaler.fit_transform(" + frame + "[" + selection + "])");
				});
	}

	/**
	 * @return the {@code columns} clause names, or the single {@code column}
	 */
	private static List<String> columnsOf(Statement statement) {
		List<String> columns = new ArrayList<String>();
		for (Reference reference : statement.getColumns()) {
			columns.add(reference.getName());
		}
		if (columns.isEmpty() && statement.getColumn() != null) {
			columns.add(statement.getColumn().getName());
		}
		return columns;
	}
}
