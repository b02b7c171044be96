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

import static org.metricshub.noeta.backend.PythonWriter.quote;
import static org.metricshub.noeta.backend.PythonWriter.text;
import static org.metricshub.noeta.backend.PythonWriter.value;

import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.noeta.frontend.ast.Parameter;
import org.metricshub.noeta.frontend.ast.Statement;
import org.metricshub.noeta.frontend.ast.StatementKind;

/**
 * Templates of load, save, export_plot and show.
 */
final class IoTemplates {

	private IoTemplates() {}

	static void register(Map<StatementKind, CodeGenerator.Template> templates) {
		templates.put(StatementKind.LOAD, IoTemplates::load);
		templates.put(StatementKind.SAVE, IoTemplates::save);
		templates.put(StatementKind.EXPORT_PLOT, IoTemplates::exportPlot);
		templates.put(StatementKind.SHOW, IoTemplates::show);
	}

	private static void load(Statement statement, CodeGenerator out) {
		String alias = CodeGenerator.alias(statement);
		if ("sql".equals(statement.getFormat())) {
			out.require("from sqlalchemy import create_engine");
			out.line("_engine = create_engine(" + quote(statement.getConnection()) + ")");
			out.line(alias + " = pd.read_sql(" + quote(statement.getPath()) + ", con=_engine"
					+ arguments(statement.getParameters(), new LinkedHashMap<String, Object>()) + ")");
			out.report("Loaded from SQL as " + text(alias) + ": {len(" + alias + ")} rows, {len(" + alias
					+ ".columns)} columns");
		} else {
			out.line(alias + " = pd.read_" + readerSuffix(statement.getFormat()) + "(" + quote(statement.getPath())
					+ arguments(statement.getParameters(), new LinkedHashMap<String, Object>()) + ")");
			out.report("Loaded " + text(statement.getPath()) + " as " + text(alias) + ": {len(" + alias
					+ ")} rows, {len(" + alias + ".columns)} columns");
		}
		out.bind(alias);
	}

	private static void save(Statement statement, CodeGenerator out) {
		String format = statement.getFormat();
		Map<String, Object> defaults = new LinkedHashMap<String, Object>();
		if ("json".equals(format)) {
			defaults.put("orient", "records");
			defaults.put("indent", Long.valueOf(2));
		} else {
			defaults.put("index", Boolean.FALSE);
		}
		String source = CodeGenerator.source(statement);
		out.line(source + ".to_" + readerSuffix(format) + "(" + quote(statement.getPath())
				+ arguments(statement.getParameters(), defaults) + ")");
		out.report("Saved " + text(source) + " to " + text(statement.getPath()));
	}

	private static void exportPlot(Statement statement, CodeGenerator out) {
		String filename = CodeGenerator.text(statement, "filename", "plot.png");
		out.line("# Export plot");
		if (statement.hasParameter("width") && statement.hasParameter("height")) {
			out.line("plt.gcf().set_size_inches(" + CodeGenerator.param(statement, "width", null) + " / 100, "
					+ CodeGenerator.param(statement, "height", null) + " / 100)");
		}
		out.line("plt.savefig(" + quote(filename) + ", dpi=" + CodeGenerator.param(statement, "dpi", Long.valueOf(100))
				+ ", bbox_inches='tight'" + CodeGenerator.keyword(statement, "format") + ")");
		out.report("Exported plot to " + text(filename));
	}

	private static void show(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		if (statement.hasParameter("n")) {
			String n = CodeGenerator.param(statement, "n", null);
			out.title("Showing first " + n + " rows of " + source);
			out.line("print(" + source + ".head(" + n + "))");
		} else {
			out.title("Showing " + source);
			out.line("print(" + source + ")");
		}
	}

	/**
	 * @param format {@code csv}, {@code json}, {@code excel} or {@code parquet}
	 * @return the suffix of the matching {@code pd.read_*} and
	 *         {@code DataFrame.to_*} functions
	 */
	static String readerSuffix(String format) {
		if ("json".equals(format) || "excel".equals(format) || "parquet".equals(format)) {
			return format;
		}
		return "csv";
	}

	/**
	 * Renders {@code , key=value} keyword arguments: the defaults first, then
	 * the written parameters, which override them. {@code format} selects the
	 * function and is never passed.
	 */
	private static String arguments(Map<String, Parameter> parameters, Map<String, Object> defaults) {
		Map<String, Object> merged = new LinkedHashMap<String, Object>(defaults);
		for (Parameter parameter : parameters.values()) {
			if (!"format".equals(parameter.getName())) {
				merged.put(parameter.getName(), parameter.getValue());
			}
		}
		StringBuilder sb = new StringBuilder();
		for (Map.Entry<String, Object> entry : merged.entrySet()) {
			sb.append(", ").append(entry.getKey()).append('=').append(value(entry.getValue()));
		}
		return sb.toString();
	}
}
