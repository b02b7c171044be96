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

import java.util.Map;
import org.metricshub.noeta.frontend.ast.Statement;
import org.metricshub.noeta.frontend.ast.StatementKind;

/**
 * Templates of the matplotlib and seaborn charts.
 * <p>
 * Every chart marks the script as plotting, so that the display block is
 * appended once at the end.
 */
final class PlotTemplates {

	private PlotTemplates() {}

	static void register(Map<StatementKind, CodeGenerator.Template> templates) {
		templates.put(StatementKind.BOXPLOT, PlotTemplates::boxplot);
		templates.put(StatementKind.HEATMAP, PlotTemplates::heatmap);
		templates.put(StatementKind.PAIRPLOT, PlotTemplates::pairplot);
		templates.put(StatementKind.TIMESERIES, PlotTemplates::timeseries);
		templates.put(StatementKind.PIE, PlotTemplates::pie);
	}

	private static void boxplot(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		out.line("# Box plot");
		out.line("plt.figure(figsize=(10, 6))");
		if (!statement.getGroupBy().isEmpty() && statement.getColumns().size() == 1) {
			out.line(source + ".boxplot(column=" + quote(statement.getColumns().get(0).getName()) + ", by="
					+ quote(statement.getGroupBy().get(0).getName()) + ")");
		} else if (!statement.getColumns().isEmpty()) {
			out.line(source + "[" + names(statement.getColumns()) + "].boxplot()");
		} else {
			out.line(source + ".boxplot()");
		}
		out.line("plt.title('Box Plot')");
		out.line("plt.xticks(rotation=45)");
		out.plot();
	}

	private static void heatmap(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String data = statement.getColumns().isEmpty() ? source + ".select_dtypes(include=['number'])"
				: source + "[" + names(statement.getColumns()) + "]";
		out.line("# Heatmap");
		out.line("plt.figure(figsize=(10, 8))");
		out.line("_correlation = " + data + ".corr()");
		out.line("sns.heatmap(_correlation, annot=True, cmap='coolwarm', center=0)");
		out.line("plt.title('Correlation Heatmap')");
		out.plot();
	}

	private static void pairplot(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String data = source;
		if (!statement.getColumns().isEmpty()) {
			if (statement.hasParameter("hue")) {
				data = source + "[" + names(statement.getColumns()) + " + [" + CodeGenerator.param(statement, "hue", null)
						+ "]]";
			} else {
				data = source + "[" + names(statement.getColumns()) + "]";
			}
		}
		out.line("# Pair plot");
		out.line("_pairplot = sns.pairplot(" + data + CodeGenerator.keyword(statement, "hue") + ")");
		out.line("_pairplot.fig.suptitle('Pair Plot', y=1.02)");
		out.plot();
	}

	private static void timeseries(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		String x = CodeGenerator.text(statement, "x", null);
		String y = CodeGenerator.text(statement, "y", null);
		out.line("# Time series plot");
		out.line("plt.figure(figsize=(12, 6))");
		out.line("plt.plot(" + column(source, x) + ", " + column(source, y) + ")");
		out.line("plt.xlabel(" + quote(x) + ")");
		out.line("plt.ylabel(" + quote(y) + ")");
		out.line("plt.title(" + CodeGenerator.param(statement, "title", "Time Series Plot") + ")");
		out.line("plt.xticks(rotation=45)");
		out.line("plt.grid(True, alpha=0.3)");
		out.plot();
	}

	private static void pie(Statement statement, CodeGenerator out) {
		String source = CodeGenerator.source(statement);
		out.line("# Pie chart");
		out.line("plt.figure(figsize=(8, 8))");
		out.line("plt.pie(" + column(source, CodeGenerator.text(statement, "values", null)) + ", labels="
				+ column(source, CodeGenerator.text(statement, "labels", null)) + ", autopct='%1.1f%%')");
		out.line("plt.title('Pie Chart')");
		out.plot();
	}
}
