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

import static org.metricshub.noeta.backend.PythonWriter.nameOrNames;
import static org.metricshub.noeta.backend.PythonWriter.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.metricshub.noeta.frontend.ast.Reference;
import org.metricshub.noeta.frontend.ast.Statement;
import org.metricshub.noeta.frontend.ast.StatementKind;

/**
 * Templates of statements combining two or more datasets.
 */
final class CombineTemplates {

	private CombineTemplates() {}

	static void register(Map<StatementKind, CodeGenerator.Template> templates) {
		templates.put(StatementKind.JOIN, CombineTemplates::join);
		templates.put(StatementKind.MERGE, CombineTemplates::merge);
		templates.put(StatementKind.CONCAT_VERTICAL, (s, out) -> concat(s, out, 0, Boolean.TRUE));
		templates.put(StatementKind.CONCAT_HORIZONTAL, (s, out) -> concat(s, out, 1, Boolean.FALSE));
		templates.put(StatementKind.UNION, (s, out) -> out.dataset(s,
				"pd.concat([" + left(s) + ", " + right(s) + "]).drop_duplicates().reset_index(drop=True)",
				"Union of " + text(left(s)) + " and " + text(right(s)) + ": " + rows(s), "Union Result"));
		templates.put(StatementKind.INTERSECTION, (s, out) -> out.dataset(s,
				"pd.merge(" + left(s) + ", " + right(s) + ", how='inner').drop_duplicates().reset_index(drop=True)",
				"Intersection of " + text(left(s)) + " and " + text(right(s)) + ": " + rows(s), "Intersection Result"));
		templates.put(StatementKind.DIFFERENCE, CombineTemplates::difference);
		templates.put(StatementKind.COMPARE, CombineTemplates::compare);
	}

	private static String left(Statement statement) {
		return statement.getSources().get(0).getName();
	}

	private static String right(Statement statement) {
		return statement.getSources().get(1).getName();
	}

	/**
	 * @return the f-string part counting the rows of the bound result
	 */
	private static String rows(Statement statement) {
		return "{len(" + CodeGenerator.target(statement) + ")} rows";
	}

	private static void join(Statement statement, CodeGenerator out) {
		out.dataset(statement,
				"pd.merge(" + left(statement) + ", " + right(statement) + ", on=" + nameOrNames(statement.getGroupBy())
						+ ", how=" + CodeGenerator.param(statement, "how", "inner") + ")",
				"Joined " + text(left(statement)) + " and " + text(right(statement)) + ": " + rows(statement),
				"Joined Result");
	}

	private static void merge(Statement statement, CodeGenerator out) {
		StringBuilder arguments = new StringBuilder(left(statement)).append(", ").append(right(statement));
		if (!statement.getGroupBy().isEmpty()) {
			arguments.append(", on=").append(nameOrNames(statement.getGroupBy()));
		} else {
			arguments.append(CodeGenerator.keyword(statement, "left_on"))
					.append(CodeGenerator.keyword(statement, "right_on"));
		}
		arguments.append(", how=").append(CodeGenerator.param(statement, "how", "inner"));
		arguments.append(CodeGenerator.keyword(statement, "suffixes"));
		out.dataset(statement, "pd.merge(" + arguments + ")",
				"Merged " + text(left(statement)) + " and " + text(right(statement)) + ": " + rows(statement),
				"Merged Result");
	}

	private static void concat(Statement statement, CodeGenerator out, int axis, Boolean ignoreIndex) {
		List<String> frames = new ArrayList<String>();
		for (Reference source : statement.getSources()) {
			frames.add(source.getName());
		}
		out.dataset(statement,
				"pd.concat([" + String.join(", ", frames) + "], axis=" + axis + ", ignore_index="
						+ CodeGenerator.param(statement, "ignore_index", ignoreIndex) + ")",
				"Concatenated " + frames.size() + " datasets: " + rows(statement), "Concatenated Result");
	}

	private static void difference(Statement statement, CodeGenerator out) {
		String target = CodeGenerator.target(statement);
		out.line("_merged = pd.merge(" + left(statement) + ", " + right(statement) + ", how='left', indicator=True)");
		String expression = "_merged[_merged['_merge'] == 'left_only'].drop('_merge', axis=1).reset_index(drop=True)";
		if (statement.hasResultAlias()) {
			out.dataset(statement, expression, "Difference of " + text(left(statement)) + " and "
					+ text(right(statement)) + ": " + rows(statement), "Difference Result");
		} else {
			out.line(target + " = " + expression);
			out.title("Difference Result");
			out.line("print(" + target + ")");
		}
	}

	private static void compare(Statement statement, CodeGenerator out) {
		out.line("_comparison = " + left(statement) + ".compare(" + right(statement) + ")");
		out.title("Comparison of " + left(statement) + " and " + right(statement));
		out.line("if _comparison.empty:");
		out.line("    print('No differences found')");
		out.line("else:");
		out.line("    print(_comparison)");
	}
}
