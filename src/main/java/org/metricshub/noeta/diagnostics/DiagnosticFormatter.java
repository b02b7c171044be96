package org.metricshub.noeta.diagnostics;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders diagnostics as plain text.
 * <p>
 * A single diagnostic renders as:
 *
 * <pre>
 * Syntax Error at line 2, column 14:
 *        2 | select sales 123 as result
 *                         ^^^
 *     Expected "with" keyword, got number 123 in select statement
 *
 * Hint: Use "select &lt;dataset&gt; with &lt;col1&gt;, &lt;col2&gt; as &lt;alias&gt;" to select columns
 * </pre>
 *
 * A batch is grouped by category with sequential numbering and a trailing
 * count. A batch of exactly one diagnostic renders in the single form.
 */
public final class DiagnosticFormatter {

	private static final String INDENT = "    ";
	private static final int RULE_WIDTH = 60;

	private DiagnosticFormatter() {}

	/**
	 * Formats one diagnostic.
	 *
	 * @param diagnostic the diagnostic to render
	 * @return the rendered text, without trailing newline
	 */
	public static String format(Diagnostic diagnostic) {
		List<String> lines = new ArrayList<String>();
		ErrorContext context = diagnostic.getContext();
		String category = diagnostic.getCategory().getDisplayName();

		if (context != null) {
			lines.add(category + " at line " + context.getLine() + ", column " + context.getColumn() + ":");
			if (!context.getSourceLine().isEmpty()) {
				lines.add(formatSourceContext(context));
			}
		} else {
			lines.add(category + ":");
		}

		lines.add(INDENT + diagnostic.getMessage());

		if (diagnostic.getHint() != null) {
			lines.add("");
			lines.add("Hint: " + diagnostic.getHint());
		}
		if (diagnostic.getSuggestion() != null) {
			lines.add("Did you mean: " + diagnostic.getSuggestion());
		}
		return String.join("\n", lines);
	}

	/**
	 * Formats a batch of diagnostics.
	 *
	 * @param diagnostics diagnostics in encounter order
	 * @return the rendered report
	 */
	public static String format(List<Diagnostic> diagnostics) {
		if (diagnostics.isEmpty()) {
			return "No errors to display";
		}
		if (diagnostics.size() == 1) {
			return format(diagnostics.get(0));
		}

		Map<ErrorCategory, List<Diagnostic>> grouped = new EnumMap<ErrorCategory, List<Diagnostic>>(ErrorCategory.class);
		for (Diagnostic diagnostic : diagnostics) {
			grouped.computeIfAbsent(diagnostic.getCategory(), k -> new ArrayList<Diagnostic>()).add(diagnostic);
		}

		List<String> lines = new ArrayList<String>();
		lines.add("Found " + diagnostics.size() + " errors in compilation:");
		lines.add("");

		int number = 1;
		for (Map.Entry<ErrorCategory, List<Diagnostic>> entry : grouped.entrySet()) {
			List<Diagnostic> inCategory = entry.getValue();
			lines.add("\n" + entry.getKey().getDisplayName() + "s (" + inCategory.size() + "):");
			lines.add(String.join("", Collections.nCopies(RULE_WIDTH, "-")));

			for (Diagnostic diagnostic : inCategory) {
				lines.add("\n[Error " + number++ + "]");
				ErrorContext context = diagnostic.getContext();
				if (context != null) {
					lines.add("  Line " + context.getLine() + ", column " + context.getColumn() + ":");
					if (!context.getSourceLine().isEmpty()) {
						lines.add(formatSourceContext(context));
					}
				}
				lines.add(INDENT + diagnostic.getMessage());
				if (diagnostic.getHint() != null) {
					lines.add("  Hint: " + diagnostic.getHint());
				}
				if (diagnostic.getSuggestion() != null) {
					lines.add("  Did you mean: " + diagnostic.getSuggestion());
				}
			}
		}

		lines.add("");
		lines.add(String.join("", Collections.nCopies(RULE_WIDTH, "=")));
		int total = diagnostics.size();
		lines.add("Total: " + total + " error" + (total == 1 ? "" : "s") + " found");
		return String.join("\n", lines);
	}

	/**
	 * Renders the quoted source line and the caret underline of the span.
	 */
	static String formatSourceContext(ErrorContext context) {
		String lineNumber = String.format("%4d", context.getLine());
		StringBuilder text = new StringBuilder();
		text.append(INDENT).append(lineNumber).append(" | ").append(context.getSourceLine()).append('\n');
		int spaces = INDENT.length() + lineNumber.length() + 3 + context.getColumn() - 1;
		for (int i = 0; i < spaces; i++) {
			text.append(' ');
		}
		for (int i = 0; i < context.getLength(); i++) {
			text.append('^');
		}
		return text.toString();
	}
}
