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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.function.Function;
import org.metricshub.noeta.frontend.ast.Program;
import org.metricshub.noeta.frontend.ast.Statement;
import org.metricshub.noeta.frontend.ast.StatementKind;
import org.metricshub.noeta.util.NoetaLogger;
import org.slf4j.Logger;

/**
 * Translates an analyzed {@link Program} into a Python/pandas script.
 * <p>
 * Each statement kind has exactly one {@link Template}, registered by the
 * per-family template classes of this package. A template either binds its
 * result to the declared alias and prints a one-line report, or, when no
 * alias is declared, prints a title followed by the result itself.
 * Column statements work on a copy of their source: the alias itself when one
 * is declared, {@code _temp} otherwise.
 * <p>
 * The generated script starts with its sorted imports and the plotting setup,
 * and ends with a display block when any statement drew a plot. Whether the
 * plots are shown is decided by the script at run time: inside an
 * interactive kernel the kernel displays them, otherwise
 * {@code plt.show()} opens them.
 * <p>
 * A generator instance is not thread-safe; {@link #generate(Program)} resets
 * its state, so an instance may be reused sequentially.
 */
public class CodeGenerator {

	private static final Logger LOG = NoetaLogger.getLogger(CodeGenerator.class);

	/**
	 * Frame variable used by column statements that display their result.
	 */
	static final String TEMP = "_temp";

	private static final List<String> STANDARD_IMPORTS = Arrays.asList(
			"import pandas as pd",
			"import numpy as np",
			"import matplotlib.pyplot as plt",
			"import seaborn as sns",
			"from scipy import stats");

	/**
	 * Emits the code of one statement kind.
	 */
	interface Template {
		/**
		 * @param statement the statement to translate
		 * @param out the generator receiving lines and imports
		 */
		void emit(Statement statement, CodeGenerator out);
	}

	private final Map<StatementKind, Template> templates = new EnumMap<StatementKind, Template>(StatementKind.class);
	private final Set<String> imports = new TreeSet<String>();
	private final List<String> lines = new ArrayList<String>();
	private final Set<String> symbols = new LinkedHashSet<String>();
	private boolean plotEmitted;

	/**
	 * Creates a generator with every statement template registered.
	 */
	public CodeGenerator() {
		IoTemplates.register(templates);
		SelectionTemplates.register(templates);
		FilterTemplates.register(templates);
		ColumnTemplates.register(templates);
		TransformTemplates.register(templates);
		ReshapeTemplates.register(templates);
		CombineTemplates.register(templates);
		AnalysisTemplates.register(templates);
		PlotTemplates.register(templates);
	}

	/**
	 * Generates the Python script of a program.
	 *
	 * @param program an analyzed program
	 * @return the script text
	 * @throws IllegalStateException if a statement kind has no template
	 */
	public String generate(Program program) {
		imports.clear();
		lines.clear();
		symbols.clear();
		plotEmitted = false;
		imports.addAll(STANDARD_IMPORTS);

		for (Statement statement : program.getStatements()) {
			Template template = templates.get(statement.getKind());
			if (template == null) {
				throw new IllegalStateException("No code template for " + statement.getKind());
			}
			template.emit(statement, this);
		}
		LOG.debug("Generated {} lines for {} statements", lines.size(), program.size());

		StringBuilder script = new StringBuilder();
		script.append(String.join("\n", imports));
		script.append("\n\n# Configure visualization settings\n");
		script.append("plt.style.use('seaborn-v0_8-darkgrid')\n");
		script.append("sns.set_palette('husl')\n\n");
		script.append(String.join("\n", lines));
		if (plotEmitted) {
			script.append("\n\n# Display plots\n");
			script.append("plt.tight_layout()\n");
			script.append("try:\n");
			script.append("    get_ipython()\n");
			script.append("    # interactive kernel: figures are displayed inline\n");
			script.append("except NameError:\n");
			script.append("    plt.show()");
		}
		return script.toString();
	}

	/**
	 * @return the aliases bound by the last generated script, in binding order
	 */
	public Set<String> getDefinedAliases() {
		return Collections.unmodifiableSet(symbols);
	}

	/**
	 * @return whether the last generated script draws at least one plot
	 */
	public boolean isPlotEmitted() {
		return plotEmitted;
	}

	/**
	 * @param kind a statement kind
	 * @return whether a template is registered for it
	 */
	public boolean supports(StatementKind kind) {
		return templates.containsKey(kind);
	}

	// emission helpers used by the templates
	// ===============================================================================

	void require(String importLine) {
		imports.add(importLine);
	}

	void line(String code) {
		lines.add(code);
	}

	/**
	 * Records a frame variable bound by the script.
	 */
	void bind(String alias) {
		symbols.add(alias);
	}

	/**
	 * Marks the script as drawing plots, which appends the display block.
	 */
	void plot() {
		plotEmitted = true;
	}

	/**
	 * @param content literal and {@code {expression}} parts of an f-string
	 */
	void report(String content) {
		line("print(f'" + content + "')");
	}

	void title(String title) {
		line("print(f'\\n" + PythonWriter.text(title) + ":')");
	}

	/**
	 * Binds {@code expression} to the alias of the statement and reports, or
	 * prints it under a title when the statement has no alias.
	 */
	void dataset(Statement statement, String expression, String report, String title) {
		if (statement.hasResultAlias()) {
			String alias = alias(statement);
			line(alias + " = " + expression);
			report(report);
			bind(alias);
		} else {
			title(title);
			line("print(" + expression + ")");
		}
	}

	/**
	 * Copies the source of the statement into its alias (or {@code _temp}),
	 * lets {@code body} emit lines working on that frame variable, then reports
	 * or prints the frame.
	 */
	void frame(Statement statement, String report, String title, Consumer<String> body) {
		String frame = target(statement);
		line(frame + " = " + source(statement) + ".copy()");
		body.accept(frame);
		if (statement.hasResultAlias()) {
			report(report);
			bind(frame);
		} else {
			title(title);
			line("print(" + frame + ")");
		}
	}

	/**
	 * A {@link #frame} whose body assigns one column.
	 *
	 * @param column the assigned column
	 * @param expression renders the assigned value given the frame variable
	 */
	void column(Statement statement, String column, Function<String, String> expression, String report, String title) {
		frame(statement, report, title,
				frame -> line(PythonWriter.column(frame, column) + " = " + expression.apply(frame)));
	}

	static String alias(Statement statement) {
		return statement.getResultAlias().getName();
	}

	static String source(Statement statement) {
		return statement.getSource().getName();
	}

	static String target(Statement statement) {
		return statement.hasResultAlias() ? alias(statement) : TEMP;
	}

	/**
	 * @return the statement column, e.g. {@code price}
	 */
	static String columnName(Statement statement) {
		return statement.getColumn().getName();
	}

	/**
	 * @return a parameter rendered as a Python literal, or {@code defaultValue}
	 *         rendered when absent
	 */
	static String param(Statement statement, String name, Object defaultValue) {
		return PythonWriter.value(statement.getValue(name, defaultValue));
	}

	/**
	 * @return a parameter as plain text, or {@code defaultValue} when absent
	 *         or {@code none}
	 */
	static String text(Statement statement, String name, String defaultValue) {
		Object value = statement.getValue(name);
		return value == null ? defaultValue : value.toString();
	}

	/**
	 * @return {@code , name=value} for a present parameter, empty otherwise
	 */
	static String keyword(Statement statement, String name) {
		return statement.hasParameter(name) ? ", " + name + "=" + PythonWriter.value(statement.getValue(name)) : "";
	}
}
