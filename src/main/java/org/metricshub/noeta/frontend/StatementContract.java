package org.metricshub.noeta.frontend;

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

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.metricshub.noeta.frontend.ast.StatementKind;

/**
 * What each statement kind accepts after its leading keyword: the grammar
 * family it follows, the clauses it takes, its required and optional
 * parameters, its flags, which parameters name columns, and whether its
 * result may be bound with {@code as}.
 * <p>
 * {@link NoetaParser} enforces contracts while parsing; the semantic
 * analyzer reads {@link #getColumnParameters()} to know which parameter
 * values are column names.
 */
public final class StatementContract {

	/**
	 * Grammar families; each has one parsing routine.
	 */
	public enum Family {
		/** {@code load [format] "path" clause* as alias} */
		LOAD,
		/** {@code save alias to "path" clause*} */
		SAVE,
		/** {@code keyword clause*}, no source dataset */
		NO_SOURCE,
		/** {@code select alias ({c1, c2} | with c1, c2)} */
		SELECT,
		/** {@code sort alias by c1 [asc|desc], ...} */
		SORT,
		/** {@code groupby alias by cols [compute {func: col}]} */
		GROUPBY,
		/** {@code mutate alias (with c = expr)+ | {c: "expr"}} */
		MUTATE,
		/** {@code keyword alias with alias clause*} */
		BINARY,
		/** {@code keyword [alias, ...] clause*} */
		MULTI,
		/** {@code hypothesis alias vs[:] alias clause*} */
		HYPOTHESIS,
		/** {@code keyword alias clause*} */
		GENERIC
	}

	/**
	 * Keyword-introduced clauses.
	 */
	public enum Clause {
		/** {@code column [=|:] name} */
		COLUMN,
		/** {@code columns [=|:] list} */
		COLUMNS,
		/** {@code by list} */
		BY,
		/** {@code on [=] name} */
		ON,
		/** {@code where condition} */
		WHERE,
		/** {@code with transform expression} */
		TRANSFORM,
		/** {@code with c1, c2} (column list instead of parameters) */
		WITH_COLUMNS
	}

	private static final Map<StatementKind, StatementContract> CONTRACTS = new EnumMap<StatementKind, StatementContract>(
			StatementKind.class);

	private final StatementKind kind;
	private final Family family;
	private final Set<Clause> clauses = EnumSet.noneOf(Clause.class);
	private final Set<Clause> requiredClauses = EnumSet.noneOf(Clause.class);
	private final Set<String> parameters = new LinkedHashSet<String>();
	private final Set<String> requiredParameters = new LinkedHashSet<String>();
	private final Set<String> flags = new LinkedHashSet<String>();
	private final Set<String> columnParameters = new LinkedHashSet<String>();
	private boolean anyParameters;
	private boolean bindable = true;
	private boolean columnsAsParameter;
	private String usage;

	private StatementContract(StatementKind kind, Family family) {
		this.kind = kind;
		this.family = family;
	}

	/**
	 * @param kind a statement kind
	 * @return its contract
	 * @throws IllegalStateException if no contract is registered for the kind
	 */
	public static StatementContract of(StatementKind kind) {
		StatementContract contract = CONTRACTS.get(kind);
		if (contract == null) {
			throw new IllegalStateException("No contract registered for " + kind);
		}
		return contract;
	}

	public StatementKind getKind() {
		return kind;
	}

	public Family getFamily() {
		return family;
	}

	public boolean accepts(Clause clause) {
		return clauses.contains(clause);
	}

	public boolean requires(Clause clause) {
		return requiredClauses.contains(clause);
	}

	/**
	 * @param name parameter name
	 * @return whether the parameter (or flag) is accepted
	 */
	public boolean acceptsParameter(String name) {
		return anyParameters || parameters.contains(name) || flags.contains(name);
	}

	/**
	 * @return every accepted parameter and flag name, in declaration order
	 */
	public Set<String> getParameters() {
		Set<String> all = new LinkedHashSet<String>(parameters);
		all.addAll(flags);
		return Collections.unmodifiableSet(all);
	}

	public Set<String> getRequiredParameters() {
		return Collections.unmodifiableSet(requiredParameters);
	}

	public boolean isFlag(String name) {
		return flags.contains(name);
	}

	/**
	 * @return parameters whose values are column names of the source dataset
	 */
	public Set<String> getColumnParameters() {
		return Collections.unmodifiableSet(columnParameters);
	}

	/**
	 * @return whether the statement produces a dataset that {@code as} may bind
	 */
	public boolean isBindable() {
		return bindable;
	}

	/**
	 * @return whether {@code columns=} is a plain parameter (positional
	 *         columns of {@code iloc}) rather than a column clause
	 */
	public boolean isColumnsParameter() {
		return columnsAsParameter;
	}

	/**
	 * @return a usage line shown as a hint on syntax errors, or {@code null}
	 */
	public String getUsage() {
		return usage;
	}

	// contract table
	// ===============================================================================

	static {
		// I/O
		define(StatementKind.LOAD, Family.LOAD).anyParameters()
				.usage("Use \"load <file_path> as <alias>\" or \"load csv <file_path> as <alias>\"");
		define(StatementKind.SAVE, Family.SAVE).anyParameters().display()
				.usage("Use \"save <dataset> to <file_path>\" to write a dataset");
		define(StatementKind.EXPORT_PLOT, Family.NO_SOURCE).required("filename").optional("width", "height", "dpi", "format")
				.display();
		define(StatementKind.SHOW, Family.GENERIC).optional("n").display();

		// Selection and projection
		define(StatementKind.SELECT, Family.SELECT)
				.usage("Use \"select <dataset> with <col1>, <col2> as <alias>\" to select columns");
		define(StatementKind.SELECT_BY_TYPE, Family.GENERIC).required("type");
		define(StatementKind.HEAD, Family.GENERIC).optional("n")
				.usage("Use \"head <dataset> with n=<number> as <alias>\" to get first rows");
		define(StatementKind.TAIL, Family.GENERIC).optional("n")
				.usage("Use \"tail <dataset> with n=<number> as <alias>\" to get last rows");
		define(StatementKind.ILOC, Family.GENERIC).optional("rows", "columns").columnsAsParameter();
		define(StatementKind.LOC, Family.GENERIC).optional("rows").clause(Clause.COLUMNS);
		define(StatementKind.RENAME, Family.GENERIC).required("mapping").columnParameters("mapping")
				.usage("Use \"rename <dataset> with mapping={\"old\": \"new\"} as <alias>\" to rename columns");
		define(StatementKind.REORDER, Family.GENERIC).required("order").columnParameters("order");

		// Filtering
		define(StatementKind.FILTER, Family.GENERIC).requiredClause(Clause.WHERE)
				.usage("Use \"filter <dataset> where <condition> as <alias>\" to filter rows");
		define(StatementKind.FILTER_BETWEEN, Family.GENERIC).requiredClause(Clause.COLUMN).required("min", "max");
		define(StatementKind.FILTER_ISIN, Family.GENERIC).requiredClause(Clause.COLUMN).required("values");
		for (StatementKind kind : Arrays.asList(StatementKind.FILTER_CONTAINS, StatementKind.FILTER_STARTSWITH,
				StatementKind.FILTER_ENDSWITH, StatementKind.FILTER_REGEX)) {
			define(kind, Family.GENERIC).requiredClause(Clause.COLUMN).required("pattern");
		}
		define(StatementKind.FILTER_NULL, Family.GENERIC).requiredClause(Clause.COLUMN);
		define(StatementKind.FILTER_NOTNULL, Family.GENERIC).requiredClause(Clause.COLUMN);
		define(StatementKind.FILTER_DUPLICATES, Family.GENERIC).optional("subset", "keep").columnParameters("subset");
		define(StatementKind.SAMPLE, Family.GENERIC).required("n").flags("random");
		define(StatementKind.DROPNA, Family.GENERIC).clause(Clause.COLUMNS).optional("how")
				.usage("Use \"dropna <dataset> [columns {<col1>, <col2>}] as <alias>\" to remove rows with missing values");
		define(StatementKind.FILLNA, Family.GENERIC).clause(Clause.COLUMN).optional("value", "method")
				.usage("Use \"fillna <dataset> column <col> with value=<value> as <alias>\" to fill missing values");
		define(StatementKind.DROP_DUPLICATES, Family.GENERIC).optional("subset", "keep").columnParameters("subset");

		// Math
		define(StatementKind.ROUND, Family.GENERIC).requiredClause(Clause.COLUMN).optional("decimals");
		define(StatementKind.ABS, Family.GENERIC).requiredClause(Clause.COLUMN);
		define(StatementKind.SQRT, Family.GENERIC).requiredClause(Clause.COLUMN);
		define(StatementKind.POWER, Family.GENERIC).requiredClause(Clause.COLUMN).optional("exponent");
		define(StatementKind.LOG, Family.GENERIC).requiredClause(Clause.COLUMN).optional("base");
		define(StatementKind.CEIL, Family.GENERIC).requiredClause(Clause.COLUMN);
		define(StatementKind.FLOOR, Family.GENERIC).requiredClause(Clause.COLUMN);

		// Strings
		for (StatementKind kind : Arrays.asList(StatementKind.UPPER, StatementKind.LOWER, StatementKind.TITLE,
				StatementKind.CAPITALIZE, StatementKind.LENGTH)) {
			define(kind, Family.GENERIC).requiredClause(Clause.COLUMN);
		}
		for (StatementKind kind : Arrays.asList(StatementKind.STRIP, StatementKind.LSTRIP, StatementKind.RSTRIP)) {
			define(kind, Family.GENERIC).requiredClause(Clause.COLUMN).optional("chars");
		}
		define(StatementKind.REPLACE, Family.GENERIC).requiredClause(Clause.COLUMN).required("old", "new");
		define(StatementKind.SPLIT, Family.GENERIC).requiredClause(Clause.COLUMN).optional("delimiter");
		define(StatementKind.CONCAT, Family.GENERIC).requiredClause(Clause.COLUMNS).optional("separator");
		define(StatementKind.SUBSTRING, Family.GENERIC).requiredClause(Clause.COLUMN).optional("start", "end");
		define(StatementKind.EXTRACT_REGEX, Family.GENERIC).requiredClause(Clause.COLUMN).required("pattern")
				.optional("group");
		define(StatementKind.FIND, Family.GENERIC).requiredClause(Clause.COLUMN).required("substring");

		// Dates
		define(StatementKind.PARSE_DATETIME, Family.GENERIC).requiredClause(Clause.COLUMN).optional("format");
		define(StatementKind.EXTRACT, Family.GENERIC).requiredClause(Clause.COLUMN).required("part");
		for (StatementKind kind : Arrays.asList(StatementKind.EXTRACT_YEAR, StatementKind.EXTRACT_MONTH,
				StatementKind.EXTRACT_DAY, StatementKind.EXTRACT_HOUR, StatementKind.EXTRACT_MINUTE,
				StatementKind.EXTRACT_SECOND, StatementKind.EXTRACT_DAYOFWEEK, StatementKind.EXTRACT_DAYOFYEAR,
				StatementKind.EXTRACT_WEEKOFYEAR, StatementKind.EXTRACT_QUARTER)) {
			define(kind, Family.GENERIC).requiredClause(Clause.COLUMN);
		}
		define(StatementKind.DATE_DIFF, Family.GENERIC).required("start", "end").optional("unit")
				.columnParameters("start", "end");
		define(StatementKind.DATE_ADD, Family.GENERIC).requiredClause(Clause.COLUMN).required("value").optional("unit");
		define(StatementKind.DATE_SUBTRACT, Family.GENERIC).requiredClause(Clause.COLUMN).required("value")
				.optional("unit");
		define(StatementKind.FORMAT_DATETIME, Family.GENERIC).requiredClause(Clause.COLUMN).required("format");

		// Types, encoding, scaling
		define(StatementKind.ASTYPE, Family.GENERIC).requiredClause(Clause.COLUMN).required("dtype")
				.usage("Use \"astype <dataset> column <col> dtype=<type> as <alias>\" to convert types");
		define(StatementKind.TO_NUMERIC, Family.GENERIC).requiredClause(Clause.COLUMN).optional("errors");
		define(StatementKind.ONE_HOT_ENCODE, Family.GENERIC).requiredClause(Clause.COLUMN).optional("prefix");
		define(StatementKind.LABEL_ENCODE, Family.GENERIC).requiredClause(Clause.COLUMN);
		define(StatementKind.ORDINAL_ENCODE, Family.GENERIC).requiredClause(Clause.COLUMN).optional("order");
		define(StatementKind.TARGET_ENCODE, Family.GENERIC).requiredClause(Clause.COLUMN).required("target")
				.columnParameters("target");
		for (StatementKind kind : Arrays.asList(StatementKind.STANDARD_SCALE, StatementKind.MINMAX_SCALE,
				StatementKind.ROBUST_SCALE, StatementKind.MAXABS_SCALE)) {
			define(kind, Family.GENERIC).requiredClause(Clause.COLUMN);
		}
		define(StatementKind.NORMALIZE, Family.GENERIC).clause(Clause.COLUMN).clause(Clause.COLUMNS).optional("method");

		// Cleaning
		define(StatementKind.ISNULL, Family.GENERIC).requiredClause(Clause.COLUMN);
		define(StatementKind.NOTNULL, Family.GENERIC).requiredClause(Clause.COLUMN);
		define(StatementKind.COUNT_NA, Family.GENERIC).display();
		for (StatementKind kind : Arrays.asList(StatementKind.FILL_FORWARD, StatementKind.FILL_BACKWARD,
				StatementKind.FILL_MEAN, StatementKind.FILL_MEDIAN, StatementKind.FILL_MODE)) {
			define(kind, Family.GENERIC).requiredClause(Clause.COLUMN);
		}
		define(StatementKind.INTERPOLATE, Family.GENERIC).requiredClause(Clause.COLUMN).optional("method");
		define(StatementKind.DUPLICATED, Family.GENERIC).clause(Clause.COLUMNS).optional("keep");
		define(StatementKind.COUNT_DUPLICATES, Family.GENERIC).clause(Clause.COLUMNS).display();
		define(StatementKind.QCUT, Family.GENERIC).requiredClause(Clause.COLUMN).required("q").optional("labels");
		define(StatementKind.CUT, Family.GENERIC).requiredClause(Clause.COLUMN).required("bins").optional("labels");
		define(StatementKind.BINNING, Family.GENERIC).requiredClause(Clause.COLUMN).required("bins");

		// Ordering
		define(StatementKind.SORT, Family.SORT)
				.usage("Use \"sort <dataset> by <column> [desc] as <alias>\" to sort data");
		define(StatementKind.SORT_INDEX, Family.GENERIC).optional("ascending");
		define(StatementKind.RANK, Family.GENERIC).requiredClause(Clause.COLUMN).optional("method", "ascending", "pct");

		// Grouping and windows
		define(StatementKind.GROUPBY, Family.GROUPBY)
				.usage("Use \"groupby <dataset> by <column> [compute {<func>: <column>}] as <alias>\" to group data");
		define(StatementKind.FILTER_GROUPS, Family.GENERIC).requiredClause(Clause.BY).required("condition");
		define(StatementKind.GROUP_TRANSFORM, Family.GENERIC).requiredClause(Clause.BY).requiredClause(Clause.COLUMN)
				.required("function");
		define(StatementKind.WINDOW_RANK, Family.GENERIC).requiredClause(Clause.COLUMN).clause(Clause.BY)
				.optional("method", "ascending");
		define(StatementKind.WINDOW_LAG, Family.GENERIC).requiredClause(Clause.COLUMN).clause(Clause.BY)
				.optional("periods");
		define(StatementKind.WINDOW_LEAD, Family.GENERIC).requiredClause(Clause.COLUMN).clause(Clause.BY)
				.optional("periods");
		define(StatementKind.ROLLING, Family.GENERIC).requiredClause(Clause.COLUMN).required("window")
				.optional("function");
		for (StatementKind kind : Arrays.asList(StatementKind.ROLLING_MEAN, StatementKind.ROLLING_SUM,
				StatementKind.ROLLING_STD, StatementKind.ROLLING_MIN, StatementKind.ROLLING_MAX)) {
			define(kind, Family.GENERIC).requiredClause(Clause.COLUMN).required("window");
		}
		for (StatementKind kind : Arrays.asList(StatementKind.EXPANDING_MEAN, StatementKind.EXPANDING_SUM,
				StatementKind.EXPANDING_MIN, StatementKind.EXPANDING_MAX, StatementKind.CUMSUM, StatementKind.CUMMAX,
				StatementKind.CUMMIN, StatementKind.CUMPROD)) {
			define(kind, Family.GENERIC).requiredClause(Clause.COLUMN);
		}
		define(StatementKind.PCT_CHANGE, Family.GENERIC).requiredClause(Clause.COLUMN).optional("periods");
		define(StatementKind.DIFF, Family.GENERIC).requiredClause(Clause.COLUMN).optional("periods");
		define(StatementKind.SHIFT, Family.GENERIC).requiredClause(Clause.COLUMN).optional("periods", "fill_value");

		// Reshaping
		define(StatementKind.PIVOT, Family.GENERIC).required("index", "values").requiredClause(Clause.COLUMNS)
				.columnParameters("index", "values");
		define(StatementKind.PIVOT_TABLE, Family.GENERIC).required("index", "values").requiredClause(Clause.COLUMNS)
				.optional("aggfunc", "fill_value").columnParameters("index", "values");
		define(StatementKind.MELT, Family.GENERIC).required("id_vars").optional("value_vars", "var_name", "value_name")
				.columnParameters("id_vars", "value_vars");
		define(StatementKind.STACK, Family.GENERIC).optional("level");
		define(StatementKind.UNSTACK, Family.GENERIC).optional("level", "fill_value");
		define(StatementKind.TRANSPOSE, Family.GENERIC);
		define(StatementKind.CROSSTAB, Family.GENERIC).required("rows").requiredClause(Clause.COLUMNS)
				.optional("values", "aggfunc").columnParameters("rows");

		// Combining
		define(StatementKind.JOIN, Family.BINARY).requiredClause(Clause.ON).optional("how")
				.usage("Use \"join <left> with <right> on <column> as <alias>\" to join datasets");
		define(StatementKind.MERGE, Family.BINARY).clause(Clause.ON)
				.optional("how", "left_on", "right_on", "suffixes").columnParameters("left_on", "right_on")
				.usage("Use \"merge <left> with <right> on=<key> as <alias>\" to merge datasets");
		define(StatementKind.CONCAT_VERTICAL, Family.MULTI).optional("ignore_index");
		define(StatementKind.CONCAT_HORIZONTAL, Family.MULTI).optional("ignore_index");
		define(StatementKind.UNION, Family.BINARY);
		define(StatementKind.INTERSECTION, Family.BINARY);
		define(StatementKind.DIFFERENCE, Family.BINARY);

		// Advanced
		define(StatementKind.SET_INDEX, Family.GENERIC).requiredClause(Clause.COLUMN).optional("drop");
		define(StatementKind.RESET_INDEX, Family.GENERIC).optional("drop");
		define(StatementKind.APPLY_ROW, Family.GENERIC).required("function");
		define(StatementKind.APPLY_COLUMN, Family.GENERIC).requiredClause(Clause.COLUMN).required("function");
		define(StatementKind.APPLYMAP, Family.GENERIC).required("function");
		define(StatementKind.APPLY, Family.GENERIC).requiredClause(Clause.COLUMNS).clause(Clause.TRANSFORM)
				.optional("function");
		define(StatementKind.MAP, Family.GENERIC).requiredClause(Clause.COLUMN).clause(Clause.TRANSFORM)
				.optional("mapping");
		define(StatementKind.MAP_VALUES, Family.GENERIC).requiredClause(Clause.COLUMN).required("mapping");
		define(StatementKind.RESAMPLE, Family.GENERIC).required("rule").clause(Clause.COLUMN).optional("aggfunc");
		define(StatementKind.ASSIGN, Family.GENERIC).requiredClause(Clause.COLUMN).required("value");
		define(StatementKind.MUTATE, Family.MUTATE);

		// Validation, index, boolean
		define(StatementKind.ASSERT_UNIQUE, Family.GENERIC).requiredClause(Clause.COLUMN).display();
		define(StatementKind.ASSERT_NO_NULLS, Family.GENERIC).requiredClause(Clause.COLUMN).display();
		define(StatementKind.ASSERT_RANGE, Family.GENERIC).requiredClause(Clause.COLUMN).optional("min", "max").display();
		define(StatementKind.REINDEX, Family.GENERIC).required("index");
		define(StatementKind.SET_MULTIINDEX, Family.GENERIC).requiredClause(Clause.COLUMNS);
		define(StatementKind.ANY, Family.GENERIC).requiredClause(Clause.COLUMN).display();
		define(StatementKind.ALL, Family.GENERIC).requiredClause(Clause.COLUMN).display();
		define(StatementKind.COUNT_TRUE, Family.GENERIC).requiredClause(Clause.COLUMN).display();
		define(StatementKind.COMPARE, Family.BINARY).display();

		// Analysis
		define(StatementKind.DESCRIBE, Family.GENERIC).clause(Clause.COLUMNS).display()
				.usage("Use \"describe <dataset>\" to show statistical summary");
		define(StatementKind.SUMMARY, Family.GENERIC).display();
		define(StatementKind.INFO, Family.GENERIC).display().usage("Use \"info <dataset>\" to show dataset information");
		define(StatementKind.UNIQUE, Family.GENERIC).requiredClause(Clause.COLUMN).display()
				.usage("Use \"unique <dataset> column <column>\" to get unique values");
		define(StatementKind.VALUE_COUNTS, Family.GENERIC).requiredClause(Clause.COLUMN).flags("normalize", "ascending")
				.display().usage("Use \"value_counts <dataset> column <column>\" to count value frequencies");
		define(StatementKind.OUTLIERS, Family.GENERIC).requiredClause(Clause.COLUMNS).optional("method", "threshold")
				.display();
		define(StatementKind.QUANTILE, Family.GENERIC).requiredClause(Clause.COLUMN).required("q").display();
		define(StatementKind.HYPOTHESIS, Family.HYPOTHESIS).clause(Clause.COLUMNS).optional("test").display();

		// Visualization
		define(StatementKind.BOXPLOT, Family.GENERIC).clause(Clause.WITH_COLUMNS).clause(Clause.COLUMNS)
				.clause(Clause.BY).display();
		define(StatementKind.HEATMAP, Family.GENERIC).clause(Clause.COLUMNS).display();
		define(StatementKind.PAIRPLOT, Family.GENERIC).clause(Clause.COLUMNS).optional("hue").columnParameters("hue")
				.display();
		define(StatementKind.TIMESERIES, Family.GENERIC).required("x", "y").optional("title").columnParameters("x", "y")
				.display();
		define(StatementKind.PIE, Family.GENERIC).required("values", "labels").columnParameters("values", "labels")
				.display();

		for (StatementKind kind : StatementKind.values()) {
			if (!CONTRACTS.containsKey(kind)) {
				throw new IllegalStateException("No contract declared for " + kind);
			}
		}
	}

	private static StatementContract define(StatementKind kind, Family family) {
		StatementContract contract = new StatementContract(kind, family);
		CONTRACTS.put(kind, contract);
		return contract;
	}

	private StatementContract clause(Clause clause) {
		clauses.add(clause);
		return this;
	}

	private StatementContract requiredClause(Clause clause) {
		clauses.add(clause);
		requiredClauses.add(clause);
		return this;
	}

	private StatementContract optional(String... names) {
		parameters.addAll(Arrays.asList(names));
		return this;
	}

	private StatementContract required(String... names) {
		parameters.addAll(Arrays.asList(names));
		requiredParameters.addAll(Arrays.asList(names));
		return this;
	}

	private StatementContract flags(String... names) {
		flags.addAll(Arrays.asList(names));
		return this;
	}

	private StatementContract columnParameters(String... names) {
		columnParameters.addAll(Arrays.asList(names));
		return this;
	}

	private StatementContract anyParameters() {
		anyParameters = true;
		return this;
	}

	private StatementContract display() {
		bindable = false;
		return this;
	}

	private StatementContract columnsAsParameter() {
		columnsAsParameter = true;
		return this;
	}

	private StatementContract usage(String line) {
		usage = line;
		return this;
	}
}
