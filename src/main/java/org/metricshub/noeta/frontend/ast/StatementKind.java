package org.metricshub.noeta.frontend.ast;

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

import java.util.Locale;
import org.metricshub.noeta.frontend.TokenType;

/**
 * Every kind of Noeta statement, one per statement keyword.
 * <p>
 * Statements that add a derived column declare how that column is named:
 * either a suffix appended to the operand column ({@code price_cumsum}) or a
 * fixed name ({@code concatenated}).
 */
public enum StatementKind {

	// I/O
	LOAD,
	SAVE,
	EXPORT_PLOT,
	SHOW,

	// Selection and projection
	SELECT,
	SELECT_BY_TYPE,
	HEAD,
	TAIL,
	ILOC,
	LOC,
	RENAME,
	REORDER,

	// Filtering
	FILTER,
	FILTER_BETWEEN,
	FILTER_ISIN,
	FILTER_CONTAINS,
	FILTER_STARTSWITH,
	FILTER_ENDSWITH,
	FILTER_REGEX,
	FILTER_NULL,
	FILTER_NOTNULL,
	FILTER_DUPLICATES,
	SAMPLE,
	DROPNA,
	FILLNA,
	DROP_DUPLICATES,

	// Math
	ROUND,
	ABS,
	SQRT,
	POWER,
	LOG,
	CEIL,
	FLOOR,

	// Strings
	UPPER,
	LOWER,
	STRIP,
	LSTRIP,
	RSTRIP,
	TITLE,
	CAPITALIZE,
	REPLACE,
	SPLIT,
	CONCAT(null, "concatenated"),
	SUBSTRING,
	LENGTH,
	EXTRACT_REGEX,
	FIND,

	// Dates
	PARSE_DATETIME,
	EXTRACT("_", null),
	EXTRACT_YEAR("_year", null),
	EXTRACT_MONTH("_month", null),
	EXTRACT_DAY("_day", null),
	EXTRACT_HOUR("_hour", null),
	EXTRACT_MINUTE("_minute", null),
	EXTRACT_SECOND("_second", null),
	EXTRACT_DAYOFWEEK("_dayofweek", null),
	EXTRACT_DAYOFYEAR("_dayofyear", null),
	EXTRACT_WEEKOFYEAR("_weekofyear", null),
	EXTRACT_QUARTER("_quarter", null),
	DATE_DIFF(null, "date_diff"),
	DATE_ADD,
	DATE_SUBTRACT,
	FORMAT_DATETIME,

	// Types, encoding, scaling
	ASTYPE,
	TO_NUMERIC,
	ONE_HOT_ENCODE,
	LABEL_ENCODE,
	ORDINAL_ENCODE,
	TARGET_ENCODE,
	STANDARD_SCALE,
	MINMAX_SCALE,
	ROBUST_SCALE,
	MAXABS_SCALE,
	NORMALIZE,

	// Cleaning
	ISNULL("_isnull", null),
	NOTNULL("_notnull", null),
	COUNT_NA,
	FILL_FORWARD,
	FILL_BACKWARD,
	FILL_MEAN,
	FILL_MEDIAN,
	FILL_MODE,
	INTERPOLATE,
	DUPLICATED(null, "is_duplicate"),
	COUNT_DUPLICATES,
	QCUT,
	CUT,
	BINNING,

	// Ordering
	SORT,
	SORT_INDEX,
	RANK,

	// Grouping and windows
	GROUPBY,
	FILTER_GROUPS,
	GROUP_TRANSFORM,
	WINDOW_RANK("_rank", null),
	WINDOW_LAG("_lag", null),
	WINDOW_LEAD("_lead", null),
	ROLLING,
	ROLLING_MEAN("_rolling_mean", null),
	ROLLING_SUM("_rolling_sum", null),
	ROLLING_STD("_rolling_std", null),
	ROLLING_MIN("_rolling_min", null),
	ROLLING_MAX("_rolling_max", null),
	EXPANDING_MEAN("_expanding_mean", null),
	EXPANDING_SUM("_expanding_sum", null),
	EXPANDING_MIN("_expanding_min", null),
	EXPANDING_MAX("_expanding_max", null),
	CUMSUM("_cumsum", null),
	CUMMAX("_cummax", null),
	CUMMIN("_cummin", null),
	CUMPROD("_cumprod", null),
	PCT_CHANGE("_pct_change", null),
	DIFF("_diff", null),
	SHIFT,

	// Reshaping
	PIVOT,
	PIVOT_TABLE,
	MELT,
	STACK,
	UNSTACK,
	TRANSPOSE,
	CROSSTAB,

	// Combining
	JOIN,
	MERGE,
	CONCAT_VERTICAL,
	CONCAT_HORIZONTAL,
	UNION,
	INTERSECTION,
	DIFFERENCE,

	// Advanced
	SET_INDEX,
	RESET_INDEX,
	APPLY_ROW,
	APPLY_COLUMN,
	APPLYMAP,
	APPLY,
	MAP,
	MAP_VALUES,
	RESAMPLE,
	ASSIGN,
	MUTATE,

	// Validation, index, boolean
	ASSERT_UNIQUE,
	ASSERT_NO_NULLS,
	ASSERT_RANGE,
	REINDEX,
	SET_MULTIINDEX,
	ANY,
	ALL,
	COUNT_TRUE,
	COMPARE,

	// Analysis
	DESCRIBE,
	SUMMARY,
	INFO,
	UNIQUE,
	VALUE_COUNTS,
	OUTLIERS,
	QUANTILE,
	HYPOTHESIS,

	// Visualization
	BOXPLOT,
	HEATMAP,
	PAIRPLOT,
	TIMESERIES,
	PIE;

	private final String keyword;
	private final String columnSuffix;
	private final String fixedColumn;

	StatementKind() {
		this(null, null);
	}

	StatementKind(String columnSuffix, String fixedColumn) {
		this.keyword = name().toLowerCase(Locale.ROOT);
		this.columnSuffix = columnSuffix;
		this.fixedColumn = fixedColumn;
	}

	/**
	 * @return the keyword introducing this statement, e.g. {@code value_counts}
	 */
	public String keyword() {
		return keyword;
	}

	/**
	 * @return the suffix appended to the operand column to name the derived
	 *         column, or {@code null}
	 */
	public String getColumnSuffix() {
		return columnSuffix;
	}

	/**
	 * @return the fixed name of the derived column, or {@code null}
	 */
	public String getFixedColumn() {
		return fixedColumn;
	}

	/**
	 * @return whether this statement adds a new column to its result
	 */
	public boolean addsColumn() {
		return columnSuffix != null || fixedColumn != null;
	}

	/**
	 * @return the name used in diagnostics, e.g. "value_counts statement"
	 */
	public String describe() {
		return keyword + " statement";
	}

	/**
	 * @param type a statement keyword token type
	 * @return the matching kind
	 * @throws IllegalArgumentException if {@code type} is not a statement keyword
	 */
	public static StatementKind of(TokenType type) {
		if (!type.isStatementKeyword()) {
			throw new IllegalArgumentException(type + " does not start a statement");
		}
		return valueOf(type.name());
	}
}
