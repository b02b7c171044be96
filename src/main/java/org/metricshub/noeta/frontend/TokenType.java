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

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Kinds of tokens produced by {@link NoetaLexer}.
 * <p>
 * Statement keywords and structural keywords are spelled exactly as the
 * lower-cased constant name. Parameter names ({@code n}, {@code method},
 * {@code value}...) are not keywords: they are plain {@link #IDENTIFIER}s.
 */
public enum TokenType {

	// I/O
	LOAD(Group.STATEMENT),
	SAVE(Group.STATEMENT),
	EXPORT_PLOT(Group.STATEMENT),
	SHOW(Group.STATEMENT),

	// Selection and projection
	SELECT(Group.STATEMENT),
	SELECT_BY_TYPE(Group.STATEMENT),
	HEAD(Group.STATEMENT),
	TAIL(Group.STATEMENT),
	ILOC(Group.STATEMENT),
	LOC(Group.STATEMENT),
	RENAME(Group.STATEMENT),
	REORDER(Group.STATEMENT),

	// Filtering
	FILTER(Group.STATEMENT),
	FILTER_BETWEEN(Group.STATEMENT),
	FILTER_ISIN(Group.STATEMENT),
	FILTER_CONTAINS(Group.STATEMENT),
	FILTER_STARTSWITH(Group.STATEMENT),
	FILTER_ENDSWITH(Group.STATEMENT),
	FILTER_REGEX(Group.STATEMENT),
	FILTER_NULL(Group.STATEMENT),
	FILTER_NOTNULL(Group.STATEMENT),
	FILTER_DUPLICATES(Group.STATEMENT),
	SAMPLE(Group.STATEMENT),
	DROPNA(Group.STATEMENT),
	FILLNA(Group.STATEMENT),
	DROP_DUPLICATES(Group.STATEMENT),

	// Math
	ROUND(Group.STATEMENT),
	ABS(Group.STATEMENT),
	SQRT(Group.STATEMENT),
	POWER(Group.STATEMENT),
	LOG(Group.STATEMENT),
	CEIL(Group.STATEMENT),
	FLOOR(Group.STATEMENT),

	// Strings
	UPPER(Group.STATEMENT),
	LOWER(Group.STATEMENT),
	STRIP(Group.STATEMENT),
	LSTRIP(Group.STATEMENT),
	RSTRIP(Group.STATEMENT),
	TITLE(Group.STATEMENT),
	CAPITALIZE(Group.STATEMENT),
	REPLACE(Group.STATEMENT),
	SPLIT(Group.STATEMENT),
	CONCAT(Group.STATEMENT),
	SUBSTRING(Group.STATEMENT),
	LENGTH(Group.STATEMENT),
	EXTRACT_REGEX(Group.STATEMENT),
	FIND(Group.STATEMENT),

	// Dates
	PARSE_DATETIME(Group.STATEMENT),
	EXTRACT(Group.STATEMENT),
	EXTRACT_YEAR(Group.STATEMENT),
	EXTRACT_MONTH(Group.STATEMENT),
	EXTRACT_DAY(Group.STATEMENT),
	EXTRACT_HOUR(Group.STATEMENT),
	EXTRACT_MINUTE(Group.STATEMENT),
	EXTRACT_SECOND(Group.STATEMENT),
	EXTRACT_DAYOFWEEK(Group.STATEMENT),
	EXTRACT_DAYOFYEAR(Group.STATEMENT),
	EXTRACT_WEEKOFYEAR(Group.STATEMENT),
	EXTRACT_QUARTER(Group.STATEMENT),
	DATE_DIFF(Group.STATEMENT),
	DATE_ADD(Group.STATEMENT),
	DATE_SUBTRACT(Group.STATEMENT),
	FORMAT_DATETIME(Group.STATEMENT),

	// Types, encoding, scaling
	ASTYPE(Group.STATEMENT),
	TO_NUMERIC(Group.STATEMENT),
	ONE_HOT_ENCODE(Group.STATEMENT),
	LABEL_ENCODE(Group.STATEMENT),
	ORDINAL_ENCODE(Group.STATEMENT),
	TARGET_ENCODE(Group.STATEMENT),
	STANDARD_SCALE(Group.STATEMENT),
	MINMAX_SCALE(Group.STATEMENT),
	ROBUST_SCALE(Group.STATEMENT),
	MAXABS_SCALE(Group.STATEMENT),
	NORMALIZE(Group.STATEMENT),

	// Cleaning
	ISNULL(Group.STATEMENT),
	NOTNULL(Group.STATEMENT),
	COUNT_NA(Group.STATEMENT),
	FILL_FORWARD(Group.STATEMENT),
	FILL_BACKWARD(Group.STATEMENT),
	FILL_MEAN(Group.STATEMENT),
	FILL_MEDIAN(Group.STATEMENT),
	FILL_MODE(Group.STATEMENT),
	INTERPOLATE(Group.STATEMENT),
	DUPLICATED(Group.STATEMENT),
	COUNT_DUPLICATES(Group.STATEMENT),
	QCUT(Group.STATEMENT),
	CUT(Group.STATEMENT),
	BINNING(Group.STATEMENT),

	// Ordering
	SORT(Group.STATEMENT),
	SORT_INDEX(Group.STATEMENT),
	RANK(Group.STATEMENT),

	// Grouping and windows
	GROUPBY(Group.STATEMENT),
	FILTER_GROUPS(Group.STATEMENT),
	GROUP_TRANSFORM(Group.STATEMENT),
	WINDOW_RANK(Group.STATEMENT),
	WINDOW_LAG(Group.STATEMENT),
	WINDOW_LEAD(Group.STATEMENT),
	ROLLING(Group.STATEMENT),
	ROLLING_MEAN(Group.STATEMENT),
	ROLLING_SUM(Group.STATEMENT),
	ROLLING_STD(Group.STATEMENT),
	ROLLING_MIN(Group.STATEMENT),
	ROLLING_MAX(Group.STATEMENT),
	EXPANDING_MEAN(Group.STATEMENT),
	EXPANDING_SUM(Group.STATEMENT),
	EXPANDING_MIN(Group.STATEMENT),
	EXPANDING_MAX(Group.STATEMENT),
	CUMSUM(Group.STATEMENT),
	CUMMAX(Group.STATEMENT),
	CUMMIN(Group.STATEMENT),
	CUMPROD(Group.STATEMENT),
	PCT_CHANGE(Group.STATEMENT),
	DIFF(Group.STATEMENT),
	SHIFT(Group.STATEMENT),

	// Reshaping
	PIVOT(Group.STATEMENT),
	PIVOT_TABLE(Group.STATEMENT),
	MELT(Group.STATEMENT),
	STACK(Group.STATEMENT),
	UNSTACK(Group.STATEMENT),
	TRANSPOSE(Group.STATEMENT),
	CROSSTAB(Group.STATEMENT),

	// Combining
	JOIN(Group.STATEMENT),
	MERGE(Group.STATEMENT),
	CONCAT_VERTICAL(Group.STATEMENT),
	CONCAT_HORIZONTAL(Group.STATEMENT),
	UNION(Group.STATEMENT),
	INTERSECTION(Group.STATEMENT),
	DIFFERENCE(Group.STATEMENT),

	// Advanced
	SET_INDEX(Group.STATEMENT),
	RESET_INDEX(Group.STATEMENT),
	APPLY_ROW(Group.STATEMENT),
	APPLY_COLUMN(Group.STATEMENT),
	APPLYMAP(Group.STATEMENT),
	APPLY(Group.STATEMENT),
	MAP(Group.STATEMENT),
	MAP_VALUES(Group.STATEMENT),
	RESAMPLE(Group.STATEMENT),
	ASSIGN(Group.STATEMENT),
	MUTATE(Group.STATEMENT),

	// Validation, index, boolean
	ASSERT_UNIQUE(Group.STATEMENT),
	ASSERT_NO_NULLS(Group.STATEMENT),
	ASSERT_RANGE(Group.STATEMENT),
	REINDEX(Group.STATEMENT),
	SET_MULTIINDEX(Group.STATEMENT),
	ANY(Group.STATEMENT),
	ALL(Group.STATEMENT),
	COUNT_TRUE(Group.STATEMENT),
	COMPARE(Group.STATEMENT),

	// Analysis
	DESCRIBE(Group.STATEMENT),
	SUMMARY(Group.STATEMENT),
	INFO(Group.STATEMENT),
	UNIQUE(Group.STATEMENT),
	VALUE_COUNTS(Group.STATEMENT),
	OUTLIERS(Group.STATEMENT),
	QUANTILE(Group.STATEMENT),
	HYPOTHESIS(Group.STATEMENT),

	// Visualization
	BOXPLOT(Group.STATEMENT),
	HEATMAP(Group.STATEMENT),
	PAIRPLOT(Group.STATEMENT),
	TIMESERIES(Group.STATEMENT),
	PIE(Group.STATEMENT),

	// Structural keywords
	AS(Group.KEYWORD),
	BY(Group.KEYWORD),
	WITH(Group.KEYWORD),
	ON(Group.KEYWORD),
	FROM(Group.KEYWORD),
	TO(Group.KEYWORD),
	WHERE(Group.KEYWORD),
	ELSE(Group.KEYWORD),
	COLUMN(Group.KEYWORD),
	COLUMNS(Group.KEYWORD),
	COMPUTE(Group.KEYWORD),
	AGG(Group.KEYWORD),
	TRANSFORM(Group.KEYWORD),
	VS(Group.KEYWORD),
	AND(Group.KEYWORD),
	OR(Group.KEYWORD),
	NOT(Group.KEYWORD),
	IN(Group.KEYWORD),
	BETWEEN(Group.KEYWORD),
	CONTAINS(Group.KEYWORD),
	STARTS_WITH(Group.KEYWORD),
	ENDS_WITH(Group.KEYWORD),
	MATCHES(Group.KEYWORD),
	IS(Group.KEYWORD),
	NULL(Group.KEYWORD),
	ASC(Group.KEYWORD),
	DESC(Group.KEYWORD),

	// File formats
	CSV(Group.KEYWORD),
	JSON(Group.KEYWORD),
	EXCEL(Group.KEYWORD),
	PARQUET(Group.KEYWORD),
	SQL(Group.KEYWORD),

	// Literals
	IDENTIFIER(Group.LITERAL, null, "dataset or column name"),
	STRING(Group.LITERAL, null, "string value"),
	NUMBER(Group.LITERAL, null, "number"),
	BOOLEAN(Group.LITERAL, null, "true or false"),

	// Operators
	EQ(Group.OPERATOR, "==", "comparison operator =="),
	NEQ(Group.OPERATOR, "!=", "comparison operator !="),
	LTE(Group.OPERATOR, "<=", "comparison operator <="),
	GTE(Group.OPERATOR, ">=", "comparison operator >="),
	LT(Group.OPERATOR, "<", "comparison operator <"),
	GT(Group.OPERATOR, ">", "comparison operator >"),
	DOUBLE_STAR(Group.OPERATOR, "**", "power operator **"),
	EQUALS(Group.OPERATOR, "=", "equals sign ="),
	PLUS(Group.OPERATOR, "+", "plus sign +"),
	MINUS(Group.OPERATOR, "-", "minus sign -"),
	STAR(Group.OPERATOR, "*", "asterisk *"),
	SLASH(Group.OPERATOR, "/", "slash /"),
	PERCENT(Group.OPERATOR, "%", "percent sign %"),

	// Punctuation
	LPAREN(Group.PUNCTUATION, "(", "opening parenthesis ("),
	RPAREN(Group.PUNCTUATION, ")", "closing parenthesis )"),
	LBRACE(Group.PUNCTUATION, "{", "opening brace {"),
	RBRACE(Group.PUNCTUATION, "}", "closing brace }"),
	LBRACKET(Group.PUNCTUATION, "[", "opening bracket ["),
	RBRACKET(Group.PUNCTUATION, "]", "closing bracket ]"),
	COLON(Group.PUNCTUATION, ":", "colon :"),
	COMMA(Group.PUNCTUATION, ",", "comma"),
	DOT(Group.PUNCTUATION, ".", "dot"),

	NEWLINE(Group.SPECIAL, null, "end of line"),
	EOF(Group.SPECIAL, null, "end of file");

	/**
	 * Broad classes of tokens.
	 */
	public enum Group {
		STATEMENT,
		KEYWORD,
		LITERAL,
		OPERATOR,
		PUNCTUATION,
		SPECIAL
	}

	private static final Map<String, TokenType> KEYWORDS;
	private static final Set<String> STATEMENT_KEYWORDS;

	static {
		Map<String, TokenType> keywords = new HashMap<String, TokenType>();
		Set<String> statements = new TreeSet<String>();
		for (TokenType type : values()) {
			if (type.isKeyword()) {
				keywords.put(type.text, type);
				if (type.group == Group.STATEMENT) {
					statements.add(type.text);
				}
			}
		}
		KEYWORDS = Collections.unmodifiableMap(keywords);
		STATEMENT_KEYWORDS = Collections.unmodifiableSet(statements);
	}

	private final Group group;
	private final String text;
	private final String description;

	TokenType(Group group) {
		this.group = group;
		this.text = name().toLowerCase(Locale.ROOT);
		this.description = "\"" + text + "\" keyword";
	}

	TokenType(Group group, String text, String description) {
		this.group = group;
		this.text = text;
		this.description = description;
	}

	public Group getGroup() {
		return group;
	}

	/**
	 * @return the fixed spelling of this token, or {@code null} for literals
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the phrase used for this token in syntax diagnostics, e.g.
	 *         "closing brace }" or "\"as\" keyword"
	 */
	public String getDescription() {
		return description;
	}

	public boolean isKeyword() {
		return group == Group.STATEMENT || group == Group.KEYWORD;
	}

	public boolean isStatementKeyword() {
		return group == Group.STATEMENT;
	}

	/**
	 * Resolves an identifier against the keyword table, ignoring case.
	 *
	 * @param word the identifier text
	 * @return the keyword token type, or {@code null} for a plain identifier
	 */
	public static TokenType keyword(String word) {
		return KEYWORDS.get(word.toLowerCase(Locale.ROOT));
	}

	/**
	 * @return the spelling of every statement keyword, sorted
	 */
	public static Set<String> statementKeywords() {
		return STATEMENT_KEYWORDS;
	}
}
