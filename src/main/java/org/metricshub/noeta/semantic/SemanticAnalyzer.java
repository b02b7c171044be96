package org.metricshub.noeta.semantic;

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
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.metricshub.noeta.diagnostics.Diagnostic;
import org.metricshub.noeta.diagnostics.ErrorCategory;
import org.metricshub.noeta.diagnostics.Suggestions;
import org.metricshub.noeta.frontend.StatementContract;
import org.metricshub.noeta.frontend.ast.Aggregation;
import org.metricshub.noeta.frontend.ast.Mutation;
import org.metricshub.noeta.frontend.ast.Parameter;
import org.metricshub.noeta.frontend.ast.Program;
import org.metricshub.noeta.frontend.ast.Reference;
import org.metricshub.noeta.frontend.ast.SortKey;
import org.metricshub.noeta.frontend.ast.Statement;
import org.metricshub.noeta.frontend.ast.StatementKind;
import org.metricshub.noeta.util.NoetaLogger;
import org.metricshub.noeta.util.NoetaSettings;
import org.slf4j.Logger;

/**
 * Walks a parsed {@link Program} statement by statement, checking dataset
 * and column references against a {@link SymbolTable} and registering the
 * datasets each statement binds with {@code as}.
 * <p>
 * For every statement:
 * <ol>
 * <li>each source dataset must be defined;</li>
 * <li>when a source schema is known, each referenced column must exist in
 * it, and operand columns of known type must have the type the operation
 * needs;</li>
 * <li>the result alias, if any, is registered with a schema derived from the
 * source: copied, projected, extended, retyped, renamed or unknown.</li>
 * </ol>
 * A statement with a diagnostic registers nothing, and analysis goes on with
 * the next statement: all diagnostics are returned together.
 */
public class SemanticAnalyzer {

	private static final Logger LOG = NoetaLogger.getLogger(SemanticAnalyzer.class);

	/** Provenance prefix of datasets loaded from files. */
	public static final String FILE_PROVENANCE = "file:";

	/** Provenance of datasets loaded from SQL queries. */
	public static final String SQL_PROVENANCE = "sql";

	/** Accepted values of the fillna {@code method} parameter, matched ignoring case. */
	public static final List<String> FILL_METHODS = Collections
			.unmodifiableList(Arrays.asList("mean", "median", "mode", "forward", "ffill", "backward", "bfill"));

	/**
	 * Computes the dataset bound by a statement from its resolved sources.
	 */
	private interface StatementHandler {
		/**
		 * @param statement the statement
		 * @param sources the resolved source datasets, in written order
		 * @param alias the result alias
		 * @return what is known about the result
		 */
		DatasetInfo result(Statement statement, List<DatasetInfo> sources, String alias);
	}

	private static final Map<StatementKind, DataType> REQUIRED_TYPES = new EnumMap<StatementKind, DataType>(
			StatementKind.class);
	private static final Map<StatementKind, DataType> RESULT_TYPES = new EnumMap<StatementKind, DataType>(
			StatementKind.class);

	static {
		requireType(DataType.NUMERIC, StatementKind.ROUND, StatementKind.ABS, StatementKind.SQRT, StatementKind.POWER,
				StatementKind.LOG, StatementKind.CEIL, StatementKind.FLOOR, StatementKind.STANDARD_SCALE,
				StatementKind.MINMAX_SCALE, StatementKind.ROBUST_SCALE, StatementKind.MAXABS_SCALE, StatementKind.NORMALIZE);
		requireType(DataType.STRING, StatementKind.UPPER, StatementKind.LOWER, StatementKind.STRIP, StatementKind.LSTRIP,
				StatementKind.RSTRIP, StatementKind.TITLE, StatementKind.CAPITALIZE, StatementKind.REPLACE,
				StatementKind.SPLIT, StatementKind.SUBSTRING, StatementKind.LENGTH, StatementKind.EXTRACT_REGEX,
				StatementKind.FIND);
		requireType(DataType.DATETIME, StatementKind.EXTRACT, StatementKind.EXTRACT_YEAR, StatementKind.EXTRACT_MONTH,
				StatementKind.EXTRACT_DAY, StatementKind.EXTRACT_HOUR, StatementKind.EXTRACT_MINUTE,
				StatementKind.EXTRACT_SECOND, StatementKind.EXTRACT_DAYOFWEEK, StatementKind.EXTRACT_DAYOFYEAR,
				StatementKind.EXTRACT_WEEKOFYEAR, StatementKind.EXTRACT_QUARTER);

		// type of the retyped operand, or of the added column
		resultType(DataType.NUMERIC, StatementKind.ROUND, StatementKind.ABS, StatementKind.SQRT, StatementKind.POWER,
				StatementKind.LOG, StatementKind.CEIL, StatementKind.FLOOR, StatementKind.LENGTH, StatementKind.FIND,
				StatementKind.TO_NUMERIC, StatementKind.LABEL_ENCODE, StatementKind.ORDINAL_ENCODE,
				StatementKind.TARGET_ENCODE, StatementKind.STANDARD_SCALE, StatementKind.MINMAX_SCALE,
				StatementKind.ROBUST_SCALE, StatementKind.MAXABS_SCALE, StatementKind.NORMALIZE, StatementKind.RANK,
				StatementKind.GROUP_TRANSFORM, StatementKind.ROLLING, StatementKind.EXTRACT, StatementKind.EXTRACT_YEAR,
				StatementKind.EXTRACT_MONTH, StatementKind.EXTRACT_DAY, StatementKind.EXTRACT_HOUR,
				StatementKind.EXTRACT_MINUTE, StatementKind.EXTRACT_SECOND, StatementKind.EXTRACT_DAYOFWEEK,
				StatementKind.EXTRACT_DAYOFYEAR, StatementKind.EXTRACT_WEEKOFYEAR, StatementKind.EXTRACT_QUARTER,
				StatementKind.DATE_DIFF, StatementKind.WINDOW_RANK, StatementKind.WINDOW_LAG, StatementKind.WINDOW_LEAD,
				StatementKind.ROLLING_MEAN, StatementKind.ROLLING_SUM, StatementKind.ROLLING_STD,
				StatementKind.ROLLING_MIN, StatementKind.ROLLING_MAX, StatementKind.EXPANDING_MEAN,
				StatementKind.EXPANDING_SUM, StatementKind.EXPANDING_MIN, StatementKind.EXPANDING_MAX,
				StatementKind.CUMSUM, StatementKind.CUMMAX, StatementKind.CUMMIN, StatementKind.CUMPROD,
				StatementKind.PCT_CHANGE, StatementKind.DIFF);
		resultType(DataType.DATETIME, StatementKind.PARSE_DATETIME, StatementKind.DATE_ADD, StatementKind.DATE_SUBTRACT);
		resultType(DataType.STRING, StatementKind.FORMAT_DATETIME, StatementKind.CONCAT);
		resultType(DataType.BOOLEAN, StatementKind.ISNULL, StatementKind.NOTNULL, StatementKind.DUPLICATED);
		resultType(DataType.UNKNOWN, StatementKind.QCUT, StatementKind.CUT, StatementKind.BINNING);
	}

	private final NoetaSettings settings;
	private final String[] sourceLines;
	private final Map<StatementKind, StatementHandler> handlers = new EnumMap<StatementKind, StatementHandler>(
			StatementKind.class);

	private SymbolTable symbols;
	private List<Diagnostic> diagnostics;

	/**
	 * @param settings compilation settings (type checking, schema probe)
	 * @param source the program text, to quote source lines in diagnostics;
	 *        may be {@code null}
	 */
	public SemanticAnalyzer(NoetaSettings settings, String source) {
		this.settings = settings == null ? new NoetaSettings() : settings;
		this.sourceLines = source == null ? new String[0] : source.split("\r?\n", -1);

		handlers.put(StatementKind.LOAD, this::load);

		StatementHandler copy = (statement, sources, alias) -> sources.get(0).copyAs(alias, provenance(statement));
		register(copy, StatementKind.HEAD, StatementKind.TAIL, StatementKind.FILTER, StatementKind.FILTER_BETWEEN,
				StatementKind.FILTER_ISIN, StatementKind.FILTER_CONTAINS, StatementKind.FILTER_STARTSWITH,
				StatementKind.FILTER_ENDSWITH, StatementKind.FILTER_REGEX, StatementKind.FILTER_NULL,
				StatementKind.FILTER_NOTNULL, StatementKind.FILTER_DUPLICATES, StatementKind.SAMPLE, StatementKind.DROPNA,
				StatementKind.FILLNA, StatementKind.DROP_DUPLICATES, StatementKind.UPPER, StatementKind.LOWER,
				StatementKind.STRIP, StatementKind.LSTRIP, StatementKind.RSTRIP, StatementKind.TITLE,
				StatementKind.CAPITALIZE, StatementKind.REPLACE, StatementKind.SUBSTRING, StatementKind.EXTRACT_REGEX,
				StatementKind.FILL_FORWARD, StatementKind.FILL_BACKWARD, StatementKind.FILL_MEAN,
				StatementKind.FILL_MEDIAN, StatementKind.FILL_MODE, StatementKind.INTERPOLATE, StatementKind.SORT,
				StatementKind.SORT_INDEX, StatementKind.FILTER_GROUPS, StatementKind.SHIFT, StatementKind.UNION,
				StatementKind.INTERSECTION, StatementKind.DIFFERENCE, StatementKind.APPLY_COLUMN, StatementKind.APPLYMAP,
				StatementKind.APPLY, StatementKind.MAP, StatementKind.MAP_VALUES, StatementKind.REINDEX);

		StatementHandler unknown = (statement, sources, alias) -> DatasetInfo.unknown(alias, provenance(statement));
		register(unknown, StatementKind.SELECT_BY_TYPE, StatementKind.ILOC, StatementKind.SPLIT,
				StatementKind.ONE_HOT_ENCODE, StatementKind.GROUPBY, StatementKind.PIVOT, StatementKind.PIVOT_TABLE,
				StatementKind.MELT, StatementKind.STACK, StatementKind.UNSTACK, StatementKind.TRANSPOSE,
				StatementKind.CROSSTAB, StatementKind.JOIN, StatementKind.MERGE, StatementKind.CONCAT_VERTICAL,
				StatementKind.CONCAT_HORIZONTAL, StatementKind.SET_INDEX, StatementKind.RESET_INDEX,
				StatementKind.APPLY_ROW, StatementKind.RESAMPLE, StatementKind.SET_MULTIINDEX);

		register(this::project, StatementKind.SELECT, StatementKind.REORDER, StatementKind.LOC);
		register(this::retype, StatementKind.ROUND, StatementKind.ABS, StatementKind.SQRT, StatementKind.POWER,
				StatementKind.LOG, StatementKind.CEIL, StatementKind.FLOOR, StatementKind.LENGTH, StatementKind.FIND,
				StatementKind.PARSE_DATETIME, StatementKind.DATE_ADD, StatementKind.DATE_SUBTRACT,
				StatementKind.FORMAT_DATETIME, StatementKind.ASTYPE, StatementKind.TO_NUMERIC,
				StatementKind.LABEL_ENCODE, StatementKind.ORDINAL_ENCODE, StatementKind.TARGET_ENCODE,
				StatementKind.STANDARD_SCALE, StatementKind.MINMAX_SCALE, StatementKind.ROBUST_SCALE,
				StatementKind.MAXABS_SCALE, StatementKind.NORMALIZE, StatementKind.QCUT, StatementKind.CUT,
				StatementKind.BINNING, StatementKind.RANK, StatementKind.GROUP_TRANSFORM, StatementKind.ROLLING);
		for (StatementKind kind : StatementKind.values()) {
			if (kind.addsColumn()) {
				handlers.put(kind, this::addDerivedColumn);
			}
		}
		handlers.put(StatementKind.ASSIGN, this::assign);
		handlers.put(StatementKind.MUTATE, this::mutate);
		handlers.put(StatementKind.RENAME, this::rename);

		// display statements bind nothing
		for (StatementKind kind : StatementKind.values()) {
			if (!StatementContract.of(kind).isBindable()) {
				handlers.put(kind, (statement, sources, alias) -> null);
			}
		}
	}

	private static void requireType(DataType type, StatementKind... kinds) {
		for (StatementKind kind : kinds) {
			REQUIRED_TYPES.put(kind, type);
		}
	}

	private static void resultType(DataType type, StatementKind... kinds) {
		for (StatementKind kind : kinds) {
			RESULT_TYPES.put(kind, type);
		}
	}

	private void register(StatementHandler handler, StatementKind... kinds) {
		for (StatementKind kind : kinds) {
			handlers.put(kind, handler);
		}
	}

	/**
	 * Analyzes a program against a new, empty symbol table.
	 *
	 * @param program the parsed program
	 * @return every diagnostic, in encounter order; empty when the program is valid
	 */
	public List<Diagnostic> analyze(Program program) {
		return analyze(program, new SymbolTable());
	}

	/**
	 * Analyzes a program against a symbol table carried from earlier
	 * compilations. The table is updated in place with the datasets the
	 * program defines.
	 *
	 * @param program the parsed program
	 * @param symbolTable the datasets defined so far
	 * @return every diagnostic, in encounter order; empty when the program is valid
	 * @throws IllegalStateException if a statement kind has no handler
	 */
	public List<Diagnostic> analyze(Program program, SymbolTable symbolTable) {
		this.symbols = symbolTable;
		this.diagnostics = new ArrayList<Diagnostic>();
		for (Statement statement : program.getStatements()) {
			analyzeStatement(statement);
		}
		LOG.debug("Analyzed {} statements: {} diagnostics, {} datasets defined", program.size(), diagnostics.size(),
				symbols.size());
		return diagnostics;
	}

	/**
	 * @return the symbol table of the last analysis
	 */
	public SymbolTable getSymbolTable() {
		return symbols;
	}

	private void analyzeStatement(Statement statement) {
		StatementHandler handler = handlers.get(statement.getKind());
		if (handler == null) {
			throw new IllegalStateException("No semantic handler for " + statement.getKind());
		}
		int before = diagnostics.size();

		List<DatasetInfo> sources = new ArrayList<DatasetInfo>();
		for (Reference source : statement.getSources()) {
			DatasetInfo info = symbols.lookup(source.getName());
			if (info == null) {
				undefinedDataset(source);
			} else {
				sources.add(info);
			}
		}
		if (diagnostics.size() > before) {
			return;
		}

		checkFillMethod(statement);
		checkColumns(statement, sources);
		if (diagnostics.size() > before) {
			return;
		}

		if (statement.hasResultAlias()) {
			String alias = statement.getResultAlias().getName();
			DatasetInfo result = handler.result(statement, sources, alias);
			if (result != null) {
				symbols.define(alias, result);
			}
		}
	}

	// column checks
	// ===============================================================================

	private void checkColumns(Statement statement, List<DatasetInfo> sources) {
		if (sources.isEmpty()) {
			return;
		}
		DatasetInfo first = sources.get(0);
		StatementContract contract = StatementContract.of(statement.getKind());

		// assign creates its column
		if (statement.getColumn() != null && statement.getKind() != StatementKind.ASSIGN) {
			if (checkColumn(first, statement.getColumn())) {
				checkType(statement, first, statement.getColumn());
			}
		}
		for (Reference column : statement.getColumns()) {
			// a multi-dataset statement (hypothesis) tests its columns in every dataset
			for (DatasetInfo source : sources) {
				if (checkColumn(source, column) && statement.getKind() == StatementKind.NORMALIZE) {
					checkType(statement, source, column);
				}
			}
		}
		for (Reference column : statement.getGroupBy()) {
			// join keys must exist on both sides
			for (DatasetInfo source : contract.getFamily() == StatementContract.Family.BINARY ? sources
					: Collections.singletonList(first)) {
				checkColumn(source, column);
			}
		}
		for (SortKey key : statement.getSortKeys()) {
			checkColumn(first, key.getColumn());
		}
		for (Aggregation aggregation : statement.getAggregations()) {
			checkColumn(first, aggregation.getColumn());
		}
		if (statement.getWhere() != null) {
			List<Reference> tested = new ArrayList<Reference>();
			statement.getWhere().collectColumns(tested);
			for (Reference column : tested) {
				checkColumn(first, column);
			}
		}
		for (String name : contract.getColumnParameters()) {
			Parameter parameter = statement.getParameter(name);
			if (parameter == null) {
				continue;
			}
			DatasetInfo target = "right_on".equals(name) && sources.size() > 1 ? sources.get(1) : first;
			for (String column : columnNames(parameter.getValue())) {
				checkColumn(target, new Reference(column, parameter.getPosition(), parameter.getLength()));
			}
		}
	}

	private static List<String> columnNames(Object value) {
		List<String> names = new ArrayList<String>();
		if (value instanceof String) {
			names.add((String) value);
		} else if (value instanceof Collection) {
			for (Object item : (Collection<?>) value) {
				if (item instanceof String) {
					names.add((String) item);
				}
			}
		} else if (value instanceof Map) {
			for (Object key : ((Map<?, ?>) value).keySet()) {
				names.add(String.valueOf(key));
			}
		}
		return names;
	}

	/**
	 * @return whether the column may be used (it exists or the schema is unknown)
	 */
	private boolean checkColumn(DatasetInfo dataset, Reference column) {
		if (!dataset.isSchemaKnown() || dataset.hasColumn(column.getName())) {
			return true;
		}
		List<String> available = dataset.getColumnNames();
		diagnostics.add(
				Diagnostic
						.builder(ErrorCategory.SEMANTIC,
								"Column '" + column.getName() + "' does not exist in dataset '" + dataset.getName() + "'")
						.at(column.getPosition().getLine(), column.getPosition().getColumn(), column.getLength(),
								sourceLine(column.getPosition().getLine()))
						.hint("Available columns in '" + dataset.getName() + "': " + String.join(", ", available))
						.suggestion(Suggestions.nearest(column.getName(), available))
						.build());
		return false;
	}

	private void checkFillMethod(Statement statement) {
		Parameter method = statement.getParameter("method");
		if (statement.getKind() != StatementKind.FILLNA || method == null || method.getValue() == null) {
			return;
		}
		String name = method.getValue().toString();
		if (FILL_METHODS.contains(name.toLowerCase(Locale.ROOT))) {
			return;
		}
		diagnostics.add(
				Diagnostic
						.builder(ErrorCategory.SEMANTIC, "Unknown fill method '" + name + "' in fillna statement")
						.at(method.getPosition().getLine(), method.getPosition().getColumn(), method.getLength(),
								sourceLine(method.getPosition().getLine()))
						.hint("Accepted methods: " + String.join(", ", FILL_METHODS))
						.suggestion(Suggestions.nearest(name.toLowerCase(Locale.ROOT), FILL_METHODS))
						.build());
	}

	private void checkType(Statement statement, DatasetInfo dataset, Reference column) {
		DataType required = REQUIRED_TYPES.get(statement.getKind());
		DataType actual = dataset.getType(column.getName());
		if (required == null || actual == DataType.UNKNOWN || actual == required) {
			return;
		}
		diagnostics.add(
				Diagnostic
						.builder(ErrorCategory.TYPE,
								"Column '" + column.getName() + "' has type " + actual.getDisplayName() + ", expected "
										+ required.getDisplayName())
						.at(column.getPosition().getLine(), column.getPosition().getColumn(), column.getLength(),
								sourceLine(column.getPosition().getLine()))
						.hint("This operation requires a " + required.getDisplayName() + " column")
						.build());
	}

	private void undefinedDataset(Reference source) {
		List<String> available = symbols.getAllNames();
		String hint = available.isEmpty() ? "No datasets have been loaded yet"
				: "Available datasets: " + String.join(", ", available);
		diagnostics.add(
				Diagnostic
						.builder(ErrorCategory.SEMANTIC, "Dataset '" + source.getName() + "' has not been loaded or created")
						.at(source.getPosition().getLine(), source.getPosition().getColumn(), source.getLength(),
								sourceLine(source.getPosition().getLine()))
						.hint(hint)
						.suggestion(Suggestions.nearest(source.getName(), available))
						.build());
	}

	// result schemas
	// ===============================================================================

	private DatasetInfo load(Statement statement, List<DatasetInfo> sources, String alias) {
		String provenance = "sql".equals(statement.getFormat()) ? SQL_PROVENANCE : FILE_PROVENANCE + statement.getPath();
		if (!settings.isTypeCheck() || "sql".equals(statement.getFormat())) {
			return DatasetInfo.unknown(alias, provenance);
		}
		List<ColumnInfo> columns = settings.getSchemaProbe().probeColumns(statement.getPath(), statement.getFormat());
		if (columns == null || columns.isEmpty()) {
			LOG.debug("Schema of {} is unknown, columns of {} will not be checked", statement.getPath(), alias);
			return DatasetInfo.unknown(alias, provenance);
		}
		return new DatasetInfo(alias, columns, provenance);
	}

	private DatasetInfo project(Statement statement, List<DatasetInfo> sources, String alias) {
		List<String> kept = new ArrayList<String>();
		for (Reference column : statement.getColumns()) {
			kept.add(column.getName());
		}
		kept.addAll(columnNames(statement.getValue("order")));
		if (kept.isEmpty()) {
			return sources.get(0).copyAs(alias, provenance(statement));
		}
		return sources.get(0).project(alias, kept, provenance(statement));
	}

	private DatasetInfo retype(Statement statement, List<DatasetInfo> sources, String alias) {
		DatasetInfo result = sources.get(0).copyAs(alias, provenance(statement));
		if (!result.isSchemaKnown()) {
			return result;
		}
		DataType type = statement.getKind() == StatementKind.ASTYPE
				? DataType.fromDtype(String.valueOf(statement.getValue("dtype")))
				: RESULT_TYPES.get(statement.getKind());
		List<Reference> operands = new ArrayList<Reference>(statement.getColumns());
		if (statement.getColumn() != null) {
			operands.add(0, statement.getColumn());
		}
		for (Reference operand : operands) {
			ColumnInfo column = result.getColumn(operand.getName());
			if (column != null) {
				result = result.withColumn(column.withType(type));
			}
		}
		return result;
	}

	private DatasetInfo addDerivedColumn(Statement statement, List<DatasetInfo> sources, String alias) {
		return addColumn(statement, sources.get(0), alias, statement.getDerivedColumn(),
				RESULT_TYPES.get(statement.getKind()));
	}

	private DatasetInfo assign(Statement statement, List<DatasetInfo> sources, String alias) {
		Object value = statement.getValue("value");
		DataType type;
		if (value instanceof Number) {
			type = DataType.NUMERIC;
		} else if (value instanceof Boolean) {
			type = DataType.BOOLEAN;
		} else if (value instanceof String) {
			type = DataType.STRING;
		} else {
			type = DataType.UNKNOWN;
		}
		return addColumn(statement, sources.get(0), alias, statement.getColumn().getName(), type);
	}

	private DatasetInfo mutate(Statement statement, List<DatasetInfo> sources, String alias) {
		DatasetInfo result = sources.get(0).copyAs(alias, provenance(statement));
		if (!result.isSchemaKnown()) {
			return result;
		}
		for (Mutation mutation : statement.getMutations()) {
			result = result.withColumn(new ColumnInfo(mutation.getColumn().getName(), DataType.UNKNOWN));
		}
		return result;
	}

	private DatasetInfo rename(Statement statement, List<DatasetInfo> sources, String alias) {
		Map<String, String> mapping = new LinkedHashMap<String, String>();
		Object value = statement.getValue("mapping");
		if (value instanceof Map) {
			for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
				mapping.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
			}
		}
		return sources.get(0).copyAs(alias, provenance(statement)).renameColumns(mapping);
	}

	private DatasetInfo addColumn(Statement statement, DatasetInfo source, String alias, String column, DataType type) {
		DatasetInfo result = source.copyAs(alias, provenance(statement));
		// an unknown schema stays unknown: never partially known
		if (!result.isSchemaKnown() || column == null) {
			return result;
		}
		return result.withColumn(new ColumnInfo(column, type));
	}

	private static String provenance(Statement statement) {
		List<String> names = new ArrayList<String>();
		for (Reference source : statement.getSources()) {
			names.add(source.getName());
		}
		return statement.getKind().keyword() + "(" + String.join(", ", names) + ")";
	}

	private String sourceLine(int line) {
		return line >= 1 && line <= sourceLines.length ? sourceLines[line - 1] : "";
	}
}
