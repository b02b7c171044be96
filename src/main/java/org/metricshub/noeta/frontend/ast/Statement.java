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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One statement of a Noeta program.
 * <p>
 * All statement kinds share this single node type: the {@link StatementKind}
 * tells which of the fields below are filled, and every later stage
 * dispatches on it through its own table. Fields left empty by a statement
 * form are {@code null} or empty lists.
 * <p>
 * Instances are populated by {@link org.metricshub.noeta.frontend.NoetaParser}
 * and should be treated as read-only afterwards.
 */
public class Statement {

	private final StatementKind kind;
	private final SourcePosition position;

	private final List<Reference> sources = new ArrayList<Reference>();
	private Reference resultAlias;

	private Reference column;
	private final List<Reference> columns = new ArrayList<Reference>();
	private final List<Reference> groupBy = new ArrayList<Reference>();
	private final Map<String, Parameter> parameters = new LinkedHashMap<String, Parameter>();

	private Condition where;
	private Expression transform;
	private final List<SortKey> sortKeys = new ArrayList<SortKey>();
	private final List<Aggregation> aggregations = new ArrayList<Aggregation>();
	private final List<Mutation> mutations = new ArrayList<Mutation>();

	private String path;
	private String format;
	private String connection;

	/**
	 * @param kind the kind of statement
	 * @param position position of the leading keyword
	 */
	public Statement(StatementKind kind, SourcePosition position) {
		this.kind = kind;
		this.position = position;
	}

	public StatementKind getKind() {
		return kind;
	}

	public SourcePosition getPosition() {
		return position;
	}

	/**
	 * @return the datasets read by this statement, in written order
	 */
	public List<Reference> getSources() {
		return Collections.unmodifiableList(sources);
	}

	/**
	 * @return the first source dataset, or {@code null} (e.g. for {@code load})
	 */
	public Reference getSource() {
		return sources.isEmpty() ? null : sources.get(0);
	}

	public void addSource(Reference source) {
		sources.add(source);
	}

	/**
	 * @return the alias after {@code as}, or {@code null} when the result is
	 *         only rendered
	 */
	public Reference getResultAlias() {
		return resultAlias;
	}

	public void setResultAlias(Reference resultAlias) {
		this.resultAlias = resultAlias;
	}

	public boolean hasResultAlias() {
		return resultAlias != null;
	}

	/**
	 * @return the column of a {@code column c} clause, or {@code null}
	 */
	public Reference getColumn() {
		return column;
	}

	public void setColumn(Reference column) {
		this.column = column;
	}

	/**
	 * @return the columns of a {@code columns} clause (or {@code select} list)
	 */
	public List<Reference> getColumns() {
		return Collections.unmodifiableList(columns);
	}

	public void addColumn(Reference reference) {
		columns.add(reference);
	}

	/**
	 * @return the columns of a {@code by} clause, or the join key of an
	 *         {@code on} clause
	 */
	public List<Reference> getGroupBy() {
		return Collections.unmodifiableList(groupBy);
	}

	public void addGroupBy(Reference reference) {
		groupBy.add(reference);
	}

	/**
	 * @return named parameters in written order; flags have the value
	 *         {@link Boolean#TRUE}
	 */
	public Map<String, Parameter> getParameters() {
		return Collections.unmodifiableMap(parameters);
	}

	public Parameter getParameter(String name) {
		return parameters.get(name);
	}

	public boolean hasParameter(String name) {
		return parameters.containsKey(name);
	}

	/**
	 * @param name parameter name
	 * @return the parameter value, or {@code null} when absent
	 */
	public Object getValue(String name) {
		Parameter parameter = parameters.get(name);
		return parameter == null ? null : parameter.getValue();
	}

	/**
	 * @param name parameter name
	 * @param defaultValue returned when the parameter is absent
	 * @return the parameter value
	 */
	public Object getValue(String name, Object defaultValue) {
		Parameter parameter = parameters.get(name);
		return parameter == null ? defaultValue : parameter.getValue();
	}

	/**
	 * @param name flag or boolean parameter name
	 * @return whether it was given and is not {@code false}
	 */
	public boolean isSet(String name) {
		Object value = getValue(name);
		return value != null && !Boolean.FALSE.equals(value);
	}

	public void putParameter(Parameter parameter) {
		parameters.put(parameter.getName(), parameter);
	}

	public Condition getWhere() {
		return where;
	}

	public void setWhere(Condition where) {
		this.where = where;
	}

	/**
	 * @return the expression of a {@code with transform} clause, or {@code null}
	 */
	public Expression getTransform() {
		return transform;
	}

	public void setTransform(Expression transform) {
		this.transform = transform;
	}

	public List<SortKey> getSortKeys() {
		return Collections.unmodifiableList(sortKeys);
	}

	public void addSortKey(SortKey sortKey) {
		sortKeys.add(sortKey);
	}

	public List<Aggregation> getAggregations() {
		return Collections.unmodifiableList(aggregations);
	}

	public void addAggregation(Aggregation aggregation) {
		aggregations.add(aggregation);
	}

	public List<Mutation> getMutations() {
		return Collections.unmodifiableList(mutations);
	}

	public void addMutation(Mutation mutation) {
		mutations.add(mutation);
	}

	/**
	 * @return the file path of {@code load}/{@code save}, or the query of
	 *         {@code load sql}
	 */
	public String getPath() {
		return path;
	}

	public void setPath(String path) {
		this.path = path;
	}

	/**
	 * @return {@code csv}, {@code json}, {@code excel}, {@code parquet} or
	 *         {@code sql} for I/O statements
	 */
	public String getFormat() {
		return format;
	}

	public void setFormat(String format) {
		this.format = format;
	}

	/**
	 * @return the connection string of {@code load sql}
	 */
	public String getConnection() {
		return connection;
	}

	public void setConnection(String connection) {
		this.connection = connection;
	}

	/**
	 * Name of the column added by this statement: the operand column plus the
	 * kind's suffix, the extracted part for {@code extract}, or the kind's
	 * fixed name.
	 *
	 * @return the derived column name, or {@code null} when none is added
	 */
	public String getDerivedColumn() {
		if (kind.getFixedColumn() != null) {
			return kind.getFixedColumn();
		}
		if (kind.getColumnSuffix() == null || column == null) {
			return null;
		}
		if (kind == StatementKind.EXTRACT) {
			return column.getName() + "_" + getValue("part", "year");
		}
		return column.getName() + kind.getColumnSuffix();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(kind.keyword());
		for (Reference source : sources) {
			sb.append(' ').append(source);
		}
		if (path != null) {
			sb.append(" \"").append(path).append('"');
		}
		if (column != null) {
			sb.append(" column=").append(column);
		}
		if (!columns.isEmpty()) {
			sb.append(" columns=").append(columns);
		}
		if (!groupBy.isEmpty()) {
			sb.append(" by=").append(groupBy);
		}
		if (!sortKeys.isEmpty()) {
			sb.append(" keys=").append(sortKeys);
		}
		if (!aggregations.isEmpty()) {
			sb.append(" compute=").append(aggregations);
		}
		if (!mutations.isEmpty()) {
			sb.append(" mutations=").append(mutations);
		}
		if (where != null) {
			sb.append(" where ").append(where);
		}
		if (transform != null) {
			sb.append(" transform ").append(transform);
		}
		for (Parameter parameter : parameters.values()) {
			sb.append(' ').append(parameter);
		}
		if (resultAlias != null) {
			sb.append(" as ").append(resultAlias);
		}
		return sb.toString();
	}
}
