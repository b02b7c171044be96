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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Node of the boolean condition language of {@code where} clauses. A tagged
 * union, like {@link Expression}:
 * <ul>
 * <li>{@link Kind#COMPARISON}: column, operator ({@code == != < > <= >=}), one value</li>
 * <li>{@link Kind#BETWEEN}: column, two values (inclusive bounds)</li>
 * <li>{@link Kind#IN}: column, the candidate values</li>
 * <li>{@link Kind#STRING_MATCH}: column, operator ({@code contains starts_with ends_with matches}), pattern</li>
 * <li>{@link Kind#NULL_CHECK}: column, {@link #isNegated()} for {@code is not null}</li>
 * <li>{@link Kind#AND}, {@link Kind#OR}: two children</li>
 * <li>{@link Kind#NOT}: one child</li>
 * </ul>
 */
public final class Condition {

	/**
	 * Node kinds.
	 */
	public enum Kind {
		COMPARISON,
		BETWEEN,
		IN,
		STRING_MATCH,
		NULL_CHECK,
		AND,
		OR,
		NOT
	}

	private final Kind kind;
	private final SourcePosition position;
	private final Reference column;
	private final String operator;
	private final List<Object> values;
	private final boolean negated;
	private final List<Condition> children;

	private Condition(Kind kind, SourcePosition position, Reference column, String operator, List<Object> values,
			boolean negated, List<Condition> children) {
		this.kind = kind;
		this.position = position;
		this.column = column;
		this.operator = operator;
		this.values = Collections.unmodifiableList(new ArrayList<Object>(values));
		this.negated = negated;
		this.children = Collections.unmodifiableList(new ArrayList<Condition>(children));
	}

	public static Condition comparison(Reference column, String operator, Object value) {
		return new Condition(Kind.COMPARISON, column.getPosition(), column, operator, Collections.singletonList(value), false,
				Collections.<Condition>emptyList());
	}

	public static Condition between(Reference column, Object low, Object high) {
		return new Condition(Kind.BETWEEN, column.getPosition(), column, "between", Arrays.asList(low, high), false,
				Collections.<Condition>emptyList());
	}

	public static Condition in(Reference column, List<Object> candidates) {
		return new Condition(Kind.IN, column.getPosition(), column, "in", candidates, false, Collections.<Condition>emptyList());
	}

	public static Condition stringMatch(Reference column, String operator, String pattern) {
		return new Condition(Kind.STRING_MATCH, column.getPosition(), column, operator, Collections.<Object>singletonList(pattern),
				false, Collections.<Condition>emptyList());
	}

	public static Condition nullCheck(Reference column, boolean negated) {
		return new Condition(Kind.NULL_CHECK, column.getPosition(), column, negated ? "is not null" : "is null",
				Collections.emptyList(), negated, Collections.<Condition>emptyList());
	}

	public static Condition and(Condition left, Condition right) {
		return new Condition(Kind.AND, left.position, null, "and", Collections.emptyList(), false, Arrays.asList(left, right));
	}

	public static Condition or(Condition left, Condition right) {
		return new Condition(Kind.OR, left.position, null, "or", Collections.emptyList(), false, Arrays.asList(left, right));
	}

	public static Condition not(Condition child, SourcePosition position) {
		return new Condition(Kind.NOT, position, null, "not", Collections.emptyList(), false, Collections.singletonList(child));
	}

	public Kind getKind() {
		return kind;
	}

	public SourcePosition getPosition() {
		return position;
	}

	/**
	 * @return the tested column, or {@code null} for combinators
	 */
	public Reference getColumn() {
		return column;
	}

	public String getOperator() {
		return operator;
	}

	public List<Object> getValues() {
		return values;
	}

	public Object getValue() {
		return values.get(0);
	}

	public boolean isNegated() {
		return negated;
	}

	public List<Condition> getChildren() {
		return children;
	}

	public Condition getChild(int index) {
		return children.get(index);
	}

	/**
	 * Collects every column tested by this condition, in order of appearance.
	 *
	 * @param columns list receiving the references
	 */
	public void collectColumns(List<Reference> columns) {
		if (column != null) {
			columns.add(column);
		}
		for (Condition child : children) {
			child.collectColumns(columns);
		}
	}

	/**
	 * Fully parenthesized rendering, e.g. {@code ((a > 1 AND b < 2) OR c == 3)}.
	 */
	@Override
	public String toString() {
		switch (kind) {
		case AND:
		case OR:
			return "(" + children.get(0) + " " + kind + " " + children.get(1) + ")";
		case NOT:
			return "NOT " + children.get(0);
		case BETWEEN:
			return column + " BETWEEN " + render(values.get(0)) + " AND " + render(values.get(1));
		case IN:
			return column + " IN " + render(values);
		case NULL_CHECK:
			return column + (negated ? " IS NOT NULL" : " IS NULL");
		default:
			return column + " " + operator + " " + render(values.get(0));
		}
	}

	private static String render(Object value) {
		return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
	}
}
