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
 * Node of the expression language used by {@code transform} clauses and
 * {@code mutate} assignments. A tagged union: the {@link Kind} tells which
 * fields are meaningful.
 * <ul>
 * <li>{@link Kind#LITERAL}: {@link #getValue()}</li>
 * <li>{@link Kind#IDENTIFIER}: {@link #getName()}</li>
 * <li>{@link Kind#UNARY}: {@link #getOperator()} ({@code -} or {@code not}), one operand</li>
 * <li>{@link Kind#BINARY}: {@link #getOperator()}, two operands</li>
 * <li>{@link Kind#CALL}: {@link #getName()}, the arguments as operands</li>
 * <li>{@link Kind#CONDITIONAL}: operands are value, condition, alternative</li>
 * </ul>
 */
public final class Expression {

	/**
	 * Node kinds.
	 */
	public enum Kind {
		LITERAL,
		IDENTIFIER,
		UNARY,
		BINARY,
		CALL,
		CONDITIONAL
	}

	private final Kind kind;
	private final SourcePosition position;
	private final Object value;
	private final String name;
	private final String operator;
	private final List<Expression> operands;

	private Expression(Kind kind, SourcePosition position, Object value, String name, String operator, List<Expression> operands) {
		this.kind = kind;
		this.position = position;
		this.value = value;
		this.name = name;
		this.operator = operator;
		this.operands = Collections.unmodifiableList(new ArrayList<Expression>(operands));
	}

	public static Expression literal(Object value, SourcePosition position) {
		return new Expression(Kind.LITERAL, position, value, null, null, Collections.<Expression>emptyList());
	}

	public static Expression identifier(String name, SourcePosition position) {
		return new Expression(Kind.IDENTIFIER, position, null, name, null, Collections.<Expression>emptyList());
	}

	public static Expression unary(String operator, Expression operand, SourcePosition position) {
		return new Expression(Kind.UNARY, position, null, null, operator, Collections.singletonList(operand));
	}

	public static Expression binary(Expression left, String operator, Expression right) {
		return new Expression(Kind.BINARY, left.position, null, null, operator, Arrays.asList(left, right));
	}

	public static Expression call(String function, List<Expression> arguments, SourcePosition position) {
		return new Expression(Kind.CALL, position, null, function, null, arguments);
	}

	/**
	 * {@code value where condition else alternative}
	 */
	public static Expression conditional(Expression value, Expression condition, Expression alternative) {
		return new Expression(Kind.CONDITIONAL, value.position, null, null, null, Arrays.asList(value, condition, alternative));
	}

	public Kind getKind() {
		return kind;
	}

	public SourcePosition getPosition() {
		return position;
	}

	public Object getValue() {
		return value;
	}

	public String getName() {
		return name;
	}

	public String getOperator() {
		return operator;
	}

	public List<Expression> getOperands() {
		return operands;
	}

	public Expression getOperand(int index) {
		return operands.get(index);
	}

	/**
	 * Collects the names of all identifiers in this tree, in order of
	 * appearance. Function names are not included.
	 *
	 * @param names list receiving the names
	 */
	public void collectIdentifiers(List<String> names) {
		if (kind == Kind.IDENTIFIER) {
			names.add(name);
		}
		for (Expression operand : operands) {
			operand.collectIdentifiers(names);
		}
	}

	/**
	 * Fully parenthesized rendering, e.g. {@code (1 + (2 * (3 ** 2)))}.
	 */
	@Override
	public String toString() {
		switch (kind) {
		case LITERAL:
			return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
		case IDENTIFIER:
			return name;
		case UNARY:
			return "(" + operator + ("not".equals(operator) ? " " : "") + operands.get(0) + ")";
		case BINARY:
			return "(" + operands.get(0) + " " + operator + " " + operands.get(1) + ")";
		case CALL:
			StringBuilder call = new StringBuilder(name).append('(');
			for (int i = 0; i < operands.size(); i++) {
				if (i > 0) {
					call.append(", ");
				}
				call.append(operands.get(i));
			}
			return call.append(')').toString();
		case CONDITIONAL:
			return "(" + operands.get(0) + " where " + operands.get(1) + " else " + operands.get(2) + ")";
		default:
			throw new IllegalStateException("Unknown expression kind " + kind);
		}
	}
}
