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

/**
 * One new or replaced column of a {@code mutate} statement. The value is
 * either a parsed {@link Expression} ({@code with col = expr}) or the raw text
 * of a quoted expression ({@code {col: "expr"}}) evaluated by the target
 * runtime.
 */
public final class Mutation {

	private final Reference column;
	private final Expression expression;
	private final String text;

	private Mutation(Reference column, Expression expression, String text) {
		this.column = column;
		this.expression = expression;
		this.text = text;
	}

	public static Mutation of(Reference column, Expression expression) {
		return new Mutation(column, expression, null);
	}

	public static Mutation ofText(Reference column, String text) {
		return new Mutation(column, null, text);
	}

	public Reference getColumn() {
		return column;
	}

	/**
	 * @return the parsed expression, or {@code null} for a quoted one
	 */
	public Expression getExpression() {
		return expression;
	}

	/**
	 * @return the quoted expression text, or {@code null} for a parsed one
	 */
	public String getText() {
		return text;
	}

	@Override
	public String toString() {
		return column + " = " + (expression != null ? expression : "\"" + text + "\"");
	}
}
