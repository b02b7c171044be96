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
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.metricshub.noeta.frontend.ast.Condition;
import org.metricshub.noeta.frontend.ast.Expression;
import org.metricshub.noeta.frontend.ast.Reference;

/**
 * Renders values, conditions and expressions as Python source.
 * <p>
 * Conditions become pandas boolean masks over a frame variable. Expressions
 * become vectorized pandas/numpy code in which identifiers are columns of the
 * frame, except {@code value} and {@code x}, which denote the current column
 * of a column-scoped transform.
 */
public final class PythonWriter {

	/**
	 * Functions that map to a numpy equivalent taking the same arguments.
	 */
	private static final Map<String, String> NUMPY_FUNCTIONS = new HashMap<String, String>();

	/**
	 * Functions that map to a pandas accessor property or method on the first
	 * argument.
	 */
	private static final Map<String, String> ACCESSORS = new HashMap<String, String>();

	static {
		for (String name : new String[] {
				"abs", "sqrt", "log", "log10", "log2", "exp", "ceil", "floor", "round", "sin", "cos", "tan", "sign",
				"power", "clip" }) {
			NUMPY_FUNCTIONS.put(name, "np." + name);
		}
		NUMPY_FUNCTIONS.put("min", "np.minimum");
		NUMPY_FUNCTIONS.put("max", "np.maximum");
		NUMPY_FUNCTIONS.put("isnull", "pd.isna");
		NUMPY_FUNCTIONS.put("isna", "pd.isna");
		NUMPY_FUNCTIONS.put("notnull", "pd.notna");
		NUMPY_FUNCTIONS.put("notna", "pd.notna");
		NUMPY_FUNCTIONS.put("to_datetime", "pd.to_datetime");
		NUMPY_FUNCTIONS.put("to_numeric", "pd.to_numeric");

		ACCESSORS.put("upper", ".str.upper()");
		ACCESSORS.put("lower", ".str.lower()");
		ACCESSORS.put("strip", ".str.strip()");
		ACCESSORS.put("title", ".str.title()");
		ACCESSORS.put("len", ".str.len()");
		ACCESSORS.put("length", ".str.len()");
		for (String part : new String[] { "year", "month", "day", "hour", "minute", "second", "quarter",
				"dayofweek", "dayofyear" }) {
			ACCESSORS.put(part, ".dt." + part);
		}
	}

	private PythonWriter() {}

	/**
	 * Renders a literal parameter value.
	 *
	 * @param value {@code null}, a {@link Boolean}, a {@link Number}, a
	 *        {@link String}, a {@link List} or a {@link Map} of those
	 * @return the Python literal
	 */
	public static String value(Object value) {
		if (value == null) {
			return "None";
		}
		if (value instanceof Boolean) {
			return ((Boolean) value).booleanValue() ? "True" : "False";
		}
		if (value instanceof Double) {
			double d = ((Double) value).doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				return "float('" + (Double.isNaN(d) ? "nan" : d > 0 ? "inf" : "-inf") + "')";
			}
			return value.toString();
		}
		if (value instanceof Number) {
			return value.toString();
		}
		if (value instanceof List) {
			StringBuilder list = new StringBuilder("[");
			boolean first = true;
			for (Object item : (List<?>) value) {
				if (!first) {
					list.append(", ");
				}
				list.append(value(item));
				first = false;
			}
			return list.append(']').toString();
		}
		if (value instanceof Map) {
			StringBuilder map = new StringBuilder("{");
			boolean first = true;
			for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
				if (!first) {
					map.append(", ");
				}
				map.append(value(entry.getKey())).append(": ").append(value(entry.getValue()));
				first = false;
			}
			return map.append('}').toString();
		}
		return quote(value.toString());
	}

	/**
	 * @param text raw text
	 * @return a single-quoted Python string literal
	 */
	public static String quote(String text) {
		return "'" + escape(text) + "'";
	}

	/**
	 * Escapes text for the literal part of a single-quoted f-string.
	 *
	 * @param text raw text
	 * @return text safe to place between {@code f'} and {@code '}
	 */
	public static String text(String text) {
		return escape(text).replace("{", "{{").replace("}", "}}");
	}

	private static String escape(String text) {
		StringBuilder sb = new StringBuilder(text.length() + 2);
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
			case '\\':
				sb.append("\\\\");
				break;
			case '\'':
				sb.append("\\'");
				break;
			case '\n':
				sb.append("\\n");
				break;
			case '\r':
				sb.append("\\r");
				break;
			case '\t':
				sb.append("\\t");
				break;
			default:
				sb.append(c);
			}
		}
		return sb.toString();
	}

	/**
	 * @param frame frame variable
	 * @param name column name
	 * @return {@code frame['name']}
	 */
	public static String column(String frame, String name) {
		return frame + "[" + quote(name) + "]";
	}

	/**
	 * @param references column references
	 * @return {@code ['a', 'b']}
	 */
	public static String names(Collection<Reference> references) {
		List<String> names = new ArrayList<String>();
		for (Reference reference : references) {
			names.add(reference.getName());
		}
		return strings(names);
	}

	/**
	 * @param names plain names
	 * @return {@code ['a', 'b']}
	 */
	public static String strings(Collection<String> names) {
		StringBuilder sb = new StringBuilder("[");
		boolean first = true;
		for (String name : names) {
			if (!first) {
				sb.append(", ");
			}
			sb.append(quote(name));
			first = false;
		}
		return sb.append(']').toString();
	}

	/**
	 * @param references one or more column references
	 * @return {@code 'a'} for a single reference, {@code ['a', 'b']} otherwise
	 */
	public static String nameOrNames(List<Reference> references) {
		if (references.size() == 1) {
			return quote(references.get(0).getName());
		}
		return names(references);
	}

	/**
	 * Renders a condition as a boolean mask over the rows of a frame.
	 *
	 * @param condition the condition
	 * @param frame the frame variable
	 * @return the mask expression
	 */
	public static String condition(Condition condition, String frame) {
		switch (condition.getKind()) {
		case AND:
			return "(" + condition(condition.getChild(0), frame) + ") & (" + condition(condition.getChild(1), frame)
					+ ")";
		case OR:
			return "(" + condition(condition.getChild(0), frame) + ") | (" + condition(condition.getChild(1), frame)
					+ ")";
		case NOT:
			return "~(" + condition(condition.getChild(0), frame) + ")";
		default:
			break;
		}
		String column = column(frame, condition.getColumn().getName());
		switch (condition.getKind()) {
		case COMPARISON:
			return column + " " + condition.getOperator() + " " + value(condition.getValue());
		case BETWEEN:
			return column + ".between(" + value(condition.getValues().get(0)) + ", " + value(condition.getValues().get(1))
					+ ")";
		case IN:
			return column + ".isin(" + value(condition.getValues()) + ")";
		case STRING_MATCH:
			return column + stringMatch(condition.getOperator(), (String) condition.getValue());
		case NULL_CHECK:
			return column + (condition.isNegated() ? ".notnull()" : ".isnull()");
		default:
			throw new IllegalStateException("Unknown condition kind " + condition.getKind());
		}
	}

	/**
	 * @param operator {@code contains}, {@code starts_with}, {@code ends_with}
	 *        or {@code matches}
	 * @param pattern the literal text or regular expression
	 * @return the {@code .str} accessor call, missing values counting as false
	 */
	public static String stringMatch(String operator, String pattern) {
		switch (operator.toLowerCase(Locale.ROOT)) {
		case "contains":
			return ".str.contains(" + quote(pattern) + ", regex=False, na=False)";
		case "starts_with":
		case "startswith":
			return ".str.startswith(" + quote(pattern) + ", na=False)";
		case "ends_with":
		case "endswith":
			return ".str.endswith(" + quote(pattern) + ", na=False)";
		default:
			return ".str.contains(" + quote(pattern) + ", regex=True, na=False)";
		}
	}

	/**
	 * Renders an expression over the columns of a frame.
	 *
	 * @param expression the expression
	 * @param frame the frame variable
	 * @param current the rendering of the current column for {@code value}
	 *        and {@code x}, or {@code null} outside column-scoped transforms
	 * @return vectorized Python code
	 */
	public static String expression(Expression expression, String frame, String current) {
		switch (expression.getKind()) {
		case LITERAL:
			return value(expression.getValue());
		case IDENTIFIER:
			String name = expression.getName();
			if (current != null && ("value".equals(name) || "x".equals(name))) {
				return current;
			}
			return column(frame, name);
		case UNARY:
			String operand = expression(expression.getOperand(0), frame, current);
			return "not".equals(expression.getOperator()) ? "(~" + operand + ")" : "(-" + operand + ")";
		case BINARY:
			String left = expression(expression.getOperand(0), frame, current);
			String right = expression(expression.getOperand(1), frame, current);
			return "(" + left + " " + pythonOperator(expression.getOperator()) + " " + right + ")";
		case CALL:
			return call(expression, frame, current);
		case CONDITIONAL:
			return "np.where(" + expression(expression.getOperand(1), frame, current) + ", "
					+ expression(expression.getOperand(0), frame, current) + ", "
					+ expression(expression.getOperand(2), frame, current) + ")";
		default:
			throw new IllegalStateException("Unknown expression kind " + expression.getKind());
		}
	}

	private static String pythonOperator(String operator) {
		if ("and".equals(operator)) {
			return "&";
		}
		if ("or".equals(operator)) {
			return "|";
		}
		return operator;
	}

	private static String call(Expression expression, String frame, String current) {
		String function = expression.getName().toLowerCase(Locale.ROOT);
		List<String> arguments = new ArrayList<String>();
		for (Expression argument : expression.getOperands()) {
			arguments.add(expression(argument, frame, current));
		}
		String accessor = ACCESSORS.get(function);
		if (accessor != null && arguments.size() == 1) {
			return arguments.get(0) + accessor;
		}
		String mapped = NUMPY_FUNCTIONS.get(function);
		return (mapped == null ? expression.getName() : mapped) + "(" + String.join(", ", arguments) + ")";
	}
}
