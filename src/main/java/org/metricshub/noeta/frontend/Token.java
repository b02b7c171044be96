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

/**
 * One lexical token. Immutable.
 */
public final class Token {

	private final TokenType type;
	private final String text;
	private final Object value;
	private final int line;
	private final int column;
	private final int length;

	/**
	 * @param type kind of token
	 * @param text the lexeme as written (string contents for strings)
	 * @param value literal value: {@link String}, {@link Long}, {@link Double} or {@link Boolean}
	 * @param line 1-based line of the first character
	 * @param column 1-based column of the first character
	 * @param length number of source characters covered by the token
	 */
	public Token(TokenType type, String text, Object value, int line, int column, int length) {
		this.type = type;
		this.text = text;
		this.value = value;
		this.line = line;
		this.column = column;
		this.length = length;
	}

	public TokenType getType() {
		return type;
	}

	public String getText() {
		return text;
	}

	public Object getValue() {
		return value;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public int getLength() {
		return length;
	}

	public boolean is(TokenType expected) {
		return type == expected;
	}

	/**
	 * Tokens usable where a name is expected: identifiers and keywords, so that
	 * columns may be called e.g. {@code rank} or {@code length}.
	 *
	 * @return whether this token can stand for a name
	 */
	public boolean isName() {
		return type == TokenType.IDENTIFIER || type.isKeyword();
	}

	/**
	 * @return how this token is named in syntax diagnostics
	 */
	public String describe() {
		if (type == TokenType.IDENTIFIER) {
			return type.getDescription() + " '" + text + "'";
		}
		if (type == TokenType.STRING) {
			return type.getDescription() + " \"" + text + "\"";
		}
		if (type == TokenType.NUMBER || type == TokenType.BOOLEAN) {
			return type.getDescription() + " " + text;
		}
		return type.getDescription();
	}

	@Override
	public String toString() {
		return type + "(" + text + ")@" + line + ":" + column;
	}
}
