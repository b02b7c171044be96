package org.metricshub.noeta.diagnostics;

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
 * Location of a diagnostic in the program text: 1-based line and column, the
 * length of the highlighted span, and the text of the offending line.
 */
public final class ErrorContext {

	private final int line;
	private final int column;
	private final int length;
	private final String sourceLine;

	/**
	 * Creates a new context. Spans shorter than one character are widened to one.
	 *
	 * @param line 1-based line number
	 * @param column 1-based column number
	 * @param length length of the highlighted span
	 * @param sourceLine text of the line, may be empty
	 */
	public ErrorContext(int line, int column, int length, String sourceLine) {
		this.line = line;
		this.column = column;
		this.length = Math.max(1, length);
		this.sourceLine = sourceLine == null ? "" : sourceLine;
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

	public String getSourceLine() {
		return sourceLine;
	}

	@Override
	public String toString() {
		return "line " + line + ", column " + column;
	}
}
