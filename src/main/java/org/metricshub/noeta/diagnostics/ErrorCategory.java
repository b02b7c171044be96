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
 * Categories of compiler diagnostics, in the order in which batches are
 * reported.
 */
public enum ErrorCategory {
	/** Bad character or unterminated literal in the program text. */
	LEXICAL("Lexical Error"),
	/** Grammar violation. */
	SYNTAX("Syntax Error"),
	/** Undefined dataset or column. */
	SEMANTIC("Semantic Error"),
	/** Column type mismatch, only reported when type checking is enabled. */
	TYPE("Type Error"),
	/** Reserved for failures of the generated code; never raised by the compiler. */
	RUNTIME("Runtime Error");

	private final String displayName;

	ErrorCategory(String displayName) {
		this.displayName = displayName;
	}

	/**
	 * @return the human readable category name, e.g. "Syntax Error"
	 */
	public String getDisplayName() {
		return displayName;
	}
}
