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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The single error type raised by the compiler for author mistakes. It
 * carries one or more {@link Diagnostic}s; its message is the formatted
 * report, so callers only ever handle one exception whatever the number of
 * diagnostics.
 */
public class NoetaException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final List<Diagnostic> diagnostics;

	/**
	 * @param diagnostic the diagnostic to report
	 */
	public NoetaException(Diagnostic diagnostic) {
		this(Collections.singletonList(diagnostic));
	}

	/**
	 * @param diagnostics the diagnostics to report, at least one
	 */
	public NoetaException(List<Diagnostic> diagnostics) {
		super(DiagnosticFormatter.format(diagnostics));
		if (diagnostics.isEmpty()) {
			throw new IllegalArgumentException("At least one diagnostic is required");
		}
		this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
	}

	/**
	 * @return the reported diagnostics, in encounter order
	 */
	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	/**
	 * @return the first reported diagnostic
	 */
	public Diagnostic getDiagnostic() {
		return diagnostics.get(0);
	}

	/**
	 * @return the category of the first reported diagnostic
	 */
	public ErrorCategory getCategory() {
		return diagnostics.get(0).getCategory();
	}
}
