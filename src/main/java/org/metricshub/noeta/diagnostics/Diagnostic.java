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
 * A structured compiler error: category, message, optional location, and
 * optional hint and literal suggestion.
 * <p>
 * Instances are immutable. Use {@link #builder(ErrorCategory, String)} to
 * create them.
 */
public final class Diagnostic {

	private final ErrorCategory category;
	private final String message;
	private final ErrorContext context;
	private final String hint;
	private final String suggestion;

	private Diagnostic(Builder builder) {
		this.category = builder.category;
		this.message = builder.message;
		this.context = builder.context;
		this.hint = builder.hint;
		this.suggestion = builder.suggestion;
	}

	/**
	 * Starts building a diagnostic.
	 *
	 * @param category category of the diagnostic
	 * @param message primary message
	 * @return a new builder
	 */
	public static Builder builder(ErrorCategory category, String message) {
		return new Builder(category, message);
	}

	public ErrorCategory getCategory() {
		return category;
	}

	public String getMessage() {
		return message;
	}

	/**
	 * @return the location of the diagnostic, or {@code null} when unknown
	 */
	public ErrorContext getContext() {
		return context;
	}

	/**
	 * @return the hint, or {@code null}
	 */
	public String getHint() {
		return hint;
	}

	/**
	 * @return the suggested fix, or {@code null}
	 */
	public String getSuggestion() {
		return suggestion;
	}

	/**
	 * @return the rendered diagnostic
	 * @see DiagnosticFormatter#format(Diagnostic)
	 */
	public String format() {
		return DiagnosticFormatter.format(this);
	}

	@Override
	public String toString() {
		return category.getDisplayName() + (context == null ? "" : " at " + context) + ": " + message;
	}

	/**
	 * Builder for {@link Diagnostic}.
	 */
	public static final class Builder {

		private final ErrorCategory category;
		private final String message;
		private ErrorContext context;
		private String hint;
		private String suggestion;

		private Builder(ErrorCategory category, String message) {
			if (category == null || message == null) {
				throw new IllegalArgumentException("A diagnostic needs a category and a message");
			}
			this.category = category;
			this.message = message;
		}

		public Builder context(ErrorContext value) {
			this.context = value;
			return this;
		}

		public Builder at(int line, int column, int length, String sourceLine) {
			this.context = new ErrorContext(line, column, length, sourceLine);
			return this;
		}

		public Builder hint(String value) {
			this.hint = value;
			return this;
		}

		public Builder suggestion(String value) {
			this.suggestion = value;
			return this;
		}

		public Diagnostic build() {
			return new Diagnostic(this);
		}
	}
}
