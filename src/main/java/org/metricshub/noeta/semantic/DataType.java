package org.metricshub.noeta.semantic;

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

import java.util.Locale;

/**
 * Column types tracked by the semantic analyzer.
 */
public enum DataType {
	STRING,
	NUMERIC,
	DATETIME,
	BOOLEAN,
	UNKNOWN;

	/**
	 * @return lower-case name used in diagnostics
	 */
	public String getDisplayName() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Maps a dtype name of the target runtime ({@code int64}, {@code object},
	 * {@code datetime64[ns]}...) to a column type.
	 *
	 * @param dtype dtype name, may be {@code null}
	 * @return the matching type, {@link #UNKNOWN} when not recognized
	 */
	public static DataType fromDtype(String dtype) {
		if (dtype == null) {
			return UNKNOWN;
		}
		String lower = dtype.trim().toLowerCase(Locale.ROOT);
		if (lower.startsWith("int") || lower.startsWith("uint") || lower.startsWith("float") || lower.equals("number")
				|| lower.equals("numeric")) {
			return NUMERIC;
		}
		if (lower.startsWith("datetime") || lower.equals("timestamp")) {
			return DATETIME;
		}
		if (lower.startsWith("bool")) {
			return BOOLEAN;
		}
		if (lower.equals("object") || lower.equals("string") || lower.equals("str") || lower.equals("category")) {
			return STRING;
		}
		return UNKNOWN;
	}
}
