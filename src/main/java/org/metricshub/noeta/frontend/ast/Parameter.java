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
 * A named statement parameter ({@code name = value}). The value is a
 * {@link String}, {@link Long}, {@link java.math.BigInteger}, {@link Double}, {@link Boolean},
 * {@code null}, a {@code List} or a {@code Map} of those.
 */
public final class Parameter {

	private final String name;
	private final Object value;
	private final SourcePosition position;
	private final int length;

	/**
	 * @param name parameter name
	 * @param value parsed value
	 * @param position position of the value
	 * @param length length of the first token of the value
	 */
	public Parameter(String name, Object value, SourcePosition position, int length) {
		this.name = name;
		this.value = value;
		this.position = position;
		this.length = length;
	}

	public String getName() {
		return name;
	}

	public Object getValue() {
		return value;
	}

	public SourcePosition getPosition() {
		return position;
	}

	public int getLength() {
		return length;
	}

	@Override
	public String toString() {
		return name + "=" + value;
	}
}
