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

/**
 * Name, type and nullability of one column. Immutable.
 */
public final class ColumnInfo {

	private final String name;
	private final DataType type;
	private final boolean nullable;

	public ColumnInfo(String name, DataType type) {
		this(name, type, true);
	}

	public ColumnInfo(String name, DataType type, boolean nullable) {
		this.name = name;
		this.type = type == null ? DataType.UNKNOWN : type;
		this.nullable = nullable;
	}

	public String getName() {
		return name;
	}

	public DataType getType() {
		return type;
	}

	public boolean isNullable() {
		return nullable;
	}

	/**
	 * @param newType the new type
	 * @return a copy of this column with another type
	 */
	public ColumnInfo withType(DataType newType) {
		return new ColumnInfo(name, newType, nullable);
	}

	/**
	 * @param newName the new name
	 * @return a copy of this column with another name
	 */
	public ColumnInfo withName(String newName) {
		return new ColumnInfo(newName, type, nullable);
	}

	@Override
	public String toString() {
		return name + ":" + type.getDisplayName();
	}
}
