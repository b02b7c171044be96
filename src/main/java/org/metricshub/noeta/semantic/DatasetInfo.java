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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What is statically known about a dataset: its ordered columns and where it
 * comes from.
 * <p>
 * A schema is either fully known (at least one column) or unknown (no
 * columns): column references against an unknown schema are not checked.
 * Instances are immutable; the derivation methods return new instances.
 */
public final class DatasetInfo {

	private final String name;
	private final Map<String, ColumnInfo> columns;
	private final String provenance;

	/**
	 * @param name dataset alias
	 * @param columns columns in order, empty for an unknown schema
	 * @param provenance where the dataset comes from, e.g. {@code file:sales.csv}
	 */
	public DatasetInfo(String name, Collection<ColumnInfo> columns, String provenance) {
		this.name = name;
		Map<String, ColumnInfo> map = new LinkedHashMap<String, ColumnInfo>();
		for (ColumnInfo column : columns) {
			map.put(column.getName(), column);
		}
		this.columns = Collections.unmodifiableMap(map);
		this.provenance = provenance;
	}

	/**
	 * @param name dataset alias
	 * @param provenance where the dataset comes from
	 * @return a dataset whose schema is unknown
	 */
	public static DatasetInfo unknown(String name, String provenance) {
		return new DatasetInfo(name, Collections.<ColumnInfo>emptyList(), provenance);
	}

	public String getName() {
		return name;
	}

	public String getProvenance() {
		return provenance;
	}

	/**
	 * @return whether the columns are known
	 */
	public boolean isSchemaKnown() {
		return !columns.isEmpty();
	}

	public boolean hasColumn(String column) {
		return columns.containsKey(column);
	}

	/**
	 * @param column column name
	 * @return the column, or {@code null}
	 */
	public ColumnInfo getColumn(String column) {
		return columns.get(column);
	}

	/**
	 * @return the column type, {@link DataType#UNKNOWN} for a missing column
	 */
	public DataType getType(String column) {
		ColumnInfo info = columns.get(column);
		return info == null ? DataType.UNKNOWN : info.getType();
	}

	public Collection<ColumnInfo> getColumns() {
		return columns.values();
	}

	public List<String> getColumnNames() {
		return new ArrayList<String>(columns.keySet());
	}

	/**
	 * @param newName alias of the copy
	 * @param newProvenance provenance of the copy
	 * @return the same schema under another name
	 */
	public DatasetInfo copyAs(String newName, String newProvenance) {
		return new DatasetInfo(newName, columns.values(), newProvenance);
	}

	/**
	 * Keeps the given columns, in the given order. Names not in the schema are
	 * ignored.
	 *
	 * @param newName alias of the projection
	 * @param kept columns to keep
	 * @param newProvenance provenance of the projection
	 * @return the projected dataset
	 */
	public DatasetInfo project(String newName, List<String> kept, String newProvenance) {
		List<ColumnInfo> projected = new ArrayList<ColumnInfo>();
		for (String column : kept) {
			ColumnInfo info = columns.get(column);
			if (info != null) {
				projected.add(info);
			}
		}
		return new DatasetInfo(newName, projected, newProvenance);
	}

	/**
	 * Adds a column at the end, or replaces a column of the same name in place.
	 *
	 * @param column the column
	 * @return the new dataset
	 */
	public DatasetInfo withColumn(ColumnInfo column) {
		Map<String, ColumnInfo> copy = new LinkedHashMap<String, ColumnInfo>(columns);
		copy.put(column.getName(), column);
		return new DatasetInfo(name, copy.values(), provenance);
	}

	/**
	 * @param mapping old name to new name
	 * @return the dataset with renamed columns, order preserved
	 */
	public DatasetInfo renameColumns(Map<String, String> mapping) {
		List<ColumnInfo> renamed = new ArrayList<ColumnInfo>();
		for (ColumnInfo column : columns.values()) {
			String target = mapping.get(column.getName());
			renamed.add(target == null ? column : column.withName(target));
		}
		return new DatasetInfo(name, renamed, provenance);
	}

	@Override
	public String toString() {
		return name + (isSchemaKnown() ? columns.values().toString() : "[unknown schema]") + " <- " + provenance;
	}
}
