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
import java.util.List;
import java.util.Map;

/**
 * Reads the columns of an external data file without loading it.
 * <p>
 * Implementations must never throw: any failure yields an empty result,
 * which the analyzer treats as an unknown schema.
 */
public interface SchemaProbe {

	/**
	 * @param path file path as written in the program
	 * @param format {@code csv}, {@code json}, {@code excel}, {@code parquet} or {@code sql}
	 * @return column name to type in file order, or an empty map
	 */
	Map<String, DataType> probe(String path, String format);

	/**
	 * Same as {@link #probe(String, String)}, with the nullability of each
	 * column. Formats that do not declare nullability report every column
	 * as nullable.
	 *
	 * @param path file path as written in the program
	 * @param format {@code csv}, {@code json}, {@code excel}, {@code parquet} or {@code sql}
	 * @return the columns in file order, or an empty list
	 */
	default List<ColumnInfo> probeColumns(String path, String format) {
		List<ColumnInfo> columns = new ArrayList<ColumnInfo>();
		Map<String, DataType> schema = probe(path, format);
		if (schema != null) {
			for (Map.Entry<String, DataType> column : schema.entrySet()) {
				columns.add(new ColumnInfo(column.getKey(), column.getValue()));
			}
		}
		return columns;
	}
}
