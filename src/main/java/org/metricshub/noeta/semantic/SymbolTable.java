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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.noeta.util.NoetaLogger;
import org.slf4j.Logger;

/**
 * Registry of the datasets currently defined: alias to {@link DatasetInfo},
 * plus the order in which aliases were defined.
 * <p>
 * One table is created per compilation unless the caller supplies one; a
 * supplied table is updated in place, so that an interactive session can
 * carry its datasets from one submitted fragment to the next. Its lifecycle
 * is: create, {@link #define(String, DatasetInfo)} (done by the analyzer),
 * {@link #reconcile(Map)} after execution, {@link #clear()}.
 * <p>
 * This class is not thread-safe: callers compiling concurrently against the
 * same table must serialize access themselves.
 */
public class SymbolTable {

	private static final Logger LOG = NoetaLogger.getLogger(SymbolTable.class);

	/** Provenance prefix of datasets learned from runtime bindings. */
	public static final String RUNTIME_PROVENANCE = "runtime:";

	private final Map<String, DatasetInfo> datasets = new LinkedHashMap<String, DatasetInfo>();
	private final List<String> history = new ArrayList<String>();

	/**
	 * Defines or redefines an alias.
	 *
	 * @param name the alias
	 * @param info what is known about the dataset
	 */
	public void define(String name, DatasetInfo info) {
		datasets.put(name, info);
		history.add(name);
	}

	/**
	 * @param name the alias
	 * @return the dataset, or {@code null} when the alias is not defined
	 */
	public DatasetInfo lookup(String name) {
		return datasets.get(name);
	}

	public boolean exists(String name) {
		return datasets.containsKey(name);
	}

	/**
	 * @return every defined alias, in order of first definition
	 */
	public List<String> getAllNames() {
		return new ArrayList<String>(datasets.keySet());
	}

	/**
	 * @return every definition in order, redefinitions included
	 */
	public List<String> getHistory() {
		return Collections.unmodifiableList(history);
	}

	public int size() {
		return datasets.size();
	}

	/**
	 * Forgets every dataset.
	 */
	public void clear() {
		datasets.clear();
		history.clear();
	}

	/**
	 * Learns schemas from the bindings of a runtime after generated code ran:
	 * every {@link TabularValue} bound to a name that is not yet defined is
	 * registered with its real columns.
	 *
	 * @param bindings the runtime's variables
	 * @return the newly registered aliases
	 */
	public List<String> reconcile(Map<String, ?> bindings) {
		List<String> added = new ArrayList<String>();
		for (Map.Entry<String, ?> binding : bindings.entrySet()) {
			String name = binding.getKey();
			if (!(binding.getValue() instanceof TabularValue) || datasets.containsKey(name)) {
				continue;
			}
			TabularValue value = (TabularValue) binding.getValue();
			List<ColumnInfo> columns = new ArrayList<ColumnInfo>();
			for (Map.Entry<String, String> column : value.getColumnTypes().entrySet()) {
				columns.add(new ColumnInfo(column.getKey(), DataType.fromDtype(column.getValue())));
			}
			define(name, new DatasetInfo(name, columns, RUNTIME_PROVENANCE + name));
			added.add(name);
		}
		if (!added.isEmpty()) {
			LOG.debug("Reconciled {} runtime datasets: {}", added.size(), added);
		}
		return added;
	}

	@Override
	public String toString() {
		return datasets.values().toString();
	}
}
