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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed Noeta program: its statements in source order.
 */
public class Program {

	private final List<Statement> statements;

	public Program(List<Statement> statements) {
		this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
	}

	public List<Statement> getStatements() {
		return statements;
	}

	public int size() {
		return statements.size();
	}

	public boolean isEmpty() {
		return statements.isEmpty();
	}

	/**
	 * Prints one line per statement, prefixed with its position.
	 *
	 * @param ps where to print
	 */
	public void dump(PrintStream ps) {
		for (Statement statement : statements) {
			ps.println(statement.getPosition() + "\t" + statement);
		}
	}
}
