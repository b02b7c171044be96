package org.metricshub.noeta.util;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out the SLF4J loggers of the compiler.
 * <p>
 * Noeta ships no SLF4J binding. Unless the host application sets
 * {@code slf4j.internal.verbosity} itself, SLF4J reports only its own errors,
 * so that a compiler embedded without a binding does not print the
 * "no providers" warning on first use.
 */
public final class NoetaLogger {

	/** System property read by SLF4J for its own reports. */
	static final String VERBOSITY_PROPERTY = "slf4j.internal.verbosity";

	static {
		if (System.getProperty(VERBOSITY_PROPERTY) == null) {
			System.setProperty(VERBOSITY_PROPERTY, "ERROR");
		}
	}

	private NoetaLogger() {}

	/**
	 * @param clazz class owning the logger
	 * @return the SLF4J logger of the class
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}
}
