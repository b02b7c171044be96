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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import org.metricshub.noeta.semantic.FileSchemaProbe;
import org.metricshub.noeta.semantic.SchemaProbe;

/**
 * A simple container for the parameters of a compilation.
 * These values have defaults, which may be changed through command line
 * arguments or programmatically.
 */
public class NoetaSettings {

	/** Default number of rows read to infer CSV column types. */
	public static final int DEFAULT_PROBE_SAMPLE_ROWS = 100;

	/**
	 * Whether referenced data files are probed for their columns;
	 * <code>false</code> by default.
	 */
	private boolean typeCheck = false;

	/**
	 * Directory against which relative data file paths are resolved when
	 * probing; <code>null</code> means the current directory.
	 */
	private File baseDirectory = null;

	/**
	 * Rows sampled to infer column types of CSV files.
	 */
	private int probeSampleRows = DEFAULT_PROBE_SAMPLE_ROWS;

	/**
	 * Probe used in type-checking mode; <code>null</code> means a
	 * {@link FileSchemaProbe} built from the settings above.
	 */
	private SchemaProbe schemaProbe = null;

	/**
	 * Whether to dump the parsed program instead of generating code.
	 */
	private boolean dumpSyntaxTree = false;

	public boolean isTypeCheck() {
		return typeCheck;
	}

	public void setTypeCheck(boolean typeCheck) {
		this.typeCheck = typeCheck;
	}

	public File getBaseDirectory() {
		return baseDirectory;
	}

	public void setBaseDirectory(File baseDirectory) {
		this.baseDirectory = baseDirectory;
	}

	public int getProbeSampleRows() {
		return probeSampleRows;
	}

	public void setProbeSampleRows(int probeSampleRows) {
		this.probeSampleRows = probeSampleRows;
	}

	/**
	 * @return the configured probe, or a {@link FileSchemaProbe} using
	 *         {@link #getBaseDirectory()} and {@link #getProbeSampleRows()}
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "the probe is a collaborator, not internal state")
	public SchemaProbe getSchemaProbe() {
		if (schemaProbe == null) {
			return new FileSchemaProbe(baseDirectory, probeSampleRows);
		}
		return schemaProbe;
	}

	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "the probe is a collaborator, not internal state")
	public void setSchemaProbe(SchemaProbe schemaProbe) {
		this.schemaProbe = schemaProbe;
	}

	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	public void setDumpSyntaxTree(boolean dumpSyntaxTree) {
		this.dumpSyntaxTree = dumpSyntaxTree;
	}
}
