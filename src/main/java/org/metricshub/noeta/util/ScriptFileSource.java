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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * A Noeta program stored in a file, read as UTF-8. A leading byte order mark
 * is dropped, so that editors adding one do not break the first statement.
 */
public class ScriptFileSource extends ScriptSource {

	private static final char BYTE_ORDER_MARK = '\uFEFF';

	private final Path path;

	/**
	 * @param filePath path of the program file
	 */
	public ScriptFileSource(String filePath) {
		super(filePath, null);
		this.path = Paths.get(filePath);
	}

	/**
	 * @return the path of the program file, as given
	 */
	public String getFilePath() {
		return getDescription();
	}

	/**
	 * Reads the file again on each call.
	 */
	@Override
	public Reader getReader() throws IOException {
		return new StringReader(readAll());
	}

	/**
	 * @return the program text, without byte order mark
	 * @throws IOException when the file is missing or unreadable
	 */
	@Override
	public String readAll() throws IOException {
		String text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
		if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
			return text.substring(1);
		}
		return text;
	}
}
