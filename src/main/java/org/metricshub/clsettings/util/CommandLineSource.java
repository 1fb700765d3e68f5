package org.metricshub.clsettings.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * ClSettings
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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Represents one source of raw compiler command lines, one command line
 * per line of text.
 * This is usually either the standard input, given on the command line
 * as "-", or a text file, given as a path with a "-f" command line switch.
 */
public class CommandLineSource {

	/** Constant <code>DESCRIPTION_STANDARD_INPUT="&lt;stdin&gt;"</code> */
	public static final String DESCRIPTION_STANDARD_INPUT = "<stdin>";

	private final String description;
	private final Reader reader;

	/**
	 * <p>
	 * Constructor for CommandLineSource.
	 * </p>
	 *
	 * @param description a {@link java.lang.String} object
	 * @param reader a {@link java.io.Reader} object
	 */
	public CommandLineSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * <p>
	 * Getter for the field <code>description</code>.
	 * </p>
	 *
	 * @return a {@link java.lang.String} object
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the command lines.
	 *
	 * @return The reader which contains the command lines.
	 * @throws java.io.IOException if any.
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/**
	 * Reads all command lines of this source. Blank lines are skipped.
	 *
	 * @return the raw command lines, in order
	 * @throws IOException if the source cannot be read
	 */
	public List<String> readCommandLines() throws IOException {
		return readCommandLines(getReader());
	}

	/**
	 * Reads the non-blank lines of the specified reader, leaving it open.
	 *
	 * @param reader where the command lines are read from
	 * @return the raw command lines, in order
	 * @throws IOException if the reader fails
	 */
	protected static List<String> readCommandLines(Reader reader) throws IOException {
		List<String> commandLines = new ArrayList<String>();
		BufferedReader br = new BufferedReader(reader);
		String line;
		while ((line = br.readLine()) != null) {
			if (!line.trim().isEmpty()) {
				commandLines.add(line);
			}
		}
		return commandLines;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
