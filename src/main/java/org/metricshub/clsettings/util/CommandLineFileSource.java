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

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import org.slf4j.Logger;

/**
 * Represents a text file listing raw command lines, one per line.
 * The file is read as UTF-8.
 */
public class CommandLineFileSource extends CommandLineSource {

	private static final Logger LOG = ClLogger.getLogger(CommandLineFileSource.class);

	private final String filePath;

	/**
	 * <p>
	 * Constructor for CommandLineFileSource.
	 * </p>
	 *
	 * @param filePath a {@link java.lang.String} object
	 */
	public CommandLineFileSource(String filePath) {
		super(filePath, null);
		this.filePath = filePath;
	}

	/**
	 * <p>
	 * Getter for the field <code>filePath</code>.
	 * </p>
	 *
	 * @return a {@link java.lang.String} object
	 */
	public String getFilePath() {
		return filePath;
	}

	/** {@inheritDoc} */
	@Override
	public Reader getReader() throws IOException {
		return Files.newBufferedReader(Paths.get(filePath), StandardCharsets.UTF_8);
	}

	/** {@inheritDoc} */
	@Override
	public List<String> readCommandLines() throws IOException {
		List<String> commandLines;
		try (Reader reader = getReader()) {
			commandLines = readCommandLines(reader);
		}
		LOG.debug("Read {} command lines from {}", commandLines.size(), filePath);
		return commandLines;
	}
}
