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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * A simple container for the parameters of a single inspection run.
 * These values have defaults, which may be changed through command line
 * arguments or programmatically.
 */
public class InspectSettings {

	/**
	 * Where command lines are read from when "-" is specified.
	 * By default, this is {@link System#in}.
	 */
	private InputStream input = System.in;

	/**
	 * Output stream;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Sources of raw command lines, in the order they were specified.
	 */
	private List<CommandLineSource> sources = new ArrayList<CommandLineSource>();

	/**
	 * Warning numbers whose state is reported for each command line.
	 */
	private List<Integer> queriedWarnings = new ArrayList<Integer>();

	/**
	 * Whether the raw command line is printed before its settings;
	 * <code>false</code> by default.
	 */
	private boolean echoRaw = false;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("sources = ").append(getSources()).append(newLine);
		desc.append("queriedWarnings = ").append(getQueriedWarnings()).append(newLine);
		desc.append("echoRaw = ").append(isEchoRaw()).append(newLine);

		return desc.toString();
	}

	/**
	 * Where command lines are read from when "-" is specified.
	 *
	 * @return the input
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "InputStream reference is intentionally shared so callers can control input.")
	public InputStream getInput() {
		return input;
	}

	/**
	 * @param input the input to set
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied InputStream must be used directly; no defensive copy possible.")
	public void setInput(InputStream input) {
		this.input = input;
	}

	/**
	 * @return the output stream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "OutputStream reference is intentionally shared so callers can control output.")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the PrintStream to print to (instead of System.out by default)
	 *
	 * @param pOutputStream PrintStream to use for the report
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}

	/**
	 * @return a copy of the command line sources
	 */
	public List<CommandLineSource> getSources() {
		return new ArrayList<CommandLineSource>(sources);
	}

	/**
	 * Add a source of command lines.
	 *
	 * @param source source to add
	 */
	public void addSource(CommandLineSource source) {
		sources.add(source);
	}

	/**
	 * @return a copy of the queried warning numbers
	 */
	public List<Integer> getQueriedWarnings() {
		return new ArrayList<Integer>(queriedWarnings);
	}

	/**
	 * Add a warning number to report on.
	 *
	 * @param warningNumber non-negative warning number
	 */
	public void addQueriedWarning(int warningNumber) {
		if (warningNumber < 0) {
			throw new IllegalArgumentException("Warning number must not be negative: " + warningNumber);
		}
		queriedWarnings.add(warningNumber);
	}

	public boolean isEchoRaw() {
		return echoRaw;
	}

	public void setEchoRaw(boolean echoRaw) {
		this.echoRaw = echoRaw;
	}
}
