package org.metricshub.clsettings.args;

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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits command lines the way <code>CommandLineToArgvW</code> and the
 * Microsoft C runtime do.
 * <ul>
 * <li>Arguments are delimited by spaces and tabs, unless quoted.</li>
 * <li>In the program name (first argument), double quotes only toggle the
 * quoting and backslashes are literal.</li>
 * <li>2n backslashes followed by a double quote produce n backslashes, and
 * the quote toggles the quoting.</li>
 * <li>2n+1 backslashes followed by a double quote produce n backslashes and
 * a literal double quote.</li>
 * <li>Backslashes not followed by a double quote are literal.</li>
 * <li>Within a quoted region, two double quotes produce a literal double
 * quote.</li>
 * </ul>
 * Unterminated quotes extend to the end of the command line.
 */
public class WindowsArgumentSplitter implements ArgumentTokenizer {

	/** Shared instance; the splitter holds no state. */
	public static final WindowsArgumentSplitter INSTANCE = new WindowsArgumentSplitter();

	/** {@inheritDoc} */
	@Override
	public List<String> tokenize(String commandLine) {
		List<String> arguments = new ArrayList<String>();
		if (commandLine == null) {
			return arguments;
		}

		int length = commandLine.length();
		int pos = skipWhitespace(commandLine, 0);
		if (pos >= length) {
			return arguments;
		}

		// Program name
		StringBuilder current = new StringBuilder();
		boolean inQuotes = false;
		while (pos < length) {
			char c = commandLine.charAt(pos);
			if (c == '"') {
				inQuotes = !inQuotes;
			} else if (!inQuotes && isWhitespace(c)) {
				break;
			} else {
				current.append(c);
			}
			pos++;
		}
		arguments.add(current.toString());

		// Remaining arguments
		current.setLength(0);
		inQuotes = false;
		boolean inArgument = false;
		pos = skipWhitespace(commandLine, pos);
		while (pos < length) {
			char c = commandLine.charAt(pos);
			if (!inQuotes && isWhitespace(c)) {
				arguments.add(current.toString());
				current.setLength(0);
				inArgument = false;
				pos = skipWhitespace(commandLine, pos);
				continue;
			}
			inArgument = true;
			if (c == '\\') {
				int backslashes = 0;
				while (pos < length && commandLine.charAt(pos) == '\\') {
					backslashes++;
					pos++;
				}
				if (pos < length && commandLine.charAt(pos) == '"') {
					appendBackslashes(current, backslashes / 2);
					if (backslashes % 2 == 1) {
						current.append('"');
						pos++;
					}
					// an even count leaves the quote to the next iteration
				} else {
					appendBackslashes(current, backslashes);
				}
			} else if (c == '"') {
				if (inQuotes && pos + 1 < length && commandLine.charAt(pos + 1) == '"') {
					current.append('"');
					pos += 2;
				} else {
					inQuotes = !inQuotes;
					pos++;
				}
			} else {
				current.append(c);
				pos++;
			}
		}
		if (inArgument) {
			arguments.add(current.toString());
		}
		return arguments;
	}

	private static void appendBackslashes(StringBuilder builder, int count) {
		for (int i = 0; i < count; i++) {
			builder.append('\\');
		}
	}

	private static int skipWhitespace(String commandLine, int pos) {
		while (pos < commandLine.length() && isWhitespace(commandLine.charAt(pos))) {
			pos++;
		}
		return pos;
	}

	private static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t';
	}
}
