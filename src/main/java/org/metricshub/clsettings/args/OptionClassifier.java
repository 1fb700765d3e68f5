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

/**
 * Tells option switches apart from positional arguments (source files,
 * the program name).
 */
public interface OptionClassifier {

	/**
	 * Recognizes switches introduced by <code>/</code> or <code>-</code>, which
	 * are interchangeable for the Microsoft C/C++ compiler.
	 */
	OptionClassifier SWITCH = new OptionClassifier() {
		@Override
		public boolean isOption(String argument) {
			if (argument == null || argument.isEmpty()) {
				return false;
			}
			char first = argument.charAt(0);
			return first == '/' || first == '-';
		}
	};

	/**
	 * @param argument one argument of a command line
	 * @return {@code true} if the argument is an option switch
	 */
	boolean isOption(String argument);
}
