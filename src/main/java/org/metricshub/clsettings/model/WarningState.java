package org.metricshub.clsettings.model;

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
 * Most recent directive recorded for one warning number on a compiler
 * command line.
 * <p>
 * The level of a warning and its "once" or "as error" marking share a single
 * value, which is how the native compiler tracks them. As a consequence,
 * <code>cl.exe /c /W1 /wd4265 /w14265 /wo4265</code> does not report C4265,
 * while <code>cl.exe /c /W1 /wd4265 /w14265</code> does.
 */
public enum WarningState {
	/** <code>/w1nnnn</code> */
	LEVEL1(1),
	/** <code>/w2nnnn</code> */
	LEVEL2(2),
	/** <code>/w3nnnn</code> */
	LEVEL3(3),
	/** <code>/w4nnnn</code> */
	LEVEL4(4),
	/** <code>/wennnn</code> */
	AS_ERROR(0),
	/** <code>/wonnnn</code> */
	ONCE(0),
	/** <code>/wdnnnn</code> */
	DISABLED(0);

	private final int level;

	WarningState(int level) {
		this.level = level;
	}

	/**
	 * Returns the warning level assigned by this directive.
	 *
	 * @return 1 to 4 for the per-level directives, 0 for the others
	 */
	public int getLevel() {
		return level;
	}

	/**
	 * Maps the mode character found after <code>/w</code> in a per-warning
	 * directive.
	 *
	 * @param mode third character of the option token
	 * @return the matching state, or {@code null} when the character does not
	 *         introduce a per-warning directive
	 */
	public static WarningState fromModeCharacter(char mode) {
		switch (mode) {
		case 'd':
			return DISABLED;
		case 'e':
			return AS_ERROR;
		case 'o':
			return ONCE;
		case '1':
			return LEVEL1;
		case '2':
			return LEVEL2;
		case '3':
			return LEVEL3;
		case '4':
			return LEVEL4;
		default:
			return null;
		}
	}
}
