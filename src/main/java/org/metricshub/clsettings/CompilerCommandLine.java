package org.metricshub.clsettings;

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

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.metricshub.clsettings.args.ArgumentTokenizer;
import org.metricshub.clsettings.args.OptionClassifier;
import org.metricshub.clsettings.args.WindowsArgumentSplitter;
import org.metricshub.clsettings.model.CompilerSettings;
import org.metricshub.clsettings.model.WarningState;
import org.metricshub.clsettings.util.ClLogger;
import org.slf4j.Logger;

/**
 * Processes the command lines stored by the Microsoft C/C++ compiler in
 * program databases and derives the settings that matter to code quality
 * and security analysis.
 * <p>
 * Options are applied left to right and a later option overrides an earlier
 * one. Unknown options, positional arguments and malformed per-warning
 * directives are skipped: parsing never fails.
 * <p>
 * Instances are stateless and can be shared between threads.
 *
 * @see <a href="https://learn.microsoft.com/cpp/build/reference/compiler-options-listed-alphabetically">Compiler options</a>
 */
public class CompilerCommandLine {

	private static final Logger LOG = ClLogger.getLogger(CompilerCommandLine.class);

	private static final CompilerCommandLine DEFAULT = new CompilerCommandLine(
			WindowsArgumentSplitter.INSTANCE,
			OptionClassifier.SWITCH);

	private final ArgumentTokenizer tokenizer;
	private final OptionClassifier classifier;

	/**
	 * Creates a resolver splitting command lines with the specified tokenizer
	 * and keeping the arguments accepted by the specified classifier.
	 *
	 * @param tokenizer splits the raw command line into arguments
	 * @param classifier recognizes option switches
	 */
	public CompilerCommandLine(ArgumentTokenizer tokenizer, OptionClassifier classifier) {
		this.tokenizer = Objects.requireNonNull(tokenizer, "Tokenizer must not be null");
		this.classifier = Objects.requireNonNull(classifier, "Option classifier must not be null");
	}

	/**
	 * Parses a raw command line with the Windows argument splitting rules.
	 *
	 * @param commandLine the raw command line from the PDB, may be {@code null}
	 * @return the resolved settings
	 */
	public static CompilerSettings parse(String commandLine) {
		return DEFAULT.resolve(commandLine);
	}

	/**
	 * Resolves the settings of the specified command line.
	 *
	 * @param commandLine the raw command line, {@code null} is treated as empty
	 * @return the resolved settings
	 */
	public CompilerSettings resolve(String commandLine) {
		CompilerSettings.Builder settings = new CompilerSettings.Builder(commandLine);
		Map<Integer, WarningState> explicitWarnings = new HashMap<Integer, WarningState>();

		for (String argument : tokenizer.tokenize(settings.getRaw())) {
			if (!classifier.isOption(argument)) {
				continue;
			}
			if (!apply(argument, settings, explicitWarnings)) {
				LOG.trace("Ignoring option {}", argument);
			}
		}

		// Per-warning levels are compared with the final warning level
		int warningLevel = settings.getWarningLevel();
		for (Map.Entry<Integer, WarningState> entry : explicitWarnings.entrySet()) {
			if (!isEnabled(entry.getValue(), warningLevel)) {
				settings.addWarningExplicitlyDisabled(entry.getKey());
			}
		}

		CompilerSettings result = settings.build();
		if (LOG.isDebugEnabled()) {
			LOG.debug("Resolved {}:\n{}", result, result.toDescriptionString());
		}
		return result;
	}

	/**
	 * Applies one option switch.
	 *
	 * @param argument the option, including its leading <code>/</code> or <code>-</code>
	 * @param settings accumulator of the global settings
	 * @param explicitWarnings last directive seen for each warning number
	 * @return whether the option was recognized
	 */
	private static boolean apply(String argument, CompilerSettings.Builder settings, Map<Integer, WarningState> explicitWarnings) {
		switch (argument.length()) {
		case 2:
			// /w disables all compiler warnings
			if (argument.charAt(1) == 'w') {
				settings.setWarningLevel(0);
				return true;
			}
			return false;
		case 3:
			return applyShortOption(argument, settings);
		case 4:
			if (argument.endsWith("WX-")) {
				settings.setWarningsAsErrors(false);
			} else if (argument.endsWith("MTd") || argument.endsWith("MDd")) {
				settings.setUsesDebugCRuntime(true);
			} else if (argument.endsWith("GL-")) {
				settings.setWholeProgramOptimizationEnabled(false);
			} else {
				return false;
			}
			return true;
		case 5:
			// /Wall displays all /W4 warnings and the ones that are off by default
			if (argument.endsWith("Wall")) {
				settings.setWarningLevel(4);
				return true;
			}
			return false;
		case 7:
			return applyWarningDirective(argument, explicitWarnings);
		default:
			return false;
		}
	}

	private static boolean applyShortOption(String argument, CompilerSettings.Builder settings) {
		if (argument.charAt(1) == 'W') {
			char wChar = argument.charAt(2);
			if (wChar == 'X') {
				settings.setWarningsAsErrors(true);
			} else if (wChar >= '0' && wChar <= '4') {
				settings.setWarningLevel(wChar - '0');
			} else {
				return false;
			}
			return true;
		}

		if (argument.endsWith("O1") || argument.endsWith("O2")) {
			// "/GF is in effect when /O1 or /O2 is used"
			settings.setOptimizationsEnabled(true);
			settings.setEliminateDuplicateStringsEnabled(true);
		} else if (argument.endsWith("Og") || argument.endsWith("Os") || argument.endsWith("Ot") || argument.endsWith("Ox")) {
			settings.setOptimizationsEnabled(true);
		} else if (argument.endsWith("Od")) {
			settings.setOptimizationsEnabled(false);
		} else if (argument.endsWith("MT") || argument.endsWith("MD")) {
			settings.setUsesDebugCRuntime(false);
		} else if (argument.endsWith("GL")) {
			settings.setWholeProgramOptimizationEnabled(true);
		} else if (argument.endsWith("GF")) {
			settings.setEliminateDuplicateStringsEnabled(true);
		} else {
			return false;
		}
		return true;
	}

	/**
	 * Records a <code>/wdnnnn</code>, <code>/wennnn</code>, <code>/wonnnn</code>
	 * or <code>/wLnnnn</code> directive, replacing any earlier directive for the
	 * same warning.
	 */
	private static boolean applyWarningDirective(String argument, Map<Integer, WarningState> explicitWarnings) {
		if (argument.charAt(1) != 'w') {
			return false;
		}
		WarningState state = WarningState.fromModeCharacter(argument.charAt(2));
		if (state == null) {
			return false;
		}
		String number = argument.substring(3);
		for (int i = 0; i < number.length(); i++) {
			char c = number.charAt(i);
			if (c < '0' || c > '9') {
				return false;
			}
		}
		explicitWarnings.put(Integer.parseInt(number), state);
		return true;
	}

	/**
	 * Evaluates whether a warning is reported, given the last directive for it.
	 * "Once" and "as error" count as enabled whatever the warning level.
	 *
	 * @param state last directive recorded for the warning
	 * @param warningLevel final global warning level
	 * @return {@code false} if the warning ends up disabled
	 */
	static boolean isEnabled(WarningState state, int warningLevel) {
		if (state == null) {
			return true;
		}
		switch (state) {
		case AS_ERROR:
		case ONCE:
			return true;
		case DISABLED:
			return false;
		case LEVEL1:
		case LEVEL2:
		case LEVEL3:
		case LEVEL4:
			return warningLevel >= state.getLevel();
		default:
			LOG.debug("Unexpected warning state {}", state);
			return true;
		}
	}
}
