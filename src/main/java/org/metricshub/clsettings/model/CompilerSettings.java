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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The compilation settings recovered from one compiler command line, as
 * stored by the compiler in the debug information of a binary.
 * <p>
 * Instances are immutable. They are created by
 * {@link org.metricshub.clsettings.CompilerCommandLine}, which fills a
 * {@link Builder} while scanning the command line.
 */
public final class CompilerSettings {

	/**
	 * Settings of an empty command line.
	 */
	public static final CompilerSettings DEFAULT = new Builder("").build();

	private final String raw;
	private final int warningLevel;
	private final boolean warningsAsErrors;
	private final boolean optimizationsEnabled;
	private final boolean usesDebugCRuntime;
	private final boolean eliminateDuplicateStringsEnabled;
	private final boolean wholeProgramOptimizationEnabled;
	private final int[] warningsExplicitlyDisabled;

	private CompilerSettings(Builder builder, int[] warningsExplicitlyDisabled) {
		this.raw = builder.raw;
		this.warningLevel = builder.warningLevel;
		this.warningsAsErrors = builder.warningsAsErrors;
		this.optimizationsEnabled = builder.optimizationsEnabled;
		this.usesDebugCRuntime = builder.usesDebugCRuntime;
		this.eliminateDuplicateStringsEnabled = builder.eliminateDuplicateStringsEnabled;
		this.wholeProgramOptimizationEnabled = builder.wholeProgramOptimizationEnabled;
		this.warningsExplicitlyDisabled = warningsExplicitlyDisabled;
	}

	/**
	 * The raw, unmodified command line before processing.
	 *
	 * @return the raw command line, never {@code null}
	 */
	public String getRaw() {
		return raw;
	}

	/**
	 * The warning level (/W1, /W3, /Wall, etc.) in the range [0, 4].
	 *
	 * @return the warning level
	 */
	public int getWarningLevel() {
		return warningLevel;
	}

	/**
	 * @return whether this command line treats warnings as errors (/WX)
	 */
	public boolean isWarningsAsErrors() {
		return warningsAsErrors;
	}

	/**
	 * @return whether this command line enables optimizations
	 */
	public boolean isOptimizationsEnabled() {
		return optimizationsEnabled;
	}

	/**
	 * @return whether this command line links a debug C runtime library (/MTd, /MDd)
	 */
	public boolean isUsesDebugCRuntime() {
		return usesDebugCRuntime;
	}

	/**
	 * Whether this command line requests string pooling, aka eliminate
	 * duplicate strings, aka /GF.
	 *
	 * @return whether string pooling is in effect
	 */
	public boolean isEliminateDuplicateStringsEnabled() {
		return eliminateDuplicateStringsEnabled;
	}

	/**
	 * @return whether this command line requests whole program optimization (/GL)
	 */
	public boolean isWholeProgramOptimizationEnabled() {
		return wholeProgramOptimizationEnabled;
	}

	/**
	 * The warnings explicitly disabled by this command line, in ascending order
	 * and without duplicates.
	 *
	 * @return an unmodifiable list of warning numbers
	 */
	public List<Integer> getWarningsExplicitlyDisabled() {
		List<Integer> list = new ArrayList<Integer>(warningsExplicitlyDisabled.length);
		for (int warning : warningsExplicitlyDisabled) {
			list.add(warning);
		}
		return Collections.unmodifiableList(list);
	}

	/**
	 * Checks whether the specified warning ends up disabled on this command line.
	 *
	 * @param warningNumber the warning number, e.g. 4996 for C4996
	 * @return {@code true} if the warning is explicitly disabled
	 */
	public boolean isWarningExplicitlyDisabled(int warningNumber) {
		return Arrays.binarySearch(warningsExplicitlyDisabled, warningNumber) >= 0;
	}

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the settings
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("warningLevel = ").append(warningLevel).append(newLine);
		desc.append("warningsAsErrors = ").append(warningsAsErrors).append(newLine);
		desc.append("optimizationsEnabled = ").append(optimizationsEnabled).append(newLine);
		desc.append("usesDebugCRuntime = ").append(usesDebugCRuntime).append(newLine);
		desc.append("eliminateDuplicateStringsEnabled = ").append(eliminateDuplicateStringsEnabled).append(newLine);
		desc.append("wholeProgramOptimizationEnabled = ").append(wholeProgramOptimizationEnabled).append(newLine);
		desc.append("warningsExplicitlyDisabled = ").append(Arrays.toString(warningsExplicitlyDisabled)).append(newLine);

		return desc.toString();
	}

	/** {@inheritDoc} */
	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof CompilerSettings)) {
			return false;
		}
		CompilerSettings other = (CompilerSettings) obj;
		return warningLevel == other.warningLevel
				&& warningsAsErrors == other.warningsAsErrors
				&& optimizationsEnabled == other.optimizationsEnabled
				&& usesDebugCRuntime == other.usesDebugCRuntime
				&& eliminateDuplicateStringsEnabled == other.eliminateDuplicateStringsEnabled
				&& wholeProgramOptimizationEnabled == other.wholeProgramOptimizationEnabled
				&& raw.equals(other.raw)
				&& Arrays.equals(warningsExplicitlyDisabled, other.warningsExplicitlyDisabled);
	}

	/** {@inheritDoc} */
	@Override
	public int hashCode() {
		return Objects
				.hash(
						raw,
						warningLevel,
						warningsAsErrors,
						optimizationsEnabled,
						usesDebugCRuntime,
						eliminateDuplicateStringsEnabled,
						wholeProgramOptimizationEnabled,
						Arrays.hashCode(warningsExplicitlyDisabled));
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return "CompilerSettings[" + raw + "]";
	}

	/**
	 * Mutable accumulator filled while a single command line is scanned.
	 * A builder is owned by one parse and is never shared.
	 */
	public static final class Builder {

		private final String raw;
		private int warningLevel;
		private boolean warningsAsErrors;
		private boolean optimizationsEnabled;
		private boolean usesDebugCRuntime;
		private boolean eliminateDuplicateStringsEnabled;
		private boolean wholeProgramOptimizationEnabled;
		private final List<Integer> warningsExplicitlyDisabled = new ArrayList<Integer>();

		/**
		 * @param raw the raw command line; {@code null} is recorded as an empty string
		 */
		public Builder(String raw) {
			this.raw = raw == null ? "" : raw;
		}

		public String getRaw() {
			return raw;
		}

		public int getWarningLevel() {
			return warningLevel;
		}

		/**
		 * @param warningLevel the global warning level, clamped to [0, 4]
		 * @return this builder
		 */
		public Builder setWarningLevel(int warningLevel) {
			this.warningLevel = Math.max(0, Math.min(4, warningLevel));
			return this;
		}

		public Builder setWarningsAsErrors(boolean warningsAsErrors) {
			this.warningsAsErrors = warningsAsErrors;
			return this;
		}

		public Builder setOptimizationsEnabled(boolean optimizationsEnabled) {
			this.optimizationsEnabled = optimizationsEnabled;
			return this;
		}

		public Builder setUsesDebugCRuntime(boolean usesDebugCRuntime) {
			this.usesDebugCRuntime = usesDebugCRuntime;
			return this;
		}

		public Builder setEliminateDuplicateStringsEnabled(boolean eliminateDuplicateStringsEnabled) {
			this.eliminateDuplicateStringsEnabled = eliminateDuplicateStringsEnabled;
			return this;
		}

		public Builder setWholeProgramOptimizationEnabled(boolean wholeProgramOptimizationEnabled) {
			this.wholeProgramOptimizationEnabled = wholeProgramOptimizationEnabled;
			return this;
		}

		/**
		 * Records a warning as explicitly disabled. Order and duplicates do not
		 * matter, the built settings hold a sorted, distinct list.
		 *
		 * @param warningNumber the disabled warning
		 * @return this builder
		 */
		public Builder addWarningExplicitlyDisabled(int warningNumber) {
			warningsExplicitlyDisabled.add(warningNumber);
			return this;
		}

		/**
		 * @return the immutable settings
		 */
		public CompilerSettings build() {
			int[] disabled = new int[warningsExplicitlyDisabled.size()];
			for (int i = 0; i < disabled.length; i++) {
				disabled[i] = warningsExplicitlyDisabled.get(i);
			}
			Arrays.sort(disabled);
			int distinct = 0;
			for (int i = 0; i < disabled.length; i++) {
				if (distinct == 0 || disabled[distinct - 1] != disabled[i]) {
					disabled[distinct++] = disabled[i];
				}
			}
			return new CompilerSettings(this, Arrays.copyOf(disabled, distinct));
		}
	}
}
