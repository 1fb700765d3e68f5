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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import org.metricshub.clsettings.model.CompilerSettings;
import org.metricshub.clsettings.util.ClLogger;
import org.metricshub.clsettings.util.CommandLineFileSource;
import org.metricshub.clsettings.util.CommandLineSource;
import org.metricshub.clsettings.util.InspectSettings;
import org.slf4j.Logger;

/**
 * Command-line interface printing the settings of compiler command lines.
 */
public final class Cli {

	private static final Logger LOG = ClLogger.getLogger(Cli.class);

	/** Description of the command lines given as arguments */
	public static final String DESCRIPTION_ARGUMENT = "<argument>";

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "clsettings.jar";
		}
		JAR_NAME = myName;
	}

	private final InspectSettings settings = new InspectSettings();
	private final PrintStream out;

	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream from which command lines are read with "-"
	 * @param out stream where the report is written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out) {
		this.out = out;
		settings.setInput(in);
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link InspectSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public InspectSettings getSettings() {
		return settings;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: remaining args are command lines
				break;
			} else if (arg.equals("--")) {
				++argIdx;
				break;
			} else if (arg.equals("-")) {
				// - : read command lines from stdin
				settings
						.addSource(
								new CommandLineSource(
										CommandLineSource.DESCRIPTION_STANDARD_INPUT,
										new InputStreamReader(settings.getInput(), StandardCharsets.UTF_8)));
			} else if (arg.equals("-f")) {
				// -f filename : read command lines from file
				checkParameterHasArgument(args, argIdx);
				settings.addSource(new CommandLineFileSource(args[++argIdx]));
			} else if (arg.equals("-w")) {
				// -w number : report the state of a warning
				checkParameterHasArgument(args, argIdx);
				settings.addQueriedWarning(parseWarningNumber(args[++argIdx]));
			} else if (arg.equals("-e")) {
				// -e : echo the raw command line
				settings.setEchoRaw(true);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		while (argIdx < args.length) {
			settings.addSource(new CommandLineSource(DESCRIPTION_ARGUMENT, new StringReader(args[argIdx++])));
		}

		if (settings.getSources().isEmpty()) {
			throw new IllegalArgumentException("No command line to inspect.");
		}
		LOG.debug("Parsed arguments:\n{}", settings.toDescriptionString());
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Parses a warning number, with or without the "C" prefix (C4996 or 4996).
	 *
	 * @param value the argument value
	 * @return the warning number
	 */
	private static int parseWarningNumber(String value) {
		String digits = value.startsWith("C") || value.startsWith("c") ? value.substring(1) : value;
		try {
			int number = Integer.parseInt(digits);
			if (number < 0) {
				throw new IllegalArgumentException("Warning number must not be negative: " + value);
			}
			return number;
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid warning number: " + value, e);
		}
	}

	/**
	 * Prints the settings of every command line of the configured sources.
	 *
	 * @throws IOException if a source cannot be read
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}
		PrintStream report = settings.getOutputStream();
		boolean first = true;
		for (CommandLineSource source : settings.getSources()) {
			for (String commandLine : source.readCommandLines()) {
				if (!first) {
					report.println();
				}
				first = false;
				print(report, CompilerCommandLine.parse(commandLine));
			}
		}
	}

	private void print(PrintStream report, CompilerSettings compilerSettings) {
		if (settings.isEchoRaw()) {
			report.println("raw = " + compilerSettings.getRaw());
		}
		report.print(compilerSettings.toDescriptionString());
		for (int warning : settings.getQueriedWarnings()) {
			report.println("C" + warning + ": " + (compilerSettings.isWarningExplicitlyDisabled(warning) ? "disabled" : "enabled"));
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-f filename]..." +
								" [-w number]..." +
								" [-e]" +
								" [-]" +
								" [--]" +
								" [command-line]...");
		dest.println();
		dest.println(" command-line = Raw compiler command line, e.g. \"cl.exe /c /W3 /wd4996 a.cpp\".");
		dest.println(" -f filename = Read command lines from filename, one per line.");
		dest.println(" - = Read command lines from the standard input, one per line.");
		dest.println(" -w number = Report whether warning number (e.g. 4996 or C4996) is disabled.");
		dest.println(" -e = Print the raw command line before its settings.");
		dest.println(" -- = End of options.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is input stream for command lines
	 * @param os output stream for the report
	 * @return configured and executed CLI instance
	 * @throws IOException if a source cannot be read
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os) throws IOException {
		Cli cli = new Cli(is, os);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
