package org.metricshub.jtt;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jtt
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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
import java.io.PrintStream;
import org.metricshub.jtt.jrt.Severity;
import org.metricshub.jtt.util.JttSettings;
import org.metricshub.jtt.util.ScriptFileSource;
import org.metricshub.jtt.util.ScriptSource;

/**
 * Command-line interface for Jtt.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "jtt.jar";
		}
		JAR_NAME = myName;
	}

	private final JttSettings settings = new JttSettings();
	private final PrintStream out;

	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream from which tokens are read
	 * @param out stream where {@code print} output and usage are written
	 * @param err stream where failures are reported
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this.out = out;
		settings.setInput(in);
		settings.setOutputStream(out);
		settings.setErrorStream(err);
	}

	/**
	 * Returns the mutable {@link JttSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public JttSettings getSettings() {
		return settings;
	}

	public boolean isPrintUsage() {
		return printUsage;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.equals("-f")) {
				// -f filename : read tokens from file
				checkParameterHasArgument(args, argIdx);
				settings.addScriptSource(new ScriptFileSource(args[++argIdx]));
			} else if (arg.equals("-a") || arg.equals("--approve")) {
				// -a level : highest severity absorbed
				checkParameterHasArgument(args, argIdx);
				settings.setApprovedLevel(Severity.parse(args[++argIdx]));
			} else if (arg.equals("-S") || arg.equals("--sandbox")) {
				// -S/--sandbox : refuse the system command
				settings.setSandbox(true);
			} else if (arg.equals("--indent")) {
				checkParameterHasArgument(args, argIdx);
				settings.setIndent(unescape(args[++argIdx]));
			} else if (arg.equals("--section")) {
				checkParameterHasArgument(args, argIdx);
				settings.setSection(unescape(args[++argIdx]));
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
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

		for (ScriptSource scriptSource : settings.getScriptSources()) {
			try {
				scriptSource.getReader();
			} catch (IOException ex) {
				throw new IllegalArgumentException(
						"Failed to read script '" + scriptSource.getDescription() + "': " + ex.getMessage(),
						ex);
			}
		}
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
	 * Turns the two-character sequences {@code \t}, {@code \n} and
	 * {@code \\} into the characters they name.
	 *
	 * @param value raw option value
	 * @return the unescaped value
	 */
	static String unescape(String value) {
		StringBuilder result = new StringBuilder(value.length());
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c == '\\' && i + 1 < value.length()) {
				char next = value.charAt(i + 1);
				if (next == 't') {
					result.append('\t');
					i++;
					continue;
				} else if (next == 'n') {
					result.append('\n');
					i++;
					continue;
				} else if (next == '\\') {
					result.append('\\');
					i++;
					continue;
				}
			}
			result.append(c);
		}
		return result.toString();
	}

	/**
	 * Executes the session based on the previously parsed arguments.
	 *
	 * @throws IOException if reading the input fails
	 * @throws ExitException if the {@code exit} command runs
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}
		new Jtt().invoke(settings);
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
								" [-f script-filename]..." +
								" [-a|--approve level]" +
								" [-S|--sandbox]" +
								" [--indent unit]" +
								" [--section marker]");
		dest.println();
		dest.println(" -f filename = Read tokens from filename, one per line, instead of stdin.");
		dest.println(" -a level = Highest severity absorbed instead of aborting the command:");
		dest.println("            warning (default), minor, critical or fatal.");
		dest.println(" -S, --sandbox = Disable the system command.");
		dest.println(" --indent unit = Indentation unit of printed trees (default \\t).");
		dest.println(" --section marker = Line printed for a branch (default ./section).");
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
	 * @param is input stream for tokens
	 * @param os output stream for program output
	 * @param es error stream for diagnostic messages
	 * @return configured and executed CLI instance
	 * @throws IOException if reading the input fails
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es) throws IOException {
		Cli cli = new Cli(is, os, es);
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
		} catch (ExitException e) {
			System.exit(e.getCode());
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
