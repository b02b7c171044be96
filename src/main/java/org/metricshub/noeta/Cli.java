package org.metricshub.noeta;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Noeta
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
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.noeta.diagnostics.NoetaException;
import org.metricshub.noeta.util.NoetaLogger;
import org.metricshub.noeta.util.NoetaSettings;
import org.metricshub.noeta.util.ScriptFileSource;
import org.metricshub.noeta.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Command-line interface for Noeta.
 */
public final class Cli {

	private static final Logger LOG = NoetaLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "noeta.jar";
		}
		JAR_NAME = myName;
	}

	private final NoetaSettings settings = new NoetaSettings();
	private final PrintStream out;
	private final PrintStream err;

	private final List<ScriptSource> scriptSources = new ArrayList<ScriptSource>();
	private File outputFile;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output and error streams.
	 */
	public Cli() {
		this(System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param out stream where the generated script is written
	 * @param err stream where diagnostics are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
	}

	/**
	 * Returns the mutable {@link NoetaSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public NoetaSettings getSettings() {
		return settings;
	}

	/**
	 * @return defensive copy of the program sources given on the command line
	 */
	public List<ScriptSource> getScriptSources() {
		return new ArrayList<ScriptSource>(scriptSources);
	}

	/**
	 * @return the file the script is written to, or {@code null} for the output stream
	 */
	public File getOutputFile() {
		return outputFile;
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
				// program file
				scriptSources.add(new ScriptFileSource(arg));
			} else if (arg.equals("-f")) {
				checkParameterHasArgument(args, argIdx);
				scriptSources.add(new ScriptFileSource(args[++argIdx]));
			} else if (arg.equals("-c")) {
				// -c code : compile the given program text
				checkParameterHasArgument(args, argIdx);
				scriptSources.add(ScriptSource.of(args[++argIdx]));
			} else if (arg.equals("-o")) {
				checkParameterHasArgument(args, argIdx);
				outputFile = new File(args[++argIdx]);
			} else if (arg.equals("-t") || arg.equals("--type-check")) {
				settings.setTypeCheck(true);
			} else if (arg.equals("--base-dir")) {
				checkParameterHasArgument(args, argIdx);
				settings.setBaseDirectory(new File(args[++argIdx]));
			} else if (arg.equals("--dump-syntax")) {
				settings.setDumpSyntaxTree(true);
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

		if (scriptSources.isEmpty()) {
			throw new IllegalArgumentException("Noeta program not provided.");
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
	 * Compiles the program given on the command line. Diagnostics are written
	 * to the error stream.
	 *
	 * @return the exit status: 0 on success, 1 if the program has errors
	 * @throws IOException if a program file cannot be read or the output
	 *         cannot be written
	 */
	public int run() throws IOException {
		if (printUsage) {
			usage(out);
			return 0;
		}
		Noeta noeta = new Noeta(settings);
		String code = Noeta.read(scriptSources);
		try {
			if (settings.isDumpSyntaxTree()) {
				noeta.parse(code).dump(out);
				return 0;
			}
			String script = noeta.compile(code);
			if (outputFile != null) {
				Files.write(outputFile.toPath(), script.getBytes(StandardCharsets.UTF_8));
				LOG.debug("Wrote {}", outputFile);
			} else {
				out.println(script);
			}
			return 0;
		} catch (NoetaException e) {
			err.println(e.getMessage());
			return 1;
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
								" [-t|--type-check]" +
								" [--base-dir dir]" +
								" [-o output-filename]" +
								" [--dump-syntax]" +
								" (-f program-filename | -c program | program-filename)...");
		dest.println();
		dest.println(" -f filename = Use contents of filename for the program.");
		dest.println(" -c program = Compile the given program text.");
		dest.println(" -o filename = Write the generated Python script to filename instead of the output.");
		dest.println(" -t, --type-check = Read the header of loaded files to check column references.");
		dest.println(" --base-dir dir = Resolve relative data file paths against dir when type checking.");
		dest.println(" --dump-syntax = Print the syntax tree instead of generating code.");
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
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		int status;
		try {
			Cli cli = new Cli();
			cli.parse(args);
			status = cli.run();
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			status = 1;
		} catch (Exception e) {
			LOG.error("Compilation failed", e);
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			status = 1;
		}
		if (status != 0) {
			System.exit(status);
		}
	}
}
