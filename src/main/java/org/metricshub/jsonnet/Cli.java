package org.metricshub.jsonnet;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jsonnet CLI
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
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.metricshub.jsonnet.backend.JsonnetRuntimeException;
import org.metricshub.jsonnet.ext.JsonnetEngine;
import org.metricshub.jsonnet.frontend.StaticException;
import org.metricshub.jsonnet.util.ArgumentNormalizer;
import org.metricshub.jsonnet.util.JsonnetLogger;
import org.metricshub.jsonnet.util.JsonnetSettings;
import org.metricshub.jsonnet.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Command-line interface for Jsonnet.
 * <p>
 * {@link #parse(String[])} and {@link #run()} throw on failure;
 * {@link #execute(String[])} reports failures and turns them into an exit
 * code, and only {@link #main(String[])} terminates the JVM.
 */
public final class Cli {

	private static final Logger LOG = JsonnetLogger.getLogger(Cli.class);

	/** Exit code of a successful invocation. */
	public static final int EXIT_SUCCESS = 0;

	/** Exit code of a failed invocation. */
	public static final int EXIT_FAILURE = 1;

	private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?[0-9]+");

	private static final Pattern NUMBER_PATTERN = Pattern
			.compile("[+-]?([0-9]+(\\.[0-9]*)?|\\.[0-9]+)([eE][+-]?[0-9]+)?");

	private final JsonnetSettings settings = new JsonnetSettings();
	private final ErrorReporter reporter;
	private final JsonnetEngine engine;

	private ScriptSource scriptSource;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input, output and error
	 * streams, using the default engine.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams and the default
	 * engine.
	 *
	 * @param in stream from which the program is read when no file is given
	 * @param out stream where the result is written
	 * @param err stream where error messages are written
	 */
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this(in, out, err, null);
	}

	/**
	 * Creates a CLI instance using the supplied streams and engine.
	 *
	 * @param in stream from which the program is read when no file is given
	 * @param out stream where the result is written
	 * @param err stream where error messages are written
	 * @param engine language implementation, or {@code null} for the default
	 *        one
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err, JsonnetEngine engine) {
		this.reporter = new ErrorReporter(err);
		this.engine = engine;
		settings.setInput(in);
		settings.setOutputStream(out);
	}

	/**
	 * Returns the {@link JsonnetSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public JsonnetSettings getSettings() {
		return settings;
	}

	/**
	 * @return whether the command line asked for the usage text
	 */
	public boolean isPrintUsage() {
		return printUsage;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws UsageException if the arguments are invalid
	 */
	public void parse(String[] args) {
		List<String> tokens = ArgumentNormalizer.normalize(args);
		List<String> remainingArgs = new ArrayList<String>();

		int argIdx = 0;
		while (argIdx < tokens.size()) {
			String arg = tokens.get(argIdx);
			if (arg.equals("-h") || arg.equals("--help")) {
				printUsage = true;
				return;
			} else if (arg.equals("-s") || arg.equals("--max-stack")) {
				int value = parseInteger(nextArgument(tokens, argIdx++));
				if (value < 1) {
					throw new UsageException("ERROR: Invalid --max-stack value " + value);
				}
				settings.setMaxStack(value);
			} else if (arg.equals("--gc-min-objects")) {
				int value = parseInteger(nextArgument(tokens, argIdx++));
				if (value < 1) {
					throw new UsageException("ERROR: Invalid --gc-min-objects value " + value);
				}
				settings.setGcMinObjects(value);
			} else if (arg.equals("--gc-growth-trigger")) {
				String text = nextArgument(tokens, argIdx++);
				double value = parseNumber(text);
				if (value < 0) {
					throw new UsageException("ERROR: Invalid --gc-growth-trigger \"" + text + "\"");
				}
				settings.setGcGrowthTrigger(value);
			} else if (arg.equals("-e") || arg.equals("--exec")) {
				settings.setFilenameIsCode(true);
			} else if (arg.equals("--debug-ast")) {
				settings.setDebugAst(true);
			} else if (arg.equals(ArgumentNormalizer.END_OF_OPTIONS)) {
				// all subsequent args are not options
				remainingArgs.addAll(tokens.subList(argIdx + 1, tokens.size()));
				break;
			} else {
				remainingArgs.add(arg);
			}
			++argIdx;
		}

		if (remainingArgs.size() > 1) {
			throw new UsageException("ERROR: Filename already specified as \"" + remainingArgs.get(0) + "\"");
		}
		if (settings.isFilenameIsCode() && remainingArgs.isEmpty()) {
			throw new UsageException("ERROR: Must give filename when using -e, --exec");
		}
		settings.setFilename(remainingArgs.isEmpty() ? JsonnetSettings.STDIN_FILENAME : remainingArgs.get(0));

		if (LOG.isDebugEnabled()) {
			LOG.debug("Parsed command line:\n{}", settings.toDescriptionString());
		}
	}

	/**
	 * Returns the value that follows the current command-line option.
	 *
	 * @param tokens normalized arguments
	 * @param argIdx index of the option that requires a value
	 * @return the value
	 */
	private static String nextArgument(List<String> tokens, int argIdx) {
		if (argIdx + 1 >= tokens.size()) {
			throw new UsageException("Expected another commandline argument.", false);
		}
		return tokens.get(argIdx + 1);
	}

	/**
	 * Parses a base-10 integer, with an optional sign and nothing else.
	 *
	 * @param text the option value
	 * @return the integer
	 */
	static int parseInteger(String text) {
		if (INTEGER_PATTERN.matcher(text).matches()) {
			try {
				return Integer.parseInt(text);
			} catch (NumberFormatException e) {
				// out of range, reported below
			}
		}
		throw new UsageException("ERROR: Invalid integer \"" + text + "\"");
	}

	/**
	 * Parses a decimal number such as <code>2</code>, <code>-0.5</code> or
	 * <code>1e3</code>.
	 *
	 * @param text the option value
	 * @return the number
	 */
	static double parseNumber(String text) {
		if (!NUMBER_PATTERN.matcher(text).matches()) {
			throw new UsageException("ERROR: Invalid number \"" + text + "\"");
		}
		return Double.parseDouble(text);
	}

	/**
	 * Executes the CLI based on the previously parsed arguments: prints the
	 * usage text, or evaluates the program and prints its result. Both go to
	 * the output stream of the settings.
	 *
	 * @throws IOException if the program cannot be read
	 * @throws StaticException if the program is invalid
	 * @throws JsonnetRuntimeException if the execution fails
	 */
	public void run() throws IOException {
		PrintStream out = settings.getOutputStream();
		if (printUsage) {
			usage(out);
			return;
		}
		scriptSource = ScriptSource.forSettings(settings);
		Jsonnet jsonnet = engine != null ? new Jsonnet(engine) : new Jsonnet();
		String result = jsonnet.evaluate(scriptSource, settings);
		out.println(result);
		out.flush();
	}

	/**
	 * Parses the arguments, runs the CLI and reports any usage, input, static
	 * or runtime error on the error stream.
	 *
	 * @param args command-line arguments
	 * @return {@link #EXIT_SUCCESS} or {@link #EXIT_FAILURE}
	 */
	public int execute(String[] args) {
		try {
			parse(args);
		} catch (UsageException e) {
			reporter.reportUsageError(e);
			return EXIT_FAILURE;
		}
		try {
			run();
			return EXIT_SUCCESS;
		} catch (IOException e) {
			LOG.debug("Cannot read {}", scriptSource, e);
			reporter.reportInputError(scriptSource, e);
		} catch (StaticException e) {
			reporter.reportStaticError(e);
		} catch (JsonnetRuntimeException e) {
			reporter.reportRuntimeError(e);
		}
		return EXIT_FAILURE;
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest.println("jsonnet {<option>} [<filename>]");
		dest.println("where <filename> defaults to - (stdin)");
		dest.println("and <option> can be:");
		dest.println("    -h / --help            This message");
		dest.println("    -e / --exec            Treat filename as code (requires explicit filename)");
		dest.println("    -s / --max-stack <n>   Number of allowed stack frames");
		dest.println("    --gc-min-objects       Do not run garbage collector until this many");
		dest.println("    --gc-growth-trigger    Run garbage collector after this amount of object growth");
		dest.println("    --debug-ast            Unparse the parsed AST without executing it");
		dest.println();
		dest.println("Multichar options are expanded e.g. -abc becomes -a -b -c.");
		dest.println("The -- option suppresses option processing.  Note that since jsonnet programs can");
		dest.println("begin with -, it is advised to use -- with -e if the program is unknown.");
		dest.flush();
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 * @throws UsageException if the arguments are invalid
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
		int code;
		try {
			code = new Cli().execute(args);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			code = EXIT_FAILURE;
		}
		System.exit(code);
	}
}
