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
import java.io.PrintStream;
import org.metricshub.jsonnet.backend.JsonnetRuntimeException;
import org.metricshub.jsonnet.backend.TraceFormatter;
import org.metricshub.jsonnet.frontend.StaticException;
import org.metricshub.jsonnet.util.ScriptFileSource;
import org.metricshub.jsonnet.util.ScriptSource;

/**
 * Writes the failures of an invocation to the error stream, in the format
 * users of the command line rely on.
 */
public class ErrorReporter {

	/** Prefix of failures detected before execution. */
	public static final String STATIC_ERROR = "STATIC ERROR: ";

	/** Prefix of failures detected during execution. */
	public static final String RUNTIME_ERROR = "RUNTIME ERROR: ";

	private final PrintStream err;

	/**
	 * @param err stream where error messages are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public ErrorReporter(PrintStream err) {
		this.err = err;
	}

	/**
	 * Reports invalid command-line arguments, followed by the usage text
	 * unless the exception says otherwise.
	 *
	 * @param e the failure
	 */
	public void reportUsageError(UsageException e) {
		err.println(e.getMessage());
		if (e.isShowUsage()) {
			err.println();
			Cli.usage(err);
		}
	}

	/**
	 * Reports that the program could not be read.
	 *
	 * @param source the program that could not be read
	 * @param e the failure
	 */
	public void reportInputError(ScriptSource source, IOException e) {
		if (source instanceof ScriptFileSource) {
			err.println("Opening input file: " + source.getDescription() + ": " + ScriptFileSource.describeFailure(e));
		} else {
			err.println("Reading " + source.getDescription() + ": " + e.getMessage());
		}
	}

	/**
	 * @param e a lexical, syntax or static analysis failure
	 */
	public void reportStaticError(StaticException e) {
		err.println(STATIC_ERROR + e.getDescription());
	}

	/**
	 * Reports an execution failure along with its Jsonnet stack trace, of
	 * which only the first and last frames are printed.
	 *
	 * @param e the failure
	 */
	public void reportRuntimeError(JsonnetRuntimeException e) {
		err.println(RUNTIME_ERROR + e.getMessage());
		for (String line : TraceFormatter.format(e.getTrace())) {
			err.println(line);
		}
	}
}
