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

import java.io.File;
import java.io.IOException;
import java.util.Objects;
import org.metricshub.jsonnet.backend.JsonnetRuntimeException;
import org.metricshub.jsonnet.ext.EngineRegistry;
import org.metricshub.jsonnet.ext.JsonnetEngine;
import org.metricshub.jsonnet.frontend.AstNode;
import org.metricshub.jsonnet.frontend.StaticException;
import org.metricshub.jsonnet.util.JsonnetLogger;
import org.metricshub.jsonnet.util.JsonnetSettings;
import org.metricshub.jsonnet.util.ScriptFileSource;
import org.metricshub.jsonnet.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing, analysis, and execution
 * of a Jsonnet program.
 * This entry point is used both when Jsonnet is evaluated as a library and
 * when invoked from the command line.
 * <p>
 * The overall process to evaluate a program is as follows:
 * <ul>
 * <li>Read the whole program.
 * <li>Parse it, producing an abstract syntax tree.
 * <li>Either unparse the tree (when {@link JsonnetSettings#isDebugAst()} is
 * set) <strong>or</strong> check it with the static analyzer and execute it
 * in the virtual machine, with the resource limits of the settings.
 * </ul>
 * The stages run once each, in this order, and the first failure stops
 * the evaluation.
 *
 * @see JsonnetEngine
 */
public class Jsonnet {

	private static final Logger LOG = JsonnetLogger.getLogger(Jsonnet.class);

	private JsonnetEngine engine;

	/**
	 * Create a new instance of Jsonnet with the default engine, resolved
	 * once the first program has been read.
	 *
	 * @see EngineRegistry#defaultEngine()
	 */
	public Jsonnet() {}

	/**
	 * Create a new instance of Jsonnet with the specified engine.
	 *
	 * @param engine implementation of the language
	 */
	public Jsonnet(JsonnetEngine engine) {
		this.engine = Objects.requireNonNull(engine, "Engine must not be null");
	}

	/**
	 * @return the engine, resolving the default one on first use
	 * @throws IllegalStateException when no engine is available
	 */
	protected JsonnetEngine getEngine() {
		if (engine == null) {
			engine = EngineRegistry.defaultEngine();
		}
		return engine;
	}

	/**
	 * Evaluates a program supplied as a string, with default settings.
	 *
	 * @param code program text
	 * @return the serialized result
	 * @throws StaticException if the program is invalid
	 * @throws JsonnetRuntimeException if the execution fails
	 */
	public String evaluate(String code) {
		try {
			return evaluate(ScriptSource.fromCode(code), new JsonnetSettings());
		} catch (IOException e) {
			// a StringReader does not fail
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Evaluates a program file, with default settings.
	 *
	 * @param file program file
	 * @return the serialized result
	 * @throws IOException if the file cannot be read
	 * @throws StaticException if the program is invalid
	 * @throws JsonnetRuntimeException if the execution fails
	 */
	public String evaluate(File file) throws IOException {
		return evaluate(new ScriptFileSource(file.getPath()), new JsonnetSettings());
	}

	/**
	 * Evaluates the specified program.
	 *
	 * @param source where to read the program from
	 * @param settings what to do with the program and within which limits
	 * @return the unparsed syntax tree when {@link JsonnetSettings#isDebugAst()}
	 *         is set, the serialized result otherwise
	 * @throws IOException if the program cannot be read; nothing was parsed then
	 * @throws StaticException if the program is invalid
	 * @throws JsonnetRuntimeException if the execution fails
	 */
	public String evaluate(ScriptSource source, JsonnetSettings settings) throws IOException {
		String text = source.readFully();
		String name = source.getDescription();
		JsonnetEngine current = getEngine();

		LOG.debug("Parsing {} ({} characters)", name, text.length());
		AstNode ast = current.parse(name, text);

		if (settings.isDebugAst()) {
			LOG.debug("Unparsing {}", name);
			return current.unparse(ast);
		}

		LOG.debug("Analyzing {}", name);
		current.analyze(ast);

		LOG
				.debug(
						"Executing {} with maxStack={}, gcMinObjects={}, gcGrowthTrigger={}",
						name,
						settings.getMaxStack(),
						settings.getGcMinObjects(),
						settings.getGcGrowthTrigger());
		return current.execute(ast, settings.getMaxStack(), settings.getGcMinObjects(), settings.getGcGrowthTrigger());
	}
}
