package org.metricshub.jsonnet.ext;

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

import org.metricshub.jsonnet.backend.JsonnetRuntimeException;
import org.metricshub.jsonnet.frontend.AstNode;
import org.metricshub.jsonnet.frontend.StaticException;

/**
 * Language implementation driven by the command line: parser, unparser,
 * static analyzer and virtual machine.
 * <p>
 * Implementations are discovered with {@link java.util.ServiceLoader} (list
 * them in <code>META-INF/services/org.metricshub.jsonnet.ext.JsonnetEngine</code>)
 * or registered with {@link EngineRegistry#register(String, JsonnetEngine)}.
 * They must provide a public no-argument constructor to be discoverable.
 */
public interface JsonnetEngine {

	/**
	 * Returns the name under which the engine is registered.
	 *
	 * @return a non-empty name
	 */
	String getEngineName();

	/**
	 * Parses a program.
	 *
	 * @param displayName name of the source, reported in errors
	 * @param source complete program text
	 * @return the syntax tree
	 * @throws StaticException on lexical or syntax errors
	 */
	AstNode parse(String displayName, String source) throws StaticException;

	/**
	 * Converts a syntax tree back to Jsonnet source.
	 *
	 * @param ast a tree returned by {@link #parse(String, String)}
	 * @return the program text
	 */
	String unparse(AstNode ast);

	/**
	 * Checks a syntax tree before execution. The tree may be annotated in
	 * place.
	 *
	 * @param ast a tree returned by {@link #parse(String, String)}
	 * @throws StaticException when the program is invalid
	 */
	void analyze(AstNode ast) throws StaticException;

	/**
	 * Executes an analyzed syntax tree.
	 *
	 * @param ast a tree that passed {@link #analyze(AstNode)}
	 * @param maxStack number of allowed stack frames
	 * @param gcMinObjects do not collect garbage until this many objects exist
	 * @param gcGrowthTrigger collect garbage after this amount of object growth
	 * @return the serialized result
	 * @throws JsonnetRuntimeException when execution fails
	 */
	String execute(AstNode ast, int maxStack, int gcMinObjects, double gcGrowthTrigger)
			throws JsonnetRuntimeException;
}
