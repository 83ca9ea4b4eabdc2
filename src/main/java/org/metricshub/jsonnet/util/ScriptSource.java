package org.metricshub.jsonnet.util;

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

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

/**
 * Represents a Jsonnet program along with the name it is reported under in
 * error messages and stack traces.
 */
public class ScriptSource {

	/** Constant <code>DESCRIPTION_COMMAND_LINE="&lt;cmdline&gt;"</code> */
	public static final String DESCRIPTION_COMMAND_LINE = "<cmdline>";

	/** Constant <code>DESCRIPTION_STDIN="&lt;stdin&gt;"</code> */
	public static final String DESCRIPTION_STDIN = "<stdin>";

	private static final int BUFFER_SIZE = 8192;

	private String description;
	private Reader reader;

	/**
	 * <p>
	 * Constructor for ScriptSource.
	 * </p>
	 *
	 * @param description a {@link java.lang.String} object
	 * @param reader a {@link java.io.Reader} object
	 */
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * Resolves where the program of an invocation comes from: the command line
	 * itself, standard input, or a file.
	 *
	 * @param settings validated settings of the invocation
	 * @return the source to read the program from
	 */
	public static ScriptSource forSettings(JsonnetSettings settings) {
		if (settings.isFilenameIsCode()) {
			return fromCode(settings.getFilename());
		}
		if (settings.isStdin()) {
			return new ScriptSource(
					DESCRIPTION_STDIN,
					new InputStreamReader(settings.getInput(), StandardCharsets.UTF_8));
		}
		return new ScriptFileSource(settings.getFilename());
	}

	/**
	 * @param code program text supplied on the command line
	 * @return a source reported as {@value #DESCRIPTION_COMMAND_LINE}
	 */
	public static ScriptSource fromCode(String code) {
		return new ScriptSource(DESCRIPTION_COMMAND_LINE, new StringReader(code));
	}

	/**
	 * <p>
	 * Getter for the field <code>description</code>.
	 * </p>
	 *
	 * @return a {@link java.lang.String} object
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the script contents.
	 *
	 * @return The reader which contains the script contents.
	 * @throws java.io.IOException if any.
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/**
	 * Reads the whole program. The pipeline needs the complete text, so
	 * nothing is parsed before this returns.
	 *
	 * @return the program text
	 * @throws IOException when the program cannot be opened or read
	 */
	public String readFully() throws IOException {
		return read(getReader());
	}

	/**
	 * Drains the specified reader without closing it.
	 *
	 * @param in reader to drain
	 * @return everything the reader served
	 * @throws IOException upon an IO error
	 */
	protected static String read(Reader in) throws IOException {
		StringBuilder text = new StringBuilder();
		char[] buffer = new char[BUFFER_SIZE];
		int len;
		while ((len = in.read(buffer)) != -1) {
			text.append(buffer, 0, len);
		}
		return text.toString();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
