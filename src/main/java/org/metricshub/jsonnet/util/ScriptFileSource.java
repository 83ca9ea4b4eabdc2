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
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * A {@link ScriptSource} backed by a file. The file is opened lazily, when
 * the program is read.
 */
public class ScriptFileSource extends ScriptSource {

	private final String filePath;

	/**
	 * <p>
	 * Constructor for ScriptFileSource.
	 * </p>
	 *
	 * @param filePath a {@link java.lang.String} object
	 */
	public ScriptFileSource(String filePath) {
		super(filePath, null);
		this.filePath = filePath;
	}

	/**
	 * Opens the file as UTF-8. Malformed sequences are replaced rather than
	 * rejected.
	 *
	 * @return a new reader on the file
	 * @throws IOException when the file cannot be opened
	 */
	@Override
	public Reader getReader() throws IOException {
		Path path = Paths.get(filePath);
		if (Files.isDirectory(path)) {
			throw new FileSystemException(filePath, null, "Is a directory");
		}
		return new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8);
	}

	/** {@inheritDoc} */
	@Override
	public String readFully() throws IOException {
		try (Reader in = getReader()) {
			return read(in);
		}
	}

	/**
	 * Describes why a file could not be opened, in the words of the operating
	 * system where possible.
	 *
	 * @param e the failure
	 * @return a short reason, such as <code>No such file or directory</code>
	 */
	public static String describeFailure(IOException e) {
		if (e instanceof NoSuchFileException) {
			return "No such file or directory";
		}
		if (e instanceof AccessDeniedException) {
			return "Permission denied";
		}
		if (e instanceof FileSystemException && ((FileSystemException) e).getReason() != null) {
			return ((FileSystemException) e).getReason();
		}
		return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
	}
}
