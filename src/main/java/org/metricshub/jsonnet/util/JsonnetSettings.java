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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.InputStream;
import java.io.PrintStream;

/**
 * A simple container for the parameters of a single Jsonnet invocation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking the driver programmatically, from within Java code.
 * <p>
 * The command line populates one instance per invocation and does not
 * change it once the arguments have been validated.
 */
public class JsonnetSettings {

	/** Filename meaning "read the program from standard input". */
	public static final String STDIN_FILENAME = "-";

	/** Default number of allowed stack frames. */
	public static final int DEFAULT_MAX_STACK = 500;

	/** Default number of objects below which the garbage collector never runs. */
	public static final int DEFAULT_GC_MIN_OBJECTS = 1000;

	/** Default growth factor of live objects that triggers the garbage collector. */
	public static final double DEFAULT_GC_GROWTH_TRIGGER = 2.0;

	/**
	 * Where the program is read from, or the program itself
	 * when {@link #isFilenameIsCode()} is set.
	 * {@value #STDIN_FILENAME} by default.
	 */
	private String filename = STDIN_FILENAME;

	/**
	 * Whether {@link #getFilename()} holds the program text;
	 * <code>false</code> by default.
	 */
	private boolean filenameIsCode = false;

	/**
	 * Whether to print the parsed syntax tree instead of executing it;
	 * <code>false</code> by default.
	 */
	private boolean debugAst = false;

	/**
	 * Number of allowed stack frames.
	 */
	private int maxStack = DEFAULT_MAX_STACK;

	private int gcMinObjects = DEFAULT_GC_MIN_OBJECTS;

	private double gcGrowthTrigger = DEFAULT_GC_GROWTH_TRIGGER;

	/**
	 * Where the program is read from when the filename is
	 * {@value #STDIN_FILENAME}.
	 * By default, this is {@link System#in}.
	 */
	private InputStream input = System.in;

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 */
	private PrintStream outputStream = System.out;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("filename = ").append(isFilenameIsCode() ? "<code>" : getFilename()).append(newLine);
		desc.append("filenameIsCode = ").append(isFilenameIsCode()).append(newLine);
		desc.append("debugAst = ").append(isDebugAst()).append(newLine);
		desc.append("maxStack = ").append(getMaxStack()).append(newLine);
		desc.append("gcMinObjects = ").append(getGcMinObjects()).append(newLine);
		desc.append("gcGrowthTrigger = ").append(getGcGrowthTrigger()).append(newLine);

		return desc.toString();
	}

	/**
	 * Where the program is read from, or the program itself
	 * when {@link #isFilenameIsCode()} is set.
	 *
	 * @return the filename
	 */
	public String getFilename() {
		return filename;
	}

	/**
	 * @param filename the filename to set
	 */
	public void setFilename(String filename) {
		this.filename = filename;
	}

	/**
	 * @return whether the program is read from standard input
	 */
	public boolean isStdin() {
		return !filenameIsCode && STDIN_FILENAME.equals(filename);
	}

	/**
	 * Whether the filename holds the program text;
	 * <code>false</code> by default.
	 *
	 * @return the filenameIsCode
	 */
	public boolean isFilenameIsCode() {
		return filenameIsCode;
	}

	/**
	 * @param filenameIsCode the filenameIsCode to set
	 */
	public void setFilenameIsCode(boolean filenameIsCode) {
		this.filenameIsCode = filenameIsCode;
	}

	/**
	 * Whether to print the parsed syntax tree instead of executing it;
	 * <code>false</code> by default.
	 *
	 * @return the debugAst
	 */
	public boolean isDebugAst() {
		return debugAst;
	}

	/**
	 * @param debugAst the debugAst to set
	 */
	public void setDebugAst(boolean debugAst) {
		this.debugAst = debugAst;
	}

	/**
	 * Number of allowed stack frames;
	 * {@value #DEFAULT_MAX_STACK} by default.
	 *
	 * @return the maxStack
	 */
	public int getMaxStack() {
		return maxStack;
	}

	/**
	 * @param maxStack the maxStack to set, at least 1
	 */
	public void setMaxStack(int maxStack) {
		if (maxStack < 1) {
			throw new IllegalArgumentException("maxStack must be at least 1: " + maxStack);
		}
		this.maxStack = maxStack;
	}

	/**
	 * Do not run the garbage collector until this many objects are alive;
	 * {@value #DEFAULT_GC_MIN_OBJECTS} by default.
	 *
	 * @return the gcMinObjects
	 */
	public int getGcMinObjects() {
		return gcMinObjects;
	}

	/**
	 * @param gcMinObjects the gcMinObjects to set, at least 1
	 */
	public void setGcMinObjects(int gcMinObjects) {
		if (gcMinObjects < 1) {
			throw new IllegalArgumentException("gcMinObjects must be at least 1: " + gcMinObjects);
		}
		this.gcMinObjects = gcMinObjects;
	}

	/**
	 * Run the garbage collector after this amount of object growth;
	 * {@value #DEFAULT_GC_GROWTH_TRIGGER} by default.
	 *
	 * @return the gcGrowthTrigger
	 */
	public double getGcGrowthTrigger() {
		return gcGrowthTrigger;
	}

	/**
	 * @param gcGrowthTrigger the gcGrowthTrigger to set, not negative
	 */
	public void setGcGrowthTrigger(double gcGrowthTrigger) {
		if (!(gcGrowthTrigger >= 0)) {
			throw new IllegalArgumentException("gcGrowthTrigger must not be negative: " + gcGrowthTrigger);
		}
		this.gcGrowthTrigger = gcGrowthTrigger;
	}

	/**
	 * Where the program is read from when the filename is
	 * {@value #STDIN_FILENAME}.
	 * By default, this is {@link java.lang.System#in}.
	 *
	 * @return the input
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "InputStream reference is intentionally shared with the caller.")
	public InputStream getInput() {
		return input;
	}

	/**
	 * @param input the input to set
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied InputStream must be used directly.")
	public void setInput(InputStream input) {
		this.input = input;
	}

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 *
	 * @return the output stream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "OutputStream reference is intentionally shared so callers can control output.")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the OutputStream to print to (instead of System.out by default)
	 *
	 * @param pOutputStream OutputStream to use for the result
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream is written to directly")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}
}
