package org.metricshub.jsonnet.backend;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A failure raised by the virtual machine while executing a Jsonnet
 * program. It carries the Jsonnet call frames that were active at the
 * point of failure, outermost last.
 */
public class JsonnetRuntimeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final List<TraceFrame> trace;

	/**
	 * <p>
	 * Constructor for JsonnetRuntimeException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 */
	public JsonnetRuntimeException(String msg) {
		this(msg, Collections.<TraceFrame>emptyList());
	}

	/**
	 * <p>
	 * Constructor for JsonnetRuntimeException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 * @param trace the active Jsonnet frames, copied
	 */
	public JsonnetRuntimeException(String msg, List<TraceFrame> trace) {
		super(msg);
		this.trace = Collections.unmodifiableList(new ArrayList<TraceFrame>(trace));
	}

	/**
	 * Returns the Jsonnet stack trace. Not to be confused with the Java one
	 * returned by {@link #getStackTrace()}.
	 *
	 * @return an unmodifiable list of frames
	 */
	public List<TraceFrame> getTrace() {
		return trace;
	}
}
