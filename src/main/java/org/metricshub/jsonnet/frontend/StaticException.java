package org.metricshub.jsonnet.frontend;

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

/**
 * Failure detected before execution: lexing, parsing or static analysis.
 *
 * @see org.metricshub.jsonnet.ext.JsonnetEngine#parse(String, String)
 * @see org.metricshub.jsonnet.ext.JsonnetEngine#analyze(AstNode)
 */
public class StaticException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final LocationRange location;

	/**
	 * <p>
	 * Constructor for StaticException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 */
	public StaticException(String msg) {
		this(null, msg);
	}

	/**
	 * <p>
	 * Constructor for StaticException.
	 * </p>
	 *
	 * @param location where the problem was found, may be <code>null</code>
	 * @param msg a {@link java.lang.String} object
	 */
	public StaticException(LocationRange location, String msg) {
		super(msg);
		this.location = location;
	}

	/**
	 * Returns where the problem was found.
	 *
	 * @return the location, or {@code null} if unavailable
	 */
	public LocationRange getLocation() {
		return location;
	}

	/**
	 * @return the message prefixed with the location when one is set
	 */
	public String getDescription() {
		if (location != null && location.isSet()) {
			return location + ": " + getMessage();
		}
		return getMessage();
	}
}
