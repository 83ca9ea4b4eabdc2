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

/**
 * Thrown when the command-line arguments are malformed or contradictory.
 * The invocation fails without running any stage of the pipeline.
 */
public class UsageException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final boolean showUsage;

	/**
	 * Creates an exception reported along with the usage text.
	 *
	 * @param msg a {@link java.lang.String} object
	 */
	public UsageException(String msg) {
		this(msg, true);
	}

	/**
	 * <p>
	 * Constructor for UsageException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 * @param showUsage whether the usage text follows the message
	 */
	public UsageException(String msg, boolean showUsage) {
		super(msg);
		this.showUsage = showUsage;
	}

	public boolean isShowUsage() {
		return showUsage;
	}
}
