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

import java.io.Serializable;
import java.util.Objects;
import org.metricshub.jsonnet.frontend.LocationRange;

/**
 * One call frame active when a Jsonnet program failed.
 */
public final class TraceFrame implements Serializable {

	private static final long serialVersionUID = 1L;

	private final LocationRange location;
	private final String name;

	/**
	 * @param location where the frame was executing
	 * @param name name of the function or construct, may be empty
	 */
	public TraceFrame(LocationRange location, String name) {
		this.location = Objects.requireNonNull(location, "location must not be null");
		this.name = name == null ? "" : name;
	}

	public LocationRange getLocation() {
		return location;
	}

	public String getName() {
		return name;
	}

	@Override
	public String toString() {
		return location + "\t" + name;
	}
}
