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

import java.io.Serializable;
import java.util.Objects;

/**
 * A span of a Jsonnet source, used to point at the origin of static errors
 * and of stack trace frames.
 */
public final class LocationRange implements Serializable {

	private static final long serialVersionUID = 1L;

	private final String file;
	private final Location begin;
	private final Location end;

	/**
	 * Creates a range that only names a file.
	 *
	 * @param file name under which the source is reported
	 */
	public LocationRange(String file) {
		this(file, Location.UNKNOWN, Location.UNKNOWN);
	}

	/**
	 * @param file name under which the source is reported
	 * @param begin first position of the span
	 * @param end position just after the span
	 */
	public LocationRange(String file, Location begin, Location end) {
		this.file = file == null ? "" : file;
		this.begin = Objects.requireNonNull(begin, "begin must not be null");
		this.end = Objects.requireNonNull(end, "end must not be null");
	}

	public String getFile() {
		return file;
	}

	public Location getBegin() {
		return begin;
	}

	public Location getEnd() {
		return end;
	}

	/**
	 * @return whether the range points at an actual position in the file
	 */
	public boolean isSet() {
		return begin.isSet();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof LocationRange)) {
			return false;
		}
		LocationRange other = (LocationRange) o;
		return file.equals(other.file) && begin.equals(other.begin) && end.equals(other.end);
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, begin, end);
	}

	/**
	 * Renders the range as <code>file:line:column</code> for a single
	 * character, <code>file:line:begin-end</code> for a span on one line and
	 * <code>file:(line:column)-(line:column)</code> otherwise.
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(file);
		if (isSet()) {
			if (file.length() > 0) {
				sb.append(':');
			}
			if (begin.getLine() == end.getLine()) {
				if (begin.getColumn() == end.getColumn() - 1) {
					sb.append(begin);
				} else {
					sb.append(begin.getLine()).append(':').append(begin.getColumn()).append('-').append(end.getColumn());
				}
			} else {
				sb.append('(').append(begin).append(")-(").append(end).append(')');
			}
		}
		return sb.toString();
	}
}
