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
import java.util.List;

/**
 * Renders Jsonnet stack traces for humans.
 * <p>
 * Deep recursion produces traces with thousands of frames, so only the
 * first and last frames are shown, separated by a single ellipsis line.
 */
public final class TraceFormatter {

	/** Number of innermost frames always shown. */
	public static final int MAX_ABOVE = 10;

	/** Number of outermost frames always shown. */
	public static final int MAX_BELOW = 10;

	/** Line standing for the elided frames. */
	public static final String ELLIPSIS = "\t...";

	private TraceFormatter() {}

	/**
	 * Formats the trace with the default bounds.
	 *
	 * @param trace the frames to render
	 * @return one line per printed frame, plus the ellipsis if any
	 */
	public static List<String> format(List<TraceFrame> trace) {
		return format(trace, MAX_ABOVE, MAX_BELOW);
	}

	/**
	 * Formats the trace. Frame <code>i</code> is kept when
	 * <code>i &lt; maxAbove</code> or <code>i &gt;= size - maxBelow</code>;
	 * the others are replaced by one {@link #ELLIPSIS}.
	 *
	 * @param trace the frames to render
	 * @param maxAbove number of leading frames to keep
	 * @param maxBelow number of trailing frames to keep
	 * @return one line per printed frame, plus the ellipsis if any
	 */
	public static List<String> format(List<TraceFrame> trace, int maxAbove, int maxBelow) {
		int size = trace.size();
		List<String> lines = new ArrayList<String>(Math.min(size, maxAbove + maxBelow + 1));
		for (int i = 0; i < size; i++) {
			if (i >= maxAbove && i < size - maxBelow) {
				if (i == maxAbove) {
					lines.add(ELLIPSIS);
				}
			} else {
				TraceFrame frame = trace.get(i);
				lines.add("\t" + frame.getLocation() + "\t" + frame.getName());
			}
		}
		return lines;
	}
}
