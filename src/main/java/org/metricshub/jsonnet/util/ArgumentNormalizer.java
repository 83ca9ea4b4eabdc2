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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Rewrites raw command-line arguments into the canonical token stream
 * consumed by the option parser.
 * <p>
 * Grouped short options are expanded, so that <code>-abc</code> becomes
 * <code>-a -b -c</code>. The <code>--</code> terminator and everything after
 * it are passed through untouched.
 */
public final class ArgumentNormalizer {

	/** Token that suppresses any further option processing. */
	public static final String END_OF_OPTIONS = "--";

	private ArgumentNormalizer() {}

	/**
	 * Normalizes the specified arguments.
	 *
	 * @param args raw command-line arguments
	 * @return a new list of tokens, in the original order
	 */
	public static List<String> normalize(String... args) {
		return normalize(Arrays.asList(args));
	}

	/**
	 * Normalizes the specified arguments.
	 *
	 * @param args raw command-line arguments
	 * @return a new list of tokens, in the original order
	 */
	public static List<String> normalize(List<String> args) {
		List<String> tokens = new ArrayList<String>(args.size());
		int argIdx = 0;
		while (argIdx < args.size()) {
			String arg = args.get(argIdx++);
			if (END_OF_OPTIONS.equals(arg)) {
				// keep the terminator and all remaining args verbatim
				tokens.add(arg);
				tokens.addAll(args.subList(argIdx, args.size()));
				break;
			}
			if (isCluster(arg)) {
				for (int i = 1; i < arg.length(); i++) {
					tokens.add("-" + arg.charAt(i));
				}
			} else {
				tokens.add(arg);
			}
		}
		return tokens;
	}

	/**
	 * @param arg a raw argument
	 * @return whether the argument has the form <code>-abc</code>
	 */
	static boolean isCluster(String arg) {
		return arg.length() > 2 && arg.charAt(0) == '-' && arg.charAt(1) != '-';
	}
}
