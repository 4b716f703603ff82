// This file is part of the Featherweight DDPA analysis (fwddpa).
//
// The Featherweight DDPA analysis is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The Featherweight DDPA analysis is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the Featherweight DDPA analysis. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package featherweightddpa.util;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Helpers for printing debugging output in the form
 * <code>input ===> outputs</code>.
 *
 * @author David J. Pearce
 *
 */
public class Tracing {
	private final PrintStream output;
	private final int width;

	public Tracing(PrintStream output) {
		this(output, 60);
	}

	public Tracing(PrintStream output, int width) {
		this.output = output;
		this.width = width;
	}

	/**
	 * Print a single step: what was asked, followed by what was produced.
	 *
	 * @param input
	 * @param outputs
	 */
	public void step(String input, List<?> outputs) {
		output.println(line(input, outputs));
	}

	/**
	 * Format a single step.
	 *
	 * @param input
	 * @param outputs
	 * @return
	 */
	public String line(String input, List<?> outputs) {
		String sl = leftPad(width, input);
		String sr = rightPad(width, outputs.toString());
		return sl + " ===> " + sr;
	}

	/**
	 * Pad a string with spaces on the left to a given width.
	 *
	 * @param width
	 * @param str
	 * @return
	 */
	public static String leftPad(int width, String str) {
		return pad(width - str.length(), ' ') + str;
	}

	/**
	 * Pad a string with spaces on the right to a given width.
	 *
	 * @param width
	 * @param str
	 * @return
	 */
	public static String rightPad(int width, String str) {
		return str + pad(width - str.length(), ' ');
	}

	public static String pad(int width, char c) {
		if (width <= 0) {
			return "";
		}
		char[] cs = new char[width];
		Arrays.fill(cs, c);
		return new String(cs);
	}
}
