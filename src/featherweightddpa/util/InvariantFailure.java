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

/**
 * This exception is thrown when the analysis encounters input which violates
 * an invariant established when the graph was built (e.g. a clause without an
 * enclosing block). Such failures cannot be recovered from, and the enclosing
 * analysis must be abandoned.
 *
 * @author David Pearce
 */
public class InvariantFailure extends RuntimeException {

	private final String msg;
	private final Object offender;

	/**
	 * Identify an invariant failure caused by a particular element.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param offender
	 *            The element (e.g. clause) responsible, or null if unknown.
	 */
	public InvariantFailure(String msg, Object offender) {
		super(offender == null ? msg : msg + ": " + offender);
		this.msg = msg;
		this.offender = offender;
	}

	/**
	 * Error message, without the offending element.
	 *
	 * @return
	 */
	public String msg() {
		return msg;
	}

	/**
	 * The element responsible for this failure.
	 *
	 * @return
	 */
	public Object offender() {
		return offender;
	}

	/**
	 * Output this failure to a given output stream.
	 */
	public void outputFailure(PrintStream output) {
		output.println("invariant failure: " + msg);
		if (offender != null) {
			output.println("\t" + offender);
		}
	}

	public static final long serialVersionUID = 1l;
}
