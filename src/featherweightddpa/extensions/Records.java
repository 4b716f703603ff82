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
package featherweightddpa.extensions;

import static featherweightddpa.core.EdgeFunctions.bodyOf;
import static featherweightddpa.core.EdgeFunctions.dynpop;
import static featherweightddpa.core.EdgeFunctions.none;
import static featherweightddpa.core.EdgeFunctions.transition;
import static featherweightddpa.pds.Structure.lookup;
import static featherweightddpa.pds.Structure.pop;
import static featherweightddpa.pds.Structure.push;

import java.util.stream.Stream;

import featherweightddpa.core.EdgeFunctions;
import featherweightddpa.core.Graph;
import featherweightddpa.core.Graph.AnnotatedClause;
import featherweightddpa.core.Syntax.Body;
import featherweightddpa.pds.DynamicPops.Kind;
import featherweightddpa.pds.DynamicPops.Targeted;
import featherweightddpa.pds.Structure.Continuation;
import featherweightddpa.pds.Structure.Transition;

/**
 * Rules for record projection and for filtering the stores found against
 * patterns.
 *
 * @author David J. Pearce
 *
 */
public class Records extends EdgeFunctions.Extension {

	@Override
	public EdgeFunctions.Rule[] rules() {
		return new EdgeFunctions.Rule[] {
				Records::projectionStart,
				// Record Projection Stop
				(acl1, acl0) -> dynpop(Kind.RECORD_PROJECTION_STOP_1_OF_2, acl0),
				// Filter Immediate and Filter Empty Record (Positive and Negative)
				(acl1, acl0) -> dynpop(Kind.FILTER_IMMEDIATE_1_OF_2, acl0),
				// Filter Nonempty Record Positive
				(acl1, acl0) -> dynpop(Targeted.of(Kind.FILTER_NONEMPTY_RECORD_POSITIVE_1_OF_2, acl0), acl0),
				// Filter Nonempty Record Negative (Missing Label and Refutable Label)
				(acl1, acl0) -> dynpop(Targeted.of(Kind.FILTER_NONEMPTY_RECORD_NEGATIVE_1_OF_2, acl0), acl0) };
	}

	/**
	 * Rule Record Projection Start. A lookup for <code>x</code> reaching
	 * <code>x = x'.l</code> continues as a lookup for <code>x'</code>, whose
	 * record is then projected on <code>l</code>.
	 */
	private static Stream<Transition> projectionStart(AnnotatedClause acl1, AnnotatedClause acl0) {
		Body.Projection b = bodyOf(acl1, Body.Projection.class);
		if (b == null) {
			return none();
		}
		return transition(acl1,
				pop(lookup(Graph.clauseOf(acl1).variable())),
				push(new Continuation.Project(b.label())),
				push(lookup(b.record())));
	}
}
