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

import static featherweightddpa.core.EdgeFunctions.alternatives;
import static featherweightddpa.core.EdgeFunctions.dynpop;
import static featherweightddpa.core.EdgeFunctions.none;
import static featherweightddpa.core.EdgeFunctions.transition;
import static featherweightddpa.pds.Structure.capture;
import static featherweightddpa.pds.Structure.jump;
import static featherweightddpa.pds.Structure.lookup;
import static featherweightddpa.pds.Structure.pop;
import static featherweightddpa.pds.Structure.push;

import java.util.stream.Stream;

import featherweightddpa.core.EdgeFunctions;
import featherweightddpa.core.Graph.AnnotatedClause;
import featherweightddpa.core.Syntax.Body;
import featherweightddpa.core.Syntax.Clause;
import featherweightddpa.core.Syntax.Pattern;
import featherweightddpa.core.Syntax.Value;
import featherweightddpa.core.Syntax.Variable;
import featherweightddpa.pds.DynamicPops.Targeted;
import featherweightddpa.pds.Structure.Continuation;
import featherweightddpa.pds.Structure.Transition;

/**
 * Rules for wiring conditionals into the lookup. A conditional
 * <code>r = x1 ~ p ? f1 : f2</code> is treated as a call to
 * <code>f1</code> or <code>f2</code> on the subject <code>x1</code>, except
 * that passing through the entry of a branch records that the subject must (or
 * must not) match the pattern.
 *
 * @author David J. Pearce
 *
 */
public class Conditionals extends EdgeFunctions.Extension {

	@Override
	public EdgeFunctions.Rule[] rules() {
		return new EdgeFunctions.Rule[] {
				(acl1, acl0) -> topSubject(acl1, true),
				(acl1, acl0) -> topSubject(acl1, false),
				(acl1, acl0) -> topNonsubjectVariable(acl1, true),
				(acl1, acl0) -> topNonsubjectVariable(acl1, false),
				(acl1, acl0) -> bottomReturn(acl1, true),
				(acl1, acl0) -> bottomReturn(acl1, false) };
	}

	/**
	 * Rule Conditional Top: Subject Positive / Negative. At the entry
	 * <code>x' =(c) x1</code> of a branch whose parameter is <code>x'</code>, a
	 * lookup for either the parameter or the subject itself continues as a lookup
	 * for the subject, filtered by the pattern. Since the parameter may coincide
	 * with the subject, both interpretations are offered.
	 */
	private static Stream<Transition> topSubject(AnnotatedClause acl1, boolean positive) {
		Body.Conditional cond = enteredBranch(acl1, positive);
		if (cond == null) {
			return none();
		}
		AnnotatedClause.Enter enter = (AnnotatedClause.Enter) acl1;
		final Variable x = enter.parameter();
		final Variable x1 = enter.argument();
		final Continuation filter = filter(cond.pattern(), positive);
		return alternatives(
				transition(acl1, pop(lookup(x)), push(filter), push(lookup(x1))),
				transition(acl1, pop(lookup(x1)), push(filter), push(lookup(x1))));
	}

	/**
	 * Rule Conditional Top: Non-Subject Variable Positive / Negative.
	 */
	private static Stream<Transition> topNonsubjectVariable(AnnotatedClause acl1, boolean positive) {
		Body.Conditional cond = enteredBranch(acl1, positive);
		if (cond == null) {
			return none();
		}
		AnnotatedClause.Enter enter = (AnnotatedClause.Enter) acl1;
		Targeted action = Targeted.conditionalTopNonsubjectVariable(positive, enter.parameter(), enter.argument(),
				acl1, cond.pattern());
		return dynpop(action, new AnnotatedClause.Unannotated(enter.site()));
	}

	/**
	 * Rule Conditional Bottom: Return Positive / Negative. A lookup for the result
	 * <code>x</code> reaching <code>x =)c( x'</code> continues as a lookup for
	 * <code>x'</code> once the subject is confirmed to (not) match the pattern.
	 */
	private static Stream<Transition> bottomReturn(AnnotatedClause acl1, boolean positive) {
		if (!(acl1 instanceof AnnotatedClause.Exit)) {
			return none();
		}
		AnnotatedClause.Exit exit = (AnnotatedClause.Exit) acl1;
		Clause c = exit.site();
		Body.Conditional cond = c.body().as(Body.Conditional.class);
		final Variable x = exit.result();
		if (cond == null || !x.equals(c.variable())) {
			return none();
		}
		if (!exit.returned().equals(branch(cond, positive).body().returnVariable())) {
			return none();
		}
		return transition(new AnnotatedClause.Unannotated(c),
				pop(lookup(x)),
				push(Continuation.ParallelJoin),
				push(lookup(exit.returned())),
				push(jump(acl1)),
				push(capture(3)),
				push(filter(cond.pattern(), positive)),
				push(lookup(cond.subject())));
	}

	/**
	 * Match the entry <code>x' =(c) x1</code> into a given branch of a
	 * conditional on <code>x1</code> whose parameter is <code>x'</code>. This
	 * returns the conditional, or null if the node is not such an entry.
	 *
	 * @param acl
	 * @param positive
	 * @return
	 */
	private static Body.Conditional enteredBranch(AnnotatedClause acl, boolean positive) {
		if (!(acl instanceof AnnotatedClause.Enter)) {
			return null;
		}
		AnnotatedClause.Enter enter = (AnnotatedClause.Enter) acl;
		Body.Conditional cond = enter.site().body().as(Body.Conditional.class);
		if (cond == null || !enter.argument().equals(cond.subject())) {
			return null;
		} else if (!enter.parameter().equals(branch(cond, positive).parameter())) {
			return null;
		}
		return cond;
	}

	/**
	 * Get the branch of a conditional taken on a match (when positive) or on a
	 * mismatch (otherwise).
	 *
	 * @param cond
	 * @param positive
	 * @return
	 */
	static Value.Function branch(Body.Conditional cond, boolean positive) {
		return positive ? cond.match() : cond.antimatch();
	}

	private static Continuation filter(Pattern p, boolean positive) {
		return positive ? new Continuation.Matches(p) : new Continuation.Antimatches(p);
	}
}
