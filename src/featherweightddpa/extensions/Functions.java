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

import static featherweightddpa.core.EdgeFunctions.dynpop;
import static featherweightddpa.core.EdgeFunctions.none;
import static featherweightddpa.core.EdgeFunctions.transition;
import static featherweightddpa.pds.Structure.capture;
import static featherweightddpa.pds.Structure.jump;
import static featherweightddpa.pds.Structure.lookup;
import static featherweightddpa.pds.Structure.pop;
import static featherweightddpa.pds.Structure.popDynamic;
import static featherweightddpa.pds.Structure.push;

import java.util.stream.Stream;

import featherweightddpa.core.EdgeFunctions;
import featherweightddpa.core.Graph.AnnotatedClause;
import featherweightddpa.core.Syntax.Body;
import featherweightddpa.core.Syntax.Clause;
import featherweightddpa.core.Syntax.Variable;
import featherweightddpa.pds.DynamicPops.Targeted;
import featherweightddpa.pds.Structure.Continuation;
import featherweightddpa.pds.Structure.TracePart;
import featherweightddpa.pds.Structure.Transition;

/**
 * Rules for wiring function calls into the lookup. On entry to a function, a
 * lookup for its parameter continues as a lookup for the argument at the call
 * site, whilst any other variable must be non-local and is found in the
 * closure. On exit from a function, a lookup for the call's result continues
 * as a lookup for the variable returned by the body, provided that control
 * really flowed through this call site.
 *
 * @author David J. Pearce
 *
 */
public class Functions extends EdgeFunctions.Extension {

	@Override
	public EdgeFunctions.Rule[] rules() {
		return new EdgeFunctions.Rule[] {
				Functions::topParameterVariable,
				Functions::bottomFlowCheck,
				Functions::bottomReturnVariable,
				Functions::topNonlocalVariable };
	}

	/**
	 * Rule Function Top: Parameter Variable. A lookup for parameter
	 * <code>x</code> reaching <code>x =(c) x'</code>, where <code>c</code> is
	 * <code>r = f x'</code>, becomes a lookup for <code>x'</code> at the call
	 * site. Before that is trusted, we check the call really invoked a function
	 * with this parameter. The pushes are ordered such that the function and then
	 * the argument are looked up first, with their stores being captured beneath
	 * the join.
	 */
	private static Stream<Transition> topParameterVariable(AnnotatedClause acl1, AnnotatedClause acl0) {
		if (!(acl1 instanceof AnnotatedClause.Enter)) {
			return none();
		}
		AnnotatedClause.Enter enter = (AnnotatedClause.Enter) acl1;
		Clause c = enter.site();
		Body.Application appl = c.body().as(Body.Application.class);
		if (appl == null || !enter.argument().equals(appl.argument())) {
			return none();
		}
		final Variable x = enter.parameter();
		final Variable x1 = enter.argument();
		final Variable x2 = appl.function();
		return transition(acl1,
				pop(lookup(x)),
				push(new Continuation.Alias(x)),
				push(new Continuation.TraceConcat(new TracePart.Enter(c))),
				push(Continuation.ParallelJoin),
				push(lookup(x1)),
				push(jump(acl1)),
				push(capture(3)),
				push(lookup(x2)),
				push(jump(acl1)),
				push(capture(8)),
				push(lookup(x1)));
	}

	/**
	 * Rule Function Bottom: Flow Check. A lookup for <code>x</code> reaching
	 * <code>x =)c( x'</code> first confirms, by looking up the function and
	 * argument at the call site, that control really flowed from this call.
	 */
	private static Stream<Transition> bottomFlowCheck(AnnotatedClause acl1, AnnotatedClause acl0) {
		if (!(acl1 instanceof AnnotatedClause.Exit)) {
			return none();
		}
		AnnotatedClause.Exit exit = (AnnotatedClause.Exit) acl1;
		Clause c = exit.site();
		Body.Application appl = c.body().as(Body.Application.class);
		final Variable x = exit.result();
		if (appl == null || !x.equals(c.variable())) {
			return none();
		}
		AnnotatedClause site = new AnnotatedClause.Unannotated(c);
		return transition(site,
				pop(lookup(x)),
				push(lookup(x)),
				push(Continuation.RealFlow),
				push(jump(acl0)),
				push(capture(2)),
				push(Continuation.ParallelJoin),
				push(lookup(appl.function())),
				push(jump(site)),
				push(capture(3)),
				push(lookup(appl.argument())));
	}

	/**
	 * Rule Function Bottom: Return Variable. Once the flow check succeeds, the
	 * lookup continues for the variable returned from the function body.
	 */
	private static Stream<Transition> bottomReturnVariable(AnnotatedClause acl1, AnnotatedClause acl0) {
		if (!(acl1 instanceof AnnotatedClause.Exit)) {
			return none();
		}
		AnnotatedClause.Exit exit = (AnnotatedClause.Exit) acl1;
		Clause c = exit.site();
		if (c.body().as(Body.Application.class) == null || !exit.result().equals(c.variable())) {
			return none();
		}
		Targeted action = Targeted.functionBottomReturnVariable(exit.result(), exit.returned(), c);
		return transition(acl1, pop(Continuation.RealFlow), popDynamic(action));
	}

	/**
	 * Rule Function Top: Non-Local Variable.
	 */
	private static Stream<Transition> topNonlocalVariable(AnnotatedClause acl1, AnnotatedClause acl0) {
		if (!(acl1 instanceof AnnotatedClause.Enter)) {
			return none();
		}
		AnnotatedClause.Enter enter = (AnnotatedClause.Enter) acl1;
		Clause c = enter.site();
		Body.Application appl = c.body().as(Body.Application.class);
		if (appl == null || !enter.argument().equals(appl.argument())) {
			return none();
		}
		return dynpop(Targeted.functionTopNonlocalVariable(enter.parameter(), c, acl1), acl1);
	}
}
