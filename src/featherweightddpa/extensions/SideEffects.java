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
import static featherweightddpa.pds.Structure.pop;
import static featherweightddpa.pds.Structure.popDynamic;

import java.util.stream.Stream;

import featherweightddpa.core.EdgeFunctions;
import featherweightddpa.core.Graph;
import featherweightddpa.core.Graph.AnnotatedClause;
import featherweightddpa.core.Syntax.Body;
import featherweightddpa.core.Syntax.Clause;
import featherweightddpa.pds.DynamicPops.Kind;
import featherweightddpa.pds.DynamicPops.Targeted;
import featherweightddpa.pds.Structure.Continuation;
import featherweightddpa.pds.Structure.Transition;

/**
 * Rules for the side effect search. Having found the value of a cell at some
 * update, the lookup must confirm that no later update between that point and
 * the dereference could have overwritten it. This search walks backwards over
 * the graph, entering and leaving function bodies and conditional branches,
 * until it either escapes or determines that no such update exists. Almost all
 * of the real work happens in the dynamic pop handlers. The rules here only
 * recognise where the search may begin and where it must step in or out of a
 * body.
 *
 * @author David J. Pearce
 *
 */
public class SideEffects extends EdgeFunctions.Extension {

	@Override
	public EdgeFunctions.Rule[] rules() {
		return new EdgeFunctions.Rule[] {
				SideEffects::statefulImmediateClauseSkip,
				// Starting points
				SideEffects::startFunctionFlowCheck,
				SideEffects::startFunctionFlowValidated,
				(acl1, acl0) -> startConditional(acl1, acl0, true),
				(acl1, acl0) -> startConditional(acl1, acl0, false),
				// Search
				SideEffects::immediateClauseSkip,
				SideEffects::functionBottomFlowCheck,
				SideEffects::functionBottomReturnVariable,
				SideEffects::functionTop,
				(acl1, acl0) -> conditional(acl1, true),
				(acl1, acl0) -> conditional(acl1, false),
				SideEffects::conditionalTop,
				(acl1, acl0) -> afterEnter(acl1, acl0, Kind.SIDE_EFFECT_SEARCH_FUNCTION_WIRING_JOIN_DEFER_1_OF_3),
				(acl1, acl0) -> afterEnter(acl1, acl0, Kind.SIDE_EFFECT_SEARCH_CONDITIONAL_WIRING_JOIN_DEFER_1_OF_2),
				(acl1, acl0) -> afterEnter(acl1, acl0, Kind.SIDE_EFFECT_SEARCH_JOIN_COMPRESSION_1_OF_3),
				// Alias analysis within the search
				SideEffects::aliasAnalysisStart,
				SideEffects::mayNotAlias,
				SideEffects::mayAlias,
				// Escape
				(acl1, acl0) -> dynpop(Kind.SIDE_EFFECT_SEARCH_ESCAPE_FRAME, acl0),
				(acl1, acl0) -> dynpop(Kind.SIDE_EFFECT_SEARCH_ESCAPE_VARIABLE_CONCATENATION_1_OF_2, acl0),
				(acl1, acl0) -> dynpop(Kind.SIDE_EFFECT_SEARCH_ESCAPE_STORE_JOIN_1_OF_2, acl0),
				// The destination here is never used, since the handler finishes with a jump.
				(acl1, acl0) -> dynpop(Kind.SIDE_EFFECT_SEARCH_ESCAPE_COMPLETE_1_OF_3, acl0),
				// Not found
				(acl1, acl0) -> dynpop(Kind.SIDE_EFFECT_SEARCH_NOT_FOUND_SHALLOW_1_OF_2, acl0),
				(acl1, acl0) -> dynpop(Kind.SIDE_EFFECT_SEARCH_NOT_FOUND_DEEP_1_OF_4, acl0) };
	}

	/**
	 * Rule Stateful Immediate Clause Skip. Immediate clauses other than updates
	 * cannot affect the heap, and a lookup may step over them even when a
	 * dereference is pending.
	 */
	private static Stream<Transition> statefulImmediateClauseSkip(AnnotatedClause acl1, AnnotatedClause acl0) {
		Clause c = Graph.clauseOf(acl1);
		if (c == null || !isSkippable(acl1)) {
			return none();
		}
		return dynpop(Targeted.of(Kind.STATEFUL_IMMEDIATE_CLAUSE_SKIP, c.variable()), acl1);
	}

	// ==============================================================
	// Starting points
	// ==============================================================

	private static Stream<Transition> startFunctionFlowCheck(AnnotatedClause acl1, AnnotatedClause acl0) {
		Clause c = applicationExited(acl1);
		if (c == null) {
			return none();
		}
		return dynpop(Targeted.of(Kind.SIDE_EFFECT_SEARCH_START_FUNCTION_FLOW_CHECK, acl1, acl0),
				new AnnotatedClause.Unannotated(c));
	}

	private static Stream<Transition> startFunctionFlowValidated(AnnotatedClause acl1, AnnotatedClause acl0) {
		if (applicationExited(acl1) == null) {
			return none();
		}
		Targeted action = Targeted.of(Kind.SIDE_EFFECT_SEARCH_START_FUNCTION_FLOW_VALIDATED_1_OF_2, acl1, acl0);
		return transition(acl1, pop(Continuation.RealFlow), popDynamic(action));
	}

	private static Stream<Transition> startConditional(AnnotatedClause acl1, AnnotatedClause acl0, boolean positive) {
		Clause c = branchExited(acl1, positive);
		if (c == null) {
			return none();
		}
		Kind kind = positive ? Kind.SIDE_EFFECT_SEARCH_START_CONDITIONAL_POSITIVE
				: Kind.SIDE_EFFECT_SEARCH_START_CONDITIONAL_NEGATIVE;
		return dynpop(Targeted.of(kind, acl1, acl0), new AnnotatedClause.Unannotated(c));
	}

	// ==============================================================
	// Search
	// ==============================================================

	private static Stream<Transition> immediateClauseSkip(AnnotatedClause acl1, AnnotatedClause acl0) {
		if (!isSkippable(acl1)) {
			return none();
		}
		return dynpop(Kind.SIDE_EFFECT_SEARCH_IMMEDIATE_CLAUSE_SKIP, acl1);
	}

	private static Stream<Transition> functionBottomFlowCheck(AnnotatedClause acl1, AnnotatedClause acl0) {
		Clause c = applicationExited(acl1);
		if (c == null) {
			return none();
		}
		return dynpop(Targeted.of(Kind.SIDE_EFFECT_SEARCH_FUNCTION_BOTTOM_FLOW_CHECK, acl0, c),
				new AnnotatedClause.Unannotated(c));
	}

	private static Stream<Transition> functionBottomReturnVariable(AnnotatedClause acl1, AnnotatedClause acl0) {
		if (applicationExited(acl1) == null) {
			return none();
		}
		Targeted action = Targeted.of(Kind.SIDE_EFFECT_SEARCH_FUNCTION_BOTTOM_RETURN_VARIABLE_1_OF_2, acl1);
		return transition(acl1, pop(Continuation.RealFlow), popDynamic(action));
	}

	private static Stream<Transition> functionTop(AnnotatedClause acl1, AnnotatedClause acl0) {
		Clause c = entered(acl1, Body.Application.class);
		if (c == null) {
			return none();
		}
		return dynpop(Targeted.of(Kind.SIDE_EFFECT_SEARCH_FUNCTION_TOP, c), acl1);
	}

	/**
	 * Rule Side Effect Search: Conditional Positive / Negative. Both steps are
	 * guarded on the exit carrying the variable returned by the match branch;
	 * the handler for each tag decides which branch is searched.
	 */
	private static Stream<Transition> conditional(AnnotatedClause acl1, boolean positive) {
		if (branchExited(acl1, true) == null) {
			return none();
		}
		Kind kind = positive ? Kind.SIDE_EFFECT_SEARCH_CONDITIONAL_POSITIVE
				: Kind.SIDE_EFFECT_SEARCH_CONDITIONAL_NEGATIVE;
		return dynpop(Targeted.of(kind, acl1), acl1);
	}

	private static Stream<Transition> conditionalTop(AnnotatedClause acl1, AnnotatedClause acl0) {
		if (entered(acl1, Body.Conditional.class) == null) {
			return none();
		}
		return dynpop(Kind.SIDE_EFFECT_SEARCH_CONDITIONAL_TOP, acl1);
	}

	/**
	 * Handle the join rules which apply when the search leaves a body through any
	 * entry node.
	 */
	private static Stream<Transition> afterEnter(AnnotatedClause acl1, AnnotatedClause acl0, Kind kind) {
		if (!(acl1 instanceof AnnotatedClause.Enter)) {
			return none();
		}
		return dynpop(kind, acl0);
	}

	private static Stream<Transition> aliasAnalysisStart(AnnotatedClause acl1, AnnotatedClause acl0) {
		if (bodyOf(acl1, Body.Update.class) == null) {
			return none();
		}
		return dynpop(Targeted.of(Kind.SIDE_EFFECT_SEARCH_ALIAS_ANALYSIS_START, acl1, acl0), acl1);
	}

	private static Stream<Transition> mayNotAlias(AnnotatedClause acl1, AnnotatedClause acl0) {
		if (bodyOf(acl1, Body.Update.class) == null) {
			return none();
		}
		Targeted action = Targeted.of(Kind.SIDE_EFFECT_SEARCH_MAY_NOT_ALIAS_1_OF_3);
		return transition(acl1, pop(Continuation.AliasCheck), popDynamic(action));
	}

	private static Stream<Transition> mayAlias(AnnotatedClause acl1, AnnotatedClause acl0) {
		Body.Update b = bodyOf(acl1, Body.Update.class);
		if (b == null) {
			return none();
		}
		Targeted action = Targeted.of(Kind.SIDE_EFFECT_SEARCH_MAY_ALIAS_1_OF_3, b.value());
		return transition(acl1, pop(Continuation.AliasCheck), popDynamic(action));
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static boolean isSkippable(AnnotatedClause acl) {
		return Graph.isImmediate(acl) && !Graph.isStatefulUpdate(acl);
	}

	/**
	 * Get the call site of an exit node leaving a function call, or null.
	 *
	 * @param acl
	 * @return
	 */
	private static Clause applicationExited(AnnotatedClause acl) {
		if (!(acl instanceof AnnotatedClause.Exit)) {
			return null;
		}
		Clause c = ((AnnotatedClause.Exit) acl).site();
		return c.body().as(Body.Application.class) == null ? null : c;
	}

	/**
	 * Get the site of an exit node leaving the given branch of a conditional, or
	 * null. The variable returned through the exit must be that returned by the
	 * branch body.
	 *
	 * @param acl
	 * @param positive
	 * @return
	 */
	private static Clause branchExited(AnnotatedClause acl, boolean positive) {
		if (!(acl instanceof AnnotatedClause.Exit)) {
			return null;
		}
		AnnotatedClause.Exit exit = (AnnotatedClause.Exit) acl;
		Clause c = exit.site();
		Body.Conditional cond = c.body().as(Body.Conditional.class);
		if (cond == null || !exit.returned().equals(Conditionals.branch(cond, positive).body().returnVariable())) {
			return null;
		}
		return c;
	}

	private static Clause entered(AnnotatedClause acl, Class<? extends Body> kind) {
		if (!(acl instanceof AnnotatedClause.Enter)) {
			return null;
		}
		Clause c = ((AnnotatedClause.Enter) acl).site();
		return c.body().as(kind) == null ? null : c;
	}
}
