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
package featherweightddpa.testing;

import static featherweightddpa.pds.Structure.at;
import static featherweightddpa.pds.Structure.capture;
import static featherweightddpa.pds.Structure.jump;
import static featherweightddpa.pds.Structure.lookup;
import static featherweightddpa.pds.Structure.pop;
import static featherweightddpa.pds.Structure.popDynamic;
import static featherweightddpa.pds.Structure.push;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;

import featherweightddpa.core.EdgeFunctions;
import featherweightddpa.core.Graph.AnnotatedClause;
import featherweightddpa.core.Graph.Edge;
import featherweightddpa.core.Stores;
import featherweightddpa.core.Stores.MapStore;
import featherweightddpa.core.Syntax.BinaryOperator;
import featherweightddpa.core.Syntax.Body;
import featherweightddpa.core.Syntax.Clause;
import featherweightddpa.core.Syntax.Expr;
import featherweightddpa.core.Syntax.Identifier;
import featherweightddpa.core.Syntax.Pattern;
import featherweightddpa.core.Syntax.UnaryOperator;
import featherweightddpa.core.Syntax.Value;
import featherweightddpa.core.Syntax.Variable;
import featherweightddpa.extensions.References;
import featherweightddpa.pds.DynamicPops.Kind;
import featherweightddpa.pds.DynamicPops.Targeted;
import featherweightddpa.pds.Structure.Continuation;
import featherweightddpa.pds.Structure.StackAction;
import featherweightddpa.pds.Structure.Terminus;
import featherweightddpa.pds.Structure.TracePart;
import featherweightddpa.pds.Structure.Transition;

/**
 * Tests for the individual rule families of the edge functions. Each test
 * builds a single edge, asks for the transitions from the state standing at its
 * target and then inspects those produced by the rule of interest.
 *
 * @author David J. Pearce
 *
 */
public class EdgeFunctionTests {
	private static final Variable a = new Variable("a");
	private static final Variable b = new Variable("b");
	private static final Variable c = new Variable("c");
	private static final Variable d = new Variable("d");
	private static final Variable f = new Variable("f");
	private static final Variable p = new Variable("p");
	private static final Variable q = new Variable("q");
	private static final Variable r = new Variable("r");
	private static final Variable x = new Variable("x");
	private static final Variable y = new Variable("y");
	private static final Variable z = new Variable("z");

	/**
	 * Some clause following the one of interest. Its shape is irrelevant to the
	 * rules under test.
	 */
	private static final AnnotatedClause NEXT = node(new Clause(q, new Body.VariableBody(z)));

	// ==============================================================
	// Core
	// ==============================================================

	@Test
	public void test_01() {
		// Value alias: z = x
		AnnotatedClause acl1 = node(new Clause(z, new Body.VariableBody(x)));
		List<Transition> ts = popping(transitions(acl1, NEXT), pop(lookup(z)));
		assertEquals(Arrays.asList(transitionTo(acl1, pop(lookup(z)), push(lookup(x)))), ts);
	}

	@Test
	public void test_02() {
		// Stateless clause skip applies to every ordinary clause
		AnnotatedClause acl1 = node(new Clause(z, new Body.Application(f, x)));
		assertTrue(transitions(acl1, NEXT).contains(transitionTo(acl1, popDynamic(Targeted.statelessClauseSkip(z)))));
	}

	@Test
	public void test_03() {
		// Block markers are skipped without touching the stack
		AnnotatedClause acl1 = new AnnotatedClause.BlockStart(z);
		List<Transition> ts = transitions(acl1, NEXT);
		assertTrue(ts.contains(transitionTo(acl1)));
		assertTrue(ts.contains(transitionTo(NEXT, popDynamic(Targeted.of(Kind.CAPTURE_1_OF_3)))));
		assertTrue(ts.contains(transitionTo(NEXT, popDynamic(Targeted.of(Kind.STORE_ALIAS_1_OF_3)))));
	}

	@Test
	public void test_04() {
		// Store processing pops are produced at the target for any edge
		AnnotatedClause acl1 = new AnnotatedClause.BlockEnd(z);
		List<Transition> ts = transitions(acl1, NEXT);
		for (Kind k : new Kind[] { Kind.DISCOVERED_STORE_2_OF_2, Kind.INTERMEDIATE_STORE, Kind.STORE_SUFFIX_1_OF_2,
				Kind.STORE_PARALLEL_JOIN_1_OF_3, Kind.STORE_SERIAL_JOIN_1_OF_3 }) {
			assertTrue(ts.contains(transitionTo(NEXT, popDynamic(Targeted.of(k)))));
		}
	}

	// ==============================================================
	// Functions
	// ==============================================================

	@Test
	public void test_05() {
		// Function top: parameter variable for r = f a entering p
		Clause site = new Clause(r, new Body.Application(f, a));
		AnnotatedClause enter = new AnnotatedClause.Enter(p, a, site);
		List<Transition> ts = popping(transitions(enter, NEXT), pop(lookup(p)));
		Transition expected = transitionTo(enter,
				pop(lookup(p)),
				push(new Continuation.Alias(p)),
				push(new Continuation.TraceConcat(new TracePart.Enter(site))),
				push(Continuation.ParallelJoin),
				push(lookup(a)),
				push(jump(enter)),
				push(capture(3)),
				push(lookup(f)),
				push(jump(enter)),
				push(capture(8)),
				push(lookup(a)));
		assertEquals(Arrays.asList(expected), ts);
	}

	@Test
	public void test_06() {
		// Function top: argument must agree with call site
		Clause site = new Clause(r, new Body.Application(f, a));
		AnnotatedClause enter = new AnnotatedClause.Enter(p, b, site);
		List<Transition> ts = transitions(enter, NEXT);
		assertTrue(popping(ts, pop(lookup(p))).isEmpty());
		assertFalse(ts.contains(transitionTo(enter, popDynamic(Targeted.functionTopNonlocalVariable(p, site, enter)))));
	}

	@Test
	public void test_07() {
		// Function top: non-local variable
		Clause site = new Clause(r, new Body.Application(f, a));
		AnnotatedClause enter = new AnnotatedClause.Enter(p, a, site);
		List<Transition> ts = transitions(enter, NEXT);
		assertTrue(ts.contains(transitionTo(enter, popDynamic(Targeted.functionTopNonlocalVariable(p, site, enter)))));
	}

	@Test
	public void test_08() {
		// Function bottom: flow check for r = f a returning b
		Clause site = new Clause(r, new Body.Application(f, a));
		AnnotatedClause exit = new AnnotatedClause.Exit(r, b, site);
		AnnotatedClause call = node(site);
		List<Transition> ts = popping(transitions(exit, NEXT), pop(lookup(r)));
		Transition expected = transitionTo(call,
				pop(lookup(r)),
				push(lookup(r)),
				push(Continuation.RealFlow),
				push(jump(NEXT)),
				push(capture(2)),
				push(Continuation.ParallelJoin),
				push(lookup(f)),
				push(jump(call)),
				push(capture(3)),
				push(lookup(a)));
		assertEquals(Arrays.asList(expected), ts);
	}

	@Test
	public void test_09() {
		// Function bottom: return variable
		Clause site = new Clause(r, new Body.Application(f, a));
		AnnotatedClause exit = new AnnotatedClause.Exit(r, b, site);
		List<Transition> ts = transitions(exit, NEXT);
		assertTrue(ts.contains(transitionTo(exit, pop(Continuation.RealFlow),
				popDynamic(Targeted.functionBottomReturnVariable(r, b, site)))));
	}

	@Test
	public void test_10() {
		// Function bottom: result must be bound by call site
		Clause site = new Clause(r, new Body.Application(f, a));
		AnnotatedClause exit = new AnnotatedClause.Exit(z, b, site);
		List<Transition> ts = transitions(exit, NEXT);
		assertTrue(popping(ts, pop(lookup(z))).isEmpty());
		assertFalse(ts.contains(transitionTo(exit, pop(Continuation.RealFlow),
				popDynamic(Targeted.functionBottomReturnVariable(z, b, site)))));
	}

	// ==============================================================
	// Conditionals
	// ==============================================================

	@Test
	public void test_11() {
		// Conditional top: subject positive
		Clause cond = conditional(x, Pattern.Int);
		AnnotatedClause enter = new AnnotatedClause.Enter(a, x, cond);
		List<Transition> ts = transitions(enter, NEXT);
		Continuation matches = new Continuation.Matches(Pattern.Int);
		assertEquals(Arrays.asList(transitionTo(enter, pop(lookup(a)), push(matches), push(lookup(x)))),
				popping(ts, pop(lookup(a))));
		assertEquals(Arrays.asList(transitionTo(enter, pop(lookup(x)), push(matches), push(lookup(x)))),
				popping(ts, pop(lookup(x))));
		assertTrue(pushing(ts, push(new Continuation.Antimatches(Pattern.Int))).isEmpty());
	}

	@Test
	public void test_12() {
		// Conditional top: subject negative
		Clause cond = conditional(x, Pattern.Str);
		AnnotatedClause enter = new AnnotatedClause.Enter(c, x, cond);
		List<Transition> ts = transitions(enter, NEXT);
		Continuation antimatches = new Continuation.Antimatches(Pattern.Str);
		assertEquals(Arrays.asList(transitionTo(enter, pop(lookup(c)), push(antimatches), push(lookup(x)))),
				popping(ts, pop(lookup(c))));
		assertTrue(pushing(ts, push(new Continuation.Matches(Pattern.Str))).isEmpty());
	}

	@Test
	public void test_13() {
		// Conditional top: non-subject variable
		Clause cond = conditional(x, Pattern.Int);
		AnnotatedClause enter = new AnnotatedClause.Enter(a, x, cond);
		List<Transition> ts = transitions(enter, NEXT);
		Targeted positive = Targeted.conditionalTopNonsubjectVariable(true, a, x, enter, Pattern.Int);
		Targeted negative = Targeted.conditionalTopNonsubjectVariable(false, a, x, enter, Pattern.Int);
		assertTrue(ts.contains(transitionTo(node(cond), popDynamic(positive))));
		assertFalse(ts.contains(transitionTo(node(cond), popDynamic(negative))));
	}

	@Test
	public void test_14() {
		// Conditional top: subject must agree with entry
		Clause cond = conditional(x, Pattern.Int);
		AnnotatedClause enter = new AnnotatedClause.Enter(a, y, cond);
		List<Transition> ts = transitions(enter, NEXT);
		assertTrue(pushing(ts, push(new Continuation.Matches(Pattern.Int))).isEmpty());
	}

	@Test
	public void test_15() {
		// Conditional bottom: return positive
		Clause cond = conditional(x, Pattern.Int);
		AnnotatedClause exit = new AnnotatedClause.Exit(z, b, cond);
		List<Transition> ts = popping(transitions(exit, NEXT), pop(lookup(z)));
		Transition expected = transitionTo(node(cond),
				pop(lookup(z)),
				push(Continuation.ParallelJoin),
				push(lookup(b)),
				push(jump(exit)),
				push(capture(3)),
				push(new Continuation.Matches(Pattern.Int)),
				push(lookup(x)));
		assertEquals(Arrays.asList(expected), ts);
	}

	@Test
	public void test_16() {
		// Conditional bottom: return negative
		Clause cond = conditional(x, Pattern.Int);
		AnnotatedClause exit = new AnnotatedClause.Exit(z, d, cond);
		List<Transition> ts = popping(transitions(exit, NEXT), pop(lookup(z)));
		assertEquals(1, ts.size());
		assertEquals(push(new Continuation.Antimatches(Pattern.Int)), ts.get(0).actions().get(5));
	}

	// ==============================================================
	// Records
	// ==============================================================

	@Test
	public void test_17() {
		Identifier l = new Identifier("l");
		AnnotatedClause acl1 = node(new Clause(z, new Body.Projection(x, l)));
		List<Transition> ts = transitions(acl1, NEXT);
		assertEquals(Arrays.asList(transitionTo(acl1, pop(lookup(z)), push(new Continuation.Project(l)), push(lookup(x)))),
				popping(ts, pop(lookup(z))));
		assertTrue(ts.contains(transitionTo(NEXT, popDynamic(Targeted.of(Kind.RECORD_PROJECTION_STOP_1_OF_2)))));
		assertTrue(ts.contains(transitionTo(NEXT, popDynamic(Targeted.of(Kind.FILTER_IMMEDIATE_1_OF_2)))));
		assertTrue(ts.contains(
				transitionTo(NEXT, popDynamic(Targeted.of(Kind.FILTER_NONEMPTY_RECORD_POSITIVE_1_OF_2, NEXT)))));
		assertTrue(ts.contains(
				transitionTo(NEXT, popDynamic(Targeted.of(Kind.FILTER_NONEMPTY_RECORD_NEGATIVE_1_OF_2, NEXT)))));
	}

	// ==============================================================
	// References
	// ==============================================================

	@Test
	public void test_18() {
		// Update is empty record
		Stores.InterningRegistry<MapStore> registry = new Stores.InterningRegistry<>();
		EdgeFunctions<MapStore> ddpa = EdgeFunctions.create(Stores.MAP_OPERATIONS, registry);
		AnnotatedClause acl1 = node(new Clause(z, new Body.Update(x, y)));
		List<Transition> ts = popping(transitions(ddpa, acl1, NEXT), pop(lookup(z)));
		assertEquals(1, ts.size());
		Continuation.Store s = (Continuation.Store) ((StackAction.Push) ts.get(0).actions().get(1)).element();
		assertEquals(Stores.MAP_OPERATIONS.singleton(z, References.EMPTY_RECORD), s.witness().store());
		assertEquals(1, registry.size());
	}

	@Test
	public void test_19() {
		// Dereference start and stop
		AnnotatedClause acl1 = node(new Clause(z, new Body.Dereference(x)));
		List<Transition> ts = transitions(acl1, NEXT);
		assertEquals(
				Arrays.asList(transitionTo(acl1, pop(lookup(z)), push(Continuation.Dereference), push(lookup(x)))),
				popping(ts, pop(lookup(z))));
		assertTrue(ts.contains(transitionTo(NEXT, popDynamic(Targeted.of(Kind.DEREFERENCE_STOP)))));
	}

	@Test
	public void test_20() {
		// Alias analysis on update
		AnnotatedClause acl1 = node(new Clause(z, new Body.Update(x, y)));
		List<Transition> ts = transitions(acl1, NEXT);
		assertTrue(ts.contains(transitionTo(acl1, popDynamic(Targeted.of(Kind.ALIAS_ANALYSIS_START, acl1, NEXT)))));
		assertTrue(ts.contains(transitionTo(acl1, pop(Continuation.AliasCheck),
				popDynamic(Targeted.of(Kind.MAY_NOT_ALIAS_1_OF_3)))));
		assertTrue(ts.contains(transitionTo(acl1, pop(Continuation.AliasCheck), popDynamic(Targeted.mayAlias(y)))));
		assertEquals(4, popping(ts, pop(Continuation.AliasCheck)).size());
	}

	@Test
	public void test_21() {
		// Alias analysis only on update
		AnnotatedClause acl1 = node(new Clause(z, new Body.Dereference(x)));
		assertTrue(popping(transitions(acl1, NEXT), pop(Continuation.AliasCheck)).isEmpty());
	}

	// ==============================================================
	// Side Effects
	// ==============================================================

	@Test
	public void test_22() {
		// Immediate clause skips apply to immediate clauses other than updates
		AnnotatedClause alias = node(new Clause(z, new Body.VariableBody(x)));
		AnnotatedClause update = node(new Clause(z, new Body.Update(x, y)));
		Transition skip = transitionTo(alias, popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_IMMEDIATE_CLAUSE_SKIP)));
		Transition stateful = transitionTo(alias, popDynamic(Targeted.of(Kind.STATEFUL_IMMEDIATE_CLAUSE_SKIP, z)));
		assertTrue(transitions(alias, NEXT).contains(skip));
		assertTrue(transitions(alias, NEXT).contains(stateful));
		List<Transition> ts = transitions(update, NEXT);
		assertTrue(ts.stream().noneMatch(t -> t.actions().contains(
				popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_IMMEDIATE_CLAUSE_SKIP)))));
		assertTrue(ts.stream().noneMatch(t -> t.actions().contains(
				popDynamic(Targeted.of(Kind.STATEFUL_IMMEDIATE_CLAUSE_SKIP, z)))));
	}

	@Test
	public void test_23() {
		// Application isn't immediate
		AnnotatedClause call = node(new Clause(r, new Body.Application(f, a)));
		Transition skip = transitionTo(call, popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_IMMEDIATE_CLAUSE_SKIP)));
		assertFalse(transitions(call, NEXT).contains(skip));
	}

	@Test
	public void test_24() {
		// Side effect search through function exit
		Clause site = new Clause(r, new Body.Application(f, a));
		AnnotatedClause exit = new AnnotatedClause.Exit(r, b, site);
		List<Transition> ts = transitions(exit, NEXT);
		assertTrue(ts.contains(transitionTo(node(site),
				popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_START_FUNCTION_FLOW_CHECK, exit, NEXT)))));
		assertTrue(ts.contains(transitionTo(exit, pop(Continuation.RealFlow),
				popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_START_FUNCTION_FLOW_VALIDATED_1_OF_2, exit, NEXT)))));
		assertTrue(ts.contains(transitionTo(node(site),
				popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_FUNCTION_BOTTOM_FLOW_CHECK, NEXT, site)))));
		assertTrue(ts.contains(transitionTo(exit, pop(Continuation.RealFlow),
				popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_FUNCTION_BOTTOM_RETURN_VARIABLE_1_OF_2, exit)))));
		assertEquals(3, popping(ts, pop(Continuation.RealFlow)).size());
	}

	@Test
	public void test_25() {
		// Side effect search through function entry
		Clause site = new Clause(r, new Body.Application(f, a));
		AnnotatedClause enter = new AnnotatedClause.Enter(p, a, site);
		List<Transition> ts = transitions(enter, NEXT);
		assertTrue(ts.contains(transitionTo(enter, popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_FUNCTION_TOP, site)))));
		assertFalse(ts.contains(transitionTo(enter, popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_CONDITIONAL_TOP)))));
		for (Kind k : new Kind[] { Kind.SIDE_EFFECT_SEARCH_FUNCTION_WIRING_JOIN_DEFER_1_OF_3,
				Kind.SIDE_EFFECT_SEARCH_CONDITIONAL_WIRING_JOIN_DEFER_1_OF_2,
				Kind.SIDE_EFFECT_SEARCH_JOIN_COMPRESSION_1_OF_3 }) {
			assertTrue(ts.contains(transitionTo(NEXT, popDynamic(Targeted.of(k)))));
		}
	}

	@Test
	public void test_26() {
		// Side effect search through conditional exit
		Clause cond = conditional(x, Pattern.Int);
		AnnotatedClause positive = new AnnotatedClause.Exit(z, b, cond);
		AnnotatedClause negative = new AnnotatedClause.Exit(z, d, cond);
		List<Transition> ps = transitions(positive, NEXT);
		List<Transition> ns = transitions(negative, NEXT);
		assertTrue(ps.contains(transitionTo(node(cond),
				popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_START_CONDITIONAL_POSITIVE, positive, NEXT)))));
		assertFalse(ps.contains(transitionTo(node(cond),
				popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_START_CONDITIONAL_NEGATIVE, positive, NEXT)))));
		assertTrue(ns.contains(transitionTo(node(cond),
				popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_START_CONDITIONAL_NEGATIVE, negative, NEXT)))));
		assertFalse(ns.contains(transitionTo(node(cond),
				popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_START_CONDITIONAL_POSITIVE, negative, NEXT)))));
	}

	@Test
	public void test_34() {
		// Both search steps through a conditional exit are guarded on the match branch
		Clause cond = conditional(x, Pattern.Int);
		AnnotatedClause positive = new AnnotatedClause.Exit(z, b, cond);
		AnnotatedClause negative = new AnnotatedClause.Exit(z, d, cond);
		List<Transition> ps = transitions(positive, NEXT);
		List<Transition> ns = transitions(negative, NEXT);
		assertTrue(ps.contains(
				transitionTo(positive, popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_CONDITIONAL_POSITIVE, positive)))));
		assertTrue(ps.contains(
				transitionTo(positive, popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_CONDITIONAL_NEGATIVE, positive)))));
		assertFalse(ns.contains(
				transitionTo(negative, popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_CONDITIONAL_POSITIVE, negative)))));
		assertFalse(ns.contains(
				transitionTo(negative, popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_CONDITIONAL_NEGATIVE, negative)))));
	}

	@Test
	public void test_27() {
		// Side effect search through conditional entry
		Clause cond = conditional(x, Pattern.Int);
		AnnotatedClause enter = new AnnotatedClause.Enter(a, x, cond);
		List<Transition> ts = transitions(enter, NEXT);
		assertTrue(ts.contains(transitionTo(enter, popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_CONDITIONAL_TOP)))));
	}

	@Test
	public void test_28() {
		// Side effect search alias analysis and escape
		AnnotatedClause acl1 = node(new Clause(z, new Body.Update(x, y)));
		List<Transition> ts = transitions(acl1, NEXT);
		assertTrue(ts.contains(transitionTo(acl1,
				popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_ALIAS_ANALYSIS_START, acl1, NEXT)))));
		assertTrue(ts.contains(transitionTo(acl1, pop(Continuation.AliasCheck),
				popDynamic(Targeted.of(Kind.SIDE_EFFECT_SEARCH_MAY_ALIAS_1_OF_3, y)))));
		for (Kind k : new Kind[] { Kind.SIDE_EFFECT_SEARCH_ESCAPE_FRAME,
				Kind.SIDE_EFFECT_SEARCH_ESCAPE_VARIABLE_CONCATENATION_1_OF_2,
				Kind.SIDE_EFFECT_SEARCH_ESCAPE_STORE_JOIN_1_OF_2, Kind.SIDE_EFFECT_SEARCH_ESCAPE_COMPLETE_1_OF_3,
				Kind.SIDE_EFFECT_SEARCH_NOT_FOUND_SHALLOW_1_OF_2, Kind.SIDE_EFFECT_SEARCH_NOT_FOUND_DEEP_1_OF_4 }) {
			assertTrue(ts.contains(transitionTo(NEXT, popDynamic(Targeted.of(k)))));
		}
	}

	// ==============================================================
	// Operations
	// ==============================================================

	@Test
	public void test_29() {
		AnnotatedClause acl1 = node(new Clause(z, new Body.BinaryOperation(x, BinaryOperator.PLUS, y)));
		List<Transition> ts = transitions(acl1, NEXT);
		Transition expected = transitionTo(acl1,
				pop(lookup(z)),
				push(Continuation.BinaryOperation),
				push(jump(NEXT)),
				push(capture(2)),
				push(lookup(y)),
				push(jump(acl1)),
				push(capture(5)),
				push(lookup(x)));
		assertEquals(Arrays.asList(expected), popping(ts, pop(lookup(z))));
		assertEquals(Arrays.asList(transitionTo(acl1, pop(Continuation.BinaryOperation),
				popDynamic(Targeted.binaryOperationStop(z, BinaryOperator.PLUS)))),
				popping(ts, pop(Continuation.BinaryOperation)));
	}

	@Test
	public void test_30() {
		AnnotatedClause acl1 = node(new Clause(z, new Body.UnaryOperation(UnaryOperator.NOT, x)));
		List<Transition> ts = transitions(acl1, NEXT);
		Transition expected = transitionTo(acl1,
				pop(lookup(z)),
				push(Continuation.UnaryOperation),
				push(jump(NEXT)),
				push(capture(2)),
				push(lookup(x)));
		assertEquals(Arrays.asList(expected), popping(ts, pop(lookup(z))));
		assertEquals(Arrays.asList(transitionTo(acl1, pop(Continuation.UnaryOperation),
				popDynamic(Targeted.unaryOperationStop(z, UnaryOperator.NOT)))),
				popping(ts, pop(Continuation.UnaryOperation)));
	}

	// ==============================================================
	// Engine
	// ==============================================================

	@Test
	public void test_31() {
		// Rules after the first result are not evaluated when not needed
		AtomicInteger calls = new AtomicInteger();
		EdgeFunctions.Extension counter = new EdgeFunctions.Extension() {
			@Override
			public EdgeFunctions.Rule[] rules() {
				return new EdgeFunctions.Rule[] { (acl1, acl0) -> {
					calls.incrementAndGet();
					return Stream.empty();
				} };
			}
		};
		EdgeFunctions<MapStore> ddpa = new EdgeFunctions<>(Stores.MAP_OPERATIONS, new Stores.InterningRegistry<>(),
				counter);
		AnnotatedClause acl1 = node(new Clause(z, new Body.VariableBody(x)));
		assertTrue(ddpa.transitions(new Edge(acl1, NEXT), at(NEXT)).findFirst().isPresent());
		assertEquals(0, calls.get());
		ddpa.transitions(new Edge(acl1, NEXT), at(NEXT)).count();
		assertEquals(1, calls.get());
	}

	@Test
	public void test_32() {
		// Extensions are bound to their engine
		EdgeFunctions.Extension ext = new EdgeFunctions.Extension() {
			@Override
			public EdgeFunctions.Rule[] rules() {
				assertNotNull(self);
				return new EdgeFunctions.Rule[0];
			}
		};
		EdgeFunctions<MapStore> ddpa = new EdgeFunctions<>(Stores.MAP_OPERATIONS, new Stores.InterningRegistry<>(), ext);
		assertTrue(ddpa.size() > 0);
	}

	@Test
	public void test_33() {
		// Tracing prints each step
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		EdgeFunctions<MapStore> ddpa = EdgeFunctions.create(Stores.MAP_OPERATIONS, new Stores.InterningRegistry<>());
		ddpa.setTrace(new PrintStream(bout, true));
		AnnotatedClause acl1 = node(new Clause(z, new Body.VariableBody(x)));
		List<Transition> ts = transitions(ddpa, acl1, NEXT);
		String output = bout.toString();
		assertTrue(output.contains("===>"));
		assertTrue(output.contains("Lookup(x)"));
		assertEquals(transitions(acl1, NEXT), ts);
		// Now disable it
		ddpa.setTrace(null);
		bout.reset();
		transitions(ddpa, acl1, NEXT);
		assertEquals(0, bout.size());
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static AnnotatedClause node(Clause c) {
		return new AnnotatedClause.Unannotated(c);
	}

	/**
	 * Construct <code>z = x ~ p ? fun a -> (b = a) : fun c -> (d = c)</code>.
	 */
	private static Clause conditional(Variable subject, Pattern pattern) {
		Value.Function match = new Value.Function(a, new Expr(new Clause(b, new Body.VariableBody(a))));
		Value.Function antimatch = new Value.Function(c, new Expr(new Clause(d, new Body.VariableBody(c))));
		return new Clause(z, new Body.Conditional(subject, pattern, match, antimatch));
	}

	private static List<Transition> transitions(AnnotatedClause acl1, AnnotatedClause acl0) {
		EdgeFunctions<MapStore> ddpa = EdgeFunctions.create(Stores.MAP_OPERATIONS, new Stores.InterningRegistry<>());
		return transitions(ddpa, acl1, acl0);
	}

	private static List<Transition> transitions(EdgeFunctions<MapStore> ddpa, AnnotatedClause acl1,
			AnnotatedClause acl0) {
		return ddpa.transitions(new Edge(acl1, acl0), at(acl0)).collect(Collectors.toList());
	}

	private static Transition transitionTo(AnnotatedClause destination, StackAction... actions) {
		return new Transition(new Terminus.Static(at(destination)), actions);
	}

	/**
	 * Select those transitions whose first action is a given one.
	 */
	private static List<Transition> popping(List<Transition> ts, StackAction first) {
		return ts.stream().filter(t -> !t.actions().isEmpty() && t.actions().get(0).equals(first))
				.collect(Collectors.toList());
	}

	/**
	 * Select those transitions which perform a given action anywhere.
	 */
	private static List<Transition> pushing(List<Transition> ts, StackAction action) {
		return ts.stream().filter(t -> t.actions().contains(action)).collect(Collectors.toList());
	}
}
