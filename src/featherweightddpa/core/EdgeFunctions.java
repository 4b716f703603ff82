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
package featherweightddpa.core;

import static featherweightddpa.pds.Structure.at;
import static featherweightddpa.pds.Structure.lookup;
import static featherweightddpa.pds.Structure.pop;
import static featherweightddpa.pds.Structure.popDynamic;
import static featherweightddpa.pds.Structure.push;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import featherweightddpa.core.Graph.AnnotatedClause;
import featherweightddpa.core.Graph.Edge;
import featherweightddpa.core.Graph.EndOfBlockMap;
import featherweightddpa.core.Syntax.Body;
import featherweightddpa.core.Syntax.Clause;
import featherweightddpa.core.Syntax.Value;
import featherweightddpa.core.Syntax.Variable;
import featherweightddpa.extensions.Conditionals;
import featherweightddpa.extensions.Functions;
import featherweightddpa.extensions.Operations;
import featherweightddpa.extensions.Records;
import featherweightddpa.extensions.References;
import featherweightddpa.extensions.SideEffects;
import featherweightddpa.pds.DynamicPops;
import featherweightddpa.pds.DynamicPops.Kind;
import featherweightddpa.pds.DynamicPops.Targeted;
import featherweightddpa.pds.DynamicPops.Untargeted;
import featherweightddpa.pds.Structure;
import featherweightddpa.pds.Structure.Continuation;
import featherweightddpa.pds.Structure.StackAction;
import featherweightddpa.pds.Structure.Terminus;
import featherweightddpa.pds.Structure.Transition;
import featherweightddpa.util.InvariantFailure;
import featherweightddpa.util.Tracing;

/**
 * Translates the DDPA graph into the pushdown system explored by the
 * reachability analysis. For a given edge and automaton state, this produces
 * every transition licensed by the DDPA rules at that point. Each rule is
 * implemented by a separate method which either contributes nothing (when its
 * edge does not have the required shape) or contributes one or more
 * transitions. The closure of any dynamic pops generated here is the
 * responsibility of the dynamic pop handlers.
 *
 * @author David J. Pearce
 *
 * @param <S> The representation of abstract stores
 */
public class EdgeFunctions<S> {
	/**
	 * Signals that a lookup must fail because the end of block map is incomplete.
	 */
	public final static String MISSING_END_OF_BLOCK = "Abstract clause lacks end-of-block mapping";

	private final Stores.Operations<S> operations;
	private final Stores.Registry<S> registry;
	/**
	 * The complete rule catalogue, in order. This consists of the core rules
	 * followed by those of each extension.
	 */
	private final Rule[] catalogue;
	/**
	 * Destination for debugging output, or null if tracing is disabled.
	 */
	private Tracing tracing;

	public EdgeFunctions(Stores.Operations<S> operations, Stores.Registry<S> registry, Extension... extensions) {
		this.operations = operations;
		this.registry = registry;
		ArrayList<Rule> rules = new ArrayList<>(Arrays.asList(coreRules()));
		// Bind self in extensions
		for (Extension e : extensions) {
			e.self = this;
			rules.addAll(Arrays.asList(e.rules()));
		}
		this.catalogue = rules.toArray(new Rule[rules.size()]);
	}

	/**
	 * Construct edge functions which implement every DDPA rule.
	 *
	 * @param <S>
	 * @param operations
	 * @param registry
	 * @return
	 */
	public static <S> EdgeFunctions<S> create(Stores.Operations<S> operations, Stores.Registry<S> registry) {
		return new EdgeFunctions<>(operations, registry, new Functions(), new Conditionals(), new Records(),
				new References(), new SideEffects(), new Operations());
	}

	/**
	 * Enable debugging output on a given stream, or disable it when the stream is
	 * null. Observe that tracing forces each result to be materialised in full.
	 *
	 * @param output
	 */
	public void setTrace(PrintStream output) {
		this.tracing = output == null ? null : new Tracing(output);
	}

	/**
	 * Get the number of rules in the catalogue.
	 *
	 * @return
	 */
	public int size() {
		return catalogue.length;
	}

	/**
	 * Produce the transitions for a given edge from a given state. The state must
	 * be standing at the target of the edge, otherwise nothing is produced. Rules
	 * are only evaluated as the resulting stream is consumed.
	 *
	 * @param edge
	 * @param state
	 * @return
	 */
	public Stream<Transition> transitions(Edge edge, Structure.State state) {
		final AnnotatedClause acl1 = edge.source();
		final AnnotatedClause acl0 = edge.target();
		Stream<Transition> result;
		// TODO: associate each edge function with its target rather than checking here.
		if (!standingAt(acl0, state)) {
			result = Stream.empty();
		} else {
			result = Arrays.stream(catalogue).flatMap(r -> r.apply(acl1, acl0));
		}
		if (tracing != null) {
			List<Transition> ts = result.collect(Collectors.toList());
			tracing.step("DDPA " + edge + " edge function at state " + state, ts);
			return ts.stream();
		}
		return result;
	}

	/**
	 * Produce the untargeted dynamic pops which may fire for a given edge and
	 * state. As for transitions, the state must be standing at the target of the
	 * edge.
	 *
	 * @param eobm  Maps each ordinary clause to the end of its block.
	 * @param edge
	 * @param state
	 * @return
	 */
	public Stream<Untargeted> untargetedDynamicPops(EndOfBlockMap eobm, Edge edge, Structure.State state) {
		final AnnotatedClause acl0 = edge.target();
		Stream<Untargeted> result;
		if (!standingAt(acl0, state)) {
			result = Stream.empty();
		} else {
			List<Supplier<Stream<Untargeted>>> actions = Arrays.asList(
					// Store Processing: Discovered Store
					() -> Stream.of(Untargeted.DiscoveredStore),
					// Navigation: Jump
					() -> Stream.of(Untargeted.Jump),
					// Navigation: Rewind
					() -> rewind(eobm, acl0));
			result = actions.stream().flatMap(Supplier::get);
		}
		if (tracing != null) {
			List<Untargeted> us = result.collect(Collectors.toList());
			tracing.step("DDPA " + edge + " untargeted pops at state " + state, us);
			return us.stream();
		}
		return result;
	}

	/**
	 * Rewind to the end of the block enclosing a given node. Only ordinary clauses
	 * can complete a lookup, and hence only they need rewinding. Every ordinary
	 * clause must belong to a block.
	 *
	 * @param eobm
	 * @param acl0
	 * @return
	 */
	private static Stream<Untargeted> rewind(EndOfBlockMap eobm, AnnotatedClause acl0) {
		Clause cl0 = Graph.clauseOf(acl0);
		if (cl0 == null) {
			// Wiring and block markers never complete a lookup
			return Stream.empty();
		}
		AnnotatedClause end = eobm.lookup(acl0);
		if (end == null) {
			throw new InvariantFailure(MISSING_END_OF_BLOCK, cl0);
		}
		return Stream.of(Untargeted.rewind(end));
	}

	private static boolean standingAt(AnnotatedClause acl0, Structure.State state) {
		if (state instanceof Structure.State.ProgramPoint) {
			return ((Structure.State.ProgramPoint) state).clause().equals(acl0);
		}
		return false;
	}

	/**
	 * Get the canonical witness of the store which binds one variable.
	 *
	 * @param x
	 * @param v
	 * @return
	 */
	public Stores.Witness<S> singletonWitness(Variable x, Value v) {
		return registry.witnessOf(operations.singleton(x, v));
	}

	// ==============================================================
	// Core Rules
	// ==============================================================

	private Rule[] coreRules() {
		return new Rule[] {
				// Store Processing
				(acl1, acl0) -> dynpop(Kind.DISCOVERED_STORE_2_OF_2, acl0),
				(acl1, acl0) -> dynpop(Kind.INTERMEDIATE_STORE, acl0),
				(acl1, acl0) -> dynpop(Kind.STORE_SUFFIX_1_OF_2, acl0),
				(acl1, acl0) -> dynpop(Kind.STORE_PARALLEL_JOIN_1_OF_3, acl0),
				(acl1, acl0) -> dynpop(Kind.STORE_SERIAL_JOIN_1_OF_3, acl0),
				(acl1, acl0) -> dynpop(Kind.STORE_ALIAS_1_OF_3, acl0),
				// Variable Search
				this::valueDiscovery,
				EdgeFunctions::valueAlias,
				EdgeFunctions::statelessClauseSkip,
				EdgeFunctions::blockMarkerSkip,
				// Navigation. Jump and rewind are untargeted.
				(acl1, acl0) -> dynpop(Kind.CAPTURE_1_OF_3, acl0) };
	}

	/**
	 * Rule Value Discovery. A lookup for <code>x</code> which reaches
	 * <code>x = v</code> has found the store <code>{x -> v}</code>.
	 */
	private Stream<Transition> valueDiscovery(AnnotatedClause acl1, AnnotatedClause acl0) {
		Clause c = Graph.clauseOf(acl1);
		Body.ValueBody b = bodyOf(acl1, Body.ValueBody.class);
		if (b == null) {
			return none();
		}
		Stores.Witness<S> sw = singletonWitness(c.variable(), b.value());
		return transition(acl1, pop(lookup(c.variable())), push(new Continuation.Store(sw)));
	}

	/**
	 * Rule Value Alias. A lookup for <code>x</code> which reaches
	 * <code>x = x'</code> continues as a lookup for <code>x'</code>.
	 */
	private static Stream<Transition> valueAlias(AnnotatedClause acl1, AnnotatedClause acl0) {
		Clause c = Graph.clauseOf(acl1);
		Body.VariableBody b = bodyOf(acl1, Body.VariableBody.class);
		if (b == null) {
			return none();
		}
		return transition(acl1, pop(lookup(c.variable())), push(lookup(b.variable())));
	}

	/**
	 * Rule Stateless Clause Skip.
	 */
	private static Stream<Transition> statelessClauseSkip(AnnotatedClause acl1, AnnotatedClause acl0) {
		Clause c = Graph.clauseOf(acl1);
		if (c == null) {
			return none();
		}
		return dynpop(Targeted.statelessClauseSkip(c.variable()), acl1);
	}

	/**
	 * Rule Block Marker Skip.
	 */
	private static Stream<Transition> blockMarkerSkip(AnnotatedClause acl1, AnnotatedClause acl0) {
		if (acl1 instanceof AnnotatedClause.BlockStart || acl1 instanceof AnnotatedClause.BlockEnd) {
			return nop(acl1);
		}
		return none();
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	/**
	 * Get the body of an ordinary node when it is of the given kind, or null
	 * otherwise.
	 *
	 * @param <T>
	 * @param acl
	 * @param kind
	 * @return
	 */
	public static <T extends Body> T bodyOf(AnnotatedClause acl, Class<T> kind) {
		Clause c = Graph.clauseOf(acl);
		return c == null ? null : c.body().as(kind);
	}

	/**
	 * Contribute nothing.
	 *
	 * @return
	 */
	public static Stream<Transition> none() {
		return Stream.empty();
	}

	/**
	 * Contribute a fixed sequence of actions leading to a program point.
	 *
	 * @param destination
	 * @param actions
	 * @return
	 */
	public static Stream<Transition> transition(AnnotatedClause destination, StackAction... actions) {
		return Stream.of(new Transition(new Terminus.Static(at(destination)), actions));
	}

	/**
	 * Contribute a move to a program point which leaves the stack unchanged.
	 *
	 * @param destination
	 * @return
	 */
	public static Stream<Transition> nop(AnnotatedClause destination) {
		return transition(destination);
	}

	/**
	 * Contribute a single targeted dynamic pop leading to a program point.
	 *
	 * @param action
	 * @param destination
	 * @return
	 */
	public static Stream<Transition> dynpop(Targeted action, AnnotatedClause destination) {
		return transition(destination, popDynamic(action));
	}

	public static Stream<Transition> dynpop(DynamicPops.Kind kind, AnnotatedClause destination) {
		return dynpop(Targeted.of(kind), destination);
	}

	/**
	 * Contribute several alternative interpretations of the same edge.
	 *
	 * @param alternatives
	 * @return
	 */
	@SafeVarargs
	public static Stream<Transition> alternatives(Stream<Transition>... alternatives) {
		return Stream.of(alternatives).flatMap(s -> s);
	}

	/**
	 * A single rule in the catalogue. Given the source and target of an edge, a
	 * rule contributes zero or more transitions.
	 *
	 * @author David J. Pearce
	 *
	 */
	@FunctionalInterface
	public interface Rule {
		public Stream<Transition> apply(AnnotatedClause acl1, AnnotatedClause acl0);
	}

	/**
	 * Provides a mechanism by which the rule catalogue can be extended.
	 *
	 * @author David J. Pearce
	 *
	 */
	public abstract static class Extension {
		protected EdgeFunctions<?> self;

		/**
		 * Get the rules provided by this extension, in the order they should be
		 * tried.
		 *
		 * @return
		 */
		public abstract Rule[] rules();
	}
}
