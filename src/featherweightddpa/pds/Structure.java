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
package featherweightddpa.pds;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import featherweightddpa.core.Graph.AnnotatedClause;
import featherweightddpa.core.Stores;
import featherweightddpa.core.Syntax.Clause;
import featherweightddpa.core.Syntax.Identifier;
import featherweightddpa.core.Syntax.Pattern;
import featherweightddpa.core.Syntax.Variable;

/**
 * The states, stack alphabet and transitions of the pushdown system which
 * encodes a DDPA lookup.
 *
 * @author David J. Pearce
 *
 */
public class Structure {

	/**
	 * A state of the pushdown automaton.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface State {

		/**
		 * Standing at a given program point during a (backwards) lookup.
		 */
		public static final class ProgramPoint implements State {
			private final AnnotatedClause clause;

			public ProgramPoint(AnnotatedClause clause) {
				if (clause == null) {
					throw new IllegalArgumentException("program point requires a clause");
				}
				this.clause = clause;
			}

			public AnnotatedClause clause() {
				return clause;
			}

			@Override
			public int hashCode() {
				return clause.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof ProgramPoint && ((ProgramPoint) o).clause.equals(clause);
			}

			@Override
			public String toString() {
				return "@(" + clause + ")";
			}
		}
	}

	/**
	 * The number of actions captured by a {@link Continuation.Capture}. This is
	 * bounded so that the stack alphabet remains finite for any given program.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class CaptureSize {
		public static final int MAX = 10;

		private final int size;

		private CaptureSize(int size) {
			this.size = size;
		}

		public int size() {
			return size;
		}

		@Override
		public int hashCode() {
			return size;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof CaptureSize && ((CaptureSize) o).size == size;
		}

		@Override
		public String toString() {
			return java.lang.Integer.toString(size);
		}

		public static CaptureSize of(int size) {
			if (size < 1 || size > MAX) {
				throw new IllegalArgumentException("invalid capture size: " + size);
			}
			return new CaptureSize(size);
		}
	}

	/**
	 * Identifies the call or branch through which a lookup has passed.
	 */
	public interface TracePart {

		public static final class Enter implements TracePart {
			private final Clause site;

			public Enter(Clause site) {
				this.site = site;
			}

			public Clause site() {
				return site;
			}

			@Override
			public int hashCode() {
				return site.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Enter && ((Enter) o).site.equals(site);
			}

			@Override
			public String toString() {
				return "enter(" + site.variable() + ")";
			}
		}

		public static final class Exit implements TracePart {
			private final Clause site;

			public Exit(Clause site) {
				this.site = site;
			}

			public Clause site() {
				return site;
			}

			@Override
			public int hashCode() {
				return ~site.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Exit && ((Exit) o).site.equals(site);
			}

			@Override
			public String toString() {
				return "exit(" + site.variable() + ")";
			}
		}
	}

	/**
	 * A stack symbol. Each represents one pending obligation of a lookup.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Continuation {

		/**
		 * Combine the two stores above this marker from alternative paths.
		 */
		public static final Continuation ParallelJoin = new Marker("ParallelJoin");
		/**
		 * Combine the two stores above this marker from consecutive paths.
		 */
		public static final Continuation SerialJoin = new Marker("SerialJoin");
		/**
		 * Obtain the value held by the cell found for the store beneath.
		 */
		public static final Continuation Dereference = new Marker("Deref");
		/**
		 * Confirm that control really flowed through a call site.
		 */
		public static final Continuation RealFlow = new Marker("RealFlow?");
		/**
		 * Determine whether two cells may be the same.
		 */
		public static final Continuation AliasCheck = new Marker("Alias?");
		public static final Continuation BinaryOperation = new Marker("BinOp");
		public static final Continuation UnaryOperation = new Marker("UnOp");

		/**
		 * A stack symbol without structure.
		 */
		public static final class Marker implements Continuation {
			private final String name;

			private Marker(String name) {
				this.name = name;
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * Find the value(s) of a given variable.
		 */
		public static final class LookupVariable implements Continuation {
			private final Variable variable;

			public LookupVariable(Variable variable) {
				this.variable = variable;
			}

			public Variable variable() {
				return variable;
			}

			@Override
			public int hashCode() {
				return variable.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof LookupVariable && ((LookupVariable) o).variable.equals(variable);
			}

			@Override
			public String toString() {
				return "Lookup(" + variable + ")";
			}
		}

		/**
		 * Rename the variable of the store beneath to this variable.
		 */
		public static final class Alias implements Continuation {
			private final Variable variable;

			public Alias(Variable variable) {
				this.variable = variable;
			}

			public Variable variable() {
				return variable;
			}

			@Override
			public int hashCode() {
				return ~variable.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Alias && ((Alias) o).variable.equals(variable);
			}

			@Override
			public String toString() {
				return "Alias(" + variable + ")";
			}
		}

		public static final class TraceConcat implements Continuation {
			private final TracePart part;

			public TraceConcat(TracePart part) {
				this.part = part;
			}

			public TracePart part() {
				return part;
			}

			@Override
			public int hashCode() {
				return part.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof TraceConcat && ((TraceConcat) o).part.equals(part);
			}

			@Override
			public String toString() {
				return "TraceConcat(" + part + ")";
			}
		}

		/**
		 * Resume the lookup at a given program point.
		 */
		public static final class Jump implements Continuation {
			private final AnnotatedClause target;

			public Jump(AnnotatedClause target) {
				this.target = target;
			}

			public AnnotatedClause target() {
				return target;
			}

			@Override
			public int hashCode() {
				return target.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Jump && ((Jump) o).target.equals(target);
			}

			@Override
			public String toString() {
				return "Jump(" + target + ")";
			}
		}

		/**
		 * Hold the next store found and replay it beneath the given number of
		 * elements.
		 */
		public static final class Capture implements Continuation {
			private final CaptureSize size;

			public Capture(CaptureSize size) {
				this.size = size;
			}

			public CaptureSize size() {
				return size;
			}

			@Override
			public int hashCode() {
				return 19 * size.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Capture && ((Capture) o).size.equals(size);
			}

			@Override
			public String toString() {
				return "Capture(" + size + ")";
			}
		}

		/**
		 * A store which has been found.
		 */
		public static final class Store implements Continuation {
			private final Stores.Witness<?> witness;

			public Store(Stores.Witness<?> witness) {
				this.witness = witness;
			}

			public Stores.Witness<?> witness() {
				return witness;
			}

			@Override
			public int hashCode() {
				return witness.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Store && ((Store) o).witness == witness;
			}

			@Override
			public String toString() {
				return "Store(" + witness + ")";
			}
		}

		/**
		 * The store beneath must match a given pattern.
		 */
		public static final class Matches implements Continuation {
			private final Pattern pattern;

			public Matches(Pattern pattern) {
				this.pattern = pattern;
			}

			public Pattern pattern() {
				return pattern;
			}

			@Override
			public int hashCode() {
				return pattern.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Matches && ((Matches) o).pattern.equals(pattern);
			}

			@Override
			public String toString() {
				return "~" + pattern;
			}
		}

		/**
		 * The store beneath must not match a given pattern.
		 */
		public static final class Antimatches implements Continuation {
			private final Pattern pattern;

			public Antimatches(Pattern pattern) {
				this.pattern = pattern;
			}

			public Pattern pattern() {
				return pattern;
			}

			@Override
			public int hashCode() {
				return ~pattern.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Antimatches && ((Antimatches) o).pattern.equals(pattern);
			}

			@Override
			public String toString() {
				return "!~" + pattern;
			}
		}

		/**
		 * Project a given label from the record store beneath.
		 */
		public static final class Project implements Continuation {
			private final Identifier label;

			public Project(Identifier label) {
				this.label = label;
			}

			public Identifier label() {
				return label;
			}

			@Override
			public int hashCode() {
				return label.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Project && ((Project) o).label.equals(label);
			}

			@Override
			public String toString() {
				return "Project(" + label + ")";
			}
		}
	}

	/**
	 * An action on the stack of the automaton.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface StackAction {

		public static final class Pop implements StackAction {
			private final Continuation element;

			public Pop(Continuation element) {
				this.element = element;
			}

			public Continuation element() {
				return element;
			}

			@Override
			public int hashCode() {
				return element.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Pop && ((Pop) o).element.equals(element);
			}

			@Override
			public String toString() {
				return "pop " + element;
			}
		}

		public static final class Push implements StackAction {
			private final Continuation element;

			public Push(Continuation element) {
				this.element = element;
			}

			public Continuation element() {
				return element;
			}

			@Override
			public int hashCode() {
				return ~element.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Push && ((Push) o).element.equals(element);
			}

			@Override
			public String toString() {
				return "push " + element;
			}
		}

		/**
		 * Pop the top element, whatever it is, and hand it to the handler identified
		 * by the given action.
		 */
		public static final class PopDynamicTargeted implements StackAction {
			private final DynamicPops.Targeted action;

			public PopDynamicTargeted(DynamicPops.Targeted action) {
				this.action = action;
			}

			public DynamicPops.Targeted action() {
				return action;
			}

			@Override
			public int hashCode() {
				return action.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof PopDynamicTargeted && ((PopDynamicTargeted) o).action.equals(action);
			}

			@Override
			public String toString() {
				return "popdyn " + action;
			}
		}
	}

	/**
	 * The destination of a transition.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Terminus {

		public static final class Static implements Terminus {
			private final State state;

			public Static(State state) {
				this.state = state;
			}

			public State state() {
				return state;
			}

			@Override
			public int hashCode() {
				return state.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Static && ((Static) o).state.equals(state);
			}

			@Override
			public String toString() {
				return state.toString();
			}
		}

		/**
		 * A destination determined by an untargeted dynamic pop. These are only
		 * produced by the dynamic pop handlers.
		 */
		public static final class Dynamic implements Terminus {
			private final DynamicPops.Untargeted action;

			public Dynamic(DynamicPops.Untargeted action) {
				this.action = action;
			}

			public DynamicPops.Untargeted action() {
				return action;
			}

			@Override
			public int hashCode() {
				return ~action.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Dynamic && ((Dynamic) o).action.equals(action);
			}

			@Override
			public String toString() {
				return "dyn(" + action + ")";
			}
		}
	}

	/**
	 * A sequence of stack actions leading to a terminus. Actions are applied in
	 * order, so the last push ends up on top of the stack.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Transition {
		private final List<StackAction> actions;
		private final Terminus terminus;

		public Transition(List<StackAction> actions, Terminus terminus) {
			this.actions = Collections.unmodifiableList(new ArrayList<>(actions));
			this.terminus = terminus;
		}

		public Transition(Terminus terminus, StackAction... actions) {
			this(Arrays.asList(Arrays.copyOf(actions, actions.length)), terminus);
		}

		public List<StackAction> actions() {
			return actions;
		}

		public Terminus terminus() {
			return terminus;
		}

		@Override
		public int hashCode() {
			return actions.hashCode() ^ terminus.hashCode();
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Transition) {
				Transition t = (Transition) o;
				return actions.equals(t.actions) && terminus.equals(t.terminus);
			}
			return false;
		}

		@Override
		public String toString() {
			return actions + " ==> " + terminus;
		}
	}

	// ==============================================================
	// Shorthands
	// ==============================================================

	public static State.ProgramPoint at(AnnotatedClause acl) {
		return new State.ProgramPoint(acl);
	}

	public static StackAction pop(Continuation c) {
		return new StackAction.Pop(c);
	}

	public static StackAction push(Continuation c) {
		return new StackAction.Push(c);
	}

	public static StackAction popDynamic(DynamicPops.Targeted action) {
		return new StackAction.PopDynamicTargeted(action);
	}

	public static Continuation lookup(Variable x) {
		return new Continuation.LookupVariable(x);
	}

	public static Continuation jump(AnnotatedClause acl) {
		return new Continuation.Jump(acl);
	}

	public static Continuation capture(int n) {
		return new Continuation.Capture(CaptureSize.of(n));
	}
}
