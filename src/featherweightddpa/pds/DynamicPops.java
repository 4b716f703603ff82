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

import java.util.Arrays;

import featherweightddpa.core.Graph.AnnotatedClause;
import featherweightddpa.core.Syntax.BinaryOperator;
import featherweightddpa.core.Syntax.Clause;
import featherweightddpa.core.Syntax.Pattern;
import featherweightddpa.core.Syntax.UnaryOperator;
import featherweightddpa.core.Syntax.Variable;

/**
 * The vocabulary of dynamic pop actions. The edge functions only construct
 * these; what happens once one fires is determined by the dynamic pop
 * handlers. Rules which take several steps to complete are split into numbered
 * phases (e.g. <code>_1_OF_3</code>), of which only the first is ever
 * constructed by an edge function.
 *
 * @author David J. Pearce
 *
 */
public class DynamicPops {
	private static final Class<?> VAR = Variable.class;
	private static final Class<?> CLAUSE = Clause.class;
	private static final Class<?> NODE = AnnotatedClause.class;

	/**
	 * Every targeted dynamic pop, along with the kinds of its operands.
	 */
	public enum Kind {
		// Store processing
		DISCOVERED_STORE_2_OF_2,
		INTERMEDIATE_STORE,
		STORE_SUFFIX_1_OF_2,
		STORE_PARALLEL_JOIN_1_OF_3,
		STORE_SERIAL_JOIN_1_OF_3,
		STORE_ALIAS_1_OF_3,
		// Variable search
		STATELESS_CLAUSE_SKIP_1_OF_2(VAR),
		// Navigation
		CAPTURE_1_OF_3,
		// Function wiring
		FUNCTION_BOTTOM_RETURN_VARIABLE(VAR, VAR, CLAUSE),
		FUNCTION_TOP_NONLOCAL_VARIABLE(VAR, CLAUSE, NODE),
		// Conditional wiring
		CONDITIONAL_TOP_NONSUBJECT_VARIABLE_POSITIVE(VAR, VAR, NODE, Pattern.class),
		CONDITIONAL_TOP_NONSUBJECT_VARIABLE_NEGATIVE(VAR, VAR, NODE, Pattern.class),
		// Records
		RECORD_PROJECTION_STOP_1_OF_2,
		FILTER_IMMEDIATE_1_OF_2,
		FILTER_NONEMPTY_RECORD_POSITIVE_1_OF_2(NODE),
		FILTER_NONEMPTY_RECORD_NEGATIVE_1_OF_2(NODE),
		// State
		DEREFERENCE_STOP,
		ALIAS_ANALYSIS_START(NODE, NODE),
		MAY_NOT_ALIAS_1_OF_3,
		MAY_ALIAS_1_OF_3(VAR),
		// Side effect search
		STATEFUL_IMMEDIATE_CLAUSE_SKIP(VAR),
		SIDE_EFFECT_SEARCH_START_FUNCTION_FLOW_CHECK(NODE, NODE),
		SIDE_EFFECT_SEARCH_START_FUNCTION_FLOW_VALIDATED_1_OF_2(NODE, NODE),
		SIDE_EFFECT_SEARCH_START_CONDITIONAL_POSITIVE(NODE, NODE),
		SIDE_EFFECT_SEARCH_START_CONDITIONAL_NEGATIVE(NODE, NODE),
		SIDE_EFFECT_SEARCH_IMMEDIATE_CLAUSE_SKIP,
		SIDE_EFFECT_SEARCH_FUNCTION_BOTTOM_FLOW_CHECK(NODE, CLAUSE),
		SIDE_EFFECT_SEARCH_FUNCTION_BOTTOM_RETURN_VARIABLE_1_OF_2(NODE),
		SIDE_EFFECT_SEARCH_FUNCTION_TOP(CLAUSE),
		SIDE_EFFECT_SEARCH_CONDITIONAL_POSITIVE(NODE),
		SIDE_EFFECT_SEARCH_CONDITIONAL_NEGATIVE(NODE),
		SIDE_EFFECT_SEARCH_CONDITIONAL_TOP,
		SIDE_EFFECT_SEARCH_FUNCTION_WIRING_JOIN_DEFER_1_OF_3,
		SIDE_EFFECT_SEARCH_CONDITIONAL_WIRING_JOIN_DEFER_1_OF_2,
		SIDE_EFFECT_SEARCH_JOIN_COMPRESSION_1_OF_3,
		SIDE_EFFECT_SEARCH_ALIAS_ANALYSIS_START(NODE, NODE),
		SIDE_EFFECT_SEARCH_MAY_NOT_ALIAS_1_OF_3,
		SIDE_EFFECT_SEARCH_MAY_ALIAS_1_OF_3(VAR),
		SIDE_EFFECT_SEARCH_ESCAPE_FRAME,
		SIDE_EFFECT_SEARCH_ESCAPE_VARIABLE_CONCATENATION_1_OF_2,
		SIDE_EFFECT_SEARCH_ESCAPE_STORE_JOIN_1_OF_2,
		SIDE_EFFECT_SEARCH_ESCAPE_COMPLETE_1_OF_3,
		SIDE_EFFECT_SEARCH_NOT_FOUND_SHALLOW_1_OF_2,
		SIDE_EFFECT_SEARCH_NOT_FOUND_DEEP_1_OF_4,
		// Operations
		BINARY_OPERATION_STOP_1_OF_2(VAR, BinaryOperator.class),
		UNARY_OPERATION_STOP(VAR, UnaryOperator.class);

		private final Class<?>[] operands;

		private Kind(Class<?>... operands) {
			this.operands = operands;
		}

		/**
		 * Get the number of operands carried by actions of this kind.
		 *
		 * @return
		 */
		public int arity() {
			return operands.length;
		}
	}

	/**
	 * A targeted dynamic pop action. This consumes the top of the stack and hands
	 * it to the handler for its kind.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Targeted {
		private final Kind kind;
		private final Object[] operands;

		private Targeted(Kind kind, Object[] operands) {
			this.kind = kind;
			this.operands = operands;
		}

		public Kind kind() {
			return kind;
		}

		public int size() {
			return operands.length;
		}

		/**
		 * Get the ith operand of this action.
		 *
		 * @param i
		 * @return
		 */
		public Object get(int i) {
			return operands[i];
		}

		@Override
		public int hashCode() {
			return kind.hashCode() ^ Arrays.hashCode(operands);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Targeted) {
				Targeted t = (Targeted) o;
				return kind == t.kind && Arrays.equals(operands, t.operands);
			}
			return false;
		}

		@Override
		public String toString() {
			if (operands.length == 0) {
				return kind.name();
			}
			String r = "";
			for (int i = 0; i != operands.length; ++i) {
				if (i != 0) {
					r += ",";
				}
				r += operands[i];
			}
			return kind.name() + "(" + r + ")";
		}

		/**
		 * Construct an action of a given kind. The operands must agree with the kind
		 * in both number and type.
		 *
		 * @param kind
		 * @param operands
		 * @return
		 */
		public static Targeted of(Kind kind, Object... operands) {
			if (operands.length != kind.operands.length) {
				throw new IllegalArgumentException(
						"invalid operand count for " + kind + ": expected " + kind.arity() + ", got " + operands.length);
			}
			for (int i = 0; i != operands.length; ++i) {
				if (!kind.operands[i].isInstance(operands[i])) {
					throw new IllegalArgumentException("invalid operand " + i + " for " + kind + ": " + operands[i]);
				}
			}
			return new Targeted(kind, Arrays.copyOf(operands, operands.length));
		}

		public static Targeted statelessClauseSkip(Variable x) {
			return of(Kind.STATELESS_CLAUSE_SKIP_1_OF_2, x);
		}

		public static Targeted functionBottomReturnVariable(Variable x, Variable returned, Clause site) {
			return of(Kind.FUNCTION_BOTTOM_RETURN_VARIABLE, x, returned, site);
		}

		public static Targeted functionTopNonlocalVariable(Variable x, Clause site, AnnotatedClause wiring) {
			return of(Kind.FUNCTION_TOP_NONLOCAL_VARIABLE, x, site, wiring);
		}

		public static Targeted conditionalTopNonsubjectVariable(boolean positive, Variable x, Variable subject,
				AnnotatedClause wiring, Pattern pattern) {
			Kind kind = positive ? Kind.CONDITIONAL_TOP_NONSUBJECT_VARIABLE_POSITIVE
					: Kind.CONDITIONAL_TOP_NONSUBJECT_VARIABLE_NEGATIVE;
			return of(kind, x, subject, wiring, pattern);
		}

		public static Targeted mayAlias(Variable value) {
			return of(Kind.MAY_ALIAS_1_OF_3, value);
		}

		public static Targeted binaryOperationStop(Variable x, BinaryOperator op) {
			return of(Kind.BINARY_OPERATION_STOP_1_OF_2, x, op);
		}

		public static Targeted unaryOperationStop(Variable x, UnaryOperator op) {
			return of(Kind.UNARY_OPERATION_STOP, x, op);
		}
	}

	/**
	 * An untargeted dynamic pop. These may fire at any program point, regardless
	 * of the stack.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Untargeted {
		public static final Untargeted DiscoveredStore = new Untargeted("DISCOVERED_STORE_1_OF_2", null);
		public static final Untargeted Jump = new Untargeted("JUMP", null);

		private final String name;
		private final AnnotatedClause endOfBlock;

		private Untargeted(String name, AnnotatedClause endOfBlock) {
			this.name = name;
			this.endOfBlock = endOfBlock;
		}

		/**
		 * Get the end of block to which a rewind returns, or null if this is not a
		 * rewind.
		 *
		 * @return
		 */
		public AnnotatedClause endOfBlock() {
			return endOfBlock;
		}

		public boolean isRewind() {
			return endOfBlock != null;
		}

		@Override
		public int hashCode() {
			return name.hashCode() ^ (endOfBlock == null ? 0 : endOfBlock.hashCode());
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Untargeted) {
				Untargeted u = (Untargeted) o;
				if (endOfBlock == null) {
					return u.endOfBlock == null && name.equals(u.name);
				}
				return name.equals(u.name) && endOfBlock.equals(u.endOfBlock);
			}
			return false;
		}

		@Override
		public String toString() {
			return endOfBlock == null ? name : name + "(" + endOfBlock + ")";
		}

		/**
		 * Construct a rewind to a given end of block.
		 *
		 * @param endOfBlock
		 * @return
		 */
		public static Untargeted rewind(AnnotatedClause endOfBlock) {
			if (endOfBlock == null) {
				throw new IllegalArgumentException("rewind requires end of block");
			}
			return new Untargeted("REWIND", endOfBlock);
		}
	}
}
