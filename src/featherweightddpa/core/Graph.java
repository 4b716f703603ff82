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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import featherweightddpa.core.Syntax.Body;
import featherweightddpa.core.Syntax.Clause;
import featherweightddpa.core.Syntax.Expr;
import featherweightddpa.core.Syntax.Value;
import featherweightddpa.core.Syntax.Variable;

/**
 * The control-flow graph over which lookups are performed. Nodes are
 * <i>annotated clauses</i>, which distinguish ordinary clauses from the wiring
 * introduced for function calls and conditionals.
 *
 * @author David J. Pearce
 *
 */
public class Graph {

	/**
	 * A node in the control-flow graph.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface AnnotatedClause {

		/**
		 * An ordinary clause from the program.
		 */
		public static final class Unannotated implements AnnotatedClause {
			private final Clause clause;

			public Unannotated(Clause clause) {
				if (clause == null) {
					throw new IllegalArgumentException("missing clause");
				}
				this.clause = clause;
			}

			public Clause clause() {
				return clause;
			}

			@Override
			public int hashCode() {
				return clause.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Unannotated && ((Unannotated) o).clause.equals(clause);
			}

			@Override
			public String toString() {
				return clause.toString();
			}
		}

		/**
		 * Wiring on entry to a function or conditional branch. This binds a
		 * parameter <code>x</code> to an argument <code>x'</code> at the given call
		 * site clause (written <code>x =(c) x'</code>).
		 *
		 * @author David J. Pearce
		 *
		 */
		public static final class Enter implements AnnotatedClause {
			private final Variable parameter;
			private final Variable argument;
			private final Clause site;

			public Enter(Variable parameter, Variable argument, Clause site) {
				if (parameter == null || argument == null || site == null) {
					throw new IllegalArgumentException("enter requires parameter, argument and site");
				}
				this.parameter = parameter;
				this.argument = argument;
				this.site = site;
			}

			public Variable parameter() {
				return parameter;
			}

			public Variable argument() {
				return argument;
			}

			public Clause site() {
				return site;
			}

			@Override
			public int hashCode() {
				return parameter.hashCode() ^ (7 * argument.hashCode()) ^ site.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Enter) {
					Enter e = (Enter) o;
					return parameter.equals(e.parameter) && argument.equals(e.argument) && site.equals(e.site);
				}
				return false;
			}

			@Override
			public String toString() {
				return parameter + " =(" + site.variable() + ") " + argument;
			}
		}

		/**
		 * Wiring on exit from a function or conditional branch. This binds the
		 * result <code>x</code> of the call site to the variable <code>x'</code>
		 * returned by the body (written <code>x =)c( x'</code>).
		 *
		 * @author David J. Pearce
		 *
		 */
		public static final class Exit implements AnnotatedClause {
			private final Variable result;
			private final Variable returned;
			private final Clause site;

			public Exit(Variable result, Variable returned, Clause site) {
				if (result == null || returned == null || site == null) {
					throw new IllegalArgumentException("exit requires result, returned variable and site");
				}
				this.result = result;
				this.returned = returned;
				this.site = site;
			}

			public Variable result() {
				return result;
			}

			public Variable returned() {
				return returned;
			}

			public Clause site() {
				return site;
			}

			@Override
			public int hashCode() {
				return result.hashCode() ^ (11 * returned.hashCode()) ^ site.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Exit) {
					Exit e = (Exit) o;
					return result.equals(e.result) && returned.equals(e.returned) && site.equals(e.site);
				}
				return false;
			}

			@Override
			public String toString() {
				return result + " =)" + site.variable() + "( " + returned;
			}
		}

		/**
		 * Marks the start of a block. Blocks are identified by their return
		 * variable.
		 */
		public static final class BlockStart implements AnnotatedClause {
			private final Variable block;

			public BlockStart(Variable block) {
				if (block == null) {
					throw new IllegalArgumentException("missing block");
				}
				this.block = block;
			}

			public Variable block() {
				return block;
			}

			@Override
			public int hashCode() {
				return 3 * block.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof BlockStart && ((BlockStart) o).block.equals(block);
			}

			@Override
			public String toString() {
				return "start(" + block + ")";
			}
		}

		/**
		 * Marks the end of a block.
		 */
		public static final class BlockEnd implements AnnotatedClause {
			private final Variable block;

			public BlockEnd(Variable block) {
				if (block == null) {
					throw new IllegalArgumentException("missing block");
				}
				this.block = block;
			}

			public Variable block() {
				return block;
			}

			@Override
			public int hashCode() {
				return 5 * block.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof BlockEnd && ((BlockEnd) o).block.equals(block);
			}

			@Override
			public String toString() {
				return "end(" + block + ")";
			}
		}
	}

	/**
	 * An edge <code>source &lt;&lt; target</code> indicating that control reaches
	 * <code>target</code> from <code>source</code>. Lookups walk edges backwards,
	 * from target to source.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Edge {
		private final AnnotatedClause source;
		private final AnnotatedClause target;

		public Edge(AnnotatedClause source, AnnotatedClause target) {
			if (source == null || target == null) {
				throw new IllegalArgumentException("edge requires source and target");
			}
			this.source = source;
			this.target = target;
		}

		public AnnotatedClause source() {
			return source;
		}

		public AnnotatedClause target() {
			return target;
		}

		@Override
		public int hashCode() {
			return source.hashCode() ^ (31 * target.hashCode());
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Edge) {
				Edge e = (Edge) o;
				return source.equals(e.source) && target.equals(e.target);
			}
			return false;
		}

		@Override
		public String toString() {
			return source + " << " + target;
		}
	}

	/**
	 * Get the clause underlying an ordinary node, or null if the node is wiring or
	 * a block marker.
	 *
	 * @param acl
	 * @return
	 */
	public static Clause clauseOf(AnnotatedClause acl) {
		if (acl instanceof AnnotatedClause.Unannotated) {
			return ((AnnotatedClause.Unannotated) acl).clause();
		}
		return null;
	}

	/**
	 * Determine whether a node is immediate. That is, whether control passes
	 * through it without visiting any other part of the graph. Only function
	 * applications and conditionals are not immediate.
	 *
	 * @param acl
	 * @return
	 */
	public static boolean isImmediate(AnnotatedClause acl) {
		Clause c = clauseOf(acl);
		if (c == null) {
			// wiring and block markers
			return true;
		}
		switch (c.body().getOpcode()) {
		case Syntax.BODY_application:
		case Syntax.BODY_conditional:
			return false;
		default:
			return true;
		}
	}

	/**
	 * Determine whether a node is an ordinary clause which updates a mutable cell.
	 *
	 * @param acl
	 * @return
	 */
	public static boolean isStatefulUpdate(AnnotatedClause acl) {
		Clause c = clauseOf(acl);
		return c != null && c.body().getOpcode() == Syntax.BODY_update;
	}

	/**
	 * Maps every ordinary clause to the node closing its enclosing block. This is
	 * used to rewind a lookup after it has inspected a closure.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class EndOfBlockMap {
		private final Map<AnnotatedClause, AnnotatedClause> mapping;

		public EndOfBlockMap(Map<AnnotatedClause, AnnotatedClause> mapping) {
			this.mapping = Collections.unmodifiableMap(new HashMap<>(mapping));
		}

		/**
		 * Get the end of block for a given node, or null if there is no mapping.
		 *
		 * @param acl
		 * @return
		 */
		public AnnotatedClause lookup(AnnotatedClause acl) {
			return mapping.get(acl);
		}

		public int size() {
			return mapping.size();
		}

		@Override
		public String toString() {
			return mapping.toString();
		}

		/**
		 * Construct the end of block map for a given program. Every clause of a block
		 * (including the bodies of functions and conditional branches nested within)
		 * maps to the end marker of that block.
		 *
		 * @param program
		 * @return
		 */
		public static EndOfBlockMap of(Expr program) {
			HashMap<AnnotatedClause, AnnotatedClause> mapping = new HashMap<>();
			populate(program, mapping);
			return new EndOfBlockMap(mapping);
		}

		private static void populate(Expr block, Map<AnnotatedClause, AnnotatedClause> mapping) {
			AnnotatedClause end = new AnnotatedClause.BlockEnd(block.returnVariable());
			for (int i = 0; i != block.size(); ++i) {
				Clause ith = block.get(i);
				mapping.put(new AnnotatedClause.Unannotated(ith), end);
				// Recursively populate nested blocks
				Body b = ith.body();
				Body.ValueBody vb = b.as(Body.ValueBody.class);
				Body.Conditional cb = b.as(Body.Conditional.class);
				if (vb != null && vb.value() instanceof Value.Function) {
					populate(((Value.Function) vb.value()).body(), mapping);
				} else if (cb != null) {
					populate(cb.match().body(), mapping);
					populate(cb.antimatch().body(), mapping);
				}
			}
		}
	}
}
