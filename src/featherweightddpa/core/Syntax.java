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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The abstract syntax analysed by DDPA. Programs are in A-normal form: every
 * intermediate result is bound to a variable by a clause, and an expression is
 * simply a sequence of clauses whose last variable is its result.
 *
 * @author David J. Pearce
 *
 */
public class Syntax {
	public final static int BODY_value = 0;
	public final static int BODY_variable = 1;
	public final static int BODY_application = 2;
	public final static int BODY_conditional = 3;
	public final static int BODY_projection = 4;
	public final static int BODY_dereference = 5;
	public final static int BODY_update = 6;
	public final static int BODY_binary = 7;
	public final static int BODY_unary = 8;

	/**
	 * A let-bound program variable. Two variables are the same if they have the
	 * same name.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Variable {
		private final String name;

		public Variable(String name) {
			if (name == null) {
				throw new IllegalArgumentException("variable requires a name");
			}
			this.name = name;
		}

		public String name() {
			return name;
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Variable && ((Variable) o).name.equals(name);
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * A record label.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Identifier {
		private final String name;

		public Identifier(String name) {
			if (name == null) {
				throw new IllegalArgumentException("identifier requires a name");
			}
			this.name = name;
		}

		public String name() {
			return name;
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Identifier && ((Identifier) o).name.equals(name);
		}

		@Override
		public String toString() {
			return name;
		}
	}

	public enum BinaryOperator {
		PLUS("+"),
		MINUS("-"),
		LESS_THAN("<"),
		LESS_THAN_OR_EQUAL_TO("<="),
		EQUAL_TO("=="),
		AND("and"),
		OR("or"),
		XOR("xor"),
		INDEX("@");

		private final String symbol;

		private BinaryOperator(String symbol) {
			this.symbol = symbol;
		}

		@Override
		public String toString() {
			return symbol;
		}
	}

	public enum UnaryOperator {
		NOT("not"),
		NEGATE("-");

		private final String symbol;

		private UnaryOperator(String symbol) {
			this.symbol = symbol;
		}

		@Override
		public String toString() {
			return symbol;
		}
	}

	/**
	 * An abstract value. Integers and strings are abstracted to a single
	 * representative, whilst booleans retain their truth value.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Value {

		public static final Int Int = new Int();

		public static final Str Str = new Str();

		public static final Bool True = new Bool(true);

		public static final Bool False = new Bool(false);

		/**
		 * A function value of the form <code>fun x -> ( e )</code>. The function
		 * body is itself an expression whose return variable is the function's
		 * result.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static final class Function implements Value {
			private final Variable parameter;
			private final Expr body;

			public Function(Variable parameter, Expr body) {
				if (parameter == null || body == null) {
					throw new IllegalArgumentException("function requires parameter and body");
				}
				this.parameter = parameter;
				this.body = body;
			}

			public Variable parameter() {
				return parameter;
			}

			public Expr body() {
				return body;
			}

			@Override
			public int hashCode() {
				return parameter.hashCode() ^ body.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Function) {
					Function f = (Function) o;
					return parameter.equals(f.parameter) && body.equals(f.body);
				}
				return false;
			}

			@Override
			public String toString() {
				return "fun " + parameter + " -> ( " + body + " )";
			}
		}

		/**
		 * A record value which maps labels to the variables holding the
		 * corresponding fields.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static final class Record implements Value {
			private final Map<Identifier, Variable> fields;

			public Record(Map<Identifier, Variable> fields) {
				this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
			}

			public Map<Identifier, Variable> fields() {
				return fields;
			}

			/**
			 * Get the variable bound to a given label, or null if there is no such
			 * label.
			 *
			 * @param label
			 * @return
			 */
			public Variable get(Identifier label) {
				return fields.get(label);
			}

			public boolean isEmpty() {
				return fields.isEmpty();
			}

			@Override
			public int hashCode() {
				return fields.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Record && ((Record) o).fields.equals(fields);
			}

			@Override
			public String toString() {
				String r = "";
				for (Map.Entry<Identifier, Variable> e : fields.entrySet()) {
					if (!r.isEmpty()) {
						r += ", ";
					}
					r += e.getKey() + "=" + e.getValue();
				}
				return "{" + r + "}";
			}
		}

		public static final class Reference implements Value {
			private final Variable cell;

			public Reference(Variable cell) {
				if (cell == null) {
					throw new IllegalArgumentException("reference requires a cell variable");
				}
				this.cell = cell;
			}

			public Variable cell() {
				return cell;
			}

			@Override
			public int hashCode() {
				return 31 * cell.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Reference && ((Reference) o).cell.equals(cell);
			}

			@Override
			public String toString() {
				return "ref " + cell;
			}
		}

		public static final class Int implements Value {
			private Int() {
			}

			@Override
			public String toString() {
				return "int";
			}
		}

		public static final class Bool implements Value {
			private final boolean value;

			private Bool(boolean value) {
				this.value = value;
			}

			public boolean value() {
				return value;
			}

			@Override
			public String toString() {
				return Boolean.toString(value);
			}
		}

		public static final class Str implements Value {
			private Str() {
			}

			@Override
			public String toString() {
				return "string";
			}
		}
	}

	/**
	 * A pattern tested by a conditional clause.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Pattern {

		public static final Pattern Any = new Atom("any");
		public static final Pattern Int = new Atom("int");
		public static final Pattern Str = new Atom("string");
		public static final Pattern Function = new Atom("fun");
		public static final Pattern Reference = new Atom("ref");
		public static final Pattern True = new Atom("true");
		public static final Pattern False = new Atom("false");

		/**
		 * A pattern without structure. There is exactly one instance of each kind.
		 */
		public static final class Atom implements Pattern {
			private final String kind;

			private Atom(String kind) {
				this.kind = kind;
			}

			@Override
			public String toString() {
				return kind;
			}
		}

		public static final class Record implements Pattern {
			private final Map<Identifier, Pattern> fields;

			public Record(Map<Identifier, Pattern> fields) {
				this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
			}

			public Map<Identifier, Pattern> fields() {
				return fields;
			}

			@Override
			public int hashCode() {
				return fields.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Record && ((Record) o).fields.equals(fields);
			}

			@Override
			public String toString() {
				String r = "";
				for (Map.Entry<Identifier, Pattern> e : fields.entrySet()) {
					if (!r.isEmpty()) {
						r += ", ";
					}
					r += e.getKey() + "=" + e.getValue();
				}
				return "{" + r + "}";
			}
		}
	}

	/**
	 * The right-hand side of a clause.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Body {

		/**
		 * Get the opcode associated with the syntactic form of this body.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * Return this body as the given kind, or null if it is of a different kind.
		 *
		 * @param <T>
		 * @param kind
		 * @return
		 */
		public <T extends Body> T as(Class<T> kind);

		public static abstract class AbstractBody implements Body {
			private final int opcode;

			public AbstractBody(int opcode) {
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}

			@Override
			public <T extends Body> T as(Class<T> kind) {
				if (kind.isInstance(this)) {
					return kind.cast(this);
				}
				return null;
			}
		}

		/**
		 * Represents a value literal, such as:
		 *
		 * <pre>
		 * x = 5
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public static final class ValueBody extends AbstractBody {
			private final Value value;

			public ValueBody(Value value) {
				super(BODY_value);
				this.value = value;
			}

			public Value value() {
				return value;
			}

			@Override
			public int hashCode() {
				return value.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof ValueBody && ((ValueBody) o).value.equals(value);
			}

			@Override
			public String toString() {
				return value.toString();
			}
		}

		/**
		 * Represents an alias of another variable, such as <code>y = x</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static final class VariableBody extends AbstractBody {
			private final Variable variable;

			public VariableBody(Variable variable) {
				super(BODY_variable);
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
				return o instanceof VariableBody && ((VariableBody) o).variable.equals(variable);
			}

			@Override
			public String toString() {
				return variable.toString();
			}
		}

		/**
		 * Represents a function application, <code>r = f a</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static final class Application extends AbstractBody {
			private final Variable function;
			private final Variable argument;

			public Application(Variable function, Variable argument) {
				super(BODY_application);
				this.function = function;
				this.argument = argument;
			}

			public Variable function() {
				return function;
			}

			public Variable argument() {
				return argument;
			}

			@Override
			public int hashCode() {
				return function.hashCode() ^ (31 * argument.hashCode());
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Application) {
					Application a = (Application) o;
					return function.equals(a.function) && argument.equals(a.argument);
				}
				return false;
			}

			@Override
			public String toString() {
				return function + " " + argument;
			}
		}

		/**
		 * Represents a conditional of the form:
		 *
		 * <pre>
		 * r = x ~ p ? fun a -> ( ... ) : fun b -> ( ... )
		 * </pre>
		 *
		 * The first function is taken when the subject matches the pattern, the
		 * second when it does not. Each function's parameter is bound to the
		 * subject.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static final class Conditional extends AbstractBody {
			private final Variable subject;
			private final Pattern pattern;
			private final Value.Function match;
			private final Value.Function antimatch;

			public Conditional(Variable subject, Pattern pattern, Value.Function match, Value.Function antimatch) {
				super(BODY_conditional);
				this.subject = subject;
				this.pattern = pattern;
				this.match = match;
				this.antimatch = antimatch;
			}

			public Variable subject() {
				return subject;
			}

			public Pattern pattern() {
				return pattern;
			}

			/**
			 * Get the branch taken when the subject matches the pattern.
			 *
			 * @return
			 */
			public Value.Function match() {
				return match;
			}

			/**
			 * Get the branch taken when the subject does not match the pattern.
			 *
			 * @return
			 */
			public Value.Function antimatch() {
				return antimatch;
			}

			@Override
			public int hashCode() {
				return subject.hashCode() ^ pattern.hashCode() ^ match.hashCode() ^ antimatch.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Conditional) {
					Conditional c = (Conditional) o;
					return subject.equals(c.subject) && pattern.equals(c.pattern) && match.equals(c.match)
							&& antimatch.equals(c.antimatch);
				}
				return false;
			}

			@Override
			public String toString() {
				return subject + " ~ " + pattern + " ? " + match + " : " + antimatch;
			}
		}

		public static final class Projection extends AbstractBody {
			private final Variable record;
			private final Identifier label;

			public Projection(Variable record, Identifier label) {
				super(BODY_projection);
				this.record = record;
				this.label = label;
			}

			public Variable record() {
				return record;
			}

			public Identifier label() {
				return label;
			}

			@Override
			public int hashCode() {
				return record.hashCode() ^ label.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Projection) {
					Projection p = (Projection) o;
					return record.equals(p.record) && label.equals(p.label);
				}
				return false;
			}

			@Override
			public String toString() {
				return record + "." + label;
			}
		}

		public static final class Dereference extends AbstractBody {
			private final Variable cell;

			public Dereference(Variable cell) {
				super(BODY_dereference);
				this.cell = cell;
			}

			public Variable cell() {
				return cell;
			}

			@Override
			public int hashCode() {
				return 37 * cell.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Dereference && ((Dereference) o).cell.equals(cell);
			}

			@Override
			public String toString() {
				return "!" + cell;
			}
		}

		/**
		 * Represents a mutable cell update, <code>r = c &lt;- v</code>. The clause
		 * itself evaluates to the empty record.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static final class Update extends AbstractBody {
			private final Variable cell;
			private final Variable value;

			public Update(Variable cell, Variable value) {
				super(BODY_update);
				this.cell = cell;
				this.value = value;
			}

			public Variable cell() {
				return cell;
			}

			public Variable value() {
				return value;
			}

			@Override
			public int hashCode() {
				return cell.hashCode() ^ (17 * value.hashCode());
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Update) {
					Update u = (Update) o;
					return cell.equals(u.cell) && value.equals(u.value);
				}
				return false;
			}

			@Override
			public String toString() {
				return cell + " <- " + value;
			}
		}

		public static final class BinaryOperation extends AbstractBody {
			private final Variable left;
			private final BinaryOperator operator;
			private final Variable right;

			public BinaryOperation(Variable left, BinaryOperator operator, Variable right) {
				super(BODY_binary);
				this.left = left;
				this.operator = operator;
				this.right = right;
			}

			public Variable leftOperand() {
				return left;
			}

			public BinaryOperator operator() {
				return operator;
			}

			public Variable rightOperand() {
				return right;
			}

			@Override
			public int hashCode() {
				return left.hashCode() ^ operator.hashCode() ^ (13 * right.hashCode());
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof BinaryOperation) {
					BinaryOperation b = (BinaryOperation) o;
					return left.equals(b.left) && operator == b.operator && right.equals(b.right);
				}
				return false;
			}

			@Override
			public String toString() {
				return left + " " + operator + " " + right;
			}
		}

		public static final class UnaryOperation extends AbstractBody {
			private final UnaryOperator operator;
			private final Variable operand;

			public UnaryOperation(UnaryOperator operator, Variable operand) {
				super(BODY_unary);
				this.operator = operator;
				this.operand = operand;
			}

			public UnaryOperator operator() {
				return operator;
			}

			public Variable operand() {
				return operand;
			}

			@Override
			public int hashCode() {
				return operator.hashCode() ^ operand.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof UnaryOperation) {
					UnaryOperation u = (UnaryOperation) o;
					return operator == u.operator && operand.equals(u.operand);
				}
				return false;
			}

			@Override
			public String toString() {
				return operator + " " + operand;
			}
		}
	}

	/**
	 * Represents a single clause <code>x = b</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Clause {
		private final Variable variable;
		private final Body body;

		public Clause(Variable variable, Body body) {
			if (variable == null || body == null) {
				throw new IllegalArgumentException("clause requires variable and body");
			}
			this.variable = variable;
			this.body = body;
		}

		/**
		 * Return the variable being bound.
		 *
		 * @return
		 */
		public Variable variable() {
			return variable;
		}

		public Body body() {
			return body;
		}

		@Override
		public int hashCode() {
			return variable.hashCode() ^ body.hashCode();
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Clause) {
				Clause c = (Clause) o;
				return variable.equals(c.variable) && body.equals(c.body);
			}
			return false;
		}

		@Override
		public String toString() {
			return variable + " = " + body;
		}
	}

	/**
	 * A non-empty sequence of clauses.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Expr {
		private final Clause[] clauses;

		public Expr(Clause... clauses) {
			if (clauses.length == 0) {
				throw new IllegalArgumentException("expression requires at least one clause");
			}
			this.clauses = Arrays.copyOf(clauses, clauses.length);
		}

		public int size() {
			return clauses.length;
		}

		public Clause get(int i) {
			return clauses[i];
		}

		public Clause[] toArray() {
			return Arrays.copyOf(clauses, clauses.length);
		}

		/**
		 * Get the variable holding the result of this expression. That is, the
		 * variable bound by its last clause.
		 *
		 * @return
		 */
		public Variable returnVariable() {
			return clauses[clauses.length - 1].variable();
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(clauses);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Expr && Arrays.equals(((Expr) o).clauses, clauses);
		}

		@Override
		public String toString() {
			String contents = "";
			for (int i = 0; i != clauses.length; ++i) {
				if (i != 0) {
					contents += "; ";
				}
				contents += clauses[i];
			}
			return contents;
		}
	}
}
