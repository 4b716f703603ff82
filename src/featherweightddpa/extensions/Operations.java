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
import featherweightddpa.core.Graph;
import featherweightddpa.core.Graph.AnnotatedClause;
import featherweightddpa.core.Syntax.Body;
import featherweightddpa.core.Syntax.Variable;
import featherweightddpa.pds.DynamicPops.Targeted;
import featherweightddpa.pds.Structure.Continuation;
import featherweightddpa.pds.Structure.Transition;

/**
 * Rules for binary and unary operations. Each operand is looked up in turn and
 * captured, after which the operator is applied abstractly by the dynamic pop
 * handlers.
 *
 * @author David J. Pearce
 *
 */
public class Operations extends EdgeFunctions.Extension {

	@Override
	public EdgeFunctions.Rule[] rules() {
		return new EdgeFunctions.Rule[] {
				Operations::binaryStart,
				Operations::binaryStop,
				Operations::unaryStart,
				Operations::unaryStop };
	}

	/**
	 * Rule Binary Operation Start. The left operand is looked up first, then the
	 * right operand from the same point, and finally the lookup resumes after
	 * the operation.
	 */
	private static Stream<Transition> binaryStart(AnnotatedClause acl1, AnnotatedClause acl0) {
		Body.BinaryOperation b = bodyOf(acl1, Body.BinaryOperation.class);
		if (b == null) {
			return none();
		}
		Variable x1 = Graph.clauseOf(acl1).variable();
		return transition(acl1,
				pop(lookup(x1)),
				push(Continuation.BinaryOperation),
				push(jump(acl0)),
				push(capture(2)),
				push(lookup(b.rightOperand())),
				push(jump(acl1)),
				push(capture(5)),
				push(lookup(b.leftOperand())));
	}

	private static Stream<Transition> binaryStop(AnnotatedClause acl1, AnnotatedClause acl0) {
		Body.BinaryOperation b = bodyOf(acl1, Body.BinaryOperation.class);
		if (b == null) {
			return none();
		}
		Targeted action = Targeted.binaryOperationStop(Graph.clauseOf(acl1).variable(), b.operator());
		return transition(acl1, pop(Continuation.BinaryOperation), popDynamic(action));
	}

	private static Stream<Transition> unaryStart(AnnotatedClause acl1, AnnotatedClause acl0) {
		Body.UnaryOperation b = bodyOf(acl1, Body.UnaryOperation.class);
		if (b == null) {
			return none();
		}
		return transition(acl1,
				pop(lookup(Graph.clauseOf(acl1).variable())),
				push(Continuation.UnaryOperation),
				push(jump(acl0)),
				push(capture(2)),
				push(lookup(b.operand())));
	}

	private static Stream<Transition> unaryStop(AnnotatedClause acl1, AnnotatedClause acl0) {
		Body.UnaryOperation b = bodyOf(acl1, Body.UnaryOperation.class);
		if (b == null) {
			return none();
		}
		Targeted action = Targeted.unaryOperationStop(Graph.clauseOf(acl1).variable(), b.operator());
		return transition(acl1, pop(Continuation.UnaryOperation), popDynamic(action));
	}
}
