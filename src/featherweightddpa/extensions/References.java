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
import static featherweightddpa.pds.Structure.lookup;
import static featherweightddpa.pds.Structure.pop;
import static featherweightddpa.pds.Structure.popDynamic;
import static featherweightddpa.pds.Structure.push;

import java.util.Collections;
import java.util.stream.Stream;

import featherweightddpa.core.EdgeFunctions;
import featherweightddpa.core.Graph;
import featherweightddpa.core.Graph.AnnotatedClause;
import featherweightddpa.core.Stores;
import featherweightddpa.core.Syntax.Body;
import featherweightddpa.core.Syntax.Value;
import featherweightddpa.core.Syntax.Variable;
import featherweightddpa.pds.DynamicPops.Kind;
import featherweightddpa.pds.DynamicPops.Targeted;
import featherweightddpa.pds.Structure.Continuation;
import featherweightddpa.pds.Structure.Transition;

/**
 * Rules for mutable reference cells. An update <code>x = x1 &lt;- x2</code>
 * always produces the empty record, whilst a dereference
 * <code>x = !x'</code> looks up the cell <code>x'</code> and then searches for
 * the most recent update which may alias it.
 *
 * @author David J. Pearce
 *
 */
public class References extends EdgeFunctions.Extension {

	/**
	 * The value produced by every update.
	 */
	public static final Value.Record EMPTY_RECORD = new Value.Record(Collections.emptyMap());

	@Override
	public EdgeFunctions.Rule[] rules() {
		return new EdgeFunctions.Rule[] {
				this::updateIsEmptyRecord,
				References::dereferenceStart,
				// Dereference Stop
				(acl1, acl0) -> dynpop(Kind.DEREFERENCE_STOP, acl0),
				// Alias Analysis
				References::aliasAnalysisStart,
				References::mayNotAlias,
				References::mayAlias };
	}

	/**
	 * Rule Update Is Empty Record.
	 */
	private Stream<Transition> updateIsEmptyRecord(AnnotatedClause acl1, AnnotatedClause acl0) {
		if (bodyOf(acl1, Body.Update.class) == null) {
			return none();
		}
		Variable x = Graph.clauseOf(acl1).variable();
		Stores.Witness<?> sw = self.singletonWitness(x, EMPTY_RECORD);
		return transition(acl1, pop(lookup(x)), push(new Continuation.Store(sw)));
	}

	/**
	 * Rule Dereference Start. A lookup for <code>x</code> reaching
	 * <code>x = !x'</code> continues as a lookup for the cell <code>x'</code>.
	 */
	private static Stream<Transition> dereferenceStart(AnnotatedClause acl1, AnnotatedClause acl0) {
		Body.Dereference b = bodyOf(acl1, Body.Dereference.class);
		if (b == null) {
			return none();
		}
		return transition(acl1,
				pop(lookup(Graph.clauseOf(acl1).variable())),
				push(Continuation.Dereference),
				push(lookup(b.cell())));
	}

	private static Stream<Transition> aliasAnalysisStart(AnnotatedClause acl1, AnnotatedClause acl0) {
		if (bodyOf(acl1, Body.Update.class) == null) {
			return none();
		}
		return dynpop(Targeted.of(Kind.ALIAS_ANALYSIS_START, acl1, acl0), acl1);
	}

	private static Stream<Transition> mayNotAlias(AnnotatedClause acl1, AnnotatedClause acl0) {
		if (bodyOf(acl1, Body.Update.class) == null) {
			return none();
		}
		return transition(acl1, pop(Continuation.AliasCheck), popDynamic(Targeted.of(Kind.MAY_NOT_ALIAS_1_OF_3)));
	}

	/**
	 * Rule May Alias. When the updated cell may alias the one being dereferenced,
	 * the lookup continues for the value written by the update.
	 */
	private static Stream<Transition> mayAlias(AnnotatedClause acl1, AnnotatedClause acl0) {
		Body.Update b = bodyOf(acl1, Body.Update.class);
		if (b == null) {
			return none();
		}
		return transition(acl1, pop(Continuation.AliasCheck), popDynamic(Targeted.mayAlias(b.value())));
	}
}
