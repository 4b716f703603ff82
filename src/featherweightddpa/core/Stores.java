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
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

import featherweightddpa.core.Syntax.Value;
import featherweightddpa.core.Syntax.Variable;

/**
 * Abstract stores map variables to the abstract values they hold. The rule
 * engine is independent of how stores are represented: it only requires the
 * capability set given by {@link Operations}, together with a
 * {@link Registry} which gives each distinct store a canonical witness.
 *
 * @author David J. Pearce
 *
 */
public class Stores {

	/**
	 * The operations required over a given store representation.
	 *
	 * @param <S> The store representation
	 */
	public interface Operations<S> {
		/**
		 * Construct the store with no bindings.
		 *
		 * @return
		 */
		public S empty();

		/**
		 * Construct the store with exactly one binding.
		 *
		 * @param variable
		 * @param value
		 * @return
		 */
		public S singleton(Variable variable, Value value);

		/**
		 * Bind a variable in a given store, producing an updated store. Observe that
		 * the variable may already be bound, in which case the original binding is
		 * simply lost.
		 *
		 * @param store
		 * @param variable
		 * @param value
		 * @return
		 */
		public S insert(S store, Variable variable, Value value);

		/**
		 * Get the value bound to a variable, or null if it is unbound.
		 *
		 * @param store
		 * @param variable
		 * @return
		 */
		public Value lookup(S store, Variable variable);
	}

	/**
	 * The default store representation: an immutable map ordered by variable name.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class MapStore {
		public static final MapStore EMPTY = new MapStore(new TreeMap<>());

		private final Map<String, Binding> bindings;

		private MapStore(TreeMap<String, Binding> bindings) {
			this.bindings = Collections.unmodifiableMap(bindings);
		}

		public int size() {
			return bindings.size();
		}

		public Value get(Variable variable) {
			Binding b = bindings.get(variable.name());
			return b == null ? null : b.value;
		}

		public MapStore put(Variable variable, Value value) {
			// Clone the bindings in order to update them
			TreeMap<String, Binding> nbindings = new TreeMap<>(bindings);
			nbindings.put(variable.name(), new Binding(variable, value));
			return new MapStore(nbindings);
		}

		@Override
		public int hashCode() {
			return bindings.hashCode();
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof MapStore && ((MapStore) o).bindings.equals(bindings);
		}

		@Override
		public String toString() {
			String r = "";
			for (Binding b : bindings.values()) {
				if (!r.isEmpty()) {
					r += ", ";
				}
				r += b;
			}
			return "{" + r + "}";
		}

		private static final class Binding {
			private final Variable variable;
			private final Value value;

			public Binding(Variable variable, Value value) {
				this.variable = variable;
				this.value = value;
			}

			@Override
			public int hashCode() {
				return variable.hashCode() ^ value.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Binding) {
					Binding b = (Binding) o;
					return variable.equals(b.variable) && value.equals(b.value);
				}
				return false;
			}

			@Override
			public String toString() {
				return variable + " -> " + value;
			}
		}
	}

	/**
	 * Operations over the default store representation.
	 */
	public static final Operations<MapStore> MAP_OPERATIONS = new Operations<MapStore>() {
		@Override
		public MapStore empty() {
			return MapStore.EMPTY;
		}

		@Override
		public MapStore singleton(Variable variable, Value value) {
			return MapStore.EMPTY.put(variable, value);
		}

		@Override
		public MapStore insert(MapStore store, Variable variable, Value value) {
			return store.put(variable, value);
		}

		@Override
		public Value lookup(MapStore store, Variable variable) {
			return store.get(variable);
		}
	};

	/**
	 * A canonical handle for a store. Witnesses are only ever created by a
	 * registry, which guarantees that equal stores share one witness. Hence,
	 * witnesses are compared by identity.
	 *
	 * @param <S>
	 */
	public static final class Witness<S> {
		private final S store;
		private final int index;

		private Witness(S store, int index) {
			this.store = store;
			this.index = index;
		}

		public S store() {
			return store;
		}

		/**
		 * The order in which this witness was registered.
		 *
		 * @return
		 */
		public int index() {
			return index;
		}

		@Override
		public String toString() {
			return "#" + index + store;
		}
	}

	/**
	 * Responsible for interning stores.
	 *
	 * @param <S>
	 */
	public interface Registry<S> {
		/**
		 * Get the canonical witness for a given store, registering it if necessary.
		 *
		 * @param store
		 * @return
		 */
		public Witness<S> witnessOf(S store);

		/**
		 * Get the number of distinct stores registered so far.
		 *
		 * @return
		 */
		public int size();
	}

	/**
	 * An append-only registry which may be shared between threads.
	 *
	 * @author David J. Pearce
	 *
	 * @param <S>
	 */
	public static class InterningRegistry<S> implements Registry<S> {
		private final ConcurrentMap<S, Witness<S>> witnesses = new ConcurrentHashMap<>();
		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Witness<S> witnessOf(S store) {
			if (store == null) {
				throw new IllegalArgumentException("cannot register null store");
			}
			return witnesses.computeIfAbsent(store, s -> new Witness<>(s, counter.getAndIncrement()));
		}

		@Override
		public int size() {
			return witnesses.size();
		}
	}
}
