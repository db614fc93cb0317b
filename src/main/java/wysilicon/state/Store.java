// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package wysilicon.state;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * An immutable mapping from program variables to symbolic terms, kept in
 * insertion order.
 */
public final class Store {
	public static final Store EMPTY = new Store(Collections.emptyMap());

	private final Map<String, Term> bindings;

	private Store(Map<String, Term> bindings) {
		this.bindings = bindings;
	}

	public static Store of(Map<String, ? extends Term> bindings) {
		return new Store(Collections.unmodifiableMap(new LinkedHashMap<>(bindings)));
	}

	/**
	 * Get the term bound to a given variable, or <code>null</code> if it is
	 * unbound.
	 *
	 * @param variable
	 * @return
	 */
	public Term get(String variable) {
		return bindings.get(variable);
	}

	public boolean contains(String variable) {
		return bindings.containsKey(variable);
	}

	public Set<String> variables() {
		return bindings.keySet();
	}

	public Collection<Term> values() {
		return bindings.values();
	}

	public Map<String, Term> asMap() {
		return bindings;
	}

	public Store plus(String variable, Term value) {
		LinkedHashMap<String, Term> nbindings = new LinkedHashMap<>(bindings);
		nbindings.put(variable, value);
		return new Store(Collections.unmodifiableMap(nbindings));
	}

	/**
	 * Add all bindings of another store, overriding any existing bindings for the
	 * same variables.
	 *
	 * @param store
	 * @return
	 */
	public Store plus(Store store) {
		LinkedHashMap<String, Term> nbindings = new LinkedHashMap<>(bindings);
		nbindings.putAll(store.bindings);
		return new Store(Collections.unmodifiableMap(nbindings));
	}

	@Override
	public String toString() {
		return bindings.toString();
	}
}
