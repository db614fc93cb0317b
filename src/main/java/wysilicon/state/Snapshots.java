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

import java.util.function.Function;

/**
 * Supplies the values of the resources added to a heap by production. When an
 * assertion is produced for the first time its values are unknown and fresh
 * terms are used. When it is produced again from an earlier consumption (for
 * example, when unfolding a predicate) the snapshot recorded by that
 * consumption is taken apart instead, such that the same values reappear.
 */
public interface Snapshots {

	/**
	 * Get the value for a single resource of the given sort.
	 *
	 * @param sort
	 * @return
	 */
	public Term next(Term.Sort sort);

	/**
	 * Get the snapshots for the left operand of a conjunction.
	 *
	 * @return
	 */
	public Snapshots first();

	/**
	 * Get the snapshots for the right operand of a conjunction.
	 *
	 * @return
	 */
	public Snapshots second();

	public static Snapshots fresh(Function<Term.Sort, ? extends Term> generator) {
		return new Snapshots() {
			@Override
			public Term next(Term.Sort sort) {
				return generator.apply(sort);
			}

			@Override
			public Snapshots first() {
				return this;
			}

			@Override
			public Snapshots second() {
				return this;
			}
		};
	}

	public static Snapshots of(Term snapshot) {
		return new Snapshots() {
			@Override
			public Term next(Term.Sort sort) {
				return Terms.convert(snapshot, sort);
			}

			@Override
			public Snapshots first() {
				return of(Terms.first(snapshot));
			}

			@Override
			public Snapshots second() {
				return of(Terms.second(snapshot));
			}
		};
	}
}
