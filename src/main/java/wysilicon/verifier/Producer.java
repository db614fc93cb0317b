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
package wysilicon.verifier;

import java.util.List;
import java.util.function.Function;

import wysilicon.core.SilFile.Expr;
import wysilicon.state.Context;
import wysilicon.state.Snapshots;
import wysilicon.state.SymbolicState;
import wysilicon.state.Term;

/**
 * Adds the resources and facts described by an assertion to a state.
 */
public interface Producer {

	/**
	 * Produce an assertion, scaling every permission it describes by a given
	 * amount. The values of any resources added are taken from the given
	 * snapshots.
	 *
	 * @param state
	 * @param snapshots
	 * @param permission
	 * @param assertion
	 * @param pve
	 * @param context
	 * @param Q
	 * @return
	 */
	public VerificationResult produce(SymbolicState state, Snapshots snapshots, Term permission, Expr assertion,
			VerificationError.Partial pve, Context context, Continuation Q);

	/**
	 * Produce a list of assertions in order, where the error reported for each
	 * is determined from the assertion itself.
	 *
	 * @param state
	 * @param snapshots
	 * @param permission
	 * @param assertions
	 * @param pveFn
	 * @param context
	 * @param Q
	 * @return
	 */
	public VerificationResult produces(SymbolicState state, Snapshots snapshots, Term permission,
			List<? extends Expr> assertions, Function<Expr, VerificationError.Partial> pveFn, Context context,
			Continuation Q);
}
