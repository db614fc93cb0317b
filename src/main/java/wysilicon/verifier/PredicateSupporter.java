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

import wysilicon.core.SilFile.Decl;
import wysilicon.core.SilFile.Expr;
import wysilicon.state.Context;
import wysilicon.state.SymbolicState;
import wysilicon.state.Term;

/**
 * Exchanges the body of a predicate for an instance of it, and vice versa.
 */
public interface PredicateSupporter {

	public VerificationResult fold(SymbolicState state, Decl.Predicate predicate, List<Term> arguments,
			Term permission, VerificationError.Partial pve, Context context, Continuation Q);

	public VerificationResult unfold(SymbolicState state, Decl.Predicate predicate, List<Term> arguments,
			Term permission, VerificationError.Partial pve, Context context, Expr.PredicateAccess location,
			Continuation Q);
}
