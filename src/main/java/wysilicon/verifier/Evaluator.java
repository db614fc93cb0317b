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

import wysilicon.core.SilFile.Expr;
import wysilicon.state.Context;
import wysilicon.state.SymbolicState;
import wysilicon.state.Term;

/**
 * Evaluates pure expressions to symbolic terms.
 */
public interface Evaluator {

	@FunctionalInterface
	public interface TermContinuation {
		public VerificationResult apply(Term term, Context context);
	}

	@FunctionalInterface
	public interface TermsContinuation {
		public VerificationResult apply(List<Term> terms, Context context);
	}

	/**
	 * Evaluate an expression in a given state. Evaluation can fail, for example
	 * when a field is read without permission, in which case the given partial
	 * error is completed with the reason.
	 *
	 * @param state
	 * @param expr
	 * @param pve
	 * @param context
	 * @param Q
	 * @return
	 */
	public VerificationResult eval(SymbolicState state, Expr expr, VerificationError.Partial pve, Context context,
			TermContinuation Q);

	/**
	 * Evaluate a list of expressions from left to right.
	 *
	 * @param state
	 * @param exprs
	 * @param pve
	 * @param context
	 * @param Q
	 * @return
	 */
	public VerificationResult evals(SymbolicState state, List<? extends Expr> exprs, VerificationError.Partial pve,
			Context context, TermsContinuation Q);
}
