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

import wysilicon.state.Context;
import wysilicon.state.SymbolicState;

/**
 * What happens next. Symbolic execution is written in continuation-passing
 * style: rather than returning the state it reaches, each step hands that state
 * to a continuation and returns whatever the continuation returns. Since a
 * continuation may be invoked from several branches, it must not depend on
 * being invoked only once.
 */
@FunctionalInterface
public interface Continuation {
	public VerificationResult apply(SymbolicState state, Context context);
}
