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
package wysilicon.io;

import java.util.List;
import java.util.Map;

import wysilicon.state.Chunk;
import wysilicon.state.Heap;
import wysilicon.state.SymbolicState;
import wysilicon.state.Term;

/**
 * Renders symbolic states for diagnostic output, one component per line.
 */
public class StateFormatter {

	public String format(SymbolicState state, List<Term> pathConditions) {
		StringBuilder sb = new StringBuilder();
		sb.append("Store:");
		for (Map.Entry<String, Term> e : state.getStore().asMap().entrySet()) {
			sb.append("\n  ").append(e.getKey()).append(" -> ").append(e.getValue());
		}
		sb.append("\nHeap:");
		format(state.getHeap(), sb);
		sb.append("\nOld Heap:");
		format(state.getOldHeap(), sb);
		sb.append("\nPath Conditions:");
		for (Term t : pathConditions) {
			sb.append("\n  ").append(t);
		}
		return sb.toString();
	}

	private static void format(Heap heap, StringBuilder sb) {
		for (Chunk c : heap) {
			sb.append("\n  ").append(c);
		}
	}
}
