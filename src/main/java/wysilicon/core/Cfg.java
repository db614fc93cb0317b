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
package wysilicon.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import wysilicon.core.SilFile.Expr;
import wysilicon.core.SilFile.Stmt;

/**
 * <p>
 * The control-flow graph of a method body, as consumed by the symbolic
 * executor. A graph is made up of blocks connected by edges, where every block
 * lists its successors in a fixed order. There are three kinds of block:
 * </p>
 * <ul>
 * <li><b>Statement blocks</b> hold a single (possibly sequential) statement
 * which contains no further control flow.</li>
 * <li><b>Loop blocks</b> hold the guard, invariants and body graph of a loop,
 * along with the set of variables written by the body.</li>
 * <li><b>Constraining blocks</b> hold a body graph within which a given set of
 * permission variables may be constrained.</li>
 * </ul>
 * <p>
 * Edges are either <i>conditional</i>, in which case they are taken only when
 * their guard holds, or <i>unconditional</i>.
 * </p>
 */
public class Cfg {
	private final Block entry;

	public Cfg(Block entry) {
		this.entry = entry;
	}

	public Block getEntry() {
		return entry;
	}

	/**
	 * Determine all blocks reachable from the entry, in depth-first order. Loop
	 * and constraining bodies are included after the block which owns them.
	 *
	 * @return
	 */
	public List<Block> getBlocks() {
		ArrayList<Block> blocks = new ArrayList<>();
		collect(entry, blocks);
		return blocks;
	}

	private static void collect(Block block, List<Block> blocks) {
		for (Block b : blocks) {
			if (b == block) {
				return;
			}
		}
		blocks.add(block);
		if (block instanceof LoopBlock) {
			collect(((LoopBlock) block).getBody(), blocks);
		} else if (block instanceof ConstrainingBlock) {
			collect(((ConstrainingBlock) block).getBody(), blocks);
		}
		for (Edge e : block.getSuccessors()) {
			collect(e.getDestination(), blocks);
		}
	}

	// =========================================================================
	// Blocks
	// =========================================================================

	public static abstract class Block {
		private final ArrayList<Edge> successors = new ArrayList<>();

		public List<Edge> getSuccessors() {
			return Collections.unmodifiableList(successors);
		}

		public Block addSuccessor(Edge edge) {
			successors.add(edge);
			return this;
		}
	}

	public static class StatementBlock extends Block {
		private final Stmt stmt;

		public StatementBlock(Stmt stmt) {
			this.stmt = stmt;
		}

		public Stmt getStatement() {
			return stmt;
		}
	}

	public static class LoopBlock extends Block {
		private final Stmt.While loop;
		private final Block body;
		private final List<Expr.VariableAccess> writtenVariables;

		public LoopBlock(Stmt.While loop, Block body, List<Expr.VariableAccess> writtenVariables) {
			this.loop = loop;
			this.body = body;
			this.writtenVariables = new ArrayList<>(writtenVariables);
		}

		/**
		 * Get the structured loop from which this block was lowered. This is used
		 * for reporting errors against the loop as a whole.
		 *
		 * @return
		 */
		public Stmt.While getLoop() {
			return loop;
		}

		public Expr getCondition() {
			return loop.getCondition();
		}

		public List<Expr> getInvariant() {
			return loop.getInvariant();
		}

		public Block getBody() {
			return body;
		}

		public List<Expr.VariableAccess> getWrittenVariables() {
			return writtenVariables;
		}
	}

	public static class ConstrainingBlock extends Block {
		private final List<Expr.VariableAccess> variables;
		private final Block body;

		public ConstrainingBlock(List<Expr.VariableAccess> variables, Block body) {
			this.variables = new ArrayList<>(variables);
			this.body = body;
		}

		public List<Expr.VariableAccess> getVariables() {
			return variables;
		}

		public Block getBody() {
			return body;
		}
	}

	// =========================================================================
	// Edges
	// =========================================================================

	public static abstract class Edge {
		private final Block destination;

		public Edge(Block destination) {
			if (destination == null) {
				throw new IllegalArgumentException("edge requires a destination");
			}
			this.destination = destination;
		}

		public Block getDestination() {
			return destination;
		}
	}

	public static class ConditionalEdge extends Edge {
		private final Expr condition;

		public ConditionalEdge(Expr condition, Block destination) {
			super(destination);
			this.condition = condition;
		}

		public Expr getCondition() {
			return condition;
		}
	}

	public static class UnconditionalEdge extends Edge {
		public UnconditionalEdge(Block destination) {
			super(destination);
		}
	}
}
