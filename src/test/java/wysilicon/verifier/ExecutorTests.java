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

import static org.junit.jupiter.api.Assertions.*;
import static wysilicon.core.SilFile.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import wysilicon.core.Cfg;
import wysilicon.core.SilFile;
import wysilicon.io.SilFilePrinter;
import wysilicon.state.Chunk;
import wysilicon.state.Context;
import wysilicon.state.Heap;
import wysilicon.state.Store;
import wysilicon.state.SymbolicState;
import wysilicon.state.Term;
import wysilicon.state.Term.Sort;
import wysilicon.state.Terms;
import wysilicon.verifier.support.DefaultConsumer;
import wysilicon.verifier.support.DefaultDecider;
import wysilicon.verifier.support.DefaultEvaluator;
import wysilicon.verifier.support.DefaultHeapCompressor;
import wysilicon.verifier.support.DefaultMagicWandSupporter;
import wysilicon.verifier.support.DefaultPredicateSupporter;
import wysilicon.verifier.support.DefaultProducer;

public class ExecutorTests {
	private static final Decl.Field F = FIELD("f", Type.Int);
	private static final Expr.VariableAccess B = VAR("b", Type.Bool);
	private static final Expr.VariableAccess N = VAR("n", Type.Int);
	private static final Expr.VariableAccess X = VAR("x", Type.Ref);
	private static final Expr.VariableAccess Y = VAR("y", Type.Ref);

	private static final Term.Var TN = new Term.Var("n", Sort.INT);
	private static final Term.Var TX = new Term.Var("x", Sort.REF);

	private final SilFile program = new SilFile(Arrays.asList(F));
	private final Context context = new Context(program);

	private Decider decider;
	private Executor executor;

	private void setup(Config config) {
		setup(config, new DefaultDecider(config));
	}

	private void setup(Config config, Decider decider) {
		this.decider = decider;
		Evaluator evaluator = new DefaultEvaluator(decider);
		HeapCompressor compressor = new DefaultHeapCompressor(decider);
		Producer producer = new DefaultProducer(decider, evaluator, compressor);
		Consumer consumer = new DefaultConsumer(decider, evaluator);
		executor = new Executor(config, evaluator, producer, consumer, decider,
				new DefaultPredicateSupporter(decider, producer, consumer, compressor),
				new DefaultMagicWandSupporter(decider, producer, consumer), compressor);
	}

	@AfterEach
	public void close() {
		if (decider != null) {
			decider.close();
		}
	}

	private static SymbolicState state(Heap heap) {
		Store store = Store.EMPTY.plus("n", TN).plus("x", TX);
		return new SymbolicState(store, heap, heap);
	}

	@Test
	public void test_unlowered_01() {
		setup(new Config());
		Stmt s = IFELSE(B, ASSIGN(N, CONST(1)), null);
		assertThrows(IllegalStateException.class,
				() -> executor.exec(state(Heap.EMPTY), s, context, (s1, c1) -> VerificationResult.SUCCESS));
	}

	@Test
	public void test_unlowered_02() {
		setup(new Config());
		assertThrows(IllegalStateException.class, () -> executor.exec(state(Heap.EMPTY), LABEL("l"), context,
				(s1, c1) -> VerificationResult.SUCCESS));
	}

	@Test
	public void test_assign_01() {
		setup(new Config());
		AtomicReference<Term> result = new AtomicReference<>();
		VerificationResult r = executor.exec(state(Heap.EMPTY), ASSIGN(N, ADD(N, CONST(1))), context, (s1, c1) -> {
			result.set(s1.getStore().get("n"));
			return VerificationResult.SUCCESS;
		});
		assertFalse(r.isFatal());
		assertEquals(Terms.plus(TN, Terms.num(1, Sort.INT)), result.get());
	}

	@Test
	public void test_subsumption_01() {
		setup(new Config());
		Term fact = Terms.atMost(Terms.num(0, Sort.INT), TN);
		decider.assume(Terms.less(Terms.num(0, Sort.INT), TN));
		AtomicReference<Boolean> learned = new AtomicReference<>();
		VerificationResult r = executor.exec(state(Heap.EMPTY), ASSERT(LTEQ(CONST(0), N)), context, (s1, c1) -> {
			learned.set(decider.getPathConditions().contains(fact));
			return VerificationResult.SUCCESS;
		});
		assertFalse(r.isFatal());
		assertTrue(learned.get());
	}

	@Test
	public void test_subsumption_02() {
		setup(new Config().setDisableSubsumption(true));
		Term fact = Terms.atMost(Terms.num(0, Sort.INT), TN);
		decider.assume(Terms.less(Terms.num(0, Sort.INT), TN));
		AtomicReference<Boolean> learned = new AtomicReference<>();
		VerificationResult r = executor.exec(state(Heap.EMPTY), ASSERT(LTEQ(CONST(0), N)), context, (s1, c1) -> {
			learned.set(decider.getPathConditions().contains(fact));
			return VerificationResult.SUCCESS;
		});
		assertFalse(r.isFatal());
		assertFalse(learned.get());
	}

	@Test
	public void test_new_01() {
		setup(new Config());
		Heap heap = Heap.EMPTY.plus(new Chunk.Field(TX, "f", TN, Terms.fullPerm()));
		AtomicReference<SymbolicState> after = new AtomicReference<>();
		VerificationResult r = executor.exec(state(heap), NEW(Y, Arrays.asList(F)), context, (s1, c1) -> {
			after.set(s1);
			Term ty = s1.getStore().get("y");
			assertTrue(decider.check(Terms.neq(ty, Term.NULL)));
			assertTrue(decider.check(Terms.neq(ty, TX)));
			return VerificationResult.SUCCESS;
		});
		assertFalse(r.isFatal());
		Term ty = after.get().getStore().get("y");
		assertEquals(2, after.get().getHeap().size());
		assertNotNull(decider.getFieldChunk(after.get().getHeap(), ty, "f"));
	}

	@Test
	public void test_fieldwrite_01() {
		setup(new Config());
		Heap heap = Heap.EMPTY.plus(new Chunk.Field(TX, "f", TN, Terms.fullPerm()));
		decider.assume(Terms.neq(TX, Term.NULL));
		AtomicReference<SymbolicState> after = new AtomicReference<>();
		VerificationResult r = executor.exec(state(heap), ASSIGN(FIELDACCESS(X, F), CONST(3)), context, (s1, c1) -> {
			after.set(s1);
			return VerificationResult.SUCCESS;
		});
		assertFalse(r.isFatal());
		// Exactly one chunk for x.f, holding the new value
		int count = 0;
		for (Chunk c : after.get().getHeap()) {
			if (c instanceof Chunk.Field && ((Chunk.Field) c).getField().equals("f")) {
				count++;
			}
		}
		assertEquals(1, count);
		Chunk.Field ch = decider.getFieldChunk(after.get().getHeap(), TX, "f");
		assertEquals(Terms.num(3, Sort.INT), ch.getValue());
		assertEquals(Terms.fullPerm(), ch.getPermission());
		// The old heap is unaffected
		assertEquals(TN, decider.getFieldChunk(after.get().getOldHeap(), TX, "f").getValue());
	}

	@Test
	public void test_assert_01() {
		setup(new Config());
		VerificationResult r = executor.exec(state(Heap.EMPTY), ASSERT(LT(CONST(0), N)), context,
				(s1, c1) -> VerificationResult.SUCCESS);
		assertTrue(r.isFatal());
		VerificationError error = ((VerificationResult.Failure) r).getError();
		assertEquals(VerificationError.Kind.ASSERT_FAILED, error.getKind());
		assertEquals(ErrorReason.Kind.ASSERTION_FALSE, error.getReason().getKind());
	}

	@Test
	public void test_fieldwrite_02() {
		setup(new Config());
		// Permission alone does not establish the receiver is non-null
		Heap heap = Heap.EMPTY.plus(new Chunk.Field(TX, "f", TN, Terms.fullPerm()));
		VerificationResult r = executor.exec(state(heap), ASSIGN(FIELDACCESS(X, F), CONST(3)), context,
				(s1, c1) -> VerificationResult.SUCCESS);
		assertTrue(r.isFatal());
		VerificationError error = ((VerificationResult.Failure) r).getError();
		assertEquals(VerificationError.Kind.ASSIGNMENT_FAILED, error.getKind());
		assertEquals(ErrorReason.Kind.RECEIVER_NULL, error.getReason().getKind());
	}

	@Test
	public void test_inhale_01() {
		setup(new Config());
		AtomicBoolean reached = new AtomicBoolean();
		Stmt s = SEQUENCE(INHALE(CONST(false)), ASSERT(CONST(false)));
		VerificationResult r = executor.exec(state(Heap.EMPTY), s, context, (s1, c1) -> {
			reached.set(true);
			return VerificationResult.SUCCESS;
		});
		assertFalse(r.isFatal());
		assertFalse(reached.get());
	}

	@Test
	public void test_edge_01() {
		setup(new Config());
		// The guard is known false so its destination is never executed
		decider.assume(Terms.less(Terms.num(0, Sort.INT), TN));
		AtomicBoolean reached = new AtomicBoolean();
		VerificationResult r = executor.exec(state(Heap.EMPTY), guarded(LT(N, CONST(0))), context, (s1, c1) -> {
			reached.set(true);
			return VerificationResult.SUCCESS;
		});
		assertFalse(r.isFatal());
		assertFalse(reached.get());
	}

	@Test
	public void test_edge_02() {
		setup(new Config());
		VerificationResult r = executor.exec(state(Heap.EMPTY), guarded(LT(N, CONST(0))), context,
				(s1, c1) -> VerificationResult.SUCCESS);
		assertTrue(r.isFatal());
		assertEquals(VerificationError.Kind.ASSERT_FAILED, ((VerificationResult.Failure) r).getError().getKind());
	}

	@Test
	public void test_logging_01() {
		Config config = new Config();
		ArrayList<String> comments = new ArrayList<>();
		setup(config, new DefaultDecider(config) {
			@Override
			public void logComment(String comment) {
				comments.add(comment);
			}
		});
		Stmt s = ASSIGN(N, ADD(N, CONST(1)));
		// Statements are only printed when debugging
		executor.exec(state(Heap.EMPTY), s, context, (s1, c1) -> VerificationResult.SUCCESS);
		assertTrue(comments.isEmpty());
		Configurator.setLevel(Executor.class.getName(), Level.DEBUG);
		try {
			executor.exec(state(Heap.EMPTY), s, context, (s1, c1) -> VerificationResult.SUCCESS);
		} finally {
			Configurator.setLevel(Executor.class.getName(), Level.WARN);
		}
		assertEquals(Arrays.asList("[exec]", SilFilePrinter.toString(s)), comments);
	}

	/**
	 * A block <code>n := n</code> with a single successor, reached when a given
	 * condition holds, which asserts <code>false</code>.
	 *
	 * @param condition
	 * @return
	 */
	private static Cfg.Block guarded(Expr condition) {
		Cfg.Block entry = new Cfg.StatementBlock(ASSIGN(N, N));
		entry.addSuccessor(new Cfg.ConditionalEdge(condition, new Cfg.StatementBlock(ASSERT(CONST(false)))));
		return entry;
	}
}
