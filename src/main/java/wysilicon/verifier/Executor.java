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

import static wysilicon.verifier.VerificationError.Kind.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import wysilicon.core.Cfg;
import wysilicon.core.SilFile;
import wysilicon.core.SilFile.Decl;
import wysilicon.core.SilFile.Expr;
import wysilicon.core.SilFile.Stmt;
import wysilicon.io.SilFilePrinter;
import wysilicon.io.StateFormatter;
import wysilicon.state.Chunk;
import wysilicon.state.Context;
import wysilicon.state.Heap;
import wysilicon.state.Snapshots;
import wysilicon.state.Store;
import wysilicon.state.SymbolicState;
import wysilicon.state.Term;
import wysilicon.state.Terms;

/**
 * <p>
 * Symbolically executes the control-flow graph of a method body. Execution is
 * written in continuation-passing style: executing a block or statement takes
 * a continuation <code>Q</code> which is invoked with every state reached
 * afterwards, and the result of execution combines the results of all such
 * invocations. Where execution splits (for example, over the edges leaving a
 * block, or over the two halves of a loop proof) the results of the parts are
 * combined with {@link VerificationResult#and(java.util.function.Supplier)},
 * such that the first failure stops all further exploration.
 * </p>
 * <p>
 * The executor is concerned only with sequencing. Evaluating expressions,
 * producing and consuming assertions, folding predicates and packaging wands
 * are all delegated to collaborators.
 * </p>
 */
public class Executor {
	private static final Logger logger = LogManager.getLogger(Executor.class);

	private final Config config;
	private final Evaluator evaluator;
	private final Producer producer;
	private final Consumer consumer;
	private final Decider decider;
	private final PredicateSupporter predicateSupporter;
	private final MagicWandSupporter magicWandSupporter;
	private final HeapCompressor heapCompressor;
	private final StateFormatter stateFormatter = new StateFormatter();

	public Executor(Config config, Evaluator evaluator, Producer producer, Consumer consumer, Decider decider,
			PredicateSupporter predicateSupporter, MagicWandSupporter magicWandSupporter,
			HeapCompressor heapCompressor) {
		this.config = config;
		this.evaluator = evaluator;
		this.producer = producer;
		this.consumer = consumer;
		this.decider = decider;
		this.predicateSupporter = predicateSupporter;
		this.magicWandSupporter = magicWandSupporter;
		this.heapCompressor = heapCompressor;
	}

	// =========================================================================
	// Blocks & Edges
	// =========================================================================

	/**
	 * Execute a block and then everything reachable from it. The continuation is
	 * invoked whenever control reaches a block without successors.
	 *
	 * @param state
	 * @param block
	 * @param context
	 * @param Q
	 * @return
	 */
	public VerificationResult exec(SymbolicState state, Cfg.Block block, Context context, Continuation Q) {
		if (block instanceof Cfg.StatementBlock) {
			Cfg.StatementBlock b = (Cfg.StatementBlock) block;
			return exec(state, b.getStatement(), context, (s1, c1) -> leave(s1, b, c1, Q));
		} else if (block instanceof Cfg.LoopBlock) {
			return execLoop(state, (Cfg.LoopBlock) block, context, Q);
		} else if (block instanceof Cfg.ConstrainingBlock) {
			return execConstraining(state, (Cfg.ConstrainingBlock) block, context, Q);
		} else {
			throw new IllegalArgumentException("unknown block encountered (" + block.getClass().getName() + ")");
		}
	}

	private VerificationResult follow(SymbolicState state, Cfg.Edge edge, Context context, Continuation Q) {
		if (edge instanceof Cfg.ConditionalEdge) {
			Cfg.ConditionalEdge ce = (Cfg.ConditionalEdge) edge;
			VerificationError.Partial pve = VerificationError.of(IF_FAILED, ce.getCondition());
			return evaluator.eval(state, ce.getCondition(), pve, context,
					(tCond, c1) -> decider.branch(tCond,
							() -> exec(state, ce.getDestination(), c1, Q),
							() -> VerificationResult.SUCCESS));
		} else if (edge instanceof Cfg.UnconditionalEdge) {
			return exec(state, edge.getDestination(), context, Q);
		} else {
			throw new IllegalArgumentException("unknown edge encountered (" + edge.getClass().getName() + ")");
		}
	}

	private VerificationResult follows(SymbolicState state, List<Cfg.Edge> edges, Context context, Continuation Q) {
		if (edges.isEmpty()) {
			return Q.apply(state, context);
		} else {
			return follows(state, edges, 0, context, Q);
		}
	}

	private VerificationResult follows(SymbolicState state, List<Cfg.Edge> edges, int index, Context context,
			Continuation Q) {
		if (index == edges.size()) {
			return VerificationResult.SUCCESS;
		} else {
			return follow(state, edges.get(index), context, Q)
					.and(() -> follows(state, edges, index + 1, context, Q));
		}
	}

	private VerificationResult leave(SymbolicState state, Cfg.Block block, Context context, Continuation Q) {
		return follows(state, block.getSuccessors(), context, Q);
	}

	/**
	 * <p>
	 * Verify a loop using its invariant. This involves two independent proofs,
	 * each carried out in its own scope:
	 * </p>
	 * <ol>
	 * <li>Starting from an arbitrary iteration, where every variable written in
	 * the body has an unknown value and the heap holds only what the invariant
	 * and guard describe, executing the body re-establishes the invariant.</li>
	 * <li>The invariant holds on entry. Execution then continues after the loop
	 * from a state described by the invariant and the negated guard.</li>
	 * </ol>
	 *
	 * @param state
	 * @param lb
	 * @param context
	 * @param Q
	 * @return
	 */
	private VerificationResult execLoop(SymbolicState state, Cfg.LoopBlock lb, Context context, Continuation Q) {
		Stmt.While loop = lb.getLoop();
		decider.logComment("loop at " + position(loop));
		List<Expr> invs = lb.getInvariant();
		Expr inv = SilFile.AND(invs);
		Expr invAndGuard = SilFile.AND(inv, lb.getCondition());
		Expr invAndNotGuard = SilFile.AND(inv, SilFile.NOT(lb.getCondition()));
		VerificationError.Partial whileFailed = VerificationError.of(WHILE_FAILED, loop);
		// Wand-typed variables are never havocked
		Store bodyStore = state.getStore();
		for (Expr.VariableAccess v : lb.getWrittenVariables()) {
			if (!(v.getType() instanceof SilFile.Type.Wand)) {
				bodyStore = bodyStore.plus(v.getVariable(), fresh(v));
			}
		}
		final Store havocked = bodyStore;
		SymbolicState bodyState = new SymbolicState(havocked, Heap.EMPTY, state.getOldHeap());
		//
		VerificationResult preserved = decider.inScope(() -> {
			decider.logComment("Verify loop body");
			return producer.produce(bodyState, freshSnapshots(), Terms.fullPerm(), invAndGuard, whileFailed, context,
					(s1, c1) -> {
						if (decider.checkSmoke()) {
							return VerificationResult.SUCCESS;
						}
						return exec(s1, lb.getBody(), c1,
								(s2, c2) -> consumer.consumes(s2, Terms.fullPerm(), invs,
										e -> VerificationError.of(LOOP_INVARIANT_NOT_PRESERVED, e), c2,
										(s3, snap, chunks, c3) -> VerificationResult.SUCCESS));
					});
		});
		return preserved.and(() -> decider.inScope(() -> {
			decider.logComment("Establish loop invariant");
			return consumer.consumes(state, Terms.fullPerm(), invs,
					e -> VerificationError.of(LOOP_INVARIANT_NOT_ESTABLISHED, e), context, (s1, snap, chunks, c1) -> {
						SymbolicState s2 = s1.withStore(havocked);
						decider.logComment("Continue after loop");
						return producer.produce(s2, freshSnapshots(), Terms.fullPerm(), invAndNotGuard, whileFailed, c1,
								(s3, c2) -> {
									if (decider.checkSmoke()) {
										return VerificationResult.SUCCESS;
									}
									return leave(s3, lb, c2, Q);
								});
					});
		}));
	}

	private VerificationResult execConstraining(SymbolicState state, Cfg.ConstrainingBlock cb, Context context,
			Continuation Q) {
		ArrayList<Term> arps = new ArrayList<>();
		for (Expr.VariableAccess v : cb.getVariables()) {
			arps.add(lookup(state, v));
		}
		Context c1 = context.setConstrainable(arps, true);
		return exec(state, cb.getBody(), c1, (s1, c2) -> leave(s1, cb, c2.setConstrainable(arps, false), Q));
	}

	// =========================================================================
	// Statements
	// =========================================================================

	public VerificationResult execs(SymbolicState state, List<Stmt> stmts, Context context, Continuation Q) {
		return execs(state, stmts, 0, context, Q);
	}

	private VerificationResult execs(SymbolicState state, List<Stmt> stmts, int index, Context context,
			Continuation Q) {
		if (index < stmts.size()) {
			return exec(state, stmts.get(index), context, (s1, c1) -> execs(s1, stmts, index + 1, c1, Q));
		} else {
			return Q.apply(state, context);
		}
	}

	/**
	 * Execute a single statement, which must not contain any control flow.
	 * Statements such as conditionals and loops are expected to have been
	 * lowered into the control-flow graph already, and encountering one here
	 * indicates a bug in whatever constructed the graph.
	 *
	 * @param state
	 * @param stmt
	 * @param context
	 * @param Q
	 * @return
	 */
	public VerificationResult exec(SymbolicState state, Stmt stmt, Context context, Continuation Q) {
		if (!(stmt instanceof Stmt.Sequence) && logger.isDebugEnabled()) {
			String text = SilFilePrinter.toString(stmt);
			logger.debug("EXECUTE {}: {}", position(stmt), text);
			if (config.isLogStates() && logger.isTraceEnabled()) {
				logger.trace(stateFormatter.format(state, decider.getPathConditions()));
			}
			decider.logComment("[exec]");
			decider.logComment(text);
		}
		if (stmt instanceof Stmt.Sequence) {
			return execs(state, ((Stmt.Sequence) stmt).getAll(), context, Q);
		} else if (stmt instanceof Stmt.LocalAssign) {
			return execLocalAssign(state, (Stmt.LocalAssign) stmt, context, Q);
		} else if (stmt instanceof Stmt.FieldWrite) {
			return execFieldWrite(state, (Stmt.FieldWrite) stmt, context, Q);
		} else if (stmt instanceof Stmt.New) {
			return execNew(state, (Stmt.New) stmt, context, Q);
		} else if (stmt instanceof Stmt.Fresh) {
			return execFresh(state, (Stmt.Fresh) stmt, context, Q);
		} else if (stmt instanceof Stmt.Inhale) {
			return execInhale(state, (Stmt.Inhale) stmt, context, Q);
		} else if (stmt instanceof Stmt.Exhale) {
			return execExhale(state, (Stmt.Exhale) stmt, context, Q);
		} else if (stmt instanceof Stmt.Assert) {
			return execAssert(state, (Stmt.Assert) stmt, context, Q);
		} else if (stmt instanceof Stmt.MethodCall) {
			return execMethodCall(state, (Stmt.MethodCall) stmt, context, Q);
		} else if (stmt instanceof Stmt.Fold) {
			return execFold(state, (Stmt.Fold) stmt, context, Q);
		} else if (stmt instanceof Stmt.Unfold) {
			return execUnfold(state, (Stmt.Unfold) stmt, context, Q);
		} else if (stmt instanceof Stmt.Package) {
			return execPackage(state, (Stmt.Package) stmt, context, Q);
		} else if (stmt instanceof Stmt.Apply) {
			return execApply(state, (Stmt.Apply) stmt, context, Q);
		} else if (stmt instanceof Stmt.IfElse || stmt instanceof Stmt.While || stmt instanceof Stmt.Label
				|| stmt instanceof Stmt.Goto || stmt instanceof Stmt.Constraining) {
			throw new IllegalStateException("unexpected statement (" + stmt.getClass().getName() + "): "
					+ SilFilePrinter.toString(stmt));
		} else {
			throw new IllegalArgumentException("unknown statement encountered (" + stmt.getClass().getName() + ")");
		}
	}

	private VerificationResult execLocalAssign(SymbolicState state, Stmt.LocalAssign stmt, Context context,
			Continuation Q) {
		Expr.VariableAccess lhs = stmt.getLeftHandSide();
		Expr rhs = stmt.getRightHandSide();
		if (lhs.getType() instanceof SilFile.Type.Wand) {
			if (!(rhs instanceof Expr.MagicWand)) {
				throw new IllegalStateException("expected magic wand but found " + rhs.getClass().getName());
			}
			VerificationError.Partial pve = VerificationError.of(LET_WAND_FAILED, stmt);
			return magicWandSupporter.createChunk(state, (Expr.MagicWand) rhs, pve, context,
					(chWand, c1) -> Q.apply(state.plus(lhs.getVariable(), new Term.WandChunk(chWand)), context));
		} else {
			VerificationError.Partial pve = VerificationError.of(ASSIGNMENT_FAILED, stmt);
			return evaluator.eval(state, rhs, pve, context,
					(tRhs, c1) -> Q.apply(state.plus(lhs.getVariable(), tRhs), c1));
		}
	}

	private VerificationResult execFieldWrite(SymbolicState state, Stmt.FieldWrite stmt, Context context,
			Continuation Q) {
		Expr.FieldAccess fa = stmt.getLeftHandSide();
		String field = fa.getField().getName();
		VerificationError.Partial pve = VerificationError.of(ASSIGNMENT_FAILED, stmt);
		return evaluator.eval(state, fa.getReceiver(), pve, context, (tRcvr, c1) -> {
			if (decider.assertTerm(Terms.neq(tRcvr, Term.NULL))) {
				return evaluator.eval(state, stmt.getRightHandSide(), pve, c1,
						(tRhs, c2) -> decider.withChunk(state.getHeap(), tRcvr, field, Terms.fullPerm(), fa, pve, c2,
								(fc, c3) -> {
									Chunk.Field nfc = new Chunk.Field(tRcvr, field, tRhs, fc.getPermission());
									return Q.apply(state.withHeap(state.getHeap().replace(fc, nfc)), c2);
								}));
			} else {
				return VerificationResult.failure(pve.dueTo(ErrorReason.receiverNull(fa)));
			}
		});
	}

	private VerificationResult execNew(SymbolicState state, Stmt.New stmt, Context context, Continuation Q) {
		Expr.VariableAccess v = stmt.getLeftHandSide();
		Term.Var t = decider.fresh(v.getVariable(), Term.Sort.REF);
		decider.assume(Terms.neq(t, Term.NULL));
		ArrayList<Chunk> chunks = new ArrayList<>();
		for (Decl.Field f : stmt.getFields()) {
			Term value = decider.fresh(f.getName(), Terms.toSort(f.getType()));
			chunks.add(new Chunk.Field(t, f.getName(), value, Terms.fullPerm()));
		}
		SymbolicState s1 = state.plus(v.getVariable(), t).plus(Heap.of(chunks));
		Set<Term> refs = getDirectlyReachableReferences(s1);
		refs.remove(t);
		ArrayList<Term> distinct = new ArrayList<>();
		for (Term r : refs) {
			distinct.add(Terms.neq(r, t));
		}
		decider.assume(Terms.and(distinct));
		return Q.apply(s1, context);
	}

	private VerificationResult execFresh(SymbolicState state, Stmt.Fresh stmt, Context context, Continuation Q) {
		Store arps = Store.EMPTY;
		ArrayList<Term> constraints = new ArrayList<>();
		for (Expr.VariableAccess v : stmt.getVariables()) {
			Decider.FreshArp arp = decider.freshArp();
			arps = arps.plus(v.getVariable(), arp.getPermission());
			constraints.add(arp.getConstraint());
		}
		// All bindings are added at once, overriding existing ones
		SymbolicState s1 = state.plus(arps);
		decider.assume(constraints);
		return Q.apply(s1, context);
	}

	private VerificationResult execInhale(SymbolicState state, Stmt.Inhale stmt, Context context, Continuation Q) {
		Expr a = stmt.getCondition();
		if (isFalse(a)) {
			return VerificationResult.SUCCESS;
		}
		VerificationError.Partial pve = VerificationError.of(INHALE_FAILED, stmt);
		return producer.produce(state, freshSnapshots(), Terms.fullPerm(), a, pve, context, Q);
	}

	private VerificationResult execExhale(SymbolicState state, Stmt.Exhale stmt, Context context, Continuation Q) {
		VerificationError.Partial pve = VerificationError.of(EXHALE_FAILED, stmt);
		return consumer.consume(state, Terms.fullPerm(), stmt.getCondition(), pve, context,
				(s1, snap, chunks, c1) -> Q.apply(s1, c1));
	}

	private VerificationResult execAssert(SymbolicState state, Stmt.Assert stmt, Context context, Continuation Q) {
		Expr a = stmt.getCondition();
		VerificationError.Partial pve = VerificationError.of(ASSERT_FAILED, stmt);
		if (isTrue(a)) {
			heapCompressor.compress(state, state.getHeap(), context);
			return Q.apply(state, context);
		} else if (isFalse(a)) {
			if (decider.checkSmoke()) {
				return VerificationResult.SUCCESS;
			} else {
				return VerificationResult.failure(pve.dueTo(ErrorReason.assertionFalse(a)));
			}
		} else if (config.isDisableSubsumption()) {
			VerificationResult r = decider.inScope(() -> consumer.consume(state, Terms.fullPerm(), a, pve, context,
					(s1, snap, chunks, c1) -> VerificationResult.SUCCESS));
			return r.and(() -> Q.apply(state, context));
		} else {
			return consumer.consume(state, Terms.fullPerm(), a, pve, context,
					(s1, snap, chunks, c1) -> Q.apply(state, c1));
		}
	}

	private VerificationResult execMethodCall(SymbolicState state, Stmt.MethodCall stmt, Context context,
			Continuation Q) {
		Decl.Method method = context.getProgram().findMethod(stmt.getName());
		List<Decl.Parameter> returns = method.getReturns();
		List<Expr.VariableAccess> targets = stmt.getTargets();
		if (targets.size() != returns.size()) {
			throw new IllegalArgumentException("invalid number of targets for call to " + method.getName());
		}
		VerificationError.Partial pve = VerificationError.of(PRECONDITION_IN_CALL_FALSE, stmt);
		return evaluator.evals(state, stmt.getArguments(), pve, context, (tArgs, c1) -> {
			Store ins = bind(method.getParameters(), tArgs);
			Expr pre = SilFile.AND(method.getRequires());
			return consumer.consume(state.withStore(ins), Terms.fullPerm(), pre, pve, c1, (s1, snap, chunks, c2) -> {
				Store outs = Store.EMPTY;
				for (Decl.Parameter r : returns) {
					outs = outs.plus(r.getName(), decider.fresh(r.getName(), Terms.toSort(r.getType())));
				}
				SymbolicState s2 = s1.plus(outs).withOldHeap(state.getHeap());
				Expr post = SilFile.AND(method.getEnsures());
				return producer.produce(s2, freshSnapshots(), Terms.fullPerm(), post, pve, c2, (s3, c3) -> {
					Store store = state.getStore();
					for (int i = 0; i != targets.size(); ++i) {
						store = store.plus(targets.get(i).getVariable(), s3.getStore().get(returns.get(i).getName()));
					}
					return Q.apply(new SymbolicState(store, s3.getHeap(), state.getOldHeap()), c3);
				});
			});
		});
	}

	private VerificationResult execFold(SymbolicState state, Stmt.Fold stmt, Context context, Continuation Q) {
		Expr.PredicateAccessPredicate pap = stmt.getPredicate();
		Decl.Predicate predicate = context.getProgram().findPredicate(pap.getLocation().getName());
		VerificationError.Partial pve = VerificationError.of(FOLD_FAILED, stmt);
		return evaluator.evals(state, pap.getLocation().getArguments(), pve, context,
				(tArgs, c1) -> evaluator.eval(state, pap.getPermission(), pve, c1, (tPerm, c2) -> {
					if (decider.assertTerm(Terms.isPositive(tPerm))) {
						return predicateSupporter.fold(state, predicate, tArgs, tPerm, pve, c2, Q);
					} else {
						return VerificationResult.failure(pve.dueTo(ErrorReason.negativePermission(pap.getPermission())));
					}
				}));
	}

	private VerificationResult execUnfold(SymbolicState state, Stmt.Unfold stmt, Context context, Continuation Q) {
		Expr.PredicateAccessPredicate pap = stmt.getPredicate();
		Expr.PredicateAccess pa = pap.getLocation();
		Decl.Predicate predicate = context.getProgram().findPredicate(pa.getName());
		VerificationError.Partial pve = VerificationError.of(UNFOLD_FAILED, stmt);
		return evaluator.evals(state, pa.getArguments(), pve, context,
				(tArgs, c1) -> evaluator.eval(state, pap.getPermission(), pve, c1, (tPerm, c2) -> {
					if (decider.assertTerm(Terms.isPositive(tPerm))) {
						return predicateSupporter.unfold(state, predicate, tArgs, tPerm, pve, c2, pa, Q);
					} else {
						return VerificationResult.failure(pve.dueTo(ErrorReason.negativePermission(pap.getPermission())));
					}
				}));
	}

	private VerificationResult execPackage(SymbolicState state, Stmt.Package stmt, Context context, Continuation Q) {
		Expr.MagicWand wand = stmt.getWand();
		VerificationError.Partial pve = VerificationError.of(PACKAGE_FAILED, stmt);
		List<List<Chunk>> consumed = Arrays.asList(Collections.emptyList(), Collections.emptyList());
		Context c0 = context.withReserveHeaps(Arrays.asList(Heap.EMPTY, state.getHeap()))
				.withProducedChunks(Collections.emptyList())
				.withConsumedChunks(consumed);
		return magicWandSupporter.packageWand(state, wand, pve, c0, (chWand, c1) -> {
			List<Heap> reserveHeaps = c1.getReserveHeaps();
			if (reserveHeaps.size() != 3) {
				throw new IllegalStateException(
						"expected exactly 3 reserve heaps in the context, but found " + reserveHeaps.size());
			}
			Heap h1 = reserveHeaps.get(2);
			Context c2 = c1.withReserveHeaps(Collections.emptyList())
					.withProducedChunks(Collections.emptyList())
					.withConsumedChunks(Collections.emptyList())
					.withLhsHeap(null);
			return Q.apply(state.withHeap(h1.plus(chWand)), c2);
		});
	}

	private VerificationResult execApply(SymbolicState state, Stmt.Apply stmt, Context context, Continuation Q) {
		Expr e = stmt.getWand();
		VerificationError.Partial pve = VerificationError.of(APPLY_FAILED, stmt);
		if (e instanceof Expr.MagicWand) {
			Expr.MagicWand wand = (Expr.MagicWand) e;
			return consumer.consume(state, Terms.fullPerm(), wand, pve, context,
					(s1, snap, chunks, c1) -> applyWand(s1, s1.getStore(), wand, pve, c1, Q));
		} else if (e instanceof Expr.VariableAccess) {
			Expr.VariableAccess v = (Expr.VariableAccess) e;
			Term t = lookup(state, v);
			if (!(t instanceof Term.WandChunk)) {
				throw new IllegalStateException("expected magic wand bound to " + v.getVariable() + ", found " + t);
			}
			Chunk.MagicWand chWand = ((Term.WandChunk) t).getChunk();
			Chunk.MagicWand ch = decider.getChunk(state.getHeap(), chWand);
			if (ch == null) {
				return VerificationResult.failure(pve.dueTo(ErrorReason.namedMagicWandChunkNotFound(v)));
			}
			return applyWand(state.minus(ch), Store.of(chWand.getBindings()), chWand.getWand(), pve, context, Q);
		} else {
			throw new IllegalStateException("expected a magic wand, but found " + e.getClass().getName());
		}
	}

	/**
	 * Exchange the left-hand side of a wand for its right-hand side. The wand
	 * itself must already have been removed from the heap.
	 *
	 * @param s1       The state after removing the wand.
	 * @param bindings The store in which the wand is interpreted.
	 * @param wand
	 * @param pve
	 * @param c1
	 * @param Q
	 * @return
	 */
	private VerificationResult applyWand(SymbolicState s1, Store bindings, Expr.MagicWand wand,
			VerificationError.Partial pve, Context c1, Continuation Q) {
		return consumer.consume(s1.withStore(bindings), Terms.fullPerm(), wand.getLeftHandSide(), pve, c1,
				(s2, snap, chunks, c2) -> {
					Context c2a = c2.withLhsHeap(s1.getHeap());
					return producer.produce(s2, freshSnapshots(), Terms.fullPerm(), wand.getRightHandSide(), pve, c2a,
							(s3, c3) -> Q.apply(s3.withStore(s1.getStore()), c3.withLhsHeap(null)));
				});
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	private Snapshots freshSnapshots() {
		return Snapshots.fresh(sort -> decider.fresh(sort));
	}

	private Term.Var fresh(Expr.VariableAccess v) {
		return decider.fresh(v.getVariable(), Terms.toSort(v.getType()));
	}

	private static Term lookup(SymbolicState state, Expr.VariableAccess v) {
		Term t = state.getStore().get(v.getVariable());
		if (t == null) {
			throw new IllegalStateException("unbound variable " + v.getVariable());
		}
		return t;
	}

	private static Store bind(List<Decl.Parameter> parameters, List<Term> arguments) {
		if (parameters.size() != arguments.size()) {
			throw new IllegalArgumentException("expected " + parameters.size() + " arguments, found " + arguments.size());
		}
		Store store = Store.EMPTY;
		for (int i = 0; i != parameters.size(); ++i) {
			store = store.plus(parameters.get(i).getName(), arguments.get(i));
		}
		return store;
	}

	/**
	 * Determine the references which can be reached from a state without
	 * following any field, namely those held in variables, those which are the
	 * receivers of field chunks and those held in fields or captured by
	 * predicates and wands.
	 *
	 * @param state
	 * @return
	 */
	private static Set<Term> getDirectlyReachableReferences(SymbolicState state) {
		LinkedHashSet<Term> refs = new LinkedHashSet<>();
		addReferences(state.getStore().values(), refs);
		for (Chunk ch : state.getHeap()) {
			if (ch instanceof Chunk.Field) {
				Chunk.Field fc = (Chunk.Field) ch;
				addReferences(Arrays.asList(fc.getReceiver(), fc.getValue()), refs);
			} else if (ch instanceof Chunk.Predicate) {
				addReferences(((Chunk.Predicate) ch).getArguments(), refs);
			} else if (ch instanceof Chunk.MagicWand) {
				addReferences(((Chunk.MagicWand) ch).getBindings().values(), refs);
			}
		}
		refs.remove(Term.NULL);
		return refs;
	}

	private static void addReferences(Iterable<Term> terms, Set<Term> refs) {
		for (Term t : terms) {
			if (t.getSort() == Term.Sort.REF) {
				refs.add(t);
			}
		}
	}

	private static boolean isTrue(Expr e) {
		return e instanceof Expr.Boolean && ((Expr.Boolean) e).getValue();
	}

	private static boolean isFalse(Expr e) {
		return e instanceof Expr.Boolean && !((Expr.Boolean) e).getValue();
	}

	private static String position(SilFile.Item item) {
		SilFile.Position pos = item.getAttribute(SilFile.Position.class);
		return pos == null ? "?" : pos.toString();
	}
}
