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
package wysilicon.tasks;

import static wysilicon.verifier.VerificationError.Kind.CONTRACT_NOT_WELLFORMED;
import static wysilicon.verifier.VerificationError.Kind.POSTCONDITION_VIOLATED;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import wysilicon.core.Cfg;
import wysilicon.core.SilFile;
import wysilicon.core.SilFile.Decl;
import wysilicon.state.Context;
import wysilicon.state.Heap;
import wysilicon.state.Snapshots;
import wysilicon.state.Store;
import wysilicon.state.SymbolicState;
import wysilicon.state.Terms;
import wysilicon.util.CfgBuilder;
import wysilicon.verifier.Config;
import wysilicon.verifier.Consumer;
import wysilicon.verifier.Decider;
import wysilicon.verifier.Evaluator;
import wysilicon.verifier.Executor;
import wysilicon.verifier.HeapCompressor;
import wysilicon.verifier.MagicWandSupporter;
import wysilicon.verifier.PredicateSupporter;
import wysilicon.verifier.Producer;
import wysilicon.verifier.VerificationError;
import wysilicon.verifier.VerificationResult;
import wysilicon.verifier.support.DefaultConsumer;
import wysilicon.verifier.support.DefaultDecider;
import wysilicon.verifier.support.DefaultEvaluator;
import wysilicon.verifier.support.DefaultHeapCompressor;
import wysilicon.verifier.support.DefaultMagicWandSupporter;
import wysilicon.verifier.support.DefaultPredicateSupporter;
import wysilicon.verifier.support.DefaultProducer;

/**
 * Verifies the methods of a program one at a time. Each method is checked
 * modularly: its precondition is produced into a state in which parameters
 * and results have unknown values, its body is executed and its
 * postcondition is then consumed.
 */
public class SilVerifyTask implements AutoCloseable {
	private static final Logger logger = LogManager.getLogger(SilVerifyTask.class);

	/**
	 * The program being verified.
	 */
	private final SilFile program;
	/**
	 * Options for the executor and its collaborators.
	 */
	private final Config config;
	/**
	 * Responsible for all path conditions. This persists across methods, but
	 * each method is verified in its own scope.
	 */
	private final Decider decider;
	private final Producer producer;
	private final Consumer consumer;
	private final Executor executor;

	public SilVerifyTask(SilFile program) {
		this(program, Config.load());
	}

	public SilVerifyTask(SilFile program, Config config) {
		if (program == null) {
			throw new IllegalArgumentException("invalid program");
		} else if (config == null) {
			throw new IllegalArgumentException("invalid configuration");
		}
		this.program = program;
		this.config = config;
		this.decider = new DefaultDecider(config);
		Evaluator evaluator = new DefaultEvaluator(decider);
		HeapCompressor heapCompressor = new DefaultHeapCompressor(decider);
		this.producer = new DefaultProducer(decider, evaluator, heapCompressor);
		this.consumer = new DefaultConsumer(decider, evaluator);
		PredicateSupporter predicateSupporter = new DefaultPredicateSupporter(decider, producer, consumer,
				heapCompressor);
		MagicWandSupporter magicWandSupporter = new DefaultMagicWandSupporter(decider, producer, consumer);
		this.executor = new Executor(config, evaluator, producer, consumer, decider, predicateSupporter,
				magicWandSupporter, heapCompressor);
	}

	public Config getConfig() {
		return config;
	}

	/**
	 * Verify every method of the program, in order of declaration.
	 *
	 * @return The outcome for each method, keyed by its name.
	 */
	public Map<String, VerificationResult> verifyAll() {
		LinkedHashMap<String, VerificationResult> results = new LinkedHashMap<>();
		int failures = 0;
		for (Decl.Method m : program.getMethods()) {
			VerificationResult r = verify(m);
			results.put(m.getName(), r);
			if (r.isFatal()) {
				failures++;
				logger.warn("{}: {}", m.getName(), r);
			}
		}
		logger.info("verified {} method(s), {} failure(s)", results.size(), failures);
		return results;
	}

	/**
	 * Verify a single method. A method without a body is trusted.
	 *
	 * @param method
	 * @return
	 */
	public VerificationResult verify(Decl.Method method) {
		if (method.getBody() == null) {
			logger.debug("skipping abstract method {}", method.getName());
			return VerificationResult.SUCCESS;
		}
		logger.debug("verifying method {}", method.getName());
		decider.logComment("method " + method.getName());
		return decider.inScope(() -> {
			Store store = Store.EMPTY;
			for (Decl.Parameter p : method.getParameters()) {
				store = store.plus(p.getName(), decider.fresh(p.getName(), Terms.toSort(p.getType())));
			}
			for (Decl.Parameter r : method.getReturns()) {
				store = store.plus(r.getName(), decider.fresh(r.getName(), Terms.toSort(r.getType())));
			}
			SymbolicState s0 = new SymbolicState(store, Heap.EMPTY, Heap.EMPTY);
			Context c0 = new Context(program);
			Cfg cfg = CfgBuilder.build(method.getBody());
			return producer.produces(s0, freshSnapshots(), Terms.fullPerm(), method.getRequires(),
					e -> VerificationError.of(CONTRACT_NOT_WELLFORMED, e), c0, (s1, c1) -> {
						SymbolicState s2 = s1.withOldHeap(s1.getHeap());
						return executor.exec(s2, cfg.getEntry(), c1,
								(s3, c3) -> consumer.consumes(s3, Terms.fullPerm(), method.getEnsures(),
										e -> VerificationError.of(POSTCONDITION_VIOLATED, e), c3,
										(s4, snap, chunks, c4) -> VerificationResult.SUCCESS));
					});
		});
	}

	/**
	 * Release the solver backing this task.
	 */
	@Override
	public void close() {
		decider.close();
	}

	private Snapshots freshSnapshots() {
		return Snapshots.fresh(sort -> decider.fresh(sort));
	}
}
