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
package wysilicon;

import static wysilicon.core.SilFile.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import wysilicon.core.SilFile;
import wysilicon.verifier.ErrorReason;
import wysilicon.verifier.VerificationError;

/**
 * The programs used for end-to-end testing. Every program has a method named
 * <code>test</code>, along with whatever it depends on.
 */
public class TestPrograms {

	public static final Decl.Field F = FIELD("f", Type.Int);
	public static final Decl.Field G = FIELD("g", Type.Int);

	public static final Expr.VariableAccess B = VAR("b", Type.Bool);
	public static final Expr.VariableAccess I = VAR("i", Type.Int);
	public static final Expr.VariableAccess K = VAR("k", Type.Perm);
	public static final Expr.VariableAccess N = VAR("n", Type.Int);
	public static final Expr.VariableAccess R = VAR("r", Type.Int);
	public static final Expr.VariableAccess W = VAR("w", Type.Wand);
	public static final Expr.VariableAccess X = VAR("x", Type.Ref);
	public static final Expr.VariableAccess Y = VAR("y", Type.Ref);

	/**
	 * A program which should verify, keyed by name.
	 */
	public static final Map<String, SilFile> VALID = new TreeMap<>();

	/**
	 * A program which should fail to verify, along with the expected error.
	 */
	public static final class Invalid {
		private final SilFile program;
		private final VerificationError.Kind kind;
		private final ErrorReason.Kind reason;

		public Invalid(SilFile program, VerificationError.Kind kind, ErrorReason.Kind reason) {
			this.program = program;
			this.kind = kind;
			this.reason = reason;
		}

		public SilFile getProgram() {
			return program;
		}

		public VerificationError.Kind getKind() {
			return kind;
		}

		public ErrorReason.Kind getReason() {
			return reason;
		}
	}

	public static final Map<String, Invalid> INVALID = new TreeMap<>();

	static {
		// ===================================================
		// Valid
		// ===================================================
		VALID.put("FieldWrite_Valid_1",
				program(method(params(X), none(), requires(ACC(X_F())),
						ensures(AND(ACC(X_F()), EQ(X_F(), CONST(5)))),
						SEQUENCE(ASSIGN(X_F(), CONST(5))))));
		VALID.put("Old_Valid_1",
				program(method(params(X), none(), requires(ACC(X_F())),
						ensures(AND(ACC(X_F()), EQ(X_F(), ADD(OLD(X_F()), CONST(1))))),
						SEQUENCE(ASSIGN(X_F(), ADD(X_F(), CONST(1)))))));
		VALID.put("If_Valid_1",
				program(method(params(B), params(R), none(), ensures(GT(R, CONST(0))),
						SEQUENCE(IFELSE(B, ASSIGN(R, CONST(1)), ASSIGN(R, CONST(2)))))));
		VALID.put("If_Valid_2",
				program(method(params(B, X), none(), requires(IMPLIES(B, ACC(X_F()))), none(),
						SEQUENCE(IFELSE(B, ASSIGN(X_F(), CONST(1)), null)))));
		VALID.put("While_Valid_1",
				program(method(params(N), params(R), requires(LTEQ(CONST(0), N)), ensures(EQ(R, N)),
						SEQUENCE(ASSIGN(I, CONST(0)),
								WHILE(LT(I, N), Arrays.asList(LTEQ(CONST(0), I), LTEQ(I, N)),
										ASSIGN(I, ADD(I, CONST(1)))),
								ASSIGN(R, I)))));
		VALID.put("Fold_Valid_1",
				program(positive(),
						method(params(X), none(), requires(AND(ACC(X_F()), EQ(X_F(), CONST(3)))),
								ensures(ACC(P(X))), SEQUENCE(FOLD(ACC(P(X)))))));
		VALID.put("Fold_Valid_2",
				program(positive(),
						method(params(X), none(), requires(ACC(P(X))),
								ensures(AND(ACC(X_F()), GT(X_F(), CONST(0)))), SEQUENCE(UNFOLD(ACC(P(X)))))));
		VALID.put("Fold_Valid_3",
				program(positive(),
						method(params(X), none(), requires(AND(ACC(X_F()), EQ(X_F(), CONST(3)))),
								ensures(AND(ACC(X_F()), EQ(X_F(), CONST(3)))),
								SEQUENCE(FOLD(ACC(P(X))), UNFOLD(ACC(P(X)))))));
		VALID.put("Call_Valid_1",
				program(increment(),
						method(params(X), none(), requires(AND(ACC(X_F()), EQ(X_F(), CONST(1)))),
								ensures(AND(ACC(X_F()), EQ(X_F(), CONST(2)))),
								SEQUENCE(CALL("inc", Arrays.asList(X))))));
		Expr.MagicWand wand = WAND(ACC(X_G()), AND(ACC(X_F()), ACC(X_G())));
		VALID.put("Wand_Valid_1",
				program(method(params(X), none(), requires(AND(ACC(X_F()), ACC(X_G()))),
						ensures(AND(ACC(X_F()), ACC(X_G()))), SEQUENCE(PACKAGE(wand), APPLY(wand)))));
		VALID.put("Wand_Valid_2",
				program(method(params(X), none(), requires(AND(ACC(X_F()), ACC(X_G()))),
						ensures(AND(ACC(X_F()), ACC(X_G()))), SEQUENCE(PACKAGE(wand), ASSIGN(W, wand), APPLY(W)))));
		VALID.put("Constraining_Valid_1",
				program(method(params(X), none(), requires(ACC(X_F(), FRACTION(CONST(1), CONST(2)))), none(),
						SEQUENCE(FRESH(Arrays.asList(K)),
								CONSTRAINING(Arrays.asList(K), EXHALE(ACC(X_F(), K)))))));
		VALID.put("Constraining_Valid_2",
				program(method(params(X), none(), requires(ACC(X_F(), FRACTION(CONST(1), CONST(2)))), none(),
						SEQUENCE(FRESH(Arrays.asList(K)),
								CONSTRAINING(Arrays.asList(K), SEQUENCE(EXHALE(ACC(X_F(), K)), EXHALE(ACC(X_F(), K))))))));
		VALID.put("New_Valid_1",
				program(method(params(X), none(), requires(ACC(X_F())), none(),
						SEQUENCE(NEW(Y, Arrays.asList(F)), ASSERT(NEQ(X, Y)), ASSIGN(Y_F(), CONST(1))))));
		VALID.put("Assert_Valid_1",
				program(method(params(N), none(), requires(AND(LT(CONST(0), N), LT(N, CONST(0)))), none(),
						SEQUENCE(ASSERT(CONST(false))))));
		VALID.put("Assert_Valid_2",
				program(method(params(X, Y), none(), requires(AND(ACC(X_F()), ACC(Y_F()))), none(),
						SEQUENCE(ASSERT(CONST(true)), ASSERT(NEQ(X, Y))))));
		VALID.put("Assert_Valid_3",
				program(method(params(N), none(), requires(AND(LT(CONST(0), N), LT(N, CONST(0)))), none(),
						SEQUENCE(ASSERT(CONST(false)), ASSERT(CONST(false))))));
		VALID.put("Assert_Valid_4",
				program(method(params(N), none(), none(), none(), SEQUENCE(ASSERT(LTEQ(CONST(0), MUL(N, N)))))));
		VALID.put("Inhale_Valid_1",
				program(method(params(X), none(), none(), none(),
						SEQUENCE(INHALE(ACC(X_F())), ASSIGN(X_F(), CONST(2)),
								EXHALE(AND(ACC(X_F()), EQ(X_F(), CONST(2))))))));
		VALID.put("Inhale_Valid_2",
				program(method(params(N), none(), none(), none(),
						SEQUENCE(INHALE(CONST(false)), ASSERT(CONST(false)), ASSERT(CONST(false))))));
		VALID.put("Abstract_Valid_1",
				program(METHOD("test", params(X), none(), requires(ACC(X_F())), ensures(CONST(false)), null)));
		// ===================================================
		// Invalid
		// ===================================================
		INVALID.put("FieldWrite_Invalid_1", new Invalid(
				program(method(params(X), none(), none(), none(), SEQUENCE(ASSIGN(X_F(), CONST(5))))),
				VerificationError.Kind.ASSIGNMENT_FAILED, ErrorReason.Kind.RECEIVER_NULL));
		INVALID.put("FieldWrite_Invalid_2", new Invalid(
				program(method(params(X), none(), requires(NEQ(X, NULL())), none(),
						SEQUENCE(ASSIGN(X_F(), CONST(5))))),
				VerificationError.Kind.ASSIGNMENT_FAILED, ErrorReason.Kind.INSUFFICIENT_PERMISSION));
		INVALID.put("Post_Invalid_1", new Invalid(
				program(method(params(X), none(), requires(ACC(X_F())),
						ensures(AND(ACC(X_F()), EQ(X_F(), CONST(6)))), SEQUENCE(ASSIGN(X_F(), CONST(5))))),
				VerificationError.Kind.POSTCONDITION_VIOLATED, ErrorReason.Kind.ASSERTION_FALSE));
		INVALID.put("Assert_Invalid_1", new Invalid(
				program(method(params(N), none(), none(), none(), SEQUENCE(ASSERT(CONST(false))))),
				VerificationError.Kind.ASSERT_FAILED, ErrorReason.Kind.ASSERTION_FALSE));
		INVALID.put("Assert_Invalid_2", new Invalid(
				program(method(params(N), none(), none(), none(), SEQUENCE(ASSERT(CONST(false)), ASSERT(CONST(false))))),
				VerificationError.Kind.ASSERT_FAILED, ErrorReason.Kind.ASSERTION_FALSE));
		INVALID.put("If_Invalid_1", new Invalid(
				program(method(params(B), params(R), none(), ensures(EQ(R, CONST(1))),
						SEQUENCE(IFELSE(B, ASSIGN(R, CONST(1)), ASSIGN(R, CONST(2)))))),
				VerificationError.Kind.POSTCONDITION_VIOLATED, ErrorReason.Kind.ASSERTION_FALSE));
		INVALID.put("While_Invalid_1", new Invalid(
				program(method(params(N), none(), requires(LTEQ(CONST(0), N)), none(),
						SEQUENCE(ASSIGN(I, CONST(0)),
								WHILE(LT(I, N), Arrays.asList(LTEQ(I, N)), ASSIGN(I, ADD(I, CONST(2))))))),
				VerificationError.Kind.LOOP_INVARIANT_NOT_PRESERVED, ErrorReason.Kind.ASSERTION_FALSE));
		INVALID.put("While_Invalid_2", new Invalid(
				program(method(params(N), none(), none(), none(),
						SEQUENCE(ASSIGN(I, ADD(N, CONST(1))),
								WHILE(LT(I, N), Arrays.asList(LTEQ(I, N)), SEQUENCE())))),
				VerificationError.Kind.LOOP_INVARIANT_NOT_ESTABLISHED, ErrorReason.Kind.ASSERTION_FALSE));
		INVALID.put("Call_Invalid_1", new Invalid(
				program(increment(),
						method(params(X), none(), none(), none(), SEQUENCE(CALL("inc", Arrays.asList(X))))),
				VerificationError.Kind.PRECONDITION_IN_CALL_FALSE, ErrorReason.Kind.INSUFFICIENT_PERMISSION));
		INVALID.put("Apply_Invalid_1", new Invalid(
				program(method(params(X), none(), requires(ACC(X_G())), none(),
						SEQUENCE(APPLY(WAND(ACC(X_G()), ACC(X_F())))))),
				VerificationError.Kind.APPLY_FAILED, ErrorReason.Kind.MAGIC_WAND_CHUNK_NOT_FOUND));
		INVALID.put("Apply_Invalid_2", new Invalid(
				program(method(params(X), none(), requires(ACC(X_G())), none(),
						SEQUENCE(ASSIGN(W, WAND(ACC(X_G()), ACC(X_F()))), APPLY(W)))),
				VerificationError.Kind.APPLY_FAILED, ErrorReason.Kind.NAMED_MAGIC_WAND_CHUNK_NOT_FOUND));
		INVALID.put("Package_Invalid_1", new Invalid(
				program(method(params(X), none(), none(), none(),
						SEQUENCE(PACKAGE(WAND(ACC(X_G()), ACC(X_F())))))),
				VerificationError.Kind.PACKAGE_FAILED, ErrorReason.Kind.INSUFFICIENT_PERMISSION));
		INVALID.put("Constraining_Invalid_1", new Invalid(
				program(method(params(X), none(), requires(ACC(X_F(), FRACTION(CONST(1), CONST(2)))), none(),
						SEQUENCE(FRESH(Arrays.asList(K)), EXHALE(ACC(X_F(), K))))),
				VerificationError.Kind.EXHALE_FAILED, ErrorReason.Kind.INSUFFICIENT_PERMISSION));
		INVALID.put("Constraining_Invalid_2", new Invalid(
				program(method(params(X), none(), requires(ACC(X_F(), FRACTION(CONST(1), CONST(2)))), none(),
						SEQUENCE(FRESH(Arrays.asList(K)), CONSTRAINING(Arrays.asList(K), EXHALE(ACC(X_F(), K))),
								EXHALE(ACC(X_F(), K))))),
				VerificationError.Kind.EXHALE_FAILED, ErrorReason.Kind.INSUFFICIENT_PERMISSION));
		INVALID.put("Fold_Invalid_1", new Invalid(
				program(positive(), method(params(X), none(), none(), none(), SEQUENCE(FOLD(ACC(P(X)))))),
				VerificationError.Kind.FOLD_FAILED, ErrorReason.Kind.INSUFFICIENT_PERMISSION));
		INVALID.put("Unfold_Invalid_1", new Invalid(
				program(positive(), method(params(X), none(), none(), none(), SEQUENCE(UNFOLD(ACC(P(X)))))),
				VerificationError.Kind.UNFOLD_FAILED, ErrorReason.Kind.INSUFFICIENT_PERMISSION));
		INVALID.put("Fold_Invalid_2", new Invalid(
				program(positive(),
						method(params(X), none(), requires(AND(ACC(X_F()), EQ(X_F(), CONST(3)))), none(),
								SEQUENCE(FOLD(ACC(P(X), FRACTION(CONST(0), CONST(1))))))),
				VerificationError.Kind.FOLD_FAILED, ErrorReason.Kind.NEGATIVE_PERMISSION));
		INVALID.put("Unfold_Invalid_2", new Invalid(
				program(positive(),
						method(params(X), none(), requires(ACC(P(X))), none(),
								SEQUENCE(UNFOLD(ACC(P(X), FRACTION(NEG(CONST(1)), CONST(2))))))),
				VerificationError.Kind.UNFOLD_FAILED, ErrorReason.Kind.NEGATIVE_PERMISSION));
		INVALID.put("Division_Invalid_1", new Invalid(
				program(method(params(N), params(R), none(), none(), SEQUENCE(ASSIGN(R, DIV(CONST(10), N))))),
				VerificationError.Kind.ASSIGNMENT_FAILED, ErrorReason.Kind.DIVISION_BY_ZERO));
		INVALID.put("Inhale_Invalid_1", new Invalid(
				program(method(params(X), none(), none(), none(),
						SEQUENCE(INHALE(ACC(X_F(), FRACTION(NEG(CONST(1)), CONST(2))))))),
				VerificationError.Kind.INHALE_FAILED, ErrorReason.Kind.NEGATIVE_PERMISSION));
	}

	// ===================================================
	// Helpers
	// ===================================================

	public static Expr.FieldAccess X_F() {
		return FIELDACCESS(X, F);
	}

	public static Expr.FieldAccess X_G() {
		return FIELDACCESS(X, G);
	}

	public static Expr.FieldAccess Y_F() {
		return FIELDACCESS(Y, F);
	}

	public static Expr.PredicateAccess P(Expr arg) {
		return PREDICATEACCESS("P", Arrays.asList(arg));
	}

	/**
	 * <code>predicate P(y: Ref) { acc(y.f) &amp;&amp; y.f &gt; 0 }</code>
	 *
	 * @return
	 */
	private static Decl.Predicate positive() {
		Expr.FieldAccess yf = FIELDACCESS(Y, F);
		return PREDICATE("P", params(Y), AND(ACC(yf), GT(yf, CONST(0))));
	}

	/**
	 * <code>method inc(y: Ref) requires acc(y.f) ensures acc(y.f) &amp;&amp; y.f == old(y.f) + 1</code>
	 *
	 * @return
	 */
	private static Decl.Method increment() {
		Expr.FieldAccess yf = FIELDACCESS(Y, F);
		return METHOD("inc", params(Y), none(), requires(ACC(yf)),
				ensures(AND(ACC(yf), EQ(yf, ADD(OLD(yf), CONST(1))))), null);
	}

	private static SilFile program(Decl... decls) {
		SilFile file = new SilFile();
		file.add(F);
		file.add(G);
		for (Decl d : decls) {
			file.add(d);
		}
		return file;
	}

	private static Decl.Method method(List<Decl.Parameter> params, List<Decl.Parameter> returns,
			List<Expr> requires, List<Expr> ensures, Stmt body) {
		return METHOD("test", params, returns, requires, ensures, body);
	}

	private static List<Decl.Parameter> params(Expr.VariableAccess... vars) {
		Decl.Parameter[] ps = new Decl.Parameter[vars.length];
		for (int i = 0; i != vars.length; ++i) {
			ps[i] = PARAMETER(vars[i].getVariable(), vars[i].getType());
		}
		return Arrays.asList(ps);
	}

	private static List<Expr> requires(Expr... clauses) {
		return Arrays.asList(clauses);
	}

	private static List<Expr> ensures(Expr... clauses) {
		return Arrays.asList(clauses);
	}

	private static <T> List<T> none() {
		return Collections.emptyList();
	}
}
