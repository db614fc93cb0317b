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
package wysilicon.util;

import static org.junit.jupiter.api.Assertions.*;
import static wysilicon.core.SilFile.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import wysilicon.core.Cfg;

public class CfgBuilderTests {
	private static final Decl.Field F = FIELD("f", Type.Int);
	private static final Expr.VariableAccess B = VAR("b", Type.Bool);
	private static final Expr.VariableAccess I = VAR("i", Type.Int);
	private static final Expr.VariableAccess Y = VAR("y", Type.Ref);
	private static final Stmt A1 = ASSIGN(I, CONST(1));
	private static final Stmt A2 = ASSIGN(I, CONST(2));
	private static final Stmt A3 = ASSIGN(I, CONST(3));
	private static final Stmt A4 = ASSIGN(I, CONST(4));

	@Test
	public void test_sequence_01() {
		Cfg cfg = CfgBuilder.build(SEQUENCE(A1, A2));
		Cfg.StatementBlock entry = (Cfg.StatementBlock) cfg.getEntry();
		Stmt.Sequence s = (Stmt.Sequence) entry.getStatement();
		assertEquals(2, s.size());
		assertSame(A1, s.get(0));
		assertSame(A2, s.get(1));
		assertTrue(entry.getSuccessors().isEmpty());
	}

	@Test
	public void test_sequence_02() {
		Cfg cfg = CfgBuilder.build(SEQUENCE(A1, SEQUENCE(), SEQUENCE(A2)));
		assertEquals(3, cfg.getBlocks().size());
		Cfg.StatementBlock entry = (Cfg.StatementBlock) cfg.getEntry();
		assertSame(A1, entry.getStatement());
	}

	@Test
	public void test_sequence_03() {
		Cfg cfg = CfgBuilder.build(SEQUENCE());
		Cfg.StatementBlock entry = (Cfg.StatementBlock) cfg.getEntry();
		assertEquals(0, ((Stmt.Sequence) entry.getStatement()).size());
		assertTrue(entry.getSuccessors().isEmpty());
	}

	@Test
	public void test_ifelse_01() {
		Cfg cfg = CfgBuilder.build(SEQUENCE(A1, IFELSE(B, A2, A3), A4));
		Cfg.Block entry = cfg.getEntry();
		assertEquals(1, entry.getSuccessors().size());
		Cfg.Block branch = entry.getSuccessors().get(0).getDestination();
		List<Cfg.Edge> edges = branch.getSuccessors();
		assertEquals(2, edges.size());
		Cfg.ConditionalEdge te = (Cfg.ConditionalEdge) edges.get(0);
		Cfg.ConditionalEdge fe = (Cfg.ConditionalEdge) edges.get(1);
		assertSame(B, te.getCondition());
		assertTrue(fe.getCondition() instanceof Expr.LogicalNot);
		assertSame(A2, ((Cfg.StatementBlock) te.getDestination()).getStatement());
		assertSame(A3, ((Cfg.StatementBlock) fe.getDestination()).getStatement());
		// Both branches continue with the same block
		Cfg.Block tj = te.getDestination().getSuccessors().get(0).getDestination();
		Cfg.Block fj = fe.getDestination().getSuccessors().get(0).getDestination();
		assertSame(tj, fj);
		assertSame(A4, ((Cfg.StatementBlock) tj).getStatement());
		assertEquals(5, cfg.getBlocks().size());
	}

	@Test
	public void test_ifelse_02() {
		Cfg cfg = CfgBuilder.build(IFELSE(B, A2, null));
		Cfg.Block fb = cfg.getEntry().getSuccessors().get(1).getDestination();
		assertEquals(0, ((Stmt.Sequence) ((Cfg.StatementBlock) fb).getStatement()).size());
		assertTrue(fb.getSuccessors().isEmpty());
	}

	@Test
	public void test_while_01() {
		Stmt.While loop = WHILE(LT(I, CONST(10)), Arrays.asList(LTEQ(CONST(0), I)),
				SEQUENCE(ASSIGN(I, ADD(I, CONST(1))), NEW(Y, Arrays.asList(F)), ASSIGN(I, CONST(0))));
		Cfg cfg = CfgBuilder.build(SEQUENCE(A1, loop, A4));
		Cfg.Block next = cfg.getEntry().getSuccessors().get(0).getDestination();
		Cfg.LoopBlock lb = (Cfg.LoopBlock) next;
		assertSame(loop, lb.getLoop());
		assertTrue(lb.getBody().getSuccessors().isEmpty());
		List<Expr.VariableAccess> written = lb.getWrittenVariables();
		assertEquals(2, written.size());
		assertEquals("i", written.get(0).getVariable());
		assertEquals("y", written.get(1).getVariable());
		assertSame(A4, ((Cfg.StatementBlock) lb.getSuccessors().get(0).getDestination()).getStatement());
	}

	@Test
	public void test_constraining_01() {
		Expr.VariableAccess k = VAR("k", Type.Perm);
		Cfg cfg = CfgBuilder.build(CONSTRAINING(Arrays.asList(k), A1));
		Cfg.ConstrainingBlock cb = (Cfg.ConstrainingBlock) cfg.getEntry();
		assertEquals(Arrays.asList(k), cb.getVariables());
		assertSame(A1, ((Cfg.StatementBlock) cb.getBody()).getStatement());
	}

	@Test
	public void test_unstructured_01() {
		assertThrows(IllegalArgumentException.class, () -> CfgBuilder.build(SEQUENCE(LABEL("l"), A1, GOTO("l"))));
	}

	@Test
	public void test_written_01() {
		Stmt body = SEQUENCE(IFELSE(B, CALL("m", Arrays.asList(I), Arrays.asList(Y)), FRESH(Arrays.asList(VAR("k", Type.Perm)))),
				ASSIGN(FIELDACCESS(Y, F), CONST(1)));
		List<Expr.VariableAccess> written = CfgBuilder.writtenVariables(body);
		assertEquals(2, written.size());
		assertEquals("y", written.get(0).getVariable());
		assertEquals("k", written.get(1).getVariable());
	}
}
