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

import static wysilicon.core.SilFile.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import wysilicon.core.Cfg;

/**
 * <p>
 * Lowers a structured method body into a control-flow graph. Runs of simple
 * statements become a single statement block, conditionals become an empty
 * block with one guarded edge per branch, whilst loops and constraining
 * statements become blocks which own the graph of their body. A block without
 * successors marks the end of the method.
 * </p>
 * <p>
 * Both branches of a conditional lead to the same block for the statements
 * following it.
 * </p>
 */
public class CfgBuilder {

    /**
     * Construct the graph for a given method body.
     *
     * @param body
     * @return
     */
    public static Cfg build(Stmt body) {
        return new Cfg(new CfgBuilder().lower(body, null));
    }

    private Cfg.Block lower(Stmt s, Cfg.Block next) {
        if (s == null) {
            return empty(next);
        } else if (s instanceof Stmt.Sequence) {
            return lowerSequence(((Stmt.Sequence) s).getAll(), next);
        } else if (isSimple(s)) {
            return link(new Cfg.StatementBlock(s), next);
        } else {
            return lowerCompound(s, next);
        }
    }

    private Cfg.Block lowerSequence(List<Stmt> stmts, Cfg.Block next) {
        Cfg.Block block = next;
        ArrayList<Stmt> run = new ArrayList<>();
        for (int i = stmts.size() - 1; i >= 0; --i) {
            Stmt s = stmts.get(i);
            if (s instanceof Stmt.Sequence) {
                block = flush(run, block);
                block = lowerSequence(((Stmt.Sequence) s).getAll(), block);
            } else if (isSimple(s)) {
                run.add(0, s);
            } else {
                block = flush(run, block);
                block = lowerCompound(s, block);
            }
        }
        block = flush(run, block);
        return block == next ? empty(next) : block;
    }

    private Cfg.Block lowerCompound(Stmt s, Cfg.Block next) {
        if (s instanceof Stmt.IfElse) {
            Stmt.IfElse ie = (Stmt.IfElse) s;
            Cfg.Block tb = lower(ie.getTrueBranch(), next);
            Cfg.Block fb = lower(ie.getFalseBranch(), next);
            Cfg.Block b = new Cfg.StatementBlock(SEQUENCE());
            b.addSuccessor(new Cfg.ConditionalEdge(ie.getCondition(), tb));
            b.addSuccessor(new Cfg.ConditionalEdge(NOT(ie.getCondition()), fb));
            return b;
        } else if (s instanceof Stmt.While) {
            Stmt.While w = (Stmt.While) s;
            Cfg.Block body = lower(w.getBody(), null);
            return link(new Cfg.LoopBlock(w, body, writtenVariables(w.getBody())), next);
        } else if (s instanceof Stmt.Constraining) {
            Stmt.Constraining c = (Stmt.Constraining) s;
            Cfg.Block body = lower(c.getBody(), null);
            return link(new Cfg.ConstrainingBlock(c.getVariables(), body), next);
        } else if (s instanceof Stmt.Label || s instanceof Stmt.Goto) {
            throw new IllegalArgumentException("unstructured control-flow not supported");
        } else {
            throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
        }
    }

    private static Cfg.Block empty(Cfg.Block next) {
        return link(new Cfg.StatementBlock(SEQUENCE()), next);
    }

    private static Cfg.Block flush(List<Stmt> run, Cfg.Block next) {
        if (run.isEmpty()) {
            return next;
        }
        Stmt s = run.size() == 1 ? run.get(0) : SEQUENCE(new ArrayList<>(run));
        run.clear();
        return link(new Cfg.StatementBlock(s), next);
    }

    private static Cfg.Block link(Cfg.Block block, Cfg.Block next) {
        if (next != null) {
            block.addSuccessor(new Cfg.UnconditionalEdge(next));
        }
        return block;
    }

    private static boolean isSimple(Stmt s) {
        return !(s instanceof Stmt.Sequence || s instanceof Stmt.IfElse || s instanceof Stmt.While
                || s instanceof Stmt.Constraining || s instanceof Stmt.Label || s instanceof Stmt.Goto);
    }

    /**
     * Determine the local variables which may be assigned by a given statement,
     * in order of first assignment.
     *
     * @param s
     * @return
     */
    public static List<Expr.VariableAccess> writtenVariables(Stmt s) {
        LinkedHashMap<String, Expr.VariableAccess> vars = new LinkedHashMap<>();
        new AbstractStatementVisitor() {
            @Override
            protected void visitLocalAssign(Stmt.LocalAssign s) {
                vars.putIfAbsent(s.getLeftHandSide().getVariable(), s.getLeftHandSide());
            }

            @Override
            protected void visitNew(Stmt.New s) {
                vars.putIfAbsent(s.getLeftHandSide().getVariable(), s.getLeftHandSide());
            }

            @Override
            protected void visitFresh(Stmt.Fresh s) {
                for (Expr.VariableAccess v : s.getVariables()) {
                    vars.putIfAbsent(v.getVariable(), v);
                }
            }

            @Override
            protected void visitMethodCall(Stmt.MethodCall s) {
                for (Expr.VariableAccess v : s.getTargets()) {
                    vars.putIfAbsent(v.getVariable(), v);
                }
            }
        }.visitStatement(s);
        return new ArrayList<>(vars.values());
    }
}
