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

/**
 * Traverses every statement nested within a given statement. Subclasses
 * override the hooks for the statements they are interested in.
 */
public class AbstractStatementVisitor {

    public void visitStatement(Stmt s) {
        if (s instanceof Stmt.Sequence) {
            visitSequence((Stmt.Sequence) s);
        } else if (s instanceof Stmt.IfElse) {
            visitIfElse((Stmt.IfElse) s);
        } else if (s instanceof Stmt.While) {
            visitWhile((Stmt.While) s);
        } else if (s instanceof Stmt.Constraining) {
            visitConstraining((Stmt.Constraining) s);
        } else if (s instanceof Stmt.LocalAssign) {
            visitLocalAssign((Stmt.LocalAssign) s);
        } else if (s instanceof Stmt.FieldWrite) {
            visitFieldWrite((Stmt.FieldWrite) s);
        } else if (s instanceof Stmt.New) {
            visitNew((Stmt.New) s);
        } else if (s instanceof Stmt.Fresh) {
            visitFresh((Stmt.Fresh) s);
        } else if (s instanceof Stmt.MethodCall) {
            visitMethodCall((Stmt.MethodCall) s);
        } else if (s instanceof Stmt.Inhale || s instanceof Stmt.Exhale || s instanceof Stmt.Assert
                || s instanceof Stmt.Fold || s instanceof Stmt.Unfold || s instanceof Stmt.Package
                || s instanceof Stmt.Apply || s instanceof Stmt.Label || s instanceof Stmt.Goto) {
            // nothing nested
        } else {
            throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
        }
    }

    protected void visitSequence(Stmt.Sequence s) {
        for (int i = 0; i != s.size(); ++i) {
            visitStatement(s.get(i));
        }
    }

    protected void visitIfElse(Stmt.IfElse s) {
        visitStatement(s.getTrueBranch());
        if (s.getFalseBranch() != null) {
            visitStatement(s.getFalseBranch());
        }
    }

    protected void visitWhile(Stmt.While s) {
        visitStatement(s.getBody());
    }

    protected void visitConstraining(Stmt.Constraining s) {
        visitStatement(s.getBody());
    }

    protected void visitLocalAssign(Stmt.LocalAssign s) {
    }

    protected void visitFieldWrite(Stmt.FieldWrite s) {
    }

    protected void visitNew(Stmt.New s) {
    }

    protected void visitFresh(Stmt.Fresh s) {
    }

    protected void visitMethodCall(Stmt.MethodCall s) {
    }
}
