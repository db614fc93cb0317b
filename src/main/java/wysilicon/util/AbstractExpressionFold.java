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

import wysilicon.core.SilFile.Expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds an expression into a single value, by combining the values computed
 * for its subexpressions. Leaves default to <code>BOTTOM()</code>.
 *
 * @param <E>
 */
public abstract class AbstractExpressionFold<E> {

    public E visitExpression(Expr expr) {
        if (expr instanceof Expr.Boolean || expr instanceof Expr.Integer || expr instanceof Expr.Null
                || expr instanceof Expr.FullPerm || expr instanceof Expr.NoPerm) {
            return BOTTOM();
        } else if (expr instanceof Expr.VariableAccess) {
            return constructVariableAccess((Expr.VariableAccess) expr);
        } else if (expr instanceof Expr.FieldAccess) {
            return visitExpression(((Expr.FieldAccess) expr).getReceiver());
        } else if (expr instanceof Expr.PredicateAccess) {
            return join(visitExpressions(((Expr.PredicateAccess) expr).getArguments()));
        } else if (expr instanceof Expr.CurrentPerm) {
            return visitExpression(((Expr.CurrentPerm) expr).getLocation());
        } else if (expr instanceof Expr.FieldAccessPredicate) {
            Expr.FieldAccessPredicate e = (Expr.FieldAccessPredicate) expr;
            return join(visitExpression(e.getLocation()), visitExpression(e.getPermission()));
        } else if (expr instanceof Expr.PredicateAccessPredicate) {
            Expr.PredicateAccessPredicate e = (Expr.PredicateAccessPredicate) expr;
            return join(visitExpression(e.getLocation()), visitExpression(e.getPermission()));
        } else if (expr instanceof Expr.Old) {
            return constructOld((Expr.Old) expr, visitExpression(((Expr.Old) expr).getOperand()));
        } else if (expr instanceof Expr.UnaryOperator) {
            return visitExpression(((Expr.UnaryOperator) expr).getOperand());
        } else if (expr instanceof Expr.BinaryOperator) {
            Expr.BinaryOperator e = (Expr.BinaryOperator) expr;
            return join(visitExpression(e.getLeftHandSide()), visitExpression(e.getRightHandSide()));
        } else if (expr instanceof Expr.NaryOperator) {
            return join(visitExpressions(((Expr.NaryOperator) expr).getOperands()));
        } else {
            throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    protected List<E> visitExpressions(List<? extends Expr> exprs) {
        List<E> results = new ArrayList<>();
        for (int i = 0; i != exprs.size(); ++i) {
            results.add(visitExpression(exprs.get(i)));
        }
        return results;
    }

    protected E constructVariableAccess(Expr.VariableAccess expr) {
        return BOTTOM();
    }

    protected E constructOld(Expr.Old expr, E operand) {
        return operand;
    }

    protected abstract E BOTTOM();

    protected abstract E join(E lhs, E rhs);

    protected E join(List<E> operands) {
        E result = BOTTOM();
        for (int i = 0; i != operands.size(); ++i) {
            result = join(result, operands.get(i));
        }
        return result;
    }
}
