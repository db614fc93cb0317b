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

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import wysilicon.core.SilFile.Expr;
import wysilicon.state.Store;
import wysilicon.state.Term;

/**
 * Determines the variables occurring in an expression. Since assertions have no
 * binders, every variable which occurs is free.
 */
public class FreeVariables extends AbstractExpressionFold<Set<String>> {
    private static final FreeVariables INSTANCE = new FreeVariables();

    /**
     * Get the variables of an expression, in order of first occurrence.
     *
     * @param expr
     * @return
     */
    public static Set<String> of(Expr expr) {
        return INSTANCE.visitExpression(expr);
    }

    /**
     * Bind each variable of an expression to its value in a given store, as
     * needed to close over the expression (e.g. when creating a magic wand).
     *
     * @param expr
     * @param store
     * @return
     */
    public static Map<String, Term> bind(Expr expr, Store store) {
        LinkedHashMap<String, Term> bindings = new LinkedHashMap<>();
        for (String v : of(expr)) {
            Term t = store.get(v);
            if (t == null) {
                throw new IllegalStateException("unbound variable " + v);
            }
            bindings.put(v, t);
        }
        return bindings;
    }

    @Override
    protected Set<String> constructVariableAccess(Expr.VariableAccess expr) {
        LinkedHashSet<String> r = new LinkedHashSet<>();
        r.add(expr.getVariable());
        return r;
    }

    @Override
    protected Set<String> BOTTOM() {
        return new LinkedHashSet<>();
    }

    @Override
    protected Set<String> join(Set<String> lhs, Set<String> rhs) {
        LinkedHashSet<String> r = new LinkedHashSet<>(lhs);
        r.addAll(rhs);
        return r;
    }
}
