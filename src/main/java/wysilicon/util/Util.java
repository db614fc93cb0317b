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

import java.util.ArrayList;
import java.util.List;

import wysilicon.core.SilFile.Expr;

public class Util {

    /**
     * Functional list append.  This creates a fresh list containing both <code>left</code> and <code>right</code> operands.
     * @param left
     * @param right
     * @param <T>
     * @return
     */
    public static <T> List<T> append(List<? extends T> left, List<? extends T> right) {
        ArrayList<T> result = new ArrayList<>();
        result.addAll(left);
        result.addAll(right);
        return result;
    }

    /**
     * Break an assertion into its top-level conjuncts.  For example, <code>acc(x.f) && (x.f > 0 && y)</code> gives
     * <code>acc(x.f)</code>, <code>x.f > 0</code> and <code>y</code>.
     *
     * @param assertion
     * @return
     */
    public static List<Expr> conjuncts(Expr assertion) {
        ArrayList<Expr> result = new ArrayList<>();
        conjuncts(assertion, result);
        return result;
    }

    private static void conjuncts(Expr assertion, List<Expr> result) {
        if (assertion instanceof Expr.LogicalAnd) {
            for (Expr e : ((Expr.LogicalAnd) assertion).getOperands()) {
                conjuncts(e, result);
            }
        } else {
            result.add(assertion);
        }
    }
}
